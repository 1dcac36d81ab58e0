package eu.fbk.quadstore.data;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Value;

/**
 * The kind of object of a {@link Quadruple}.
 * <p>
 * The flavor is stored next to the object of each quadruple, so that lookups can restrict the
 * object kind and rows can be parsed back without inspecting the object string form. The
 * numeric {@link #getCode() code} is what executors persist.
 * </p>
 */
public enum Flavor {

    /** The object is a {@code Resource} (URI or blank node). */
    RESOURCE_OBJECT(1),

    /** The object is a {@code Literal}. */
    LITERAL_OBJECT(2);

    private final int code;

    private Flavor(final int code) {
        this.code = code;
    }

    /**
     * Returns the numeric code persisted for this flavor.
     *
     * @return the code, 1 for resource objects and 2 for literal objects
     */
    public int getCode() {
        return this.code;
    }

    /**
     * Returns the flavor implied by the kind of the object value supplied.
     *
     * @param object
     *            the object value
     * @return the corresponding flavor
     * @throws AmbiguousObjectFlavorException
     *             if the value is neither a {@code Resource} nor a {@code Literal}
     */
    public static Flavor forObject(final Value object) throws AmbiguousObjectFlavorException {
        if (object instanceof Literal) {
            return LITERAL_OBJECT;
        } else if (object instanceof Resource) {
            return RESOURCE_OBJECT;
        }
        throw new AmbiguousObjectFlavorException("Cannot determine the flavor of object "
                + object + (object == null ? "" : " (" + object.getClass().getName() + ")"));
    }

    /**
     * Returns the flavor with the persisted code supplied.
     *
     * @param code
     *            the persisted code
     * @return the corresponding flavor
     * @throws IllegalArgumentException
     *             if the code is unknown
     */
    public static Flavor forCode(final int code) throws IllegalArgumentException {
        for (final Flavor flavor : values()) {
            if (flavor.code == code) {
                return flavor;
            }
        }
        throw new IllegalArgumentException("Unknown flavor code " + code);
    }

}
