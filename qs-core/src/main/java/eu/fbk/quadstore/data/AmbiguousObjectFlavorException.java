package eu.fbk.quadstore.data;

/**
 * Signals that the kind of an object term (resource vs. literal) cannot be determined, or that a
 * lookup on the object omits the flavor restriction.
 */
public class AmbiguousObjectFlavorException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance with the error message specified.
     *
     * @param message
     *            the error message
     */
    public AmbiguousObjectFlavorException(final String message) {
        super(message);
    }

}
