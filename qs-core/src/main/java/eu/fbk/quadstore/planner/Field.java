package eu.fbk.quadstore.planner;

/**
 * A stored attribute of a quadruple that a {@link Condition} may test.
 */
public enum Field {

    /** The per-position key of the context. */
    CONTEXT,

    /** The per-position key of the subject. */
    SUBJECT,

    /** The per-position key of the predicate. */
    PREDICATE,

    /** The per-position key of the object. */
    OBJECT,

    /** The code of the object flavor. */
    FLAVOR

}
