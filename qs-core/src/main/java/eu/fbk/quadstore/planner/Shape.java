package eu.fbk.quadstore.planner;

import javax.annotation.Nullable;

/**
 * The set of positions bound by a {@link Pattern}, together with the index answering it.
 * <p>
 * There is one constant for each subset of {context, subject, predicate, object}: fifteen
 * non-empty shapes plus {@link #ANY}, which binds nothing and requires a full scan. Binding the
 * object as a resource or as a literal yields the same shape; the object kind is carried by the
 * pattern flavor. The index of each shape is the most selective one whose fields are all bound,
 * preferring subject and object over predicate, and predicate over context.
 * </p>
 */
public enum Shape {

    ANY(false, false, false, false, null),

    C(true, false, false, false, Index.CONTEXT),

    S(false, true, false, false, Index.SUBJECT),

    P(false, false, true, false, Index.PREDICATE),

    O(false, false, false, true, Index.OBJECT),

    CS(true, true, false, false, Index.SUBJECT),

    CP(true, false, true, false, Index.PREDICATE),

    CO(true, false, false, true, Index.OBJECT),

    SP(false, true, true, false, Index.SUBJECT_PREDICATE),

    SO(false, true, false, true, Index.SUBJECT_OBJECT),

    PO(false, false, true, true, Index.PREDICATE_OBJECT),

    CSP(true, true, true, false, Index.SUBJECT_PREDICATE),

    CSO(true, true, false, true, Index.SUBJECT_OBJECT),

    CPO(true, false, true, true, Index.PREDICATE_OBJECT),

    SPO(false, true, true, true, Index.SUBJECT_OBJECT),

    CSPO(true, true, true, true, Index.SUBJECT_OBJECT);

    private final boolean context;

    private final boolean subject;

    private final boolean predicate;

    private final boolean object;

    @Nullable
    private final Index index;

    private Shape(final boolean context, final boolean subject, final boolean predicate,
            final boolean object, @Nullable final Index index) {
        this.context = context;
        this.subject = subject;
        this.predicate = predicate;
        this.object = object;
        this.index = index;
    }

    /**
     * Returns the shape binding exactly the positions specified.
     *
     * @param context
     *            whether the context is bound
     * @param subject
     *            whether the subject is bound
     * @param predicate
     *            whether the predicate is bound
     * @param object
     *            whether the object is bound
     * @return the corresponding shape
     */
    public static Shape forBindings(final boolean context, final boolean subject,
            final boolean predicate, final boolean object) {
        for (final Shape shape : values()) {
            if (shape.context == context && shape.subject == subject
                    && shape.predicate == predicate && shape.object == object) {
                return shape;
            }
        }
        throw new Error("Unexpected missing shape");
    }

    public boolean hasContext() {
        return this.context;
    }

    public boolean hasSubject() {
        return this.subject;
    }

    public boolean hasPredicate() {
        return this.predicate;
    }

    public boolean hasObject() {
        return this.object;
    }

    /**
     * Returns the index to be consulted for patterns of this shape.
     *
     * @return the index, or null for {@link #ANY}, which scans every quadruple
     */
    @Nullable
    public Index getIndex() {
        return this.index;
    }

}
