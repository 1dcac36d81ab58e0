package eu.fbk.quadstore.data;

import java.io.Serializable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import eu.fbk.quadstore.planner.Field;

/**
 * The flat, persisted form of a {@link Quadruple}, as exchanged with executors.
 * <p>
 * A row carries the quadruple id, the object flavor, the per-position key of each term and the
 * string form of each term. Rows built from quadruples via {@link #create(Quadruple)} are always
 * consistent; rows built by executors from stored data are trusted as they are, and turned back
 * into quadruples via {@link #toQuadruple()}, which takes the object kind from the stored flavor.
 * </p>
 */
public final class QuadrupleRow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long id;

    private final Flavor flavor;

    private final long contextKey;

    private final long subjectKey;

    private final long predicateKey;

    private final long objectKey;

    private final String context;

    private final String subject;

    private final String predicate;

    private final String object;

    /**
     * Creates a new row with the values specified.
     *
     * @param id
     *            the quadruple id
     * @param flavor
     *            the object flavor, not null
     * @param contextKey
     *            the key of the context
     * @param subjectKey
     *            the key of the subject
     * @param predicateKey
     *            the key of the predicate
     * @param objectKey
     *            the key of the object
     * @param context
     *            the string form of the context, not null
     * @param subject
     *            the string form of the subject, not null
     * @param predicate
     *            the string form of the predicate, not null
     * @param object
     *            the string form of the object, not null
     */
    public QuadrupleRow(final long id, final Flavor flavor, final long contextKey,
            final long subjectKey, final long predicateKey, final long objectKey,
            final String context, final String subject, final String predicate,
            final String object) {
        this.id = id;
        this.flavor = Preconditions.checkNotNull(flavor);
        this.contextKey = contextKey;
        this.subjectKey = subjectKey;
        this.predicateKey = predicateKey;
        this.objectKey = objectKey;
        this.context = Preconditions.checkNotNull(context);
        this.subject = Preconditions.checkNotNull(subject);
        this.predicate = Preconditions.checkNotNull(predicate);
        this.object = Preconditions.checkNotNull(object);
    }

    /**
     * Creates the row storing the quadruple specified.
     *
     * @param quadruple
     *            the quadruple
     * @return the created row
     */
    public static QuadrupleRow create(final Quadruple quadruple) {
        return new QuadrupleRow(quadruple.getID(), quadruple.getFlavor(),
                QuadrupleIdentity.computeKey(quadruple.getContext()),
                QuadrupleIdentity.computeKey(quadruple.getSubject()),
                QuadrupleIdentity.computeKey(quadruple.getPredicate()),
                QuadrupleIdentity.computeKey(quadruple.getObject()),
                Terms.format(quadruple.getContext()), Terms.format(quadruple.getSubject()),
                Terms.format(quadruple.getPredicate()), Terms.format(quadruple.getObject()));
    }

    public long getID() {
        return this.id;
    }

    public Flavor getFlavor() {
        return this.flavor;
    }

    public long getContextKey() {
        return this.contextKey;
    }

    public long getSubjectKey() {
        return this.subjectKey;
    }

    public long getPredicateKey() {
        return this.predicateKey;
    }

    public long getObjectKey() {
        return this.objectKey;
    }

    public String getContext() {
        return this.context;
    }

    public String getSubject() {
        return this.subject;
    }

    public String getPredicate() {
        return this.predicate;
    }

    public String getObject() {
        return this.object;
    }

    /**
     * Returns the value of the field specified: a per-position key, or the flavor code.
     *
     * @param field
     *            the field
     * @return the value of the field in this row
     */
    public long get(final Field field) {
        switch (field) {
        case CONTEXT:
            return this.contextKey;
        case SUBJECT:
            return this.subjectKey;
        case PREDICATE:
            return this.predicateKey;
        case OBJECT:
            return this.objectKey;
        case FLAVOR:
            return this.flavor.getCode();
        default:
            throw new Error("Unexpected field " + field);
        }
    }

    /**
     * Rebuilds the quadruple stored in this row.
     *
     * @return the quadruple, whose object kind is given by the row flavor
     * @throws IllegalArgumentException
     *             if the stored strings are not valid terms
     */
    public Quadruple toQuadruple() throws IllegalArgumentException {
        return Quadruple.create(Terms.parseResource(this.context),
                Terms.parseResource(this.subject), Terms.parseURI(this.predicate),
                Terms.parseObject(this.object, this.flavor));
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof QuadrupleRow)) {
            return false;
        }
        final QuadrupleRow other = (QuadrupleRow) object;
        return this.id == other.id && this.flavor == other.flavor
                && this.context.equals(other.context) && this.subject.equals(other.subject)
                && this.predicate.equals(other.predicate) && this.object.equals(other.object);
    }

    @Override
    public int hashCode() {
        return (int) (this.id ^ this.id >>> 32);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", this.id).add("flavor", this.flavor)
                .add("context", this.context).add("subject", this.subject)
                .add("predicate", this.predicate).add("object", this.object).toString();
    }

}
