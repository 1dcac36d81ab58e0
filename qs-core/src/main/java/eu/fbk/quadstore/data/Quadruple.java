package eu.fbk.quadstore.data;

import java.io.Serializable;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.SESAME;

/**
 * An RDF statement in a named graph: the unit of storage of a quadruple store.
 * <p>
 * A {@code Quadruple} is immutable and fully bound: context, subject, predicate and object are
 * all non-null. Its {@link Flavor} is derived from the kind of its object, while its
 * {@link #getID() id} is computed at construction time by {@link QuadrupleIdentity#computeId}.
 * Two quadruples are equal if their four terms are equal.
 * </p>
 */
public final class Quadruple implements Serializable {

    /** The context assigned to statements lacking one when no context is supplied. */
    public static final URI DEFAULT_CONTEXT = SESAME.NIL;

    private static final long serialVersionUID = 1L;

    private final Resource context;

    private final Resource subject;

    private final URI predicate;

    private final Value object;

    private final Flavor flavor;

    private final long id;

    private Quadruple(final Resource context, final Resource subject, final URI predicate,
            final Value object) {
        this.context = Preconditions.checkNotNull(context, "Null context");
        this.subject = Preconditions.checkNotNull(subject, "Null subject");
        this.predicate = Preconditions.checkNotNull(predicate, "Null predicate");
        this.object = Preconditions.checkNotNull(object, "Null object");
        this.flavor = Flavor.forObject(object);
        this.id = QuadrupleIdentity.computeId(context, subject, predicate, object);
    }

    /**
     * Creates a new quadruple with the terms specified.
     *
     * @param context
     *            the context, not null
     * @param subject
     *            the subject, not null
     * @param predicate
     *            the predicate, not null
     * @param object
     *            the object, not null
     * @return the created quadruple
     * @throws NullPointerException
     *             if any of the terms is null
     * @throws AmbiguousObjectFlavorException
     *             if the object is neither a resource nor a literal
     */
    public static Quadruple create(final Resource context, final Resource subject,
            final URI predicate, final Value object) {
        return new Quadruple(context, subject, predicate, object);
    }

    /**
     * Creates a new quadruple for the statement specified. If the statement has no context, the
     * supplied default context is used, or {@link #DEFAULT_CONTEXT} if it is null.
     *
     * @param statement
     *            the statement, not null
     * @param defaultContext
     *            the context to use if the statement has none, possibly null
     * @return the created quadruple
     */
    public static Quadruple create(final Statement statement,
            @Nullable final Resource defaultContext) {
        final Resource context = statement.getContext() != null ? statement.getContext()
                : MoreObjects.firstNonNull(defaultContext, DEFAULT_CONTEXT);
        return new Quadruple(context, statement.getSubject(), statement.getPredicate(),
                statement.getObject());
    }

    public Resource getContext() {
        return this.context;
    }

    public Resource getSubject() {
        return this.subject;
    }

    public URI getPredicate() {
        return this.predicate;
    }

    public Value getObject() {
        return this.object;
    }

    public Flavor getFlavor() {
        return this.flavor;
    }

    /**
     * Returns the content hash identifying this quadruple in a store.
     *
     * @return the quadruple id
     */
    public long getID() {
        return this.id;
    }

    /**
     * Returns a Sesame statement with the same terms of this quadruple.
     *
     * @return the statement, including the context
     */
    public Statement toStatement() {
        return Terms.getValueFactory().createStatement(this.subject, this.predicate,
                this.object, this.context);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Quadruple)) {
            return false;
        }
        final Quadruple other = (Quadruple) object;
        return this.id == other.id && this.flavor == other.flavor
                && this.object.equals(other.object) && this.subject.equals(other.subject)
                && this.predicate.equals(other.predicate) && this.context.equals(other.context);
    }

    @Override
    public int hashCode() {
        return (int) (this.id ^ this.id >>> 32);
    }

    @Override
    public String toString() {
        return Terms.format(this.context) + " " + Terms.format(this.subject) + " "
                + Terms.format(this.predicate) + " " + Terms.format(this.object);
    }

}
