package eu.fbk.quadstore.planner;

import javax.annotation.Nullable;

import com.google.common.base.Objects;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import eu.fbk.quadstore.data.Flavor;
import eu.fbk.quadstore.data.Quadruple;
import eu.fbk.quadstore.data.Terms;

/**
 * A partially bound quadruple, used to select or delete the matching quadruples of a store.
 * <p>
 * Each of context, subject, predicate and object may be bound to a term or left unbound
 * (wildcard). The object slot holds either a resource or a literal, never both: the
 * {@link Flavor} of a pattern is always determined by the kind of its bound object. A pattern
 * matches a quadruple if all its bound terms are equal to the corresponding quadruple terms,
 * with the unbound positions matching anything.
 * </p>
 * <p>
 * Patterns are immutable and created either with {@link #create(Resource, Resource, URI, Value)}
 * or with the {@link Builder}.
 * </p>
 */
public final class Pattern {

    /** The pattern binding no position, matching every quadruple. */
    public static final Pattern ANY = new Pattern(null, null, null, null, null);

    @Nullable
    private final Resource context;

    @Nullable
    private final Resource subject;

    @Nullable
    private final URI predicate;

    @Nullable
    private final Value object;

    @Nullable
    private final Flavor flavor;

    private final Shape shape;

    private Pattern(@Nullable final Resource context, @Nullable final Resource subject,
            @Nullable final URI predicate, @Nullable final Value object,
            @Nullable final Flavor flavor) {
        this.context = context;
        this.subject = subject;
        this.predicate = predicate;
        this.object = object;
        this.flavor = flavor;
        this.shape = Shape.forBindings(context != null, subject != null, predicate != null,
                object != null);
    }

    /**
     * Creates a pattern with the terms specified, null denoting unbound positions. The flavor is
     * derived from the kind of the object value.
     *
     * @param context
     *            the context, possibly null
     * @param subject
     *            the subject, possibly null
     * @param predicate
     *            the predicate, possibly null
     * @param object
     *            the object, either a resource or a literal, possibly null
     * @return the created pattern
     * @throws eu.fbk.quadstore.data.AmbiguousObjectFlavorException
     *             if the object is neither a resource nor a literal
     */
    public static Pattern create(@Nullable final Resource context,
            @Nullable final Resource subject, @Nullable final URI predicate,
            @Nullable final Value object) {
        if (context == null && subject == null && predicate == null && object == null) {
            return ANY;
        }
        return new Pattern(context, subject, predicate, object,
                object == null ? null : Flavor.forObject(object));
    }

    /**
     * Returns the pattern matching exactly the quadruple specified.
     *
     * @param quadruple
     *            the quadruple
     * @return a pattern binding all the four positions
     */
    public static Pattern create(final Quadruple quadruple) {
        return new Pattern(quadruple.getContext(), quadruple.getSubject(),
                quadruple.getPredicate(), quadruple.getObject(), quadruple.getFlavor());
    }

    /**
     * Returns a new builder with all positions unbound.
     *
     * @return the created builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public Resource getContext() {
        return this.context;
    }

    @Nullable
    public Resource getSubject() {
        return this.subject;
    }

    @Nullable
    public URI getPredicate() {
        return this.predicate;
    }

    @Nullable
    public Value getObject() {
        return this.object;
    }

    /**
     * Returns the flavor of the bound object.
     *
     * @return the flavor, null if and only if the object is unbound
     */
    @Nullable
    public Flavor getFlavor() {
        return this.flavor;
    }

    public Shape getShape() {
        return this.shape;
    }

    /**
     * Returns the label of the pattern: one letter for each bound position among {@code C},
     * {@code S}, {@code P}, and {@code O} or {@code L} for an object bound to a resource or a
     * literal. The label is empty for {@link #ANY}.
     *
     * @return the label
     */
    public String getLabel() {
        final StringBuilder builder = new StringBuilder(4);
        if (this.context != null) {
            builder.append('C');
        }
        if (this.subject != null) {
            builder.append('S');
        }
        if (this.predicate != null) {
            builder.append('P');
        }
        if (this.flavor != null) {
            builder.append(this.flavor == Flavor.LITERAL_OBJECT ? 'L' : 'O');
        }
        return builder.toString();
    }

    /**
     * Tests whether the quadruple specified matches this pattern.
     *
     * @param quadruple
     *            the quadruple
     * @return true if every bound position equals the corresponding quadruple term
     */
    public boolean matches(final Quadruple quadruple) {
        return (this.context == null || this.context.equals(quadruple.getContext()))
                && (this.subject == null || this.subject.equals(quadruple.getSubject()))
                && (this.predicate == null || this.predicate.equals(quadruple.getPredicate()))
                && (this.object == null || this.flavor == quadruple.getFlavor()
                        && this.object.equals(quadruple.getObject()));
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Pattern)) {
            return false;
        }
        final Pattern other = (Pattern) object;
        return Objects.equal(this.context, other.context)
                && Objects.equal(this.subject, other.subject)
                && Objects.equal(this.predicate, other.predicate)
                && Objects.equal(this.object, other.object) && this.flavor == other.flavor;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.context, this.subject, this.predicate, this.object);
    }

    @Override
    public String toString() {
        return "<" + format(this.context) + ", " + format(this.subject) + ", "
                + format(this.predicate) + ", " + format(this.object) + ">";
    }

    private static String format(@Nullable final Value value) {
        return value == null ? "*" : Terms.format(value);
    }

    /**
     * A builder of {@code Pattern}s.
     * <p>
     * The object is bound through either {@link #object(Resource)} or {@link #object(Literal)};
     * binding it again replaces the previous binding, including its kind.
     * </p>
     */
    public static final class Builder {

        @Nullable
        private Resource context;

        @Nullable
        private Resource subject;

        @Nullable
        private URI predicate;

        @Nullable
        private Value object;

        @Nullable
        private Flavor flavor;

        Builder() {
        }

        public Builder context(@Nullable final Resource context) {
            this.context = context;
            return this;
        }

        public Builder subject(@Nullable final Resource subject) {
            this.subject = subject;
            return this;
        }

        public Builder predicate(@Nullable final URI predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder object(@Nullable final Resource object) {
            this.object = object;
            this.flavor = object == null ? null : Flavor.RESOURCE_OBJECT;
            return this;
        }

        public Builder object(@Nullable final Literal object) {
            this.object = object;
            this.flavor = object == null ? null : Flavor.LITERAL_OBJECT;
            return this;
        }

        public Pattern build() {
            if (this.context == null && this.subject == null && this.predicate == null
                    && this.object == null) {
                return ANY;
            }
            return new Pattern(this.context, this.subject, this.predicate, this.object,
                    this.flavor);
        }

    }

}
