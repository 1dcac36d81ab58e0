package eu.fbk.quadstore.planner;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * An equality test of a stored {@link Field} against a value.
 * <p>
 * For the four term positions the value is the per-position key of the bound term; for
 * {@link Field#FLAVOR} it is the flavor code.
 * </p>
 */
public final class Condition {

    private final Field field;

    private final long value;

    /**
     * Creates a new condition.
     *
     * @param field
     *            the field tested, not null
     * @param value
     *            the value the field must be equal to
     */
    public Condition(final Field field, final long value) {
        this.field = Preconditions.checkNotNull(field);
        this.value = value;
    }

    public Field getField() {
        return this.field;
    }

    public long getValue() {
        return this.value;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Condition)) {
            return false;
        }
        final Condition other = (Condition) object;
        return this.field == other.field && this.value == other.value;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.field, this.value);
    }

    @Override
    public String toString() {
        return this.field.name().toLowerCase() + "=" + this.value;
    }

}
