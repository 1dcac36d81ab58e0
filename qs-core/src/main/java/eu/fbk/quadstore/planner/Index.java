package eu.fbk.quadstore.planner;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A stored index over one or more quadruple fields.
 * <p>
 * Indexes covering the object always cover the flavor too, as objects with the same key but
 * different flavor are different terms. Executors are free to ignore the index chosen by the
 * planner (e.g., when delegating index selection to a SQL optimizer), but an executor that
 * maintains these indexes can answer a {@link Lookup} by probing {@link Lookup#getIndex()} with
 * the lookup values of the index fields and then checking the remaining conditions.
 * </p>
 */
public enum Index {

    CONTEXT(Field.CONTEXT),

    SUBJECT(Field.SUBJECT),

    PREDICATE(Field.PREDICATE),

    OBJECT(Field.OBJECT, Field.FLAVOR),

    SUBJECT_PREDICATE(Field.SUBJECT, Field.PREDICATE),

    SUBJECT_OBJECT(Field.SUBJECT, Field.OBJECT, Field.FLAVOR),

    PREDICATE_OBJECT(Field.PREDICATE, Field.OBJECT, Field.FLAVOR);

    private final List<Field> fields;

    private Index(final Field... fields) {
        this.fields = ImmutableList.copyOf(fields);
    }

    /**
     * Returns the fields composing the index key, in key order.
     *
     * @return an immutable list of fields
     */
    public List<Field> getFields() {
        return this.fields;
    }

}
