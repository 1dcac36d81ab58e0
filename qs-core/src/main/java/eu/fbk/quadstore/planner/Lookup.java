package eu.fbk.quadstore.planner;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import eu.fbk.quadstore.data.AmbiguousObjectFlavorException;
import eu.fbk.quadstore.data.QuadrupleRow;

/**
 * A compiled lookup over a persisted quadruple set, produced by the {@link QueryPlanner}.
 * <p>
 * A lookup is a conjunction of equality {@link Condition}s, at most one per {@link Field},
 * together with the {@link Index} suggested for answering it. An empty conjunction selects every
 * stored quadruple. A condition on the object is always paired with a condition on the flavor.
 * </p>
 */
public final class Lookup {

    private static final Joiner JOINER = Joiner.on(" AND ");

    private final Shape shape;

    @Nullable
    private final Index index;

    private final List<Condition> conditions;

    private final Map<Field, Long> values;

    Lookup(final Shape shape, @Nullable final Index index, final Iterable<Condition> conditions) {
        this.shape = Preconditions.checkNotNull(shape);
        this.index = index;
        this.conditions = ImmutableList.copyOf(conditions);
        this.values = Maps.newEnumMap(Field.class);
        for (final Condition condition : this.conditions) {
            Preconditions.checkArgument(
                    this.values.put(condition.getField(), condition.getValue()) == null,
                    "Duplicate condition on %s", condition.getField());
        }
        if (this.values.containsKey(Field.OBJECT) && !this.values.containsKey(Field.FLAVOR)) {
            throw new AmbiguousObjectFlavorException("Lookup on object without flavor: "
                    + this.conditions);
        }
        if (index != null) {
            for (final Field field : index.getFields()) {
                Preconditions.checkArgument(this.values.containsKey(field),
                        "Index %s not applicable to %s", index, this.conditions);
            }
        }
    }

    public Shape getShape() {
        return this.shape;
    }

    /**
     * Returns the index the lookup should be answered with.
     *
     * @return the index, null if the lookup requires a full scan
     */
    @Nullable
    public Index getIndex() {
        return this.index;
    }

    /**
     * Returns the conditions of this lookup, in the order context, subject, predicate, object,
     * flavor.
     *
     * @return an immutable list of conditions, empty for a full scan
     */
    public List<Condition> getConditions() {
        return this.conditions;
    }

    /**
     * Returns the value a field is constrained to.
     *
     * @param field
     *            the field
     * @return the value, or null if the field is not constrained
     */
    @Nullable
    public Long getValue(final Field field) {
        return this.values.get(field);
    }

    /**
     * Returns the values of the index fields, in index order.
     *
     * @return the index key, or an empty list if there is no index
     */
    public List<Long> getIndexKey() {
        if (this.index == null) {
            return ImmutableList.of();
        }
        final ImmutableList.Builder<Long> builder = ImmutableList.builder();
        for (final Field field : this.index.getFields()) {
            builder.add(this.values.get(field));
        }
        return builder.build();
    }

    /**
     * Tests whether a stored row satisfies all the conditions of this lookup.
     *
     * @param row
     *            the row
     * @return true if the row matches
     */
    public boolean matches(final QuadrupleRow row) {
        for (final Condition condition : this.conditions) {
            if (row.get(condition.getField()) != condition.getValue()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return this.shape + (this.index == null ? " (scan)" : " (" + this.index + ")")
                + (this.conditions.isEmpty() ? "" : " " + JOINER.join(this.conditions));
    }

}
