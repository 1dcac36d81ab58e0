package eu.fbk.quadstore.planner;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import eu.fbk.quadstore.data.QuadrupleIdentity;

/**
 * Compiles {@link Pattern}s into {@link Lookup}s.
 * <p>
 * Each bound position becomes an equality condition on the per-position key of its term; a
 * bound object also adds a condition on the flavor implied by the kind of the object, so that
 * the lookup only touches rows of that kind. The index of the
 * lookup is the one declared by the pattern {@link Shape}.
 * </p>
 */
public final class QueryPlanner {

    private QueryPlanner() {
    }

    /**
     * Compiles the pattern specified.
     *
     * @param pattern
     *            the pattern, possibly {@link Pattern#ANY}
     * @return the compiled lookup, with no conditions for {@link Pattern#ANY}
     */
    public static Lookup plan(final Pattern pattern) {
        Preconditions.checkNotNull(pattern);
        final Shape shape = pattern.getShape();
        final List<Condition> conditions = Lists.newArrayListWithCapacity(5);
        if (shape.hasContext()) {
            conditions.add(new Condition(Field.CONTEXT, QuadrupleIdentity.computeKey(pattern
                    .getContext())));
        }
        if (shape.hasSubject()) {
            conditions.add(new Condition(Field.SUBJECT, QuadrupleIdentity.computeKey(pattern
                    .getSubject())));
        }
        if (shape.hasPredicate()) {
            conditions.add(new Condition(Field.PREDICATE, QuadrupleIdentity.computeKey(pattern
                    .getPredicate())));
        }
        if (shape.hasObject()) {
            conditions.add(new Condition(Field.OBJECT, QuadrupleIdentity.computeKey(pattern
                    .getObject())));
            conditions.add(new Condition(Field.FLAVOR, pattern.getFlavor().getCode()));
        }
        return new Lookup(shape, shape.getIndex(), conditions);
    }

}
