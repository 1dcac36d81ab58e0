package eu.fbk.quadstore.data;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import org.openrdf.model.Statement;

import eu.fbk.quadstore.planner.Pattern;

/**
 * An in-memory, insertion-ordered set of quadruples.
 * <p>
 * This is the collection returned by store selections. Adding a quadruple equal to one already
 * contained has no effect, so the set holds at most one copy of each quadruple even when rows
 * are reported more than once. Null elements are not allowed.
 * </p>
 */
public final class QuadrupleSet extends AbstractSet<Quadruple> {

    private final Set<Quadruple> quadruples;

    /**
     * Creates a new, empty set.
     */
    public QuadrupleSet() {
        this.quadruples = Sets.newLinkedHashSet();
    }

    /**
     * Creates a new set with the quadruples specified.
     *
     * @param quadruples
     *            the quadruples to add, duplicates being ignored
     */
    public QuadrupleSet(final Iterable<? extends Quadruple> quadruples) {
        this();
        for (final Quadruple quadruple : quadruples) {
            add(quadruple);
        }
    }

    @Override
    public boolean add(final Quadruple quadruple) {
        return this.quadruples.add(Preconditions.checkNotNull(quadruple));
    }

    @Override
    public boolean contains(final Object object) {
        return this.quadruples.contains(object);
    }

    @Override
    public boolean remove(final Object object) {
        return this.quadruples.remove(object);
    }

    @Override
    public Iterator<Quadruple> iterator() {
        return this.quadruples.iterator();
    }

    @Override
    public int size() {
        return this.quadruples.size();
    }

    @Override
    public void clear() {
        this.quadruples.clear();
    }

    /**
     * Returns the quadruples of this set matching the pattern specified.
     *
     * @param pattern
     *            the pattern
     * @return a new set with the matching quadruples
     */
    public QuadrupleSet filter(final Pattern pattern) {
        Preconditions.checkNotNull(pattern);
        final QuadrupleSet result = new QuadrupleSet();
        for (final Quadruple quadruple : this.quadruples) {
            if (pattern.matches(quadruple)) {
                result.add(quadruple);
            }
        }
        return result;
    }

    /**
     * Returns the quadruples of this set as Sesame statements, each with its context.
     *
     * @return a new list of statements, in the iteration order of this set
     */
    public List<Statement> toStatements() {
        final List<Statement> statements = Lists.newArrayListWithCapacity(this.quadruples.size());
        for (final Quadruple quadruple : this.quadruples) {
            statements.add(quadruple.toStatement());
        }
        return statements;
    }

}
