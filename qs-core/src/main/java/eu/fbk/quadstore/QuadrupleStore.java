package eu.fbk.quadstore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import eu.fbk.quadstore.data.AmbiguousObjectFlavorException;
import eu.fbk.quadstore.data.Handler;
import eu.fbk.quadstore.data.Quadruple;
import eu.fbk.quadstore.data.QuadrupleRow;
import eu.fbk.quadstore.data.QuadrupleSet;
import eu.fbk.quadstore.executor.QuadrupleExecutor;
import eu.fbk.quadstore.executor.QuadrupleTransaction;
import eu.fbk.quadstore.planner.Lookup;
import eu.fbk.quadstore.planner.Pattern;
import eu.fbk.quadstore.planner.QueryPlanner;

/**
 * A set of quadruples persisted by a {@link QuadrupleExecutor}.
 * <p>
 * A {@code QuadrupleStore} keeps set semantics over the quadruples of its executor: each
 * quadruple is stored at most once, identified by its {@link Quadruple#getID() id}. Selections
 * and removals by {@link Pattern} are compiled by the {@link QueryPlanner} and executed by the
 * executor. Each method runs in a single executor transaction, committed on success and rolled
 * back on failure; {@link #merge(Iterable, Resource)} adds a whole batch in one transaction.
 * </p>
 * <p>
 * The executor is supplied by the caller, which is responsible for initializing it before use and
 * closing it afterwards. A {@code QuadrupleStore} is thread safe if its executor is. Failures of
 * the executor are reported as {@link ExecutorFailureException}s wrapping the original cause.
 * Null arguments are accepted where documented, making the call a no-op.
 * </p>
 */
public final class QuadrupleStore {

    private final QuadrupleExecutor executor;

    /**
     * Creates a new store backed by the executor specified.
     *
     * @param executor
     *            the executor, already initialized or to be initialized before use
     */
    public QuadrupleStore(final QuadrupleExecutor executor) {
        this.executor = Preconditions.checkNotNull(executor);
    }

    /**
     * Returns the executor backing this store.
     *
     * @return the executor
     */
    public QuadrupleExecutor getExecutor() {
        return this.executor;
    }

    /**
     * Adds a quadruple, unless already stored.
     *
     * @param quadruple
     *            the quadruple to add; if null, nothing is done
     * @return true if the quadruple has been added, false if it was already stored or null
     * @throws ExecutorFailureException
     *             on failure
     */
    public boolean add(@Nullable final Quadruple quadruple) throws ExecutorFailureException {
        if (quadruple == null) {
            return false;
        }
        final QuadrupleRow row = QuadrupleRow.create(quadruple);
        return call("add " + quadruple, false, new Call<Boolean>() {

            @Override
            public Boolean call(final QuadrupleTransaction transaction) throws IOException {
                return transaction.insert(row);
            }

        });
    }

    /**
     * Adds all the statements specified in a single transaction: either all of them are stored,
     * or, on failure, none is. Statements without a context are assigned the context supplied, or
     * {@link Quadruple#DEFAULT_CONTEXT} if it is null. Statements already stored are skipped.
     *
     * @param statements
     *            the statements to add; if null, nothing is done
     * @param context
     *            the context of statements lacking one, possibly null
     * @return the number of quadruples actually added
     * @throws ExecutorFailureException
     *             on failure, in which case no statement has been added
     * @throws AmbiguousObjectFlavorException
     *             if a statement object is neither a resource nor a literal, in which case no
     *             statement has been added
     */
    public int merge(@Nullable final Iterable<? extends Statement> statements,
            @Nullable final Resource context) throws ExecutorFailureException {
        if (statements == null) {
            return 0;
        }
        return call("merge", false, new Call<Integer>() {

            @Override
            public Integer call(final QuadrupleTransaction transaction) throws IOException {
                int count = 0;
                for (final Statement statement : statements) {
                    final Quadruple quadruple = Quadruple.create(statement, context);
                    if (transaction.insert(QuadrupleRow.create(quadruple))) {
                        ++count;
                    }
                }
                return count;
            }

        });
    }

    /**
     * Removes a quadruple, if stored.
     *
     * @param quadruple
     *            the quadruple to remove; if null, nothing is done
     * @return true if the quadruple was stored and has been removed
     * @throws ExecutorFailureException
     *             on failure
     */
    public boolean remove(@Nullable final Quadruple quadruple) throws ExecutorFailureException {
        if (quadruple == null) {
            return false;
        }
        final long id = quadruple.getID();
        return call("remove " + quadruple, false, new Call<Boolean>() {

            @Override
            public Boolean call(final QuadrupleTransaction transaction) throws IOException {
                return transaction.delete(id);
            }

        });
    }

    /**
     * Removes all the quadruples matching the pattern specified. Patterns binding no position are
     * rejected as insufficient and cause no removal: use {@link #clear()} to remove everything.
     *
     * @param pattern
     *            the pattern; if null or {@link Pattern#ANY}, nothing is done
     * @return the number of quadruples removed
     * @throws ExecutorFailureException
     *             on failure
     */
    public long remove(@Nullable final Pattern pattern) throws ExecutorFailureException {
        if (pattern == null || pattern.equals(Pattern.ANY)) {
            return 0L;
        }
        final Lookup lookup = QueryPlanner.plan(pattern);
        return call("remove " + pattern, false, new Call<Long>() {

            @Override
            public Long call(final QuadrupleTransaction transaction) throws IOException {
                return transaction.delete(lookup);
            }

        });
    }

    public long removeByContext(@Nullable final Resource context)
            throws ExecutorFailureException {
        return removeIfBound(context == null ? null : Pattern.builder().context(context));
    }

    public long removeBySubject(@Nullable final Resource subject)
            throws ExecutorFailureException {
        return removeIfBound(subject == null ? null : Pattern.builder().subject(subject));
    }

    public long removeByPredicate(@Nullable final URI predicate)
            throws ExecutorFailureException {
        return removeIfBound(predicate == null ? null : Pattern.builder().predicate(predicate));
    }

    public long removeByObject(@Nullable final Resource object) throws ExecutorFailureException {
        return removeIfBound(object == null ? null : Pattern.builder().object(object));
    }

    public long removeByLiteral(@Nullable final Literal literal)
            throws ExecutorFailureException {
        return removeIfBound(literal == null ? null : Pattern.builder().object(literal));
    }

    public long removeByContextSubject(@Nullable final Resource context,
            @Nullable final Resource subject) throws ExecutorFailureException {
        return removeIfBound(context == null || subject == null ? null : Pattern.builder()
                .context(context).subject(subject));
    }

    public long removeByContextPredicate(@Nullable final Resource context,
            @Nullable final URI predicate) throws ExecutorFailureException {
        return removeIfBound(context == null || predicate == null ? null : Pattern.builder()
                .context(context).predicate(predicate));
    }

    public long removeByContextObject(@Nullable final Resource context,
            @Nullable final Resource object) throws ExecutorFailureException {
        return removeIfBound(context == null || object == null ? null : Pattern.builder()
                .context(context).object(object));
    }

    public long removeByContextLiteral(@Nullable final Resource context,
            @Nullable final Literal literal) throws ExecutorFailureException {
        return removeIfBound(context == null || literal == null ? null : Pattern.builder()
                .context(context).object(literal));
    }

    public long removeByContextSubjectPredicate(@Nullable final Resource context,
            @Nullable final Resource subject, @Nullable final URI predicate)
            throws ExecutorFailureException {
        return removeIfBound(context == null || subject == null || predicate == null ? null
                : Pattern.builder().context(context).subject(subject).predicate(predicate));
    }

    public long removeByContextSubjectObject(@Nullable final Resource context,
            @Nullable final Resource subject, @Nullable final Resource object)
            throws ExecutorFailureException {
        return removeIfBound(context == null || subject == null || object == null ? null
                : Pattern.builder().context(context).subject(subject).object(object));
    }

    public long removeByContextSubjectLiteral(@Nullable final Resource context,
            @Nullable final Resource subject, @Nullable final Literal literal)
            throws ExecutorFailureException {
        return removeIfBound(context == null || subject == null || literal == null ? null
                : Pattern.builder().context(context).subject(subject).object(literal));
    }

    public long removeByContextPredicateObject(@Nullable final Resource context,
            @Nullable final URI predicate, @Nullable final Resource object)
            throws ExecutorFailureException {
        return removeIfBound(context == null || predicate == null || object == null ? null
                : Pattern.builder().context(context).predicate(predicate).object(object));
    }

    public long removeByContextPredicateLiteral(@Nullable final Resource context,
            @Nullable final URI predicate, @Nullable final Literal literal)
            throws ExecutorFailureException {
        return removeIfBound(context == null || predicate == null || literal == null ? null
                : Pattern.builder().context(context).predicate(predicate).object(literal));
    }

    public long removeBySubjectPredicate(@Nullable final Resource subject,
            @Nullable final URI predicate) throws ExecutorFailureException {
        return removeIfBound(subject == null || predicate == null ? null : Pattern.builder()
                .subject(subject).predicate(predicate));
    }

    public long removeBySubjectObject(@Nullable final Resource subject,
            @Nullable final Resource object) throws ExecutorFailureException {
        return removeIfBound(subject == null || object == null ? null : Pattern.builder()
                .subject(subject).object(object));
    }

    public long removeBySubjectLiteral(@Nullable final Resource subject,
            @Nullable final Literal literal) throws ExecutorFailureException {
        return removeIfBound(subject == null || literal == null ? null : Pattern.builder()
                .subject(subject).object(literal));
    }

    public long removeByPredicateObject(@Nullable final URI predicate,
            @Nullable final Resource object) throws ExecutorFailureException {
        return removeIfBound(predicate == null || object == null ? null : Pattern.builder()
                .predicate(predicate).object(object));
    }

    public long removeByPredicateLiteral(@Nullable final URI predicate,
            @Nullable final Literal literal) throws ExecutorFailureException {
        return removeIfBound(predicate == null || literal == null ? null : Pattern.builder()
                .predicate(predicate).object(literal));
    }

    private long removeIfBound(@Nullable final Pattern.Builder builder)
            throws ExecutorFailureException {
        return builder == null ? 0L : remove(builder.build());
    }

    /**
     * Removes all the stored quadruples.
     *
     * @return the number of quadruples removed
     * @throws ExecutorFailureException
     *             on failure
     */
    public long clear() throws ExecutorFailureException {
        return call("clear", false, new Call<Long>() {

            @Override
            public Long call(final QuadrupleTransaction transaction) throws IOException {
                return transaction.clear();
            }

        });
    }

    /**
     * Tests whether a quadruple is stored.
     *
     * @param quadruple
     *            the quadruple; if null, false is returned
     * @return true if the quadruple is stored
     * @throws ExecutorFailureException
     *             on failure
     */
    public boolean contains(@Nullable final Quadruple quadruple)
            throws ExecutorFailureException {
        if (quadruple == null) {
            return false;
        }
        final long id = quadruple.getID();
        return call("contains " + quadruple, true, new Call<Boolean>() {

            @Override
            public Boolean call(final QuadrupleTransaction transaction) throws IOException {
                return transaction.contains(id);
            }

        });
    }

    /**
     * Returns all the stored quadruples matching the pattern specified.
     *
     * @param pattern
     *            the pattern; if null, every stored quadruple is returned
     * @return a set with the matching quadruples, possibly empty
     * @throws ExecutorFailureException
     *             on failure, including rows that cannot be parsed back into quadruples
     */
    public QuadrupleSet select(@Nullable final Pattern pattern) throws ExecutorFailureException {
        final Pattern actualPattern = pattern == null ? Pattern.ANY : pattern;
        final Lookup lookup = QueryPlanner.plan(actualPattern);
        return call("select " + actualPattern, true, new Call<QuadrupleSet>() {

            @Override
            public QuadrupleSet call(final QuadrupleTransaction transaction) throws IOException {
                final QuadrupleSet result = new QuadrupleSet();
                transaction.select(lookup, new Handler<QuadrupleRow>() {

                    @Override
                    public void handle(@Nullable final QuadrupleRow row) {
                        if (row != null) {
                            result.add(row.toQuadruple());
                        }
                    }

                });
                return result;
            }

        });
    }

    /**
     * Returns all the stored quadruples matching the terms specified, null terms acting as
     * wildcards. The object is matched as a resource or as a literal depending on its type.
     *
     * @param context
     *            the context, possibly null
     * @param subject
     *            the subject, possibly null
     * @param predicate
     *            the predicate, possibly null
     * @param object
     *            the object, possibly null
     * @return a set with the matching quadruples, possibly empty
     * @throws ExecutorFailureException
     *             on failure
     */
    public QuadrupleSet select(@Nullable final Resource context, @Nullable final Resource subject,
            @Nullable final URI predicate, @Nullable final Value object)
            throws ExecutorFailureException {
        return select(Pattern.create(context, subject, predicate, object));
    }

    /**
     * Returns the number of stored quadruples.
     *
     * @return the number of quadruples
     * @throws ExecutorFailureException
     *             on failure
     */
    public long size() throws ExecutorFailureException {
        return call("size", true, new Call<Long>() {

            @Override
            public Long call(final QuadrupleTransaction transaction) throws IOException {
                return transaction.count();
            }

        });
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.executor + ")";
    }

    private <T> T call(final String operation, final boolean readOnly, final Call<T> call)
            throws ExecutorFailureException {

        final QuadrupleTransaction transaction;
        try {
            transaction = this.executor.begin(readOnly);
        } catch (final Throwable ex) {
            throw failure("Could not begin transaction for " + operation, ex);
        }

        final T result;
        try {
            result = call.call(transaction);
        } catch (final Throwable ex) {
            try {
                transaction.end(false);
            } catch (final Throwable ex2) {
                ex.addSuppressed(ex2);
            }
            throw failure("Could not perform " + operation, ex);
        }

        try {
            transaction.end(true);
        } catch (final Throwable ex) {
            throw failure("Could not commit " + operation, ex);
        }
        return result;
    }

    private static ExecutorFailureException failure(final String message, final Throwable ex) {
        Throwables.propagateIfInstanceOf(ex, Error.class);
        Throwables.propagateIfInstanceOf(ex, IllegalArgumentException.class); // invalid input
        return new ExecutorFailureException(message, ex);
    }

    private interface Call<T> {

        T call(QuadrupleTransaction transaction) throws IOException;

    }

}
