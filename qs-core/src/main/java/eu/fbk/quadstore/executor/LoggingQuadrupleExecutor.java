package eu.fbk.quadstore.executor;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.quadstore.data.Handler;
import eu.fbk.quadstore.data.QuadrupleRow;
import eu.fbk.quadstore.planner.Lookup;

/**
 * A {@code QuadrupleExecutor} wrapper that logs calls to the operations of a wrapped
 * {@code QuadrupleExecutor} and their execution times.
 * <p>
 * This wrapper intercepts calls to an underlying {@code QuadrupleExecutor} and to the
 * {@code QuadrupleTransaction}s it creates, and logs request information and execution times via
 * SLF4J (level DEBUG, logger named after this class). The overhead introduced by this wrapper
 * when logging is disabled is negligible.
 * </p>
 */
public final class LoggingQuadrupleExecutor extends ForwardingQuadrupleExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingQuadrupleExecutor.class);

    private static final AtomicLong COUNTER = new AtomicLong();

    private final QuadrupleExecutor delegate;

    /**
     * Creates a new instance for the wrapped {@code QuadrupleExecutor} specified.
     *
     * @param delegate
     *            the wrapped {@code QuadrupleExecutor}
     */
    public LoggingQuadrupleExecutor(final QuadrupleExecutor delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured for {}", getClass().getSimpleName(), delegate);
    }

    @Override
    protected QuadrupleExecutor delegate() {
        return this.delegate;
    }

    @Override
    public void init() throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.init();
            LOGGER.debug("{} - initialized in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.init();
        }
    }

    @Override
    public QuadrupleTransaction begin(final boolean readOnly) throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final QuadrupleTransaction transaction = new LoggingQuadrupleTransaction(
                    super.begin(readOnly), COUNTER.incrementAndGet());
            LOGGER.debug("{} - started in {} mode in {} ms", transaction, readOnly ? "read-only"
                    : "read-write", System.currentTimeMillis() - ts);
            return transaction;
        } else {
            return super.begin(readOnly);
        }
    }

    @Override
    public void close() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.delegate + ")";
    }

    private static final class LoggingQuadrupleTransaction extends
            ForwardingQuadrupleTransaction {

        private final QuadrupleTransaction delegate;

        private final long number;

        LoggingQuadrupleTransaction(final QuadrupleTransaction delegate, final long number) {
            this.delegate = Preconditions.checkNotNull(delegate);
            this.number = number;
        }

        @Override
        protected QuadrupleTransaction delegate() {
            return this.delegate;
        }

        @Override
        public boolean insert(final QuadrupleRow row) throws IOException {
            final long ts = System.currentTimeMillis();
            final boolean inserted = super.insert(row);
            LOGGER.debug("{} - row {} {} in {} ms", this, row.getID(), inserted ? "inserted"
                    : "already stored", System.currentTimeMillis() - ts);
            return inserted;
        }

        @Override
        public boolean delete(final long id) throws IOException {
            final long ts = System.currentTimeMillis();
            final boolean deleted = super.delete(id);
            LOGGER.debug("{} - row {} {} in {} ms", this, id, deleted ? "deleted" : "not found",
                    System.currentTimeMillis() - ts);
            return deleted;
        }

        @Override
        public long delete(final Lookup lookup) throws IOException {
            final long ts = System.currentTimeMillis();
            final long count = super.delete(lookup);
            LOGGER.debug("{} - {} rows deleted for {} in {} ms", this, count, lookup,
                    System.currentTimeMillis() - ts);
            return count;
        }

        @Override
        public long clear() throws IOException {
            final long ts = System.currentTimeMillis();
            final long count = super.clear();
            LOGGER.debug("{} - {} rows cleared in {} ms", this, count,
                    System.currentTimeMillis() - ts);
            return count;
        }

        @Override
        public boolean contains(final long id) throws IOException {
            final long ts = System.currentTimeMillis();
            final boolean contained = super.contains(id);
            LOGGER.debug("{} - row {} {} in {} ms", this, id, contained ? "found" : "not found",
                    System.currentTimeMillis() - ts);
            return contained;
        }

        @Override
        public void select(final Lookup lookup, final Handler<? super QuadrupleRow> handler)
                throws IOException {
            final AtomicLong count = new AtomicLong();
            final long ts = System.currentTimeMillis();
            super.select(lookup, new Handler<QuadrupleRow>() {

                @Override
                public void handle(@Nullable final QuadrupleRow row) throws Throwable {
                    if (row != null) {
                        count.incrementAndGet();
                    }
                    handler.handle(row);
                }

            });
            LOGGER.debug("{} - {} rows selected for {} in {} ms", this, count, lookup,
                    System.currentTimeMillis() - ts);
        }

        @Override
        public long count() throws IOException {
            final long ts = System.currentTimeMillis();
            final long count = super.count();
            LOGGER.debug("{} - {} rows counted in {} ms", this, count,
                    System.currentTimeMillis() - ts);
            return count;
        }

        @Override
        public void end(final boolean commit) throws IOException {
            final long ts = System.currentTimeMillis();
            super.end(commit);
            LOGGER.debug("{} - {} done in {} ms", this, commit ? "commit" : "rollback",
                    System.currentTimeMillis() - ts);
        }

        @Override
        public String toString() {
            return "TX" + this.number;
        }

    }

}
