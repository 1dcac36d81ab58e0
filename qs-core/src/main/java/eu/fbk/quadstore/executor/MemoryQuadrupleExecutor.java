package eu.fbk.quadstore.executor;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.quadstore.data.Handler;
import eu.fbk.quadstore.data.QuadrupleRow;
import eu.fbk.quadstore.planner.Field;
import eu.fbk.quadstore.planner.Index;
import eu.fbk.quadstore.planner.Lookup;

/**
 * A {@code QuadrupleExecutor} keeping all the rows in memory.
 * <p>
 * This class realizes a functional, non-persistent implementation of the executor. Rows are kept
 * in a table indexed by id and by each {@link Index}, and lookups are answered by probing the
 * index chosen by the planner. Each read-write transaction works on its own copy of the table,
 * taken at the first write, and the copy replaces the shared table upon successful commit; a
 * commit fails if another transaction committed in the meanwhile. Read-only transactions see the
 * table as it was when they started.
 * </p>
 */
public class MemoryQuadrupleExecutor implements QuadrupleExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryQuadrupleExecutor.class);

    private Table table;

    private int revision;

    private boolean initialized;

    private boolean closed;

    /**
     * Creates a new, empty {@code MemoryQuadrupleExecutor}.
     */
    public MemoryQuadrupleExecutor() {
        this.table = new Table();
        this.revision = 1;
        this.initialized = false;
        this.closed = false;
        LOGGER.info("{} configured", getClass().getSimpleName());
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(!this.initialized && !this.closed);
        this.initialized = true;
        LOGGER.info("{} initialized", getClass().getSimpleName());
    }

    @Override
    public synchronized QuadrupleTransaction begin(final boolean readOnly) throws IOException,
            IllegalStateException {
        Preconditions.checkState(this.initialized && !this.closed);
        return new MemoryTransaction(readOnly, this.table, this.revision);
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        LOGGER.info("{} closed, {} rows discarded", getClass().getSimpleName(),
                this.table.rows.size());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private synchronized void update(final Table table, final int revision) throws IOException {
        if (this.revision != revision) {
            throw new IOException("Commit failed due to concurrent modifications "
                    + this.revision + ", " + revision);
        }
        Preconditions.checkState(!this.closed, "Executor closed");
        this.table = table;
        ++this.revision;
        LOGGER.debug("{} updated to revision {}, {} rows", getClass().getSimpleName(),
                this.revision, table.rows.size());
    }

    private static final class Table {

        final Map<Long, QuadrupleRow> rows;

        final Map<Index, SetMultimap<List<Long>, Long>> indexes;

        Table() {
            this.rows = Maps.newLinkedHashMap();
            this.indexes = Maps.newEnumMap(Index.class);
            for (final Index index : Index.values()) {
                this.indexes.put(index, LinkedHashMultimap.<List<Long>, Long>create());
            }
        }

        Table(final Table table) {
            this.rows = Maps.newLinkedHashMap(table.rows);
            this.indexes = Maps.newEnumMap(Index.class);
            for (final Map.Entry<Index, SetMultimap<List<Long>, Long>> entry : table.indexes
                    .entrySet()) {
                this.indexes.put(entry.getKey(), LinkedHashMultimap.create(entry.getValue()));
            }
        }

        boolean insert(final QuadrupleRow row) {
            if (this.rows.containsKey(row.getID())) {
                return false;
            }
            this.rows.put(row.getID(), row);
            for (final Index index : Index.values()) {
                this.indexes.get(index).put(keyOf(index, row), row.getID());
            }
            return true;
        }

        boolean delete(final long id) {
            final QuadrupleRow row = this.rows.remove(id);
            if (row == null) {
                return false;
            }
            for (final Index index : Index.values()) {
                this.indexes.get(index).remove(keyOf(index, row), id);
            }
            return true;
        }

        List<QuadrupleRow> lookup(final Lookup lookup) {
            final Index index = lookup.getIndex();
            final Collection<QuadrupleRow> candidates;
            if (index == null) {
                candidates = this.rows.values();
            } else {
                final List<QuadrupleRow> rows = Lists.newArrayList();
                for (final Long id : this.indexes.get(index).get(lookup.getIndexKey())) {
                    rows.add(this.rows.get(id));
                }
                candidates = rows;
            }
            final ImmutableList.Builder<QuadrupleRow> builder = ImmutableList.builder();
            for (final QuadrupleRow row : candidates) {
                if (lookup.matches(row)) {
                    builder.add(row);
                }
            }
            return builder.build();
        }

        private static List<Long> keyOf(final Index index, final QuadrupleRow row) {
            final ImmutableList.Builder<Long> builder = ImmutableList.builder();
            for (final Field field : index.getFields()) {
                builder.add(row.get(field));
            }
            return builder.build();
        }

    }

    private final class MemoryTransaction implements QuadrupleTransaction {

        private Table table;

        private final int revision;

        private final boolean readOnly;

        private boolean dirty;

        private boolean ended;

        MemoryTransaction(final boolean readOnly, final Table table, final int revision) {
            this.table = table;
            this.revision = revision;
            this.readOnly = readOnly;
            this.dirty = false;
            this.ended = false;
        }

        private Table readable() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
            return this.table;
        }

        private Table writable() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
            if (this.readOnly) {
                throw new IllegalStateException(
                        "Write operation not allowed on read-only transaction");
            }
            if (!this.dirty) {
                this.table = new Table(this.table);
                this.dirty = true;
            }
            return this.table;
        }

        @Override
        public boolean insert(final QuadrupleRow row) throws IOException, IllegalStateException {
            Preconditions.checkNotNull(row);
            return writable().insert(row);
        }

        @Override
        public boolean delete(final long id) throws IOException, IllegalStateException {
            return writable().delete(id);
        }

        @Override
        public long delete(final Lookup lookup) throws IOException, IllegalStateException {
            final Table table = writable();
            long count = 0;
            for (final QuadrupleRow row : table.lookup(lookup)) {
                if (table.delete(row.getID())) {
                    ++count;
                }
            }
            return count;
        }

        @Override
        public long clear() throws IOException, IllegalStateException {
            final long count = writable().rows.size();
            this.table = new Table();
            return count;
        }

        @Override
        public boolean contains(final long id) throws IOException, IllegalStateException {
            return readable().rows.containsKey(id);
        }

        @Override
        public void select(final Lookup lookup, final Handler<? super QuadrupleRow> handler)
                throws IOException, IllegalStateException {
            Preconditions.checkNotNull(handler);
            try {
                for (final QuadrupleRow row : readable().lookup(lookup)) {
                    handler.handle(row);
                }
                handler.handle(null);
            } catch (final Throwable ex) {
                Throwables.propagateIfPossible(ex, IOException.class);
                throw new IOException(ex);
            }
        }

        @Override
        public long count() throws IOException, IllegalStateException {
            return readable().rows.size();
        }

        @Override
        public void end(final boolean commit) throws IOException, IllegalStateException {
            Preconditions.checkState(!this.ended, "Transaction already ended");
            this.ended = true;
            if (commit && this.dirty) {
                update(this.table, this.revision);
            }
        }

    }

}
