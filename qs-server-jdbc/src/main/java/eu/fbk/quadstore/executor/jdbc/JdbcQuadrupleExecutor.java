package eu.fbk.quadstore.executor.jdbc;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.quadstore.data.Flavor;
import eu.fbk.quadstore.data.Handler;
import eu.fbk.quadstore.data.QuadrupleRow;
import eu.fbk.quadstore.executor.QuadrupleExecutor;
import eu.fbk.quadstore.executor.QuadrupleTransaction;
import eu.fbk.quadstore.planner.Condition;
import eu.fbk.quadstore.planner.Field;
import eu.fbk.quadstore.planner.Lookup;
import eu.fbk.quadstore.runtime.DataCorruptedException;

/**
 * A {@code QuadrupleExecutor} storing quadruple rows in a SQL table accessed via JDBC.
 * <p>
 * Connections are obtained from a HikariCP pool created in {@link #init()} and released in
 * {@link #close()}. Each transaction owns a connection with auto-commit disabled, which is
 * committed or rolled back and returned to the pool when the transaction ends. Compiled
 * {@link Lookup}s are translated into parameterized {@code WHERE} clauses, one equality per
 * condition, so that no SQL crosses the executor boundary.
 * </p>
 * <p>
 * The table is not created by this class. Its expected layout is:
 * </p>
 *
 * <pre>
 * CREATE TABLE quadruples (
 *     quadruple_id BIGINT NOT NULL PRIMARY KEY,
 *     flavor INTEGER NOT NULL,
 *     context VARCHAR(1000) NOT NULL, context_id BIGINT NOT NULL,
 *     subject VARCHAR(1000) NOT NULL, subject_id BIGINT NOT NULL,
 *     predicate VARCHAR(1000) NOT NULL, predicate_id BIGINT NOT NULL,
 *     object VARCHAR(1000) NOT NULL, object_id BIGINT NOT NULL)
 * </pre>
 * <p>
 * with indexes on {@code context_id}, {@code subject_id}, {@code predicate_id},
 * {@code (object_id, flavor)}, {@code (subject_id, predicate_id)},
 * {@code (subject_id, object_id, flavor)} and {@code (predicate_id, object_id, flavor)},
 * matching the {@link eu.fbk.quadstore.planner.Index} hints of compiled lookups.
 * </p>
 */
public final class JdbcQuadrupleExecutor implements QuadrupleExecutor {

    /** Prefix of the configuration properties accepted by {@link #fromProperties}. */
    public static final String PROPERTY_PREFIX = "quadstore.jdbc.";

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQuadrupleExecutor.class);

    private static final String DEFAULT_TABLE = "quadruples";

    private static final int DEFAULT_POOL_SIZE = 10;

    private static final int DEFAULT_FETCH_SIZE = 200;

    private static final int DEFAULT_QUERY_TIMEOUT = 120; // seconds

    private static final Pattern TABLE_PATTERN = Pattern
            .compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final String COLUMNS = "quadruple_id, flavor, context, context_id, subject, "
            + "subject_id, predicate, predicate_id, object, object_id";

    private final HikariConfig config;

    private final String table;

    private final int fetchSize;

    private final int queryTimeout;

    private final AtomicLong transactionCounter;

    @Nullable
    private HikariDataSource dataSource;

    private boolean closed;

    /**
     * Creates a new instance based on the supplied configuration parameters.
     *
     * @param url
     *            the JDBC URL of the database, not null
     * @param username
     *            the username to log in, possibly null
     * @param password
     *            the password to log in, possibly null
     * @param table
     *            the name of the quadruple table, optionally qualified with a schema; if null
     *            defaults to {@code quadruples}
     * @param poolSize
     *            the maximum number of pooled connections; if null defaults to 10
     * @param fetchSize
     *            the number of rows to fetch from the database in a single operation when
     *            iterating over selection results; if null defaults to 200
     * @param queryTimeout
     *            the timeout in seconds of each SQL statement; if null defaults to 120
     */
    public JdbcQuadrupleExecutor(final String url, @Nullable final String username,
            @Nullable final String password, @Nullable final String table,
            @Nullable final Integer poolSize, @Nullable final Integer fetchSize,
            @Nullable final Integer queryTimeout) {

        // Configure and validate parameters
        this.table = MoreObjects.firstNonNull(table, DEFAULT_TABLE);
        this.fetchSize = MoreObjects.firstNonNull(fetchSize, DEFAULT_FETCH_SIZE);
        this.queryTimeout = MoreObjects.firstNonNull(queryTimeout, DEFAULT_QUERY_TIMEOUT);
        this.transactionCounter = new AtomicLong(0L);
        final int actualPoolSize = MoreObjects.firstNonNull(poolSize, DEFAULT_POOL_SIZE);
        Preconditions.checkNotNull(url, "Null JDBC URL");
        Preconditions.checkArgument(TABLE_PATTERN.matcher(this.table).matches(),
                "Invalid table name: %s", this.table);
        Preconditions.checkArgument(actualPoolSize > 0, "Invalid pool size: %s", actualPoolSize);
        Preconditions.checkArgument(this.fetchSize > 0, "Invalid fetch size: %s", this.fetchSize);
        Preconditions.checkArgument(this.queryTimeout >= 0, "Invalid query timeout: %s",
                this.queryTimeout);

        // Configure the connection pool, which is created only at initialization time
        this.config = new HikariConfig();
        this.config.setPoolName(getClass().getSimpleName());
        this.config.setJdbcUrl(url);
        if (username != null) {
            this.config.setUsername(username);
        }
        if (password != null) {
            this.config.setPassword(password);
        }
        this.config.setAutoCommit(false);
        this.config.setMaximumPoolSize(actualPoolSize);
        this.config.setMinimumIdle(Math.min(2, actualPoolSize));
        this.config.setConnectionTimeout(30000); // 30 s
        this.config.setIdleTimeout(600000); // 10 m
        this.config.setMaxLifetime(1800000); // 30 m

        LOGGER.info("{} configured, URL={}, table={}, poolSize={}, fetchSize={}, "
                + "queryTimeout={}s", getClass().getSimpleName(), url, this.table,
                actualPoolSize, this.fetchSize, this.queryTimeout);
    }

    /**
     * Creates a new instance based on the configuration properties supplied. Recognized
     * properties are {@code quadstore.jdbc.url} (mandatory), {@code quadstore.jdbc.username},
     * {@code quadstore.jdbc.password}, {@code quadstore.jdbc.table},
     * {@code quadstore.jdbc.poolSize}, {@code quadstore.jdbc.fetchSize} and
     * {@code quadstore.jdbc.queryTimeout}.
     *
     * @param properties
     *            the configuration properties
     * @return the created executor, not yet initialized
     * @throws IllegalArgumentException
     *             if the URL is missing or a property has an invalid value
     */
    public static JdbcQuadrupleExecutor fromProperties(final Properties properties)
            throws IllegalArgumentException {
        final String url = properties.getProperty(PROPERTY_PREFIX + "url");
        Preconditions.checkArgument(url != null, "Missing property %surl", PROPERTY_PREFIX);
        return new JdbcQuadrupleExecutor(url, properties.getProperty(PROPERTY_PREFIX
                + "username"), properties.getProperty(PROPERTY_PREFIX + "password"),
                properties.getProperty(PROPERTY_PREFIX + "table"), getInteger(properties,
                        "poolSize"), getInteger(properties, "fetchSize"), getInteger(
                        properties, "queryTimeout"));
    }

    @Nullable
    private static Integer getInteger(final Properties properties, final String name) {
        final String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (final NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + name
                    + ": " + value, ex);
        }
    }

    public String getTable() {
        return this.table;
    }

    public int getFetchSize() {
        return this.fetchSize;
    }

    public int getQueryTimeout() {
        return this.queryTimeout;
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(this.dataSource == null && !this.closed);
        try {
            this.dataSource = new HikariDataSource(this.config);
        } catch (final RuntimeException ex) {
            throw new IOException("Could not connect to " + this.config.getJdbcUrl(), ex);
        }
        LOGGER.info("{} initialized", this);
    }

    @Override
    public QuadrupleTransaction begin(final boolean readOnly) throws IOException,
            IllegalStateException {
        final HikariDataSource dataSource;
        synchronized (this) {
            Preconditions.checkState(this.dataSource != null && !this.closed,
                    "Executor not initialized or already closed");
            dataSource = this.dataSource;
        }
        return new JdbcTransaction(dataSource, readOnly);
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        if (this.dataSource != null) {
            // pending transactions are terminated externally
            this.dataSource.close();
            LOGGER.info("{} closed", this);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.config.getJdbcUrl() + ", " + this.table
                + ")";
    }

    private static String columnOf(final Field field) {
        switch (field) {
        case CONTEXT:
            return "context_id";
        case SUBJECT:
            return "subject_id";
        case PREDICATE:
            return "predicate_id";
        case OBJECT:
            return "object_id";
        case FLAVOR:
            return "flavor";
        default:
            throw new Error("Unexpected field " + field);
        }
    }

    private static void closeQuietly(@Nullable final Connection connection) {
        if (connection != null) {
            try {
                connection.close();
            } catch (final SQLException ex) {
                LOGGER.warn("Failed to close JDBC connection", ex);
            }
        }
    }

    private final class JdbcTransaction implements QuadrupleTransaction {

        private final Connection connection;

        private final boolean readOnly;

        private final String id; // for logging purposes

        private boolean ended;

        JdbcTransaction(final HikariDataSource dataSource, final boolean readOnly)
                throws IOException {

            this.readOnly = readOnly;
            this.id = "JDBC TX" + JdbcQuadrupleExecutor.this.transactionCounter.incrementAndGet();
            this.ended = false;

            Connection connection = null;
            try {
                connection = dataSource.getConnection();
                connection.setAutoCommit(false);
                connection.setReadOnly(readOnly);
            } catch (final SQLException ex) {
                closeQuietly(connection);
                throw new IOException("Could not obtain a connection from "
                        + JdbcQuadrupleExecutor.this, ex);
            }
            this.connection = connection;
            LOGGER.debug("{} - started ({})", this.id, readOnly ? "read-only" : "read-write");
        }

        private void checkActive() {
            Preconditions.checkState(!this.ended, "Transaction already ended");
        }

        private void checkWritable() {
            checkActive();
            if (this.readOnly) {
                throw new IllegalStateException(
                        "Write operation not allowed on read-only transaction");
            }
        }

        private PreparedStatement prepare(final String sql) throws SQLException {
            LOGGER.trace("{} - {}", this.id, sql);
            final PreparedStatement statement = this.connection.prepareStatement(sql);
            try {
                statement.setQueryTimeout(JdbcQuadrupleExecutor.this.queryTimeout);
            } catch (final SQLException ex) {
                statement.close();
                throw ex;
            }
            return statement;
        }

        private String where(final Lookup lookup) {
            final List<Condition> conditions = lookup.getConditions();
            if (conditions.isEmpty()) {
                return "";
            }
            final List<String> clauses = Lists.newArrayListWithCapacity(conditions.size());
            for (final Condition condition : conditions) {
                clauses.add(columnOf(condition.getField()) + " = ?");
            }
            return " WHERE " + Joiner.on(" AND ").join(clauses);
        }

        private void bind(final PreparedStatement statement, final Lookup lookup)
                throws SQLException {
            int index = 1;
            for (final Condition condition : lookup.getConditions()) {
                if (condition.getField() == Field.FLAVOR) {
                    statement.setInt(index++, (int) condition.getValue());
                } else {
                    statement.setLong(index++, condition.getValue());
                }
            }
        }

        private QuadrupleRow read(final ResultSet rs) throws SQLException, DataCorruptedException {
            final long id = rs.getLong(1);
            final Flavor flavor;
            try {
                flavor = Flavor.forCode(rs.getInt(2));
            } catch (final IllegalArgumentException ex) {
                throw new DataCorruptedException("Invalid flavor for row " + id, ex);
            }
            return new QuadrupleRow(id, flavor, rs.getLong(4), rs.getLong(6), rs.getLong(8),
                    rs.getLong(10), rs.getString(3), rs.getString(5), rs.getString(7),
                    rs.getString(9));
        }

        private boolean exists(final long id) throws SQLException {
            final String table = JdbcQuadrupleExecutor.this.table;
            try (PreparedStatement statement = prepare("SELECT 1 FROM " + table
                    + " WHERE quadruple_id = ?")) {
                statement.setLong(1, id);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next();
                }
            }
        }

        private long update(final String sql, @Nullable final Lookup lookup) throws SQLException {
            try (PreparedStatement statement = prepare(sql)) {
                if (lookup != null) {
                    bind(statement, lookup);
                }
                return statement.executeUpdate();
            }
        }

        @Override
        public boolean insert(final QuadrupleRow row) throws IOException, IllegalStateException {
            Preconditions.checkNotNull(row);
            checkWritable();
            try {
                if (exists(row.getID())) {
                    return false;
                }
                try (PreparedStatement statement = prepare("INSERT INTO "
                        + JdbcQuadrupleExecutor.this.table + " (" + COLUMNS
                        + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                    statement.setLong(1, row.getID());
                    statement.setInt(2, row.getFlavor().getCode());
                    statement.setString(3, row.getContext());
                    statement.setLong(4, row.getContextKey());
                    statement.setString(5, row.getSubject());
                    statement.setLong(6, row.getSubjectKey());
                    statement.setString(7, row.getPredicate());
                    statement.setLong(8, row.getPredicateKey());
                    statement.setString(9, row.getObject());
                    statement.setLong(10, row.getObjectKey());
                    statement.executeUpdate();
                }
                return true;
            } catch (final SQLException ex) {
                throw new IOException(this.id + " - insert failed for row " + row.getID(), ex);
            }
        }

        @Override
        public boolean delete(final long id) throws IOException, IllegalStateException {
            checkWritable();
            try (PreparedStatement statement = prepare("DELETE FROM "
                    + JdbcQuadrupleExecutor.this.table + " WHERE quadruple_id = ?")) {
                statement.setLong(1, id);
                return statement.executeUpdate() > 0;
            } catch (final SQLException ex) {
                throw new IOException(this.id + " - delete failed for row " + id, ex);
            }
        }

        @Override
        public long delete(final Lookup lookup) throws IOException, IllegalStateException {
            Preconditions.checkNotNull(lookup);
            checkWritable();
            try {
                return update("DELETE FROM " + JdbcQuadrupleExecutor.this.table + where(lookup),
                        lookup);
            } catch (final SQLException ex) {
                throw new IOException(this.id + " - delete failed for " + lookup, ex);
            }
        }

        @Override
        public long clear() throws IOException, IllegalStateException {
            checkWritable();
            try {
                return update("DELETE FROM " + JdbcQuadrupleExecutor.this.table, null);
            } catch (final SQLException ex) {
                throw new IOException(this.id + " - clear failed", ex);
            }
        }

        @Override
        public boolean contains(final long id) throws IOException, IllegalStateException {
            checkActive();
            try {
                return exists(id);
            } catch (final SQLException ex) {
                throw new IOException(this.id + " - lookup failed for row " + id, ex);
            }
        }

        @Override
        public void select(final Lookup lookup, final Handler<? super QuadrupleRow> handler)
                throws IOException, IllegalStateException {
            Preconditions.checkNotNull(lookup);
            Preconditions.checkNotNull(handler);
            checkActive();
            try {
                try (PreparedStatement statement = prepare("SELECT " + COLUMNS + " FROM "
                        + JdbcQuadrupleExecutor.this.table + where(lookup))) {
                    bind(statement, lookup);
                    statement.setFetchSize(JdbcQuadrupleExecutor.this.fetchSize);
                    try (ResultSet rs = statement.executeQuery()) {
                        while (rs.next()) {
                            handler.handle(read(rs));
                        }
                    }
                }
                handler.handle(null);
            } catch (final SQLException ex) {
                throw new IOException(this.id + " - select failed for " + lookup, ex);
            } catch (final Throwable ex) {
                Throwables.propagateIfPossible(ex, IOException.class);
                throw new IOException(ex);
            }
        }

        @Override
        public long count() throws IOException, IllegalStateException {
            checkActive();
            try (PreparedStatement statement = prepare("SELECT COUNT(*) FROM "
                    + JdbcQuadrupleExecutor.this.table)) {
                try (ResultSet rs = statement.executeQuery()) {
                    rs.next();
                    return rs.getLong(1);
                }
            } catch (final SQLException ex) {
                throw new IOException(this.id + " - count failed", ex);
            }
        }

        @Override
        public void end(final boolean commit) throws DataCorruptedException, IOException,
                IllegalStateException {
            checkActive();
            this.ended = true;
            try {
                if (commit) {
                    try {
                        this.connection.commit();
                    } catch (final SQLException ex) {
                        try {
                            this.connection.rollback();
                        } catch (final SQLException ex2) {
                            ex.addSuppressed(ex2);
                            throw new DataCorruptedException(this.id
                                    + " - commit and rollback both failed", ex);
                        }
                        throw new IOException(this.id + " - commit failed, rolled back", ex);
                    }
                } else {
                    try {
                        this.connection.rollback();
                    } catch (final SQLException ex) {
                        throw new DataCorruptedException(this.id + " - rollback failed", ex);
                    }
                }
                LOGGER.debug("{} - {}", this.id, commit ? "committed" : "rolled back");
            } finally {
                closeQuietly(this.connection);
            }
        }

        @Override
        public String toString() {
            return this.id;
        }

    }

}
