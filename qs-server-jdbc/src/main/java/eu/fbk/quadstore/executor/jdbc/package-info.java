/**
 * JDBC executor ({@code qs-server-jdbc}).
 * <p>
 * {@link eu.fbk.quadstore.executor.jdbc.JdbcQuadrupleExecutor} stores quadruple rows in a single
 * SQL table accessed through a HikariCP connection pool. The table is expected to exist; its
 * layout is documented in the class Javadoc.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.quadstore.executor.jdbc;
