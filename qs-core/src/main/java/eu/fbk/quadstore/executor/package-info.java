/**
 * Executor API ({@code qs-core}).
 * <p>
 * This package defines the boundary between the quadruple store core and the backends that
 * physically store quadruples. More in details, the package provides:
 * </p>
 * <ul>
 * <li>the executor API ({@link eu.fbk.quadstore.executor.QuadrupleExecutor},
 * {@link eu.fbk.quadstore.executor.QuadrupleTransaction});</li>
 * <li>abstract classes ({@link eu.fbk.quadstore.executor.ForwardingQuadrupleExecutor} and
 * {@link eu.fbk.quadstore.executor.ForwardingQuadrupleTransaction}) for implementing the
 * decorator pattern;</li>
 * <li>a decorator logging operations and their execution times (
 * {@link eu.fbk.quadstore.executor.LoggingQuadrupleExecutor});</li>
 * <li>an in-memory executor ({@link eu.fbk.quadstore.executor.MemoryQuadrupleExecutor}).</li>
 * </ul>
 * <p>
 * Executors exchange {@link eu.fbk.quadstore.data.QuadrupleRow}s and compiled
 * {@link eu.fbk.quadstore.planner.Lookup}s: no query text crosses this boundary. Executors for
 * specific databases are provided by dedicated modules.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.quadstore.executor;
