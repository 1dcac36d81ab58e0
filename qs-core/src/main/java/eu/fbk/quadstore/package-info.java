/**
 * Quadruple store API ({@code qs-core}).
 * <p>
 * {@link eu.fbk.quadstore.QuadrupleStore} is the entry point: it adds, removes and selects
 * {@link eu.fbk.quadstore.data.Quadruple}s by delegating to a
 * {@link eu.fbk.quadstore.executor.QuadrupleExecutor}, after compiling selection and removal
 * patterns via the {@link eu.fbk.quadstore.planner.QueryPlanner}. Executor failures are reported
 * as {@link eu.fbk.quadstore.ExecutorFailureException}s.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.quadstore;
