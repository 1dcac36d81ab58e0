/**
 * Quadruple patterns and their compilation into lookups ({@code qs-core}).
 * <p>
 * A {@link eu.fbk.quadstore.planner.Pattern} binds any subset of the four quadruple positions
 * and is classified by its {@link eu.fbk.quadstore.planner.Shape}. The
 * {@link eu.fbk.quadstore.planner.QueryPlanner} turns a pattern into a
 * {@link eu.fbk.quadstore.planner.Lookup}: a conjunction of equality
 * {@link eu.fbk.quadstore.planner.Condition}s on stored {@link eu.fbk.quadstore.planner.Field}s,
 * plus the {@link eu.fbk.quadstore.planner.Index} best suited to answer it. Lookups carry no
 * backend syntax; executors translate them into their native query form.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.quadstore.planner;
