/**
 * Lifecycle of QuadStore components ({@code qs-core}).
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.quadstore.runtime;
