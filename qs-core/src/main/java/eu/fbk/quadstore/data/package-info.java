/**
 * Quadruple data model ({@code qs-core}).
 * <p>
 * Terms are Sesame {@code Value}s: contexts and subjects are {@code Resource}s, predicates are
 * {@code URI}s and objects are either {@code Resource}s or {@code Literal}s, the distinction
 * being recorded by the {@link eu.fbk.quadstore.data.Flavor} of each
 * {@link eu.fbk.quadstore.data.Quadruple}. {@link eu.fbk.quadstore.data.Terms} defines the string
 * form of terms, on which {@link eu.fbk.quadstore.data.QuadrupleIdentity} computes quadruple ids
 * and per-position keys. {@link eu.fbk.quadstore.data.QuadrupleRow} is the persisted form of a
 * quadruple and {@link eu.fbk.quadstore.data.QuadrupleSet} the collection returned by
 * selections.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.quadstore.data;
