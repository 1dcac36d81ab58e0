package eu.fbk.quadstore.data;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

/**
 * Deterministic content hashes identifying quadruples and single terms.
 * <p>
 * Both hashes are the first 8 bytes (little endian) of the MD5 digest of the UTF-8 encoding of a
 * string. The quadruple id hashes the string forms of context, subject, predicate and object
 * joined by a single space, in this order; a per-position key hashes the string form of a single
 * term. Separator, order and hash function are part of the persisted format: changing any of
 * them invalidates every stored id.
 * </p>
 */
public final class QuadrupleIdentity {

    private static final HashFunction HASH_FUNCTION = Hashing.md5();

    private static final Joiner JOINER = Joiner.on(' ');

    private QuadrupleIdentity() {
    }

    /**
     * Computes the id of the quadruple with the terms specified.
     *
     * @param context
     *            the context
     * @param subject
     *            the subject
     * @param predicate
     *            the predicate
     * @param object
     *            the object
     * @return the quadruple id
     */
    public static long computeId(final Resource context, final Resource subject,
            final URI predicate, final Value object) {
        return hash(JOINER.join(Terms.format(context), Terms.format(subject),
                Terms.format(predicate), Terms.format(object)));
    }

    /**
     * Computes the per-position key of the term specified.
     *
     * @param term
     *            the term
     * @return the key of the term, independent of the position it occupies
     */
    public static long computeKey(final Value term) {
        return hash(Terms.format(term));
    }

    /**
     * Hashes a string to a 64-bit value.
     *
     * @param string
     *            the string to hash
     * @return the hash
     */
    public static long hash(final String string) {
        return HASH_FUNCTION.hashString(string, Charsets.UTF_8).asLong();
    }

}
