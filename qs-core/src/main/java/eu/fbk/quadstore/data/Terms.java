package eu.fbk.quadstore.data;

import com.google.common.base.Preconditions;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Conversion of terms (Sesame {@code Value}s) to and from their string form.
 * <p>
 * The string form of a term is what the quadruple id and the per-position keys are computed on,
 * and what executors persist:
 * </p>
 * <ul>
 * <li>URIs are rendered as their full identifier string;</li>
 * <li>blank nodes are rendered as {@code _:} followed by their ID;</li>
 * <li>literals are rendered as their label between double quotes, with backslash escapes for
 * {@code \}, {@code "}, newline, carriage return and tab, followed by {@code @lang} if they carry
 * a language tag, or by {@code ^^<datatype>} if they carry a datatype.</li>
 * </ul>
 * <p>
 * The quotes keep the string form of a literal distinct from the one of any resource, and the
 * escapes make literal parsing exact. Parsing is driven by the kind of term expected by the
 * caller.
 * </p>
 */
public final class Terms {

    private static final String BNODE_PREFIX = "_:";

    private static final String DATATYPE_PREFIX = "^^<";

    private static final Escaper LABEL_ESCAPER = Escapers.builder().addEscape('\\', "\\\\")
            .addEscape('"', "\\\"").addEscape('\n', "\\n").addEscape('\r', "\\r")
            .addEscape('\t', "\\t").build();

    private static final ValueFactory FACTORY = ValueFactoryImpl.getInstance();

    private Terms() {
    }

    /**
     * Returns the {@code ValueFactory} used to rebuild terms.
     *
     * @return the value factory
     */
    public static ValueFactory getValueFactory() {
        return FACTORY;
    }

    /**
     * Returns the string form of the term specified.
     *
     * @param term
     *            the term, not null
     * @return the string form
     * @throws AmbiguousObjectFlavorException
     *             if the term is neither a {@code Resource} nor a {@code Literal}
     */
    public static String format(final Value term) {
        Preconditions.checkNotNull(term);
        if (term instanceof URI) {
            return term.stringValue();
        } else if (term instanceof BNode) {
            return BNODE_PREFIX + ((BNode) term).getID();
        } else if (term instanceof Literal) {
            final Literal literal = (Literal) term;
            final StringBuilder builder = new StringBuilder();
            builder.append('"').append(LABEL_ESCAPER.escape(literal.getLabel())).append('"');
            final String language = literal.getLanguage();
            final URI datatype = literal.getDatatype();
            if (language != null) {
                builder.append('@').append(language);
            } else if (datatype != null) {
                builder.append(DATATYPE_PREFIX).append(datatype.stringValue()).append('>');
            }
            return builder.toString();
        }
        throw new AmbiguousObjectFlavorException("Unsupported term " + term + " ("
                + term.getClass().getName() + ")");
    }

    /**
     * Parses a resource (URI or blank node) from its string form.
     *
     * @param string
     *            the string form
     * @return the parsed resource
     * @throws IllegalArgumentException
     *             if the string is not a valid resource
     */
    public static Resource parseResource(final String string) throws IllegalArgumentException {
        Preconditions.checkNotNull(string);
        if (string.startsWith(BNODE_PREFIX)) {
            return FACTORY.createBNode(string.substring(BNODE_PREFIX.length()));
        }
        return FACTORY.createURI(string);
    }

    /**
     * Parses a URI from its string form.
     *
     * @param string
     *            the string form
     * @return the parsed URI
     * @throws IllegalArgumentException
     *             if the string is not a valid URI
     */
    public static URI parseURI(final String string) throws IllegalArgumentException {
        final Resource resource = parseResource(string);
        Preconditions.checkArgument(resource instanceof URI, "Not a URI: %s", string);
        return (URI) resource;
    }

    /**
     * Parses a literal from its string form.
     *
     * @param string
     *            the string form
     * @return the parsed literal
     * @throws IllegalArgumentException
     *             if the string is not a valid literal
     */
    public static Literal parseLiteral(final String string) throws IllegalArgumentException {
        Preconditions.checkNotNull(string);
        Preconditions.checkArgument(string.startsWith("\""), "Not a literal: %s", string);

        // Unescape the label up to the closing quote
        final int length = string.length();
        final StringBuilder label = new StringBuilder(length);
        int index = 1;
        while (true) {
            Preconditions.checkArgument(index < length, "Unterminated literal: %s", string);
            final char ch = string.charAt(index++);
            if (ch == '"') {
                break;
            } else if (ch != '\\') {
                label.append(ch);
                continue;
            }
            Preconditions.checkArgument(index < length, "Unterminated literal: %s", string);
            final char escaped = string.charAt(index++);
            switch (escaped) {
            case '\\':
            case '"':
                label.append(escaped);
                break;
            case 'n':
                label.append('\n');
                break;
            case 'r':
                label.append('\r');
                break;
            case 't':
                label.append('\t');
                break;
            default:
                throw new IllegalArgumentException("Invalid escape \\" + escaped + " in " + string);
            }
        }

        // Language tag or datatype, if any
        final String suffix = string.substring(index);
        if (suffix.isEmpty()) {
            return FACTORY.createLiteral(label.toString());
        } else if (suffix.length() > 1 && suffix.charAt(0) == '@') {
            return FACTORY.createLiteral(label.toString(), suffix.substring(1));
        } else if (suffix.length() > DATATYPE_PREFIX.length() + 1
                && suffix.startsWith(DATATYPE_PREFIX) && suffix.endsWith(">")) {
            return FACTORY.createLiteral(label.toString(), FACTORY.createURI(suffix.substring(
                    DATATYPE_PREFIX.length(), suffix.length() - 1)));
        }
        throw new IllegalArgumentException("Invalid literal suffix " + suffix + " in " + string);
    }

    /**
     * Parses an object term from its string form, using the flavor to decide its kind.
     *
     * @param string
     *            the string form
     * @param flavor
     *            the persisted flavor of the object
     * @return the parsed object
     */
    public static Value parseObject(final String string, final Flavor flavor) {
        return flavor == Flavor.LITERAL_OBJECT ? parseLiteral(string) : parseResource(string);
    }

}
