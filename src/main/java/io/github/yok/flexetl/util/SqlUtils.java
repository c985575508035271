package io.github.yok.flexetl.util;

import com.google.common.base.Preconditions;
import lombok.Generated;

/**
 * Utility methods for building SQL text: identifier quoting and string literal escaping.
 *
 * <p>
 * Literal escaping uses backslash escapes, as understood by the sink store: a backslash becomes
 * {@code \\} and a single quote becomes {@code \'}. {@link #unescapeLiteral(String)} reverses it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlUtils {

    @Generated
    private SqlUtils() {}

    /**
     * Quotes an identifier with double quotes, doubling embedded double quotes.
     *
     * @param identifier table, schema or column name
     * @return quoted identifier
     */
    public static String quoteIdentifier(String identifier) {
        Preconditions.checkNotNull(identifier, "identifier must not be null");
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Escapes text for embedding inside a single-quoted SQL literal.
     *
     * @param text raw text
     * @return escaped text (without surrounding quotes)
     */
    public static String escapeLiteral(String text) {
        Preconditions.checkNotNull(text, "text must not be null");
        return text.replace("\\", "\\\\").replace("'", "\\'");
    }

    /**
     * Reverses {@link #escapeLiteral(String)}.
     *
     * @param escaped escaped text
     * @return raw text
     */
    public static String unescapeLiteral(String escaped) {
        Preconditions.checkNotNull(escaped, "escaped must not be null");
        StringBuilder sb = new StringBuilder(escaped.length());
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (c == '\\' && i + 1 < escaped.length()) {
                sb.append(escaped.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes text and wraps it in single quotes.
     *
     * @param text raw text
     * @return SQL string literal
     */
    public static String quoteLiteral(String text) {
        return "'" + escapeLiteral(text) + "'";
    }
}
