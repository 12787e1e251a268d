package ed.inf.adbs.querysync;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * String helpers for moving user-supplied values into and out of SQL text.
 * Values are embedded as single-quoted literals, identifiers are compared
 * without their double-quote or backtick quoting.
 */
public final class SqlText {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SqlText() {
    }

    /**
     * Doubles every single quote so the value can sit inside a '...' literal.
     * @param value raw value, may be null
     * @return the escaped value, or null if the input was null
     */
    public static String escapeSingleQuotes(String value) {
        if (value == null) {
            return null;
        }
        return value.replace("'", "''");
    }

    /**
     * Reverses {@link #escapeSingleQuotes(String)}.
     * @param value literal body as printed inside quotes, may be null
     * @return the raw value
     */
    public static String unescapeSingleQuotes(String value) {
        if (value == null) {
            return null;
        }
        return value.replace("''", "'");
    }

    /**
     * Removes one pair of surrounding single quotes when the value has them.
     * @param value the value to strip
     * @return the value without its enclosing quotes
     */
    public static String stripSingleQuotes(String value) {
        if (value != null && value.length() > 1 && value.startsWith("'") && value.endsWith("'")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    /**
     * @param value the value to test
     * @return true if the value is enclosed in single quotes
     */
    public static boolean isSingleQuoted(String value) {
        return value != null && value.length() > 1 && value.startsWith("'") && value.endsWith("'");
    }

    /**
     * Splits a comma separated list of values, honouring single or double
     * quotes around items so that commas inside quotes are kept. Enclosing
     * quotes are removed and items are trimmed; empty items are dropped.
     * For example {@code a, 'b,c' ,"d"} gives {@code [a, b,c, d]}.
     * @param text the delimited values
     * @return the individual values
     */
    public static List<String> splitQuotedString(String text) {
        List<String> values = new ArrayList<>();
        if (text == null) {
            return values;
        }

        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == ',') {
                addTrimmed(values, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addTrimmed(values, current);
        return values;
    }

    private static void addTrimmed(List<String> values, StringBuilder item) {
        String value = item.toString().trim();
        if (!value.isEmpty()) {
            values.add(value);
        }
    }

    /**
     * Removes double-quote, backtick or square-bracket quoting from an identifier.
     * @param identifier identifier as printed, may be null
     * @return the bare identifier
     */
    public static String unquoteIdentifier(String identifier) {
        if (identifier == null || identifier.length() < 2) {
            return identifier;
        }
        char first = identifier.charAt(0);
        char last = identifier.charAt(identifier.length() - 1);
        if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
            return identifier.substring(1, identifier.length() - 1);
        }
        return identifier;
    }

    /**
     * Wraps an identifier in double quotes unless it already is quoted.
     * @param identifier the bare identifier
     * @return the quoted identifier
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier.length() > 1 && identifier.startsWith("\"") && identifier.endsWith("\"")) {
            return identifier;
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes an identifier only when it is not a plain word, e.g. {@code k8s-app}.
     * @param identifier the bare identifier
     * @return the identifier, quoted if needed
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (PLAIN_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return quoteIdentifier(identifier);
    }

    /**
     * Normalises identifier quoting in printed SQL: backticks become double quotes.
     * Text inside single-quoted literals and double-quoted identifiers is copied as is.
     * @param sql printed SQL text
     * @return the normalised text
     */
    public static String normalizeQuoting(String sql) {
        if (sql == null) {
            return null;
        }
        StringBuilder normalized = new StringBuilder(sql.length());
        char quote = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (quote != 0) {
                // a doubled quote closes and reopens, which leaves the state unchanged
                if (c == quote) {
                    quote = 0;
                }
                normalized.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                normalized.append(c);
            } else {
                normalized.append(c == '`' ? '"' : c);
            }
        }
        return normalized.toString();
    }
}
