package com.dataflow2sql.generator;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Identifiers are quoted only when needed: reserved words, names with
 * characters outside {@code [A-Za-z0-9_]}, and names starting with a digit.
 * The quote character is dialect specific ({@code `} for BigQuery,
 * {@code "} elsewhere) and is doubled inside quoted names.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifierIfNeeded("capacity", '"');  // capacity
 *   SQLQuoting.quoteIdentifierIfNeeded("user", '`');      // `user`
 *   SQLQuoting.quoteLiteral("O'Reilly");                   // 'O''Reilly'
 *   SQLQuoting.quoteLiteral("O'Reilly", true);             // 'O\'Reilly'
 * </pre>
 */
public final class SQLQuoting {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Words that must be quoted when used as identifiers in at least one
     * supported dialect.
     */
    private static final Set<String> RESERVED_WORDS = Set.of(
        "all", "and", "any", "array", "as", "asc", "between", "by", "case", "cast",
        "collate", "create", "cross", "current_date", "current_time", "current_timestamp",
        "current_user", "default", "desc", "distinct", "else", "end", "except", "exists",
        "extract", "false", "fetch", "for", "from", "full", "group", "having", "in",
        "inner", "intersect", "interval", "into", "is", "join", "lateral", "left",
        "like", "limit", "natural", "not", "null", "offset", "on", "or", "order",
        "outer", "over", "partition", "range", "right", "rows", "select", "set",
        "some", "table", "then", "to", "true", "union", "unique", "user", "using",
        "when", "where", "window", "with");

    private SQLQuoting() {}

    /**
     * Quotes an identifier with the given quote character.
     *
     * @param identifier the identifier to quote
     * @param quoteChar the dialect's identifier quote character
     * @return the quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier, char quoteChar) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String quote = String.valueOf(quoteChar);
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    /**
     * Quotes an identifier only if it is reserved or not a simple name.
     *
     * @param identifier the identifier
     * @param quoteChar the dialect's identifier quote character
     * @return the identifier, quoted if necessary
     */
    public static String quoteIdentifierIfNeeded(String identifier, char quoteChar) {
        if (needsQuoting(identifier)) {
            return quoteIdentifier(identifier, quoteChar);
        }
        return identifier;
    }

    /**
     * Returns whether an identifier must be quoted.
     *
     * @param identifier the identifier
     * @return true for reserved words and names that are not simple identifiers
     */
    public static boolean needsQuoting(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return !SIMPLE_IDENTIFIER.matcher(identifier).matches()
            || RESERVED_WORDS.contains(identifier.toLowerCase(Locale.ROOT));
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Uses single quotes and escapes internal quotes according to SQL standard.
     * Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        return quoteLiteral(value, false);
    }

    /**
     * Quotes a string literal value for a dialect.
     *
     * <p>With {@code backslashEscapes}, backslashes and quotes are escaped with a
     * backslash ({@code 'd\'Ivoire'}), as BigQuery reads them; otherwise quotes
     * are doubled and backslashes are literal.
     *
     * @param value the string value to quote
     * @param backslashEscapes whether the dialect treats backslash as an escape character
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value, boolean backslashEscapes) {
        if (value == null) {
            return "NULL";
        }
        if (backslashEscapes) {
            return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        return "'" + value.replace("'", "''") + "'";
    }
}
