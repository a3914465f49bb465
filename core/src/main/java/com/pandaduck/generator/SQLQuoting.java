package com.pandaduck.generator;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Frame labels are case-sensitive and may contain any character (for
 * example the two-level aggregate labels {@code ('B', 'min')}), so column
 * identifiers are always quoted rather than quoted only when needed.
 *
 * <p>Example usage:
 * <pre>
 *   String column = SQLQuoting.quoteIdentifier("price");
 *   // Result: "price"
 *
 *   String userInput = SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
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
        if (value == null) {
            return "NULL";
        }

        String escaped = value.replace("'", "''");
        return "'" + escaped + "'";
    }

    /**
     * Quotes a table name for use in SQL.
     *
     * <p>Rejects names containing statement separators or comment markers.
     *
     * @param tableName the table name to quote
     * @return quoted table name safe for SQL
     * @throws IllegalArgumentException if table name is null or contains invalid characters
     */
    public static String quoteTableName(String tableName) {
        if (tableName == null) {
            throw new IllegalArgumentException("Table name cannot be null");
        }
        if (tableName.contains(";") || tableName.contains("--")) {
            throw new IllegalArgumentException(
                "Table name contains invalid characters: " + tableName);
        }
        return quoteIdentifier(tableName);
    }
}
