package com.pandaduck.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when query execution fails.
 *
 * <p>This exception wraps SQLException with query context and provides
 * user-friendly error messages for common DuckDB errors.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       LocalFrame result = frame.collect();
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.pandaduck.runtime.QueryExecutor
 */
public class QueryExecutionException extends RuntimeException {

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Detects common DuckDB error patterns and rewrites them as actionable
     * guidance.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Query execution failed. Check column names and data types.";
        }

        if (message.contains("Binder Error") && message.contains("not found")) {
            return translateColumnNotFound(message);
        }

        if (message.contains("Conversion Error")) {
            return "Data type mismatch in query. " +
                   "Check that selection labels match the index column type.";
        }

        if (message.contains("Out of Memory Error")) {
            return "Query requires more memory than available. " +
                   "Try reducing data size or adding filters.";
        }

        if (message.contains("Catalog Error")) {
            return "Table not found: " + message;
        }

        return "Query execution failed: " + message;
    }

    private String translateColumnNotFound(String message) {
        Pattern pattern = Pattern.compile("column \"([^\"]+)\" not found");
        Matcher matcher = pattern.matcher(message);

        if (matcher.find()) {
            return "Column '" + matcher.group(1) + "' not found. " +
                   "Check column name spelling and case sensitivity.";
        }
        return "Column not found: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
