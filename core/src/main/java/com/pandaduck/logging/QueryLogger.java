package com.pandaduck.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured per-query logging.
 *
 * <p>{@link #startQuery} puts the query id into the SLF4J MDC so every log
 * line written while the query runs, on the calling thread, carries it.
 * Callers must invoke {@link #clearContext()} in a finally block.
 *
 * <pre>
 *   QueryLogger.startQuery(queryId);
 *   try {
 *       ...
 *       QueryLogger.completeQuery(totalMs);
 *   } finally {
 *       QueryLogger.clearContext();
 *   }
 * </pre>
 */
public final class QueryLogger {

    private static final Logger logger = LoggerFactory.getLogger(QueryLogger.class);

    /** MDC key holding the current query id */
    public static final String QUERY_ID_KEY = "queryId";

    private QueryLogger() {}

    /**
     * Starts logging context for a query.
     *
     * @param queryId the query id
     */
    public static void startQuery(String queryId) {
        MDC.put(QUERY_ID_KEY, queryId);
        logger.debug("Query started");
    }

    /**
     * Returns the query id of the current thread's context.
     *
     * @return the query id, or null outside a query
     */
    public static String currentQueryId() {
        return MDC.get(QUERY_ID_KEY);
    }

    /**
     * Logs generated SQL and the time it took to generate.
     *
     * @param sql the generated SQL
     * @param generationTimeMs generation time in milliseconds
     */
    public static void logSQLGeneration(String sql, long generationTimeMs) {
        logger.debug("Generated SQL in {} ms: {}", generationTimeMs, sql);
    }

    /**
     * Logs the materialization of one grouped-map stage.
     *
     * @param description the grouped-map operation
     * @param groupCount number of groups processed
     * @param rowCount number of output rows
     * @param timeMs materialization time in milliseconds
     */
    public static void logGroupMap(String description, int groupCount, long rowCount, long timeMs) {
        logger.debug("Grouped map '{}' processed {} groups into {} rows in {} ms",
            description, groupCount, rowCount, timeMs);
    }

    /**
     * Logs query execution metrics.
     *
     * @param executionTimeMs execution time in milliseconds
     * @param rowCount number of rows returned
     */
    public static void logExecution(long executionTimeMs, long rowCount) {
        logger.debug("Executed in {} ms, {} rows", executionTimeMs, rowCount);
    }

    /**
     * Logs query completion.
     *
     * @param totalTimeMs total query time in milliseconds
     */
    public static void completeQuery(long totalTimeMs) {
        logger.info("Query completed in {} ms", totalTimeMs);
    }

    /**
     * Logs a query failure.
     *
     * @param error the failure
     */
    public static void logError(Throwable error) {
        logger.error("Query failed: {}", error.getMessage(), error);
    }

    /**
     * Removes the query id from the MDC.
     */
    public static void clearContext() {
        MDC.remove(QUERY_ID_KEY);
    }
}
