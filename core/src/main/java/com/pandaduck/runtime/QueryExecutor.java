package com.pandaduck.runtime;

import com.pandaduck.exception.QueryExecutionException;
import com.pandaduck.exception.RuntimeComputationException;
import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.logging.QueryLogger;
import com.pandaduck.logical.GroupMap;
import com.pandaduck.logical.LogicalPlan;
import com.pandaduck.types.DataType;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import com.pandaduck.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Executes logical plans against DuckDB and returns materialized results.
 *
 * <p>Each QueryExecutor is bound to one {@link DuckDBRuntime}, owned by a
 * frame session. Executing a plan first materializes its grouped-map nodes
 * (bottom-up) into temporary tables, then generates and runs the SQL of the
 * whole plan, and finally drops the temporary tables.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(runtime, FrameConfig.defaults());
 *   QueryResult result = executor.execute(plan);
 * </pre>
 *
 * @see DuckDBRuntime
 * @see GroupMapExecutor
 */
public class QueryExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    /** Message raised by the cumulative product's positivity check */
    public static final String NON_POSITIVE_VALUE_MESSAGE = "values should be bigger than 0";

    private final DuckDBRuntime runtime;
    private final GroupMapExecutor groupMapExecutor;

    /**
     * Creates a query executor with the specified runtime.
     *
     * @param runtime the DuckDB runtime (typically from a session)
     * @param config the session configuration
     */
    public QueryExecutor(DuckDBRuntime runtime, FrameConfig config) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.groupMapExecutor = new GroupMapExecutor(this, config);
    }

    /**
     * Executes a plan and returns all of its rows.
     *
     * @param plan the plan to execute
     * @return the result, typed by the plan's schema
     * @throws QueryExecutionException if query execution fails
     * @throws RuntimeComputationException if evaluation fails on the data
     */
    public QueryResult execute(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        String queryId = "q_" + UUID.randomUUID().toString().substring(0, 8);
        QueryLogger.startQuery(queryId);
        long queryStartTime = System.nanoTime();

        Connection connection = runtime.getConnection();
        Map<LogicalPlan, String> materialized = new IdentityHashMap<>();
        try {
            materializeGroupMaps(plan, materialized, connection);

            long genStart = System.nanoTime();
            String sql = new SQLGenerator(materialized).generate(plan);
            QueryLogger.logSQLGeneration(sql, (System.nanoTime() - genStart) / 1_000_000);

            QueryResult result = executeQuery(sql, plan.schema());

            QueryLogger.completeQuery((System.nanoTime() - queryStartTime) / 1_000_000);
            return result;
        } catch (RuntimeException e) {
            QueryLogger.logError(e);
            throw e;
        } finally {
            for (String table : materialized.values()) {
                groupMapExecutor.drop(table, connection);
            }
            QueryLogger.clearContext();
        }
    }

    private void materializeGroupMaps(LogicalPlan plan, Map<LogicalPlan, String> materialized,
                                      Connection connection) {
        if (materialized.containsKey(plan)) {
            return;
        }
        for (LogicalPlan child : plan.children()) {
            materializeGroupMaps(child, materialized, connection);
        }
        if (plan instanceof GroupMap groupMap) {
            String table = groupMapExecutor.materialize(groupMap, new SQLGenerator(materialized), connection);
            materialized.put(plan, table);
        }
    }

    /**
     * Returns the SQL a plan translates to, without executing it.
     *
     * <p>Grouped-map nodes render as scans of placeholder tables.
     *
     * @param plan the plan
     * @return the SQL
     */
    public String explain(LogicalPlan plan) {
        Map<LogicalPlan, String> placeholders = new IdentityHashMap<>();
        collectPlaceholders(plan, placeholders);
        return new SQLGenerator(placeholders).generate(plan);
    }

    private static void collectPlaceholders(LogicalPlan plan, Map<LogicalPlan, String> placeholders) {
        for (LogicalPlan child : plan.children()) {
            collectPlaceholders(child, placeholders);
        }
        if (plan instanceof GroupMap && !placeholders.containsKey(plan)) {
            placeholders.put(plan, "__groupmap_pending_" + (placeholders.size() + 1));
        }
    }

    /**
     * Executes a query and returns all rows.
     *
     * @param sql the SQL query to execute
     * @param expectedSchema the schema to coerce values to, or null to derive it from the result
     * @return the query result
     * @throws QueryExecutionException if query execution fails
     */
    public QueryResult executeQuery(String sql, StructType expectedSchema) {
        Objects.requireNonNull(sql, "sql must not be null");

        long execStart = System.nanoTime();
        try (Statement stmt = runtime.getConnection().createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {

            StructType schema = expectedSchema != null ? expectedSchema : schemaOf(rs.getMetaData());
            int columnCount = rs.getMetaData().getColumnCount();
            if (columnCount != schema.size()) {
                throw new QueryExecutionException(String.format(
                    "Query returned %d columns but %d were expected", columnCount, schema.size()), sql);
            }

            List<Object[]> rows = new ArrayList<>();
            while (rs.next()) {
                Object[] row = new Object[columnCount];
                for (int i = 0; i < columnCount; i++) {
                    DataType type = schema.fieldAt(i).dataType();
                    row[i] = TypeMapper.coerce(TypeMapper.fromJdbcValue(rs.getObject(i + 1)), type);
                }
                rows.add(row);
            }

            QueryLogger.logExecution((System.nanoTime() - execStart) / 1_000_000, rows.size());
            return new QueryResult(schema, rows);

        } catch (SQLException e) {
            throw translate(e, sql);
        }
    }

    /**
     * Executes an update or DDL statement.
     *
     * @param sql the statement
     * @return the number of affected rows
     * @throws QueryExecutionException if execution fails
     */
    public int executeUpdate(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        logger.debug("Executing update: {}", sql);
        try (Statement stmt = runtime.getConnection().createStatement()) {
            return stmt.executeUpdate(sql);
        } catch (SQLException e) {
            throw translate(e, sql);
        }
    }

    private static StructType schemaOf(ResultSetMetaData meta) throws SQLException {
        List<StructField> fields = new ArrayList<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            fields.add(new StructField(meta.getColumnLabel(i),
                TypeMapper.fromDuckDBType(meta.getColumnTypeName(i)),
                meta.isNullable(i) != ResultSetMetaData.columnNoNulls));
        }
        return new StructType(fields);
    }

    private static QueryExecutionException translate(SQLException e, String sql) {
        String message = e.getMessage();
        if (message != null && message.contains(NON_POSITIVE_VALUE_MESSAGE)) {
            return new RuntimeComputationException(message, e, sql);
        }
        return new QueryExecutionException("Failed to execute query: " + message, e, sql);
    }

    public DuckDBRuntime getRuntime() {
        return runtime;
    }

    /**
     * Stops the grouped-map worker pool. The runtime is owned by the caller.
     */
    @Override
    public void close() {
        groupMapExecutor.close();
    }
}
