package com.pandaduck.runtime;

import com.pandaduck.exception.QueryExecutionException;
import com.pandaduck.exception.RuntimeComputationException;
import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.logging.QueryLogger;
import com.pandaduck.logical.GroupMap;
import com.pandaduck.logical.GroupMapFunction;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import com.pandaduck.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Materializes {@link GroupMap} nodes.
 *
 * <p>The child plan is read ordered by the grouping columns and then the
 * node's order columns, split into groups wherever the key tuple changes,
 * and each group is handed to the node's function on a fixed-size worker
 * pool. Outputs are concatenated in group order, coerced to the declared
 * schema and written into a temporary table whose name is returned.
 *
 * <p>All database access happens on the calling thread; workers only run
 * user functions over in-memory rows.
 */
public class GroupMapExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GroupMapExecutor.class);

    private static final String TABLE_PREFIX = "__groupmap_";
    private static final int INSERT_BATCH_SIZE = 1000;

    private final QueryExecutor queryExecutor;
    private final ExecutorService workers;
    private final long timeoutSeconds;

    /**
     * Creates a grouped-map executor.
     *
     * @param queryExecutor the executor used to read the child plan
     * @param config the configuration providing pool size and timeout
     */
    public GroupMapExecutor(QueryExecutor queryExecutor, FrameConfig config) {
        this.queryExecutor = Objects.requireNonNull(queryExecutor, "queryExecutor must not be null");
        Objects.requireNonNull(config, "config must not be null");
        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.groupMapParallelism(), r -> {
            Thread t = new Thread(r, "pandaduck-groupmap-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timeoutSeconds = config.groupMapTimeoutSeconds();
    }

    /**
     * Materializes a grouped-map node into a new temporary table.
     *
     * @param node the node to materialize
     * @param generator a generator aware of already materialized descendants
     * @param connection the connection to write the table with
     * @return the temporary table name
     * @throws RuntimeComputationException if a group function fails or returns rows not matching the schema
     * @throws QueryExecutionException if reading the input or writing the table fails
     */
    public String materialize(GroupMap node, SQLGenerator generator, Connection connection) {
        long startTime = System.nanoTime();

        StructType inputSchema = node.child().schema();
        List<String> orderItems = new ArrayList<>();
        for (String name : node.groupingColumns()) {
            orderItems.add(SQLQuoting.quoteIdentifier(name) + " ASC NULLS FIRST");
        }
        for (String name : node.orderColumns()) {
            orderItems.add(SQLQuoting.quoteIdentifier(name) + " ASC NULLS FIRST");
        }
        String inputSQL = String.format("SELECT * FROM (%s) AS groupmap_input ORDER BY %s",
            generator.generate(node.child()), String.join(", ", orderItems));

        QueryResult input = queryExecutor.executeQuery(inputSQL, inputSchema);
        List<List<Object[]>> groups = splitGroups(input.rows(), keyIndexes(inputSchema, node.groupingColumns()));

        List<Object[]> output = runGroups(node, groups, inputSQL);
        String table = TABLE_PREFIX + UUID.randomUUID().toString().replace("-", "");
        writeTable(table, node.schema(), output, connection);

        QueryLogger.logGroupMap(node.description(), groups.size(), output.size(),
            (System.nanoTime() - startTime) / 1_000_000);
        return table;
    }

    private static int[] keyIndexes(StructType schema, List<String> columns) {
        int[] indexes = new int[columns.size()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = schema.fieldIndex(columns.get(i));
        }
        return indexes;
    }

    private static Object[] keyOf(Object[] row, int[] keyIndexes) {
        Object[] key = new Object[keyIndexes.length];
        for (int i = 0; i < keyIndexes.length; i++) {
            key[i] = row[keyIndexes[i]];
        }
        return key;
    }

    /**
     * Splits rows sorted by key into runs of equal keys.
     */
    static List<List<Object[]>> splitGroups(List<Object[]> sortedRows, int[] keyIndexes) {
        List<List<Object[]>> groups = new ArrayList<>();
        List<Object[]> current = null;
        Object[] currentKey = null;
        for (Object[] row : sortedRows) {
            Object[] key = keyOf(row, keyIndexes);
            if (current == null || !Arrays.equals(key, currentKey)) {
                current = new ArrayList<>();
                groups.add(current);
                currentKey = key;
            }
            current.add(row);
        }
        return groups;
    }

    private List<Object[]> runGroups(GroupMap node, List<List<Object[]>> groups, String inputSQL) {
        GroupMapFunction function = node.function();
        List<Future<List<Object[]>>> futures = new ArrayList<>(groups.size());
        for (List<Object[]> group : groups) {
            futures.add(workers.submit(() -> function.apply(group)));
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        StructType schema = node.schema();
        List<Object[]> output = new ArrayList<>();
        try {
            for (int g = 0; g < futures.size(); g++) {
                List<Object[]> rows;
                try {
                    rows = futures.get(g).get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    throw new RuntimeComputationException(String.format(
                        "Grouped map '%s' failed on group %d: %s", node.description(), g, cause.getMessage()),
                        cause, inputSQL);
                }
                if (rows == null) {
                    throw new RuntimeComputationException(String.format(
                        "Grouped map '%s' returned no result for group %d", node.description(), g), inputSQL);
                }
                for (Object[] row : rows) {
                    output.add(coerceRow(row, schema, node.description(), g, inputSQL));
                }
            }
        } catch (TimeoutException e) {
            throw new QueryExecutionException(String.format(
                "Grouped map '%s' did not finish within %d seconds", node.description(), timeoutSeconds),
                e, inputSQL);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while running grouped map '" +
                node.description() + "'", e, inputSQL);
        } finally {
            for (Future<List<Object[]>> future : futures) {
                future.cancel(true);
            }
        }
        return output;
    }

    private static Object[] coerceRow(Object[] row, StructType schema, String description, int group, String sql) {
        if (row == null || row.length != schema.size()) {
            throw new RuntimeComputationException(String.format(
                "Grouped map '%s' returned a row with %d values for group %d but the declared schema has %d columns",
                description, row == null ? 0 : row.length, group, schema.size()), sql);
        }
        Object[] coerced = new Object[row.length];
        for (int i = 0; i < row.length; i++) {
            StructField field = schema.fieldAt(i);
            try {
                coerced[i] = TypeMapper.coerce(row[i], field.dataType());
            } catch (ClassCastException e) {
                throw new RuntimeComputationException(String.format(
                    "Grouped map '%s' returned a %s for column '%s' declared as %s (group %d): %s",
                    description, row[i].getClass().getSimpleName(), field.name(),
                    field.dataType().typeName(), group, e.getMessage()), e, sql);
            }
        }
        return coerced;
    }

    private void writeTable(String table, StructType schema, List<Object[]> rows, Connection connection) {
        List<String> columns = new ArrayList<>();
        List<String> params = new ArrayList<>();
        for (StructField field : schema.fields()) {
            columns.add(SQLQuoting.quoteIdentifier(field.name()) + " " + TypeMapper.toDuckDBType(field.dataType()));
            params.add("?");
        }
        String quoted = SQLQuoting.quoteTableName(table);
        String createSQL = "CREATE TEMP TABLE " + quoted + " (" + String.join(", ", columns) + ")";
        String insertSQL = "INSERT INTO " + quoted + " VALUES (" + String.join(", ", params) + ")";

        logger.debug("Creating grouped-map table: {}", createSQL);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createSQL);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to create grouped-map table: " + e.getMessage(), e, createSQL);
        }

        try (PreparedStatement insert = connection.prepareStatement(insertSQL)) {
            int pending = 0;
            for (Object[] row : rows) {
                for (int i = 0; i < row.length; i++) {
                    insert.setObject(i + 1, toJdbcValue(row[i]));
                }
                insert.addBatch();
                if (++pending == INSERT_BATCH_SIZE) {
                    insert.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                insert.executeBatch();
            }
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to write grouped-map output: " + e.getMessage(), e, insertSQL);
        }
    }

    private static Object toJdbcValue(Object value) {
        if (value instanceof LocalDate date) {
            return Date.valueOf(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Timestamp.valueOf(dateTime);
        }
        return value;
    }

    /**
     * Drops a temporary table created by {@link #materialize}.
     *
     * @param table the table name
     * @param connection the connection that created it
     */
    public void drop(String table, Connection connection) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS " + SQLQuoting.quoteTableName(table));
        } catch (SQLException e) {
            logger.warn("Failed to drop grouped-map table {}: {}", table, e.getMessage());
        }
    }

    /**
     * Stops the worker pool.
     */
    @Override
    public void close() {
        workers.shutdownNow();
    }
}
