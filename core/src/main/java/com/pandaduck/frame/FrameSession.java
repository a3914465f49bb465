package com.pandaduck.frame;

import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.logical.LocalRelation;
import com.pandaduck.logical.LogicalPlan;
import com.pandaduck.logical.TableScan;
import com.pandaduck.runtime.DuckDBRuntime;
import com.pandaduck.runtime.FrameConfig;
import com.pandaduck.runtime.QueryExecutor;
import com.pandaduck.runtime.QueryResult;
import com.pandaduck.types.LongType;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import com.pandaduck.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for building frames.
 *
 * <p>A session owns one DuckDB runtime and the executor running frame plans
 * against it. Frames created from a session stay bound to it and must not be
 * used after the session is closed.
 *
 * <pre>
 *   try (FrameSession session = FrameSession.create()) {
 *       Frame df = session.createFrame(schema, rows);
 *       LocalFrame result = df.groupBy("A").sum().collect();
 *   }
 * </pre>
 */
public class FrameSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FrameSession.class);

    private final String sessionId;
    private final FrameConfig config;
    private final DuckDBRuntime runtime;
    private final QueryExecutor executor;

    private FrameSession(FrameConfig config) {
        this.sessionId = UUID.randomUUID().toString();
        this.config = config;
        this.runtime = DuckDBRuntime.create(config.jdbcUrl());
        this.executor = new QueryExecutor(runtime, config);
        logger.info("Frame session {} started with {}", sessionId, config);
    }

    /**
     * Creates a session configured from system properties.
     *
     * @return the session
     */
    public static FrameSession create() {
        return create(FrameConfig.fromSystemProperties());
    }

    /**
     * Creates a session with explicit configuration.
     *
     * @param config the configuration
     * @return the session
     */
    public static FrameSession create(FrameConfig config) {
        return new FrameSession(Objects.requireNonNull(config, "config must not be null"));
    }

    public String sessionId() {
        return sessionId;
    }

    public FrameConfig config() {
        return config;
    }

    public QueryExecutor executor() {
        return executor;
    }

    /**
     * Creates a frame from local rows with a default sequential index.
     *
     * <p>The index is an unnamed BIGINT level holding 0..n-1.
     *
     * @param schema the data columns
     * @param rows the rows, one value per data column
     * @return the frame
     */
    public Frame createFrame(StructType schema, List<Object[]> rows) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        if (schema.fieldIndex(Frame.DEFAULT_INDEX_COLUMN) >= 0) {
            throw new IllegalArgumentException(
                "Column name " + Frame.DEFAULT_INDEX_COLUMN + " is reserved for the default index");
        }

        List<StructField> fields = new ArrayList<>();
        fields.add(new StructField(Frame.DEFAULT_INDEX_COLUMN, LongType.get(), false));
        fields.addAll(schema.fields());

        List<Object[]> indexed = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Object[] row = rows.get(i);
            if (row.length != schema.size()) {
                throw new IllegalArgumentException(String.format(
                    "Row %d has %d values but the schema has %d columns", i, row.length, schema.size()));
            }
            Object[] withIndex = new Object[row.length + 1];
            withIndex[0] = (long) i;
            System.arraycopy(row, 0, withIndex, 1, row.length);
            indexed.add(withIndex);
        }

        LocalRelation relation = new LocalRelation(new StructType(fields), indexed);
        FrameMetadata metadata = FrameMetadata.builder(relation.schema())
            .indexColumns(List.of(IndexColumn.unnamed(Frame.DEFAULT_INDEX_COLUMN)))
            .dataColumns(schema.fieldNames())
            .build();
        return new Frame(this, relation, metadata);
    }

    /**
     * Creates a frame from local rows indexed by some of its columns.
     *
     * @param schema all columns, index columns included
     * @param rows the rows, one value per column
     * @param indexColumns the columns forming the index levels, which keep their names
     * @return the frame
     */
    public Frame createFrame(StructType schema, List<Object[]> rows, String... indexColumns) {
        LocalRelation relation = new LocalRelation(schema, rows);
        return unindexed(relation).setIndex(indexColumns);
    }

    /**
     * Creates an unindexed frame over an existing DuckDB table or view.
     *
     * @param tableName the table name
     * @return the frame
     */
    public Frame table(String tableName) {
        QueryResult description = executor.executeQuery(
            "DESCRIBE " + SQLQuoting.quoteTableName(tableName), null);
        int nameIndex = description.schema().fieldIndex("column_name");
        int typeIndex = description.schema().fieldIndex("column_type");
        List<StructField> fields = new ArrayList<>();
        for (Object[] row : description.rows()) {
            fields.add(new StructField((String) row[nameIndex],
                TypeMapper.fromDuckDBType((String) row[typeIndex]), true));
        }
        return unindexed(new TableScan(tableName, new StructType(fields)));
    }

    private Frame unindexed(LogicalPlan plan) {
        FrameMetadata metadata = FrameMetadata.builder(plan.schema())
            .dataColumns(plan.schema().fieldNames())
            .build();
        return new Frame(this, plan, metadata);
    }

    /**
     * Runs a DDL or DML statement against the session's database.
     *
     * @param sql the statement
     */
    public void execute(String sql) {
        executor.executeUpdate(sql);
    }

    @Override
    public void close() {
        logger.info("Closing frame session {}", sessionId);
        executor.close();
        runtime.close();
    }
}
