package com.pandaduck.frame;

import com.pandaduck.api.FrameOperation;
import com.pandaduck.api.MissingOperations;
import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.exception.SchemaResolutionException;
import com.pandaduck.expression.BinaryExpression;
import com.pandaduck.expression.CastExpression;
import com.pandaduck.expression.ColumnReference;
import com.pandaduck.expression.Expression;
import com.pandaduck.expression.Literal;
import com.pandaduck.expression.WindowFunction;
import com.pandaduck.groupby.GroupBy;
import com.pandaduck.groupby.GroupKey;
import com.pandaduck.logical.Aggregate;
import com.pandaduck.logical.LogicalPlan;
import com.pandaduck.logical.Project;
import com.pandaduck.logical.Sort;
import com.pandaduck.runtime.QueryResult;
import com.pandaduck.selection.ColumnSelector;
import com.pandaduck.selection.Locator;
import com.pandaduck.selection.RowSelector;
import com.pandaduck.types.LongType;
import com.pandaduck.types.StructField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A lazily evaluated, pandas-like data frame.
 *
 * <p>A frame pairs a {@link LogicalPlan} with the {@link FrameMetadata} that
 * says which of the plan's output columns are index columns and which are
 * data columns. The two are always derived together: every operation builds
 * a new plan and new metadata bound to that plan's schema, and the
 * constructor rejects a pair whose schemas differ. Nothing runs until
 * {@link #collect()} or {@link #count()} is called.
 *
 * <p>Frames are immutable and share their session's DuckDB connection.
 */
public class Frame {

    private static final Logger logger = LoggerFactory.getLogger(Frame.class);

    /** Physical name of the default sequential index column */
    public static final String DEFAULT_INDEX_COLUMN = "__index_level_0__";

    private final FrameSession session;
    private final LogicalPlan plan;
    private final FrameMetadata metadata;

    /**
     * Creates a frame.
     *
     * @param session the owning session
     * @param plan the plan computing the frame's rows
     * @param metadata the metadata describing the plan's output
     * @throws IllegalArgumentException if the metadata was built for a different schema
     */
    public Frame(FrameSession session, LogicalPlan plan, FrameMetadata metadata) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        if (!metadata.schema().equals(plan.schema())) {
            throw new IllegalArgumentException(String.format(
                "Metadata schema %s does not match plan schema %s", metadata.schema(), plan.schema()));
        }
    }

    /**
     * Creates a frame in the same session from a derived plan and metadata.
     *
     * @param newPlan the plan
     * @param newMetadata the metadata bound to the plan's schema
     * @return the frame
     */
    public Frame derive(LogicalPlan newPlan, FrameMetadata newMetadata) {
        return new Frame(session, newPlan, newMetadata);
    }

    public FrameSession session() {
        return session;
    }

    public LogicalPlan plan() {
        return plan;
    }

    public FrameMetadata metadata() {
        return metadata;
    }

    /**
     * Returns the data column names.
     *
     * @return the data columns, in order
     */
    public List<String> columns() {
        return metadata.dataColumns();
    }

    /**
     * Returns the display names of the index levels.
     *
     * @return the names, null for unnamed levels
     */
    public List<String> indexNames() {
        return metadata.indexNames();
    }

    /**
     * Returns a reference to a column of this frame's plan.
     *
     * @param name a data or index column name
     * @return the column reference, typed by the declared type
     * @throws SchemaResolutionException if the plan has no such column
     */
    public ColumnReference col(String name) {
        StructField field = plan.schema().fieldByName(name);
        if (field == null) {
            throw new SchemaResolutionException(List.of(name), "col");
        }
        return new ColumnReference(field.name(), field.dataType(), field.nullable());
    }

    /**
     * Returns one data column as a series that keeps this frame's index.
     *
     * @param name the data column
     * @return the series
     */
    public Series get(String name) {
        if (!metadata.isDataColumn(name)) {
            throw new SchemaResolutionException(List.of(name), "get");
        }
        List<String> projected = metadata.indexColumnIds();
        projected.add(name);
        Project project = Project.columns(plan, projected);
        FrameMetadata.Builder builder = metadata.copy()
            .schema(project.schema())
            .dataColumns(List.of(name));
        if (metadata.columnLabels().isPresent()) {
            builder.columnLabels(List.of(metadata.labelOf(name)));
        }
        return new Series(session, project, builder.build());
    }

    /**
     * Keeps the index and the given data columns.
     *
     * @param names the data columns, in output order
     * @return the projected frame
     */
    public Frame select(String... names) {
        return loc().get(RowSelector.all(), ColumnSelector.columns(names));
    }

    /**
     * Replaces a data column, or appends it when absent.
     *
     * @param name the column name
     * @param expr an expression over this frame's columns
     * @return the new frame
     * @throws SchemaResolutionException if the expression refers to a column this frame does not have
     */
    public Frame withColumn(String name, Expression expr) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expr, "expr must not be null");
        Locator.requireColumns(plan.schema(), expr, "withColumn");
        if (metadata.indexColumnIds().contains(name)) {
            throw new FrameConfigurationException("Cannot assign to index column " + name, "withColumn",
                "resetIndex first");
        }

        List<Expression> projections = new ArrayList<>();
        List<String> aliases = new ArrayList<>();
        for (String id : metadata.indexColumnIds()) {
            projections.add(col(id));
            aliases.add(id);
        }
        List<String> dataColumns = new ArrayList<>(metadata.dataColumns());
        boolean replaced = false;
        for (String column : dataColumns) {
            if (column.equals(name)) {
                projections.add(expr);
                replaced = true;
            } else {
                projections.add(col(column));
            }
            aliases.add(column);
        }
        List<List<String>> labels = metadata.columnLabels().map(ArrayList::new).orElse(null);
        if (!replaced) {
            projections.add(expr);
            aliases.add(name);
            dataColumns.add(name);
            if (labels != null) {
                labels.add(padLabel(name, metadata.labelLevels()));
            }
        }

        Project project = new Project(plan, projections, aliases);
        FrameMetadata newMetadata = metadata.copy()
            .schema(project.schema())
            .dataColumns(dataColumns)
            .columnLabels(labels)
            .build();
        return new Frame(session, project, newMetadata);
    }

    private static List<String> padLabel(String name, int levels) {
        List<String> label = new ArrayList<>(Collections.nCopies(levels, ""));
        label.set(0, name);
        return label;
    }

    /**
     * Makes the given data columns the index, dropping the current index.
     *
     * @param columns the data columns forming the new index levels
     * @return the re-indexed frame
     */
    public Frame setIndex(String... columns) {
        if (columns.length == 0) {
            throw new FrameConfigurationException("No index columns passed", "setIndex");
        }
        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!metadata.isDataColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaResolutionException(missing, "setIndex");
        }

        List<String> indexList = Arrays.asList(columns);
        List<String> dataColumns = new ArrayList<>();
        List<List<String>> labels = metadata.columnLabels().isPresent() ? new ArrayList<>() : null;
        for (String column : metadata.dataColumns()) {
            if (!indexList.contains(column)) {
                dataColumns.add(column);
                if (labels != null) {
                    labels.add(metadata.labelOf(column));
                }
            }
        }
        List<IndexColumn> index = new ArrayList<>();
        for (String column : columns) {
            index.add(IndexColumn.named(column));
        }

        List<String> projected = new ArrayList<>(indexList);
        projected.addAll(dataColumns);
        Project project = Project.columns(plan, projected);
        FrameMetadata newMetadata = metadata.copy()
            .schema(project.schema())
            .indexColumns(index)
            .dataColumns(dataColumns)
            .columnLabels(labels)
            .build();
        return new Frame(session, project, newMetadata);
    }

    /**
     * Moves the index levels into the data columns and attaches a new
     * sequential index.
     *
     * <p>Levels are named by their display name, {@code index} for a single
     * unnamed level or {@code level_i} otherwise, and are inserted ahead of
     * the existing data columns.
     *
     * @return the frame with a default index
     * @throws FrameConfigurationException if a level name collides with an existing data column
     */
    public Frame resetIndex() {
        List<IndexColumn> index = metadata.indexColumns();
        List<Expression> projections = new ArrayList<>();
        List<String> aliases = new ArrayList<>();
        List<String> dataColumns = new ArrayList<>();

        WindowFunction rowNumber = new WindowFunction("row_number", List.of(), List.of(),
            List.of(), false, LongType.get());
        Expression sequence = BinaryExpression.subtract(new CastExpression(rowNumber, LongType.get()), Literal.of(1L));
        projections.add(sequence);
        aliases.add(DEFAULT_INDEX_COLUMN);

        for (int i = 0; i < index.size(); i++) {
            IndexColumn level = index.get(i);
            String name;
            if (level.hasName()) {
                name = level.name();
            } else if (index.size() == 1) {
                name = "index";
            } else {
                name = "level_" + i;
            }
            if (metadata.isDataColumn(name) || dataColumns.contains(name) || DEFAULT_INDEX_COLUMN.equals(name)) {
                throw new FrameConfigurationException("cannot insert " + name + ", already exists", "resetIndex");
            }
            projections.add(col(level.columnId()));
            aliases.add(name);
            dataColumns.add(name);
        }
        List<List<String>> labels = null;
        if (metadata.columnLabels().isPresent()) {
            int levels = metadata.labelLevels();
            labels = new ArrayList<>();
            for (String name : dataColumns) {
                labels.add(padLabel(name, levels));
            }
            labels.addAll(metadata.columnLabels().get());
        }
        for (String column : metadata.dataColumns()) {
            if (DEFAULT_INDEX_COLUMN.equals(column)) {
                throw new FrameConfigurationException("cannot insert " + column + ", already exists", "resetIndex");
            }
            projections.add(col(column));
            aliases.add(column);
            dataColumns.add(column);
        }

        Project project = new Project(plan, projections, aliases);
        FrameMetadata newMetadata = FrameMetadata.builder(project.schema())
            .indexColumns(List.of(IndexColumn.unnamed(DEFAULT_INDEX_COLUMN)))
            .dataColumns(dataColumns)
            .columnLabels(labels)
            .build();
        return new Frame(session, project, newMetadata);
    }

    /**
     * Sorts rows by the index columns, ascending.
     *
     * @return the sorted frame
     * @throws FrameConfigurationException if the frame has no index
     */
    public Frame sortIndex() {
        if (!metadata.hasIndex()) {
            throw new FrameConfigurationException("Index must be set.", "sortIndex", "setIndex");
        }
        return withPlan(sortByIndex(plan, metadata));
    }

    /**
     * Wraps a plan in an ascending sort over the metadata's index columns.
     *
     * @param plan the plan
     * @param metadata metadata whose index columns exist in the plan
     * @return the sorted plan
     */
    public static Sort sortByIndex(LogicalPlan plan, FrameMetadata metadata) {
        List<Sort.SortOrder> orders = new ArrayList<>();
        for (String id : metadata.indexColumnIds()) {
            StructField field = plan.schema().fieldByName(id);
            orders.add(Sort.SortOrder.ascending(new ColumnReference(id, field.dataType(), field.nullable())));
        }
        return new Sort(plan, orders);
    }

    /**
     * Rebinds this frame's metadata to a plan with the same output schema.
     *
     * @param newPlan the plan
     * @return the frame
     */
    protected Frame withPlan(LogicalPlan newPlan) {
        return new Frame(session, newPlan, metadata.copy().schema(newPlan.schema()).build());
    }

    /**
     * Returns a label-based locator.
     *
     * @return the locator
     */
    public Locator loc() {
        return new Locator(this);
    }

    /**
     * Groups by data columns.
     *
     * @param columns the key columns
     * @return the grouping
     */
    public GroupBy groupBy(String... columns) {
        return new GroupBy(this, GroupKey.of(this, columns));
    }

    /**
     * Groups by arbitrary key expressions.
     *
     * @param key the grouping key
     * @return the grouping
     */
    public GroupBy groupBy(GroupKey key) {
        return new GroupBy(this, key);
    }

    /**
     * Executes the plan and returns the rows with their index values.
     *
     * @return the materialized frame
     */
    public LocalFrame collect() {
        List<String> projected = metadata.projectedColumnIds();
        LogicalPlan output = projected.equals(plan.schema().fieldNames()) ? plan : Project.columns(plan, projected);
        QueryResult result = session.executor().execute(output);

        int levels = metadata.indexColumns().size();
        List<String> names = new ArrayList<>();
        if (metadata.columnLabels().isPresent()) {
            for (List<String> label : metadata.columnLabels().get()) {
                names.add(label.size() == 1 ? label.get(0) : label.toString());
            }
        } else {
            names.addAll(metadata.dataColumns());
        }
        LocalFrame.Builder builder = LocalFrame.builder()
            .indexNames(metadata.indexNames())
            .columns(names);
        for (Object[] row : result.rows()) {
            builder.addRow(Arrays.copyOfRange(row, 0, levels), Arrays.copyOfRange(row, levels, row.length));
        }
        logger.debug("Collected {} rows", result.rowCount());
        return builder.build();
    }

    /**
     * Counts the rows.
     *
     * @return the number of rows
     */
    public long count() {
        Aggregate aggregate = new Aggregate(plan, List.of(),
            List.of(new Aggregate.AggregateExpression("count", null, "count")));
        QueryResult result = session.executor().execute(aggregate);
        return (Long) result.rows().get(0)[0];
    }

    /**
     * Returns the SQL this frame's plan translates to.
     *
     * @return the SQL
     */
    public String explain() {
        return session.executor().explain(plan);
    }

    /**
     * Invokes a frame operation by its pandas name.
     *
     * <p>Names without a Java counterpart raise the not-implemented error
     * registered for them.
     *
     * @param name the pandas method or property name
     * @return the result of the operation
     * @throws com.pandaduck.exception.PandasNotImplementedException if the name is a known missing operation
     * @throws IllegalArgumentException if the name is unknown
     */
    public Object call(String name) {
        FrameOperation operation = FrameOperation.fromName(name);
        if (operation != null) {
            return operation.invoke(this);
        }
        throw MissingOperations.lookup(MissingOperations.FRAME, name)
            .map(d -> (RuntimeException) d.toException())
            .orElseGet(() -> new IllegalArgumentException("'DataFrame' object has no attribute '" + name + "'"));
    }

    @Override
    public String toString() {
        return String.format("Frame(index=%s, columns=%s)", metadata.indexNames(), metadata.dataColumns());
    }
}
