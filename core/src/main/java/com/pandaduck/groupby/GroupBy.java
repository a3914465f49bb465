package com.pandaduck.groupby;

import com.pandaduck.api.GroupByOperation;
import com.pandaduck.api.MissingOperations;
import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.exception.SchemaResolutionException;
import com.pandaduck.exception.TypeMismatchException;
import com.pandaduck.expression.AliasExpression;
import com.pandaduck.expression.ColumnReference;
import com.pandaduck.expression.Expression;
import com.pandaduck.frame.Frame;
import com.pandaduck.frame.FrameMetadata;
import com.pandaduck.frame.IndexColumn;
import com.pandaduck.frame.LocalFrame;
import com.pandaduck.frame.LocalSeries;
import com.pandaduck.frame.Series;
import com.pandaduck.logical.Aggregate;
import com.pandaduck.logical.Aggregate.AggregateExpression;
import com.pandaduck.logical.Distinct;
import com.pandaduck.logical.GroupMap;
import com.pandaduck.logical.GroupMapFunction;
import com.pandaduck.logical.LogicalPlan;
import com.pandaduck.logical.Project;
import com.pandaduck.logical.Sort;
import com.pandaduck.selection.Locator;
import com.pandaduck.types.DataType;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-group operations over a frame.
 *
 * <p>A group-by is bound to a parent frame and a {@link GroupKey}. It never
 * changes: {@link #narrow} returns a new group-by, and every terminal
 * operation builds a new frame, so one value can serve several terminal
 * calls. Operations take one of three routes:
 * <ul>
 *   <li>reductions, {@link #size()} and {@link #aggregate(Map)} become an
 *       {@link Aggregate} whose key columns form the result's index;</li>
 *   <li>cumulative operations become running window expressions partitioned
 *       by the key and keep the parent's index;</li>
 *   <li>{@link #apply}, {@link #transform} and {@link #filter} become a
 *       {@link GroupMap} that hands each group to a user function.</li>
 * </ul>
 *
 * <pre>
 *   Frame sums = frame.groupBy("A").sum();
 *   Series b = (Series) frame.groupBy("A").narrow("B").cumsum();
 *   Frame big = frame.groupBy("A").filter(g -> g.mean("B") > 3);
 * </pre>
 */
public class GroupBy {

    private static final Logger logger = LoggerFactory.getLogger(GroupBy.class);

    private static final String INDEX_ALIAS = "__index_level_%d__";
    private static final String GROUP_KEY_ALIAS = "__groupkey_%d__";

    private final Frame parent;
    private final GroupKey key;
    private final List<String> explicitColumns;
    private final boolean seriesResult;

    /**
     * Creates a group-by over all data columns not used as keys.
     *
     * @param parent the frame being grouped
     * @param key the grouping key
     * @throws SchemaResolutionException if a key expression refers to a column the frame does not have
     */
    public GroupBy(Frame parent, GroupKey key) {
        this(parent, key, null, false);
        for (Expression expr : key.expressions()) {
            Locator.requireColumns(parent.plan().schema(), expr, "groupBy");
        }
    }

    private GroupBy(Frame parent, GroupKey key, List<String> explicitColumns, boolean seriesResult) {
        this.parent = Objects.requireNonNull(parent, "parent must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.explicitColumns = explicitColumns == null ? null : Collections.unmodifiableList(explicitColumns);
        this.seriesResult = seriesResult;
    }

    public Frame parent() {
        return parent;
    }

    public GroupKey key() {
        return key;
    }

    /**
     * Whether the aggregated columns were narrowed explicitly.
     *
     * @return true after {@link #narrow}
     */
    public boolean isExplicit() {
        return explicitColumns != null;
    }

    /**
     * Returns the columns terminal operations work on: the narrowed columns,
     * or else every data column of the parent that is not a key.
     *
     * @return the columns
     */
    public List<String> aggColumns() {
        if (explicitColumns != null) {
            return explicitColumns;
        }
        List<String> keyNames = key.names();
        List<String> columns = new ArrayList<>();
        for (String column : parent.metadata().dataColumns()) {
            if (!keyNames.contains(column)) {
                columns.add(column);
            }
        }
        return columns;
    }

    /**
     * Narrows to one column; results of terminal operations are series.
     *
     * @param column the data column
     * @return the narrowed group-by
     */
    public GroupBy narrow(String column) {
        return new GroupBy(parent, key, resolve(List.of(column)), true);
    }

    /**
     * Narrows to a list of columns; results of terminal operations are frames.
     *
     * @param columns the data columns
     * @return the narrowed group-by
     */
    public GroupBy narrow(String... columns) {
        return narrow(Arrays.asList(columns));
    }

    public GroupBy narrow(List<String> columns) {
        return new GroupBy(parent, key, resolve(columns), false);
    }

    private List<String> resolve(List<String> columns) {
        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!parent.metadata().isDataColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaResolutionException(missing, "groupBy");
        }
        return new ArrayList<>(columns);
    }

    // ==================== Reductions ====================

    public Frame count() {
        return reduce(ReduceFunction.COUNT);
    }

    public Frame sum() {
        return reduce(ReduceFunction.SUM);
    }

    public Frame mean() {
        return reduce(ReduceFunction.MEAN);
    }

    public Frame min() {
        return reduce(ReduceFunction.MIN);
    }

    public Frame max() {
        return reduce(ReduceFunction.MAX);
    }

    public Frame first() {
        return reduce(ReduceFunction.FIRST);
    }

    public Frame last() {
        return reduce(ReduceFunction.LAST);
    }

    public Frame std() {
        return reduce(ReduceFunction.STD);
    }

    public Frame var() {
        return reduce(ReduceFunction.VAR);
    }

    public Frame all() {
        return reduce(ReduceFunction.ALL);
    }

    public Frame any() {
        return reduce(ReduceFunction.ANY);
    }

    /**
     * Reduces every aggregated column per group.
     *
     * <p>Numeric-only reductions skip non-numeric columns. The result is
     * indexed by the key and sorted by it; with no column left to reduce it
     * holds the distinct keys only.
     *
     * @param function the reduction
     * @return the reduced frame
     */
    public Frame reduce(ReduceFunction function) {
        FrameMetadata metadata = parent.metadata();
        List<Sort.SortOrder> rowOrder = indexOrder(metadata);

        List<String> columns = new ArrayList<>();
        List<AggregateExpression> aggregates = new ArrayList<>();
        for (String column : aggColumns()) {
            if (!function.accepts(metadata.declaredType(column))) {
                logger.debug("{} skips non-numeric column {}", function, column);
                continue;
            }
            aggregates.add(function.lower(parent.col(column), column, rowOrder));
            columns.add(column);
        }

        LogicalPlan plan;
        if (aggregates.isEmpty()) {
            plan = new Distinct(new Project(parent.plan(), key.expressions(), keyAliases(INDEX_ALIAS)));
        } else {
            plan = new Aggregate(parent.plan(), aliasedKeys(INDEX_ALIAS), aggregates);
        }
        return keyed(sortByKey(plan), columns, labelsFor(columns));
    }

    /**
     * Counts rows per group, missing values included.
     *
     * @return a series named after the single narrowed column, else {@code count}
     */
    public Series size() {
        String name = explicitColumns != null && explicitColumns.size() == 1 ? explicitColumns.get(0) : "count";
        Aggregate aggregate = new Aggregate(parent.plan(), aliasedKeys(INDEX_ALIAS),
            List.of(new AggregateExpression("count", null, name)));
        LogicalPlan plan = sortByKey(aggregate);
        return new Series(parent.session(), plan, keyedMetadata(plan, List.of(name), null));
    }

    /**
     * Aggregates columns with per-column functions.
     *
     * <p>The result is indexed by the key and is not sorted.
     *
     * @param spec column name to a function name or a list of function names
     * @return the aggregated frame
     * @throws FrameConfigurationException if the spec is malformed
     * @throws SchemaResolutionException if the spec names a column the frame does not have
     */
    public Frame aggregate(Map<?, ?> spec) {
        AggregationSpec parsed = AggregationSpec.parse(spec);
        FrameMetadata metadata = parent.metadata();

        List<String> missing = new ArrayList<>();
        for (String column : parsed.columns()) {
            if (!metadata.isDataColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaResolutionException(missing, "aggregate");
        }

        List<Sort.SortOrder> rowOrder = indexOrder(metadata);
        List<String> columns = new ArrayList<>();
        List<List<String>> labels = new ArrayList<>();
        List<AggregateExpression> aggregates = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : parsed.functions().entrySet()) {
            String column = entry.getKey();
            for (String function : entry.getValue()) {
                String alias = parsed.outputName(column, function);
                aggregates.add(AggregationSpec.lower(function, parent.col(column), alias, rowOrder));
                columns.add(alias);
                labels.add(parsed.outputLabel(column, function));
            }
        }

        Aggregate aggregate = new Aggregate(parent.plan(), aliasedKeys(INDEX_ALIAS), aggregates);
        logger.debug("aggregate {} over {}", parsed, key);
        return keyed(aggregate, columns, parsed.isMultiLevel() ? labels : null);
    }

    // ==================== Cumulative operations ====================

    public Frame cummax() {
        return cumulative(CumulativeFunction.CUMMAX);
    }

    public Frame cummin() {
        return cumulative(CumulativeFunction.CUMMIN);
    }

    public Frame cumsum() {
        return cumulative(CumulativeFunction.CUMSUM);
    }

    /**
     * Running product per group.
     *
     * <p>Evaluation fails with a {@link com.pandaduck.exception.RuntimeComputationException}
     * when a non-missing value is zero or negative.
     *
     * @return the frame of running products, keeping the parent's index
     */
    public Frame cumprod() {
        return cumulative(CumulativeFunction.CUMPROD);
    }

    /**
     * Computes a running value per group and column, in index order.
     *
     * @param function the running computation
     * @return a frame with the parent's index and one column per accumulated column
     * @throws FrameConfigurationException if the parent has no index
     */
    public Frame cumulative(CumulativeFunction function) {
        FrameMetadata metadata = parent.metadata();
        if (!metadata.hasIndex()) {
            throw new FrameConfigurationException("Index must be set.", function.operationName(), "setIndex");
        }

        List<Expression> projections = new ArrayList<>();
        List<String> aliases = new ArrayList<>();
        for (String id : metadata.indexColumnIds()) {
            projections.add(parent.col(id));
            aliases.add(id);
        }
        List<Sort.SortOrder> order = indexOrder(metadata);
        List<String> columns = new ArrayList<>();
        for (String column : aggColumns()) {
            if (!function.accepts(metadata.declaredType(column))) {
                logger.debug("{} skips non-numeric column {}", function.operationName(), column);
                continue;
            }
            projections.add(function.lower(parent.col(column), key.expressions(), order));
            aliases.add(column);
            columns.add(column);
        }

        Project project = new Project(parent.plan(), projections, aliases);
        FrameMetadata result = metadata.copy()
            .schema(project.schema())
            .dataColumns(columns)
            .columnLabels(labelsFor(columns))
            .build();
        return wrap(project, result);
    }

    // ==================== Grouped map ====================

    /**
     * Runs a function once per group and concatenates its outputs.
     *
     * <p>Each invocation sees the group's rows with the parent's index. Its
     * output is read positionally into the declared schema. The result has
     * no index.
     *
     * @param func the per-group function
     * @param schema the declared output schema
     * @return the concatenated outputs
     * @throws TypeMismatchException if {@code func} is null
     * @throws FrameConfigurationException if the schema is missing, empty or has duplicate names
     */
    public Frame apply(GroupApplyFunction func, StructType schema) {
        if (func == null) {
            throw new TypeMismatchException("apply requires a function", "apply");
        }
        requireSchema(schema, "apply");

        List<String> columns = explicitColumns != null ? explicitColumns : parent.metadata().dataColumns();
        GroupedInput input = groupedInput(columns);
        GroupMapFunction mapper = rows -> {
            LocalFrame result = func.apply(input.toLocalFrame(rows));
            if (result == null) {
                throw new IllegalStateException("apply function returned null");
            }
            if (result.columns().size() != schema.size()) {
                throw new IllegalStateException(String.format(
                    "apply function returned %d columns but the declared schema has %d",
                    result.columns().size(), schema.size()));
            }
            List<Object[]> output = new ArrayList<>(result.size());
            for (int i = 0; i < result.size(); i++) {
                output.add(result.row(i));
            }
            return output;
        };

        GroupMap groupMap = input.groupMap(mapper, schema, "apply");
        FrameMetadata metadata = FrameMetadata.builder(groupMap.schema())
            .dataColumns(schema.fieldNames())
            .build();
        return wrap(groupMap, metadata);
    }

    /**
     * Transforms every aggregated column group by group.
     *
     * <p>The function receives one column of one group at a time and must
     * return a series of the same length. The result keeps the parent's index.
     *
     * @param func the per-column function
     * @param returnType the type of the transformed columns
     * @return the transformed frame
     * @throws TypeMismatchException if {@code func} is null
     * @throws FrameConfigurationException if the return type is missing
     */
    public Frame transform(GroupTransformFunction func, DataType returnType) {
        if (func == null) {
            throw new TypeMismatchException("transform requires a function", "transform");
        }
        if (returnType == null || returnType instanceof StructType) {
            throw new FrameConfigurationException("transform requires a declared return type", "transform",
                "pass the column type the function returns, e.g. DoubleType.get()");
        }
        List<String> columns = aggColumns();
        if (columns.isEmpty()) {
            throw new FrameConfigurationException("No columns to transform", "transform");
        }

        FrameMetadata metadata = parent.metadata();
        List<StructField> fields = new ArrayList<>();
        for (String id : metadata.indexColumnIds()) {
            fields.add(metadata.field(id));
        }
        for (String column : columns) {
            fields.add(new StructField(column, returnType, true));
        }
        StructType schema = new StructType(fields);

        GroupedInput input = groupedInput(columns);
        int levels = input.levels;
        List<String> indexNames = metadata.indexNames();
        GroupMapFunction mapper = rows -> {
            List<Object[]> index = new ArrayList<>(rows.size());
            for (Object[] row : rows) {
                index.add(Arrays.copyOfRange(row, 0, levels));
            }
            List<Object[]> output = new ArrayList<>(rows.size());
            for (Object[] label : index) {
                Object[] row = new Object[levels + columns.size()];
                System.arraycopy(label, 0, row, 0, levels);
                output.add(row);
            }
            for (int c = 0; c < columns.size(); c++) {
                List<Object> values = new ArrayList<>(rows.size());
                for (Object[] row : rows) {
                    values.add(row[levels + c]);
                }
                LocalSeries result = func.apply(new LocalSeries(columns.get(c), indexNames, index, values));
                if (result == null || result.size() != rows.size()) {
                    throw new IllegalStateException(String.format(
                        "transform function must return %d values for column %s, got %s",
                        rows.size(), columns.get(c), result == null ? "null" : String.valueOf(result.size())));
                }
                for (int r = 0; r < rows.size(); r++) {
                    output.get(r)[levels + c] = result.get(r);
                }
            }
            return output;
        };

        GroupMap groupMap = input.groupMap(mapper, schema, "transform");
        FrameMetadata result = metadata.copy()
            .schema(groupMap.schema())
            .dataColumns(columns)
            .columnLabels(labelsFor(columns))
            .build();
        return wrap(groupMap, result);
    }

    /**
     * Keeps the rows of the groups a predicate accepts.
     *
     * <p>The parent's index is re-attached and the result is sorted by it.
     *
     * @param func the per-group predicate
     * @return the filtered frame
     * @throws TypeMismatchException if {@code func} is null
     */
    public Frame filter(GroupFilterFunction func) {
        if (func == null) {
            throw new TypeMismatchException("filter requires a function", "filter");
        }
        FrameMetadata metadata = parent.metadata();
        List<String> columns = explicitColumns != null ? explicitColumns : metadata.dataColumns();

        List<StructField> fields = new ArrayList<>();
        for (String id : metadata.indexColumnIds()) {
            fields.add(metadata.field(id));
        }
        for (String column : columns) {
            fields.add(metadata.field(column));
        }
        StructType schema = new StructType(fields);

        GroupedInput input = groupedInput(columns);
        int width = schema.size();
        GroupMapFunction mapper = rows -> {
            if (!func.test(input.toLocalFrame(rows))) {
                return Collections.emptyList();
            }
            List<Object[]> output = new ArrayList<>(rows.size());
            for (Object[] row : rows) {
                output.add(Arrays.copyOf(row, width));
            }
            return output;
        };

        GroupMap groupMap = input.groupMap(mapper, schema, "filter");
        FrameMetadata restored = metadata.copy()
            .schema(groupMap.schema())
            .dataColumns(columns)
            .columnLabels(labelsFor(columns))
            .build();
        LogicalPlan plan = restored.hasIndex() ? Frame.sortByIndex(groupMap, restored) : groupMap;
        return wrap(plan, restored);
    }

    private static void requireSchema(StructType schema, String operation) {
        if (schema == null) {
            throw new FrameConfigurationException(operation + " requires a declared return schema", operation,
                "pass the StructType of the rows the function returns");
        }
        if (schema.size() == 0) {
            throw new FrameConfigurationException("The declared return schema has no columns", operation);
        }
        Set<String> names = new HashSet<>();
        for (StructField field : schema.fields()) {
            if (!names.add(field.name())) {
                throw new FrameConfigurationException("Duplicate column in declared return schema: " + field.name(),
                    operation);
            }
            if (field.dataType() instanceof StructType) {
                throw new FrameConfigurationException(
                    "Nested struct column in declared return schema: " + field.name(), operation,
                    "declare flat columns of scalar types");
            }
        }
    }

    /**
     * The worker input of a grouped map: index columns, the columns handed to
     * the user function and the key values, in that order.
     */
    private final class GroupedInput {
        final Project plan;
        final int levels;
        final List<String> columns;

        GroupedInput(Project plan, int levels, List<String> columns) {
            this.plan = plan;
            this.levels = levels;
            this.columns = columns;
        }

        LocalFrame toLocalFrame(List<Object[]> rows) {
            LocalFrame.Builder builder = LocalFrame.builder()
                .indexNames(parent.metadata().indexNames())
                .columns(columns);
            for (Object[] row : rows) {
                builder.addRow(Arrays.copyOfRange(row, 0, levels),
                    Arrays.copyOfRange(row, levels, levels + columns.size()));
            }
            return builder.build();
        }

        GroupMap groupMap(GroupMapFunction function, StructType schema, String description) {
            logger.debug("{} over {} with columns {}", description, key, columns);
            return new GroupMap(plan, keyAliases(GROUP_KEY_ALIAS), parent.metadata().indexColumnIds(),
                function, schema, description);
        }
    }

    private GroupedInput groupedInput(List<String> columns) {
        FrameMetadata metadata = parent.metadata();
        List<Expression> projections = new ArrayList<>();
        List<String> aliases = new ArrayList<>();
        for (String id : metadata.indexColumnIds()) {
            projections.add(parent.col(id));
            aliases.add(id);
        }
        for (String column : columns) {
            projections.add(parent.col(column));
            aliases.add(column);
        }
        projections.addAll(key.expressions());
        aliases.addAll(keyAliases(GROUP_KEY_ALIAS));
        return new GroupedInput(new Project(parent.plan(), projections, aliases),
            metadata.indexColumns().size(), new ArrayList<>(columns));
    }

    // ==================== Helpers ====================

    private List<String> keyAliases(String format) {
        List<String> aliases = new ArrayList<>(key.size());
        for (int i = 0; i < key.size(); i++) {
            aliases.add(String.format(format, i));
        }
        return aliases;
    }

    private List<Expression> aliasedKeys(String format) {
        List<String> aliases = keyAliases(format);
        List<Expression> keys = new ArrayList<>(key.size());
        for (int i = 0; i < key.size(); i++) {
            keys.add(new AliasExpression(key.columns().get(i).expression(), aliases.get(i)));
        }
        return keys;
    }

    private Sort sortByKey(LogicalPlan plan) {
        List<Sort.SortOrder> orders = new ArrayList<>();
        for (String alias : keyAliases(INDEX_ALIAS)) {
            StructField field = plan.schema().fieldByName(alias);
            orders.add(Sort.SortOrder.ascending(new ColumnReference(alias, field.dataType(), field.nullable())));
        }
        return new Sort(plan, orders);
    }

    private static List<Sort.SortOrder> indexOrder(FrameMetadata metadata) {
        List<Sort.SortOrder> orders = new ArrayList<>();
        for (String id : metadata.indexColumnIds()) {
            orders.add(Sort.SortOrder.ascending(new ColumnReference(id, metadata.declaredType(id))));
        }
        return orders;
    }

    private List<List<String>> labelsFor(List<String> columns) {
        FrameMetadata metadata = parent.metadata();
        if (metadata.columnLabels().isEmpty()) {
            return null;
        }
        List<List<String>> labels = new ArrayList<>(columns.size());
        for (String column : columns) {
            labels.add(metadata.labelOf(column));
        }
        return labels;
    }

    private FrameMetadata keyedMetadata(LogicalPlan plan, List<String> columns, List<List<String>> labels) {
        List<String> aliases = keyAliases(INDEX_ALIAS);
        List<String> names = key.names();
        List<IndexColumn> index = new ArrayList<>(key.size());
        for (int i = 0; i < key.size(); i++) {
            index.add(new IndexColumn(aliases.get(i), names.get(i)));
        }
        return FrameMetadata.builder(plan.schema())
            .indexColumns(index)
            .dataColumns(columns)
            .columnLabels(labels)
            .build();
    }

    private Frame keyed(LogicalPlan plan, List<String> columns, List<List<String>> labels) {
        return wrap(plan, keyedMetadata(plan, columns, labels));
    }

    private Frame wrap(LogicalPlan plan, FrameMetadata metadata) {
        if (seriesResult && metadata.dataColumns().size() == 1) {
            return new Series(parent.session(), plan, metadata);
        }
        return new Frame(parent.session(), plan, metadata);
    }

    /**
     * Invokes a group-by operation by its pandas name.
     *
     * @param name the pandas method name
     * @return the result frame
     * @throws com.pandaduck.exception.PandasNotImplementedException if the name is a known missing operation
     * @throws IllegalArgumentException if the name is unknown
     */
    public Frame call(String name) {
        GroupByOperation operation = GroupByOperation.fromName(name);
        if (operation != null) {
            return operation.invoke(this);
        }
        throw MissingOperations.lookup(MissingOperations.GROUP_BY, name)
            .map(d -> (RuntimeException) d.toException())
            .orElseGet(() -> new IllegalArgumentException("'GroupBy' object has no attribute '" + name + "'"));
    }

    @Override
    public String toString() {
        return String.format("GroupBy(key=%s, columns=%s)", key, aggColumns());
    }
}
