package com.pandaduck.selection;

import com.pandaduck.exception.IndexingShapeException;
import com.pandaduck.exception.SchemaResolutionException;
import com.pandaduck.exception.TypeMismatchException;
import com.pandaduck.exception.UnsupportedSelectionException;
import com.pandaduck.expression.BinaryExpression;
import com.pandaduck.expression.CastExpression;
import com.pandaduck.expression.ColumnReference;
import com.pandaduck.expression.Expression;
import com.pandaduck.expression.ExpressionUtils;
import com.pandaduck.expression.InExpression;
import com.pandaduck.expression.Literal;
import com.pandaduck.frame.Frame;
import com.pandaduck.frame.FrameMetadata;
import com.pandaduck.frame.Series;
import com.pandaduck.logical.Filter;
import com.pandaduck.logical.LogicalPlan;
import com.pandaduck.logical.Project;
import com.pandaduck.types.BooleanType;
import com.pandaduck.types.DataType;
import com.pandaduck.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Label-based selection and assignment over a frame, the equivalent of
 * pandas' {@code df.loc[rows, columns]}.
 *
 * <p>Row selectors become filters over the single index column (or over the
 * predicate), column selectors become a projection that keeps the index
 * columns ahead of the selected data columns. Each call returns a new frame
 * whose metadata is derived from the parent's in the same step as its plan.
 *
 * <pre>
 *   Frame rows = frame.loc().get(RowSelector.range(2, 5));
 *   Series b = (Series) frame.loc().get(RowSelector.where(frame.col("A").isNotNull()),
 *                                       ColumnSelector.column("B"));
 *   Frame updated = frame.loc().set(RowSelector.all(), "C", frame.col("B"));
 * </pre>
 *
 * <p>A locator obtained from a {@link Series} is bound to that series'
 * column: it accepts only a row selector and always yields a series.
 */
public class Locator {

    private static final Logger logger = LoggerFactory.getLogger(Locator.class);

    private static final String OPERATION = "loc";
    private static final String ASSIGN_OPERATION = "loc.set";

    private final Frame frame;
    private final String boundColumn;

    /**
     * Creates a locator over a frame.
     *
     * @param frame the frame
     */
    public Locator(Frame frame) {
        this(frame, null);
    }

    /**
     * Creates a locator bound to one column of a frame.
     *
     * @param frame the frame
     * @param boundColumn the column every selection is restricted to, or null
     */
    public Locator(Frame frame, String boundColumn) {
        this.frame = Objects.requireNonNull(frame, "frame must not be null");
        this.boundColumn = boundColumn;
    }

    /**
     * Selects rows, keeping all columns (or the bound column).
     *
     * @param rows the row selector
     * @return the selected frame, a series when the locator is bound to a column
     */
    public Frame get(RowSelector rows) {
        if (boundColumn != null) {
            return select(rows, ColumnSelector.column(boundColumn));
        }
        return select(rows, ColumnSelector.all());
    }

    /**
     * Selects rows and columns.
     *
     * @param rows the row selector
     * @param columns the column selector
     * @return the selected frame, a series for a single-column selector
     * @throws IndexingShapeException if the locator is bound to a column
     */
    public Frame get(RowSelector rows, ColumnSelector columns) {
        if (boundColumn != null) {
            throw new IndexingShapeException("Too many indexers", OPERATION,
                "select rows only: series.loc().get(rows)");
        }
        return select(rows, columns);
    }

    private Frame select(RowSelector rows, ColumnSelector columns) {
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(columns, "columns must not be null");

        FrameMetadata metadata = frame.metadata();
        LogicalPlan filtered = applyRows(frame.plan(), metadata, rows);

        boolean single = columns instanceof ColumnSelector.SingleColumn;
        List<String> selected = resolveColumns(metadata, columns);

        List<String> projected = metadata.indexColumnIds();
        projected.addAll(selected);
        Project project = Project.columns(filtered, projected);

        FrameMetadata.Builder builder = metadata.copy()
            .schema(project.schema())
            .dataColumns(selected);
        if (metadata.columnLabels().isPresent()) {
            List<List<String>> labels = new ArrayList<>(selected.size());
            for (String column : selected) {
                labels.add(metadata.labelOf(column));
            }
            builder.columnLabels(labels);
        }
        FrameMetadata selectedMetadata = builder.build();

        logger.debug("loc[{}, {}] selected columns {}", rows, columns, selected);
        if (single) {
            return new Series(frame.session(), project, selectedMetadata);
        }
        return frame.derive(project, selectedMetadata);
    }

    private static List<String> resolveColumns(FrameMetadata metadata, ColumnSelector columns) {
        List<String> names;
        if (columns instanceof ColumnSelector.AllColumns) {
            return new ArrayList<>(metadata.dataColumns());
        } else if (columns instanceof ColumnSelector.ColumnRange range) {
            if (!range.isUnbounded()) {
                throw new UnsupportedSelectionException(
                    "Can only select columns either by name or reference or all", OPERATION,
                    "select, where, withColumn");
            }
            return new ArrayList<>(metadata.dataColumns());
        } else if (columns instanceof ColumnSelector.SingleColumn column) {
            names = List.of(column.name());
        } else if (columns instanceof ColumnSelector.ColumnList list) {
            names = list.names();
        } else {
            throw new IllegalStateException("Unknown column selector: " + columns);
        }

        List<String> missing = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!metadata.isDataColumn(name)) {
                missing.add(name);
            } else if (!seen.add(name)) {
                throw new UnsupportedSelectionException(
                    "Duplicate column labels are not supported: " + name, OPERATION);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaResolutionException(missing, OPERATION);
        }
        return new ArrayList<>(names);
    }

    private static LogicalPlan applyRows(LogicalPlan plan, FrameMetadata metadata, RowSelector rows) {
        if (rows instanceof RowSelector.All) {
            return plan;
        }
        if (rows instanceof RowSelector.Predicate predicate) {
            Expression condition = predicate.condition();
            if (!(condition.dataType() instanceof BooleanType)) {
                throw new TypeMismatchException(
                    "Row predicate must be boolean, got " + condition.dataType().typeName(), OPERATION);
            }
            requireColumns(plan.schema(), condition, OPERATION);
            return new Filter(plan, condition);
        }
        if (rows instanceof RowSelector.LabelRange range) {
            return applyRange(plan, metadata, range);
        }
        if (rows instanceof RowSelector.Label) {
            throw new UnsupportedSelectionException(
                "Cannot use a scalar value for row selection.", OPERATION,
                "select a list with one label: RowSelector.labels(label)");
        }
        if (rows instanceof RowSelector.LabelList list) {
            return applyLabels(plan, metadata, list.labels());
        }
        throw new IllegalStateException("Unknown row selector: " + rows);
    }

    private static LogicalPlan applyRange(LogicalPlan plan, FrameMetadata metadata, RowSelector.LabelRange range) {
        if (range.step() != null) {
            throw new UnsupportedSelectionException("Cannot use step in a label range.", OPERATION,
                "filter with a predicate: RowSelector.where(...)");
        }
        if (range.isUnbounded()) {
            return plan;
        }
        ColumnReference index = singleIndexColumn(metadata,
            "Cannot use slice if no index provided.", "Cannot use slice for MultiIndex.");

        Expression condition = null;
        if (range.start() != null) {
            condition = BinaryExpression.greaterThanOrEqual(index, castLabel(range.start(), index.dataType()));
        }
        if (range.stop() != null) {
            Expression upper = BinaryExpression.lessThanOrEqual(index, castLabel(range.stop(), index.dataType()));
            condition = condition == null ? upper : BinaryExpression.and(condition, upper);
        }
        return new Filter(plan, condition);
    }

    private static LogicalPlan applyLabels(LogicalPlan plan, FrameMetadata metadata, List<Object> labels) {
        if (labels.isEmpty()) {
            return new Filter(plan, Literal.of(false));
        }
        ColumnReference index = singleIndexColumn(metadata,
            "Cannot select with labels if no index provided.", "Cannot select with MultiIndex.");

        if (labels.size() == 1) {
            return new Filter(plan, BinaryExpression.equal(index, castLabel(labels.get(0), index.dataType())));
        }
        List<Expression> values = new ArrayList<>(labels.size());
        for (Object label : labels) {
            values.add(castLabel(label, index.dataType()));
        }
        return new Filter(plan, new InExpression(index, values));
    }

    private static ColumnReference singleIndexColumn(FrameMetadata metadata, String noIndexMessage,
                                                     String multiIndexMessage) {
        int levels = metadata.indexColumns().size();
        if (levels == 0) {
            throw new UnsupportedSelectionException(noIndexMessage, OPERATION, "setIndex");
        }
        if (levels > 1) {
            throw new UnsupportedSelectionException(multiIndexMessage, OPERATION,
                "filter with a predicate: RowSelector.where(...)");
        }
        String id = metadata.indexColumns().get(0).columnId();
        return new ColumnReference(id, metadata.declaredType(id));
    }

    private static Expression castLabel(Object label, DataType indexType) {
        try {
            return new CastExpression(Literal.ofObject(label), indexType);
        } catch (IllegalArgumentException e) {
            throw new TypeMismatchException(e.getMessage(), OPERATION);
        }
    }

    /**
     * Assigns a column over all rows.
     *
     * @param rows the row selector; only the whole-row selector is accepted
     * @param column the column to replace or add
     * @param value a column expression over this frame, or a frame with exactly one column
     * @return the frame with the column assigned
     * @throws UnsupportedSelectionException if the row selector is not the whole-row selector
     * @throws TypeMismatchException if the value has the wrong shape
     */
    public Frame set(RowSelector rows, String column, Object value) {
        return set(rows, ColumnSelector.column(column), value);
    }

    /**
     * Assigns a column over all rows.
     *
     * @param rows the row selector; only the whole-row selector is accepted
     * @param column the column selector; only a single column name is accepted
     * @param value a column expression over this frame, or a frame with exactly one column
     * @return the frame with the column assigned
     */
    public Frame set(RowSelector rows, ColumnSelector column, Object value) {
        if (boundColumn != null) {
            throw new UnsupportedSelectionException("Cannot assign through a series locator", ASSIGN_OPERATION,
                "assign on the parent frame");
        }
        boolean wholeRows = rows instanceof RowSelector.All ||
            (rows instanceof RowSelector.LabelRange range && range.isUnbounded());
        if (!wholeRows) {
            throw new UnsupportedSelectionException(
                "Can only assign value to the whole dataframe, the row index has to be `:`",
                ASSIGN_OPERATION, "withColumn, select");
        }
        if (!(column instanceof ColumnSelector.SingleColumn single)) {
            throw new TypeMismatchException("only column names can be assigned", ASSIGN_OPERATION);
        }

        if (value instanceof Expression expr) {
            return frame.withColumn(single.name(), expr);
        }
        if (value instanceof Frame other) {
            if (other.columns().size() != 1) {
                throw new TypeMismatchException("Only a dataframe with one column can be assigned", ASSIGN_OPERATION);
            }
            return frame.withColumn(single.name(), frame.col(other.columns().get(0)));
        }
        throw new TypeMismatchException("Only a column or dataframe with single column can be assigned",
            ASSIGN_OPERATION);
    }

    /**
     * Checks that every column an expression refers to exists in a schema.
     *
     * @param schema the schema
     * @param expr the expression
     * @param operation the operation reported on failure
     * @throws SchemaResolutionException naming the missing columns
     */
    public static void requireColumns(StructType schema, Expression expr, String operation) {
        List<String> missing = new ArrayList<>();
        for (String name : ExpressionUtils.referencedColumns(expr)) {
            if (schema.fieldIndex(name) < 0) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaResolutionException(missing, operation);
        }
    }
}
