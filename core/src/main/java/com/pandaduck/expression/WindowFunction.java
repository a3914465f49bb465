package com.pandaduck.expression;

import com.pandaduck.logical.Sort;
import com.pandaduck.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing an aggregate evaluated as a window function.
 *
 * <p>Cumulative group operations are rendered as running windows:
 * <pre>
 *   max("B") OVER (PARTITION BY "A" ORDER BY "__index_level_0__" ASC NULLS FIRST
 *                  ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW)
 * </pre>
 */
public final class WindowFunction implements Expression {

    private static final String RUNNING_FRAME = "ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW";

    private final String function;
    private final List<Expression> arguments;
    private final List<Expression> partitionBy;
    private final List<Sort.SortOrder> orderBy;
    private final boolean runningFrame;
    private final DataType dataType;

    /**
     * Creates a window function.
     *
     * @param function the aggregate function name (sum, max, ...)
     * @param arguments the function arguments
     * @param partitionBy the partition by expressions (empty for no partitioning)
     * @param orderBy the order by specifications (empty for no ordering)
     * @param runningFrame whether to restrict the frame to rows up to the current row
     * @param dataType the result type
     */
    public WindowFunction(String function,
                          List<Expression> arguments,
                          List<Expression> partitionBy,
                          List<Sort.SortOrder> orderBy,
                          boolean runningFrame,
                          DataType dataType) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.arguments = new ArrayList<>(
            Objects.requireNonNull(arguments, "arguments must not be null"));
        this.partitionBy = new ArrayList<>(
            Objects.requireNonNull(partitionBy, "partitionBy must not be null"));
        this.orderBy = new ArrayList<>(
            Objects.requireNonNull(orderBy, "orderBy must not be null"));
        this.runningFrame = runningFrame;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String function() {
        return function;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public List<Expression> partitionBy() {
        return Collections.unmodifiableList(partitionBy);
    }

    public List<Sort.SortOrder> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public boolean isRunningFrame() {
        return runningFrame;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder();

        sql.append(function).append("(");
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(arguments.get(i).toSQL());
        }
        sql.append(") OVER (");

        List<String> clauses = new ArrayList<>();
        if (!partitionBy.isEmpty()) {
            List<String> parts = new ArrayList<>();
            for (Expression expr : partitionBy) {
                parts.add(expr.toSQL());
            }
            clauses.add("PARTITION BY " + String.join(", ", parts));
        }
        if (!orderBy.isEmpty()) {
            List<String> parts = new ArrayList<>();
            for (Sort.SortOrder order : orderBy) {
                parts.add(order.toSQL());
            }
            clauses.add("ORDER BY " + String.join(", ", parts));
        }
        if (runningFrame) {
            clauses.add(RUNNING_FRAME);
        }
        sql.append(String.join(" ", clauses));
        sql.append(")");
        return sql.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WindowFunction)) return false;
        WindowFunction that = (WindowFunction) obj;
        return runningFrame == that.runningFrame &&
               function.equals(that.function) &&
               arguments.equals(that.arguments) &&
               partitionBy.equals(that.partitionBy) &&
               orderBy.equals(that.orderBy) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments, partitionBy, orderBy, runningFrame, dataType);
    }
}
