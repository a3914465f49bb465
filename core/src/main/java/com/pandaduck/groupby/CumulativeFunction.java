package com.pandaduck.groupby;

import com.pandaduck.expression.BinaryExpression;
import com.pandaduck.expression.CaseWhenExpression;
import com.pandaduck.expression.CastExpression;
import com.pandaduck.expression.Expression;
import com.pandaduck.expression.FunctionCall;
import com.pandaduck.expression.Literal;
import com.pandaduck.expression.UnaryExpression;
import com.pandaduck.expression.WindowFunction;
import com.pandaduck.logical.Aggregate.AggregateExpression;
import com.pandaduck.logical.Sort;
import com.pandaduck.runtime.QueryExecutor;
import com.pandaduck.types.DataType;
import com.pandaduck.types.DoubleType;
import com.pandaduck.types.StringType;
import com.pandaduck.types.TypeMapper;

import java.util.List;

/**
 * Running per-group computations, evaluated as window aggregates over a
 * frame that runs from the start of the group to the current row.
 */
public enum CumulativeFunction {
    CUMMAX("cummax", "max", false),
    CUMMIN("cummin", "min", false),
    CUMSUM("cumsum", "sum", true),
    CUMPROD("cumprod", "sum", true);

    private final String operationName;
    private final String windowFunction;
    private final boolean numericOnly;

    CumulativeFunction(String operationName, String windowFunction, boolean numericOnly) {
        this.operationName = operationName;
        this.windowFunction = windowFunction;
        this.numericOnly = numericOnly;
    }

    public String operationName() {
        return operationName;
    }

    public boolean accepts(DataType type) {
        return !numericOnly || TypeMapper.isNumeric(type);
    }

    /**
     * Returns the type a column of the given type accumulates to.
     *
     * @param inputType the column type
     * @return the output type
     */
    public DataType resultType(DataType inputType) {
        switch (this) {
            case CUMSUM:
                return AggregateExpression.resolveReturnType("sum", inputType);
            case CUMPROD:
                return DoubleType.get();
            default:
                return inputType;
        }
    }

    /**
     * Builds the running expression for one column.
     *
     * <p>Missing inputs stay missing. The product is computed as
     * {@code exp(sum(ln(x)))}; a non-positive value raises a DuckDB
     * {@code error()} when the row is evaluated.
     *
     * @param column the column
     * @param partitionBy the group key expressions
     * @param order the within-group row order
     * @return the expression
     */
    public Expression lower(Expression column, List<Expression> partitionBy, List<Sort.SortOrder> order) {
        Expression input = MissingValues.maskNaN(column);
        DataType type = resultType(column.dataType());

        Expression running;
        if (this == CUMPROD) {
            Expression message = FunctionCall.of("concat", StringType.get(),
                Literal.of(QueryExecutor.NON_POSITIVE_VALUE_MESSAGE + ": "),
                new CastExpression(input, StringType.get()));
            Expression checked = CaseWhenExpression.when(
                BinaryExpression.lessThanOrEqual(input, Literal.of(0)),
                FunctionCall.of("error", input.dataType(), message),
                input);
            Expression logarithm = FunctionCall.of("ln", DoubleType.get(), checked);
            Expression sum = new WindowFunction(windowFunction, List.of(logarithm), partitionBy, order,
                true, DoubleType.get());
            running = FunctionCall.of("exp", DoubleType.get(), sum);
        } else {
            running = new CastExpression(
                new WindowFunction(windowFunction, List.of(input), partitionBy, order, true, type), type);
        }
        return CaseWhenExpression.when(UnaryExpression.isNull(input), Literal.nullValue(type), running);
    }
}
