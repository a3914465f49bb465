package com.pandaduck.groupby;

import com.pandaduck.expression.CastExpression;
import com.pandaduck.expression.Expression;
import com.pandaduck.expression.FunctionCall;
import com.pandaduck.expression.Literal;
import com.pandaduck.expression.UnaryExpression;
import com.pandaduck.logical.Aggregate.AggregateExpression;
import com.pandaduck.logical.Sort;
import com.pandaduck.types.BooleanType;
import com.pandaduck.types.DataType;
import com.pandaduck.types.TypeMapper;

import java.util.Collections;
import java.util.List;

/**
 * The per-group reductions a {@link GroupBy} pushes down into an aggregate.
 */
public enum ReduceFunction {
    COUNT("count", false),
    SUM("sum", true),
    MEAN("avg", true),
    MIN("min", false),
    MAX("max", false),
    FIRST("first", false),
    LAST("last", false),
    STD("stddev_samp", true),
    VAR("var_samp", true),
    ALL("bool_and", false),
    ANY("bool_or", false);

    private final String sqlFunction;
    private final boolean numericOnly;

    ReduceFunction(String sqlFunction, boolean numericOnly) {
        this.sqlFunction = sqlFunction;
        this.numericOnly = numericOnly;
    }

    public String sqlFunction() {
        return sqlFunction;
    }

    public boolean isNumericOnly() {
        return numericOnly;
    }

    /**
     * Whether a column of the given type takes part in this reduction.
     *
     * @param type the column type
     * @return false for non-numeric columns of a numeric-only reduction
     */
    public boolean accepts(DataType type) {
        return !numericOnly || TypeMapper.isNumeric(type);
    }

    /**
     * Builds the aggregate for one column.
     *
     * @param column the column to reduce
     * @param alias the output column name
     * @param rowOrder the parent's index order, used by first and last
     * @return the aggregate expression
     */
    public AggregateExpression lower(Expression column, String alias, List<Sort.SortOrder> rowOrder) {
        Expression input = MissingValues.maskNaN(column);
        switch (this) {
            case ALL:
            case ANY:
                Expression fill = Literal.of(this == ALL);
                Expression asBoolean = FunctionCall.of("coalesce", BooleanType.get(),
                    new CastExpression(input, BooleanType.get()), fill);
                return new AggregateExpression(sqlFunction, asBoolean, alias);
            case FIRST:
            case LAST:
                return new AggregateExpression(sqlFunction, input, alias, false,
                    UnaryExpression.isNotNull(input), rowOrder);
            default:
                return new AggregateExpression(sqlFunction, input, alias, false, null, Collections.emptyList());
        }
    }
}
