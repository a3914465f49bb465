package com.pandaduck.groupby;

import com.pandaduck.expression.CaseWhenExpression;
import com.pandaduck.expression.Expression;
import com.pandaduck.expression.FunctionCall;
import com.pandaduck.expression.Literal;
import com.pandaduck.types.BooleanType;
import com.pandaduck.types.TypeMapper;

/**
 * NaN handling for grouped computations.
 *
 * <p>DuckDB aggregates and windows treat NaN as an ordinary value while
 * grouped results treat it as missing, so floating-point inputs are rewritten
 * to {@code CASE WHEN isnan(x) THEN NULL ELSE x END} first.
 */
final class MissingValues {

    private MissingValues() {
    }

    static Expression maskNaN(Expression column) {
        if (!TypeMapper.isFloatingPoint(column.dataType())) {
            return column;
        }
        Expression isNaN = FunctionCall.of("isnan", BooleanType.get(), column);
        return CaseWhenExpression.when(isNaN, Literal.nullValue(column.dataType()), column);
    }
}
