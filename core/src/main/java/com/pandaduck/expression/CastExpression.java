package com.pandaduck.expression;

import com.pandaduck.types.DataType;
import com.pandaduck.types.TypeMapper;
import java.util.Objects;

/**
 * Expression that casts another expression to a different data type.
 *
 * <p>Used to cast row selection labels to the index column's declared type
 * and to coerce values to BOOLEAN for the {@code all}/{@code any} reductions.
 *
 * <p>Examples:
 * <pre>
 *   CAST(5 AS BIGINT)
 *   CAST("flag" AS BOOLEAN)
 * </pre>
 */
public final class CastExpression implements Expression {

    private final Expression expression;
    private final DataType targetType;

    /**
     * Creates a cast expression.
     *
     * @param expression the expression to cast
     * @param targetType the target data type
     */
    public CastExpression(Expression expression, DataType targetType) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public DataType targetType() {
        return targetType;
    }

    @Override
    public DataType dataType() {
        return targetType;
    }

    @Override
    public boolean nullable() {
        return expression.nullable();
    }

    @Override
    public String toSQL() {
        return String.format("CAST(%s AS %s)", expression.toSQL(), TypeMapper.toDuckDBType(targetType));
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return expression.equals(that.expression) && targetType.equals(that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, targetType);
    }
}
