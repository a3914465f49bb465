package com.pandaduck.expression;

import com.pandaduck.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a CASE WHEN conditional expression.
 *
 * <p>SQL form:
 * <pre>
 *   CASE
 *     WHEN condition1 THEN result1
 *     WHEN condition2 THEN result2
 *     ELSE default_result
 *   END
 * </pre>
 *
 * <p>The result type is the type of the first THEN branch; callers build
 * branches of a common type (NaN masking, positivity checks).
 */
public final class CaseWhenExpression implements Expression {

    private final List<Expression> conditions;
    private final List<Expression> thenBranches;
    private final Expression elseBranch;

    /**
     * Creates a CASE WHEN expression.
     *
     * @param conditions the WHEN conditions (must match thenBranches size)
     * @param thenBranches the THEN result expressions
     * @param elseBranch the ELSE result expression (may be null)
     * @throws IllegalArgumentException if conditions and thenBranches have different sizes
     */
    public CaseWhenExpression(List<Expression> conditions, List<Expression> thenBranches, Expression elseBranch) {
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(thenBranches, "thenBranches must not be null");

        if (conditions.size() != thenBranches.size()) {
            throw new IllegalArgumentException(
                "conditions and thenBranches must have the same size: " +
                conditions.size() + " vs " + thenBranches.size());
        }
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("CASE WHEN requires at least one condition");
        }

        this.conditions = new ArrayList<>(conditions);
        this.thenBranches = new ArrayList<>(thenBranches);
        this.elseBranch = elseBranch;
    }

    public List<Expression> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    public List<Expression> thenBranches() {
        return Collections.unmodifiableList(thenBranches);
    }

    /**
     * Returns the ELSE branch expression.
     *
     * @return the ELSE expression, or null if not specified
     */
    public Expression elseBranch() {
        return elseBranch;
    }

    @Override
    public DataType dataType() {
        return thenBranches.get(0).dataType();
    }

    @Override
    public boolean nullable() {
        if (elseBranch == null || elseBranch.nullable()) {
            return true;
        }
        for (Expression branch : thenBranches) {
            if (branch.nullable()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder("CASE ");

        for (int i = 0; i < conditions.size(); i++) {
            sql.append("WHEN ").append(conditions.get(i).toSQL());
            sql.append(" THEN ").append(thenBranches.get(i).toSQL()).append(" ");
        }

        if (elseBranch != null) {
            sql.append("ELSE ").append(elseBranch.toSQL()).append(" ");
        }

        sql.append("END");
        return sql.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhenExpression)) return false;
        CaseWhenExpression that = (CaseWhenExpression) obj;
        return Objects.equals(conditions, that.conditions) &&
               Objects.equals(thenBranches, that.thenBranches) &&
               Objects.equals(elseBranch, that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, thenBranches, elseBranch);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    /**
     * Creates a single-branch CASE expression.
     *
     * @param condition the WHEN condition
     * @param then the THEN result
     * @param otherwise the ELSE result (may be null)
     * @return the expression
     */
    public static CaseWhenExpression when(Expression condition, Expression then, Expression otherwise) {
        return new CaseWhenExpression(List.of(condition), List.of(then), otherwise);
    }
}
