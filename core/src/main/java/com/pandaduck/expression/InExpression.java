package com.pandaduck.expression;

import com.pandaduck.types.BooleanType;
import com.pandaduck.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing an IN clause (or NOT IN clause).
 *
 * <p>SQL form: expr IN (val1, val2, val3)
 * <p>SQL form (negated): expr NOT IN (val1, val2, val3)
 *
 * <p>The result is always a boolean type.
 */
public final class InExpression implements Expression {

    private final Expression testExpr;
    private final List<Expression> values;
    private final boolean negated;

    /**
     * Creates an IN expression.
     *
     * @param testExpr the expression being tested
     * @param values the values to test against
     * @param negated true for NOT IN, false for IN
     * @throws IllegalArgumentException if values is empty
     */
    public InExpression(Expression testExpr, List<Expression> values, boolean negated) {
        Objects.requireNonNull(testExpr, "testExpr must not be null");
        Objects.requireNonNull(values, "values must not be null");

        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN clause requires at least one value");
        }

        this.testExpr = testExpr;
        this.values = new ArrayList<>(values);
        this.negated = negated;
    }

    /**
     * Creates an IN expression (not negated).
     *
     * @param testExpr the expression being tested
     * @param values the values to test against
     */
    public InExpression(Expression testExpr, List<Expression> values) {
        this(testExpr, values, false);
    }

    public Expression testExpr() {
        return testExpr;
    }

    public List<Expression> values() {
        return Collections.unmodifiableList(values);
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return testExpr.nullable() || values.stream().anyMatch(Expression::nullable);
    }

    @Override
    public String toSQL() {
        String valueList = values.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", "));
        return String.format("(%s %sIN (%s))", testExpr.toSQL(), negated ? "NOT " : "", valueList);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return negated == that.negated &&
               testExpr.equals(that.testExpr) &&
               values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, values, negated);
    }
}
