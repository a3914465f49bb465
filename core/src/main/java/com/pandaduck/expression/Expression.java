package com.pandaduck.expression;

import com.pandaduck.types.DataType;

/**
 * Base interface for all expressions in the pandaduck plan layer.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references</li>
 *   <li>Arithmetic operations (a + b, a * b)</li>
 *   <li>Comparison operations (a > b, a == b)</li>
 *   <li>Function calls (log(value), isnan(value))</li>
 * </ul>
 *
 * <p>Expressions are used in:
 * <ul>
 *   <li>SELECT clause (projections, column assignment)</li>
 *   <li>WHERE clause (row selection predicates)</li>
 *   <li>GROUP BY clause (group keys)</li>
 *   <li>ORDER BY clause</li>
 * </ul>
 *
 * <p>Expressions are immutable; all concrete implementations in this package are {@code final}.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Converts this expression to its SQL string representation.
     *
     * @return the SQL string representation
     */
    String toSQL();
}
