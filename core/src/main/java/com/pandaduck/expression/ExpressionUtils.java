package com.pandaduck.expression;

import com.pandaduck.logical.Sort;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Utility methods for inspecting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Collects the names of all columns an expression tree refers to, in
     * first-seen order.
     *
     * <p>Used to check that a column expression handed to a frame only
     * refers to columns of that frame.
     *
     * @param expr the expression to inspect
     * @return the referenced column names
     */
    public static Set<String> referencedColumns(Expression expr) {
        Set<String> names = new LinkedHashSet<>();
        collect(expr, names);
        return names;
    }

    private static void collect(Expression expr, Set<String> names) {
        if (expr == null) {
            return;
        }
        if (expr instanceof ColumnReference col) {
            names.add(col.columnName());
        } else if (expr instanceof BinaryExpression bin) {
            collect(bin.left(), names);
            collect(bin.right(), names);
        } else if (expr instanceof UnaryExpression unary) {
            collect(unary.operand(), names);
        } else if (expr instanceof CastExpression cast) {
            collect(cast.expression(), names);
        } else if (expr instanceof AliasExpression alias) {
            collect(alias.expression(), names);
        } else if (expr instanceof FunctionCall func) {
            for (Expression arg : func.arguments()) {
                collect(arg, names);
            }
        } else if (expr instanceof InExpression in) {
            collect(in.testExpr(), names);
            for (Expression value : in.values()) {
                collect(value, names);
            }
        } else if (expr instanceof CaseWhenExpression cw) {
            for (Expression cond : cw.conditions()) {
                collect(cond, names);
            }
            for (Expression then : cw.thenBranches()) {
                collect(then, names);
            }
            collect(cw.elseBranch(), names);
        } else if (expr instanceof WindowFunction window) {
            for (Expression arg : window.arguments()) {
                collect(arg, names);
            }
            for (Expression part : window.partitionBy()) {
                collect(part, names);
            }
            for (Sort.SortOrder order : window.orderBy()) {
                collect(order.expression(), names);
            }
        }
        // literals refer to no column
    }
}
