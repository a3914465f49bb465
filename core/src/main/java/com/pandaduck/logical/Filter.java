package com.pandaduck.logical;

import com.pandaduck.expression.Expression;
import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.types.StructType;
import java.util.Objects;

/**
 * Logical plan node representing a filter operation (WHERE clause).
 *
 * <p>Row selection by predicate, label, label range and label list all
 * become filters over the index columns.
 *
 * <p>SQL generation:
 * <pre>SELECT * FROM (child) AS subquery_1 WHERE condition</pre>
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the filter condition (must evaluate to boolean)
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Expression condition() {
        return condition;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        String childSQL = generator.generate(child());
        return String.format("SELECT * FROM (%s) AS %s WHERE %s",
            childSQL, generator.generateSubqueryAlias(), condition.toSQL());
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition);
    }
}
