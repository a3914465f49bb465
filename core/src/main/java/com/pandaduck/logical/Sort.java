package com.pandaduck.logical;

import com.pandaduck.expression.Expression;
import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a sort (ORDER BY clause).
 *
 * <p>Plans carry no row order unless they end in a Sort; index sorting,
 * sorted group keys and the ordered output of group filters all use it.
 *
 * <p>SQL generation:
 * <pre>SELECT * FROM (child) AS subquery_1 ORDER BY expr1 ASC NULLS FIRST, expr2 DESC NULLS LAST</pre>
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> sortOrders;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param sortOrders the sort orders
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        super(child);
        this.sortOrders = new ArrayList<>(Objects.requireNonNull(sortOrders, "sortOrders must not be null"));

        if (this.sortOrders.isEmpty()) {
            throw new IllegalArgumentException("sortOrders must not be empty");
        }
    }

    /**
     * Returns the sort orders.
     *
     * @return an unmodifiable list of sort orders
     */
    public List<SortOrder> sortOrders() {
        return Collections.unmodifiableList(sortOrders);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        String childSQL = generator.generate(child());

        List<String> orderClauses = new ArrayList<>();
        for (SortOrder order : sortOrders) {
            orderClauses.add(order.toSQL());
        }

        return String.format("SELECT * FROM (%s) AS %s ORDER BY %s",
            childSQL, generator.generateSubqueryAlias(), String.join(", ", orderClauses));
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public String toString() {
        return String.format("Sort(%s)", sortOrders);
    }

    /**
     * Represents a sort order (expression + direction + null handling).
     */
    public static class SortOrder {
        private final Expression expression;
        private final SortDirection direction;
        private final NullOrdering nullOrdering;

        public SortOrder(Expression expression, SortDirection direction, NullOrdering nullOrdering) {
            this.expression = Objects.requireNonNull(expression);
            this.direction = Objects.requireNonNull(direction);
            this.nullOrdering = Objects.requireNonNull(nullOrdering);
        }

        public SortOrder(Expression expression, SortDirection direction) {
            this(expression, direction,
                 direction == SortDirection.ASCENDING ? NullOrdering.NULLS_FIRST : NullOrdering.NULLS_LAST);
        }

        /**
         * Creates an ascending, nulls-first sort order.
         *
         * @param expression the sort key
         * @return the sort order
         */
        public static SortOrder ascending(Expression expression) {
            return new SortOrder(expression, SortDirection.ASCENDING);
        }

        public Expression expression() {
            return expression;
        }

        public SortDirection direction() {
            return direction;
        }

        public NullOrdering nullOrdering() {
            return nullOrdering;
        }

        /**
         * Renders this order as an ORDER BY item.
         *
         * @return the SQL fragment
         */
        public String toSQL() {
            return expression.toSQL() +
                (direction == SortDirection.DESCENDING ? " DESC" : " ASC") +
                (nullOrdering == NullOrdering.NULLS_FIRST ? " NULLS FIRST" : " NULLS LAST");
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof SortOrder)) return false;
            SortOrder that = (SortOrder) obj;
            return expression.equals(that.expression) &&
                   direction == that.direction &&
                   nullOrdering == that.nullOrdering;
        }

        @Override
        public int hashCode() {
            return Objects.hash(expression, direction, nullOrdering);
        }

        @Override
        public String toString() {
            return String.format("%s %s %s", expression, direction, nullOrdering);
        }
    }

    /**
     * Sort direction.
     */
    public enum SortDirection {
        ASCENDING,
        DESCENDING
    }

    /**
     * Null ordering.
     */
    public enum NullOrdering {
        NULLS_FIRST,
        NULLS_LAST
    }
}
