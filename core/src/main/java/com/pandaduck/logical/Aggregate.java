package com.pandaduck.logical;

import com.pandaduck.expression.AliasExpression;
import com.pandaduck.expression.ColumnReference;
import com.pandaduck.expression.Expression;
import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.types.BooleanType;
import com.pandaduck.types.DataType;
import com.pandaduck.types.DoubleType;
import com.pandaduck.types.LongType;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import com.pandaduck.types.TypeMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Logical plan node representing an aggregation (GROUP BY clause).
 *
 * <p>Grouping expressions are usually aliased to synthesized key columns
 * ({@code __index_level_0__}, ...) which become the index of the result.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT "A" AS "__index_level_0__", CAST(MIN("B") AS INTEGER) AS "B"
 *   FROM (child) AS subquery_1 GROUP BY "A"
 * </pre>
 */
public final class Aggregate extends LogicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<AggregateExpression> aggregateExpressions;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingExpressions the grouping expressions (GROUP BY), plain columns or aliased
     * @param aggregateExpressions the aggregate expressions (may be empty for a key-only result)
     */
    public Aggregate(LogicalPlan child,
                     List<Expression> groupingExpressions,
                     List<AggregateExpression> aggregateExpressions) {
        super(child);
        this.groupingExpressions = new ArrayList<>(
            Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null"));
        this.aggregateExpressions = new ArrayList<>(
            Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null"));

        if (this.groupingExpressions.isEmpty() && this.aggregateExpressions.isEmpty()) {
            throw new IllegalArgumentException("Aggregate requires grouping or aggregate expressions");
        }
    }

    public List<Expression> groupingExpressions() {
        return Collections.unmodifiableList(groupingExpressions);
    }

    public List<AggregateExpression> aggregateExpressions() {
        return Collections.unmodifiableList(aggregateExpressions);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        StringBuilder sql = new StringBuilder("SELECT ");

        List<String> selectExprs = new ArrayList<>();
        for (Expression expr : groupingExpressions) {
            if (expr instanceof AliasExpression) {
                selectExprs.add(expr.toSQL());
            } else {
                selectExprs.add(expr.toSQL() + " AS " + SQLQuoting.quoteIdentifier(outputName(expr)));
            }
        }
        for (AggregateExpression aggExpr : aggregateExpressions) {
            selectExprs.add(aggExpr.toSQL() + " AS " + SQLQuoting.quoteIdentifier(aggExpr.alias()));
        }
        sql.append(String.join(", ", selectExprs));

        sql.append(" FROM (");
        sql.append(generator.generate(child()));
        sql.append(") AS ").append(generator.generateSubqueryAlias());

        if (!groupingExpressions.isEmpty()) {
            List<String> groupExprs = new ArrayList<>();
            for (Expression expr : groupingExpressions) {
                Expression inner = expr instanceof AliasExpression
                    ? ((AliasExpression) expr).expression()
                    : expr;
                groupExprs.add(inner.toSQL());
            }
            sql.append(" GROUP BY ").append(String.join(", ", groupExprs));
        }

        return sql.toString();
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>();
        for (Expression expr : groupingExpressions) {
            fields.add(new StructField(outputName(expr), expr.dataType(), expr.nullable()));
        }
        for (AggregateExpression aggExpr : aggregateExpressions) {
            fields.add(new StructField(aggExpr.alias(), aggExpr.dataType(), aggExpr.nullable()));
        }
        return new StructType(fields);
    }

    private static String outputName(Expression expr) {
        if (expr instanceof AliasExpression) {
            return ((AliasExpression) expr).alias();
        }
        if (expr instanceof ColumnReference) {
            return ((ColumnReference) expr).columnName();
        }
        throw new IllegalArgumentException("Grouping expression " + expr + " requires an alias");
    }

    @Override
    public String toString() {
        return String.format("Aggregate(groupBy=%s, agg=%s)", groupingExpressions, aggregateExpressions);
    }

    /**
     * Represents an aggregate expression (e.g., SUM(amount), COUNT(DISTINCT id)).
     *
     * <p>The rendered aggregate is always cast to its inferred result type so
     * that the output schema does not depend on DuckDB's widening rules
     * (SUM over INTEGER yields HUGEINT, MEDIAN over INTEGER yields DOUBLE).
     * An optional filter renders as {@code FILTER (WHERE ...)} and an optional
     * input order as an ordered aggregate:
     * <pre>
     *   CAST(FIRST("B" ORDER BY "__index_level_0__" ASC NULLS FIRST) FILTER (WHERE ("B" IS NOT NULL)) AS DOUBLE)
     * </pre>
     */
    public static class AggregateExpression implements Expression {
        private final String function;
        private final Expression argument;
        private final String alias;
        private final boolean distinct;
        private final Expression filter;
        private final List<Sort.SortOrder> orderBy;
        private final DataType resultType;

        /**
         * Creates an aggregate expression.
         *
         * @param function the aggregate function name (count, sum, avg, ...)
         * @param argument the expression to aggregate (null for COUNT(*))
         * @param alias the result column name
         * @param distinct whether to aggregate only distinct values
         * @param filter an optional row filter applied before aggregating (may be null)
         * @param orderBy the order in which an order-sensitive aggregate sees its input (may be empty)
         */
        public AggregateExpression(String function, Expression argument, String alias,
                                   boolean distinct, Expression filter, List<Sort.SortOrder> orderBy) {
            this.function = Objects.requireNonNull(function, "function must not be null");
            this.argument = argument;
            this.alias = Objects.requireNonNull(alias, "alias must not be null");
            this.distinct = distinct;
            this.filter = filter;
            this.orderBy = new ArrayList<>(Objects.requireNonNull(orderBy, "orderBy must not be null"));
            if (argument == null && distinct) {
                throw new IllegalArgumentException("DISTINCT requires an argument");
            }
            this.resultType = resolveReturnType(function, argument == null ? null : argument.dataType());
        }

        public AggregateExpression(String function, Expression argument, String alias) {
            this(function, argument, alias, false, null, Collections.emptyList());
        }

        public String function() {
            return function;
        }

        /**
         * Returns the expression being aggregated.
         *
         * @return the argument expression, or null for COUNT(*)
         */
        public Expression argument() {
            return argument;
        }

        public String alias() {
            return alias;
        }

        public boolean isDistinct() {
            return distinct;
        }

        /**
         * Returns the FILTER clause condition.
         *
         * @return the condition, or null if unfiltered
         */
        public Expression filter() {
            return filter;
        }

        public List<Sort.SortOrder> orderBy() {
            return Collections.unmodifiableList(orderBy);
        }

        @Override
        public DataType dataType() {
            return resultType;
        }

        @Override
        public boolean nullable() {
            return !function.equalsIgnoreCase("count");
        }

        @Override
        public String toSQL() {
            StringBuilder sql = new StringBuilder();
            sql.append(function.toUpperCase(Locale.ROOT)).append("(");
            if (distinct) {
                sql.append("DISTINCT ");
            }
            sql.append(argument == null ? "*" : argument.toSQL());
            if (!orderBy.isEmpty()) {
                List<String> orderItems = new ArrayList<>();
                for (Sort.SortOrder order : orderBy) {
                    orderItems.add(order.toSQL());
                }
                sql.append(" ORDER BY ").append(String.join(", ", orderItems));
            }
            sql.append(")");
            if (filter != null) {
                sql.append(" FILTER (WHERE ").append(filter.toSQL()).append(")");
            }
            return String.format("CAST(%s AS %s)", sql, TypeMapper.toDuckDBType(resultType));
        }

        @Override
        public String toString() {
            return toSQL();
        }

        /**
         * Infers the result type of an aggregate function.
         *
         * <p>Counts are BIGINT, sums of integral columns are BIGINT, means and
         * dispersion measures are DOUBLE, boolean reductions are BOOLEAN and
         * every other function keeps its argument's type.
         *
         * @param function the function name
         * @param argType the argument type (null for COUNT(*))
         * @return the result type
         */
        public static DataType resolveReturnType(String function, DataType argType) {
            String name = function.toLowerCase(Locale.ROOT);
            switch (name) {
                case "count":
                    return LongType.get();
                case "sum":
                    return argType != null && TypeMapper.isIntegral(argType) ? LongType.get() : DoubleType.get();
                case "avg":
                case "mean":
                case "median":
                case "stddev":
                case "stddev_samp":
                case "stddev_pop":
                case "variance":
                case "var_samp":
                case "var_pop":
                case "skewness":
                case "kurtosis":
                    return DoubleType.get();
                case "bool_and":
                case "bool_or":
                    return BooleanType.get();
                default:
                    return argType != null ? argType : LongType.get();
            }
        }
    }
}
