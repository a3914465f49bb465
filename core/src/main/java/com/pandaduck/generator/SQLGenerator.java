package com.pandaduck.generator;

import com.pandaduck.exception.SQLGenerationException;
import com.pandaduck.logical.GroupMap;
import com.pandaduck.logical.LogicalPlan;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SQL generator that converts logical plans to DuckDB SQL.
 *
 * <p>Each plan node renders itself and calls back into {@link #generate}
 * for its children; the generator owns the state shared across one
 * translation: the subquery alias counter and the temporary tables that hold
 * already materialized grouped-map nodes.
 *
 * <p>Example usage:
 * <pre>
 *   LogicalPlan plan = frame.plan();
 *   String sql = new SQLGenerator().generate(plan);
 * </pre>
 *
 * @see LogicalPlan
 */
public class SQLGenerator {

    private final Map<LogicalPlan, String> materializedTables;
    private int aliasCounter;
    private int depth;

    /**
     * Creates a new SQL generator for plans without grouped-map nodes.
     */
    public SQLGenerator() {
        this(Collections.emptyMap());
    }

    /**
     * Creates a new SQL generator that renders the given grouped-map nodes
     * as scans of their temporary tables.
     *
     * @param materializedTables grouped-map node to temporary table name, keyed by identity
     */
    public SQLGenerator(Map<LogicalPlan, String> materializedTables) {
        this.materializedTables = new IdentityHashMap<>(
            Objects.requireNonNull(materializedTables, "materializedTables must not be null"));
        this.aliasCounter = 0;
        this.depth = 0;
    }

    /**
     * Generates SQL for a logical plan node.
     *
     * <p>This is the main entry point for SQL generation and also the callback
     * plan nodes use for their children. The alias counter is reset for each
     * top-level call.
     *
     * @param plan the logical plan to translate
     * @return the generated DuckDB SQL string
     * @throws NullPointerException if plan is null
     * @throws SQLGenerationException if SQL generation fails
     */
    public String generate(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        if (depth == 0) {
            aliasCounter = 0;
        }
        depth++;
        try {
            return plan.toSQL(this);
        } catch (SQLGenerationException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SQLGenerationException("Unexpected error during SQL generation", e, plan);
        } finally {
            depth--;
        }
    }

    /**
     * Generates a unique subquery alias.
     *
     * @return the alias (subquery_1, subquery_2, ...)
     */
    public String generateSubqueryAlias() {
        return "subquery_" + (++aliasCounter);
    }

    /**
     * Returns the temporary table holding a materialized grouped-map node.
     *
     * @param node the grouped-map node
     * @return the table name, or null if the node has not been materialized
     */
    public String materializedTable(GroupMap node) {
        return materializedTables.get(node);
    }
}
