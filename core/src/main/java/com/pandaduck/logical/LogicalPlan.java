package com.pandaduck.logical;

import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all logical plan nodes.
 *
 * <p>A plan is an immutable tree: every frame transformation builds a new
 * node on top of an existing one and never changes a node after construction.
 * Each node defines its output schema (column names and types) and knows how
 * to render itself as DuckDB SQL through {@link #toSQL(SQLGenerator)}.
 *
 * @see SQLGenerator
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /** Output schema of this node, computed lazily */
    private StructType schema;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        if (child == null) {
            throw new NullPointerException("child must not be null");
        }
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Translates this logical plan node to DuckDB SQL.
     *
     * @param generator the SQL generator to use
     * @return the generated SQL string
     */
    public abstract String toSQL(SQLGenerator generator);

    /**
     * Infers the output schema for this logical plan node.
     *
     * @return the output schema
     */
    protected abstract StructType inferSchema();

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the output schema of this plan node, inferring it on first access.
     *
     * @return the output schema
     */
    public StructType schema() {
        if (schema == null) {
            schema = inferSchema();
        }
        return schema;
    }

    @Override
    public abstract String toString();
}
