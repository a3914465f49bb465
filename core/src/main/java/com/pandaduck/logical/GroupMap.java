package com.pandaduck.logical;

import com.pandaduck.exception.SQLGenerationException;
import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a grouped-map computation.
 *
 * <p>The child's rows are partitioned by the grouping columns, each group is
 * handed in full to one invocation of a {@link GroupMapFunction}, and the
 * concatenated outputs form a relation with the declared schema. The schema
 * is fixed at construction because it must be known before any row is read.
 *
 * <p>This computation has no SQL equivalent: the executor materializes the
 * node into a temporary table first and the generator then renders
 * {@code SELECT * FROM "__groupmap_..."}.
 */
public final class GroupMap extends LogicalPlan {

    private final List<String> groupingColumns;
    private final List<String> orderColumns;
    private final GroupMapFunction function;
    private final StructType outputSchema;
    private final String description;

    /**
     * Creates a grouped-map node.
     *
     * @param child the child node
     * @param groupingColumns the child columns whose values identify a group
     * @param orderColumns the child columns giving the row order within a group
     * @param function the per-group function
     * @param outputSchema the declared output schema
     * @param description a short name of the operation, used in logs and errors
     */
    public GroupMap(LogicalPlan child,
                    List<String> groupingColumns,
                    List<String> orderColumns,
                    GroupMapFunction function,
                    StructType outputSchema,
                    String description) {
        super(child);
        this.groupingColumns = new ArrayList<>(
            Objects.requireNonNull(groupingColumns, "groupingColumns must not be null"));
        this.orderColumns = new ArrayList<>(
            Objects.requireNonNull(orderColumns, "orderColumns must not be null"));
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.outputSchema = Objects.requireNonNull(outputSchema, "outputSchema must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");

        if (this.groupingColumns.isEmpty()) {
            throw new IllegalArgumentException("GroupMap requires at least one grouping column");
        }
        if (outputSchema.size() == 0) {
            throw new IllegalArgumentException("GroupMap requires a non-empty output schema");
        }
        StructType childSchema = child.schema();
        for (String name : this.groupingColumns) {
            requireChildColumn(childSchema, name);
        }
        for (String name : this.orderColumns) {
            requireChildColumn(childSchema, name);
        }
    }

    private static void requireChildColumn(StructType childSchema, String name) {
        if (childSchema.fieldIndex(name) < 0) {
            throw new IllegalArgumentException("Column not found in child schema: " + name);
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<String> groupingColumns() {
        return Collections.unmodifiableList(groupingColumns);
    }

    public List<String> orderColumns() {
        return Collections.unmodifiableList(orderColumns);
    }

    public GroupMapFunction function() {
        return function;
    }

    public String description() {
        return description;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        String table = generator.materializedTable(this);
        if (table == null) {
            throw new SQLGenerationException(
                "Grouped-map computation '" + description + "' must be materialized before SQL generation", this);
        }
        return "SELECT * FROM " + SQLQuoting.quoteTableName(table);
    }

    @Override
    protected StructType inferSchema() {
        return outputSchema;
    }

    @Override
    public String toString() {
        return String.format("GroupMap(%s, by=%s)", description, groupingColumns);
    }
}
