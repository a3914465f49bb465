package com.pandaduck.logical;

import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.types.StructType;
import java.util.Objects;

/**
 * Logical plan node reading an existing DuckDB table.
 *
 * <p>SQL generation:
 * <pre>SELECT * FROM "table_name"</pre>
 */
public final class TableScan extends LogicalPlan {

    private final String tableName;
    private final StructType tableSchema;

    /**
     * Creates a table scan node.
     *
     * @param tableName the table name
     * @param tableSchema the table's schema, as reported by DESCRIBE
     */
    public TableScan(String tableName, StructType tableSchema) {
        super();
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.tableSchema = Objects.requireNonNull(tableSchema, "tableSchema must not be null");
    }

    public String tableName() {
        return tableName;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        return "SELECT * FROM " + SQLQuoting.quoteTableName(tableName);
    }

    @Override
    protected StructType inferSchema() {
        return tableSchema;
    }

    @Override
    public String toString() {
        return String.format("TableScan(%s)", tableName);
    }
}
