package com.pandaduck.expression;

import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.types.DataType;
import java.util.Objects;

/**
 * Expression representing a reference to a physical column of a plan's output.
 *
 * <p>Column references appear in:
 * <ul>
 *   <li>SELECT clauses: SELECT "name", "age"</li>
 *   <li>WHERE clauses: WHERE "age" > 25</li>
 *   <li>GROUP BY clauses: GROUP BY "category"</li>
 *   <li>ORDER BY clauses: ORDER BY "__index_level_0__"</li>
 * </ul>
 */
public final class ColumnReference implements Expression {

    private final String columnName;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     */
    public ColumnReference(String columnName, DataType dataType, boolean nullable) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    /**
     * Creates a nullable column reference.
     *
     * @param columnName the column name
     * @param dataType the data type of the column
     */
    public ColumnReference(String columnName, DataType dataType) {
        this(columnName, dataType, true);
    }

    /**
     * Returns the column name.
     *
     * @return the column name
     */
    public String columnName() {
        return columnName;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toSQL() {
        return SQLQuoting.quoteIdentifier(columnName);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return nullable == that.nullable &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, dataType, nullable);
    }

    /**
     * Creates a nullable column reference.
     *
     * @param columnName the column name
     * @param dataType the data type
     * @return the column reference
     */
    public static ColumnReference of(String columnName, DataType dataType) {
        return new ColumnReference(columnName, dataType);
    }
}
