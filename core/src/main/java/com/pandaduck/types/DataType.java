package com.pandaduck.types;

/**
 * Sealed interface for all data types in the pandaduck type system.
 *
 * <p>This represents the physical type of a column or expression. The type
 * system maps cleanly onto DuckDB's column types and is what frame metadata
 * reports through {@code declaredType(column)}.
 *
 * <p>Common data types include:
 * <ul>
 *   <li>Primitive types: IntegerType, LongType, DoubleType, StringType, etc.</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>Row types: StructType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, FloatType, DoubleType,
            StringType, DateType, TimestampType, StructType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String).
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }
}
