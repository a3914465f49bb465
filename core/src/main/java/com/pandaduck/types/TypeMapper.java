package com.pandaduck.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Maps pandaduck DataTypes to DuckDB SQL type strings and JVM values.
 *
 * <p>This class provides bidirectional mapping between the frame type system
 * and DuckDB's SQL type system, plus the value coercion used when rows cross
 * the JDBC boundary (reading results, binding grouped-map output).
 *
 * @see DataType
 */
public class TypeMapper {

    /**
     * Converts a pandaduck DataType to a DuckDB SQL type string.
     *
     * <p>Examples:
     * <pre>
     *   IntegerType → "INTEGER"
     *   StringType → "VARCHAR"
     *   LongType → "BIGINT"
     * </pre>
     *
     * @param type the pandaduck data type
     * @return the DuckDB SQL type string
     * @throws UnsupportedOperationException if the type is not supported
     */
    public static String toDuckDBType(DataType type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }

        if (type instanceof BooleanType) return "BOOLEAN";
        if (type instanceof IntegerType) return "INTEGER";
        if (type instanceof LongType) return "BIGINT";
        if (type instanceof FloatType) return "FLOAT";
        if (type instanceof DoubleType) return "DOUBLE";
        if (type instanceof StringType) return "VARCHAR";
        if (type instanceof DateType) return "DATE";
        if (type instanceof TimestampType) return "TIMESTAMP";
        throw new UnsupportedOperationException("StructType as column type not supported");
    }

    /**
     * Converts a DuckDB SQL type string (as reported by {@code DESCRIBE}) to a pandaduck DataType.
     *
     * <p>Narrow integral types widen to INTEGER, HUGEINT narrows to BIGINT and
     * DECIMAL columns are read as DOUBLE.
     *
     * @param duckdbType the DuckDB SQL type string
     * @return the pandaduck data type
     * @throws UnsupportedOperationException if the type string is not recognized
     */
    public static DataType fromDuckDBType(String duckdbType) {
        if (duckdbType == null || duckdbType.isEmpty()) {
            throw new IllegalArgumentException("duckdbType must not be null or empty");
        }

        String normalized = duckdbType.trim().toUpperCase();
        if (normalized.startsWith("DECIMAL") || normalized.startsWith("NUMERIC")) {
            return DoubleType.get();
        }

        return switch (normalized) {
            case "TINYINT", "SMALLINT", "INTEGER", "INT", "UTINYINT", "USMALLINT" -> IntegerType.get();
            case "BIGINT", "HUGEINT", "UINTEGER", "UBIGINT" -> LongType.get();
            case "FLOAT", "REAL"             -> FloatType.get();
            case "DOUBLE", "DOUBLE PRECISION" -> DoubleType.get();
            case "VARCHAR", "TEXT", "STRING"  -> StringType.get();
            case "BOOLEAN", "BOOL"           -> BooleanType.get();
            case "DATE"                      -> DateType.get();
            case "TIMESTAMP", "TIMESTAMP WITHOUT TIME ZONE" -> TimestampType.get();
            default -> throw new UnsupportedOperationException("Unsupported DuckDB type: " + duckdbType);
        };
    }

    /**
     * Returns whether the type is numeric (integral or floating point).
     *
     * @param type the data type
     * @return true for numeric types
     */
    public static boolean isNumeric(DataType type) {
        return isIntegral(type) || isFloatingPoint(type);
    }

    /**
     * Returns whether the type is an integral type.
     *
     * @param type the data type
     * @return true for INTEGER and BIGINT
     */
    public static boolean isIntegral(DataType type) {
        return type instanceof IntegerType || type instanceof LongType;
    }

    /**
     * Returns whether the type is a floating point type, i.e. one that can hold NaN.
     *
     * @param type the data type
     * @return true for FLOAT and DOUBLE
     */
    public static boolean isFloatingPoint(DataType type) {
        return type instanceof FloatType || type instanceof DoubleType;
    }

    /**
     * Normalizes a value read through JDBC to the JVM representation used by
     * local frames.
     *
     * @param value the raw JDBC value (may be null)
     * @return the normalized value
     */
    public static Object fromJdbcValue(Object value) {
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof BigDecimal dec) {
            return dec.doubleValue();
        }
        return value;
    }

    /**
     * Coerces a JVM value into the representation of the given type.
     *
     * <p>Integral targets accept only whole numbers within range. FLOAT accepts
     * any finite value within float range, rounding to the nearest float.
     *
     * @param value the value (may be null)
     * @param type the target type
     * @return the coerced value, or null
     * @throws ClassCastException if the value cannot represent the type
     */
    public static Object coerce(Object value, DataType type) {
        if (value == null) {
            return null;
        }
        if (type instanceof BooleanType) return (Boolean) value;
        if (type instanceof IntegerType) return exactInt((Number) value);
        if (type instanceof LongType) return exactLong((Number) value, "BIGINT");
        if (type instanceof FloatType) return boundedFloat((Number) value);
        if (type instanceof DoubleType) return ((Number) value).doubleValue();
        if (type instanceof StringType) return value.toString();
        if (type instanceof DateType) return (LocalDate) value;
        if (type instanceof TimestampType) return (LocalDateTime) value;
        throw new UnsupportedOperationException("StructType values not supported");
    }

    private static int exactInt(Number value) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        long whole = exactLong(value, "INTEGER");
        if (whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
            throw new ClassCastException("Value " + value + " overflows INTEGER");
        }
        return (int) whole;
    }

    private static long exactLong(Number value, String target) {
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return value.longValue();
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            if (big.bitLength() > 63) {
                throw new ClassCastException("Value " + value + " overflows " + target);
            }
            return big.longValue();
        }
        if (value instanceof BigDecimal) {
            try {
                return ((BigDecimal) value).longValueExact();
            } catch (ArithmeticException e) {
                throw new ClassCastException("Value " + value + " is not a whole number within " + target + " range");
            }
        }
        double d = value.doubleValue();
        // 2^63 itself is not a valid long
        if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)
                || d < -0x1p63 || d >= 0x1p63) {
            throw new ClassCastException("Value " + value + " is not a whole number within " + target + " range");
        }
        return (long) d;
    }

    private static float boundedFloat(Number value) {
        if (value instanceof Float) {
            return (Float) value;
        }
        double d = value.doubleValue();
        float f = (float) d;
        if (Float.isInfinite(f) && !Double.isInfinite(d)) {
            throw new ClassCastException("Value " + value + " overflows FLOAT");
        }
        return f;
    }
}
