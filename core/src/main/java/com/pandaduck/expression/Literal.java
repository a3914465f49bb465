package com.pandaduck.expression;

import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.types.BooleanType;
import com.pandaduck.types.DataType;
import com.pandaduck.types.DateType;
import com.pandaduck.types.DoubleType;
import com.pandaduck.types.FloatType;
import com.pandaduck.types.IntegerType;
import com.pandaduck.types.LongType;
import com.pandaduck.types.StringType;
import com.pandaduck.types.TimestampType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Examples in SQL:
 * <pre>
 *   42                -- integer literal
 *   'hello'           -- string literal
 *   3.14              -- double literal
 *   'NaN'::DOUBLE     -- not-a-number
 *   TRUE              -- boolean literal
 *   NULL              -- null literal
 * </pre>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    /**
     * Returns whether this is a NULL literal.
     *
     * @return true if value is null, false otherwise
     */
    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public String toSQL() {
        if (value == null) {
            return "NULL";
        }
        if (dataType instanceof StringType) {
            return SQLQuoting.quoteLiteral(value.toString());
        }
        if (dataType instanceof BooleanType) {
            return value.toString().toUpperCase();
        }
        if (dataType instanceof DateType) {
            return "DATE '" + value + "'";
        }
        if (dataType instanceof TimestampType) {
            return "TIMESTAMP '" + value.toString().replace("T", " ") + "'";
        }
        if (dataType instanceof DoubleType || dataType instanceof FloatType) {
            double d = ((Number) value).doubleValue();
            String typeName = dataType instanceof DoubleType ? "DOUBLE" : "FLOAT";
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "'" + d + "'::" + typeName;
            }
            return "CAST(" + value + " AS " + typeName + ")";
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    /**
     * Creates a literal from an arbitrary JVM value, inferring its type.
     *
     * <p>Used for row selection labels, which arrive untyped and are cast to
     * the index column's declared type afterwards.
     *
     * @param value the value (may be null)
     * @return the literal expression
     * @throws IllegalArgumentException if the value's class has no matching type
     */
    public static Literal ofObject(Object value) {
        if (value == null) {
            return nullValue(StringType.get());
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new Literal(((Number) value).intValue(), IntegerType.get());
        }
        if (value instanceof Long) {
            return new Literal(value, LongType.get());
        }
        if (value instanceof Float) {
            return new Literal(value, FloatType.get());
        }
        if (value instanceof Double) {
            return new Literal(value, DoubleType.get());
        }
        if (value instanceof Boolean) {
            return new Literal(value, BooleanType.get());
        }
        if (value instanceof LocalDate) {
            return new Literal(value, DateType.get());
        }
        if (value instanceof LocalDateTime) {
            return new Literal(value, TimestampType.get());
        }
        if (value instanceof CharSequence) {
            return new Literal(value.toString(), StringType.get());
        }
        throw new IllegalArgumentException(
            "Cannot convert value of type " + value.getClass().getName() + " to a literal");
    }

    /**
     * Creates a NULL literal of the given type.
     *
     * @param dataType the data type
     * @return the NULL literal expression
     */
    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }
}
