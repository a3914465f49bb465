package com.pandaduck.types;

/**
 * 32-bit integral column type, DuckDB INTEGER.
 *
 * <p>Values are {@link Integer}. Narrower DuckDB integer types are read as
 * this type. Input must be a whole number within INTEGER range, so a
 * grouped-map function returning {@code 2.7} or {@code 3_000_000_000L} for
 * such a column fails instead of being truncated or wrapped.
 */
public final class IntegerType implements DataType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {}

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "integer";
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IntegerType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
