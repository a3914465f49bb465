package com.pandaduck.types;

/**
 * 64-bit integral column type, DuckDB BIGINT.
 *
 * <p>Values are {@link Long}. The default row index, counts, group sizes and
 * sums over integral columns use this type. Input must be a whole number
 * within range; fractional or overflowing values are rejected rather than
 * truncated.
 */
public final class LongType implements DataType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {}

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "long";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LongType;
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
