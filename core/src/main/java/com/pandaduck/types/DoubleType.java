package com.pandaduck.types;

/**
 * Double-precision floating point column type, DuckDB DOUBLE.
 *
 * <p>Values are {@link Double}, with NaN treated as missing by reductions.
 * Means, medians, dispersion measures and cumulative products always
 * produce this type, and any {@link Number} is accepted on input.
 */
public final class DoubleType implements DataType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {}

    public static DoubleType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "double";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DoubleType;
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
