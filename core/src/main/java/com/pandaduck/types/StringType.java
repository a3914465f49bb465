package com.pandaduck.types;

/**
 * Text column type, DuckDB VARCHAR.
 *
 * <p>Values are {@link String}; other input values are stored through
 * {@code toString()}. Numeric-only reductions skip columns of this type,
 * while min and max order them lexicographically.
 */
public final class StringType implements DataType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StringType;
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
