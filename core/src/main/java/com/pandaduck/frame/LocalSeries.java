package com.pandaduck.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A materialized single column with its index, held in the JVM.
 *
 * <p>Grouped transform functions receive and return local series; the
 * statistics helpers skip nulls and NaN the way pandas treats missing values.
 */
public final class LocalSeries {

    private final String name;
    private final List<String> indexNames;
    private final List<Object[]> index;
    private final List<Object> values;

    /**
     * Creates a local series.
     *
     * @param name the series name
     * @param indexNames the index level names (null entries for unnamed levels)
     * @param index the index values per row, one entry per index level
     * @param values the values
     */
    public LocalSeries(String name, List<String> indexNames, List<Object[]> index, List<Object> values) {
        this.name = name;
        this.indexNames = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(indexNames, "indexNames must not be null")));
        this.index = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(index, "index must not be null")));
        this.values = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(values, "values must not be null")));
        if (!this.indexNames.isEmpty() && this.index.size() != this.values.size()) {
            throw new IllegalArgumentException(String.format(
                "index has %d rows but values have %d", this.index.size(), this.values.size()));
        }
    }

    /**
     * Creates an unindexed series.
     *
     * @param name the series name
     * @param values the values
     * @return the series
     */
    public static LocalSeries of(String name, List<Object> values) {
        return new LocalSeries(name, Collections.emptyList(), Collections.emptyList(), values);
    }

    public String name() {
        return name;
    }

    public int size() {
        return values.size();
    }

    public Object get(int row) {
        return values.get(row);
    }

    public List<Object> values() {
        return values;
    }

    public List<String> indexNames() {
        return indexNames;
    }

    /**
     * Returns the index values of one row.
     *
     * @param row the row position
     * @return a copy of the row's index values
     */
    public Object[] index(int row) {
        return index.get(row).clone();
    }

    /**
     * Returns a series with the same name and index and new values.
     *
     * @param newValues the values, one per row
     * @return the new series
     */
    public LocalSeries withValues(List<Object> newValues) {
        return new LocalSeries(name, indexNames, index, newValues);
    }

    /**
     * Applies a function to every value.
     *
     * @param mapper the function
     * @return the mapped series
     */
    public LocalSeries map(UnaryOperator<Object> mapper) {
        List<Object> mapped = new ArrayList<>(values.size());
        for (Object value : values) {
            mapped.add(mapper.apply(value));
        }
        return withValues(mapped);
    }

    public Double sum() {
        return LocalStatistics.sum(values);
    }

    public Double mean() {
        return LocalStatistics.mean(values);
    }

    public Object min() {
        return LocalStatistics.min(values);
    }

    public Object max() {
        return LocalStatistics.max(values);
    }

    @Override
    public String toString() {
        return String.format("LocalSeries(%s, %d rows)", name, values.size());
    }
}
