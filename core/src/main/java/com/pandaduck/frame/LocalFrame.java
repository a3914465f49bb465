package com.pandaduck.frame;

import com.pandaduck.exception.SchemaResolutionException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A materialized frame held in the JVM: index names, index values per row,
 * column names and row values.
 *
 * <p>Returned by {@link Frame#collect()} and handed to grouped-map user
 * functions, where it carries the index reconstructed from the frame's
 * metadata.
 */
public final class LocalFrame {

    private final List<String> indexNames;
    private final List<String> columns;
    private final List<Object[]> index;
    private final List<Object[]> rows;

    private LocalFrame(List<String> indexNames, List<String> columns, List<Object[]> index, List<Object[]> rows) {
        this.indexNames = Collections.unmodifiableList(new ArrayList<>(indexNames));
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.index = Collections.unmodifiableList(new ArrayList<>(index));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return rows.size();
    }

    public List<String> columns() {
        return columns;
    }

    /**
     * Returns the index level names.
     *
     * @return the names, null for unnamed levels; empty when the frame has no index
     */
    public List<String> indexNames() {
        return indexNames;
    }

    public boolean hasIndex() {
        return !indexNames.isEmpty();
    }

    /**
     * Returns the values of one column.
     *
     * @param name the column name
     * @return the column values in row order
     * @throws SchemaResolutionException if the column does not exist
     */
    public List<Object> column(String name) {
        int position = position(name);
        List<Object> values = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            values.add(row[position]);
        }
        return values;
    }

    public Object get(int row, String column) {
        return rows.get(row)[position(column)];
    }

    /**
     * Returns the values of one row.
     *
     * @param row the row position
     * @return a copy of the row's data values, in column order
     */
    public Object[] row(int row) {
        return rows.get(row).clone();
    }

    /**
     * Returns the index values of one row.
     *
     * @param row the row position
     * @return a copy of the row's index values, one per index level
     */
    public Object[] index(int row) {
        return index.get(row).clone();
    }

    /**
     * Returns the index values of all rows of a single-level index.
     *
     * @return the labels in row order
     * @throws IllegalStateException if the index does not have exactly one level
     */
    public List<Object> indexValues() {
        if (indexNames.size() != 1) {
            throw new IllegalStateException("indexValues requires a single-level index, found " + indexNames.size());
        }
        List<Object> labels = new ArrayList<>(index.size());
        for (Object[] label : index) {
            labels.add(label[0]);
        }
        return labels;
    }

    /**
     * Finds the first row with the given index values.
     *
     * @param label the index values, one per level
     * @return the row position, or -1 if no row has that label
     */
    public int rowOf(Object... label) {
        for (int i = 0; i < index.size(); i++) {
            if (Arrays.equals(index.get(i), label)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns one column with the frame's index.
     *
     * @param name the column name
     * @return the series
     * @throws SchemaResolutionException if the column does not exist
     */
    public LocalSeries series(String name) {
        return new LocalSeries(name, indexNames, index, column(name));
    }

    public Double sum(String column) {
        return LocalStatistics.sum(column(column));
    }

    public Double mean(String column) {
        return LocalStatistics.mean(column(column));
    }

    public Object min(String column) {
        return LocalStatistics.min(column(column));
    }

    public Object max(String column) {
        return LocalStatistics.max(column(column));
    }

    private int position(String column) {
        int position = columns.indexOf(column);
        if (position < 0) {
            throw new SchemaResolutionException(List.of(column), "LocalFrame.column");
        }
        return position;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("LocalFrame(index=").append(indexNames).append(", columns=").append(columns).append(")");
        for (int i = 0; i < rows.size(); i++) {
            sb.append("\n  ");
            if (!indexNames.isEmpty()) {
                sb.append(Arrays.toString(index.get(i))).append(" ");
            }
            sb.append(Arrays.toString(rows.get(i)));
        }
        return sb.toString();
    }

    /**
     * Builder for {@link LocalFrame}.
     */
    public static final class Builder {
        private List<String> indexNames = new ArrayList<>();
        private List<String> columns = new ArrayList<>();
        private final List<Object[]> index = new ArrayList<>();
        private final List<Object[]> rows = new ArrayList<>();

        private Builder() {
        }

        public Builder indexNames(List<String> indexNames) {
            this.indexNames = new ArrayList<>(Objects.requireNonNull(indexNames, "indexNames must not be null"));
            return this;
        }

        public Builder columns(List<String> columns) {
            this.columns = new ArrayList<>(Objects.requireNonNull(columns, "columns must not be null"));
            return this;
        }

        public Builder columns(String... columns) {
            return columns(Arrays.asList(columns));
        }

        /**
         * Adds a row.
         *
         * @param label the row's index values, one per index level (empty when there is no index)
         * @param values the row's data values, one per column
         * @return this builder
         */
        public Builder addRow(Object[] label, Object[] values) {
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(values, "values must not be null");
            index.add(label.clone());
            rows.add(values.clone());
            return this;
        }

        /**
         * Adds a row without index values.
         *
         * @param values the row's data values, one per column
         * @return this builder
         */
        public Builder addRow(Object... values) {
            return addRow(new Object[0], values);
        }

        /**
         * Builds the frame.
         *
         * @return the frame
         * @throws IllegalArgumentException if a row does not match the index levels or columns
         */
        public LocalFrame build() {
            for (int i = 0; i < rows.size(); i++) {
                if (index.get(i).length != indexNames.size()) {
                    throw new IllegalArgumentException(String.format(
                        "Row %d has %d index values but the index has %d levels",
                        i, index.get(i).length, indexNames.size()));
                }
                if (rows.get(i).length != columns.size()) {
                    throw new IllegalArgumentException(String.format(
                        "Row %d has %d values but the frame has %d columns", i, rows.get(i).length, columns.size()));
                }
            }
            return new LocalFrame(indexNames, columns, index, rows);
        }
    }
}
