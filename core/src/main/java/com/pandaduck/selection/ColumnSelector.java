package com.pandaduck.selection;

import com.pandaduck.expression.ColumnReference;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The column side of a label-based selection.
 *
 * <p>A {@link SingleColumn} selection yields a series; a {@link ColumnList}
 * yields a frame with exactly those columns; a {@link ColumnRange} is only
 * accepted when unbounded, meaning all columns.
 */
public sealed interface ColumnSelector {

    static ColumnSelector all() {
        return AllColumns.INSTANCE;
    }

    static ColumnSelector column(String name) {
        return new SingleColumn(name);
    }

    static ColumnSelector column(ColumnReference column) {
        return new SingleColumn(column.columnName());
    }

    static ColumnSelector columns(String... names) {
        return new ColumnList(Arrays.asList(names));
    }

    static ColumnSelector columns(List<String> names) {
        return new ColumnList(names);
    }

    /**
     * Creates a column range; null bounds are open.
     *
     * @param start the first column, or null
     * @param stop the last column, or null
     * @return the range selector
     */
    static ColumnSelector range(String start, String stop) {
        return new ColumnRange(start, stop);
    }

    /**
     * Selects every data column.
     */
    final class AllColumns implements ColumnSelector {
        static final AllColumns INSTANCE = new AllColumns();

        private AllColumns() {
        }

        @Override
        public String toString() {
            return ":";
        }
    }

    /**
     * One column, selected as a series.
     *
     * @param name the column name
     */
    record SingleColumn(String name) implements ColumnSelector {

        public SingleColumn {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * An explicit list of columns.
     *
     * @param names the column names
     */
    record ColumnList(List<String> names) implements ColumnSelector {

        public ColumnList {
            names = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(names, "names must not be null")));
        }
    }

    /**
     * A range of columns.
     *
     * @param start the first column, or null
     * @param stop the last column, or null
     */
    record ColumnRange(String start, String stop) implements ColumnSelector {

        public boolean isUnbounded() {
            return start == null && stop == null;
        }
    }
}
