package com.pandaduck.selection;

import com.pandaduck.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The row side of a label-based selection.
 *
 * <ul>
 *   <li>{@link All}: every row ({@code df.loc[:]})</li>
 *   <li>{@link Label}: a bare scalar label, which is rejected because it is
 *       ambiguous with positional selection</li>
 *   <li>{@link LabelRange}: an inclusive label range over a single index column</li>
 *   <li>{@link LabelList}: an explicit list of labels over a single index column</li>
 *   <li>{@link Predicate}: a boolean column expression</li>
 * </ul>
 */
public sealed interface RowSelector {

    static RowSelector all() {
        return All.INSTANCE;
    }

    static RowSelector label(Object label) {
        return new Label(label);
    }

    /**
     * Creates an inclusive label range; a null bound is open.
     *
     * @param start the first label, or null
     * @param stop the last label, or null
     * @return the range selector
     */
    static RowSelector range(Object start, Object stop) {
        return new LabelRange(start, stop, null);
    }

    static RowSelector range(Object start, Object stop, Object step) {
        return new LabelRange(start, stop, step);
    }

    static RowSelector labels(Object... labels) {
        return new LabelList(Arrays.asList(labels));
    }

    static RowSelector labels(List<?> labels) {
        return new LabelList(new ArrayList<Object>(labels));
    }

    static RowSelector where(Expression condition) {
        return new Predicate(condition);
    }

    /**
     * Selects every row.
     */
    final class All implements RowSelector {
        static final All INSTANCE = new All();

        private All() {
        }

        @Override
        public String toString() {
            return ":";
        }
    }

    /**
     * A single scalar label.
     *
     * @param value the label
     */
    record Label(Object value) implements RowSelector {
    }

    /**
     * An inclusive label range.
     *
     * @param start the first label, or null for an open start
     * @param stop the last label, or null for an open end
     * @param step the step, or null; any step is unsupported
     */
    record LabelRange(Object start, Object stop, Object step) implements RowSelector {

        /**
         * Returns whether this range has neither bounds nor step.
         *
         * @return true for {@code [:]}
         */
        public boolean isUnbounded() {
            return start == null && stop == null && step == null;
        }
    }

    /**
     * An explicit list of labels.
     *
     * @param labels the labels (may be empty)
     */
    record LabelList(List<Object> labels) implements RowSelector {

        public LabelList {
            labels = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(labels, "labels must not be null")));
        }
    }

    /**
     * A boolean column expression evaluated per row.
     *
     * @param condition the condition
     */
    record Predicate(Expression condition) implements RowSelector {

        public Predicate {
            Objects.requireNonNull(condition, "condition must not be null");
        }
    }
}
