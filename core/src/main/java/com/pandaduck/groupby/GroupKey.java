package com.pandaduck.groupby;

import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.exception.SchemaResolutionException;
import com.pandaduck.expression.Expression;
import com.pandaduck.frame.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The ordered grouping keys of a {@link GroupBy}.
 *
 * <p>Each key is an expression over the parent frame with a display name.
 * Key order fixes the order of the index levels in grouped outputs and the
 * tie-break order when sorting by key.
 */
public final class GroupKey {

    private final List<KeyColumn> columns;

    private GroupKey(List<KeyColumn> columns) {
        if (columns.isEmpty()) {
            throw new FrameConfigurationException("No group keys passed!", "groupBy");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    /**
     * Creates a key over data columns of a frame.
     *
     * @param frame the frame being grouped
     * @param names the data columns, in key order
     * @return the key
     * @throws SchemaResolutionException if a name is not a data column of the frame
     */
    public static GroupKey of(Frame frame, String... names) {
        List<String> missing = new ArrayList<>();
        List<KeyColumn> keys = new ArrayList<>();
        for (String name : names) {
            if (!frame.metadata().isDataColumn(name)) {
                missing.add(name);
            } else {
                keys.add(new KeyColumn(name, frame.col(name)));
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaResolutionException(missing, "groupBy");
        }
        return new GroupKey(keys);
    }

    /**
     * Creates a key from named expressions.
     *
     * @param columns the key columns, in key order
     * @return the key
     */
    public static GroupKey of(List<KeyColumn> columns) {
        return new GroupKey(Objects.requireNonNull(columns, "columns must not be null"));
    }

    public List<KeyColumn> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    /**
     * Returns the key display names.
     *
     * @return the names, in key order
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(columns.size());
        for (KeyColumn column : columns) {
            names.add(column.name());
        }
        return names;
    }

    /**
     * Returns the key expressions.
     *
     * @return the expressions, in key order
     */
    public List<Expression> expressions() {
        List<Expression> expressions = new ArrayList<>(columns.size());
        for (KeyColumn column : columns) {
            expressions.add(column.expression());
        }
        return expressions;
    }

    @Override
    public String toString() {
        return "GroupKey" + names();
    }

    /**
     * One grouping expression and the name its output index level carries.
     *
     * @param name the display name
     * @param expression the grouping expression
     */
    public record KeyColumn(String name, Expression expression) {
        public KeyColumn {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }
}
