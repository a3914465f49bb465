package com.pandaduck.groupby;

import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.expression.Expression;
import com.pandaduck.logical.Aggregate.AggregateExpression;
import com.pandaduck.logical.Sort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A parsed {@code aggregate} request: for each source column, the ordered
 * aggregate function names to apply to it.
 *
 * <p>When any column asks for more than one function, every output column
 * carries the two-level label {@code (column, function)}; otherwise outputs
 * keep their column names.
 */
public final class AggregationSpec {

    private static final String SHAPE_MESSAGE =
        "aggs must be a dict mapping from column name (string) to aggregate functions (string or list of strings).";

    private final Map<String, List<String>> functions;
    private final boolean multiLevel;

    private AggregationSpec(Map<String, List<String>> functions) {
        this.functions = Collections.unmodifiableMap(functions);
        boolean multi = false;
        for (List<String> names : functions.values()) {
            multi |= names.size() > 1;
        }
        this.multiLevel = multi;
    }

    /**
     * Parses a request mapping column names to a function name or a list of names.
     *
     * @param spec the request
     * @return the parsed spec
     * @throws FrameConfigurationException if the request has any other shape, repeats a
     *         function for a column or names an unsupported function
     */
    public static AggregationSpec parse(Map<?, ?> spec) {
        if (spec == null || spec.isEmpty()) {
            throw new FrameConfigurationException(SHAPE_MESSAGE, "aggregate");
        }
        Map<String, List<String>> functions = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : spec.entrySet()) {
            if (!(entry.getKey() instanceof String column)) {
                throw new FrameConfigurationException(SHAPE_MESSAGE, "aggregate");
            }
            List<String> names = new ArrayList<>();
            Object value = entry.getValue();
            if (value instanceof String name) {
                names.add(name);
            } else if (value instanceof List<?> list && !list.isEmpty()) {
                Set<String> seen = new LinkedHashSet<>();
                for (Object item : list) {
                    if (!(item instanceof String name)) {
                        throw new FrameConfigurationException(SHAPE_MESSAGE, "aggregate");
                    }
                    if (!seen.add(name)) {
                        throw new FrameConfigurationException(
                            "Function " + name + " is requested twice for column " + column, "aggregate");
                    }
                    names.add(name);
                }
            } else {
                throw new FrameConfigurationException(SHAPE_MESSAGE, "aggregate");
            }
            for (String name : names) {
                requireSupported(name);
            }
            functions.put(column, names);
        }
        return new AggregationSpec(functions);
    }

    private static void requireSupported(String function) {
        String name = function.toLowerCase(Locale.ROOT);
        if (name.equals("nunique") || name.equals("median")) {
            return;
        }
        try {
            ReduceFunction.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new FrameConfigurationException("'" + function + "' is not a supported aggregate function",
                "aggregate", "count, sum, mean, min, max, first, last, std, var, all, any, median, nunique");
        }
    }

    public Map<String, List<String>> functions() {
        return functions;
    }

    public List<String> columns() {
        return new ArrayList<>(functions.keySet());
    }

    public boolean isMultiLevel() {
        return multiLevel;
    }

    /**
     * Returns the physical name of one output column.
     *
     * @param column the source column
     * @param function the function name
     * @return the column name, or {@code ('column', 'function')} for multi-level output
     */
    public String outputName(String column, String function) {
        return multiLevel ? String.format("('%s', '%s')", column, function) : column;
    }

    /**
     * Returns the label of one output column.
     *
     * @param column the source column
     * @param function the function name
     * @return {@code [column, function]} for multi-level output, else {@code [column]}
     */
    public List<String> outputLabel(String column, String function) {
        return multiLevel ? List.of(column, function) : List.of(column);
    }

    /**
     * Builds the aggregate for one (column, function) pair.
     *
     * @param function the function name
     * @param column the source column
     * @param alias the output name
     * @param rowOrder the parent's index order
     * @return the aggregate expression
     */
    static AggregateExpression lower(String function, Expression column, String alias,
                                     List<Sort.SortOrder> rowOrder) {
        String name = function.toLowerCase(Locale.ROOT);
        if (name.equals("nunique")) {
            return new AggregateExpression("count", MissingValues.maskNaN(column), alias, true, null,
                Collections.emptyList());
        }
        if (name.equals("median")) {
            return new AggregateExpression("median", MissingValues.maskNaN(column), alias);
        }
        return ReduceFunction.valueOf(name.toUpperCase(Locale.ROOT)).lower(column, alias, rowOrder);
    }

    @Override
    public String toString() {
        return "AggregationSpec" + functions;
    }
}
