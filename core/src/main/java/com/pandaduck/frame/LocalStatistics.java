package com.pandaduck.frame;

import java.util.Comparator;
import java.util.List;

/**
 * Null- and NaN-skipping statistics over materialized values.
 */
final class LocalStatistics {

    private LocalStatistics() {}

    static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    static Double sum(List<Object> values) {
        double total = 0.0;
        for (Object value : values) {
            if (!isMissing(value)) {
                total += ((Number) value).doubleValue();
            }
        }
        return total;
    }

    static Double mean(List<Object> values) {
        double total = 0.0;
        int count = 0;
        for (Object value : values) {
            if (!isMissing(value)) {
                total += ((Number) value).doubleValue();
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }

    static Object min(List<Object> values) {
        return extreme(values, -1);
    }

    static Object max(List<Object> values) {
        return extreme(values, 1);
    }

    private static Object extreme(List<Object> values, int direction) {
        Comparator<Object> order = naturalOrder();
        Object best = null;
        for (Object value : values) {
            if (isMissing(value)) {
                continue;
            }
            if (!(value instanceof Comparable)) {
                throw new ClassCastException(value.getClass().getSimpleName() + " values cannot be ordered");
            }
            if (best == null || order.compare(value, best) * direction > 0) {
                best = value;
            }
        }
        return best;
    }

    @SuppressWarnings("unchecked")
    private static Comparator<Object> naturalOrder() {
        Comparator<Comparable<Object>> natural = Comparator.naturalOrder();
        return (Comparator<Object>) (Comparator<?>) natural;
    }
}
