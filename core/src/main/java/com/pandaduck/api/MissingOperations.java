package com.pandaduck.api;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of pandas names that are recognized but not implemented.
 *
 * <p>Consulted only after a name failed to resolve to a supported
 * operation, so that callers get a {@code PandasNotImplementedException}
 * naming the attempted API and, where one exists, the supported alternative.
 */
public final class MissingOperations {

    public static final String FRAME = "pd.DataFrame";
    public static final String GROUP_BY = "pd.GroupBy";

    private static final Map<String, Map<String, UnsupportedOperationDescriptor>> REGISTRY = new HashMap<>();

    static {
        // pd.DataFrame properties
        property(FRAME, "T");
        property(FRAME, "at", "loc() with a label list");
        property(FRAME, "axes");
        property(FRAME, "blocks");
        property(FRAME, "empty");
        property(FRAME, "ftypes");
        property(FRAME, "iat", "loc() with a label list");
        property(FRAME, "iloc", "loc() with a label selector");
        property(FRAME, "is_copy");
        property(FRAME, "ix", "loc()");
        property(FRAME, "ndim");
        property(FRAME, "size", "count() times columns().size()");
        property(FRAME, "style");
        property(FRAME, "values", "collect()");

        // pd.DataFrame methods
        method(FRAME, "add");
        method(FRAME, "add_prefix");
        method(FRAME, "add_suffix");
        method(FRAME, "align");
        method(FRAME, "all");
        method(FRAME, "any");
        method(FRAME, "append");
        method(FRAME, "apply", "groupBy(...).apply(func, schema)");
        method(FRAME, "applymap");
        method(FRAME, "as_blocks");
        method(FRAME, "as_matrix");
        method(FRAME, "asfreq");
        method(FRAME, "asof");
        method(FRAME, "astype");
        method(FRAME, "at_time");
        method(FRAME, "between_time");
        method(FRAME, "bfill");
        method(FRAME, "bool");
        method(FRAME, "boxplot");
        method(FRAME, "clip");
        method(FRAME, "clip_lower");
        method(FRAME, "clip_upper");
        method(FRAME, "combine");
        method(FRAME, "combine_first");
        method(FRAME, "compound");
        method(FRAME, "convert_objects");
        method(FRAME, "corrwith");
        method(FRAME, "cov");
        method(FRAME, "cummax", "groupBy(...).cummax()");
        method(FRAME, "cummin", "groupBy(...).cummin()");
        method(FRAME, "cumprod", "groupBy(...).cumprod()");
        method(FRAME, "cumsum", "groupBy(...).cumsum()");
        method(FRAME, "describe");
        method(FRAME, "diff");
        method(FRAME, "div");
        method(FRAME, "divide");
        method(FRAME, "dot");
        method(FRAME, "drop_duplicates");
        method(FRAME, "droplevel");
        method(FRAME, "duplicated");
        method(FRAME, "eq");
        method(FRAME, "equals");
        method(FRAME, "eval");
        method(FRAME, "ewm");
        method(FRAME, "expanding");
        method(FRAME, "ffill");
        method(FRAME, "filter", "loc().get(RowSelector.where(...))");
        method(FRAME, "first", "groupBy(...).first()");
        method(FRAME, "first_valid_index");
        method(FRAME, "floordiv");
        method(FRAME, "ge");
        method(FRAME, "get_dtype_counts");
        method(FRAME, "get_ftype_counts");
        method(FRAME, "get_value");
        method(FRAME, "get_values");
        method(FRAME, "gt");
        method(FRAME, "hist");
        method(FRAME, "idxmax");
        method(FRAME, "idxmin");
        method(FRAME, "infer_objects");
        method(FRAME, "info");
        method(FRAME, "insert", "withColumn(name, expr)");
        method(FRAME, "interpolate");
        method(FRAME, "items");
        method(FRAME, "iterrows");
        method(FRAME, "itertuples");
        method(FRAME, "join");
        method(FRAME, "keys");
        method(FRAME, "last", "groupBy(...).last()");
        method(FRAME, "last_valid_index");
        method(FRAME, "le");
        method(FRAME, "lookup");
        method(FRAME, "lt");
        method(FRAME, "mad");
        method(FRAME, "mask");
        method(FRAME, "median", "groupBy(...).aggregate(Map.of(column, \"median\"))");
        method(FRAME, "melt");
        method(FRAME, "memory_usage");
        method(FRAME, "mod");
        method(FRAME, "mode");
        method(FRAME, "mul");
        method(FRAME, "multiply");
        method(FRAME, "ne");
        method(FRAME, "nlargest");
        method(FRAME, "nsmallest");
        method(FRAME, "nunique", "groupBy(...).aggregate(Map.of(column, \"nunique\"))");
        method(FRAME, "pct_change");
        method(FRAME, "pivot");
        method(FRAME, "pivot_table");
        method(FRAME, "pop");
        method(FRAME, "pow");
        method(FRAME, "prod");
        method(FRAME, "product");
        method(FRAME, "quantile");
        method(FRAME, "query", "loc().get(RowSelector.where(...))");
        method(FRAME, "radd");
        method(FRAME, "rank");
        method(FRAME, "rdiv");
        method(FRAME, "reindex");
        method(FRAME, "reindex_axis");
        method(FRAME, "reindex_like");
        method(FRAME, "rename", "withColumn(name, col(old))");
        method(FRAME, "rename_axis");
        method(FRAME, "reorder_levels");
        method(FRAME, "replace");
        method(FRAME, "resample");
        method(FRAME, "rfloordiv");
        method(FRAME, "rmod");
        method(FRAME, "rmul");
        method(FRAME, "rolling");
        method(FRAME, "round");
        method(FRAME, "rpow");
        method(FRAME, "rsub");
        method(FRAME, "rtruediv");
        method(FRAME, "sample");
        method(FRAME, "select", "select(String...)");
        method(FRAME, "select_dtypes");
        method(FRAME, "sem");
        method(FRAME, "set_axis");
        method(FRAME, "set_value");
        method(FRAME, "shift");
        method(FRAME, "slice_shift");
        method(FRAME, "squeeze");
        method(FRAME, "stack");
        method(FRAME, "sub");
        method(FRAME, "subtract");
        method(FRAME, "swapaxes");
        method(FRAME, "swaplevel");
        method(FRAME, "tail");
        method(FRAME, "take");
        method(FRAME, "to_clipboard");
        method(FRAME, "to_csv");
        method(FRAME, "to_dense");
        method(FRAME, "to_feather");
        method(FRAME, "to_gbq");
        method(FRAME, "to_hdf");
        method(FRAME, "to_json");
        method(FRAME, "to_latex");
        method(FRAME, "to_msgpack");
        method(FRAME, "to_panel");
        method(FRAME, "to_parquet");
        method(FRAME, "to_period");
        method(FRAME, "to_pickle");
        method(FRAME, "to_records");
        method(FRAME, "to_sparse");
        method(FRAME, "to_sql");
        method(FRAME, "to_stata");
        method(FRAME, "to_timestamp");
        method(FRAME, "to_xarray");
        method(FRAME, "transform", "groupBy(...).transform(func, type)");
        method(FRAME, "transpose");
        method(FRAME, "truediv");
        method(FRAME, "truncate");
        method(FRAME, "tshift");
        method(FRAME, "tz_convert");
        method(FRAME, "tz_localize");
        method(FRAME, "unstack");
        method(FRAME, "update");
        method(FRAME, "where", "loc().get(RowSelector.where(...))");
        method(FRAME, "xs");

        // pd.GroupBy properties
        property(GROUP_BY, "groups");
        property(GROUP_BY, "indices");
        property(GROUP_BY, "ngroups");
        property(GROUP_BY, "dtypes");
        property(GROUP_BY, "plot");

        // pd.GroupBy methods
        method(GROUP_BY, "median", "aggregate(Map.of(column, \"median\"))");
        method(GROUP_BY, "nunique", "aggregate(Map.of(column, \"nunique\"))");
        method(GROUP_BY, "prod", "apply(func, schema)");
        method(GROUP_BY, "head");
        method(GROUP_BY, "tail");
        method(GROUP_BY, "nth");
        method(GROUP_BY, "ngroup");
        method(GROUP_BY, "cumcount");
        method(GROUP_BY, "describe");
        method(GROUP_BY, "diff");
        method(GROUP_BY, "shift");
        method(GROUP_BY, "rank");
        method(GROUP_BY, "quantile");
        method(GROUP_BY, "pct_change");
        method(GROUP_BY, "fillna");
        method(GROUP_BY, "bfill");
        method(GROUP_BY, "ffill");
        method(GROUP_BY, "backfill");
        method(GROUP_BY, "pad");
        method(GROUP_BY, "idxmax");
        method(GROUP_BY, "idxmin");
        method(GROUP_BY, "mad");
        method(GROUP_BY, "sem");
        method(GROUP_BY, "ohlc");
        method(GROUP_BY, "corr");
        method(GROUP_BY, "cov");
        method(GROUP_BY, "corrwith");
        method(GROUP_BY, "pipe");
        method(GROUP_BY, "expanding");
        method(GROUP_BY, "rolling");
        method(GROUP_BY, "resample");
        method(GROUP_BY, "tshift");
        method(GROUP_BY, "take");
        method(GROUP_BY, "boxplot");
        method(GROUP_BY, "hist");
        method(GROUP_BY, "agg", "aggregate(spec)");
        method(GROUP_BY, "value_counts", "size()");
    }

    private MissingOperations() {
    }

    private static void property(String className, String name) {
        register(new UnsupportedOperationDescriptor(className, name, true, null));
    }

    private static void property(String className, String name, String suggestion) {
        register(new UnsupportedOperationDescriptor(className, name, true, suggestion));
    }

    private static void method(String className, String name) {
        register(new UnsupportedOperationDescriptor(className, name, false, null));
    }

    private static void method(String className, String name, String suggestion) {
        register(new UnsupportedOperationDescriptor(className, name, false, suggestion));
    }

    private static void register(UnsupportedOperationDescriptor descriptor) {
        REGISTRY.computeIfAbsent(descriptor.className(), k -> new HashMap<>())
            .put(descriptor.name(), descriptor);
    }

    /**
     * Looks up a missing operation.
     *
     * @param className the pandas class name, {@link #FRAME} or {@link #GROUP_BY}
     * @param name the attempted name
     * @return the descriptor, or empty if the name is not registered
     */
    public static Optional<UnsupportedOperationDescriptor> lookup(String className, String name) {
        return Optional.ofNullable(REGISTRY.getOrDefault(className, Collections.emptyMap()).get(name));
    }

    /**
     * Returns every registered name of a class.
     *
     * @param className the pandas class name
     * @return the registered descriptors by name
     */
    public static Map<String, UnsupportedOperationDescriptor> registered(String className) {
        return Collections.unmodifiableMap(REGISTRY.getOrDefault(className, Collections.emptyMap()));
    }
}
