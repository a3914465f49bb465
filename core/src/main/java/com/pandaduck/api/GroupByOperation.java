package com.pandaduck.api;

import com.pandaduck.frame.Frame;
import com.pandaduck.groupby.GroupBy;

import java.util.Locale;
import java.util.function.Function;

/**
 * Group-by operations reachable by their pandas name through {@link GroupBy#call(String)}.
 */
public enum GroupByOperation {
    COUNT("count", GroupBy::count),
    SUM("sum", GroupBy::sum),
    MEAN("mean", GroupBy::mean),
    MIN("min", GroupBy::min),
    MAX("max", GroupBy::max),
    FIRST("first", GroupBy::first),
    LAST("last", GroupBy::last),
    STD("std", GroupBy::std),
    VAR("var", GroupBy::var),
    ALL("all", GroupBy::all),
    ANY("any", GroupBy::any),
    SIZE("size", GroupBy::size),
    CUMMAX("cummax", GroupBy::cummax),
    CUMMIN("cummin", GroupBy::cummin),
    CUMSUM("cumsum", GroupBy::cumsum),
    CUMPROD("cumprod", GroupBy::cumprod);

    private final String pandasName;
    private final Function<GroupBy, Frame> operation;

    GroupByOperation(String pandasName, Function<GroupBy, Frame> operation) {
        this.pandasName = pandasName;
        this.operation = operation;
    }

    public String pandasName() {
        return pandasName;
    }

    public Frame invoke(GroupBy groupBy) {
        return operation.apply(groupBy);
    }

    /**
     * Looks up an operation by its pandas name.
     *
     * @param name the name
     * @return the operation, or null if none has that name
     */
    public static GroupByOperation fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (GroupByOperation operation : values()) {
            if (operation.pandasName.equals(normalized)) {
                return operation;
            }
        }
        return null;
    }
}
