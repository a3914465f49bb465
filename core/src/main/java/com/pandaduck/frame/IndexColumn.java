package com.pandaduck.frame;

import java.util.Objects;

/**
 * One index column of a frame: the physical column carrying the labels and
 * the display name of that index level.
 *
 * @param columnId the physical column name in the plan's output schema
 * @param name the display name of the index level, or null when unnamed
 */
public record IndexColumn(String columnId, String name) {

    public IndexColumn {
        Objects.requireNonNull(columnId, "columnId must not be null");
    }

    /**
     * Creates an unnamed index column.
     *
     * @param columnId the physical column name
     * @return the index column
     */
    public static IndexColumn unnamed(String columnId) {
        return new IndexColumn(columnId, null);
    }

    /**
     * Creates an index column named after its physical column.
     *
     * @param columnId the physical column name
     * @return the index column
     */
    public static IndexColumn named(String columnId) {
        return new IndexColumn(columnId, columnId);
    }

    public boolean hasName() {
        return name != null;
    }
}
