package com.pandaduck.runtime;

import com.pandaduck.types.StructType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fully materialized result of one query: the output schema and its rows,
 * with values normalized to the JVM types of {@link com.pandaduck.types.TypeMapper#coerce}.
 *
 * @param schema the result schema
 * @param rows the result rows, one value per schema field
 */
public record QueryResult(StructType schema, List<Object[]> rows) {

    public QueryResult {
        Objects.requireNonNull(schema, "schema must not be null");
        rows = Collections.unmodifiableList(Objects.requireNonNull(rows, "rows must not be null"));
    }

    public int rowCount() {
        return rows.size();
    }
}
