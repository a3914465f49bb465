package com.pandaduck.frame;

import com.pandaduck.exception.SchemaResolutionException;
import com.pandaduck.types.DataType;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of how a plan's output columns form a frame.
 *
 * <p>The metadata records which physical columns are index columns (ordered,
 * each with an optional display name) and which are data columns (ordered,
 * optionally carrying hierarchical labels aligned one to one with them). It
 * also holds the schema snapshot of the one plan it describes, so that a
 * frame can check that the two were built together.
 *
 * <p>Metadata is never modified; {@link #copy()} returns a builder
 * preloaded with the current values, and every plan rewrite produces new
 * metadata through it.
 */
public final class FrameMetadata {

    private final StructType schema;
    private final List<IndexColumn> indexColumns;
    private final List<String> dataColumns;
    private final List<List<String>> columnLabels;
    private final int labelLevels;

    private FrameMetadata(Builder builder) {
        this.schema = Objects.requireNonNull(builder.schema, "schema must not be null");
        this.indexColumns = Collections.unmodifiableList(new ArrayList<>(builder.indexColumns));
        this.dataColumns = Collections.unmodifiableList(new ArrayList<>(builder.dataColumns));
        if (builder.columnLabels == null) {
            this.columnLabels = null;
        } else {
            List<List<String>> labels = new ArrayList<>(builder.columnLabels.size());
            for (List<String> label : builder.columnLabels) {
                if (label == null || label.isEmpty()) {
                    throw new IllegalArgumentException("column labels must not be empty");
                }
                labels.add(Collections.unmodifiableList(new ArrayList<>(label)));
            }
            this.columnLabels = Collections.unmodifiableList(labels);
        }
        // An empty label list keeps the depth it had before its columns were dropped
        if (columnLabels == null) {
            this.labelLevels = 1;
        } else if (!columnLabels.isEmpty()) {
            this.labelLevels = columnLabels.get(0).size();
        } else {
            this.labelLevels = Math.max(1, builder.labelLevels);
        }
        validate();
    }

    private void validate() {
        Set<String> seen = new HashSet<>();
        for (IndexColumn index : indexColumns) {
            requireInSchema(index.columnId());
            if (!seen.add(index.columnId())) {
                throw new IllegalArgumentException("Duplicate column in metadata: " + index.columnId());
            }
        }
        for (String column : dataColumns) {
            requireInSchema(column);
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Duplicate column in metadata: " + column);
            }
        }
        if (columnLabels != null && columnLabels.size() != dataColumns.size()) {
            throw new IllegalArgumentException(String.format(
                "%d column labels given for %d data columns", columnLabels.size(), dataColumns.size()));
        }
    }

    private void requireInSchema(String column) {
        if (schema.fieldIndex(column) < 0) {
            throw new IllegalArgumentException("Column " + column + " is not part of schema " + schema);
        }
    }

    /**
     * Creates a builder for metadata describing a plan with the given schema.
     *
     * @param schema the plan's output schema
     * @return a new builder with no index, data columns or labels
     */
    public static Builder builder(StructType schema) {
        return new Builder(schema);
    }

    /**
     * Returns a builder preloaded with this metadata's values.
     *
     * @return the builder
     */
    public Builder copy() {
        Builder builder = new Builder(schema);
        builder.indexColumns = new ArrayList<>(indexColumns);
        builder.dataColumns = new ArrayList<>(dataColumns);
        builder.columnLabels = columnLabels == null ? null : new ArrayList<>(columnLabels);
        builder.labelLevels = labelLevels;
        return builder;
    }

    public StructType schema() {
        return schema;
    }

    public List<IndexColumn> indexColumns() {
        return indexColumns;
    }

    /**
     * Returns the physical names of the index columns.
     *
     * @return the index column ids, in index level order
     */
    public List<String> indexColumnIds() {
        List<String> ids = new ArrayList<>(indexColumns.size());
        for (IndexColumn index : indexColumns) {
            ids.add(index.columnId());
        }
        return ids;
    }

    /**
     * Returns the display names of the index levels.
     *
     * @return the names, with null for unnamed levels
     */
    public List<String> indexNames() {
        List<String> names = new ArrayList<>(indexColumns.size());
        for (IndexColumn index : indexColumns) {
            names.add(index.name());
        }
        return names;
    }

    public List<String> dataColumns() {
        return dataColumns;
    }

    /**
     * Returns the hierarchical labels of the data columns.
     *
     * @return the labels aligned with {@link #dataColumns()}, or empty when columns carry plain names
     */
    public Optional<List<List<String>>> columnLabels() {
        return Optional.ofNullable(columnLabels);
    }

    /**
     * Returns the number of levels in the column labels.
     *
     * <p>Defined even when no data column is left, so that columns added later
     * can be padded to the same depth. Plain names count as one level.
     *
     * @return the label depth, at least 1
     */
    public int labelLevels() {
        return labelLevels;
    }

    /**
     * Returns the label of one data column: its hierarchical label if present,
     * else its physical name.
     *
     * @param dataColumn the data column
     * @return the label
     */
    public List<String> labelOf(String dataColumn) {
        int position = dataColumns.indexOf(dataColumn);
        if (position < 0) {
            throw new SchemaResolutionException(List.of(dataColumn), "labelOf");
        }
        return columnLabels == null ? List.of(dataColumn) : columnLabels.get(position);
    }

    /**
     * Returns the index columns followed by the data columns.
     *
     * @return the ids of every column the frame exposes, in output order
     */
    public List<String> projectedColumnIds() {
        List<String> ids = indexColumnIds();
        ids.addAll(dataColumns);
        return ids;
    }

    public boolean isDataColumn(String column) {
        return dataColumns.contains(column);
    }

    public boolean hasIndex() {
        return !indexColumns.isEmpty();
    }

    /**
     * Returns the declared physical type of a column.
     *
     * @param column the physical column name
     * @return the column's type
     * @throws SchemaResolutionException if the column is not part of the schema
     */
    public DataType declaredType(String column) {
        return field(column).dataType();
    }

    /**
     * Returns the schema field of a column.
     *
     * @param column the physical column name
     * @return the field
     * @throws SchemaResolutionException if the column is not part of the schema
     */
    public StructField field(String column) {
        StructField field = schema.fieldByName(column);
        if (field == null) {
            throw new SchemaResolutionException(List.of(column), "declared_type");
        }
        return field;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FrameMetadata)) return false;
        FrameMetadata that = (FrameMetadata) obj;
        return schema.equals(that.schema) &&
               indexColumns.equals(that.indexColumns) &&
               dataColumns.equals(that.dataColumns) &&
               Objects.equals(columnLabels, that.columnLabels) &&
               labelLevels == that.labelLevels;
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, indexColumns, dataColumns, columnLabels, labelLevels);
    }

    @Override
    public String toString() {
        return String.format("FrameMetadata(index=%s, data=%s%s)", indexColumns, dataColumns,
            columnLabels == null ? "" : ", labels=" + columnLabels);
    }

    /**
     * Builder for {@link FrameMetadata}; the only way to derive new metadata.
     */
    public static final class Builder {
        private StructType schema;
        private List<IndexColumn> indexColumns = new ArrayList<>();
        private List<String> dataColumns = new ArrayList<>();
        private List<List<String>> columnLabels;
        private int labelLevels;

        private Builder(StructType schema) {
            this.schema = Objects.requireNonNull(schema, "schema must not be null");
        }

        /**
         * Rebinds the metadata to the schema of a rewritten plan.
         *
         * @param schema the new plan's output schema
         * @return this builder
         */
        public Builder schema(StructType schema) {
            this.schema = Objects.requireNonNull(schema, "schema must not be null");
            return this;
        }

        public Builder indexColumns(List<IndexColumn> indexColumns) {
            this.indexColumns = new ArrayList<>(Objects.requireNonNull(indexColumns, "indexColumns must not be null"));
            return this;
        }

        public Builder dataColumns(List<String> dataColumns) {
            this.dataColumns = new ArrayList<>(Objects.requireNonNull(dataColumns, "dataColumns must not be null"));
            return this;
        }

        /**
         * Sets the hierarchical column labels.
         *
         * @param columnLabels labels aligned with the data columns, or null for plain names
         * @return this builder
         */
        public Builder columnLabels(List<List<String>> columnLabels) {
            this.columnLabels = columnLabels == null ? null : new ArrayList<>(columnLabels);
            return this;
        }

        /**
         * Builds the metadata.
         *
         * @return the metadata
         * @throws IllegalArgumentException if a column is missing from the schema or listed twice,
         *         or the labels are not aligned with the data columns
         */
        public FrameMetadata build() {
            return new FrameMetadata(this);
        }
    }
}
