package com.pandaduck.logical;

import com.pandaduck.expression.Literal;
import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import com.pandaduck.types.TypeMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node holding inline rows with a declared schema.
 *
 * <p>SQL generation renders a VALUES list in which every cell is cast to the
 * declared column type, so the relation's types never depend on DuckDB's
 * literal inference:
 * <pre>
 *   SELECT * FROM (VALUES (CAST(0 AS BIGINT), CAST(1 AS INTEGER))) AS t("__index_level_0__", "A")
 * </pre>
 *
 * <p>An empty relation renders as a typed single-row select filtered by {@code WHERE FALSE}.
 */
public final class LocalRelation extends LogicalPlan {

    private final StructType declaredSchema;
    private final List<Object[]> rows;

    /**
     * Creates a local relation.
     *
     * @param schema the declared schema
     * @param rows the rows, each holding one value per schema field
     * @throws IllegalArgumentException if the schema is empty or a row has the wrong arity
     */
    public LocalRelation(StructType schema, List<Object[]> rows) {
        super();
        this.declaredSchema = Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        if (schema.size() == 0) {
            throw new IllegalArgumentException("LocalRelation requires at least one column");
        }

        List<Object[]> copy = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            Object[] row = rows.get(r);
            if (row == null || row.length != schema.size()) {
                throw new IllegalArgumentException(String.format(
                    "Row %d has %d values but the schema declares %d columns",
                    r, row == null ? 0 : row.length, schema.size()));
            }
            Object[] coerced = new Object[row.length];
            for (int c = 0; c < row.length; c++) {
                StructField field = schema.fieldAt(c);
                try {
                    coerced[c] = TypeMapper.coerce(row[c], field.dataType());
                } catch (ClassCastException e) {
                    throw new IllegalArgumentException(String.format(
                        "Row %d value %s cannot be stored in column '%s' of type %s",
                        r, row[c], field.name(), field.dataType().typeName()), e);
                }
            }
            copy.add(coerced);
        }
        this.rows = copy;
    }

    /**
     * Returns the rows of this relation.
     *
     * @return an unmodifiable list of rows
     */
    public List<Object[]> rows() {
        return Collections.unmodifiableList(rows);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        List<StructField> fields = declaredSchema.fields();

        if (rows.isEmpty()) {
            List<String> columns = new ArrayList<>();
            for (StructField field : fields) {
                columns.add(String.format("CAST(NULL AS %s) AS %s",
                    TypeMapper.toDuckDBType(field.dataType()),
                    SQLQuoting.quoteIdentifier(field.name())));
            }
            return "SELECT " + String.join(", ", columns) + " WHERE FALSE";
        }

        List<String> tuples = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            List<String> cells = new ArrayList<>(row.length);
            for (int c = 0; c < row.length; c++) {
                StructField field = fields.get(c);
                cells.add(String.format("CAST(%s AS %s)",
                    new Literal(row[c], field.dataType()).toSQL(),
                    TypeMapper.toDuckDBType(field.dataType())));
            }
            tuples.add("(" + String.join(", ", cells) + ")");
        }

        List<String> names = new ArrayList<>();
        for (StructField field : fields) {
            names.add(SQLQuoting.quoteIdentifier(field.name()));
        }
        return String.format("SELECT * FROM (VALUES %s) AS %s(%s)",
            String.join(", ", tuples), generator.generateSubqueryAlias(), String.join(", ", names));
    }

    @Override
    protected StructType inferSchema() {
        return declaredSchema;
    }

    @Override
    public String toString() {
        return String.format("LocalRelation(%d rows, %s)", rows.size(), declaredSchema);
    }
}
