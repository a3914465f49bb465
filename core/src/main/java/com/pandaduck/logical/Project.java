package com.pandaduck.logical;

import com.pandaduck.expression.ColumnReference;
import com.pandaduck.expression.Expression;
import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.generator.SQLQuoting;
import com.pandaduck.types.StructField;
import com.pandaduck.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a projection (SELECT clause).
 *
 * <p>Every output column has a name: either the explicit alias or, for a
 * plain column reference, the referenced column's name.
 *
 * <p>SQL generation:
 * <pre>SELECT expr1 AS "a", expr2 AS "b" FROM (child) AS subquery_1</pre>
 */
public final class Project extends LogicalPlan {

    private final List<Expression> projections;
    private final List<String> aliases;

    /**
     * Creates a projection node with explicit aliases.
     *
     * @param child the child node
     * @param projections the projection expressions
     * @param aliases the output names, one per projection (null entries fall back to the column name)
     * @throws IllegalArgumentException if the lists differ in size or an unnamed projection is not a column
     */
    public Project(LogicalPlan child, List<Expression> projections, List<String> aliases) {
        super(child);
        Objects.requireNonNull(projections, "projections must not be null");
        Objects.requireNonNull(aliases, "aliases must not be null");

        if (projections.isEmpty()) {
            throw new IllegalArgumentException("projections must not be empty");
        }
        if (projections.size() != aliases.size()) {
            throw new IllegalArgumentException(
                "projections and aliases must have the same size: " +
                projections.size() + " vs " + aliases.size());
        }

        this.projections = new ArrayList<>(projections);
        this.aliases = new ArrayList<>(aliases.size());
        for (int i = 0; i < projections.size(); i++) {
            String alias = aliases.get(i);
            if (alias == null) {
                Expression expr = projections.get(i);
                if (!(expr instanceof ColumnReference)) {
                    throw new IllegalArgumentException("Projection " + expr + " requires an alias");
                }
                alias = ((ColumnReference) expr).columnName();
            }
            this.aliases.add(alias);
        }
    }

    /**
     * Creates a projection of plain column references.
     *
     * @param child the child node
     * @param projections the column references
     */
    public Project(LogicalPlan child, List<Expression> projections) {
        this(child, projections, Collections.nCopies(projections.size(), null));
    }

    /**
     * Creates a projection selecting the named columns of the child, in order.
     *
     * @param child the child node
     * @param columnNames the names of the columns to keep
     * @return the projection
     * @throws IllegalArgumentException if a name is not part of the child's schema
     */
    public static Project columns(LogicalPlan child, List<String> columnNames) {
        StructType childSchema = child.schema();
        List<Expression> refs = new ArrayList<>(columnNames.size());
        for (String name : columnNames) {
            StructField field = childSchema.fieldByName(name);
            if (field == null) {
                throw new IllegalArgumentException("Column not found in child schema: " + name);
            }
            refs.add(new ColumnReference(field.name(), field.dataType(), field.nullable()));
        }
        return new Project(child, refs);
    }

    public List<Expression> projections() {
        return Collections.unmodifiableList(projections);
    }

    public List<String> aliases() {
        return Collections.unmodifiableList(aliases);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        List<String> selectExprs = new ArrayList<>(projections.size());
        for (int i = 0; i < projections.size(); i++) {
            selectExprs.add(projections.get(i).toSQL() + " AS " + SQLQuoting.quoteIdentifier(aliases.get(i)));
        }

        return String.format("SELECT %s FROM (%s) AS %s",
            String.join(", ", selectExprs), generator.generate(child()), generator.generateSubqueryAlias());
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>(projections.size());
        for (int i = 0; i < projections.size(); i++) {
            Expression expr = projections.get(i);
            fields.add(new StructField(aliases.get(i), expr.dataType(), expr.nullable()));
        }
        return new StructType(fields);
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", aliases);
    }
}
