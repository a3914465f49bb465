package com.pandaduck.logical;

import com.pandaduck.generator.SQLGenerator;
import com.pandaduck.types.StructType;
import java.util.Objects;

/**
 * Logical plan node removing duplicate rows.
 *
 * <p>SQL generation:
 * <pre>SELECT DISTINCT * FROM (child) AS subquery_1</pre>
 */
public final class Distinct extends LogicalPlan {

    public Distinct(LogicalPlan child) {
        super(child);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        return String.format("SELECT DISTINCT * FROM (%s) AS %s",
            generator.generate(child()), generator.generateSubqueryAlias());
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public String toString() {
        return "Distinct";
    }
}
