package com.pandaduck.runtime;

import com.pandaduck.exception.QueryExecutionException;
import com.pandaduck.exception.RuntimeComputationException;
import com.pandaduck.frame.Frame;
import com.pandaduck.test.FrameTestBase;
import com.pandaduck.test.TestCategories;
import com.pandaduck.types.IntegerType;
import com.pandaduck.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("QueryExecutor Tests")
public class QueryExecutorTest extends FrameTestBase {

    @Test
    @DisplayName("Raw queries should derive their schema from the result")
    void testDerivedSchema() {
        QueryResult result = session.executor().executeQuery("SELECT 42 AS answer, 'x' AS name", null);

        assertThat(result.schema().fieldNames()).containsExactly("answer", "name");
        assertThat(result.schema().fieldAt(0).dataType()).isEqualTo(IntegerType.get());
        assertThat(result.rows().get(0)).containsExactly(42, "x");
    }

    @Test
    @DisplayName("Invalid SQL should raise a query execution error carrying the SQL")
    void testInvalidSQL() {
        assertThatThrownBy(() -> session.executor().executeQuery("SELEC 1", null))
            .isInstanceOf(QueryExecutionException.class)
            .isNotInstanceOf(RuntimeComputationException.class)
            .satisfies(e -> assertThat(((QueryExecutionException) e).getFailedSQL()).isEqualTo("SELEC 1"));
    }

    @Test
    @DisplayName("Non-positive value errors should become runtime computation errors")
    void testComputationError() {
        assertThatThrownBy(() -> session.executor().executeQuery(
                "SELECT error('" + QueryExecutor.NON_POSITIVE_VALUE_MESSAGE + ": -1.0')", null))
            .isInstanceOf(RuntimeComputationException.class);
    }

    @Test
    @DisplayName("explain should render grouped-map nodes as placeholder tables")
    void testExplainPlaceholder() {
        Frame df = frame(schema(field("k", StringType.get()), field("v", IntegerType.get())),
            row("a", 1), row("b", 2));

        String sql = df.groupBy("k").filter(g -> true).explain();

        assertThat(sql).contains("\"__groupmap_pending_1\"");
        assertThat(sql).contains("ORDER BY \"__index_level_0__\" ASC NULLS FIRST");
    }

    @Test
    @DisplayName("Grouped-map tables should be dropped after execution")
    void testTemporaryTablesDropped() {
        Frame df = frame(schema(field("k", StringType.get()), field("v", IntegerType.get())),
            row("a", 1), row("b", 2));

        df.groupBy("k").filter(g -> true).collect();

        QueryResult tables = session.executor().executeQuery(
            "SELECT count(*) FROM duckdb_tables() WHERE temporary", null);
        assertThat(tables.rows().get(0)[0]).isEqualTo(0L);
    }
}
