package com.pandaduck.frame;

import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.exception.SchemaResolutionException;
import com.pandaduck.expression.BinaryExpression;
import com.pandaduck.expression.Literal;
import com.pandaduck.selection.ColumnSelector;
import com.pandaduck.selection.RowSelector;
import com.pandaduck.test.FrameTestBase;
import com.pandaduck.test.TestCategories;
import com.pandaduck.types.DoubleType;
import com.pandaduck.types.IntegerType;
import com.pandaduck.types.LongType;
import com.pandaduck.types.StringType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("Frame Tests")
public class FrameTest extends FrameTestBase {

    private Frame df;

    @Override
    protected void doSetUp() {
        super.doSetUp();
        df = frame(schema(field("A", IntegerType.get()), field("B", DoubleType.get()), field("C", StringType.get())),
            row(3, 1.5, "x"),
            row(1, 2.5, "y"),
            row(2, 3.5, "z"));
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Local rows should get a sequential unnamed index")
        void testDefaultIndex() {
            LocalFrame local = df.collect();

            assertThat(df.indexNames()).containsExactly((String) null);
            assertThat(df.columns()).containsExactly("A", "B", "C");
            assertThat(local.indexValues()).containsExactly(0L, 1L, 2L);
            assertThat(local.column("C")).containsExactly("x", "y", "z");
        }

        @Test
        @DisplayName("Local rows may be indexed by one of their columns")
        void testIndexedConstruction() {
            Frame indexed = session.createFrame(
                schema(field("k", StringType.get()), field("v", IntegerType.get())),
                rows(row("a", 1), row("b", 2)), "k");

            assertThat(indexed.indexNames()).containsExactly("k");
            assertThat(indexed.columns()).containsExactly("v");
            assertThat(indexed.collect().rowOf("b")).isEqualTo(1);
        }

        @Test
        @DisplayName("The default index column name should be reserved")
        void testReservedName() {
            assertThatThrownBy(() -> frame(schema(field(Frame.DEFAULT_INDEX_COLUMN, IntegerType.get())), row(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reserved");
        }

        @Test
        @DisplayName("Rows must match the schema")
        void testArityMismatch() {
            assertThatThrownBy(() -> frame(schema(field("A", IntegerType.get())), row(1, 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Row 0 has 2 values");
        }

        @Test
        @DisplayName("A table should become an unindexed frame")
        void testTable() {
            session.execute("CREATE TABLE people AS SELECT * FROM (VALUES ('ann', 31), ('bob', 42)) AS t(name, age)");

            Frame people = session.table("people");

            assertThat(people.metadata().hasIndex()).isFalse();
            assertThat(people.columns()).containsExactly("name", "age");
            assertThat(people.metadata().declaredType("age")).isEqualTo(IntegerType.get());
            assertThat(people.count()).isEqualTo(2L);
        }
    }

    @Nested
    @DisplayName("withColumn")
    class WithColumn {

        @Test
        @DisplayName("A new column should be appended")
        void testAppend() {
            Frame added = df.withColumn("D", BinaryExpression.multiply(df.col("A"), Literal.of(10)));
            LocalFrame local = added.collect();

            assertThat(added.columns()).containsExactly("A", "B", "C", "D");
            assertThat(local.column("D")).containsExactly(30, 10, 20);
        }

        @Test
        @DisplayName("An existing column should be replaced in place")
        void testReplace() {
            Frame replaced = df.withColumn("A", BinaryExpression.add(df.col("A"), Literal.of(1)));

            assertThat(replaced.columns()).containsExactly("A", "B", "C");
            assertThat(replaced.collect().column("A")).containsExactly(4, 2, 3);
        }

        @Test
        @DisplayName("The original frame should be unchanged")
        void testImmutable() {
            df.withColumn("D", Literal.of(1));

            assertThat(df.columns()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("An index column should not be assignable")
        void testIndexColumn() {
            assertThatThrownBy(() -> df.withColumn(Frame.DEFAULT_INDEX_COLUMN, Literal.of(1)))
                .isInstanceOf(FrameConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Index manipulation")
    class IndexManipulation {

        @Test
        @DisplayName("setIndex should move columns into the index")
        void testSetIndex() {
            Frame indexed = df.setIndex("A");

            assertThat(indexed.indexNames()).containsExactly("A");
            assertThat(indexed.columns()).containsExactly("B", "C");
            assertThat(indexed.collect().indexValues()).containsExactly(3, 1, 2);
        }

        @Test
        @DisplayName("setIndex should reject unknown columns and empty input")
        void testSetIndexErrors() {
            assertThatThrownBy(() -> df.setIndex("Z"))
                .isInstanceOf(SchemaResolutionException.class);
            assertThatThrownBy(() -> df.setIndex())
                .isInstanceOf(FrameConfigurationException.class);
        }

        @Test
        @DisplayName("sortIndex should order rows by the index")
        void testSortIndex() {
            LocalFrame local = df.setIndex("A").sortIndex().collect();

            assertThat(local.indexValues()).containsExactly(1, 2, 3);
            assertThat(local.column("C")).containsExactly("y", "z", "x");
        }

        @Test
        @DisplayName("sortIndex without an index should fail")
        void testSortIndexWithoutIndex() {
            session.execute("CREATE TABLE plain AS SELECT 1 AS x");

            assertThatThrownBy(() -> session.table("plain").sortIndex())
                .isInstanceOf(FrameConfigurationException.class)
                .hasMessage("Index must be set.");
        }

        @Test
        @DisplayName("resetIndex should move a named index back into the data")
        void testResetNamedIndex() {
            Frame reset = df.setIndex("A").sortIndex().resetIndex();
            LocalFrame local = reset.collect();

            assertThat(reset.columns()).containsExactly("A", "B", "C");
            assertThat(reset.metadata().declaredType(Frame.DEFAULT_INDEX_COLUMN)).isEqualTo(LongType.get());
            assertThat(reset.indexNames()).containsExactly((String) null);
            assertThat(local.indexValues()).containsExactlyInAnyOrder(0L, 1L, 2L);
            assertThat(local.column("A")).containsExactlyInAnyOrder(1, 2, 3);
        }

        @Test
        @DisplayName("resetIndex should call a single unnamed level index")
        void testResetUnnamedIndex() {
            Frame reset = df.resetIndex();
            LocalFrame local = reset.collect();

            assertThat(reset.columns()).containsExactly("index", "A", "B", "C");
            assertThat(local.column("index")).containsExactlyInAnyOrder(0L, 1L, 2L);
        }

        @Test
        @DisplayName("resetIndex should refuse to overwrite an existing column")
        void testResetConflict() {
            Frame conflicting = df.resetIndex();

            assertThatThrownBy(conflicting::resetIndex)
                .isInstanceOf(FrameConfigurationException.class)
                .hasMessage("cannot insert index, already exists");
        }
    }

    @Nested
    @DisplayName("Columns and series")
    class ColumnsAndSeries {

        @Test
        @DisplayName("get should return a series with the frame's index")
        void testGet() {
            Series b = df.get("B");
            LocalSeries local = b.toLocalSeries();

            assertThat(b.name()).isEqualTo("B");
            assertThat(local.values()).containsExactly(1.5, 2.5, 3.5);
            assertThat(local.index(2)).containsExactly(2L);
        }

        @Test
        @DisplayName("select should keep the index and the named columns")
        void testSelect() {
            Frame selected = df.select("C", "A");

            assertThat(selected.columns()).containsExactly("C", "A");
            assertThat(selected.indexNames()).containsExactly((String) null);
        }

        @Test
        @DisplayName("col should reject unknown columns")
        void testColUnknown() {
            assertThatThrownBy(() -> df.col("Z"))
                .isInstanceOf(SchemaResolutionException.class);
        }

        @Test
        @DisplayName("count should count rows without materializing them")
        void testCount() {
            assertThat(df.count()).isEqualTo(3L);
            assertThat(df.loc().get(RowSelector.labels(0L, 2L)).count()).isEqualTo(2L);
        }

        @Test
        @DisplayName("explain should render the plan as SQL")
        void testExplain() {
            String sql = df.groupBy("C").sum().explain();

            assertThat(sql).contains("GROUP BY \"C\"");
            assertThat(sql).contains("ORDER BY \"__index_level_0__\" ASC NULLS FIRST");
        }
    }

    @Nested
    @DisplayName("Multi-level labels without data columns")
    class EmptyLabeledFrame {

        private Frame emptied;

        @BeforeEach
        void selectNoColumns() {
            Frame aggregated = df.groupBy("A").aggregate(Map.of("B", List.of("min", "max")));
            emptied = aggregated.loc().get(RowSelector.all(), ColumnSelector.columns(List.of()));
        }

        @Test
        @DisplayName("Selecting no columns should keep the label depth")
        void testDepthKept() {
            assertThat(emptied.columns()).isEmpty();
            assertThat(emptied.metadata().columnLabels()).hasValue(List.of());
            assertThat(emptied.metadata().labelLevels()).isEqualTo(2);
        }

        @Test
        @DisplayName("resetIndex should pad the restored key to the label depth")
        void testResetIndex() {
            Frame reset = emptied.resetIndex();

            assertThat(reset.columns()).containsExactly("A");
            assertThat(reset.metadata().columnLabels()).hasValue(List.of(List.of("A", "")));
            assertThat(reset.collect().column("A")).containsExactlyInAnyOrder(1, 2, 3);
        }

        @Test
        @DisplayName("withColumn should pad the new column to the label depth")
        void testWithColumn() {
            Frame added = emptied.withColumn("Z", Literal.of(1));

            assertThat(added.columns()).containsExactly("Z");
            assertThat(added.metadata().columnLabels()).hasValue(List.of(List.of("Z", "")));
            assertThat(added.collect().column("Z")).containsOnly(1);
        }
    }
}
