package com.pandaduck.groupby;

import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.exception.SchemaResolutionException;
import com.pandaduck.frame.Frame;
import com.pandaduck.frame.LocalFrame;
import com.pandaduck.test.FrameTestBase;
import com.pandaduck.test.TestCategories;
import com.pandaduck.types.DoubleType;
import com.pandaduck.types.IntegerType;
import com.pandaduck.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("GroupBy Aggregate Tests")
public class GroupByAggregateTest extends FrameTestBase {

    private Frame df;

    @Override
    protected void doSetUp() {
        super.doSetUp();
        df = frame(schema(field("A", IntegerType.get()), field("B", IntegerType.get()), field("C", DoubleType.get())),
            row(1, 1, 0.25),
            row(1, 2, 0.5),
            row(2, 3, 0.75),
            row(2, 4, 1.25),
            row(2, 3, Double.NaN));
    }

    @Nested
    @DisplayName("Single function per column")
    class SingleFunction {

        @Test
        @DisplayName("Each column should get its own function and keep its name")
        void testPerColumnFunctions() {
            logStep("Given: {B: min, C: sum}");
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("B", "min");
            spec.put("C", "sum");

            logStep("When: aggregating by A");
            Frame aggregated = df.groupBy("A").aggregate(spec);
            LocalFrame local = aggregated.collect();
            logData("aggregate", local);

            logStep("Then: one row per key, indexed by A");
            assertThat(aggregated.indexNames()).containsExactly("A");
            assertThat(aggregated.columns()).containsExactly("B", "C");
            assertThat(aggregated.metadata().columnLabels()).isEmpty();

            int one = local.rowOf(1);
            int two = local.rowOf(2);
            assertThat(local.get(one, "B")).isEqualTo(1);
            assertThat(local.get(two, "B")).isEqualTo(3);
            assertThat((Double) local.get(one, "C")).isCloseTo(0.75, within(1e-9));
            assertThat((Double) local.get(two, "C")).isCloseTo(2.0, within(1e-9));
        }

        @Test
        @DisplayName("Worked example: min of B and sum of C per A")
        void testWorkedExample() {
            Frame sample = frame(schema(field("A", IntegerType.get()), field("B", IntegerType.get()),
                    field("C", DoubleType.get())),
                row(1, 1, 0.362), row(1, 2, 0.227), row(2, 3, 1.267), row(2, 4, -0.562));
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("B", "min");
            spec.put("C", "sum");

            LocalFrame local = sample.groupBy("A").aggregate(spec).collect();

            int one = local.rowOf(1);
            int two = local.rowOf(2);
            assertThat(local.get(one, "B")).isEqualTo(1);
            assertThat((Double) local.get(one, "C")).isCloseTo(0.589, within(1e-9));
            assertThat(local.get(two, "B")).isEqualTo(3);
            assertThat((Double) local.get(two, "C")).isCloseTo(0.705, within(1e-9));
        }

        @Test
        @DisplayName("nunique should count distinct non-missing values")
        void testNunique() {
            LocalFrame local = df.groupBy("A").aggregate(Map.of("B", "nunique")).collect();

            assertThat(local.get(local.rowOf(1), "B")).isEqualTo(2L);
            assertThat(local.get(local.rowOf(2), "B")).isEqualTo(2L);
        }

        @Test
        @DisplayName("median should ignore NaN")
        void testMedian() {
            LocalFrame local = df.groupBy("A").aggregate(Map.of("C", "median")).collect();

            assertThat((Double) local.get(local.rowOf(2), "C")).isCloseTo(1.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Multiple functions per column")
    class MultipleFunctions {

        @Test
        @DisplayName("A list of functions should produce two-level labels")
        void testMultiLevelLabels() {
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("B", List.of("min", "max"));
            spec.put("C", "count");

            Frame aggregated = df.groupBy("A").aggregate(spec);

            assertThat(aggregated.metadata().columnLabels()).hasValueSatisfying(labels ->
                assertThat(labels).containsExactly(
                    List.of("B", "min"), List.of("B", "max"), List.of("C", "count")));

            LocalFrame local = aggregated.collect();
            int two = local.rowOf(2);
            assertThat(aggregated.columns()).containsExactly("('B', 'min')", "('B', 'max')", "('C', 'count')");
            assertThat(local.columns()).containsExactly("[B, min]", "[B, max]", "[C, count]");
            assertThat(local.get(two, "[B, min]")).isEqualTo(3);
            assertThat(local.get(two, "[B, max]")).isEqualTo(4);
            assertThat(local.get(two, "[C, count]")).isEqualTo(2L);
        }
    }

    @Nested
    @DisplayName("Invalid specs")
    class InvalidSpecs {

        @Test
        @DisplayName("An empty spec should be rejected")
        void testEmptySpec() {
            assertThatThrownBy(() -> df.groupBy("A").aggregate(Map.of()))
                .isInstanceOf(FrameConfigurationException.class)
                .hasMessageContaining("aggs must be a dict");
        }

        @Test
        @DisplayName("A non-string function should be rejected")
        void testMalformedValue() {
            assertThatThrownBy(() -> df.groupBy("A").aggregate(Map.of("B", 42)))
                .isInstanceOf(FrameConfigurationException.class)
                .hasMessageContaining("aggs must be a dict");
        }

        @Test
        @DisplayName("A column that does not exist should fail resolution")
        void testMissingColumn() {
            assertThatThrownBy(() -> df.groupBy("A").aggregate(Map.of("Z", "sum")))
                .isInstanceOf(SchemaResolutionException.class)
                .satisfies(e -> assertThat(((SchemaResolutionException) e).getMissingLabels()).containsExactly("Z"));
        }

        @Test
        @DisplayName("An unsupported function should be rejected")
        void testUnsupportedFunction() {
            assertThatThrownBy(() -> df.groupBy("A").aggregate(Map.of("B", "kurt")))
                .isInstanceOf(FrameConfigurationException.class)
                .hasMessageContaining("kurt");
        }

        @Test
        @DisplayName("min over a string column should compare lexically")
        void testStringMin() {
            Frame words = frame(schema(field("K", IntegerType.get()), field("W", StringType.get())),
                row(1, "b"), row(1, "a"));

            LocalFrame local = words.groupBy("K").aggregate(Map.of("W", "min")).collect();

            assertThat(local.column("W")).containsExactly("a");
        }
    }
}
