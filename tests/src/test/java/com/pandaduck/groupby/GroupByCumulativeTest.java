package com.pandaduck.groupby;

import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.exception.RuntimeComputationException;
import com.pandaduck.frame.Frame;
import com.pandaduck.frame.LocalFrame;
import com.pandaduck.frame.LocalSeries;
import com.pandaduck.frame.Series;
import com.pandaduck.test.FrameTestBase;
import com.pandaduck.test.TestCategories;
import com.pandaduck.types.DoubleType;
import com.pandaduck.types.IntegerType;
import com.pandaduck.types.LongType;
import com.pandaduck.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("GroupBy Cumulative Tests")
public class GroupByCumulativeTest extends FrameTestBase {

    @Nested
    @DisplayName("cumprod")
    class CumProd {

        @Test
        @DisplayName("Running product should skip missing values and keep the index")
        void testRunningProduct() {
            logStep("Given: B with a NaN at the head of group A=1");
            Frame df = frame(schema(field("A", IntegerType.get()), field("B", DoubleType.get())),
                row(1, Double.NaN), row(1, 0.1), row(1, 20.0), row(4, 10.0));

            logStep("When: computing the running product");
            Frame result = df.groupBy("A").cumprod();
            LocalFrame local = result.collect();
            logData("cumprod", local);

            logStep("Then: the NaN row stays missing and the others accumulate");
            assertThat(result.indexNames()).containsExactly((String) null);
            assertThat(result.columns()).containsExactly("B");
            assertThat(local.get(local.rowOf(0L), "B")).isNull();
            assertThat((Double) local.get(local.rowOf(1L), "B")).isCloseTo(0.1, within(1e-9));
            assertThat((Double) local.get(local.rowOf(2L), "B")).isCloseTo(2.0, within(1e-9));
            assertThat((Double) local.get(local.rowOf(3L), "B")).isCloseTo(10.0, within(1e-9));
        }

        @Test
        @DisplayName("A non-positive value should fail at execution")
        void testNonPositive() {
            Frame df = frame(schema(field("A", IntegerType.get()), field("B", DoubleType.get())),
                row(1, 1.0), row(1, -2.0));

            Frame result = df.groupBy("A").cumprod();

            assertThatThrownBy(result::collect)
                .isInstanceOf(RuntimeComputationException.class)
                .hasMessageContaining("values should be bigger than 0");
        }

        @Test
        @DisplayName("The product of integral columns should be double")
        void testProductType() {
            Frame df = frame(schema(field("A", IntegerType.get()), field("C", IntegerType.get())),
                row(1, 2), row(1, 3));

            Frame result = df.groupBy("A").cumprod();

            assertThat(result.metadata().declaredType("C")).isEqualTo(DoubleType.get());
            LocalFrame local = result.collect();
            assertThat((Double) local.get(local.rowOf(1L), "C")).isCloseTo(6.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("cumsum, cummax and cummin")
    class RunningAggregates {

        @Test
        @DisplayName("cumsum should restart per group and widen integers")
        void testCumsum() {
            Frame df = frame(schema(field("A", StringType.get()), field("C", IntegerType.get())),
                row("x", 1), row("y", 10), row("x", 2), row("y", 20), row("x", 3));

            Frame result = df.groupBy("A").cumsum();
            LocalFrame local = result.collect();

            assertThat(result.metadata().declaredType("C")).isEqualTo(LongType.get());
            assertThat(local.get(local.rowOf(0L), "C")).isEqualTo(1L);
            assertThat(local.get(local.rowOf(2L), "C")).isEqualTo(3L);
            assertThat(local.get(local.rowOf(4L), "C")).isEqualTo(6L);
            assertThat(local.get(local.rowOf(1L), "C")).isEqualTo(10L);
            assertThat(local.get(local.rowOf(3L), "C")).isEqualTo(30L);
        }

        @Test
        @DisplayName("cummax should carry over a missing value")
        void testCummaxWithNaN() {
            Frame df = frame(schema(field("A", IntegerType.get()), field("B", DoubleType.get())),
                row(1, 3.0), row(1, Double.NaN), row(1, 1.0), row(1, 5.0));

            LocalFrame local = df.groupBy("A").cummax().collect();

            assertThat(local.get(local.rowOf(0L), "B")).isEqualTo(3.0);
            assertThat(local.get(local.rowOf(1L), "B")).isNull();
            assertThat(local.get(local.rowOf(2L), "B")).isEqualTo(3.0);
            assertThat(local.get(local.rowOf(3L), "B")).isEqualTo(5.0);
        }

        @Test
        @DisplayName("cummin should keep non-numeric columns")
        void testCumminStrings() {
            Frame df = frame(schema(field("A", IntegerType.get()), field("S", StringType.get())),
                row(1, "b"), row(1, "c"), row(1, "a"));

            Frame result = df.groupBy("A").cummin();
            LocalFrame local = result.collect();

            assertThat(result.columns()).containsExactly("S");
            assertThat(local.get(local.rowOf(1L), "S")).isEqualTo("b");
            assertThat(local.get(local.rowOf(2L), "S")).isEqualTo("a");
        }

        @Test
        @DisplayName("cumsum should skip non-numeric columns and the keys")
        void testNumericOnly() {
            Frame df = frame(schema(field("A", IntegerType.get()), field("S", StringType.get()),
                    field("B", DoubleType.get())),
                row(1, "x", 1.0));

            assertThat(df.groupBy("A").cumsum().columns()).containsExactly("B");
        }

        @Test
        @DisplayName("A narrowed group-by should return a series")
        void testSeriesResult() {
            Frame df = frame(schema(field("A", IntegerType.get()), field("B", DoubleType.get())),
                row(1, 1.0), row(1, 2.0), row(2, 4.0));

            Frame result = df.groupBy("A").narrow("B").cumsum();

            assertThat(result).isInstanceOf(Series.class);
            LocalSeries series = ((Series) result).toLocalSeries();
            assertThat(series.name()).isEqualTo("B");
            assertThat(series.values()).containsExactlyInAnyOrder(1.0, 3.0, 4.0);
        }
    }

    @Test
    @DisplayName("A frame without index should be rejected")
    void testRequiresIndex() {
        session.execute("CREATE TABLE running AS SELECT * FROM (VALUES (1, 2), (1, 3)) AS v(k, x)");
        Frame table = session.table("running");

        assertThatThrownBy(() -> table.groupBy("k").cumsum())
            .isInstanceOf(FrameConfigurationException.class)
            .hasMessageContaining("Index must be set.");
    }
}
