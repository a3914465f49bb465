package com.pandaduck.groupby;

import com.pandaduck.exception.FrameConfigurationException;
import com.pandaduck.exception.RuntimeComputationException;
import com.pandaduck.exception.TypeMismatchException;
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
import com.pandaduck.types.StructType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("GroupBy Grouped-Map Tests")
public class GroupByGroupedMapTest extends FrameTestBase {

    private Frame df;

    @Override
    protected void doSetUp() {
        super.doSetUp();
        df = frame(schema(field("A", StringType.get()), field("B", IntegerType.get()), field("C", DoubleType.get())),
            row("foo", 1, 2.0),
            row("bar", 2, 5.0),
            row("foo", 3, 8.0),
            row("bar", 4, 1.0),
            row("foo", 5, 2.0),
            row("bar", 6, 9.0));
    }

    @Nested
    @DisplayName("filter")
    class Filter {

        @Test
        @DisplayName("Only rows of accepted groups should remain, in index order")
        void testFilterByGroupMean() {
            logStep("Given: groups foo (B mean 3) and bar (B mean 4)");

            logStep("When: keeping groups whose B mean exceeds 3");
            Frame filtered = df.groupBy("A").filter(g -> g.mean("B") > 3.0);
            LocalFrame local = filtered.collect();
            logData("filtered", local);

            logStep("Then: the bar rows remain with their original index");
            assertThat(filtered.columns()).containsExactly("A", "B", "C");
            assertThat(local.indexValues()).containsExactly(1L, 3L, 5L);
            assertThat(local.column("A")).containsOnly("bar");
            assertThat(local.column("C")).containsExactly(5.0, 1.0, 9.0);
        }

        @Test
        @DisplayName("Rejecting every group should give an empty frame")
        void testFilterNone() {
            LocalFrame local = df.groupBy("A").filter(g -> false).collect();

            assertThat(local.size()).isZero();
            assertThat(local.columns()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("A null predicate should be rejected")
        void testNullPredicate() {
            assertThatThrownBy(() -> df.groupBy("A").filter(null))
                .isInstanceOf(TypeMismatchException.class);
        }
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("Each group should see its rows with the parent's index")
        void testApplySeesIndex() {
            StructType out = schema(field("key", StringType.get()), field("total", DoubleType.get()),
                field("first_index", LongType.get()));

            Frame applied = df.groupBy("A").apply(g -> LocalFrame.builder()
                .columns("key", "total", "first_index")
                .addRow(g.get(0, "A"), g.sum("C"), g.index(0)[0])
                .build(), out);
            LocalFrame local = applied.collect();
            logData("applied", local);

            assertThat(applied.metadata().hasIndex()).isFalse();
            assertThat(local.size()).isEqualTo(2);
            int bar = local.column("key").indexOf("bar");
            int foo = local.column("key").indexOf("foo");
            assertThat(local.get(bar, "total")).isEqualTo(15.0);
            assertThat(local.get(bar, "first_index")).isEqualTo(1L);
            assertThat(local.get(foo, "total")).isEqualTo(12.0);
            assertThat(local.get(foo, "first_index")).isEqualTo(0L);
        }

        @Test
        @DisplayName("A function may return several rows per group")
        void testApplyExpands() {
            StructType out = schema(field("B", IntegerType.get()));

            Frame applied = df.groupBy("A").apply(g -> {
                LocalFrame.Builder builder = LocalFrame.builder().columns("B");
                for (Object value : g.column("B")) {
                    builder.addRow(((Integer) value) * 10);
                }
                return builder.build();
            }, out);

            assertThat(applied.collect().column("B")).containsExactlyInAnyOrder(10, 20, 30, 40, 50, 60);
        }

        @Test
        @DisplayName("A missing schema should fail before the function runs")
        void testMissingSchema() {
            AtomicBoolean invoked = new AtomicBoolean();

            assertThatThrownBy(() -> df.groupBy("A").apply(g -> {
                invoked.set(true);
                return g;
            }, null))
                .isInstanceOf(FrameConfigurationException.class)
                .hasMessageContaining("declared return schema");
            assertThat(invoked).isFalse();
        }

        @Test
        @DisplayName("A nested struct column in the schema should fail before any plan is built")
        void testNestedStructSchema() {
            AtomicBoolean invoked = new AtomicBoolean();
            StructType out = schema(field("x", IntegerType.get()),
                field("nested", schema(field("y", IntegerType.get()))));

            assertThatThrownBy(() -> df.groupBy("A").apply(g -> {
                invoked.set(true);
                return g;
            }, out))
                .isInstanceOf(FrameConfigurationException.class)
                .hasMessageContaining("Nested struct column in declared return schema: nested");
            assertThat(invoked).isFalse();
        }

        @Test
        @DisplayName("A null function should be rejected")
        void testNullFunction() {
            assertThatThrownBy(() -> df.groupBy("A").apply(null, schema(field("x", IntegerType.get()))))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Output with the wrong number of columns should fail at execution")
        void testWrongArity() {
            StructType out = schema(field("x", IntegerType.get()), field("y", IntegerType.get()));
            Frame applied = df.groupBy("A").apply(g -> LocalFrame.builder().columns("x").addRow(1).build(), out);

            assertThatThrownBy(applied::collect)
                .isInstanceOf(RuntimeComputationException.class)
                .hasMessageContaining("Grouped map 'apply' failed");
        }

        @Test
        @DisplayName("An exception in the function should fail the whole computation")
        void testThrowingFunction() {
            Frame applied = df.groupBy("A").apply(g -> {
                throw new IllegalStateException("boom");
            }, schema(field("x", IntegerType.get())));

            assertThatThrownBy(applied::collect)
                .isInstanceOf(RuntimeComputationException.class)
                .hasMessageContaining("boom");
        }
        @Test
        @DisplayName("A fractional value for an INTEGER column should fail instead of truncating")
        void testFractionalIntoInteger() {
            Frame applied = df.groupBy("A").apply(
                g -> LocalFrame.builder().columns("X").addRow(2.7).build(), schema(field("X", IntegerType.get())));

            assertThatThrownBy(applied::collect)
                .isInstanceOf(RuntimeComputationException.class)
                .hasMessageContaining("column 'X' declared as integer")
                .hasMessageContaining("2.7 is not a whole number");
        }

        @Test
        @DisplayName("A long beyond INTEGER range should fail instead of wrapping")
        void testOverflowIntoInteger() {
            Frame applied = df.groupBy("A").apply(
                g -> LocalFrame.builder().columns("X").addRow(3_000_000_000L).build(),
                schema(field("X", IntegerType.get())));

            assertThatThrownBy(applied::collect)
                .isInstanceOf(RuntimeComputationException.class)
                .hasMessageContaining("overflows INTEGER");
        }

        @Test
        @DisplayName("Whole numbers of any numeric class should fit integral columns")
        void testWholeNumbersWiden() {
            StructType out = schema(field("X", IntegerType.get()), field("Y", LongType.get()));
            Frame applied = df.groupBy("A").apply(
                g -> LocalFrame.builder().columns("X", "Y").addRow(4.0, 7).build(), out);

            LocalFrame local = applied.collect();
            assertThat(local.column("X")).containsExactly(4, 4);
            assertThat(local.column("Y")).containsExactly(7L, 7L);
        }
    }

    @Nested
    @DisplayName("transform")
    class Transform {

        @Test
        @DisplayName("Transformed values should line up with the parent's index")
        void testTransformKeepsIndex() {
            Frame transformed = df.groupBy("A").narrow("B").transform(s -> {
                int min = (Integer) s.min();
                return s.map(v -> (Integer) v - min);
            }, IntegerType.get());

            assertThat(transformed).isInstanceOf(Series.class);
            LocalSeries local = ((Series) transformed).toLocalSeries();
            List<Object> byIndex = new ArrayList<>(Collections.nCopies(6, null));
            for (int i = 0; i < local.size(); i++) {
                byIndex.set(((Long) local.index(i)[0]).intValue(), local.get(i));
            }
            assertThat(byIndex).containsExactly(0, 0, 2, 2, 4, 4);
        }

        @Test
        @DisplayName("Every non-key column should be transformed")
        void testTransformAllColumns() {
            Frame transformed = df.groupBy("A").transform(
                s -> s.map(v -> ((Number) v).doubleValue() / s.sum()), DoubleType.get());
            LocalFrame local = transformed.collect();

            assertThat(transformed.columns()).containsExactly("B", "C");
            assertThat(transformed.indexNames()).containsExactly((String) null);
            assertThat((Double) local.get(local.rowOf(1L), "B")).isCloseTo(2.0 / 12.0, within(1e-9));
            assertThat((Double) local.get(local.rowOf(4L), "C")).isCloseTo(2.0 / 12.0, within(1e-9));
        }

        @Test
        @DisplayName("A result of the wrong length should fail at execution")
        void testWrongLength() {
            Frame transformed = df.groupBy("A").narrow("B").transform(
                s -> LocalSeries.of("B", List.of(1)), IntegerType.get());

            assertThatThrownBy(transformed::collect)
                .isInstanceOf(RuntimeComputationException.class)
                .hasMessageContaining("must return 3 values");
        }

        @Test
        @DisplayName("A missing return type should be rejected")
        void testMissingReturnType() {
            assertThatThrownBy(() -> df.groupBy("A").transform(s -> s, null))
                .isInstanceOf(FrameConfigurationException.class);
        }

        @Test
        @DisplayName("Fractional values returned for an INTEGER result should fail")
        void testFractionalTransformResult() {
            Frame doubles = frame(schema(field("A", StringType.get()), field("B", DoubleType.get())),
                row("foo", 2.7),
                row("bar", 3.4));

            Frame transformed = doubles.groupBy("A").narrow("B").transform(s -> s, IntegerType.get());

            assertThatThrownBy(transformed::collect)
                .isInstanceOf(RuntimeComputationException.class)
                .hasMessageContaining("declared as integer");
        }
    }
}
