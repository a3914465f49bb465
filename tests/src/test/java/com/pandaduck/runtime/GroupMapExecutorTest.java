package com.pandaduck.runtime;

import com.pandaduck.exception.QueryExecutionException;
import com.pandaduck.exception.RuntimeComputationException;
import com.pandaduck.frame.Frame;
import com.pandaduck.frame.FrameSession;
import com.pandaduck.frame.LocalFrame;
import com.pandaduck.test.FrameTestBase;
import com.pandaduck.test.TestCategories;
import com.pandaduck.types.IntegerType;
import com.pandaduck.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("GroupMapExecutor Tests")
public class GroupMapExecutorTest extends FrameTestBase {

    @Nested
    @DisplayName("Group splitting")
    class GroupSplitting {

        @Test
        @DisplayName("Sorted rows should split into runs of equal keys")
        void testSplit() {
            List<Object[]> rows = Arrays.asList(
                new Object[]{"a", 1}, new Object[]{"a", 2}, new Object[]{"b", 3}, new Object[]{null, 4});

            List<List<Object[]>> groups = GroupMapExecutor.splitGroups(rows, new int[]{0});

            assertThat(groups).hasSize(3);
            assertThat(groups.get(0)).hasSize(2);
            assertThat(groups.get(1).get(0)[1]).isEqualTo(3);
            assertThat(groups.get(2).get(0)[1]).isEqualTo(4);
        }

        @Test
        @DisplayName("Multi-column keys should compare every column")
        void testSplitMultiKey() {
            List<Object[]> rows = Arrays.asList(
                new Object[]{"a", 1, 0}, new Object[]{"a", 2, 1}, new Object[]{"a", 2, 2});

            assertThat(GroupMapExecutor.splitGroups(rows, new int[]{0, 1})).hasSize(2);
        }

        @Test
        @DisplayName("No rows should give no groups")
        void testSplitEmpty() {
            assertThat(GroupMapExecutor.splitGroups(List.of(), new int[]{0})).isEmpty();
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        private Frame words() {
            return frame(schema(field("k", StringType.get()), field("v", IntegerType.get())),
                row("a", 1), row("b", 2), row("c", 3), row("d", 4));
        }

        @Test
        @DisplayName("Groups should run on the worker pool")
        void testWorkerThreads() {
            Set<String> threads = ConcurrentHashMap.newKeySet();

            LocalFrame local = words().groupBy("k").filter(g -> {
                threads.add(Thread.currentThread().getName());
                return true;
            }).collect();

            assertThat(local.size()).isEqualTo(4);
            assertThat(threads).allMatch(name -> name.startsWith("pandaduck-groupmap-"));
        }

        @Test
        @DisplayName("Values should be coerced to the declared column type")
        void testCoercion() {
            Frame applied = words().groupBy("k").apply(g -> LocalFrame.builder()
                .columns("v")
                .addRow(((Integer) g.get(0, "v")).longValue())
                .build(), schema(field("v", IntegerType.get())));

            assertThat(applied.collect().column("v")).containsExactlyInAnyOrder(1, 2, 3, 4);
        }

        @Test
        @DisplayName("A value of the wrong kind should fail with the column name")
        void testBadValue() {
            Frame applied = words().groupBy("k").apply(g -> LocalFrame.builder()
                .columns("v")
                .addRow("not a number")
                .build(), schema(field("v", IntegerType.get())));

            assertThatThrownBy(applied::collect)
                .isInstanceOf(RuntimeComputationException.class)
                .hasMessageContaining("column 'v'");
        }

        @Test
        @DisplayName("A stage exceeding the timeout should fail")
        void testTimeout() {
            FrameConfig config = FrameConfig.defaults()
                .withJdbcUrl("jdbc:duckdb::memory:timeout_" + System.nanoTime())
                .withGroupMapParallelism(1)
                .withGroupMapTimeoutSeconds(1);
            try (FrameSession slow = FrameSession.create(config)) {
                Frame df = slow.createFrame(schema(field("k", StringType.get())), rows(row("a")));
                Frame filtered = df.groupBy("k").filter(g -> {
                    Thread.sleep(10_000);
                    return true;
                });

                assertThatThrownBy(filtered::collect)
                    .isInstanceOf(QueryExecutionException.class)
                    .hasMessageContaining("did not finish within 1 seconds");
            }
        }
    }
}
