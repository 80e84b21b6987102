package com.lazyduck.runtime;

import com.lazyduck.LazyFrames;
import com.lazyduck.exception.TaskExecutionException;
import com.lazyduck.expression.Concat;
import com.lazyduck.expression.Expr;
import com.lazyduck.frame.Series;
import com.lazyduck.frame.Table;
import com.lazyduck.io.FromGraph;
import com.lazyduck.test.Fixtures;
import com.lazyduck.test.TestBase;
import com.lazyduck.test.TestCategories;
import com.lazyduck.types.LongType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests: optimize, materialize and run.
 *
 * <p>Test ID prefix: TC-EXEC-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Query Executor Tests")
public class QueryExecutorTest extends TestBase {

    private final Expr df = LazyFrames.fromTable(Fixtures.abc(100), 10);

    @Nested
    @DisplayName("Compute")
    class Compute {

        @Test
        @DisplayName("TC-EXEC-001: Filtered selection concatenates partitions in order")
        void testFilterProjection() {
            try (QueryExecutor executor = new QueryExecutor()) {
                Series b = (Series) executor.compute(df.get(df.get("a").equalTo(5)).get("b"));

                assertThat(b.values()).containsExactly(5L, 15L, 25L, 35L, 45L, 55L, 65L, 75L, 85L, 95L);
                assertThat(b.index().values()).containsExactly(5L, 15L, 25L, 35L, 45L, 55L, 65L, 75L, 85L, 95L);
            }
        }

        @Test
        @DisplayName("TC-EXEC-002: Chained filters on the original frame align by label")
        void testChainedFilters() {
            Expr expr = df.get(df.get("a").equalTo(5)).get(df.get("c").greaterThan(20)).get("b");

            try (QueryExecutor executor = new QueryExecutor()) {
                Series b = (Series) executor.compute(expr);
                assertThat(b.values()).containsExactly(15L, 25L, 35L, 45L, 55L, 65L, 75L, 85L, 95L);
            }
        }

        @Test
        @DisplayName("TC-EXEC-003: Arithmetic matches the unoptimized graph")
        void testOptimizedMatchesUnoptimized() {
            Expr expr = new com.lazyduck.expression.Binop.Multiply(3, df.add(df)).get(List.of("b", "c"));

            try (QueryExecutor executor = new QueryExecutor()) {
                Table optimized = (Table) executor.compute(expr);
                List<Object> raw = new LocalTaskExecutor().execute(expr.materialize(), expr.keys());
                Table unoptimized = (Table) com.lazyduck.frame.Kernels.concat(raw);

                assertThat(optimized.column("b").values()).isEqualTo(unoptimized.column("b").values());
                assertThat(optimized.column("c").get(10)).isEqualTo(120L);
                assertThat(optimized.columnNames()).containsExactly("b", "c");
            }
        }

        @Test
        @DisplayName("TC-EXEC-004: Broadcast scalar is applied to every partition")
        void testBroadcast() {
            Expr centered = df.get("b").subtract(df.get("b").sum());

            try (QueryExecutor executor = new QueryExecutor()) {
                Series result = (Series) executor.compute(centered);
                assertThat(result.size()).isEqualTo(100);
                assertThat(result.get(0)).isEqualTo(-4950L);
                assertThat(result.get(99)).isEqualTo(99L - 4950L);
            }
        }

        @Test
        @DisplayName("TC-EXEC-005: Head returns the first rows")
        void testHead() {
            try (QueryExecutor executor = new QueryExecutor()) {
                Table head = (Table) executor.compute(df.head(3));
                assertThat(head.numRows()).isEqualTo(3);
                assertThat(head.column("b").values()).containsExactly(0L, 1L, 2L);
            }
        }

        @Test
        @DisplayName("TC-EXEC-006: Concat of frames with unknown divisions")
        void testConcat() {
            Expr unsorted = LazyFrames.fromTable(Fixtures.abc(100, 20), 2, false);
            Expr both = Concat.of(List.of(df, unsorted));

            assertThat(both.npartitions()).isEqualTo(12);
            assertThat(both.knownDivisions()).isFalse();
            try (QueryExecutor executor = new QueryExecutor()) {
                assertThat(executor.compute(both.get("b").sum())).isEqualTo(4950L + 2190L);
            }
        }

        @Test
        @DisplayName("TC-EXEC-007: Repartition keeps every row")
        void testRepartition() {
            try (QueryExecutor executor = new QueryExecutor()) {
                Expr fewer = df.repartition(3);
                Expr more = df.repartition(25);

                assertThat(executor.computePartitions(fewer)).hasSize(3);
                assertThat(executor.computePartitions(more)).hasSize(25);
                assertThat(((Table) executor.compute(fewer)).column("b").values())
                    .isEqualTo(((Table) executor.compute(df)).column("b").values());
                assertThat(executor.compute(more.get("b").sum())).isEqualTo(4950L);
                assertThat(fewer.knownDivisions()).isTrue();
                assertThat(more.knownDivisions()).isFalse();
            }
        }

        @Test
        @DisplayName("TC-EXEC-008: Repartition by divisions moves rows into the new ranges")
        void testRepartitionByDivisions() {
            Expr ranged = df.repartitionByDivisions(List.of(0L, 30L, 60L, 99L));

            try (QueryExecutor executor = new QueryExecutor()) {
                List<Object> parts = executor.computePartitions(ranged);
                assertThat(parts).hasSize(3);
                assertThat(((Table) parts.get(0)).numRows()).isEqualTo(30);
                assertThat(((Table) parts.get(1)).numRows()).isEqualTo(30);
                assertThat(((Table) parts.get(2)).numRows()).isEqualTo(40);
            }
        }
    }

    @Nested
    @DisplayName("Persist")
    class Persist {

        @Test
        @DisplayName("TC-EXEC-010: Persisted expression has one task per partition")
        void testPersist() {
            Expr expr = df.get("b").add(1);

            try (QueryExecutor executor = new QueryExecutor()) {
                Expr persisted = executor.persist(expr);

                assertThat(persisted).isInstanceOf(FromGraph.class);
                assertThat(persisted.npartitions()).isEqualTo(10);
                assertThat(persisted.divisions()).isEqualTo(expr.divisions());
                assertThat(executor.plan(persisted).size()).isEqualTo(10);
                assertThat(((Series) executor.compute(persisted)).values())
                    .isEqualTo(((Series) executor.compute(expr)).values());
            }
        }

        @Test
        @DisplayName("TC-EXEC-011: Persisted expressions can be built on")
        void testPersistThenReduce() {
            try (QueryExecutor executor = new QueryExecutor()) {
                Expr persisted = executor.persist(df.get("b"));
                assertThat(executor.compute(persisted.sum())).isEqualTo(4950L);
            }
        }
    }

    @Nested
    @DisplayName("Executors")
    class Executors {

        @Test
        @DisplayName("TC-EXEC-020: Thread pool computes the same results")
        void testThreadPool() {
            PlannerConfig config = PlannerConfig.defaults().withExecutorThreads(4);
            try (QueryExecutor executor = new QueryExecutor(config, new ThreadPoolTaskExecutor(config))) {
                assertThat(executor.compute(new com.lazyduck.reduction.Sum(df.get("b"), 2))).isEqualTo(4950L);
                Series values = (Series) executor.compute(df.get("b").multiply(2));
                assertThat(values.values()).hasSize(100);
                assertThat(values.get(50)).isEqualTo(100L);
            }
        }

        @Test
        @DisplayName("TC-EXEC-021: Failing task reports its key")
        void testFailureKey() {
            Expr failing = df.get("b").apply(value -> {
                throw new IllegalStateException("bad value " + value);
            }, LongType.get());

            try (QueryExecutor executor = new QueryExecutor()) {
                assertThatThrownBy(() -> executor.compute(failing))
                    .isInstanceOf(TaskExecutionException.class)
                    .hasRootCauseInstanceOf(IllegalStateException.class)
                    .satisfies(e -> assertThat(((TaskExecutionException) e).getFailedKey()).isNotNull());
            }
        }

        @Test
        @DisplayName("TC-EXEC-022: Thread pool reports the failing key")
        void testThreadPoolFailure() {
            Expr failing = df.get("b").apply(value -> {
                throw new IllegalStateException("bad value " + value);
            }, LongType.get());

            try (ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor(2);
                 QueryExecutor executor = new QueryExecutor(PlannerConfig.defaults(), pool)) {
                assertThatThrownBy(() -> executor.compute(failing))
                    .isInstanceOf(TaskExecutionException.class)
                    .hasRootCauseInstanceOf(IllegalStateException.class);
            }
        }
    }
}
