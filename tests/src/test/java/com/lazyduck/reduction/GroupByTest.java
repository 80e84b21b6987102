package com.lazyduck.reduction;

import com.lazyduck.LazyFrames;
import com.lazyduck.exception.ColumnNotFoundException;
import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.expression.Expr;
import com.lazyduck.frame.Kernels;
import com.lazyduck.frame.Table;
import com.lazyduck.runtime.LocalTaskExecutor;
import com.lazyduck.runtime.QueryExecutor;
import com.lazyduck.schema.Meta;
import com.lazyduck.test.Fixtures;
import com.lazyduck.test.TestBase;
import com.lazyduck.test.TestCategories;
import com.lazyduck.types.DoubleType;
import com.lazyduck.types.LongType;
import com.lazyduck.types.StringType;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for grouped aggregation.
 *
 * <p>The main fixture has 100 rows with {@code a = i % 10}, {@code b = i}
 * and {@code c = 2 * i}, in 10 partitions, so every key appears once per
 * partition. Expected values are computed row by row from the same table.
 *
 * <p>Test ID prefix: TC-GROUP-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Group-by Tests")
public class GroupByTest extends TestBase {

    private final Table table = Fixtures.abc(100);
    private final Expr df = LazyFrames.fromTable(table, 10);
    private QueryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new QueryExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    /** Sums, minimums, maximums and counts of column {@code column} keyed by {@code a}. */
    private Map<Long, long[]> direct(String column) {
        Map<Long, long[]> stats = new TreeMap<>();
        for (int row = 0; row < table.numRows(); row++) {
            long key = (Long) table.column("a").get(row);
            long value = (Long) table.column(column).get(row);
            long[] s = stats.computeIfAbsent(key, k -> new long[] {0, Long.MAX_VALUE, Long.MIN_VALUE, 0});
            s[0] += value;
            s[1] = Math.min(s[1], value);
            s[2] = Math.max(s[2], value);
            s[3]++;
        }
        return stats;
    }

    private List<Object> expected(String column, int stat) {
        List<Object> values = new ArrayList<>();
        direct(column).values().forEach(s -> values.add(s[stat]));
        return values;
    }

    @Nested
    @DisplayName("Aggregations")
    class Aggregations {

        @Test
        @DisplayName("TC-GROUP-001: Sum per key matches a row by row computation")
        void testSum() {
            Table sums = (Table) executor.compute(df.groupBy("a").sum());
            logData("sums", sums);

            assertThat(sums.index().name()).isEqualTo("a");
            assertThat(sums.index().values()).containsExactly(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L);
            assertThat(sums.columnNames()).containsExactly("b", "c");
            assertThat(sums.column("b").values()).isEqualTo(expected("b", 0));
            assertThat(sums.column("c").values()).isEqualTo(expected("c", 0));
        }

        @Test
        @DisplayName("TC-GROUP-002: Mean per key is sum over count")
        void testMean() {
            Table means = (Table) executor.compute(df.groupBy("a").mean());

            List<Object> expected = new ArrayList<>();
            direct("b").values().forEach(s -> expected.add((double) s[0] / s[3]));
            assertThat(means.column("b").dataType()).isEqualTo(DoubleType.get());
            assertThat(means.column("b").values()).isEqualTo(expected);
        }

        @Test
        @DisplayName("TC-GROUP-003: Min, max and count per key")
        void testMinMaxCount() {
            Table mins = (Table) executor.compute(df.groupBy("a").min());
            Table maxes = (Table) executor.compute(df.groupBy("a").max());
            Table counts = (Table) executor.compute(df.groupBy("a").count());

            assertThat(mins.column("c").values()).isEqualTo(expected("c", 1));
            assertThat(maxes.column("c").values()).isEqualTo(expected("c", 2));
            assertThat(counts.column("b").values()).isEqualTo(expected("b", 3));
            assertThat(counts.column("b").dataType()).isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("TC-GROUP-004: Null keys are dropped and null values skipped")
        void testNulls() {
            Table input = Table.builder()
                .column("k", LongType.get(), Arrays.asList(1L, 1L, null, 2L))
                .column("v", LongType.get(), Arrays.asList(null, 3L, 5L, null))
                .index(null, LongType.get(), List.of(0L, 1L, 2L, 3L))
                .build();
            Expr frame = LazyFrames.fromTable(input, 2);

            Table sums = (Table) executor.compute(frame.groupBy("k").sum());
            Table means = (Table) executor.compute(frame.groupBy("k").mean());
            Table counts = (Table) executor.compute(frame.groupBy("k").count());

            assertThat(sums.index().values()).containsExactly(1L, 2L);
            assertThat(sums.column("v").values()).containsExactly(3L, 0L);
            assertThat(means.column("v").values()).containsExactly(3.0, null);
            assertThat(counts.column("v").values()).containsExactly(1L, 0L);
        }
    }

    @Nested
    @DisplayName("Tree shape")
    class TreeShape {

        @ParameterizedTest(name = "splitEvery={0}")
        @ValueSource(ints = {2, 3, 16})
        @DisplayName("TC-GROUP-005: Result does not depend on fan-in")
        void testFanInIndependence(int splitEvery) {
            Object bounded = executor.compute(df.groupBy("a").aggregate("sum", splitEvery, 1));

            assertThat(bounded).isEqualTo(executor.compute(df.groupBy("a").sum()));
        }

        @Test
        @DisplayName("TC-GROUP-006: Several output partitions hold disjoint keys")
        void testSplitOut() {
            Expr grouped = df.groupBy("a").aggregate("mean", 3, 3);
            List<Object> parts = executor.computePartitions(grouped);

            assertThat(grouped.npartitions()).isEqualTo(3);
            assertThat(parts).hasSize(3);
            List<Object> keys = new ArrayList<>();
            for (Object part : parts) {
                keys.addAll(((Table) part).index().values());
            }
            assertThat(keys).doesNotHaveDuplicates()
                .containsExactlyInAnyOrder(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L);

            Table combined = ((Table) executor.compute(grouped)).sortByIndex();
            assertThat(combined).isEqualTo(executor.compute(df.groupBy("a").mean()));
        }

        @Test
        @DisplayName("TC-GROUP-007: Optimized result equals the unoptimized graph")
        void testUnoptimizedGraph() {
            Expr grouped = df.get(List.of("a", "c")).groupBy("a").max();

            Object unoptimized = Kernels.concat(new LocalTaskExecutor().execute(grouped.materialize(), grouped.keys()));

            assertThat(executor.compute(grouped)).isEqualTo(unoptimized);
        }
    }

    @Nested
    @DisplayName("Meta")
    class MetaTests {

        @Test
        @DisplayName("TC-GROUP-008: Meta is indexed by the key with aggregated types")
        void testMeta() {
            Meta meta = df.groupBy("a").mean().meta();

            assertThat(meta.isFrame()).isTrue();
            assertThat(meta.columns()).containsExactly("b", "c");
            assertThat(meta.columnType("b")).isEqualTo(DoubleType.get());
            assertThat(meta.index().name()).isEqualTo("a");
            assertThat(meta.indexType()).isEqualTo(LongType.get());
            assertThat(df.groupBy("a").count().npartitions()).isEqualTo(1);
        }

        @Test
        @DisplayName("TC-GROUP-009: Invalid groupings are rejected")
        void testInvalidGroupings() {
            Table text = Table.builder()
                .column("k", LongType.get(), List.of(1L))
                .column("s", StringType.get(), List.of("x"))
                .index(null, LongType.get(), List.of(0L))
                .build();
            Expr frame = LazyFrames.fromTable(text, 1);

            assertThatThrownBy(() -> df.groupBy("z").sum().meta()).isInstanceOf(ColumnNotFoundException.class);
            assertThatThrownBy(() -> frame.groupBy("k").sum().meta()).isInstanceOf(PlanConstructionException.class);
            assertThatThrownBy(() -> df.get("b").groupBy("a").sum().meta()).isInstanceOf(PlanConstructionException.class);
            assertThatThrownBy(() -> df.groupBy("a").aggregate("median", null, 1))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(((Table) executor.compute(frame.groupBy("k").max())).column("s").values()).containsExactly("x");
        }
    }
}
