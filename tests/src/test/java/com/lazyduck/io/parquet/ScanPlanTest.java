package com.lazyduck.io.parquet;

import com.lazyduck.exception.DatasetReadException;
import com.lazyduck.frame.BinaryOperator;
import com.lazyduck.frame.Table;
import com.lazyduck.test.Fixtures;
import com.lazyduck.test.InMemoryDatasetReader;
import com.lazyduck.test.TestBase;
import com.lazyduck.test.TestCategories;
import com.lazyduck.types.LongType;
import com.lazyduck.types.StructField;
import com.lazyduck.types.StructType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for scan planning: pruning, division inference and plan caching.
 *
 * <p>Test ID prefix: TC-SCAN-*
 */
@TestCategories.Tier1
@TestCategories.IO
@DisplayName("ScanPlan Tests")
public class ScanPlanTest extends TestBase {

    private static Fragment fragment(int group, Object min, Object max) {
        return new Fragment("f.parquet", group, group * 10L, 10,
            Map.of("k", new ColumnStatistics(min, max, 0)));
    }

    @Test
    @DisplayName("TC-SCAN-001: Disjoint ascending ranges give divisions")
    void testInferDivisions() {
        List<Fragment> fragments = List.of(fragment(0, 0L, 9L), fragment(1, 10L, 19L), fragment(2, 25L, 30L));

        assertThat(ScanPlan.inferDivisions(fragments, "k")).containsExactly(0L, 10L, 25L, 30L);
    }

    @Test
    @DisplayName("TC-SCAN-002: Touching ranges give unknown divisions")
    void testTouchingRanges() {
        List<Fragment> fragments = List.of(fragment(0, 0L, 10L), fragment(1, 10L, 19L));

        assertThat(ScanPlan.inferDivisions(fragments, "k")).containsExactly(null, null, null);
    }

    @Test
    @DisplayName("TC-SCAN-003: Missing statistics give unknown divisions")
    void testMissingStatistics() {
        List<Fragment> fragments = List.of(fragment(0, 0L, 9L), new Fragment("f.parquet", 1, 10, 10, null));

        assertThat(ScanPlan.inferDivisions(fragments, "k")).containsExactly(null, null, null);
        assertThat(ScanPlan.inferDivisions(List.of(fragment(0, 0L, 9L)), "other")).containsExactly(null, null);
    }

    @Test
    @DisplayName("TC-SCAN-004: Empty row groups are skipped, pruned ones counted")
    void testPruneCounts() {
        List<Table> groups = new java.util.ArrayList<>(Fixtures.blocks(4));
        groups.add(1, Fixtures.abc(0));
        ParquetDataset dataset = new ParquetDataset("mem://counts", new InMemoryDatasetReader(groups));

        ScanPlan all = dataset.scanPlan(List.of(), null, true);
        ScanPlan some = dataset.scanPlan(
            List.of(new FilterPredicate("a", BinaryOperator.GREATER_THAN_OR_EQUAL, 2L)), null, true);

        assertThat(all.npartitions()).isEqualTo(4);
        assertThat(all.pruned()).isZero();
        assertThat(some.npartitions()).isEqualTo(2);
        assertThat(some.pruned()).isEqualTo(2);
        assertThat(some.fragment(0).rowGroup()).isEqualTo(3);
    }

    @Test
    @DisplayName("TC-SCAN-005: Plans are cached per dataset")
    void testPlanCache() {
        InMemoryDatasetReader reader = new InMemoryDatasetReader(Fixtures.blocks(4));
        ParquetDataset dataset = new ParquetDataset("mem://plans", reader, 2);
        List<FilterPredicate> filters = Arrays.asList(new FilterPredicate("a", BinaryOperator.EQUAL, 1L));

        ScanPlan first = dataset.scanPlan(filters, null, true);
        ScanPlan second = dataset.scanPlan(List.copyOf(filters), null, true);
        dataset.scanPlan(List.of(), null, true);
        dataset.scanPlan(List.of(), "b", true);

        assertThat(second).isSameAs(first);
        assertThat(dataset.planCache().size()).isEqualTo(2);
        assertThat(reader.fragmentCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("TC-SCAN-006: Plan without fragments still has one partition")
    void testEmptyPlan() {
        ParquetDataset dataset = new ParquetDataset("mem://none", new InMemoryDatasetReader(Fixtures.blocks(2)));
        ScanPlan plan = dataset.scanPlan(
            List.of(new FilterPredicate("a", BinaryOperator.LESS_THAN, 0L)), "b", true);

        assertThat(plan.npartitions()).isEqualTo(1);
        assertThat(plan.fragment(0)).isNull();
        assertThat(plan.divisions()).containsExactly(null, null);
    }

    @Test
    @DisplayName("TC-SCAN-007: Plans beyond the cache capacity are evicted")
    void testPlanEviction() {
        ParquetDataset dataset = new ParquetDataset("mem://evict", new InMemoryDatasetReader(Fixtures.blocks(4)), 1);
        List<FilterPredicate> filters = List.of(new FilterPredicate("a", BinaryOperator.EQUAL, 1L));

        ScanPlan first = dataset.scanPlan(filters, null, true);
        dataset.scanPlan(List.of(), null, true);
        ScanPlan again = dataset.scanPlan(filters, null, true);

        assertThat(again).isNotSameAs(first);
        assertThat(again.npartitions()).isEqualTo(first.npartitions());
        assertThat(dataset.planCache().size()).isEqualTo(1);
        assertThatThrownBy(() -> new ParquetDataset("mem://evict", new InMemoryDatasetReader(Fixtures.blocks(1)), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("TC-SCAN-008: Storage failures while planning are not wrapped by the cache")
    void testPlanFailure() {
        DatasetReader failing = new DatasetReader() {
            @Override
            public String token() {
                return "failing";
            }

            @Override
            public StructType schema(String path) {
                return new StructType(List.of(new StructField("a", LongType.get())));
            }

            @Override
            public List<Fragment> fragments(String path) {
                throw new DatasetReadException("listing failed", null, path);
            }

            @Override
            public Table read(String path, Fragment fragment, List<String> columns,
                              List<FilterPredicate> filters, String index) {
                throw new UnsupportedOperationException();
            }
        };
        ParquetDataset dataset = new ParquetDataset("mem://failing", failing);

        assertThatThrownBy(() -> dataset.scanPlan(List.of(), null, true))
            .isInstanceOf(DatasetReadException.class)
            .hasMessage("listing failed");
        assertThat(dataset.planCache().size()).isZero();
    }

    @Test
    @DisplayName("TC-SCAN-009: Datasets on the same path through different sources are distinct")
    void testDatasetIdentity() {
        InMemoryDatasetReader reader = new InMemoryDatasetReader(Fixtures.blocks(1));
        ParquetDataset first = new ParquetDataset("mem://same", reader);
        ParquetDataset sameSource = new ParquetDataset("mem://same", reader);
        ParquetDataset otherSource = new ParquetDataset("mem://same", new InMemoryDatasetReader(Fixtures.blocks(1)));

        assertThat(sameSource).isEqualTo(first);
        assertThat(sameSource.token()).isEqualTo(first.token());
        assertThat(otherSource).isNotEqualTo(first);
        assertThat(otherSource.token()).isNotEqualTo(first.token());
    }
}
