package com.lazyduck.expression;

import com.lazyduck.LazyFrames;
import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.optimizer.Optimizer;
import com.lazyduck.runtime.PlannerConfig;
import com.lazyduck.test.Fixtures;
import com.lazyduck.test.TestBase;
import com.lazyduck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Test ID prefix: TC-REPART-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Repartition Tests")
public class RepartitionTest extends TestBase {

    private final Expr df = LazyFrames.fromTable(Fixtures.abc(100), 10);

    @Test
    @DisplayName("TC-REPART-001: Fewer partitions keep boundaries")
    void testCoalesce() {
        Expr fewer = df.repartition(4);

        assertThat(fewer.npartitions()).isEqualTo(4);
        assertThat(fewer.divisions()).containsExactly(0L, 30L, 50L, 80L, 99L);
    }

    @Test
    @DisplayName("TC-REPART-002: More partitions clear divisions")
    void testSplit() {
        Expr more = df.repartition(25);

        assertThat(more.npartitions()).isEqualTo(25);
        assertThat(more.knownDivisions()).isFalse();
        assertThat(more.layer()).hasSize(25);
    }

    @Test
    @DisplayName("TC-REPART-003: Same partition count is removed")
    void testNoOp() {
        Optimizer optimizer = new Optimizer(PlannerConfig.defaults().withFuse(false));

        assertThat(optimizer.simplify(df.repartition(10))).isEqualTo(df);
        assertThat(optimizer.simplify(df.repartitionByDivisions(df.divisions()))).isEqualTo(df);
    }

    @Test
    @DisplayName("TC-REPART-004: New divisions must be valid and cover the input")
    void testInvalidDivisions() {
        Expr unsorted = LazyFrames.fromTable(Fixtures.abc(100), 10, false);

        assertThatThrownBy(() -> df.repartitionByDivisions(List.of(10L, 99L)))
            .isInstanceOf(PlanConstructionException.class)
            .hasMessageContaining("cover");
        assertThatThrownBy(() -> df.repartitionByDivisions(List.of(0L, 60L, 30L, 99L)))
            .isInstanceOf(PlanConstructionException.class);
        assertThatThrownBy(() -> unsorted.repartitionByDivisions(List.of(0L, 99L)))
            .isInstanceOf(PlanConstructionException.class)
            .hasMessageContaining("known input divisions");
        assertThatThrownBy(() -> df.repartition(0))
            .isInstanceOf(PlanConstructionException.class);
    }

    @Test
    @DisplayName("TC-REPART-005: Row counts look through repartitioning")
    void testLenThroughRepartition() {
        Optimizer optimizer = new Optimizer(PlannerConfig.defaults().withFuse(false));

        assertThat(optimizer.simplify(df.repartition(3).length())).isEqualTo(Literal.of(100L));
    }
}
