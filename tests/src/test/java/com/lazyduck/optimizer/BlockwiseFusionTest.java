package com.lazyduck.optimizer;

import com.lazyduck.LazyFrames;
import com.lazyduck.expression.Expr;
import com.lazyduck.expression.Fused;
import com.lazyduck.graph.SubgraphCallable;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskGraph;
import com.lazyduck.reduction.Sum;
import com.lazyduck.runtime.LocalTaskExecutor;
import com.lazyduck.runtime.PlannerConfig;
import com.lazyduck.runtime.QueryExecutor;
import com.lazyduck.test.Fixtures;
import com.lazyduck.test.TestBase;
import com.lazyduck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for grouping blockwise chains into single tasks.
 *
 * <p>Test ID prefix: TC-FUSE-*
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("Blockwise Fusion Tests")
public class BlockwiseFusionTest extends TestBase {

    private final Expr df = LazyFrames.fromTable(Fixtures.abc(100), 10);
    private final Optimizer fusing = new Optimizer();
    private final Optimizer unfused = new Optimizer(PlannerConfig.defaults().withFuse(false));

    @Test
    @DisplayName("TC-FUSE-001: A blockwise chain runs as one task per partition")
    void testChainFusesToPartitionCount() {
        Expr expr = df.get("a").add(1).multiply(2);

        TaskGraph graph = fusing.run(expr).materialize();
        logData("graph", graph);

        assertThat(graph.size()).isEqualTo(10);
        assertThat(unfused.run(expr).materialize().size()).isEqualTo(30);
    }

    @Test
    @DisplayName("TC-FUSE-002: The fused node keeps the output's meta and divisions")
    void testFusedMetaAndDivisions() {
        Expr expr = df.get("a").add(1).multiply(2);
        Expr fused = fusing.run(expr);

        assertThat(fused).isInstanceOf(Fused.class);
        assertThat(fused.meta()).isEqualTo(expr.meta());
        assertThat(fused.divisions()).isEqualTo(expr.divisions());
        assertThat(((Fused) fused).exprs()).hasSize(3);
        assertThat(fused.dependencies()).isEmpty();
    }

    @Test
    @DisplayName("TC-FUSE-003: Fused tasks evaluate a subgraph")
    void testFusedTaskIsSubgraph() {
        Expr fused = fusing.run(df.get("a").add(1).multiply(2));
        Task task = fused.materialize().get(fused.keys().get(0));

        assertThat(task.function()).isInstanceOf(SubgraphCallable.class);
        assertThat(((SubgraphCallable) task.function()).tasks()).hasSize(3);
    }

    @Test
    @DisplayName("TC-FUSE-004: Reduction chunks fuse with their input")
    void testReductionFusesChunks() {
        Expr expr = df.get("a").add(1).sum();

        int fusedTasks = fusing.run(expr).materialize().size();
        int unfusedTasks = unfused.run(expr).materialize().size();
        logData("tasks", fusedTasks + " fused, " + unfusedTasks + " unfused");

        assertThat(fusedTasks).isLessThan(unfusedTasks);
        assertThat(fusedTasks).isEqualTo(10 + 2 + 1);
    }

    @Test
    @DisplayName("TC-FUSE-005: Fan-in of five over ten partitions adds three reduce tasks")
    void testFanIn() {
        Expr expr = new Sum(df.get("b"), 5);
        TaskGraph graph = fusing.run(expr).materialize();

        assertThat(graph.size()).isEqualTo(13);
    }

    @Test
    @DisplayName("TC-FUSE-006: A node read twice inside one group joins the group")
    void testDiamondFusesCompletely() {
        Expr a = df.get("a");
        Expr expr = a.add(1).add(a.multiply(2));

        Expr optimized = fusing.run(expr);
        logData("plan", optimized.explain());

        assertThat(optimized).isInstanceOf(Fused.class);
        Fused fused = (Fused) optimized;
        assertThat(fused.exprs()).hasSize(4);
        assertThat(fused.externals()).isEmpty();
        assertThat(fused.materialize().size()).isEqualTo(10);
    }

    @Test
    @DisplayName("TC-FUSE-007: A node also read outside the group stays external")
    void testSharedDependencyStaysExternal() {
        Expr a = df.get("a");
        Expr expr = a.add(1).subtract(a.sum());

        Expr optimized = fusing.run(expr);
        logData("plan", optimized.explain());

        assertThat(optimized).isInstanceOf(Fused.class);
        Fused fused = (Fused) optimized;
        assertThat(fused.exprs()).hasSize(2);
        assertThat(fused.npartitions()).isEqualTo(10);
        assertThat(fused.externals()).hasSize(2);
        assertThat(fused.externals()).anySatisfy(dep -> assertThat(dep.npartitions()).isEqualTo(1));
        assertThat(fused.externals()).anySatisfy(dep -> assertThat(dep.npartitions()).isEqualTo(10));
        assertThat(fused.materialize().size()).isEqualTo(10 + 10 + 10 + 3);
    }

    @Test
    @DisplayName("TC-FUSE-008: Head reads one partition")
    void testHeadGraph() {
        TaskGraph graph = fusing.run(df.head()).materialize();
        assertThat(graph.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("TC-FUSE-009: Fusion does not change computed results")
    void testFusionTransparency() {
        Expr filtered = df.get(df.get("a").greaterThan(3L));
        List<Expr> exprs = List.of(
            df.get("a").add(1).multiply(2),
            filtered.get(List.of("b", "c")),
            filtered.get("c").sum(),
            df.groupBy("a").mean(),
            df.get("b").add(df.get("c")).valueCounts());

        try (QueryExecutor fused = new QueryExecutor(PlannerConfig.defaults().withFuse(true), new LocalTaskExecutor());
             QueryExecutor plain = new QueryExecutor(PlannerConfig.defaults().withFuse(false), new LocalTaskExecutor())) {
            for (Expr expr : exprs) {
                logStep("Comparing " + expr);
                assertThat(fused.compute(expr)).isEqualTo(plain.compute(expr));
            }
        }
    }
}
