package com.lazyduck.graph;

import com.lazyduck.exception.TaskExecutionException;
import com.lazyduck.runtime.LocalTaskExecutor;
import com.lazyduck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for task graphs, task evaluation and subgraph callables.
 *
 * <p>Test ID prefix: TC-GRAPH-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TaskGraph Tests")
public class TaskGraphTest {

    private static final PartitionFunction SUM = args -> {
        long total = 0;
        for (Object arg : args) {
            if (arg instanceof List) {
                for (Object item : (List<?>) arg) {
                    total += (Long) item;
                }
            } else {
                total += (Long) arg;
            }
        }
        return total;
    };

    private static TaskKey key(String name, int index) {
        return new TaskKey(name, index);
    }

    private static TaskGraph diamond() {
        TaskGraph graph = new TaskGraph();
        graph.put(key("x", 0), Task.constant(1L));
        graph.put(key("left", 0), new Task(SUM, List.of(key("x", 0), 10L)));
        graph.put(key("right", 0), new Task(SUM, List.of(key("x", 0), 100L)));
        graph.put(key("out", 0), new Task(SUM, List.of(List.of(key("left", 0), key("right", 0)))));
        graph.put(key("unused", 0), Task.constant(7L));
        return graph;
    }

    @Test
    @DisplayName("TC-GRAPH-001: Dependencies include keys nested in lists")
    void testDependencies() {
        Task task = diamond().get(key("out", 0));

        assertThat(task.dependencies()).containsExactlyInAnyOrder(key("left", 0), key("right", 0));
        assertThat(Task.constant(3L).dependencies()).isEmpty();
        assertThat(Task.alias(key("x", 0)).dependencies()).containsExactly(key("x", 0));
    }

    @Test
    @DisplayName("TC-GRAPH-002: Topological order puts dependencies first")
    void testTopologicalOrder() {
        List<TaskKey> order = diamond().topologicalOrder(List.of(key("out", 0)));

        assertThat(order).hasSize(4).doesNotContain(key("unused", 0));
        assertThat(order.get(0)).isEqualTo(key("x", 0));
        assertThat(order.get(3)).isEqualTo(key("out", 0));
    }

    @Test
    @DisplayName("TC-GRAPH-003: Culling keeps only what the targets read")
    void testCull() {
        TaskGraph culled = diamond().cull(List.of(key("left", 0)));

        assertThat(culled.keys()).containsExactlyInAnyOrder(key("x", 0), key("left", 0));
    }

    @Test
    @DisplayName("TC-GRAPH-004: Missing keys and cycles are reported")
    void testInvalidGraphs() {
        TaskGraph missing = new TaskGraph();
        missing.put(key("a", 0), Task.alias(key("b", 0)));
        TaskGraph cycle = new TaskGraph();
        cycle.put(key("a", 0), Task.alias(key("b", 0)));
        cycle.put(key("b", 0), Task.alias(key("a", 0)));

        assertThatThrownBy(() -> missing.topologicalOrder(List.of(key("a", 0))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing key " + key("b", 0));
        assertThatThrownBy(() -> cycle.topologicalOrder(List.of(key("a", 0))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("cycle");
    }

    @Test
    @DisplayName("TC-GRAPH-005: Local executor evaluates shared dependencies once")
    void testLocalExecutor() {
        int[] calls = new int[1];
        TaskGraph graph = diamond();
        graph.put(key("x", 0), new Task(args -> {
            calls[0]++;
            return 1L;
        }, List.of()));

        List<Object> values = new LocalTaskExecutor().execute(graph, List.of(key("out", 0), key("left", 0)));

        assertThat(values).containsExactly(112L, 11L);
        assertThat(calls[0]).isEqualTo(1);
    }

    @Test
    @DisplayName("TC-GRAPH-006: Failing tasks are reported by key")
    void testFailure() {
        TaskGraph graph = diamond();
        graph.put(key("right", 0), new Task(args -> {
            throw new ArithmeticException("boom");
        }, List.of(key("x", 0))));

        assertThatThrownBy(() -> new LocalTaskExecutor().execute(graph, List.of(key("out", 0))))
            .isInstanceOf(TaskExecutionException.class)
            .hasCauseInstanceOf(ArithmeticException.class)
            .satisfies(e -> assertThat(((TaskExecutionException) e).getFailedKey()).isEqualTo(key("right", 0)));
    }

    @Test
    @DisplayName("TC-GRAPH-007: Subgraph callables run an inner graph over their inputs")
    void testSubgraphCallable() {
        Map<TaskKey, Task> inner = new LinkedHashMap<>();
        inner.put(key("add", 0), new Task(SUM, List.of(key("in", 0), 1L)));
        inner.put(key("twice", 0), new Task(SUM, List.of(key("add", 0), key("add", 0))));
        SubgraphCallable callable = new SubgraphCallable("fused", inner, key("twice", 0), List.of(key("in", 0)));

        assertThat(callable.apply(List.of(4L))).isEqualTo(10L);
        assertThatThrownBy(() -> callable.apply(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SubgraphCallable("bad", inner, key("missing", 0), List.of()))
            .isInstanceOf(IllegalArgumentException.class);

        TaskGraph outer = new TaskGraph();
        outer.put(key("source", 0), Task.constant(2L));
        outer.put(key("result", 0), new Task(callable, List.of(key("source", 0))));
        assertThat(new LocalTaskExecutor().execute(outer, List.of(key("result", 0)))).containsExactly(6L);
    }
}
