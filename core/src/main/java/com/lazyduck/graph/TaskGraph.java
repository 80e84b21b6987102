package com.lazyduck.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mapping from task keys to tasks, in insertion order.
 */
public final class TaskGraph {

    private final LinkedHashMap<TaskKey, Task> tasks = new LinkedHashMap<>();

    public TaskGraph() {}

    public TaskGraph(Map<TaskKey, Task> tasks) {
        this.tasks.putAll(tasks);
    }

    public void put(TaskKey key, Task task) {
        tasks.put(key, task);
    }

    public void putAll(Map<TaskKey, Task> layer) {
        tasks.putAll(layer);
    }

    public Task get(TaskKey key) {
        return tasks.get(key);
    }

    public boolean containsKey(TaskKey key) {
        return tasks.containsKey(key);
    }

    public Set<TaskKey> keys() {
        return Collections.unmodifiableSet(tasks.keySet());
    }

    public Map<TaskKey, Task> asMap() {
        return Collections.unmodifiableMap(tasks);
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Returns the keys needed to compute the targets, dependencies first.
     *
     * @param targets the keys to compute
     * @return a topological order of the targets and everything they read
     * @throws IllegalStateException if a key is missing or the graph has a cycle
     */
    public List<TaskKey> topologicalOrder(Collection<TaskKey> targets) {
        List<TaskKey> order = new ArrayList<>();
        Set<TaskKey> done = new HashSet<>();
        Set<TaskKey> inProgress = new HashSet<>();
        for (TaskKey target : targets) {
            if (done.contains(target)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(target, requireTask(target, null)));
            inProgress.add(target);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.pending.hasNext()) {
                    TaskKey dep = frame.pending.next();
                    if (done.contains(dep)) {
                        continue;
                    }
                    if (!inProgress.add(dep)) {
                        throw new IllegalStateException("Task graph has a cycle through " + dep);
                    }
                    stack.push(new Frame(dep, requireTask(dep, frame.key)));
                } else {
                    stack.pop();
                    inProgress.remove(frame.key);
                    done.add(frame.key);
                    order.add(frame.key);
                }
            }
        }
        return order;
    }

    /**
     * Returns the subgraph needed to compute the targets.
     *
     * @param targets the keys to keep
     * @return the culled graph
     */
    public TaskGraph cull(Collection<TaskKey> targets) {
        TaskGraph culled = new TaskGraph();
        for (TaskKey key : topologicalOrder(targets)) {
            culled.put(key, tasks.get(key));
        }
        return culled;
    }

    private Task requireTask(TaskKey key, TaskKey requiredBy) {
        Task task = tasks.get(key);
        if (task == null) {
            throw new IllegalStateException(requiredBy == null
                ? "Task graph has no task for " + key
                : "Task " + requiredBy + " depends on missing key " + key);
        }
        return task;
    }

    @Override
    public String toString() {
        return "TaskGraph(" + tasks.size() + " tasks)";
    }

    private static final class Frame {
        private final TaskKey key;
        private final Iterator<TaskKey> pending;

        private Frame(TaskKey key, Task task) {
            this.key = key;
            this.pending = task.dependencies().iterator();
        }
    }
}
