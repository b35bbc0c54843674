package co.fanki.diagrameditor.gantt.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Directed graph over task keys.
 *
 * <p>An edge {@code a -> b} means "a must finish before b starts" and
 * comes from b's {@code after} list. A task bounded by {@code until x}
 * contributes an edge from the task to x. References that name no task
 * are left out; the {@link DependencyResolver} reports them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    private final Set<String> keys;

    private final Map<String, Set<String>> forward;

    private final Map<String, Set<String>> reverse;

    private DependencyGraph(final Set<String> theKeys,
            final Map<String, Set<String>> theForward,
            final Map<String, Set<String>> theReverse) {
        this.keys = theKeys;
        this.forward = theForward;
        this.reverse = theReverse;
    }

    /**
     * Builds the graph of a list of tasks.
     *
     * @param tasks the tasks in document order
     * @return the graph
     */
    public static DependencyGraph of(final List<GanttTask> tasks) {
        final TaskIndex index = new TaskIndex(tasks);
        final Set<String> keys = new LinkedHashSet<>();
        final Map<String, Set<String>> forward = new LinkedHashMap<>();
        final Map<String, Set<String>> reverse = new LinkedHashMap<>();
        for (final GanttTask task : tasks) {
            keys.add(task.key());
            forward.putIfAbsent(task.key(), new LinkedHashSet<>());
            reverse.putIfAbsent(task.key(), new LinkedHashSet<>());
        }
        for (final GanttTask task : tasks) {
            for (final String reference : task.afterDeps()) {
                index.find(reference).map(GanttTask::key)
                        .filter(dep -> !dep.equals(task.key()))
                        .ifPresent(dep -> link(forward, reverse, dep, task.key()));
            }
            final Optional<GanttTask> until = index.find(task.untilDep());
            until.map(GanttTask::key)
                    .filter(dep -> !dep.equals(task.key()))
                    .ifPresent(dep -> link(forward, reverse, task.key(), dep));
        }
        return new DependencyGraph(keys, forward, reverse);
    }

    /** @return the task keys in document order */
    public Set<String> keys() {
        return Collections.unmodifiableSet(keys);
    }

    /**
     * Returns the direct successors of a task.
     *
     * @param key the task key
     * @return the keys of the tasks waiting on it, empty when unknown
     */
    public Set<String> successors(final String key) {
        return Collections.unmodifiableSet(
                forward.getOrDefault(key, Set.of()));
    }

    /**
     * Returns the direct predecessors of a task.
     *
     * @param key the task key
     * @return the keys of the tasks it waits on, empty when unknown
     */
    public Set<String> predecessors(final String key) {
        return Collections.unmodifiableSet(
                reverse.getOrDefault(key, Set.of()));
    }

    /**
     * Finds dependency cycles with a three color depth-first search.
     *
     * <p>Each back edge yields one cycle: the path from the revisited
     * task down to the task that closed the loop. Cycles are reported,
     * never broken.</p>
     *
     * @return the cycles as ordered key lists, empty when the graph is
     *         acyclic
     */
    public List<List<String>> detectCycles() {
        final Map<String, Color> colors = new HashMap<>();
        final List<List<String>> cycles = new ArrayList<>();
        for (final String key : keys) {
            if (colors.getOrDefault(key, Color.WHITE) == Color.WHITE) {
                visit(key, colors, new ArrayList<>(), cycles);
            }
        }
        return cycles;
    }

    /**
     * Returns every task the given one transitively waits on.
     *
     * @param key the task key
     * @return the upstream keys, in breadth-first order, without the task
     */
    public Set<String> upstream(final String key) {
        return reach(key, reverse);
    }

    /**
     * Returns every task transitively waiting on the given one.
     *
     * @param key the task key
     * @return the downstream keys, in breadth-first order, without the task
     */
    public Set<String> downstream(final String key) {
        return reach(key, forward);
    }

    /**
     * Orders the tasks so that every task comes after its predecessors,
     * using Kahn's algorithm. Tasks on a cycle never reach in-degree
     * zero and are left out.
     *
     * @return the ordered keys
     */
    public List<String> topologicalOrder() {
        final Map<String, Integer> inDegree = new HashMap<>();
        for (final String key : keys) {
            inDegree.put(key, reverse.get(key).size());
        }
        final Queue<String> ready = new ArrayDeque<>();
        for (final String key : keys) {
            if (inDegree.get(key) == 0) {
                ready.add(key);
            }
        }
        final List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String key = ready.poll();
            order.add(key);
            for (final String next : forward.get(key)) {
                final int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }
        return order;
    }

    private void visit(final String key, final Map<String, Color> colors,
            final List<String> path, final List<List<String>> cycles) {
        colors.put(key, Color.GRAY);
        path.add(key);
        for (final String next : forward.getOrDefault(key, Set.of())) {
            final Color color = colors.getOrDefault(next, Color.WHITE);
            if (color == Color.GRAY) {
                cycles.add(List.copyOf(path.subList(path.indexOf(next),
                        path.size())));
            } else if (color == Color.WHITE) {
                visit(next, colors, path, cycles);
            }
        }
        path.remove(path.size() - 1);
        colors.put(key, Color.BLACK);
    }

    private Set<String> reach(final String start,
            final Map<String, Set<String>> adjacency) {
        final Set<String> seen = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final String next : adjacency.getOrDefault(current, Set.of())) {
                if (!next.equals(start) && seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen;
    }

    private static void link(final Map<String, Set<String>> forward,
            final Map<String, Set<String>> reverse, final String from,
            final String to) {
        forward.get(from).add(to);
        reverse.get(to).add(from);
    }

    private enum Color {
        WHITE, GRAY, BLACK
    }

}
