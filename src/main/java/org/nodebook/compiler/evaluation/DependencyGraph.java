package org.nodebook.compiler.evaluation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Evaluation order of derived values.
 *
 * @param topologicalOrder Keys sorted so that every key appears after its dependencies.
 *                         Keys on or behind a cycle are absent.
 * @param cycles           Each detected cycle as a path whose last element repeats the first.
 */
public record DependencyGraph(List<EvaluationKey> topologicalOrder, List<List<EvaluationKey>> cycles) {

    public DependencyGraph {
        topologicalOrder = List.copyOf(topologicalOrder);
        cycles = List.copyOf(cycles);
    }

    /**
     * Sorts keys with Kahn's algorithm.
     *
     * @param dependencies For each key, the keys it depends on. Dependencies that are
     *                     not keys themselves are ignored.
     * @return The graph with its order and cycles.
     */
    public static DependencyGraph build(Map<EvaluationKey, Set<EvaluationKey>> dependencies) {
        Map<EvaluationKey, Set<EvaluationKey>> pending = new LinkedHashMap<>();
        Map<EvaluationKey, Set<EvaluationKey>> dependents = new LinkedHashMap<>();
        for (EvaluationKey key : dependencies.keySet()) {
            pending.put(key, new LinkedHashSet<>());
            dependents.computeIfAbsent(key, k -> new LinkedHashSet<>());
        }
        for (Map.Entry<EvaluationKey, Set<EvaluationKey>> entry : dependencies.entrySet()) {
            for (EvaluationKey dependency : entry.getValue()) {
                if (pending.containsKey(dependency)) {
                    pending.get(entry.getKey()).add(dependency);
                    dependents.get(dependency).add(entry.getKey());
                }
            }
        }

        Queue<EvaluationKey> ready = new ArrayDeque<>();
        for (Map.Entry<EvaluationKey, Set<EvaluationKey>> entry : pending.entrySet()) {
            if (entry.getValue().isEmpty()) {
                ready.add(entry.getKey());
            }
        }

        List<EvaluationKey> sorted = new ArrayList<>();
        Set<EvaluationKey> done = new HashSet<>();
        while (!ready.isEmpty()) {
            EvaluationKey current = ready.poll();
            sorted.add(current);
            done.add(current);
            for (EvaluationKey dependent : dependents.get(current)) {
                Set<EvaluationKey> remaining = pending.get(dependent);
                remaining.remove(current);
                if (remaining.isEmpty()) {
                    ready.add(dependent);
                }
            }
        }

        List<List<EvaluationKey>> cycles = new ArrayList<>();
        if (sorted.size() != pending.size()) {
            findCycles(pending, done, cycles);
        }
        return new DependencyGraph(sorted, cycles);
    }

    private static void findCycles(Map<EvaluationKey, Set<EvaluationKey>> pending, Set<EvaluationKey> done,
                                   List<List<EvaluationKey>> cycles) {
        Set<EvaluationKey> finished = new HashSet<>(done);
        for (EvaluationKey start : pending.keySet()) {
            walk(start, new ArrayList<>(), pending, finished, cycles);
        }
    }

    private static void walk(EvaluationKey key, List<EvaluationKey> path, Map<EvaluationKey, Set<EvaluationKey>> pending,
                             Set<EvaluationKey> finished, List<List<EvaluationKey>> cycles) {
        if (finished.contains(key)) return;
        int index = path.indexOf(key);
        if (index >= 0) {
            List<EvaluationKey> cycle = new ArrayList<>(path.subList(index, path.size()));
            cycle.add(key);
            cycles.add(cycle);
            return;
        }
        path.add(key);
        for (EvaluationKey dependency : pending.get(key)) {
            walk(dependency, path, pending, finished, cycles);
        }
        path.remove(path.size() - 1);
        finished.add(key);
    }

    /**
     * @return Keys that are on a cycle or depend on one.
     */
    public Set<EvaluationKey> blocked(Set<EvaluationKey> allKeys) {
        Set<EvaluationKey> blocked = new LinkedHashSet<>(allKeys);
        topologicalOrder.forEach(blocked::remove);
        return blocked;
    }
}
