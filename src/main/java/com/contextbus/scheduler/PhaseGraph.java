package com.contextbus.scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Validated phase DAG with a fixed execution order.
 *
 * The execution order is a topological order; among phases that are ready
 * at the same time the lower {@code order} runs first, then the name
 * decides. Unknown dependencies and cycles are rejected at construction.
 */
public class PhaseGraph {

    private final Map<String, Phase> phases;
    private final List<Phase> executionOrder;

    public PhaseGraph(List<Phase> declared) {
        Map<String, Phase> byName = new LinkedHashMap<>();
        for (Phase phase : declared) {
            if (byName.putIfAbsent(phase.name(), phase) != null) {
                throw new PhaseOrderViolationException("phase '" + phase.name() + "' declared twice");
            }
        }
        for (Phase phase : byName.values()) {
            for (String dependency : phase.dependsOn()) {
                if (!byName.containsKey(dependency)) {
                    throw new PhaseOrderViolationException(
                        "phase '" + phase.name() + "' depends on unknown phase '" + dependency + "'");
                }
            }
        }
        this.phases = byName;
        this.executionOrder = List.copyOf(sort(byName));
    }

    private static List<Phase> sort(Map<String, Phase> byName) {
        Map<String, Integer> indegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Phase phase : byName.values()) {
            indegree.put(phase.name(), phase.dependsOn().size());
            for (String dependency : phase.dependsOn()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(phase.name());
            }
        }

        PriorityQueue<Phase> ready = new PriorityQueue<>(
            Comparator.comparingInt(Phase::order).thenComparing(Phase::name));
        byName.values().stream().filter(p -> p.dependsOn().isEmpty()).forEach(ready::add);

        List<Phase> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            Phase next = ready.poll();
            ordered.add(next);
            for (String dependent : dependents.getOrDefault(next.name(), List.of())) {
                if (indegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(byName.get(dependent));
                }
            }
        }

        if (ordered.size() != byName.size()) {
            Deque<String> stuck = new ArrayDeque<>();
            byName.keySet().stream().filter(n -> indegree.get(n) > 0).sorted().forEach(stuck::add);
            throw new PhaseOrderViolationException("phase graph has a cycle among " + stuck);
        }
        return ordered;
    }

    public List<Phase> executionOrder() {
        return executionOrder;
    }

    public Optional<Phase> phase(String name) {
        return Optional.ofNullable(phases.get(name));
    }

    public Optional<Phase> first() {
        return executionOrder.isEmpty() ? Optional.empty() : Optional.of(executionOrder.get(0));
    }

    public boolean isEmpty() {
        return phases.isEmpty();
    }
}
