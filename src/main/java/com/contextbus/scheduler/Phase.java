package com.contextbus.scheduler;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A pipeline stage. Tasks are kept in declaration order; that order is the
 * merge order of their findings.
 */
public record Phase(String name, int order, Set<String> dependsOn, List<TaskSpec> tasks) {

    public Phase {
        Objects.requireNonNull(name, "name");
        dependsOn = dependsOn == null ? Set.of() : Set.copyOf(dependsOn);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        if (dependsOn.contains(name)) {
            throw new PhaseOrderViolationException("phase '" + name + "' depends on itself");
        }
        Set<String> taskIds = new HashSet<>();
        for (TaskSpec task : tasks) {
            if (!task.phase().equals(name)) {
                throw new IllegalArgumentException("task " + task.taskId() + " declared under phase " + name);
            }
            if (!taskIds.add(task.taskId())) {
                throw new IllegalArgumentException("duplicate task " + task.taskId());
            }
        }
    }

    public boolean hasTask(String taskId) {
        return tasks.stream().anyMatch(t -> t.taskId().equals(taskId));
    }
}
