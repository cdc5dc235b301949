package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextMutation;

import java.util.List;
import java.util.Map;

/**
 * The settled conflict together with the context change that applies it.
 * An escalation carries no upserts: the prior value stays provisionally.
 */
public record ConflictResolution(
    ContextConflict conflict,
    Map<String, ContextEntry> upserts,
    List<String> removals,
    ContextMutation mutation
) {
    public ConflictResolution {
        upserts = Map.copyOf(upserts);
        removals = List.copyOf(removals);
    }

    public List<String> retryTasks() {
        return conflict.detail() == null ? List.of() : conflict.detail().retryTasks();
    }
}
