package com.contextbus.context;

import com.contextbus.conflict.ContextConflict;

import java.util.List;

public record MergeResult(ContextSnapshot snapshot, List<ContextConflict> conflicts) {

    public MergeResult {
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
