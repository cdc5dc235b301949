package com.contextbus.agent;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Input of one task attempt.
 *
 * The snapshot is the immutable view the task was scheduled with; a retry
 * sees the same one unless a conflict resolution injected a correction.
 * {@link #pollInterim()} never blocks.
 */
public record InvestigationContext(
    String sessionId,
    String jobKey,
    String taskId,
    int attempt,
    ContextSnapshot snapshot,
    Supplier<Map<String, List<ContextEntry>>> interimFindings
) {

    /** Findings already posted by finished tasks of the same phase, by task id. */
    public Map<String, List<ContextEntry>> pollInterim() {
        return interimFindings == null ? Map.of() : interimFindings.get();
    }
}
