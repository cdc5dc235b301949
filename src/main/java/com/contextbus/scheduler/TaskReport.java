package com.contextbus.scheduler;

import com.contextbus.context.ContextEntry;
import com.contextbus.evidence.EvidenceRecord;

import java.util.List;

/**
 * Result of running one task to completion, retries included.
 *
 * @param attempts       attempts made, at least 1
 * @param findings       findings stamped with the task id, empty when exhausted
 * @param confidence     0 when exhausted
 * @param note           failure reason or the adapter's degradation message
 * @param exhausted      every attempt failed and the task was degraded
 */
public record TaskReport(
    TaskSpec spec,
    TaskOutcome outcome,
    int attempts,
    List<ContextEntry> findings,
    List<EvidenceRecord> evidence,
    double confidence,
    String note,
    boolean exhausted
) {

    public TaskReport {
        findings = List.copyOf(findings);
        evidence = List.copyOf(evidence);
    }

    static TaskReport exhausted(TaskSpec spec, int attempts, String reason) {
        return new TaskReport(spec, TaskOutcome.DEGRADED, attempts, List.of(), List.of(), 0.0, reason, true);
    }

    public String taskId() {
        return spec.taskId();
    }

    public boolean isDegraded() {
        return outcome == TaskOutcome.DEGRADED;
    }
}
