package com.contextbus.agent;

import com.contextbus.context.ContextEntry;
import com.contextbus.evidence.EvidenceRecord;

import java.util.List;
import java.util.Objects;

/**
 * What an investigator hands back for one run.
 *
 * @param findings   context entries the task contributes
 * @param evidence   provenance for the claims behind the findings
 * @param confidence overall confidence in [0, 1]
 * @param status     completion signal
 * @param message    free-form note, usually the failure reason
 */
public record AgentResult(
    List<ContextEntry> findings,
    List<EvidenceRecord> evidence,
    double confidence,
    AgentStatus status,
    String message
) {

    public AgentResult {
        Objects.requireNonNull(status, "status");
        findings = findings == null ? List.of() : List.copyOf(findings);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static AgentResult done(List<ContextEntry> findings, List<EvidenceRecord> evidence, double confidence) {
        return new AgentResult(findings, evidence, confidence, AgentStatus.DONE, null);
    }

    public static AgentResult degraded(List<ContextEntry> findings, List<EvidenceRecord> evidence,
                                       double confidence, String message) {
        return new AgentResult(findings, evidence, confidence, AgentStatus.DEGRADED, message);
    }

    public static AgentResult failed(String message) {
        return new AgentResult(List.of(), List.of(), 0.0, AgentStatus.FAILED, message);
    }
}
