package com.contextbus.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Provenance for a claim.
 *
 * @param evidenceId        id referenced from context entries
 * @param claim             semantic key of the claim this record supports
 * @param sourceTask        task that recorded it; stamped by the scheduler
 * @param sourceArtifactRef pointer to the inspected artifact (commit, doc URL, probe output)
 * @param kind              evidence kind
 */
public record EvidenceRecord(
    @JsonProperty("evidence_id") String evidenceId,
    @JsonProperty("claim") String claim,
    @JsonProperty("source_task") String sourceTask,
    @JsonProperty("source_artifact_ref") String sourceArtifactRef,
    @JsonProperty("kind") EvidenceKind kind
) {

    public EvidenceRecord {
        Objects.requireNonNull(evidenceId, "evidenceId");
        Objects.requireNonNull(claim, "claim");
        Objects.requireNonNull(kind, "kind");
    }

    public static EvidenceRecord of(String claim, EvidenceKind kind, String sourceArtifactRef) {
        return new EvidenceRecord("ev-" + UUID.randomUUID().toString().substring(0, 8),
            claim, null, sourceArtifactRef, kind);
    }

    public EvidenceRecord withSourceTask(String taskId) {
        return new EvidenceRecord(evidenceId, claim, taskId, sourceArtifactRef, kind);
    }
}
