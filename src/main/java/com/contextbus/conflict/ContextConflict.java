package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Two entries touching the same semantic key with different content.
 *
 * The first competing entry is the prior (provisional) one, the second
 * the newcomer. Instances are immutable; resolving returns a copy.
 */
public record ContextConflict(
    @JsonProperty("conflict_id") String conflictId,
    @JsonProperty("key") String key,
    @JsonProperty("phase") String phase,
    @JsonProperty("competing_entries") List<ContextEntry> competingEntries,
    @JsonProperty("classification") ConflictClassification classification,
    @JsonProperty("resolution") ResolutionStatus resolution,
    @JsonProperty("detail") ResolutionDetail detail
) {

    public ContextConflict {
        competingEntries = List.copyOf(competingEntries);
        if (competingEntries.size() < 2) {
            throw new IllegalArgumentException("a conflict needs at least two competing entries");
        }
    }

    public static ContextConflict pending(String conflictId, String key, String phase,
                                          ContextEntry prior, ContextEntry incoming,
                                          ConflictClassification classification) {
        return new ContextConflict(conflictId, key, phase, List.of(prior, incoming),
            classification, ResolutionStatus.PENDING, null);
    }

    public ContextEntry prior() {
        return competingEntries.get(0);
    }

    public ContextEntry incoming() {
        return competingEntries.get(1);
    }

    public boolean isPending() {
        return resolution == ResolutionStatus.PENDING;
    }

    /** Same conflict filed under {@code label}, with both competing entries rewritten to it. */
    public ContextConflict relabelled(String label) {
        List<ContextEntry> rewritten = competingEntries.stream().map(e -> e.withKey(label)).toList();
        return new ContextConflict(conflictId, label, phase, rewritten, classification, resolution, detail);
    }

    public ContextConflict resolved(ResolutionDetail detail) {
        return new ContextConflict(conflictId, key, phase, competingEntries,
            classification, ResolutionStatus.RESOLVED, detail);
    }

    public ContextConflict escalated(ResolutionDetail detail) {
        return new ContextConflict(conflictId, key, phase, competingEntries,
            classification, ResolutionStatus.ESCALATED, detail);
    }
}
