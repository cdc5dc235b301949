package com.contextbus.context;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One fact contributed by one task.
 *
 * @param key          semantic key, unique within a snapshot version
 * @param value        typed value
 * @param sourceTask   task id of the contributor, or {@code foundation}
 * @param confidence   contributor's confidence in [0, 1]
 * @param evidenceRefs ids of the supporting evidence records
 * @param degraded     set when the contributing task finished degraded
 */
public record ContextEntry(
    @JsonProperty("key") String key,
    @JsonProperty("value") ContextValue value,
    @JsonProperty("source_task") String sourceTask,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("evidence_refs") List<String> evidenceRefs,
    @JsonProperty("degraded") boolean degraded
) {

    public ContextEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(sourceTask, "sourceTask");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
    }

    public static ContextEntry of(String key, ContextValue value, String sourceTask,
                                  double confidence, List<String> evidenceRefs) {
        return new ContextEntry(key, value, sourceTask, confidence, evidenceRefs, false);
    }

    public String namespace() {
        return SemanticKeys.namespace(key);
    }

    public boolean fromFoundation() {
        return SemanticKeys.FOUNDATION_SOURCE.equals(sourceTask);
    }

    public ContextEntry withKey(String newKey) {
        return new ContextEntry(newKey, value, sourceTask, confidence, evidenceRefs, degraded);
    }

    public ContextEntry asDegraded(double confidenceFactor) {
        return new ContextEntry(key, value, sourceTask, confidence * confidenceFactor, evidenceRefs, true);
    }

    /**
     * Folds a corroborating entry (same key, same value) into this one:
     * evidence is unioned and the higher confidence kept.
     */
    public ContextEntry corroboratedBy(ContextEntry other) {
        Set<String> refs = new LinkedHashSet<>(evidenceRefs);
        refs.addAll(other.evidenceRefs);
        return new ContextEntry(key, value, sourceTask,
            Math.max(confidence, other.confidence), new ArrayList<>(refs), degraded && other.degraded);
    }
}
