package com.contextbus.evidence;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configurable weight per evidence kind, used to compare the strength of
 * two competing entries. The weights are heuristics, not probabilities.
 */
public class EvidenceWeights {

    private final Map<EvidenceKind, Double> weights;

    public EvidenceWeights(Map<EvidenceKind, Double> weights) {
        EnumMap<EvidenceKind, Double> copy = new EnumMap<>(EvidenceKind.class);
        for (EvidenceKind kind : EvidenceKind.values()) {
            copy.put(kind, 1.0);
        }
        copy.putAll(weights);
        this.weights = copy;
    }

    public static EvidenceWeights defaults() {
        return new EvidenceWeights(Map.of(
            EvidenceKind.IMPLEMENTATION, 3.0,
            EvidenceKind.PATTERN, 2.0,
            EvidenceKind.DEPLOYMENT, 2.0,
            EvidenceKind.DOCUMENTATION, 1.0
        ));
    }

    public double weightOf(EvidenceKind kind) {
        return weights.get(kind);
    }

    public Map<EvidenceKind, Double> asMap() {
        return Map.copyOf(weights);
    }

    public double strength(List<EvidenceRecord> records) {
        return records.stream().mapToDouble(r -> weightOf(r.kind())).sum();
    }
}
