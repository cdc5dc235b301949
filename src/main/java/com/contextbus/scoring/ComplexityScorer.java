package com.contextbus.scoring;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Estimates investigation complexity from the breadth of the findings:
 * how many facts, across how many namespaces, backed by how much evidence.
 */
public class ComplexityScorer implements StrategicScorer {

    static final int ENTRY_SATURATION = 20;
    static final int NAMESPACE_SATURATION = 6;
    static final int EVIDENCE_SATURATION = 30;

    @Override
    public String scorerId() {
        return "complexity";
    }

    @Override
    public String scorerVersion() {
        return "v1";
    }

    @Override
    public ScoreDecision score(ContextSnapshot context) {
        List<ContextEntry> findings = Findings.of(context);
        long namespaces = findings.stream().map(ContextEntry::namespace).distinct().count();
        long evidence = findings.stream().mapToLong(e -> e.evidenceRefs().size()).sum();

        double breadth = saturate(findings.size(), ENTRY_SATURATION);
        double spread = saturate(namespaces, NAMESPACE_SATURATION);
        double depth = saturate(evidence, EVIDENCE_SATURATION);
        double overall = 0.4 * breadth + 0.4 * spread + 0.2 * depth;

        String level = overall >= 0.7 ? "High" : overall >= 0.4 ? "Medium" : "Low";
        int testSteps = 4 + (int) Math.round(overall * 6);

        return new ScoreDecision(scorerId(), scorerVersion(), level, overall,
            Map.of("findings", findings.size(), "namespaces", namespaces, "evidence_refs", evidence,
                "optimal_test_steps", testSteps),
            String.format("%d finding(s) across %d namespace(s) with %d evidence reference(s)",
                findings.size(), namespaces, evidence));
    }

    private static double saturate(long value, int saturation) {
        return Math.min(1.0, (double) value / saturation);
    }
}
