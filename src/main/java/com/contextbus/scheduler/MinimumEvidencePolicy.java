package com.contextbus.scheduler;

import com.contextbus.context.ContextEntry;
import com.contextbus.evidence.EvidenceKind;
import com.contextbus.evidence.EvidenceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether the checked investigation phase produced enough to go on.
 *
 * <ul>
 *   <li>{@code IMPLEMENTATION_EVIDENCE}: some task recorded implementation evidence.</li>
 *   <li>{@code DESCRIPTIVE_FINDINGS}: some finding sits in a descriptive namespace,
 *       or some task recorded documentation evidence.</li>
 *   <li>{@code RELATED_TASK_EVIDENCE}: some finding sits in a related-items namespace.</li>
 * </ul>
 */
public class MinimumEvidencePolicy {

    private final boolean enabled;
    private final String phase;
    private final Set<String> descriptiveNamespaces;
    private final Set<String> relatedNamespaces;

    public MinimumEvidencePolicy(boolean enabled, String phase,
                                 Collection<String> descriptiveNamespaces, Collection<String> relatedNamespaces) {
        this.enabled = enabled;
        this.phase = phase == null || phase.isBlank() ? null : phase;
        this.descriptiveNamespaces = lower(descriptiveNamespaces);
        this.relatedNamespaces = lower(relatedNamespaces);
    }

    public static MinimumEvidencePolicy disabled() {
        return new MinimumEvidencePolicy(false, null, List.of(), List.of());
    }

    /** Whether the policy is checked after {@code candidate}; defaults to the first phase. */
    public boolean appliesTo(Phase candidate, PhaseGraph graph) {
        if (!enabled) {
            return false;
        }
        if (phase != null) {
            return phase.equals(candidate.name());
        }
        return graph.first().map(p -> p.name().equals(candidate.name())).orElse(false);
    }

    /** Unmet conditions in declaration order; empty when everything is met. */
    public List<EvidenceCondition> unmet(List<TaskReport> reports) {
        EnumSet<EvidenceCondition> met = EnumSet.noneOf(EvidenceCondition.class);
        for (TaskReport report : reports) {
            for (EvidenceRecord evidence : report.evidence()) {
                if (evidence.kind() == EvidenceKind.IMPLEMENTATION) {
                    met.add(EvidenceCondition.IMPLEMENTATION_EVIDENCE);
                }
                if (evidence.kind() == EvidenceKind.DOCUMENTATION) {
                    met.add(EvidenceCondition.DESCRIPTIVE_FINDINGS);
                }
            }
            for (ContextEntry finding : report.findings()) {
                String namespace = finding.namespace().toLowerCase(Locale.ROOT);
                if (descriptiveNamespaces.contains(namespace)) {
                    met.add(EvidenceCondition.DESCRIPTIVE_FINDINGS);
                }
                if (relatedNamespaces.contains(namespace)) {
                    met.add(EvidenceCondition.RELATED_TASK_EVIDENCE);
                }
            }
        }
        List<EvidenceCondition> unmet = new ArrayList<>();
        for (EvidenceCondition condition : EvidenceCondition.values()) {
            if (!met.contains(condition)) {
                unmet.add(condition);
            }
        }
        return unmet;
    }

    public boolean isViolated(List<EvidenceCondition> unmet) {
        return unmet.size() == EvidenceCondition.values().length;
    }

    private static Set<String> lower(Collection<String> namespaces) {
        return namespaces.stream().map(n -> n.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }
}
