package com.contextbus.evidence;

import com.contextbus.context.SemanticKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validation gate over the evidence ledger. Deterministic, no scoring model.
 *
 * - A claim is approved only with at least one implementation or pattern record.
 * - Deployment evidence speaks to availability, never to capability, so it
 *   cannot approve a claim by itself; it only marks an approved claim as deployed.
 * - A rejected claim is offered the nearest approved claim of the same
 *   namespace (token overlap on the key name) as an alternative.
 */
public class EvidenceGate {

    private static final Logger log = LoggerFactory.getLogger(EvidenceGate.class);

    private final EvidenceLedger ledger;

    public EvidenceGate(EvidenceLedger ledger) {
        this.ledger = ledger;
    }

    public GateResult validate(String sessionId, String claim) {
        List<EvidenceRecord> records = ledger.recordsFor(sessionId, claim);
        List<EvidenceRecord> support = records.stream()
            .filter(r -> r.kind().approvesCapability())
            .toList();
        if (!support.isEmpty()) {
            boolean deployed = records.stream().anyMatch(r -> r.kind() == EvidenceKind.DEPLOYMENT);
            return new GateResult.Approved(claim, support, deployed);
        }

        String reason = records.isEmpty()
            ? "no evidence recorded for claim"
            : "no implementation or pattern evidence; only " + describeKinds(records);

        Optional<String> alternative = nearestApproved(sessionId, claim);
        if (alternative.isPresent()) {
            log.info("Claim {} rejected ({}); suggesting {}", claim, reason, alternative.get());
            return new GateResult.RequiresAlternative(claim, alternative.get(), reason);
        }
        log.info("Claim {} rejected: {}", claim, reason);
        return new GateResult.Rejected(claim, reason);
    }

    /**
     * Approved claims of the ledger, keyed by canonical form, keeping the
     * first label each was recorded under.
     */
    public Map<String, String> approvedClaims(String sessionId) {
        Map<String, String> approved = new LinkedHashMap<>();
        for (EvidenceRecord record : ledger.records(sessionId)) {
            if (record.kind().approvesCapability()) {
                approved.putIfAbsent(SemanticKeys.canonical(record.claim()), record.claim());
            }
        }
        return approved;
    }

    private Optional<String> nearestApproved(String sessionId, String claim) {
        String namespace = SemanticKeys.namespace(claim);
        String canonical = SemanticKeys.canonical(claim);
        Set<String> tokens = SemanticKeys.tokens(claim);

        return approvedClaims(sessionId).entrySet().stream()
            .filter(e -> !e.getKey().equals(canonical))
            .map(Map.Entry::getValue)
            .filter(candidate -> SemanticKeys.namespace(candidate).equalsIgnoreCase(namespace))
            .map(candidate -> Map.entry(candidate, overlap(tokens, SemanticKeys.tokens(candidate))))
            .filter(e -> e.getValue() > 0.0)
            .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .map(Map.Entry::getKey)
            .findFirst();
    }

    private static double overlap(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private static String describeKinds(List<EvidenceRecord> records) {
        return records.stream()
            .map(r -> r.kind().getValue())
            .distinct()
            .sorted()
            .reduce((a, b) -> a + ", " + b)
            .orElse("none") + " evidence";
    }
}
