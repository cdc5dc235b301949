package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;
import com.contextbus.evidence.EvidenceRecord;
import com.contextbus.evidence.EvidenceWeights;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Settles value disagreements by comparing weighted evidence behind each
 * entry. Equal strength is escalated rather than decided arbitrarily.
 */
public class EvidenceStrengthStrategy implements ResolutionStrategy {

    private final EvidenceWeights weights;

    public EvidenceStrengthStrategy(EvidenceWeights weights) {
        this.weights = weights;
    }

    @Override
    public String strategyId() {
        return "evidence-strength";
    }

    @Override
    public String strategyVersion() {
        return "v1";
    }

    @Override
    public ConflictClassification handles() {
        return ConflictClassification.VALUE_DISAGREEMENT;
    }

    @Override
    public Outcome resolve(String key, ContextEntry prior, ContextEntry incoming, Inputs inputs) {
        List<EvidenceRecord> priorEvidence = evidenceOf(prior, inputs);
        List<EvidenceRecord> incomingEvidence = evidenceOf(incoming, inputs);
        double priorStrength = weights.strength(priorEvidence);
        double incomingStrength = weights.strength(incomingEvidence);

        if (Double.compare(priorStrength, incomingStrength) == 0) {
            return new Outcome.Escalate(String.format(Locale.ROOT,
                "evidence tie for %s: %.2f (%d record(s)) from %s vs %.2f (%d record(s)) from %s",
                key, priorStrength, priorEvidence.size(), prior.sourceTask(),
                incomingStrength, incomingEvidence.size(), incoming.sourceTask()));
        }

        boolean priorWins = priorStrength > incomingStrength;
        ContextEntry winner = priorWins ? prior : incoming;
        ContextEntry loser = priorWins ? incoming : prior;
        return new Outcome.Winner(winner, loser, String.format(Locale.ROOT,
            "evidence strength %.2f from %d record(s) for '%s' outweighs %.2f from %d record(s) for '%s'",
            Math.max(priorStrength, incomingStrength),
            priorWins ? priorEvidence.size() : incomingEvidence.size(),
            winner.value().render(),
            Math.min(priorStrength, incomingStrength),
            priorWins ? incomingEvidence.size() : priorEvidence.size(),
            loser.value().render()), false);
    }

    private List<EvidenceRecord> evidenceOf(ContextEntry entry, Inputs inputs) {
        return entry.evidenceRefs().stream()
            .map(ref -> inputs.ledger().find(inputs.sessionId(), ref))
            .flatMap(Optional::stream)
            .toList();
    }
}
