package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextMutation;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.MutationKind;
import com.contextbus.context.SemanticKeys;
import com.contextbus.evidence.EvidenceLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic conflict resolver.
 *
 * - Semantic aliases are canonicalized to the longer label with no
 *   confidence penalty. If the values still disagree afterwards, a
 *   follow-up conflict under the canonical key goes to the matching strategy.
 * - Type mismatches and value disagreements go to the registered strategy
 *   for their classification.
 * - Every outcome is returned as a {@link ConflictResolution} whose mutation
 *   names the strategy and the rationale.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    static final String RESOLVER_ID = "conflict-resolver";

    private final ConflictDetector detector;
    private final EvidenceLedger ledger;
    private final Map<ConflictClassification, ResolutionStrategy> strategies;

    public ConflictResolver(ConflictDetector detector, EvidenceLedger ledger, List<ResolutionStrategy> strategies) {
        this.detector = detector;
        this.ledger = ledger;
        EnumMap<ConflictClassification, ResolutionStrategy> byClass = new EnumMap<>(ConflictClassification.class);
        for (ResolutionStrategy strategy : strategies) {
            if (byClass.putIfAbsent(strategy.handles(), strategy) != null) {
                throw new IllegalArgumentException("duplicate strategy for " + strategy.handles());
            }
        }
        this.strategies = byClass;
    }

    /**
     * Resolves a pending conflict against the current snapshot. The result
     * lists one resolution per version to write, in order.
     */
    public List<ConflictResolution> resolve(String sessionId, ContextSnapshot current, ContextConflict conflict) {
        if (!conflict.isPending()) {
            throw new IllegalArgumentException("conflict " + conflict.conflictId() + " is already " + conflict.resolution());
        }
        if (conflict.classification() == ConflictClassification.SEMANTIC_ALIAS) {
            return resolveAlias(sessionId, current, conflict);
        }
        ContextConflict target = onSurvivingLabel(current, conflict);
        ContextEntry prior = current.get(target.key()).orElse(target.prior());
        return List.of(resolveValues(sessionId, current, target, prior, target.incoming()));
    }

    /**
     * An alias resolution earlier in the same batch may have removed the
     * conflict's label; the conflict then belongs to the label that replaced it.
     */
    private static ContextConflict onSurvivingLabel(ContextSnapshot current, ContextConflict conflict) {
        if (current.get(conflict.key()).isPresent()) {
            return conflict;
        }
        return current.findConcept(conflict.key())
            .map(survivor -> conflict.relabelled(survivor.key()))
            .orElse(conflict);
    }

    private List<ConflictResolution> resolveAlias(String sessionId, ContextSnapshot current, ContextConflict conflict) {
        ContextEntry prior = current.findConcept(conflict.prior().key()).orElse(conflict.prior());
        ContextEntry incoming = conflict.incoming();
        String label = SemanticKeys.canonicalLabel(prior.key(), incoming.key());
        ContextEntry priorRelabelled = prior.withKey(label);
        ContextEntry incomingRelabelled = incoming.withKey(label);
        List<String> removals = prior.key().equals(label) ? List.of() : List.of(prior.key());

        Optional<ConflictClassification> remaining = detector.classifyValues(label, priorRelabelled, incomingRelabelled);
        String rationale = "'" + prior.key() + "' and '" + incoming.key() + "' denote the same concept; canonical label '" + label + "'";

        if (remaining.isEmpty()) {
            ContextEntry merged = priorRelabelled.corroboratedBy(incomingRelabelled);
            ResolutionDetail detail = new ResolutionDetail("semantic-alias", RESOLVER_ID + "/semantic-alias",
                null, merged.value().render(), rationale, List.of());
            log.info("Conflict {} resolved by canonicalization: {}", conflict.conflictId(), rationale);
            return List.of(new ConflictResolution(conflict.resolved(detail), Map.of(label, merged), removals,
                new ContextMutation(MutationKind.CANONICALIZE, label, detail.resolvedBy(), rationale)));
        }

        ResolutionDetail aliasDetail = new ResolutionDetail("semantic-alias", RESOLVER_ID + "/semantic-alias",
            null, priorRelabelled.value().render(), rationale + "; values still differ (" + remaining.get() + ")", List.of());
        ConflictResolution canonicalized = new ConflictResolution(conflict.resolved(aliasDetail),
            Map.of(label, priorRelabelled), removals,
            new ContextMutation(MutationKind.CANONICALIZE, label, aliasDetail.resolvedBy(), aliasDetail.rationale()));
        log.info("Conflict {} canonicalized to {}, follow-up {} required", conflict.conflictId(), label, remaining.get());

        ContextSnapshot relabelled = current.next(current.phase(), Map.of(label, priorRelabelled), removals, List.of());
        ContextConflict followUp = ContextConflict.pending(conflict.conflictId() + "-a", label, conflict.phase(),
            priorRelabelled, incomingRelabelled, remaining.get());

        List<ConflictResolution> resolutions = new ArrayList<>();
        resolutions.add(canonicalized);
        resolutions.add(resolveValues(sessionId, relabelled, followUp, priorRelabelled, incomingRelabelled));
        return resolutions;
    }

    private ConflictResolution resolveValues(String sessionId, ContextSnapshot current, ContextConflict conflict,
                                             ContextEntry prior, ContextEntry incoming) {
        String key = conflict.key();
        if (prior.value().equals(incoming.value())) {
            ContextEntry merged = prior.corroboratedBy(incoming);
            ResolutionDetail detail = new ResolutionDetail("corroboration", RESOLVER_ID,
                prior.sourceTask(), merged.value().render(), "values agree after earlier resolution", List.of());
            return new ConflictResolution(conflict.resolved(detail), Map.of(key, merged), List.of(),
                new ContextMutation(MutationKind.RESOLVE, key, RESOLVER_ID, detail.rationale()));
        }

        ResolutionStrategy strategy = strategies.get(conflict.classification());
        if (strategy == null) {
            ResolutionDetail detail = new ResolutionDetail("none", RESOLVER_ID, null, prior.value().render(),
                "no strategy registered for " + conflict.classification(), List.of());
            log.warn("Conflict {} escalated: no strategy for {}", conflict.conflictId(), conflict.classification());
            return escalation(conflict, detail);
        }

        ResolutionStrategy.Outcome outcome = strategy.resolve(key, prior, incoming,
            new ResolutionStrategy.Inputs(sessionId, current, ledger));
        String actor = RESOLVER_ID + "/" + strategy.strategyId() + "@" + strategy.strategyVersion();

        if (outcome instanceof ResolutionStrategy.Outcome.Winner winner) {
            ContextEntry loser = winner.loser();
            List<String> retry = winner.retryLoser() && !loser.fromFoundation()
                ? List.of(loser.sourceTask())
                : List.of();
            ContextEntry standing = winner.winner().withKey(key);
            ResolutionDetail detail = new ResolutionDetail(strategy.strategyId(), actor,
                standing.sourceTask(), standing.value().render(), winner.rationale(), retry);
            log.info("Conflict {} on {} resolved by {}: {}", conflict.conflictId(), key, strategy.strategyId(), winner.rationale());
            return new ConflictResolution(conflict.resolved(detail), Map.of(key, standing), List.of(),
                new ContextMutation(MutationKind.RESOLVE, key, actor, winner.rationale()));
        }

        ResolutionStrategy.Outcome.Escalate escalate = (ResolutionStrategy.Outcome.Escalate) outcome;
        ResolutionDetail detail = new ResolutionDetail(strategy.strategyId(), actor, null,
            prior.value().render(), escalate.rationale(), List.of());
        log.warn("Conflict {} on {} escalated by {}: {}", conflict.conflictId(), key, strategy.strategyId(), escalate.rationale());
        return escalation(conflict, detail);
    }

    private ConflictResolution escalation(ContextConflict conflict, ResolutionDetail detail) {
        return new ConflictResolution(conflict.escalated(detail), Map.of(), List.of(),
            new ContextMutation(MutationKind.ESCALATE, conflict.key(), detail.resolvedBy(), detail.rationale()));
    }
}
