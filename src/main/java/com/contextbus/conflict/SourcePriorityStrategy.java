package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;

/**
 * Settles type mismatches by source authority.
 *
 * The higher-ranked source in the priority table wins. When neither side
 * is ranked above the other, the value that fits the key's schema wins.
 * Otherwise the conflict is escalated. The loser is flagged for a re-run.
 */
public class SourcePriorityStrategy implements ResolutionStrategy {

    private final SourcePriorityTable priorities;
    private final KeySchemaTable schemas;

    public SourcePriorityStrategy(SourcePriorityTable priorities, KeySchemaTable schemas) {
        this.priorities = priorities;
        this.schemas = schemas;
    }

    @Override
    public String strategyId() {
        return "source-priority";
    }

    @Override
    public String strategyVersion() {
        return "v1";
    }

    @Override
    public ConflictClassification handles() {
        return ConflictClassification.TYPE_MISMATCH;
    }

    @Override
    public Outcome resolve(String key, ContextEntry prior, ContextEntry incoming, Inputs inputs) {
        int priorRank = priorities.rank(key, prior);
        int incomingRank = priorities.rank(key, incoming);
        if (priorRank != incomingRank) {
            boolean priorWins = priorRank < incomingRank;
            ContextEntry winner = priorWins ? prior : incoming;
            ContextEntry loser = priorWins ? incoming : prior;
            return new Outcome.Winner(winner, loser,
                "source " + winner.sourceTask() + " is authoritative for " + key
                    + " over " + loser.sourceTask(), true);
        }

        boolean priorFits = schemas.conforms(key, prior.value());
        boolean incomingFits = schemas.conforms(key, incoming.value());
        if (priorFits != incomingFits) {
            ContextEntry winner = priorFits ? prior : incoming;
            ContextEntry loser = priorFits ? incoming : prior;
            return new Outcome.Winner(winner, loser,
                "value '" + winner.value().render() + "' matches the schema for " + key
                    + ", '" + loser.value().render() + "' does not", true);
        }

        return new Outcome.Escalate("no authoritative source declared for " + key
            + " between " + prior.sourceTask() + " and " + incoming.sourceTask());
    }
}
