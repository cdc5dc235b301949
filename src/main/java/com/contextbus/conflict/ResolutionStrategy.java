package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.evidence.EvidenceLedger;

/**
 * A deterministic rule that settles one class of value conflicts.
 * Given identical entries and configuration it must return identical outcomes.
 */
public interface ResolutionStrategy {

    /** Unique strategy identifier, e.g. "source-priority". */
    String strategyId();

    /** Strategy version, e.g. "v1". */
    String strategyVersion();

    ConflictClassification handles();

    /**
     * @param key      semantic key under dispute
     * @param prior    entry currently in the snapshot
     * @param incoming competing entry
     */
    Outcome resolve(String key, ContextEntry prior, ContextEntry incoming, Inputs inputs);

    /**
     * Read-only inputs a strategy may consult.
     */
    record Inputs(String sessionId, ContextSnapshot snapshot, EvidenceLedger ledger) {}

    sealed interface Outcome {
        /**
         * @param retryLoser whether the losing task should be re-run on the corrected snapshot
         */
        record Winner(ContextEntry winner, ContextEntry loser, String rationale, boolean retryLoser) implements Outcome {}

        record Escalate(String rationale) implements Outcome {}
    }
}
