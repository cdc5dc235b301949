package com.contextbus.evidence;

import java.util.List;

/**
 * Outcome of validating one claim against the ledger.
 */
public sealed interface GateResult {

    String claim();

    default boolean isApproved() {
        return this instanceof Approved;
    }

    /**
     * @param support             records that justify the claim
     * @param deploymentConfirmed whether deployment evidence also exists
     */
    record Approved(String claim, List<EvidenceRecord> support, boolean deploymentConfirmed) implements GateResult {
        public Approved {
            support = List.copyOf(support);
        }
    }

    record Rejected(String claim, String reason) implements GateResult {}

    record RequiresAlternative(String claim, String suggestion, String reason) implements GateResult {}
}
