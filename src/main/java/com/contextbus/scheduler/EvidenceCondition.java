package com.contextbus.scheduler;

/**
 * Conditions of the minimum-evidence policy. A session halts only when all
 * of them are unmet after the checked phase.
 */
public enum EvidenceCondition {
    IMPLEMENTATION_EVIDENCE("no implementation evidence"),
    DESCRIPTIVE_FINDINGS("no descriptive findings"),
    RELATED_TASK_EVIDENCE("no related-task evidence");

    private final String unmetDescription;

    EvidenceCondition(String unmetDescription) {
        this.unmetDescription = unmetDescription;
    }

    public String unmetDescription() {
        return unmetDescription;
    }
}
