package com.contextbus.orchestration;

public enum CaveatKind {
    DEGRADED_TASK,
    ESCALATED_CONFLICT,
    SUBSTITUTED_CLAIM,
    DROPPED_CLAIM,
    /** Backed by implementation evidence, but deployment checks did not confirm it. */
    NOT_YET_DEPLOYED
}
