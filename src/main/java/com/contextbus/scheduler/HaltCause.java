package com.contextbus.scheduler;

public enum HaltCause {
    MINIMUM_EVIDENCE_UNMET,
    CRITICAL_CONFLICT_ESCALATED,
    LEASE_EXPIRED,
    PHASE_ORDER_VIOLATION,
    INTERNAL_ERROR
}
