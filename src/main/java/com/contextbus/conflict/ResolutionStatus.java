package com.contextbus.conflict;

public enum ResolutionStatus {
    PENDING,
    RESOLVED,
    ESCALATED
}
