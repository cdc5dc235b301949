package com.contextbus.scheduler;

public enum PhaseState {
    PENDING,
    RUNNING,
    COMPLETED,
    BLOCKED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
