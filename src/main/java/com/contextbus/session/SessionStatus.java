package com.contextbus.session;

public enum SessionStatus {
    RUNNING,
    COMPLETED,
    HALTED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
