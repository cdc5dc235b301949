package com.contextbus.agent;

public enum AgentStatus {
    DONE,
    /** Finished with partial findings the pipeline may still use. */
    DEGRADED,
    FAILED
}
