package com.contextbus.scheduler;

/**
 * How a task ended from the scheduler's point of view. Both outcomes count
 * as done for phase completion.
 */
public enum TaskOutcome {
    DONE,
    DEGRADED
}
