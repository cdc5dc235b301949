package com.contextbus.scheduler;

import java.time.Duration;
import java.util.Objects;

/**
 * One investigator run inside a phase. Immutable and shared by reference.
 */
public record TaskSpec(String agentKind, String phase, Duration timeout, RetryPolicy retryPolicy) {

    public TaskSpec {
        Objects.requireNonNull(agentKind, "agentKind");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("task timeout must be positive: " + agentKind);
        }
        retryPolicy = retryPolicy == null ? RetryPolicy.retryOnce() : retryPolicy;
    }

    public static TaskSpec of(String agentKind, String phase, Duration timeout) {
        return new TaskSpec(agentKind, phase, timeout, RetryPolicy.retryOnce());
    }

    /** {@code phase/agentKind}, the source label of the task's findings. */
    public String taskId() {
        return phase + "/" + agentKind;
    }
}
