package com.contextbus.scheduler;

/**
 * @param maxAttempts total attempts including the first; at least 1
 */
public record RetryPolicy(int maxAttempts) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
    }

    /** First attempt plus one retry. */
    public static RetryPolicy retryOnce() {
        return new RetryPolicy(2);
    }
}
