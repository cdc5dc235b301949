package com.contextbus.session;

import java.time.Instant;

/**
 * Lock record guarding one job key.
 *
 * A lease taken for a queued session has no expiry; its clock starts with
 * the first renewal, when the pipeline begins. From then on it is valid
 * until {@code expiresAt} unless renewed by a heartbeat.
 */
public record LeaseRecord(String jobKey, String sessionId, Instant acquiredAt, Instant startedAt, Instant expiresAt) {

    public static LeaseRecord queued(String jobKey, String sessionId, Instant now) {
        return new LeaseRecord(jobKey, sessionId, now, null, null);
    }

    public boolean isStarted() {
        return startedAt != null;
    }

    public boolean isExpired(Instant now) {
        return isStarted() && !now.isBefore(expiresAt);
    }

    public LeaseRecord renewedUntil(Instant now, Instant newExpiry) {
        return new LeaseRecord(jobKey, sessionId, acquiredAt, isStarted() ? startedAt : now, newExpiry);
    }
}
