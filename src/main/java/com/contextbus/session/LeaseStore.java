package com.contextbus.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface LeaseStore {

    /**
     * Atomically installs {@code candidate} unless an unexpired lease holds
     * its job key. An expired holder is reclaimed and reported.
     */
    AcquireResult acquire(LeaseRecord candidate, Instant now);

    /** Extends the lease if {@code sessionId} still holds it and it has not expired. */
    boolean renew(String jobKey, String sessionId, Instant newExpiry, Instant now);

    /** Removes the lease if {@code sessionId} holds it. */
    boolean release(String jobKey, String sessionId);

    /** Removes the lease if it is expired, returning the removed record. */
    Optional<LeaseRecord> reclaimIfExpired(String jobKey, Instant now);

    Optional<LeaseRecord> find(String jobKey);

    List<LeaseRecord> all();

    /**
     * @param holder    lease in force after the call
     * @param reclaimed expired lease replaced by the candidate, null if none
     */
    record AcquireResult(boolean acquired, LeaseRecord holder, LeaseRecord reclaimed) {}
}
