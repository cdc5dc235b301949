package com.contextbus.session;

import com.contextbus.config.ContextBusProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Guarantees at most one active session per job key and owns the session
 * lifecycle.
 *
 * A session holds a lease on its job key. While the session waits for a
 * pipeline thread the lease cannot expire; {@link #begin} starts its
 * {@code leaseTimeout} clock and the running pipeline renews it with
 * heartbeats. A started lease that is not renewed
 * in time is reclaimed, either by the next acquire for the same key or by
 * the periodic sweep, and the session is failed. Reclaim listeners are the
 * only path to forced cancellation of a running pipeline.
 */
@Service
public class ExecutionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRegistry.class);

    static final String LEASE_EXPIRED_REASON = "lease expired";

    private final LeaseStore leaseStore;
    private final Clock clock;
    private final Duration leaseTimeout;
    private final ConcurrentHashMap<String, ExecutionSession> sessions = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<ExecutionSession>> reclaimListeners = new CopyOnWriteArrayList<>();

    @Autowired
    public ExecutionRegistry(LeaseStore leaseStore, Clock clock, ContextBusProperties properties) {
        this(leaseStore, clock, properties.getLease().getTimeout());
    }

    public ExecutionRegistry(LeaseStore leaseStore, Clock clock, Duration leaseTimeout) {
        this.leaseStore = leaseStore;
        this.clock = clock;
        this.leaseTimeout = leaseTimeout;
    }

    /**
     * Starts a session for {@code jobKey}.
     *
     * @throws AlreadyRunningException if an unexpired session holds the key
     */
    public ExecutionSession acquire(String jobKey) {
        Instant now = clock.instant();
        String sessionId = "ses-" + UUID.randomUUID();
        LeaseRecord candidate = LeaseRecord.queued(jobKey, sessionId, now);

        LeaseStore.AcquireResult result = leaseStore.acquire(candidate, now);
        if (result.reclaimed() != null) {
            expire(result.reclaimed().sessionId());
        }
        if (!result.acquired()) {
            log.info("Rejected acquire for job={}: session {} is active", jobKey, result.holder().sessionId());
            throw new AlreadyRunningException(jobKey, result.holder().sessionId());
        }

        ExecutionSession session = ExecutionSession.start(sessionId, jobKey, now);
        sessions.put(sessionId, session);
        log.info("Acquired session={} for job={}", sessionId, jobKey);
        return session;
    }

    /**
     * Marks the session's pipeline as running and starts its lease clock.
     *
     * @throws LeaseExpiredException if the session ended while queued
     */
    public void begin(String sessionId) {
        heartbeat(sessionId);
        log.debug("Session={} started; lease renewed for {}", sessionId, leaseTimeout);
    }

    /**
     * Renews the session's lease.
     *
     * @throws LeaseExpiredException if the lease was lost; the session is failed
     */
    public void heartbeat(String sessionId) {
        ExecutionSession session = require(sessionId);
        Instant now = clock.instant();
        if (!session.isRunning() || !leaseStore.renew(session.jobKey(), sessionId, now.plus(leaseTimeout), now)) {
            leaseStore.reclaimIfExpired(session.jobKey(), now);
            expire(sessionId);
            throw new LeaseExpiredException(sessionId);
        }
    }

    /**
     * Checks the session still holds an unexpired lease without renewing it.
     *
     * @throws LeaseExpiredException otherwise
     */
    public void assertActive(String sessionId) {
        ExecutionSession session = require(sessionId);
        Instant now = clock.instant();
        boolean held = session.isRunning() && leaseStore.find(session.jobKey())
            .filter(lease -> lease.sessionId().equals(sessionId))
            .filter(lease -> !lease.isExpired(now))
            .isPresent();
        if (!held) {
            expire(sessionId);
            throw new LeaseExpiredException(sessionId);
        }
    }

    /**
     * Moves a running session to a terminal status and frees its job key.
     * A session that already ended keeps its first terminal status.
     */
    public ExecutionSession release(String sessionId, SessionStatus terminal, String reason) {
        ExecutionSession ended = sessions.computeIfPresent(sessionId, (id, current) ->
            current.isRunning() ? current.terminate(terminal, reason, clock.instant()) : current);
        if (ended == null) {
            throw new UnknownSessionException(sessionId);
        }
        if (leaseStore.release(ended.jobKey(), sessionId)) {
            log.info("Released session={} job={} status={}", sessionId, ended.jobKey(), ended.status());
        }
        return ended;
    }

    /** Sweeps expired leases so crashed or stuck runs free their job keys. */
    @Scheduled(fixedDelayString = "${contextbus.lease.sweep-interval:PT5S}")
    public void reclaimExpired() {
        Instant now = clock.instant();
        for (LeaseRecord lease : leaseStore.all()) {
            leaseStore.reclaimIfExpired(lease.jobKey(), now)
                .ifPresent(reclaimed -> expire(reclaimed.sessionId()));
        }
    }

    public void onLeaseReclaimed(Consumer<ExecutionSession> listener) {
        reclaimListeners.add(listener);
    }

    public Optional<ExecutionSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public ExecutionSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
    }

    private void expire(String sessionId) {
        ExecutionSession before = sessions.get(sessionId);
        if (before == null || !before.isRunning()) {
            return;
        }
        ExecutionSession failed = sessions.computeIfPresent(sessionId, (id, current) ->
            current.isRunning() ? current.terminate(SessionStatus.FAILED, LEASE_EXPIRED_REASON, clock.instant()) : current);
        log.warn("Lease of session={} job={} expired; session reclaimed", sessionId, before.jobKey());
        for (Consumer<ExecutionSession> listener : reclaimListeners) {
            try {
                listener.accept(failed);
            } catch (Exception ex) {
                log.warn("Reclaim listener failed for session={}: {}", sessionId, ex.getMessage());
            }
        }
    }
}
