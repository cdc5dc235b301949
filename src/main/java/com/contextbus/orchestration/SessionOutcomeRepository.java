package com.contextbus.orchestration;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Terminal outcomes by session. The first outcome recorded for a session wins.
 */
@Component
public class SessionOutcomeRepository {

    private final ConcurrentHashMap<String, CompletableFuture<SessionOutcome>> outcomes = new ConcurrentHashMap<>();

    public boolean record(SessionOutcome outcome) {
        return slot(outcome.sessionId()).complete(outcome);
    }

    public Optional<SessionOutcome> find(String sessionId) {
        CompletableFuture<SessionOutcome> slot = outcomes.get(sessionId);
        return slot != null && slot.isDone() ? Optional.of(slot.join()) : Optional.empty();
    }

    /** Waits up to {@code timeout} for the outcome; empty if none arrived in time. */
    public Optional<SessionOutcome> await(String sessionId, Duration timeout) throws InterruptedException {
        try {
            return Optional.of(slot(sessionId).get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            return Optional.empty();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("outcome slot of session " + sessionId + " failed", ex.getCause());
        }
    }

    private CompletableFuture<SessionOutcome> slot(String sessionId) {
        return outcomes.computeIfAbsent(sessionId, k -> new CompletableFuture<>());
    }
}
