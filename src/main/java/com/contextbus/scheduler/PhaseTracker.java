package com.contextbus.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-session phase state machine: {@code PENDING -> RUNNING -> COMPLETED|FAILED},
 * with {@code BLOCKED} recorded when a start is refused because a
 * dependency has not completed. There is no way to force a start.
 */
public class PhaseTracker {

    private static final Logger log = LoggerFactory.getLogger(PhaseTracker.class);

    private final String sessionId;
    private final PhaseGraph graph;
    private final Map<String, PhaseState> states = new LinkedHashMap<>();
    private final List<Transition> transitions = new ArrayList<>();

    public PhaseTracker(String sessionId, PhaseGraph graph) {
        this.sessionId = sessionId;
        this.graph = graph;
        for (Phase phase : graph.executionOrder()) {
            states.put(phase.name(), PhaseState.PENDING);
        }
    }

    /**
     * Moves {@code phaseName} to RUNNING.
     *
     * @throws PhaseOrderViolationException if a dependency is not COMPLETED
     *         (the phase is then BLOCKED) or the phase is not startable
     */
    public synchronized void start(String phaseName) {
        Phase phase = graph.phase(phaseName)
            .orElseThrow(() -> new PhaseOrderViolationException("unknown phase '" + phaseName + "'"));
        PhaseState current = states.get(phaseName);
        if (current != PhaseState.PENDING && current != PhaseState.BLOCKED) {
            throw new PhaseOrderViolationException("phase '" + phaseName + "' cannot start from " + current);
        }

        List<String> unmet = phase.dependsOn().stream()
            .filter(dep -> states.get(dep) != PhaseState.COMPLETED)
            .sorted()
            .toList();
        if (!unmet.isEmpty()) {
            move(phaseName, PhaseState.BLOCKED, "waiting on " + unmet);
            log.warn("Refused to start phase {} of session={}: dependencies {} not completed",
                phaseName, sessionId, unmet);
            throw new PhaseOrderViolationException(
                "phase '" + phaseName + "' started before dependencies " + unmet + " completed");
        }
        move(phaseName, PhaseState.RUNNING, null);
    }

    public synchronized void complete(String phaseName) {
        requireRunning(phaseName);
        move(phaseName, PhaseState.COMPLETED, null);
    }

    public synchronized void fail(String phaseName, String reason) {
        requireRunning(phaseName);
        move(phaseName, PhaseState.FAILED, reason);
    }

    public synchronized PhaseState state(String phaseName) {
        PhaseState state = states.get(phaseName);
        if (state == null) {
            throw new IllegalArgumentException("unknown phase '" + phaseName + "'");
        }
        return state;
    }

    /** States in execution order. */
    public synchronized List<Map.Entry<String, PhaseState>> orderedStates() {
        return states.entrySet().stream().map(e -> Map.entry(e.getKey(), e.getValue())).toList();
    }

    public synchronized List<Transition> transitions() {
        return List.copyOf(transitions);
    }

    private void requireRunning(String phaseName) {
        if (states.get(phaseName) != PhaseState.RUNNING) {
            throw new PhaseOrderViolationException(
                "phase '" + phaseName + "' is " + states.get(phaseName) + ", not RUNNING");
        }
    }

    private void move(String phaseName, PhaseState to, String note) {
        PhaseState from = states.put(phaseName, to);
        transitions.add(new Transition(phaseName, from, to, note, Instant.now()));
        log.debug("Phase {} of session={}: {} -> {}", phaseName, sessionId, from, to);
    }

    public record Transition(String phase, PhaseState from, PhaseState to, String note, Instant at) {}
}
