package com.contextbus.context;

import com.contextbus.conflict.ConflictResolution;
import com.contextbus.conflict.ContextConflict;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only, versioned context per session.
 *
 * Writes for one session are serialized. Readers get immutable snapshots;
 * {@link #snapshot(String, String)} only returns what a phase published,
 * never a phase in the middle of merging.
 */
public interface ContextStore {

    /** Creates the session's version-0 snapshot from foundation entries. */
    ContextSnapshot open(String sessionId, List<ContextEntry> foundation);

    MergeResult merge(String sessionId, String phase, List<ContextEntry> contributions);

    ContextSnapshot apply(String sessionId, String phase, ConflictResolution resolution);

    /**
     * Publishes the working snapshot as the view of {@code phase}.
     *
     * @throws IllegalStateException if any conflict of the session is still pending
     */
    ContextSnapshot publish(String sessionId, String phase);

    Optional<ContextSnapshot> snapshot(String sessionId, String asOfPhase);

    ContextSnapshot latest(String sessionId);

    List<ContextSnapshot> history(String sessionId);

    List<ContextConflict> conflicts(String sessionId);

    /** Posts findings of a finished task for still-running tasks of the phase. */
    void postInterim(String sessionId, String taskId, List<ContextEntry> entries);

    /** Non-blocking read of interim findings, keyed by task id. */
    Map<String, List<ContextEntry>> pollInterim(String sessionId);

    /** Closes the session's context; later writes are rejected. */
    void close(String sessionId);

    boolean isOpen(String sessionId);
}
