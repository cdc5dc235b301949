package com.contextbus.orchestration;

import com.contextbus.scheduler.HaltReason;

/**
 * Receives finished artifacts. Implementations are called on the session
 * thread after the session is released; exceptions are logged and ignored.
 */
public interface ArtifactSink {

    void onArtifact(String sessionId, Artifact artifact);

    default void onHalt(String sessionId, HaltReason reason) {
    }
}
