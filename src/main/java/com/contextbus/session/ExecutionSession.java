package com.contextbus.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One orchestration run for one job key.
 *
 * @param statusReason why the session reached a terminal status, null while running
 */
public record ExecutionSession(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("job_key") String jobKey,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("status") SessionStatus status,
    @JsonProperty("ended_at") Instant endedAt,
    @JsonProperty("status_reason") String statusReason
) {

    public static ExecutionSession start(String sessionId, String jobKey, Instant startedAt) {
        return new ExecutionSession(sessionId, jobKey, startedAt, SessionStatus.RUNNING, null, null);
    }

    public ExecutionSession terminate(SessionStatus terminal, String reason, Instant at) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        return new ExecutionSession(sessionId, jobKey, startedAt, terminal, at, reason);
    }

    public boolean isRunning() {
        return status == SessionStatus.RUNNING;
    }
}
