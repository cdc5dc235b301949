package com.contextbus.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Something that happened in a session, for read-only consumers.
 *
 * @param phase  phase the event belongs to, null for session-level events
 * @param taskId task the event belongs to, null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrchestrationEvent(
    @JsonProperty("event_type") String eventType,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("phase") String phase,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("data") Map<String, Object> data,
    @JsonProperty("timestamp") Instant timestamp
) {

    public static final String SESSION_STARTED = "session.started";
    public static final String SESSION_COMPLETED = "session.completed";
    public static final String SESSION_HALTED = "session.halted";
    public static final String SESSION_FAILED = "session.failed";
    public static final String PHASE_STARTED = "phase.started";
    public static final String PHASE_COMPLETED = "phase.completed";
    public static final String PHASE_FAILED = "phase.failed";
    public static final String TASK_FINISHED = "task.finished";
    public static final String TASK_RERUN = "task.rerun";
    public static final String CONFLICT_RESOLVED = "conflict.resolved";
    public static final String CONFLICT_ESCALATED = "conflict.escalated";
    public static final String CONTEXT_PUBLISHED = "context.published";
    public static final String BUDGET_ALERT = "budget.alert";

    public OrchestrationEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static OrchestrationEvent session(String eventType, String sessionId, Map<String, Object> data) {
        return new OrchestrationEvent(eventType, sessionId, null, null, data, Instant.now());
    }

    public static OrchestrationEvent phase(String eventType, String sessionId, String phase, Map<String, Object> data) {
        return new OrchestrationEvent(eventType, sessionId, phase, null, data, Instant.now());
    }

    public static OrchestrationEvent task(String eventType, String sessionId, String phase, String taskId,
                                          Map<String, Object> data) {
        return new OrchestrationEvent(eventType, sessionId, phase, taskId, data, Instant.now());
    }
}
