package com.contextbus.orchestration;

import com.contextbus.scheduler.HaltReason;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Terminal result of a session: a full artifact, or a structured reason
 * naming exactly what stopped it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SessionOutcome.Completed.class, name = "completed"),
    @JsonSubTypes.Type(value = SessionOutcome.Halted.class, name = "halted"),
    @JsonSubTypes.Type(value = SessionOutcome.Failed.class, name = "failed")
})
public sealed interface SessionOutcome {

    String sessionId();

    record Completed(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("artifact") Artifact artifact
    ) implements SessionOutcome {}

    /** Stopped by policy: minimum evidence or an escalated critical key. */
    record Halted(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("reason") HaltReason reason
    ) implements SessionOutcome {}

    /** Aborted: lease lost, configuration error or unexpected failure. */
    record Failed(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("reason") HaltReason reason
    ) implements SessionOutcome {}
}
