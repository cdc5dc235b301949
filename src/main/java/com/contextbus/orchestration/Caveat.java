package com.contextbus.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param subject task id, conflict key or claim the caveat is about
 */
public record Caveat(
    @JsonProperty("kind") CaveatKind kind,
    @JsonProperty("subject") String subject,
    @JsonProperty("message") String message
) {}
