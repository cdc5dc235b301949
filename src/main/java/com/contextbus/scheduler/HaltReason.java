package com.contextbus.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured reason a session stopped without an artifact.
 *
 * @param phase            phase being executed, null if none had started
 * @param unmetConditions  exactly the conditions that failed: minimum-evidence
 *                         conditions, or the critical keys left escalated
 */
public record HaltReason(
    @JsonProperty("cause") HaltCause cause,
    @JsonProperty("phase") String phase,
    @JsonProperty("unmet_conditions") List<String> unmetConditions,
    @JsonProperty("detail") String detail
) {

    public HaltReason {
        unmetConditions = unmetConditions == null ? List.of() : List.copyOf(unmetConditions);
    }
}
