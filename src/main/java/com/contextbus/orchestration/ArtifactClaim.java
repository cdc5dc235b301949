package com.contextbus.orchestration;

import com.contextbus.context.ContextValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A claim that passed the validation gate.
 *
 * @param evidenceIds         implementation or pattern records supporting it
 * @param deploymentConfirmed deployment evidence exists as well
 * @param substitutedFor      claim this one replaced, null if none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtifactClaim(
    @JsonProperty("claim") String claim,
    @JsonProperty("value") ContextValue value,
    @JsonProperty("source_task") String sourceTask,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("evidence_ids") List<String> evidenceIds,
    @JsonProperty("deployment_confirmed") boolean deploymentConfirmed,
    @JsonProperty("substituted_for") String substitutedFor
) {

    public ArtifactClaim {
        evidenceIds = List.copyOf(evidenceIds);
    }
}
