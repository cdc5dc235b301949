package com.contextbus.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * @param decision  categorical outcome, e.g. "High" or a generated title
 * @param score     normalised score in [0, 1]
 * @param details   scorer-specific inputs and derived figures
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScoreDecision(
    @JsonProperty("scorer_id") String scorerId,
    @JsonProperty("scorer_version") String scorerVersion,
    @JsonProperty("decision") String decision,
    @JsonProperty("score") double score,
    @JsonProperty("details") Map<String, Object> details,
    @JsonProperty("rationale") String rationale
) {

    public ScoreDecision {
        score = Math.max(0.0, Math.min(1.0, score));
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
