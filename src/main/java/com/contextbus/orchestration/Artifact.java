package com.contextbus.orchestration;

import com.contextbus.scoring.ScoreDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Final structured output of a completed session. Every claim validated as
 * approved when the artifact was built; whatever was degraded, escalated,
 * substituted or dropped on the way is listed as a caveat.
 */
public record Artifact(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("job_key") String jobKey,
    @JsonProperty("context_version") long contextVersion,
    @JsonProperty("claims") List<ArtifactClaim> claims,
    @JsonProperty("caveats") List<Caveat> caveats,
    @JsonProperty("decisions") List<ScoreDecision> decisions,
    @JsonProperty("created_at") Instant createdAt
) {

    public Artifact {
        claims = List.copyOf(claims);
        caveats = List.copyOf(caveats);
        decisions = List.copyOf(decisions);
    }

    public Optional<ArtifactClaim> claim(String key) {
        return claims.stream().filter(c -> c.claim().equals(key)).findFirst();
    }

    public List<Caveat> caveats(CaveatKind kind) {
        return caveats.stream().filter(c -> c.kind() == kind).toList();
    }
}
