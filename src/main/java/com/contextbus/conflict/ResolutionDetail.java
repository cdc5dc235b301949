package com.contextbus.conflict;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Provenance of a conflict resolution.
 *
 * @param strategyId   strategy that produced the outcome
 * @param resolvedBy   actor recorded on the context mutation
 * @param winnerSource source task whose value stands, null when escalated
 * @param winningValue rendered value that stands (provisional when escalated)
 * @param rationale    why the outcome was reached
 * @param retryTasks   losing tasks flagged for a re-run on the corrected snapshot
 */
public record ResolutionDetail(
    @JsonProperty("strategy_id") String strategyId,
    @JsonProperty("resolved_by") String resolvedBy,
    @JsonProperty("winner_source") String winnerSource,
    @JsonProperty("winning_value") String winningValue,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("retry_tasks") List<String> retryTasks
) {
    public ResolutionDetail {
        retryTasks = retryTasks == null ? List.of() : List.copyOf(retryTasks);
    }
}
