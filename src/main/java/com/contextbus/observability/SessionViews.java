package com.contextbus.observability;

import com.contextbus.conflict.ConflictClassification;
import com.contextbus.conflict.ResolutionStatus;
import com.contextbus.context.ContextMutation;
import com.contextbus.scheduler.PhaseState;
import com.contextbus.scheduler.TaskOutcome;
import com.contextbus.session.SessionStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Read-only views served by the observability queries.
 */
public final class SessionViews {

    private SessionViews() {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StatusView(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("job_key") String jobKey,
        @JsonProperty("status") SessionStatus status,
        @JsonProperty("status_reason") String statusReason,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("ended_at") Instant endedAt,
        @JsonProperty("current_phase") String currentPhase,
        @JsonProperty("phases") List<PhaseView> phases,
        @JsonProperty("tasks") List<TaskView> tasks,
        @JsonProperty("degraded_tasks") List<String> degradedTasks,
        @JsonProperty("context_version") long contextVersion,
        @JsonProperty("conflicts") ConflictCounts conflicts,
        @JsonProperty("budget_level") BudgetLevel budgetLevel
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PhaseView(
        @JsonProperty("name") String name,
        @JsonProperty("state") PhaseState state
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TaskView(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("outcome") TaskOutcome outcome,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("findings") int findings,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("note") String note,
        @JsonProperty("rerun") boolean rerun
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ConflictCounts(
        @JsonProperty("total") int total,
        @JsonProperty("resolved") int resolved,
        @JsonProperty("escalated") int escalated,
        @JsonProperty("pending") int pending
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ContextVersionView(
        @JsonProperty("version") long version,
        @JsonProperty("phase") String phase,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("entry_count") int entryCount,
        @JsonProperty("mutations") List<ContextMutation> mutations
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ConflictView(
        @JsonProperty("conflict_id") String conflictId,
        @JsonProperty("key") String key,
        @JsonProperty("phase") String phase,
        @JsonProperty("classification") ConflictClassification classification,
        @JsonProperty("resolution") ResolutionStatus resolution,
        @JsonProperty("competing") List<CompetingEntryView> competing,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("resolved_by") String resolvedBy,
        @JsonProperty("winner_source") String winnerSource,
        @JsonProperty("rationale") String rationale,
        @JsonProperty("retry_tasks") List<String> retryTasks
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CompetingEntryView(
        @JsonProperty("key") String key,
        @JsonProperty("source_task") String sourceTask,
        @JsonProperty("value") String value,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("evidence_refs") List<String> evidenceRefs
    ) {}
}
