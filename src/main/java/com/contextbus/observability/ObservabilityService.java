package com.contextbus.observability;

import com.contextbus.conflict.ContextConflict;
import com.contextbus.conflict.ResolutionDetail;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.ContextStore;
import com.contextbus.scheduler.PipelineRun;
import com.contextbus.scheduler.PipelineRunRepository;
import com.contextbus.scheduler.TaskReport;
import com.contextbus.session.ExecutionRegistry;
import com.contextbus.session.ExecutionSession;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only queries over session state. Nothing here feeds back into execution.
 */
@Service
public class ObservabilityService {

    private final ExecutionRegistry registry;
    private final PipelineRunRepository runs;
    private final ContextStore contextStore;
    private final ContextBudgetMonitor budgetMonitor;

    public ObservabilityService(ExecutionRegistry registry, PipelineRunRepository runs,
                                ContextStore contextStore, ContextBudgetMonitor budgetMonitor) {
        this.registry = registry;
        this.runs = runs;
        this.contextStore = contextStore;
        this.budgetMonitor = budgetMonitor;
    }

    public SessionViews.StatusView status(String sessionId) {
        ExecutionSession session = registry.require(sessionId);
        Optional<PipelineRun> run = runs.find(sessionId);

        List<SessionViews.PhaseView> phases = run
            .map(r -> r.tracker().orderedStates().stream()
                .map(e -> new SessionViews.PhaseView(e.getKey(), e.getValue()))
                .toList())
            .orElse(List.of());
        Set<String> rerun = run.map(PipelineRun::rerunTasks).orElse(Set.of());
        List<TaskReport> reports = run.map(PipelineRun::reports).orElse(List.of());
        List<SessionViews.TaskView> tasks = reports.stream()
            .map(r -> new SessionViews.TaskView(r.taskId(), r.outcome(), r.attempts(), r.findings().size(),
                r.confidence(), r.note(), rerun.contains(r.taskId())))
            .toList();
        List<String> degraded = reports.stream().filter(TaskReport::isDegraded).map(TaskReport::taskId).toList();

        List<ContextSnapshot> history = contextStore.history(sessionId);
        long version = history.isEmpty() ? 0 : history.get(history.size() - 1).version();

        return new SessionViews.StatusView(session.sessionId(), session.jobKey(), session.status(),
            session.statusReason(), session.startedAt(), session.endedAt(),
            run.map(PipelineRun::currentPhase).orElse(null), phases, tasks, degraded, version,
            counts(contextStore.conflicts(sessionId)), budgetMonitor.level(sessionId));
    }

    /** Context versions in order, each with the phase and mutations that produced it. */
    public List<SessionViews.ContextVersionView> contextFlow(String sessionId) {
        registry.require(sessionId);
        return contextStore.history(sessionId).stream()
            .map(s -> new SessionViews.ContextVersionView(s.version(), s.phase(), s.createdAt(), s.size(),
                s.mutations()))
            .toList();
    }

    public List<SessionViews.ConflictView> conflicts(String sessionId) {
        registry.require(sessionId);
        return contextStore.conflicts(sessionId).stream().map(ObservabilityService::toView).toList();
    }

    private static SessionViews.ConflictCounts counts(List<ContextConflict> conflicts) {
        int resolved = 0;
        int escalated = 0;
        int pending = 0;
        for (ContextConflict conflict : conflicts) {
            switch (conflict.resolution()) {
                case RESOLVED -> resolved++;
                case ESCALATED -> escalated++;
                case PENDING -> pending++;
            }
        }
        return new SessionViews.ConflictCounts(conflicts.size(), resolved, escalated, pending);
    }

    private static SessionViews.ConflictView toView(ContextConflict conflict) {
        ResolutionDetail detail = conflict.detail();
        List<SessionViews.CompetingEntryView> competing = conflict.competingEntries().stream()
            .map(e -> new SessionViews.CompetingEntryView(e.key(), e.sourceTask(), e.value().render(),
                e.confidence(), e.evidenceRefs()))
            .toList();
        return new SessionViews.ConflictView(conflict.conflictId(), conflict.key(), conflict.phase(),
            conflict.classification(), conflict.resolution(), competing,
            detail == null ? null : detail.strategyId(),
            detail == null ? null : detail.resolvedBy(),
            detail == null ? null : detail.winnerSource(),
            detail == null ? null : detail.rationale(),
            detail == null ? List.of() : detail.retryTasks());
    }
}
