package com.contextbus.scheduler;

import com.contextbus.conflict.ConflictResolution;
import com.contextbus.conflict.ConflictResolver;
import com.contextbus.conflict.ContextConflict;
import com.contextbus.conflict.ResolutionStatus;
import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.ContextStore;
import com.contextbus.context.MergeResult;
import com.contextbus.context.SemanticKeys;
import com.contextbus.evidence.EvidenceLedger;
import com.contextbus.evidence.EvidenceRecord;
import com.contextbus.logging.MdcContext;
import com.contextbus.observability.OrchestrationEvent;
import com.contextbus.observability.OrchestrationEventBus;
import com.contextbus.session.ExecutionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Top-level coordinator: runs the phases of a session strictly in graph
 * order and turns each phase's task reports into the next published
 * context version.
 *
 * Per phase:
 * <ol>
 *   <li>start the phase (refused unless every dependency completed)</li>
 *   <li>run all tasks concurrently against the latest published snapshot</li>
 *   <li>renew the lease; a lost lease aborts before anything is written</li>
 *   <li>record evidence, merge findings in task declaration order</li>
 *   <li>resolve every conflict the merge raised</li>
 *   <li>re-run, once, tasks a type-mismatch resolution flagged, on the corrected snapshot</li>
 *   <li>halt on escalated critical keys or an unmet minimum-evidence policy</li>
 *   <li>publish the snapshot and complete the phase</li>
 * </ol>
 */
public class PhaseScheduler {

    private static final Logger log = LoggerFactory.getLogger(PhaseScheduler.class);

    private final PhaseGraph graph;
    private final TaskRunner taskRunner;
    private final ContextStore contextStore;
    private final EvidenceLedger ledger;
    private final ConflictResolver resolver;
    private final ExecutionRegistry registry;
    private final OrchestrationEventBus events;
    private final MinimumEvidencePolicy minimumEvidence;
    private final Set<String> criticalKeys;

    public PhaseScheduler(PhaseGraph graph, TaskRunner taskRunner, ContextStore contextStore,
                          EvidenceLedger ledger, ConflictResolver resolver, ExecutionRegistry registry,
                          OrchestrationEventBus events, MinimumEvidencePolicy minimumEvidence,
                          Collection<String> criticalKeys) {
        this.graph = graph;
        this.taskRunner = taskRunner;
        this.contextStore = contextStore;
        this.ledger = ledger;
        this.resolver = resolver;
        this.registry = registry;
        this.events = events;
        this.minimumEvidence = minimumEvidence;
        this.criticalKeys = criticalKeys.stream().map(SemanticKeys::canonical).collect(Collectors.toUnmodifiableSet());
    }

    public PhaseGraph graph() {
        return graph;
    }

    public PipelineRun newRun(String sessionId, String jobKey) {
        return new PipelineRun(sessionId, jobKey, new PhaseTracker(sessionId, graph));
    }

    /**
     * Runs every phase of {@code run}. Lease loss and phase-order violations
     * propagate as exceptions; everything else ends in a result.
     */
    public PipelineResult execute(PipelineRun run) {
        String sessionId = run.sessionId();
        for (Phase phase : graph.executionOrder()) {
            MdcContext.setPhase(sessionId, phase.name());
            try {
                Optional<HaltReason> halt = runPhase(run, phase);
                if (halt.isPresent()) {
                    return new PipelineResult.Halted(halt.get(), contextStore.latest(sessionId));
                }
            } finally {
                MdcContext.clearPhase();
            }
        }
        return new PipelineResult.Completed(contextStore.latest(sessionId));
    }

    private Optional<HaltReason> runPhase(PipelineRun run, Phase phase) {
        String sessionId = run.sessionId();
        registry.heartbeat(sessionId);
        run.tracker().start(phase.name());
        run.enterPhase(phase.name());
        events.publish(OrchestrationEvent.phase(OrchestrationEvent.PHASE_STARTED, sessionId, phase.name(),
            Map.of("tasks", phase.tasks().size())));
        log.info("Phase {} started with {} task(s)", phase.name(), phase.tasks().size());

        ContextSnapshot input = contextStore.latest(sessionId);
        List<TaskReport> reports = taskRunner.run(sessionId, run.jobKey(), phase.tasks(), input,
            () -> registry.heartbeat(sessionId));
        registry.heartbeat(sessionId);

        List<ContextConflict> escalated = new ArrayList<>();
        Set<String> flagged = integrate(run, phase, reports, escalated);

        if (!flagged.isEmpty()) {
            List<TaskSpec> rerun = phase.tasks().stream().filter(t -> flagged.contains(t.taskId())).toList();
            log.info("Re-running {} task(s) of phase {} on corrected context v{}: {}",
                rerun.size(), phase.name(), contextStore.latest(sessionId).version(), flagged);
            for (TaskSpec spec : rerun) {
                run.markRerun(spec.taskId());
                events.publish(OrchestrationEvent.task(OrchestrationEvent.TASK_RERUN, sessionId, phase.name(),
                    spec.taskId(), Map.of()));
            }
            List<TaskReport> second = taskRunner.run(sessionId, run.jobKey(), rerun,
                contextStore.latest(sessionId), () -> registry.heartbeat(sessionId));
            registry.heartbeat(sessionId);
            integrate(run, phase, second, escalated);
        }

        List<String> criticalEscalations = escalated.stream()
            .map(ContextConflict::key)
            .filter(key -> criticalKeys.contains(SemanticKeys.canonical(key)))
            .distinct()
            .sorted()
            .toList();
        if (!criticalEscalations.isEmpty()) {
            return Optional.of(halt(run, phase, new HaltReason(HaltCause.CRITICAL_CONFLICT_ESCALATED, phase.name(),
                criticalEscalations, "conflicts on critical keys could not be resolved")));
        }

        if (minimumEvidence.appliesTo(phase, graph)) {
            List<EvidenceCondition> unmet = minimumEvidence.unmet(run.reportsFor(phase.name()));
            if (minimumEvidence.isViolated(unmet)) {
                List<String> names = unmet.stream().map(Enum::name).toList();
                String detail = unmet.stream().map(EvidenceCondition::unmetDescription)
                    .collect(Collectors.joining(", "));
                return Optional.of(halt(run, phase,
                    new HaltReason(HaltCause.MINIMUM_EVIDENCE_UNMET, phase.name(), names, detail)));
            }
            if (!unmet.isEmpty()) {
                log.info("Minimum evidence satisfied after phase {} despite {}", phase.name(), unmet);
            }
        }

        ContextSnapshot published = contextStore.publish(sessionId, phase.name());
        run.tracker().complete(phase.name());
        events.publish(OrchestrationEvent.phase(OrchestrationEvent.CONTEXT_PUBLISHED, sessionId, phase.name(),
            Map.of("version", published.version(), "entries", published.size(), "footprint", published.footprint())));
        events.publish(OrchestrationEvent.phase(OrchestrationEvent.PHASE_COMPLETED, sessionId, phase.name(),
            Map.of("version", published.version(), "escalated", escalated.size())));
        log.info("Phase {} completed at context v{}", phase.name(), published.version());
        return Optional.empty();
    }

    /**
     * Records reports and evidence, merges the findings and resolves the
     * resulting conflicts. Returns the tasks of {@code phase} flagged for a re-run.
     */
    private Set<String> integrate(PipelineRun run, Phase phase, List<TaskReport> reports,
                                  List<ContextConflict> escalated) {
        String sessionId = run.sessionId();
        List<ContextEntry> contributions = new ArrayList<>();
        for (TaskReport report : reports) {
            run.record(report);
            for (EvidenceRecord evidence : report.evidence()) {
                ledger.record(sessionId, evidence);
            }
            contributions.addAll(report.findings());
            events.publish(OrchestrationEvent.task(OrchestrationEvent.TASK_FINISHED, sessionId, phase.name(),
                report.taskId(), taskData(report)));
        }

        MergeResult merged = contextStore.merge(sessionId, phase.name(), contributions);
        Set<String> flagged = new LinkedHashSet<>();
        for (ContextConflict conflict : merged.conflicts()) {
            List<ConflictResolution> resolutions = resolver.resolve(sessionId, contextStore.latest(sessionId), conflict);
            for (ConflictResolution resolution : resolutions) {
                contextStore.apply(sessionId, phase.name(), resolution);
                ContextConflict outcome = resolution.conflict();
                if (outcome.resolution() == ResolutionStatus.ESCALATED) {
                    escalated.add(outcome);
                }
                resolution.retryTasks().stream().filter(phase::hasTask).forEach(flagged::add);
                events.publish(OrchestrationEvent.phase(
                    outcome.resolution() == ResolutionStatus.ESCALATED
                        ? OrchestrationEvent.CONFLICT_ESCALATED
                        : OrchestrationEvent.CONFLICT_RESOLVED,
                    sessionId, phase.name(),
                    Map.of("conflict_id", outcome.conflictId(), "key", outcome.key(),
                        "classification", outcome.classification().name())));
            }
        }
        return flagged;
    }

    private HaltReason halt(PipelineRun run, Phase phase, HaltReason reason) {
        run.tracker().fail(phase.name(), reason.detail());
        events.publish(OrchestrationEvent.phase(OrchestrationEvent.PHASE_FAILED, run.sessionId(), phase.name(),
            Map.of("cause", reason.cause().name(), "unmet_conditions", reason.unmetConditions())));
        log.warn("Phase {} failed, halting session: {} {}", phase.name(), reason.cause(), reason.unmetConditions());
        return reason;
    }

    private static Map<String, Object> taskData(TaskReport report) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("outcome", report.outcome().name());
        data.put("attempts", report.attempts());
        data.put("findings", report.findings().size());
        data.put("confidence", report.confidence());
        if (report.note() != null) {
            data.put("note", report.note());
        }
        return data;
    }
}
