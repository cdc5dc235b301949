package com.contextbus.orchestration;

import com.contextbus.agent.AgentRegistry;
import com.contextbus.agent.UnknownAgentException;
import com.contextbus.context.ClosedContextException;
import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextStore;
import com.contextbus.context.ContextValue;
import com.contextbus.context.SemanticKeys;
import com.contextbus.logging.MdcContext;
import com.contextbus.observability.OrchestrationEvent;
import com.contextbus.observability.OrchestrationEventBus;
import com.contextbus.scheduler.HaltCause;
import com.contextbus.scheduler.HaltReason;
import com.contextbus.scheduler.Phase;
import com.contextbus.scheduler.PhaseOrderViolationException;
import com.contextbus.scheduler.PhaseScheduler;
import com.contextbus.scheduler.PipelineResult;
import com.contextbus.scheduler.PipelineRun;
import com.contextbus.scheduler.PipelineRunRepository;
import com.contextbus.scheduler.TaskSpec;
import com.contextbus.session.ExecutionRegistry;
import com.contextbus.session.ExecutionSession;
import com.contextbus.session.LeaseExpiredException;
import com.contextbus.session.SessionStatus;
import com.contextbus.session.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;

/**
 * Job submission and session lifecycle.
 *
 * {@link #submit} acquires the job key, seeds the foundation snapshot from
 * the submitted parameters and hands the pipeline to the session executor.
 * The session ends with exactly one {@link SessionOutcome}. A reclaimed
 * lease closes the session's context and interrupts its pipeline; nothing
 * it was still merging is kept.
 */
@Service
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    /** Namespace for submitted parameters given without one. */
    public static final String FOUNDATION_NAMESPACE = "job";

    private final ExecutionRegistry registry;
    private final ContextStore contextStore;
    private final PhaseScheduler scheduler;
    private final PipelineRunRepository runs;
    private final ArtifactAssembler assembler;
    private final SessionOutcomeRepository outcomes;
    private final List<ArtifactSink> sinks;
    private final OrchestrationEventBus events;
    private final AgentRegistry agents;
    private final Executor sessionExecutor;
    private final ConcurrentHashMap<String, Future<?>> running = new ConcurrentHashMap<>();

    @Autowired
    public OrchestrationService(ExecutionRegistry registry, ContextStore contextStore, PhaseScheduler scheduler,
                                PipelineRunRepository runs, ArtifactAssembler assembler,
                                SessionOutcomeRepository outcomes, ObjectProvider<ArtifactSink> sinks,
                                OrchestrationEventBus events, AgentRegistry agents,
                                @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this(registry, contextStore, scheduler, runs, assembler, outcomes, sinks.orderedStream().toList(),
            events, agents, sessionExecutor);
    }

    public OrchestrationService(ExecutionRegistry registry, ContextStore contextStore, PhaseScheduler scheduler,
                                PipelineRunRepository runs, ArtifactAssembler assembler,
                                SessionOutcomeRepository outcomes, List<ArtifactSink> sinks,
                                OrchestrationEventBus events, AgentRegistry agents, Executor sessionExecutor) {
        this.registry = registry;
        this.contextStore = contextStore;
        this.scheduler = scheduler;
        this.runs = runs;
        this.assembler = assembler;
        this.outcomes = outcomes;
        this.sinks = List.copyOf(sinks);
        this.events = events;
        this.agents = agents;
        this.sessionExecutor = sessionExecutor;
        registry.onLeaseReclaimed(this::onLeaseReclaimed);
    }

    /**
     * Starts a session for {@code jobKey}.
     *
     * @throws InvalidSubmissionException             on a blank job key or parameter name
     * @throws com.contextbus.session.AlreadyRunningException if the job key is running
     */
    public ExecutionSession submit(String jobKey, Map<String, Object> initialParameters) {
        if (jobKey == null || jobKey.isBlank()) {
            throw new InvalidSubmissionException("job_key is required");
        }
        List<ContextEntry> foundation = foundation(jobKey, initialParameters == null ? Map.of() : initialParameters);
        checkConfiguration();

        ExecutionSession session = registry.acquire(jobKey);
        String sessionId = session.sessionId();
        contextStore.open(sessionId, foundation);
        PipelineRun run = scheduler.newRun(sessionId, jobKey);
        runs.register(run);
        events.publish(OrchestrationEvent.session(OrchestrationEvent.SESSION_STARTED, sessionId,
            Map.of("job_key", jobKey, "foundation_entries", foundation.size())));

        FutureTask<Void> pipeline = new FutureTask<>(() -> runPipeline(session, run), null);
        running.put(sessionId, pipeline);
        try {
            sessionExecutor.execute(pipeline);
        } catch (RejectedExecutionException ex) {
            running.remove(sessionId);
            contextStore.close(sessionId);
            registry.release(sessionId, SessionStatus.FAILED, "not accepted for execution");
            throw ex;
        }
        log.info("Submitted job={} as session={}", jobKey, sessionId);
        return session;
    }

    public Optional<SessionOutcome> outcome(String sessionId) {
        registry.require(sessionId);
        return outcomes.find(sessionId);
    }

    /** Blocks up to {@code timeout} for the session to end. */
    public Optional<SessionOutcome> awaitOutcome(String sessionId, Duration timeout) throws InterruptedException {
        registry.require(sessionId);
        return outcomes.await(sessionId, timeout);
    }

    private List<ContextEntry> foundation(String jobKey, Map<String, Object> parameters) {
        TreeMap<String, ContextEntry> entries = new TreeMap<>();
        entries.put(FOUNDATION_NAMESPACE + ".jobKey", seed(FOUNDATION_NAMESPACE + ".jobKey", jobKey));
        for (Map.Entry<String, Object> parameter : parameters.entrySet()) {
            String name = parameter.getKey();
            if (name == null || name.isBlank() || name.startsWith(".") || name.endsWith(".")) {
                throw new InvalidSubmissionException("invalid parameter name '" + name + "'");
            }
            if (parameter.getValue() == null) {
                throw new InvalidSubmissionException("parameter '" + name + "' has no value");
            }
            String key = name.contains(".") ? name : FOUNDATION_NAMESPACE + "." + name;
            ContextEntry existing = entries.get(key);
            if (existing == null) {
                existing = entries.values().stream()
                    .filter(e -> SemanticKeys.sameConcept(e.key(), key))
                    .findFirst()
                    .orElse(null);
            }
            if (existing != null) {
                throw new InvalidSubmissionException("parameter '" + name + "' duplicates '" + existing.key() + "'");
            }
            entries.put(key, seed(key, parameter.getValue()));
        }
        return new ArrayList<>(entries.values());
    }

    private static ContextEntry seed(String key, Object raw) {
        return ContextEntry.of(key, ContextValue.of(raw), SemanticKeys.FOUNDATION_SOURCE, 1.0, List.of());
    }

    private void checkConfiguration() {
        if (scheduler.graph().isEmpty()) {
            throw new IllegalStateException("no phases configured");
        }
        for (Phase phase : scheduler.graph().executionOrder()) {
            for (TaskSpec task : phase.tasks()) {
                if (agents.find(task.agentKind()).isEmpty()) {
                    throw new UnknownAgentException(task.agentKind());
                }
            }
        }
    }

    private void runPipeline(ExecutionSession session, PipelineRun run) {
        String sessionId = session.sessionId();
        MdcContext.setSession(sessionId, session.jobKey());
        try {
            registry.begin(sessionId);
            PipelineResult result = scheduler.execute(run);
            if (result instanceof PipelineResult.Completed completed) {
                Artifact artifact = assembler.assemble(sessionId, session.jobKey(), completed.finalSnapshot(),
                    run.reports(), contextStore.conflicts(sessionId));
                registry.release(sessionId, SessionStatus.COMPLETED, "artifact assembled");
                finish(new SessionOutcome.Completed(sessionId, artifact), OrchestrationEvent.SESSION_COMPLETED,
                    Map.of("claims", artifact.claims().size(), "caveats", artifact.caveats().size()));
                sinks.forEach(sink -> notifySafely(sessionId, () -> sink.onArtifact(sessionId, artifact)));
            } else {
                HaltReason reason = ((PipelineResult.Halted) result).reason();
                registry.release(sessionId, SessionStatus.HALTED, reason.cause() + ": " + reason.detail());
                finish(new SessionOutcome.Halted(sessionId, reason), OrchestrationEvent.SESSION_HALTED,
                    Map.of("cause", reason.cause().name(), "unmet_conditions", reason.unmetConditions()));
                sinks.forEach(sink -> notifySafely(sessionId, () -> sink.onHalt(sessionId, reason)));
            }
        } catch (LeaseExpiredException | ClosedContextException | CancellationException ex) {
            log.warn("Session={} lost its lease in phase {}; in-flight work discarded", sessionId, run.currentPhase());
            fail(sessionId, new HaltReason(HaltCause.LEASE_EXPIRED, run.currentPhase(), List.of(), ex.getMessage()));
        } catch (PhaseOrderViolationException ex) {
            log.error("Session={} aborted on phase order violation: {}", sessionId, ex.getMessage());
            fail(sessionId, new HaltReason(HaltCause.PHASE_ORDER_VIOLATION, run.currentPhase(), List.of(),
                ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Session={} failed unexpectedly", sessionId, ex);
            fail(sessionId, new HaltReason(HaltCause.INTERNAL_ERROR, run.currentPhase(), List.of(),
                String.valueOf(ex.getMessage())));
        } finally {
            contextStore.close(sessionId);
            running.remove(sessionId);
            MdcContext.clear();
        }
    }

    private void fail(String sessionId, HaltReason reason) {
        registry.release(sessionId, SessionStatus.FAILED, reason.cause() + ": " + reason.detail());
        finish(new SessionOutcome.Failed(sessionId, reason), OrchestrationEvent.SESSION_FAILED,
            Map.of("cause", reason.cause().name()));
    }

    private void finish(SessionOutcome outcome, String eventType, Map<String, Object> data) {
        if (outcomes.record(outcome)) {
            events.publish(OrchestrationEvent.session(eventType, outcome.sessionId(), data));
        }
    }

    private void onLeaseReclaimed(ExecutionSession session) {
        String sessionId = session.sessionId();
        contextStore.close(sessionId);
        Future<?> pipeline = running.remove(sessionId);
        if (pipeline != null) {
            pipeline.cancel(true);
        }
        String phase = runs.find(sessionId).map(PipelineRun::currentPhase).orElse(null);
        if (outcomes.record(new SessionOutcome.Failed(sessionId,
                new HaltReason(HaltCause.LEASE_EXPIRED, phase, List.of(), "lease expired")))) {
            events.publish(OrchestrationEvent.session(OrchestrationEvent.SESSION_FAILED, sessionId,
                Map.of("cause", HaltCause.LEASE_EXPIRED.name())));
        }
    }

    private void notifySafely(String sessionId, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException ex) {
            log.warn("Artifact sink failed for session={}: {}", sessionId, ex.getMessage());
        }
    }
}
