package com.contextbus.config;

import com.contextbus.agent.AgentRegistry;
import com.contextbus.conflict.ConflictDetector;
import com.contextbus.conflict.ConflictResolver;
import com.contextbus.conflict.EvidenceStrengthStrategy;
import com.contextbus.conflict.KeySchemaTable;
import com.contextbus.conflict.SourcePriorityStrategy;
import com.contextbus.conflict.SourcePriorityTable;
import com.contextbus.context.ContextMerger;
import com.contextbus.context.ContextStore;
import com.contextbus.evidence.EvidenceGate;
import com.contextbus.evidence.EvidenceKind;
import com.contextbus.evidence.EvidenceLedger;
import com.contextbus.evidence.EvidenceWeights;
import com.contextbus.observability.OrchestrationEventBus;
import com.contextbus.orchestration.ArtifactAssembler;
import com.contextbus.scheduler.MinimumEvidencePolicy;
import com.contextbus.scheduler.Phase;
import com.contextbus.scheduler.PhaseGraph;
import com.contextbus.scheduler.PhaseScheduler;
import com.contextbus.scheduler.RetryPolicy;
import com.contextbus.scheduler.TaskRunner;
import com.contextbus.scheduler.TaskSpec;
import com.contextbus.scoring.ComplexityScorer;
import com.contextbus.scoring.NamingScorer;
import com.contextbus.scoring.PriorityScorer;
import com.contextbus.scoring.ScopeScorer;
import com.contextbus.scoring.StrategicAnalysisService;
import com.contextbus.session.ExecutionRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pure policies and strategies from {@link ContextBusProperties}.
 * Stateful services are components in their own packages.
 */
@Configuration
@EnableScheduling
public class OrchestrationConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeySchemaTable keySchemaTable(ContextBusProperties properties) {
        return new KeySchemaTable(properties.getKeySchemas());
    }

    @Bean
    public ConflictDetector conflictDetector(KeySchemaTable keySchemaTable) {
        return new ConflictDetector(keySchemaTable);
    }

    @Bean
    public ContextMerger contextMerger(ConflictDetector conflictDetector) {
        return new ContextMerger(conflictDetector);
    }

    @Bean
    public EvidenceWeights evidenceWeights(ContextBusProperties properties) {
        Map<EvidenceKind, Double> weights = new EnumMap<>(EvidenceWeights.defaults().asMap());
        properties.getEvidenceWeights().forEach((kind, weight) -> weights.put(EvidenceKind.fromValue(kind), weight));
        return new EvidenceWeights(weights);
    }

    /**
     * Resolver with one strategy per classification:
     * 1. Source priority for type mismatches
     * 2. Evidence strength for value disagreements
     * Semantic aliases are canonicalized by the resolver itself.
     */
    @Bean
    public ConflictResolver conflictResolver(ConflictDetector conflictDetector, KeySchemaTable keySchemaTable,
                                             EvidenceLedger ledger, EvidenceWeights evidenceWeights,
                                             ContextBusProperties properties) {
        return new ConflictResolver(conflictDetector, ledger, List.of(
            new SourcePriorityStrategy(new SourcePriorityTable(properties.getSourcePriority()), keySchemaTable),
            new EvidenceStrengthStrategy(evidenceWeights)
        ));
    }

    @Bean
    public EvidenceGate evidenceGate(EvidenceLedger ledger) {
        return new EvidenceGate(ledger);
    }

    @Bean
    public StrategicAnalysisService strategicAnalysisService() {
        return new StrategicAnalysisService(List.of(
            new ComplexityScorer(),
            new PriorityScorer(),
            new ScopeScorer(),
            new NamingScorer()
        ));
    }

    @Bean
    public ArtifactAssembler artifactAssembler(EvidenceGate evidenceGate, EvidenceLedger ledger,
                                               StrategicAnalysisService strategicAnalysisService, Clock clock) {
        return new ArtifactAssembler(evidenceGate, ledger, strategicAnalysisService, clock);
    }

    @Bean
    public PhaseGraph phaseGraph(ContextBusProperties properties) {
        List<Phase> phases = properties.getPhases().stream()
            .map(p -> new Phase(p.getName(), p.getOrder(), Set.copyOf(p.getDependsOn()),
                p.getTasks().stream()
                    .map(t -> new TaskSpec(t.getAgentKind(), p.getName(), t.getTimeout(),
                        new RetryPolicy(t.getMaxAttempts())))
                    .toList()))
            .toList();
        return new PhaseGraph(phases);
    }

    @Bean
    public MinimumEvidencePolicy minimumEvidencePolicy(ContextBusProperties properties) {
        ContextBusProperties.MinimumEvidence policy = properties.getMinimumEvidence();
        return new MinimumEvidencePolicy(policy.isEnabled(), policy.getPhase(),
            policy.getDescriptiveNamespaces(), policy.getRelatedNamespaces());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService taskWorkers(ContextBusProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkers().getPoolSize(), named("task-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sessionExecutor(ContextBusProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkers().getSessionPoolSize(), named("session"));
    }

    @Bean
    public TaskRunner taskRunner(AgentRegistry agentRegistry, ContextStore contextStore,
                                 @Qualifier("taskWorkers") ExecutorService taskWorkers,
                                 ContextBusProperties properties) {
        return new TaskRunner(agentRegistry, contextStore, taskWorkers, properties.getDegradedConfidenceFactor());
    }

    @Bean
    public PhaseScheduler phaseScheduler(PhaseGraph phaseGraph, TaskRunner taskRunner, ContextStore contextStore,
                                         EvidenceLedger ledger, ConflictResolver conflictResolver,
                                         ExecutionRegistry executionRegistry, OrchestrationEventBus events,
                                         MinimumEvidencePolicy minimumEvidencePolicy,
                                         ContextBusProperties properties) {
        return new PhaseScheduler(phaseGraph, taskRunner, contextStore, ledger, conflictResolver,
            executionRegistry, events, minimumEvidencePolicy, properties.getCriticalKeys());
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
