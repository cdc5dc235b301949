package com.contextbus.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externally supplied configuration under the {@code contextbus} prefix.
 *
 * Keys containing dots (full semantic keys in {@code source-priority} or
 * {@code key-schemas}) must be written in bracket form, e.g.
 * {@code "[deployment.status]"}.
 */
@ConfigurationProperties(prefix = "contextbus")
public class ContextBusProperties {

    private Lease lease = new Lease();
    private Workers workers = new Workers();
    private List<PhaseProperties> phases = new ArrayList<>();
    private Map<String, List<String>> sourcePriority = new LinkedHashMap<>();
    private Map<String, String> keySchemas = new LinkedHashMap<>();
    private List<String> criticalKeys = new ArrayList<>();
    private Map<String, Double> evidenceWeights = new LinkedHashMap<>();
    private double degradedConfidenceFactor = 0.5;
    private MinimumEvidence minimumEvidence = new MinimumEvidence();
    private Budget budget = new Budget();

    public Lease getLease() { return lease; }
    public void setLease(Lease lease) { this.lease = lease; }
    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }
    public List<PhaseProperties> getPhases() { return phases; }
    public void setPhases(List<PhaseProperties> phases) { this.phases = phases; }
    public Map<String, List<String>> getSourcePriority() { return sourcePriority; }
    public void setSourcePriority(Map<String, List<String>> sourcePriority) { this.sourcePriority = sourcePriority; }
    public Map<String, String> getKeySchemas() { return keySchemas; }
    public void setKeySchemas(Map<String, String> keySchemas) { this.keySchemas = keySchemas; }
    public List<String> getCriticalKeys() { return criticalKeys; }
    public void setCriticalKeys(List<String> criticalKeys) { this.criticalKeys = criticalKeys; }
    public Map<String, Double> getEvidenceWeights() { return evidenceWeights; }
    public void setEvidenceWeights(Map<String, Double> evidenceWeights) { this.evidenceWeights = evidenceWeights; }
    public double getDegradedConfidenceFactor() { return degradedConfidenceFactor; }
    public void setDegradedConfidenceFactor(double degradedConfidenceFactor) { this.degradedConfidenceFactor = degradedConfidenceFactor; }
    public MinimumEvidence getMinimumEvidence() { return minimumEvidence; }
    public void setMinimumEvidence(MinimumEvidence minimumEvidence) { this.minimumEvidence = minimumEvidence; }
    public Budget getBudget() { return budget; }
    public void setBudget(Budget budget) { this.budget = budget; }

    public static class Lease {
        /** Must exceed the longest phase: tasks renew the lease only at phase boundaries. */
        private Duration timeout = Duration.ofMinutes(2);
        private Duration sweepInterval = Duration.ofSeconds(5);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class Workers {
        /** Threads shared by all tasks of all sessions. */
        private int poolSize = 8;
        /** Sessions whose pipelines may run at the same time. */
        private int sessionPoolSize = 4;

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public int getSessionPoolSize() { return sessionPoolSize; }
        public void setSessionPoolSize(int sessionPoolSize) { this.sessionPoolSize = sessionPoolSize; }
    }

    public static class PhaseProperties {
        private String name;
        private int order;
        private List<String> dependsOn = new ArrayList<>();
        private List<TaskProperties> tasks = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public int getOrder() { return order; }
        public void setOrder(int order) { this.order = order; }
        public List<String> getDependsOn() { return dependsOn; }
        public void setDependsOn(List<String> dependsOn) { this.dependsOn = dependsOn; }
        public List<TaskProperties> getTasks() { return tasks; }
        public void setTasks(List<TaskProperties> tasks) { this.tasks = tasks; }
    }

    public static class TaskProperties {
        private String agentKind;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 2;

        public String getAgentKind() { return agentKind; }
        public void setAgentKind(String agentKind) { this.agentKind = agentKind; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class MinimumEvidence {
        private boolean enabled = true;
        /** Phase the policy is checked after; the first phase when unset. */
        private String phase;
        private List<String> descriptiveNamespaces = new ArrayList<>(List.of("docs", "summary"));
        private List<String> relatedNamespaces = new ArrayList<>(List.of("related"));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getPhase() { return phase; }
        public void setPhase(String phase) { this.phase = phase; }
        public List<String> getDescriptiveNamespaces() { return descriptiveNamespaces; }
        public void setDescriptiveNamespaces(List<String> descriptiveNamespaces) { this.descriptiveNamespaces = descriptiveNamespaces; }
        public List<String> getRelatedNamespaces() { return relatedNamespaces; }
        public void setRelatedNamespaces(List<String> relatedNamespaces) { this.relatedNamespaces = relatedNamespaces; }
    }

    public static class Budget {
        private long maxCharacters = 200_000;
        private double warningRatio = 0.60;
        private double criticalRatio = 0.80;
        private double emergencyRatio = 0.95;

        public long getMaxCharacters() { return maxCharacters; }
        public void setMaxCharacters(long maxCharacters) { this.maxCharacters = maxCharacters; }
        public double getWarningRatio() { return warningRatio; }
        public void setWarningRatio(double warningRatio) { this.warningRatio = warningRatio; }
        public double getCriticalRatio() { return criticalRatio; }
        public void setCriticalRatio(double criticalRatio) { this.criticalRatio = criticalRatio; }
        public double getEmergencyRatio() { return emergencyRatio; }
        public void setEmergencyRatio(double emergencyRatio) { this.emergencyRatio = emergencyRatio; }
    }
}
