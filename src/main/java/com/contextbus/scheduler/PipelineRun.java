package com.contextbus.scheduler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable execution state of one session's pipeline. Written by the
 * session's scheduler thread, read by observability.
 */
public class PipelineRun {

    private final String sessionId;
    private final String jobKey;
    private final PhaseTracker tracker;
    private final Map<String, TaskReport> reports = new LinkedHashMap<>();
    private final Set<String> rerunTasks = new LinkedHashSet<>();
    private volatile String currentPhase;

    public PipelineRun(String sessionId, String jobKey, PhaseTracker tracker) {
        this.sessionId = sessionId;
        this.jobKey = jobKey;
        this.tracker = tracker;
    }

    public String sessionId() {
        return sessionId;
    }

    public String jobKey() {
        return jobKey;
    }

    public PhaseTracker tracker() {
        return tracker;
    }

    public String currentPhase() {
        return currentPhase;
    }

    void enterPhase(String phase) {
        this.currentPhase = phase;
    }

    /** Records a task's latest report, replacing an earlier one of the same task. */
    synchronized void record(TaskReport report) {
        reports.put(report.taskId(), report);
    }

    synchronized void markRerun(String taskId) {
        rerunTasks.add(taskId);
    }

    public synchronized List<TaskReport> reports() {
        return new ArrayList<>(reports.values());
    }

    public synchronized List<TaskReport> reportsFor(String phase) {
        return reports.values().stream().filter(r -> r.spec().phase().equals(phase)).toList();
    }

    public synchronized List<TaskReport> degradedTasks() {
        return reports.values().stream().filter(TaskReport::isDegraded).toList();
    }

    public synchronized Set<String> rerunTasks() {
        return Set.copyOf(rerunTasks);
    }
}
