package com.contextbus.scheduler;

import com.contextbus.agent.AgentAdapter;
import com.contextbus.agent.AgentRegistry;
import com.contextbus.agent.AgentResult;
import com.contextbus.agent.AgentStatus;
import com.contextbus.agent.InvestigationContext;
import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.ContextStore;
import com.contextbus.evidence.EvidenceRecord;
import com.contextbus.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the tasks of a phase concurrently on the shared worker pool.
 *
 * Attempts run in rounds: every task gets its first attempt in round one,
 * tasks that timed out, threw or reported FAILED are retried in the next
 * round with the same input snapshot, up to their retry policy. A task
 * whose attempts are exhausted is reported degraded with no findings and
 * confidence 0. A task that reports DEGRADED keeps its findings with
 * confidence scaled down and entries marked degraded.
 *
 * The worker pool is shared by all sessions. An attempt's timeout starts
 * when a worker picks it up, not when it is queued; while attempts wait
 * for a worker the caller's keep-alive runs periodically.
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private static final long QUEUED_POLL_MILLIS = 50;

    private final AgentRegistry agents;
    private final ContextStore contextStore;
    private final ExecutorService workers;
    private final double degradedConfidenceFactor;

    public TaskRunner(AgentRegistry agents, ContextStore contextStore, ExecutorService workers,
                      double degradedConfidenceFactor) {
        this.agents = agents;
        this.contextStore = contextStore;
        this.workers = workers;
        this.degradedConfidenceFactor = degradedConfidenceFactor;
    }

    public List<TaskReport> run(String sessionId, String jobKey, List<TaskSpec> tasks, ContextSnapshot input) {
        return run(sessionId, jobKey, tasks, input, () -> { });
    }

    /**
     * Runs {@code tasks} against {@code input} and returns one report per
     * task in declaration order.
     *
     * @param keepAlive called while attempts wait for a worker; an exception
     *                  it throws cancels outstanding attempts and propagates
     * @throws CancellationException if the calling thread is interrupted;
     *         outstanding attempts are cancelled first
     */
    public List<TaskReport> run(String sessionId, String jobKey, List<TaskSpec> tasks, ContextSnapshot input,
                                Runnable keepAlive) {
        Map<String, TaskReport> reports = new HashMap<>();
        Map<String, Integer> attempts = new HashMap<>();
        List<TaskSpec> pending = new ArrayList<>(tasks);

        while (!pending.isEmpty()) {
            Map<TaskSpec, Attempt> inFlight = new LinkedHashMap<>();
            for (TaskSpec spec : pending) {
                int number = attempts.merge(spec.taskId(), 1, Integer::sum);
                Attempt attempt = new Attempt();
                attempt.future = workers.submit(() -> {
                    attempt.markStarted();
                    return invoke(sessionId, jobKey, spec, number, input);
                });
                inFlight.put(spec, attempt);
            }

            List<TaskSpec> retry = new ArrayList<>();
            for (Map.Entry<TaskSpec, Attempt> entry : inFlight.entrySet()) {
                TaskSpec spec = entry.getKey();
                int attempt = attempts.get(spec.taskId());
                String failure;
                try {
                    AgentResult result = await(entry.getValue(), spec, keepAlive);
                    if (result.status() != AgentStatus.FAILED) {
                        reports.put(spec.taskId(), accept(spec, attempt, result));
                        continue;
                    }
                    failure = "reported failure" + (result.message() == null ? "" : ": " + result.message());
                } catch (TimeoutException ex) {
                    entry.getValue().future.cancel(true);
                    failure = "timed out after " + spec.timeout();
                } catch (ExecutionException ex) {
                    failure = "threw " + ex.getCause();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    inFlight.values().forEach(a -> a.future.cancel(true));
                    throw new CancellationException("interrupted while running tasks of session " + sessionId);
                } catch (RuntimeException ex) {
                    inFlight.values().forEach(a -> a.future.cancel(true));
                    throw ex;
                }

                if (attempt < spec.retryPolicy().maxAttempts()) {
                    log.warn("Task {} attempt {} {}; retrying with the same input", spec.taskId(), attempt, failure);
                    retry.add(spec);
                } else {
                    log.warn("Task {} degraded after {} attempt(s): {}", spec.taskId(), attempt, failure);
                    reports.put(spec.taskId(), TaskReport.exhausted(spec, attempt, failure));
                }
            }
            pending = retry;
        }

        return tasks.stream().map(t -> reports.get(t.taskId())).toList();
    }

    /** Waits for a worker to pick the attempt up, then for at most the task's timeout. */
    private AgentResult await(Attempt attempt, TaskSpec spec, Runnable keepAlive)
            throws InterruptedException, ExecutionException, TimeoutException {
        while (!attempt.started.await(QUEUED_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (attempt.future.isDone()) {
                return attempt.future.get();
            }
            keepAlive.run();
        }
        long remaining = spec.timeout().toNanos() - (System.nanoTime() - attempt.startedNanos);
        return attempt.future.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
    }

    private AgentResult invoke(String sessionId, String jobKey, TaskSpec spec, int attempt,
                               ContextSnapshot input) throws Exception {
        MdcContext.setTask(sessionId, spec.phase(), spec.taskId());
        try {
            AgentAdapter adapter = agents.require(spec.agentKind());
            InvestigationContext context = new InvestigationContext(sessionId, jobKey, spec.taskId(), attempt,
                input, () -> contextStore.pollInterim(sessionId));
            log.debug("Running task {} attempt {} on context v{}", spec.taskId(), attempt, input.version());

            AgentResult result = adapter.run(context, spec.timeout());
            if (result == null) {
                return AgentResult.failed("adapter returned no result");
            }
            AgentResult stamped = stamp(spec.taskId(), result);
            if (stamped.status() != AgentStatus.FAILED && !Thread.currentThread().isInterrupted()) {
                contextStore.postInterim(sessionId, spec.taskId(), stamped.findings());
            }
            return stamped;
        } finally {
            MdcContext.clear();
        }
    }

    private AgentResult stamp(String taskId, AgentResult result) {
        boolean degraded = result.status() == AgentStatus.DEGRADED;
        List<ContextEntry> findings = new ArrayList<>();
        for (ContextEntry finding : result.findings()) {
            ContextEntry owned = new ContextEntry(finding.key(), finding.value(), taskId,
                finding.confidence(), finding.evidenceRefs(), false);
            findings.add(degraded ? owned.asDegraded(degradedConfidenceFactor) : owned);
        }
        List<EvidenceRecord> evidence = result.evidence().stream()
            .map(e -> e.withSourceTask(taskId))
            .toList();
        return new AgentResult(findings, evidence, result.confidence(), result.status(), result.message());
    }

    private static final class Attempt {
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedNanos;
        private volatile Future<AgentResult> future;

        private void markStarted() {
            startedNanos = System.nanoTime();
            started.countDown();
        }
    }

    private TaskReport accept(TaskSpec spec, int attempt, AgentResult result) {
        if (result.status() == AgentStatus.DEGRADED) {
            log.info("Task {} finished degraded on attempt {}: {}", spec.taskId(), attempt, result.message());
            return new TaskReport(spec, TaskOutcome.DEGRADED, attempt, result.findings(), result.evidence(),
                result.confidence() * degradedConfidenceFactor, result.message(), false);
        }
        log.info("Task {} done on attempt {} with {} finding(s)", spec.taskId(), attempt, result.findings().size());
        return new TaskReport(spec, TaskOutcome.DONE, attempt, result.findings(), result.evidence(),
            result.confidence(), null, false);
    }
}
