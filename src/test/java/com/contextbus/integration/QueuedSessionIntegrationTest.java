package com.contextbus.integration;

import com.contextbus.agent.AgentAdapter;
import com.contextbus.agent.AgentResult;
import com.contextbus.agent.ScriptedAgent;
import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextValue;
import com.contextbus.evidence.EvidenceKind;
import com.contextbus.evidence.EvidenceRecord;
import com.contextbus.orchestration.OrchestrationService;
import com.contextbus.orchestration.SessionOutcome;
import com.contextbus.session.ExecutionSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sessions queued behind a single pipeline thread, each taking longer to
 * reach the front than the lease timeout.
 */
@SpringBootTest(properties = {
    "contextbus.workers.session-pool-size=1",
    "contextbus.lease.timeout=PT1S",
    "contextbus.lease.sweep-interval=100",
    "contextbus.phases[0].name=investigation",
    "contextbus.phases[0].tasks[0].agent-kind=slow-code",
    "contextbus.phases[0].tasks[0].timeout=PT5S"
})
class QueuedSessionIntegrationTest {

    @TestConfiguration
    static class SlowInvestigator {

        @Bean
        AgentAdapter slowCodeAgent() {
            return new ScriptedAgent("slow-code", ctx -> {
                Thread.sleep(600);
                EvidenceRecord commit = EvidenceRecord.of("feature.queued", EvidenceKind.IMPLEMENTATION, "commit:q1");
                return AgentResult.done(List.of(
                    ContextEntry.of("feature.queued", ContextValue.flag(true), "slow-code", 0.9,
                        List.of(commit.evidenceId()))),
                    List.of(commit), 0.9);
            });
        }
    }

    @Autowired OrchestrationService orchestration;

    @Test
    @DisplayName("Queued sessions are not reclaimed before their pipeline starts")
    void queuedSessions_allComplete() throws Exception {
        List<ExecutionSession> sessions = new ArrayList<>();
        for (String jobKey : List.of("QUEUE-A", "QUEUE-B", "QUEUE-C")) {
            sessions.add(orchestration.submit(jobKey, Map.of()));
        }

        for (ExecutionSession session : sessions) {
            SessionOutcome outcome = orchestration.awaitOutcome(session.sessionId(), Duration.ofSeconds(15))
                .orElseThrow(() -> new AssertionError("no outcome for " + session.jobKey()));
            assertInstanceOf(SessionOutcome.Completed.class, outcome, session.jobKey() + ": " + outcome);
        }
    }
}
