package com.contextbus.scoring;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.ContextValue;
import com.contextbus.context.SemanticKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class StrategicAnalysisServiceTest {

    @Nested
    @DisplayName("Scorers")
    class Scorers {

        @Test
        void complexity_growsWithBreadthOfFindings() {
            ScoreDecision small = new ComplexityScorer().score(snapshot(
                finding("code.files", ContextValue.number(2))));
            ScoreDecision large = new ComplexityScorer().score(snapshot(manyFindings(24, 6)));

            assertEquals("Low", small.decision());
            assertEquals("High", large.decision());
            assertTrue(large.score() > small.score());
            assertTrue(((Integer) large.details().get("optimal_test_steps")) > ((Integer) small.details().get("optimal_test_steps")));
        }

        @Test
        void priority_mapsDeclaredLevels_andPrefersInvestigatedValue() {
            ScoreDecision decision = new PriorityScorer().score(snapshot(
                ContextEntry.of("job.priority", ContextValue.text("Minor"), SemanticKeys.FOUNDATION_SOURCE, 1.0, List.of()),
                finding("ticket.priority", ContextValue.text("Blocker"))));

            assertEquals("High", decision.decision());
            assertEquals("ticket.priority", decision.details().get("source_key"));
        }

        @Test
        void priority_defaultsToMedium() {
            ScoreDecision decision = new PriorityScorer().score(snapshot());
            assertEquals("Medium", decision.decision());
            assertEquals(0.5, decision.score());
        }

        @Test
        void scope_countsNamespaces() {
            assertEquals("focused", new ScopeScorer().score(snapshot(manyFindings(3, 2))).decision());
            assertEquals("moderate", new ScopeScorer().score(snapshot(manyFindings(6, 3))).decision());
            assertEquals("broad", new ScopeScorer().score(snapshot(manyFindings(10, 5))).decision());
        }

        @Test
        void naming_usesMostConfidentTitle_prefixedWithJobKey() {
            ScoreDecision decision = new NamingScorer().score(snapshot(
                ContextEntry.of("job.jobKey", ContextValue.text("ACM-22079"), SemanticKeys.FOUNDATION_SOURCE, 1.0, List.of()),
                ContextEntry.of("ticket.title", ContextValue.text("Digest-based upgrades"), "p1/ticket", 0.9, List.of()),
                ContextEntry.of("docs.summary", ContextValue.text("Upgrade docs"), "p1/docs", 0.4, List.of())));

            assertEquals("ACM-22079: Digest-based upgrades", decision.decision());
        }
    }

    @Test
    void failingScorer_isSkipped() {
        StrategicScorer broken = new StrategicScorer() {
            @Override
            public String scorerId() {
                return "broken";
            }

            @Override
            public String scorerVersion() {
                return "v0";
            }

            @Override
            public ScoreDecision score(ContextSnapshot context) {
                throw new IllegalStateException("model unavailable");
            }
        };
        StrategicAnalysisService service = new StrategicAnalysisService(List.of(broken, new ScopeScorer()));

        List<ScoreDecision> decisions = service.analyze(snapshot());

        assertEquals(List.of("scope"), decisions.stream().map(ScoreDecision::scorerId).toList());
    }

    @Test
    void sameSnapshot_sameDecisions() {
        StrategicAnalysisService service = new StrategicAnalysisService(List.of(
            new ComplexityScorer(), new PriorityScorer(), new ScopeScorer(), new NamingScorer()));
        ContextSnapshot snapshot = snapshot(manyFindings(7, 3));

        assertEquals(service.analyze(snapshot), service.analyze(snapshot));
    }

    private static ContextEntry finding(String key, ContextValue value) {
        return ContextEntry.of(key, value, "p1/agent", 0.7, List.of("ev-" + key));
    }

    private static ContextEntry[] manyFindings(int count, int namespaces) {
        ContextEntry[] entries = new ContextEntry[count];
        for (int i = 0; i < count; i++) {
            entries[i] = finding("ns" + (i % namespaces) + ".item" + i, ContextValue.number(i));
        }
        return entries;
    }

    private static ContextSnapshot snapshot(ContextEntry... entries) {
        TreeMap<String, ContextEntry> map = new TreeMap<>();
        for (ContextEntry entry : entries) {
            map.put(entry.key(), entry);
        }
        return new ContextSnapshot("ses-score", 2, "synthesis", map, List.of(), Instant.EPOCH);
    }
}
