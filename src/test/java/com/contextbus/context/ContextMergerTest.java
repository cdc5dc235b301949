package com.contextbus.context;

import com.contextbus.conflict.ConflictClassification;
import com.contextbus.conflict.ConflictDetector;
import com.contextbus.conflict.KeySchemaTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ContextMergerTest {

    private ContextMerger merger;
    private ContextSnapshot base;

    @BeforeEach
    void setUp() {
        merger = new ContextMerger(new ConflictDetector(KeySchemaTable.empty()));
        TreeMap<String, ContextEntry> seed = new TreeMap<>();
        seed.put("job.jobKey", ContextEntry.of("job.jobKey", ContextValue.text("ACM-22079"),
            SemanticKeys.FOUNDATION_SOURCE, 1.0, List.of()));
        base = new ContextSnapshot("ses-1", 0, SemanticKeys.FOUNDATION_SOURCE, seed, List.of(), Instant.now());
    }

    @Nested
    @DisplayName("Distinct keys")
    class DistinctKeys {

        @Test
        @DisplayName("Same value name under different namespaces raises no conflict")
        void differentNamespaces_noConflict() {
            MergeResult result = merger.merge(base, "investigation", List.of(
                entry("ticket.targetVersion", ContextValue.text("2.15"), "investigation/ticket"),
                entry("env.envVersion", ContextValue.text("2.14"), "investigation/environment")));

            assertFalse(result.hasConflicts());
            assertEquals(1, result.snapshot().version());
            assertEquals("2.15", result.snapshot().get("ticket.targetVersion").orElseThrow().value().render());
            assertEquals("2.14", result.snapshot().get("env.envVersion").orElseThrow().value().render());
        }

        @Test
        void emptyContributions_returnBaseUnchanged() {
            MergeResult result = merger.merge(base, "investigation", List.of());
            assertSame(base, result.snapshot());
            assertFalse(result.hasConflicts());
        }
    }

    @Nested
    @DisplayName("Existing keys")
    class ExistingKeys {

        @Test
        void equalValue_corroboratesAndUnionsEvidence() {
            MergeResult first = merger.merge(base, "p1", List.of(
                new ContextEntry("code.prNumber", ContextValue.number(468), "p1/code", 0.6, List.of("ev-a"), false)));
            MergeResult second = merger.merge(first.snapshot(), "p2", List.of(
                new ContextEntry("code.prNumber", ContextValue.number(468), "p2/docs", 0.9, List.of("ev-b"), false)));

            assertFalse(second.hasConflicts());
            ContextEntry merged = second.snapshot().get("code.prNumber").orElseThrow();
            assertEquals("p1/code", merged.sourceTask());
            assertEquals(0.9, merged.confidence());
            assertEquals(List.of("ev-a", "ev-b"), merged.evidenceRefs());
        }

        @Test
        void differentValue_keepsPriorAndRaisesPendingConflict() {
            MergeResult first = merger.merge(base, "p1", List.of(
                entry("deploy.status", ContextValue.flag(true), "p1/environment")));
            MergeResult second = merger.merge(first.snapshot(), "p1", List.of(
                entry("deploy.status", ContextValue.flag(false), "p1/code")));

            assertEquals(1, second.conflicts().size());
            assertTrue(second.conflicts().get(0).isPending());
            assertEquals(ConflictClassification.VALUE_DISAGREEMENT, second.conflicts().get(0).classification());
            assertEquals(ContextValue.flag(true), second.snapshot().get("deploy.status").orElseThrow().value());
        }

        @Test
        void differentDomain_isTypeMismatch() {
            MergeResult first = merger.merge(base, "p1", List.of(
                entry("build.version", ContextValue.text("2.15"), "p1/ticket")));
            MergeResult second = merger.merge(first.snapshot(), "p1", List.of(
                entry("build.version", ContextValue.number(215), "p1/environment")));

            assertEquals(ConflictClassification.TYPE_MISMATCH, second.conflicts().get(0).classification());
        }

        @Test
        void aliasLabel_isHeldBackAsAliasConflict() {
            MergeResult first = merger.merge(base, "p1", List.of(
                entry("cluster.curatorName", ContextValue.text("curator-a"), "p1/environment")));
            MergeResult second = merger.merge(first.snapshot(), "p1", List.of(
                entry("cluster.curator_name", ContextValue.text("curator-a"), "p1/code")));

            assertEquals(ConflictClassification.SEMANTIC_ALIAS, second.conflicts().get(0).classification());
            assertTrue(second.snapshot().get("cluster.curator_name").isEmpty());
        }
    }

    @Test
    @DisplayName("Every accepted entry survives later merges")
    void priorEntriesAreNeverLost() {
        ContextSnapshot current = base;
        for (int i = 0; i < 5; i++) {
            MergeResult result = merger.merge(current, "p" + i, List.of(
                entry("finding.item" + i, ContextValue.number(i), "p" + i + "/agent"),
                entry("finding.item0", ContextValue.number(99), "p" + i + "/late")));
            current = result.snapshot();
        }
        assertEquals("ACM-22079", current.get("job.jobKey").orElseThrow().value().render());
        for (int i = 0; i < 5; i++) {
            assertTrue(current.get("finding.item" + i).isPresent(), "finding.item" + i + " lost");
        }
        assertEquals(ContextValue.number(0), current.get("finding.item0").orElseThrow().value());
    }

    private static ContextEntry entry(String key, ContextValue value, String source) {
        return ContextEntry.of(key, value, source, 0.8, List.of());
    }
}
