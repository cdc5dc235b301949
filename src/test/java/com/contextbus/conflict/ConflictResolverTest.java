package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextMutation;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.ContextValue;
import com.contextbus.context.MutationKind;
import com.contextbus.evidence.EvidenceKind;
import com.contextbus.evidence.EvidenceLedger;
import com.contextbus.evidence.EvidenceRecord;
import com.contextbus.evidence.EvidenceWeights;
import com.contextbus.evidence.InMemoryEvidenceLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    private static final String SESSION = "ses-resolver";

    private EvidenceLedger ledger;
    private KeySchemaTable schemas;
    private ConflictResolver resolver;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryEvidenceLedger();
        schemas = new KeySchemaTable(Map.of("build.version", "^\\d+\\.\\d+$"));
        resolver = resolverWith(Map.of("deployment", List.of("environment", "code-diff")));
    }

    private ConflictResolver resolverWith(Map<String, List<String>> priorities) {
        return new ConflictResolver(new ConflictDetector(schemas), ledger, List.of(
            new SourcePriorityStrategy(new SourcePriorityTable(priorities), schemas),
            new EvidenceStrengthStrategy(EvidenceWeights.defaults())));
    }

    @Nested
    @DisplayName("Value disagreement by evidence strength")
    class EvidenceStrength {

        @Test
        @DisplayName("Two implementation records outweigh one deployment record")
        void strongerEvidenceWins() {
            EvidenceRecord deployed = ledger.record(SESSION,
                EvidenceRecord.of("deployment.deploymentStatus", EvidenceKind.DEPLOYMENT, "probe://cluster"));
            EvidenceRecord impl1 = ledger.record(SESSION,
                EvidenceRecord.of("deployment.deploymentStatus", EvidenceKind.IMPLEMENTATION, "commit:abc"));
            EvidenceRecord impl2 = ledger.record(SESSION,
                EvidenceRecord.of("deployment.deploymentStatus", EvidenceKind.IMPLEMENTATION, "commit:def"));

            ContextEntry prior = new ContextEntry("deployment.deploymentStatus", ContextValue.flag(true),
                "investigation/docs", 0.8, List.of(deployed.evidenceId()), false);
            ContextEntry incoming = new ContextEntry("deployment.deploymentStatus", ContextValue.flag(false),
                "investigation/code", 0.8, List.of(impl1.evidenceId(), impl2.evidenceId()), false);

            List<ConflictResolution> resolutions = resolver.resolve(SESSION, snapshotWith(prior), pending(prior, incoming,
                ConflictClassification.VALUE_DISAGREEMENT));

            assertEquals(1, resolutions.size());
            ConflictResolution resolution = resolutions.get(0);
            assertEquals(ResolutionStatus.RESOLVED, resolution.conflict().resolution());
            assertEquals(ContextValue.flag(false), resolution.upserts().get("deployment.deploymentStatus").value());
            assertEquals("evidence-strength", resolution.conflict().detail().strategyId());
            assertTrue(resolution.conflict().detail().rationale().contains("2 record(s)"),
                resolution.conflict().detail().rationale());
            assertTrue(resolution.retryTasks().isEmpty());
        }

        @Test
        void tie_isEscalatedAndKeepsPriorValue() {
            ContextEntry prior = ContextEntry.of("summary.state", ContextValue.text("open"), "p1/a", 0.5, List.of());
            ContextEntry incoming = ContextEntry.of("summary.state", ContextValue.text("closed"), "p1/b", 0.5, List.of());

            ConflictResolution resolution = resolver.resolve(SESSION, snapshotWith(prior),
                pending(prior, incoming, ConflictClassification.VALUE_DISAGREEMENT)).get(0);

            assertEquals(ResolutionStatus.ESCALATED, resolution.conflict().resolution());
            assertTrue(resolution.upserts().isEmpty());
            assertEquals(MutationKind.ESCALATE, resolution.mutation().kind());
        }
    }

    @Nested
    @DisplayName("Type mismatch by source priority")
    class SourcePriority {

        @Test
        void authoritativeSourceWins_andLoserIsFlaggedForRerun() {
            ContextEntry prior = ContextEntry.of("deployment.replicas", ContextValue.text("three"),
                "investigation/code-diff", 0.9, List.of());
            ContextEntry incoming = ContextEntry.of("deployment.replicas", ContextValue.number(3),
                "investigation/environment", 0.6, List.of());

            ConflictResolution resolution = resolver.resolve(SESSION, snapshotWith(prior),
                pending(prior, incoming, ConflictClassification.TYPE_MISMATCH)).get(0);

            assertEquals("investigation/environment", resolution.conflict().detail().winnerSource());
            assertEquals(ContextValue.number(3), resolution.upserts().get("deployment.replicas").value());
            assertEquals(List.of("investigation/code-diff"), resolution.retryTasks());
        }

        @Test
        void unrankedSources_fallBackToSchemaConformance() {
            ContextEntry prior = ContextEntry.of("build.version", ContextValue.text("latest"), "p1/ticket", 0.9, List.of());
            ContextEntry incoming = ContextEntry.of("build.version", ContextValue.text("2.15"), "p1/docs", 0.4, List.of());

            ConflictResolution resolution = resolver.resolve(SESSION, snapshotWith(prior),
                pending(prior, incoming, ConflictClassification.TYPE_MISMATCH)).get(0);

            assertEquals("2.15", resolution.conflict().detail().winningValue());
            assertEquals(List.of("p1/ticket"), resolution.retryTasks());
        }

        @Test
        void foundationLoser_isNeverRetried() {
            ConflictResolver foundationLast = resolverWith(Map.of("job", List.of("environment")));
            ContextEntry prior = ContextEntry.of("job.replicas", ContextValue.text("3"), "foundation", 1.0, List.of());
            ContextEntry incoming = ContextEntry.of("job.replicas", ContextValue.number(3), "p1/environment", 0.7, List.of());

            ConflictResolution resolution = foundationLast.resolve(SESSION, snapshotWith(prior),
                pending(prior, incoming, ConflictClassification.TYPE_MISMATCH)).get(0);

            assertEquals("p1/environment", resolution.conflict().detail().winnerSource());
            assertTrue(resolution.retryTasks().isEmpty());
        }
    }

    @Nested
    @DisplayName("Semantic aliases")
    class Aliases {

        @Test
        void equalValues_areCanonicalizedToLongerLabel() {
            ContextEntry prior = ContextEntry.of("cluster.curator", ContextValue.text("c1"), "p1/env", 0.7, List.of("ev-1"));
            ContextEntry incoming = ContextEntry.of("cluster.Curator_", ContextValue.text("c1"), "p1/code", 0.9, List.of("ev-2"));

            List<ConflictResolution> resolutions = resolver.resolve(SESSION, snapshotWith(prior),
                pending(prior, incoming, ConflictClassification.SEMANTIC_ALIAS));

            assertEquals(1, resolutions.size());
            ConflictResolution resolution = resolutions.get(0);
            assertEquals(List.of("cluster.curator"), resolution.removals());
            ContextEntry merged = resolution.upserts().get("cluster.Curator_");
            assertEquals(0.9, merged.confidence());
            assertEquals(List.of("ev-1", "ev-2"), merged.evidenceRefs());
            assertEquals(MutationKind.CANONICALIZE, resolution.mutation().kind());
        }

        @Test
        void differingValues_produceFollowUpResolution() {
            ContextEntry prior = ContextEntry.of("summary.state", ContextValue.text("open"), "p1/a", 0.5, List.of());
            ContextEntry incoming = ContextEntry.of("summary.State", ContextValue.text("closed"), "p1/b", 0.5, List.of());

            List<ConflictResolution> resolutions = resolver.resolve(SESSION, snapshotWith(prior),
                pending(prior, incoming, ConflictClassification.SEMANTIC_ALIAS));

            assertEquals(2, resolutions.size());
            assertEquals(ResolutionStatus.RESOLVED, resolutions.get(0).conflict().resolution());
            ContextConflict followUp = resolutions.get(1).conflict();
            assertEquals(ConflictClassification.VALUE_DISAGREEMENT, followUp.classification());
            assertEquals(ResolutionStatus.ESCALATED, followUp.resolution());
            assertEquals("summary.State", followUp.key());
        }
    }

    @Test
    @DisplayName("Identical inputs resolve identically across runs")
    void resolutionIsDeterministic() {
        EvidenceRecord impl = ledger.record(SESSION,
            EvidenceRecord.of("code.merged", EvidenceKind.IMPLEMENTATION, "commit:1"));
        ContextEntry prior = ContextEntry.of("code.merged", ContextValue.flag(false), "p1/a", 0.5, List.of());
        ContextEntry incoming = ContextEntry.of("code.merged", ContextValue.flag(true), "p1/b", 0.5,
            List.of(impl.evidenceId()));

        ConflictResolution first = resolver.resolve(SESSION, snapshotWith(prior),
            pending(prior, incoming, ConflictClassification.VALUE_DISAGREEMENT)).get(0);
        for (int i = 0; i < 10; i++) {
            ConflictResolution again = resolverWith(Map.of("deployment", List.of("environment", "code-diff")))
                .resolve(SESSION, snapshotWith(prior), pending(prior, incoming, ConflictClassification.VALUE_DISAGREEMENT))
                .get(0);
            assertEquals(first.conflict(), again.conflict());
            assertEquals(first.upserts(), again.upserts());
            ContextMutation m1 = first.mutation();
            ContextMutation m2 = again.mutation();
            assertEquals(m1, m2);
        }
    }

    @Test
    void resolvedConflict_cannotBeResolvedAgain() {
        ContextEntry prior = ContextEntry.of("a.b", ContextValue.text("x"), "p1/a", 0.5, List.of());
        ContextEntry incoming = ContextEntry.of("a.b", ContextValue.text("y"), "p1/b", 0.5, List.of());
        ContextConflict escalated = resolver.resolve(SESSION, snapshotWith(prior),
            pending(prior, incoming, ConflictClassification.VALUE_DISAGREEMENT)).get(0).conflict();

        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(SESSION, snapshotWith(prior), escalated));
    }

    private static ContextConflict pending(ContextEntry prior, ContextEntry incoming, ConflictClassification classification) {
        return ContextConflict.pending("cf-1-1", prior.key(), "p1", prior, incoming, classification);
    }

    private static ContextSnapshot snapshotWith(ContextEntry... entries) {
        TreeMap<String, ContextEntry> map = new TreeMap<>();
        for (ContextEntry entry : entries) {
            map.put(entry.key(), entry);
        }
        return new ContextSnapshot(SESSION, 1, "p1", map, List.of(), Instant.EPOCH);
    }
}
