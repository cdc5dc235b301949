package com.contextbus.evidence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceGateTest {

    private static final String SESSION = "ses-gate";

    private EvidenceLedger ledger;
    private EvidenceGate gate;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryEvidenceLedger();
        gate = new EvidenceGate(ledger);
    }

    @Test
    void implementationEvidence_approves() {
        ledger.record(SESSION, EvidenceRecord.of("feature.digestUpgrade", EvidenceKind.IMPLEMENTATION, "commit:1a2b"));

        GateResult result = gate.validate(SESSION, "feature.digestUpgrade");

        GateResult.Approved approved = assertInstanceOf(GateResult.Approved.class, result);
        assertEquals(1, approved.support().size());
        assertFalse(approved.deploymentConfirmed());
    }

    @Test
    void patternEvidence_approves_andDeploymentMarksDeployed() {
        ledger.record(SESSION, EvidenceRecord.of("feature.digestUpgrade", EvidenceKind.PATTERN, "pattern:upgrade"));
        ledger.record(SESSION, EvidenceRecord.of("feature.digestUpgrade", EvidenceKind.DEPLOYMENT, "probe:qe6"));

        GateResult.Approved approved = assertInstanceOf(GateResult.Approved.class,
            gate.validate(SESSION, "feature.digestUpgrade"));
        assertTrue(approved.deploymentConfirmed());
        assertEquals(EvidenceKind.PATTERN, approved.support().get(0).kind());
    }

    @Test
    @DisplayName("Deployment evidence alone never approves; the nearest approved claim is suggested")
    void deploymentOnly_requiresAlternative() {
        ledger.record(SESSION, EvidenceRecord.of("feature.upgradeStatus", EvidenceKind.DEPLOYMENT, "probe:qe6"));
        ledger.record(SESSION, EvidenceRecord.of("feature.upgradeSupport", EvidenceKind.IMPLEMENTATION, "commit:9f"));
        ledger.record(SESSION, EvidenceRecord.of("feature.consoleBanner", EvidenceKind.IMPLEMENTATION, "commit:77"));
        ledger.record(SESSION, EvidenceRecord.of("other.upgradeStatusPage", EvidenceKind.IMPLEMENTATION, "commit:42"));

        GateResult result = gate.validate(SESSION, "feature.upgradeStatus");

        GateResult.RequiresAlternative alternative = assertInstanceOf(GateResult.RequiresAlternative.class, result);
        assertEquals("feature.upgradeSupport", alternative.suggestion());
        assertTrue(alternative.reason().contains("deployment"), alternative.reason());
    }

    @Test
    void documentationOnly_withoutAlternative_isRejected() {
        ledger.record(SESSION, EvidenceRecord.of("docs.releaseNote", EvidenceKind.DOCUMENTATION, "https://docs/1"));

        GateResult.Rejected rejected = assertInstanceOf(GateResult.Rejected.class,
            gate.validate(SESSION, "docs.releaseNote"));
        assertTrue(rejected.reason().contains("documentation"));
    }

    @Test
    void unknownClaim_isRejected() {
        GateResult.Rejected rejected = assertInstanceOf(GateResult.Rejected.class,
            gate.validate(SESSION, "feature.invented"));
        assertEquals("no evidence recorded for claim", rejected.reason());
    }

    @Test
    void claimLabelsAreMatchedByConcept() {
        ledger.record(SESSION, EvidenceRecord.of("feature.digest_upgrade", EvidenceKind.IMPLEMENTATION, "commit:1"));

        assertTrue(gate.validate(SESSION, "feature.digestUpgrade").isApproved());
    }

    @Test
    void ledgersAreIsolatedPerSession() {
        ledger.record("ses-other", EvidenceRecord.of("feature.x", EvidenceKind.IMPLEMENTATION, "commit:1"));

        assertFalse(gate.validate(SESSION, "feature.x").isApproved());
        ledger.discard("ses-other");
        assertTrue(ledger.records("ses-other").isEmpty());
    }
}
