package com.contextbus.orchestration;

import com.contextbus.conflict.ContextConflict;
import com.contextbus.conflict.ResolutionStatus;
import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.ContextValue;
import com.contextbus.context.SemanticKeys;
import com.contextbus.evidence.EvidenceGate;
import com.contextbus.evidence.EvidenceKind;
import com.contextbus.evidence.EvidenceLedger;
import com.contextbus.evidence.EvidenceRecord;
import com.contextbus.evidence.GateResult;
import com.contextbus.scheduler.TaskReport;
import com.contextbus.scoring.StrategicAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the artifact from a completed session's final snapshot, gating
 * every investigated entry through the evidence gate.
 *
 * Approved entries become claims. A claim that requires an alternative is
 * replaced by the suggested claim; a rejected claim is dropped. Both are
 * recorded as caveats. Before the artifact is returned every claim is
 * validated once more, so nothing unapproved can slip in through a
 * substitution.
 */
public class ArtifactAssembler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactAssembler.class);

    static final String ALTERNATIVE_REF_TYPE = "evidence-claim";

    private final EvidenceGate gate;
    private final EvidenceLedger ledger;
    private final StrategicAnalysisService analysis;
    private final Clock clock;

    public ArtifactAssembler(EvidenceGate gate, EvidenceLedger ledger, StrategicAnalysisService analysis, Clock clock) {
        this.gate = gate;
        this.ledger = ledger;
        this.analysis = analysis;
        this.clock = clock;
    }

    public Artifact assemble(String sessionId, String jobKey, ContextSnapshot finalSnapshot,
                             List<TaskReport> reports, List<ContextConflict> conflicts) {
        List<Caveat> caveats = new ArrayList<>();
        Map<String, ArtifactClaim> claims = new LinkedHashMap<>();
        boolean deploymentChecked = ledger.records(sessionId).stream()
            .anyMatch(r -> r.kind() == EvidenceKind.DEPLOYMENT);

        for (ContextEntry entry : finalSnapshot.entries().values()) {
            if (entry.fromFoundation()) {
                continue;
            }
            GateResult result = gate.validate(sessionId, entry.key());
            if (result instanceof GateResult.Approved approved) {
                claims.putIfAbsent(SemanticKeys.canonical(entry.key()), claimOf(entry, approved, null));
            } else if (result instanceof GateResult.RequiresAlternative alternative) {
                substitute(sessionId, finalSnapshot, entry, alternative, claims, caveats);
            } else {
                GateResult.Rejected rejected = (GateResult.Rejected) result;
                caveats.add(new Caveat(CaveatKind.DROPPED_CLAIM, entry.key(),
                    "claim dropped: " + rejected.reason()));
            }
        }

        List<ArtifactClaim> verified = new ArrayList<>();
        for (ArtifactClaim claim : claims.values()) {
            GateResult recheck = gate.validate(sessionId, claim.claim());
            if (recheck.isApproved()) {
                verified.add(claim);
            } else {
                log.error("Claim {} failed re-validation at construction; dropped", claim.claim());
                caveats.add(new Caveat(CaveatKind.DROPPED_CLAIM, claim.claim(), "claim failed re-validation"));
            }
        }

        if (deploymentChecked) {
            for (ArtifactClaim claim : verified) {
                if (!claim.deploymentConfirmed()) {
                    caveats.add(new Caveat(CaveatKind.NOT_YET_DEPLOYED, claim.claim(),
                        "implemented in source; deployment not confirmed"));
                }
            }
        }
        for (TaskReport report : reports) {
            if (report.isDegraded()) {
                caveats.add(new Caveat(CaveatKind.DEGRADED_TASK, report.taskId(), report.exhausted()
                    ? "no findings after " + report.attempts() + " attempt(s): " + report.note()
                    : "partial findings, confidence reduced" + (report.note() == null ? "" : ": " + report.note())));
            }
        }
        for (ContextConflict conflict : conflicts) {
            if (conflict.resolution() == ResolutionStatus.ESCALATED) {
                String rationale = conflict.detail() == null ? "unresolved" : conflict.detail().rationale();
                caveats.add(new Caveat(CaveatKind.ESCALATED_CONFLICT, conflict.key(),
                    conflict.classification() + " left unresolved; provisional value kept: " + rationale));
            }
        }

        Artifact artifact = new Artifact(sessionId, jobKey, finalSnapshot.version(), verified, caveats,
            analysis.analyze(finalSnapshot), clock.instant());
        log.info("Assembled artifact for session={} from context v{}: {} claim(s), {} caveat(s)",
            sessionId, finalSnapshot.version(), verified.size(), caveats.size());
        return artifact;
    }

    private void substitute(String sessionId, ContextSnapshot snapshot, ContextEntry entry,
                            GateResult.RequiresAlternative alternative,
                            Map<String, ArtifactClaim> claims, List<Caveat> caveats) {
        String suggestion = alternative.suggestion();
        caveats.add(new Caveat(CaveatKind.SUBSTITUTED_CLAIM, entry.key(),
            "replaced by " + suggestion + ": " + alternative.reason()));

        GateResult suggested = gate.validate(sessionId, suggestion);
        if (!(suggested instanceof GateResult.Approved approved)) {
            return;
        }
        Optional<ContextEntry> backing = snapshot.findConcept(suggestion);
        ContextEntry source = backing.orElseGet(() -> new ContextEntry(suggestion,
            ContextValue.reference(ALTERNATIVE_REF_TYPE, suggestion),
            sourceOf(approved.support()), entry.confidence(), List.of(), false));
        claims.putIfAbsent(SemanticKeys.canonical(source.key()),
            claimOf(source, approved, entry.key()));
    }

    private static String sourceOf(List<EvidenceRecord> support) {
        return support.stream().map(EvidenceRecord::sourceTask).filter(s -> s != null).findFirst().orElse("ledger");
    }

    private static ArtifactClaim claimOf(ContextEntry entry, GateResult.Approved approved, String substitutedFor) {
        List<String> evidenceIds = approved.support().stream().map(EvidenceRecord::evidenceId).toList();
        return new ArtifactClaim(entry.key(), entry.value(), entry.sourceTask(), entry.confidence(),
            evidenceIds, approved.deploymentConfirmed(), substitutedFor);
    }
}
