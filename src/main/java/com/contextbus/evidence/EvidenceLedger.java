package com.contextbus.evidence;

import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-session record of claims and their provenance.
 */
public interface EvidenceLedger {

    EvidenceRecord record(String sessionId, EvidenceRecord evidence);

    List<EvidenceRecord> records(String sessionId);

    /** Records whose claim denotes the same concept as {@code claim}. */
    List<EvidenceRecord> recordsFor(String sessionId, String claim);

    Optional<EvidenceRecord> find(String sessionId, String evidenceId);

    void discard(String sessionId);
}
