package com.contextbus.evidence;

import com.contextbus.context.SemanticKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryEvidenceLedger implements EvidenceLedger {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<EvidenceRecord>> ledgers = new ConcurrentHashMap<>();

    @Override
    public EvidenceRecord record(String sessionId, EvidenceRecord evidence) {
        ledgers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(evidence);
        return evidence;
    }

    @Override
    public List<EvidenceRecord> records(String sessionId) {
        List<EvidenceRecord> records = ledgers.get(sessionId);
        return records == null ? Collections.emptyList() : List.copyOf(records);
    }

    @Override
    public List<EvidenceRecord> recordsFor(String sessionId, String claim) {
        String canonical = SemanticKeys.canonical(claim);
        return records(sessionId).stream()
            .filter(r -> SemanticKeys.canonical(r.claim()).equals(canonical))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<EvidenceRecord> find(String sessionId, String evidenceId) {
        return records(sessionId).stream()
            .filter(r -> evidenceId.equals(r.evidenceId()))
            .findFirst();
    }

    @Override
    public void discard(String sessionId) {
        ledgers.remove(sessionId);
    }
}
