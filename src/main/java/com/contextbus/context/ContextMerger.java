package com.contextbus.context;

import com.contextbus.conflict.ConflictClassification;
import com.contextbus.conflict.ConflictDetector;
import com.contextbus.conflict.ContextConflict;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Pure merge of task contributions into a snapshot.
 *
 * An absent key is inserted. A present key is never overwritten: equal
 * values corroborate the prior entry, anything else leaves the prior value
 * in place and emits a pending {@link ContextConflict}. A key that differs
 * only by label from an existing one is held back as an alias conflict.
 */
public class ContextMerger {

    private final ConflictDetector detector;

    public ContextMerger(ConflictDetector detector) {
        this.detector = detector;
    }

    public MergeResult merge(ContextSnapshot base, String phase, List<ContextEntry> contributions) {
        if (contributions.isEmpty()) {
            return new MergeResult(base, List.of());
        }

        TreeMap<String, ContextEntry> working = new TreeMap<>(base.entries());
        Map<String, ContextEntry> upserts = new LinkedHashMap<>();
        List<ContextMutation> mutations = new ArrayList<>();
        List<ContextConflict> conflicts = new ArrayList<>();
        long nextVersion = base.version() + 1;

        for (ContextEntry incoming : contributions) {
            ContextEntry existing = working.get(incoming.key());
            if (existing == null) {
                Optional<ContextEntry> alias = findAlias(working, incoming.key());
                if (alias.isPresent()) {
                    conflicts.add(ContextConflict.pending(
                        conflictId(nextVersion, conflicts.size()), alias.get().key(), phase,
                        alias.get(), incoming, ConflictClassification.SEMANTIC_ALIAS));
                    mutations.add(new ContextMutation(MutationKind.CONFLICT_DEFERRED, incoming.key(),
                        incoming.sourceTask(), "alias of " + alias.get().key()));
                    continue;
                }
                working.put(incoming.key(), incoming);
                upserts.put(incoming.key(), incoming);
                mutations.add(new ContextMutation(MutationKind.INSERT, incoming.key(),
                    incoming.sourceTask(), incoming.value().render()));
                continue;
            }

            Optional<ConflictClassification> classification = detector.classify(existing, incoming);
            if (classification.isEmpty()) {
                ContextEntry corroborated = existing.corroboratedBy(incoming);
                working.put(incoming.key(), corroborated);
                upserts.put(incoming.key(), corroborated);
                mutations.add(new ContextMutation(MutationKind.CORROBORATE, incoming.key(),
                    incoming.sourceTask(), "same value from " + incoming.sourceTask()));
            } else {
                conflicts.add(ContextConflict.pending(
                    conflictId(nextVersion, conflicts.size()), incoming.key(), phase,
                    existing, incoming, classification.get()));
                mutations.add(new ContextMutation(MutationKind.CONFLICT_DEFERRED, incoming.key(),
                    incoming.sourceTask(), classification.get() + ": prior value kept provisionally"));
            }
        }

        ContextSnapshot next = base.next(phase, upserts, List.of(), mutations);
        return new MergeResult(next, conflicts);
    }

    private Optional<ContextEntry> findAlias(Map<String, ContextEntry> working, String key) {
        String canonical = SemanticKeys.canonical(key);
        return working.values().stream()
            .filter(e -> !e.key().equals(key))
            .filter(e -> SemanticKeys.canonical(e.key()).equals(canonical))
            .findFirst();
    }

    private static String conflictId(long version, int index) {
        return "cf-" + version + "-" + (index + 1);
    }
}
