package com.contextbus.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, versioned view of the merged context of a session.
 *
 * Versions are only ever produced by the store: version 0 is the
 * foundation, each merge or resolution adds one. The mutations list
 * describes how this version was derived from the previous one.
 */
public record ContextSnapshot(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("version") long version,
    @JsonProperty("phase") String phase,
    @JsonProperty("entries") SortedMap<String, ContextEntry> entries,
    @JsonProperty("mutations") List<ContextMutation> mutations,
    @JsonProperty("created_at") Instant createdAt
) {

    public ContextSnapshot {
        entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
        mutations = List.copyOf(mutations);
    }

    public Optional<ContextEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /** Finds an entry whose key denotes the same concept as {@code key}. */
    public Optional<ContextEntry> findConcept(String key) {
        ContextEntry exact = entries.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        String canonical = SemanticKeys.canonical(key);
        return entries.values().stream()
            .filter(e -> SemanticKeys.canonical(e.key()).equals(canonical))
            .findFirst();
    }

    public int size() {
        return entries.size();
    }

    /** Rough character footprint used by the budget monitor. */
    @JsonIgnore
    public long footprint() {
        long total = 0;
        for (Map.Entry<String, ContextEntry> e : entries.entrySet()) {
            total += e.getKey().length() + e.getValue().value().render().length();
            for (String ref : e.getValue().evidenceRefs()) {
                total += ref.length();
            }
        }
        return total;
    }

    /**
     * Derives the next version. Entries in {@code upserts} replace or add,
     * keys in {@code removals} are dropped before upserts apply.
     */
    public ContextSnapshot next(String phase, Map<String, ContextEntry> upserts,
                                List<String> removals, List<ContextMutation> mutations) {
        TreeMap<String, ContextEntry> copy = new TreeMap<>(entries);
        removals.forEach(copy::remove);
        copy.putAll(upserts);
        return new ContextSnapshot(sessionId, version + 1, phase, copy, mutations, Instant.now());
    }
}
