package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.SemanticKeys;

import java.util.Optional;

/**
 * Classifies a pair of entries that touch the same semantic key.
 *
 * Rules apply in priority order: alias (different labels, same concept),
 * type mismatch (different domains or schema conformance), then plain
 * value disagreement. Equal values under the same key are corroboration,
 * not conflict.
 */
public class ConflictDetector {

    private final KeySchemaTable schemas;

    public ConflictDetector(KeySchemaTable schemas) {
        this.schemas = schemas;
    }

    public Optional<ConflictClassification> classify(ContextEntry prior, ContextEntry incoming) {
        if (!prior.key().equals(incoming.key())) {
            if (SemanticKeys.sameConcept(prior.key(), incoming.key())) {
                return Optional.of(ConflictClassification.SEMANTIC_ALIAS);
            }
            return Optional.empty();
        }
        return classifyValues(prior.key(), prior, incoming);
    }

    /** Classification ignoring labels, used once aliases share a key. */
    public Optional<ConflictClassification> classifyValues(String key, ContextEntry left, ContextEntry right) {
        if (left.value().equals(right.value())) {
            return Optional.empty();
        }
        if (left.value().domain() != right.value().domain()) {
            return Optional.of(ConflictClassification.TYPE_MISMATCH);
        }
        if (schemas.conforms(key, left.value()) != schemas.conforms(key, right.value())) {
            return Optional.of(ConflictClassification.TYPE_MISMATCH);
        }
        return Optional.of(ConflictClassification.VALUE_DISAGREEMENT);
    }
}
