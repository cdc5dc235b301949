package com.contextbus.conflict;

/**
 * Conflict kinds, declared in classification priority order.
 */
public enum ConflictClassification {
    SEMANTIC_ALIAS,
    TYPE_MISMATCH,
    VALUE_DISAGREEMENT
}
