package com.contextbus.context;

public enum MutationKind {
    SEED,
    INSERT,
    CORROBORATE,
    CONFLICT_DEFERRED,
    CANONICALIZE,
    RESOLVE,
    ESCALATE
}
