package com.contextbus.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EvidenceKind {
    IMPLEMENTATION("implementation"),
    DEPLOYMENT("deployment"),
    DOCUMENTATION("documentation"),
    PATTERN("pattern");

    private final String value;

    EvidenceKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Kinds that can approve a capability claim on their own. */
    public boolean approvesCapability() {
        return this == IMPLEMENTATION || this == PATTERN;
    }

    @JsonCreator
    public static EvidenceKind fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown evidence kind: " + raw));
    }
}
