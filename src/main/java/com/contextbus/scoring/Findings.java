package com.contextbus.scoring;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;

import java.util.List;

final class Findings {

    private Findings() {}

    /** Investigated entries, foundation parameters excluded. */
    static List<ContextEntry> of(ContextSnapshot context) {
        return context.entries().values().stream().filter(e -> !e.fromFoundation()).toList();
    }
}
