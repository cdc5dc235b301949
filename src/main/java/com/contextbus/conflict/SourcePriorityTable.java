package com.contextbus.conflict;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.SemanticKeys;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authoritative sources per key or namespace, most authoritative first.
 *
 * A source matches an entry when it names the entry's task id or the agent
 * kind of that task ({@code phase/agentKind}). {@code foundation} names the
 * values seeded at submission.
 */
public class SourcePriorityTable {

    private final Map<String, List<String>> priorities;

    public SourcePriorityTable(Map<String, List<String>> priorities) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        priorities.forEach((scope, sources) -> copy.put(scope, List.copyOf(sources)));
        this.priorities = Map.copyOf(copy);
    }

    public static SourcePriorityTable empty() {
        return new SourcePriorityTable(Map.of());
    }

    public List<String> sourcesFor(String key) {
        List<String> exact = priorities.get(key);
        if (exact != null) {
            return exact;
        }
        return priorities.getOrDefault(SemanticKeys.namespace(key), List.of());
    }

    /** Position of the entry's source in the table, {@link Integer#MAX_VALUE} when unlisted. */
    public int rank(String key, ContextEntry entry) {
        List<String> sources = sourcesFor(key);
        for (int i = 0; i < sources.size(); i++) {
            if (matches(sources.get(i), entry.sourceTask())) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }

    private static boolean matches(String source, String sourceTask) {
        return source.equals(sourceTask) || sourceTask.endsWith("/" + source);
    }
}
