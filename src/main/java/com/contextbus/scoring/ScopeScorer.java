package com.contextbus.scoring;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Classifies the investigated surface as focused (one or two namespaces),
 * moderate, or broad (five or more), and lists the namespaces.
 */
public class ScopeScorer implements StrategicScorer {

    @Override
    public String scorerId() {
        return "scope";
    }

    @Override
    public String scorerVersion() {
        return "v1";
    }

    @Override
    public ScoreDecision score(ContextSnapshot context) {
        TreeMap<String, Integer> perNamespace = new TreeMap<>();
        for (ContextEntry entry : Findings.of(context)) {
            String namespace = entry.namespace().isEmpty() ? "(none)" : entry.namespace();
            perNamespace.merge(namespace, 1, Integer::sum);
        }
        int count = perNamespace.size();
        String decision = count >= 5 ? "broad" : count >= 3 ? "moderate" : "focused";
        return new ScoreDecision(scorerId(), scorerVersion(), decision, Math.min(1.0, count / 5.0),
            Map.of("namespaces", List.copyOf(perNamespace.keySet()), "entries_per_namespace", Map.copyOf(perNamespace)),
            count + " namespace(s) investigated");
    }
}
