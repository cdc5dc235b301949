package com.contextbus.scoring;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.SemanticKeys;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a declared priority (any entry whose name is {@code priority}) onto
 * High, Medium or Low. Investigated values outrank the submitted one; when
 * nothing declares a priority the decision is Medium.
 */
public class PriorityScorer implements StrategicScorer {

    private static final Map<String, Double> LEVELS = Map.of(
        "blocker", 1.0,
        "critical", 0.9,
        "high", 0.8,
        "major", 0.6,
        "normal", 0.5,
        "medium", 0.5,
        "minor", 0.3,
        "low", 0.2,
        "trivial", 0.1
    );

    @Override
    public String scorerId() {
        return "priority";
    }

    @Override
    public String scorerVersion() {
        return "v1";
    }

    @Override
    public ScoreDecision score(ContextSnapshot context) {
        Optional<ContextEntry> declared = context.entries().values().stream()
            .filter(e -> SemanticKeys.canonical(SemanticKeys.name(e.key())).equals("priority"))
            .min(Comparator.comparing(ContextEntry::fromFoundation).thenComparing(ContextEntry::key));

        if (declared.isEmpty()) {
            return new ScoreDecision(scorerId(), scorerVersion(), "Medium", 0.5, Map.of(),
                "no priority declared");
        }

        String raw = declared.get().value().render().trim().toLowerCase(Locale.ROOT);
        double score = LEVELS.getOrDefault(raw, 0.5);
        String decision = score >= 0.75 ? "High" : score >= 0.45 ? "Medium" : "Low";
        return new ScoreDecision(scorerId(), scorerVersion(), decision, score,
            Map.of("source_key", declared.get().key(), "declared", raw),
            "declared priority '" + raw + "' from " + declared.get().sourceTask());
    }
}
