package com.contextbus.scoring;

import com.contextbus.context.ContextEntry;
import com.contextbus.context.ContextSnapshot;
import com.contextbus.context.SemanticKeys;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Proposes a title for the artifact: the most confident summary or title
 * finding, prefixed with the job key when one was submitted.
 */
public class NamingScorer implements StrategicScorer {

    private static final Set<String> TITLE_NAMES = Set.of("title", "summary", "feature", "featurename");
    static final int MAX_TITLE_LENGTH = 120;

    @Override
    public String scorerId() {
        return "naming";
    }

    @Override
    public String scorerVersion() {
        return "v1";
    }

    @Override
    public ScoreDecision score(ContextSnapshot context) {
        Optional<ContextEntry> best = context.entries().values().stream()
            .filter(e -> TITLE_NAMES.contains(SemanticKeys.canonical(SemanticKeys.name(e.key()))))
            .max(Comparator.comparingDouble(ContextEntry::confidence)
                .thenComparing(ContextEntry::fromFoundation, Comparator.reverseOrder())
                .thenComparing(ContextEntry::key, Comparator.reverseOrder()));

        Optional<String> jobKey = context.entries().values().stream()
            .filter(ContextEntry::fromFoundation)
            .filter(e -> SemanticKeys.canonical(SemanticKeys.name(e.key())).equals("jobkey"))
            .map(e -> e.value().render())
            .findFirst();

        if (best.isEmpty()) {
            String fallback = jobKey.map(k -> k + ": investigation").orElse("Investigation");
            return new ScoreDecision(scorerId(), scorerVersion(), fallback, 0.0, Map.of(),
                "no title or summary finding");
        }

        String subject = best.get().value().render().trim();
        String title = jobKey.map(k -> k + ": " + subject).orElse(subject);
        if (title.length() > MAX_TITLE_LENGTH) {
            title = title.substring(0, MAX_TITLE_LENGTH - 3) + "...";
        }
        return new ScoreDecision(scorerId(), scorerVersion(), title, best.get().confidence(),
            Map.of("source_key", best.get().key()),
            "title derived from " + best.get().key() + " (" + best.get().sourceTask() + ")");
    }
}
