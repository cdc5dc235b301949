package com.contextbus.scoring;

import com.contextbus.context.ContextSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the configured scorers, in order, over a final context snapshot.
 * A scorer that throws is skipped and logged; it never fails the session.
 */
public class StrategicAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(StrategicAnalysisService.class);

    private final List<StrategicScorer> scorers;

    public StrategicAnalysisService(List<StrategicScorer> scorers) {
        this.scorers = List.copyOf(scorers);
    }

    public List<ScoreDecision> analyze(ContextSnapshot context) {
        List<ScoreDecision> decisions = new ArrayList<>();
        for (StrategicScorer scorer : scorers) {
            try {
                ScoreDecision decision = scorer.score(context);
                log.debug("Scorer {}@{} decided '{}' ({})", scorer.scorerId(), scorer.scorerVersion(),
                    decision.decision(), decision.rationale());
                decisions.add(decision);
            } catch (RuntimeException ex) {
                log.warn("Scorer {} failed on context v{}: {}", scorer.scorerId(), context.version(), ex.getMessage());
            }
        }
        return decisions;
    }
}
