package com.contextbus.scoring;

import com.contextbus.context.ContextSnapshot;

/**
 * An opaque strategic analysis: a pure, versioned function from the final
 * context to a decision. Implementations must not call external systems.
 */
public interface StrategicScorer {

    /** Unique identifier, e.g. "complexity". */
    String scorerId();

    /** Semantic version, e.g. "v1". */
    String scorerVersion();

    ScoreDecision score(ContextSnapshot context);
}
