package com.contextbus.agent;

import java.time.Duration;

/**
 * Uniform contract for investigators. The scheduler knows nothing about
 * what an implementation inspects; it only sees findings, evidence,
 * confidence and a completion signal.
 *
 * Implementations may throw; the scheduler treats an exception like a
 * {@link AgentStatus#FAILED} result. The timeout is advisory, the scheduler
 * enforces it independently.
 */
public interface AgentAdapter {

    /** Identifier referenced by task definitions. */
    String agentKind();

    AgentResult run(InvestigationContext context, Duration timeout) throws Exception;
}
