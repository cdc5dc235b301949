package com.contextbus.scheduler;

import com.contextbus.context.ContextSnapshot;

/**
 * How a pipeline run ended. Errors that abort the run surface as exceptions.
 */
public sealed interface PipelineResult {

    ContextSnapshot finalSnapshot();

    record Completed(ContextSnapshot finalSnapshot) implements PipelineResult {}

    record Halted(HaltReason reason, ContextSnapshot finalSnapshot) implements PipelineResult {}
}
