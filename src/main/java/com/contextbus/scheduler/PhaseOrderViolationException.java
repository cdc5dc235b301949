package com.contextbus.scheduler;

/**
 * A phase was started before its dependencies completed, or the declared
 * phase graph is not a DAG. Always a programming or configuration error.
 */
public class PhaseOrderViolationException extends RuntimeException {

    public PhaseOrderViolationException(String message) {
        super(message);
    }
}
