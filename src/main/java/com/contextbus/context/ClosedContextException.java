package com.contextbus.context;

/**
 * Thrown when a write targets a session whose context was closed, e.g.
 * after its lease was reclaimed.
 */
public class ClosedContextException extends RuntimeException {

    public ClosedContextException(String sessionId) {
        super("context of session " + sessionId + " is closed");
    }
}
