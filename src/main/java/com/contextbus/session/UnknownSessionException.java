package com.contextbus.session;

public class UnknownSessionException extends RuntimeException {

    public UnknownSessionException(String sessionId) {
        super("unknown session: " + sessionId);
    }
}
