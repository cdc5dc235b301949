package com.contextbus.session;

public class LeaseExpiredException extends RuntimeException {

    public LeaseExpiredException(String sessionId) {
        super("lease of session " + sessionId + " expired");
    }
}
