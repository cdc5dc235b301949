package com.contextbus.agent;

public class UnknownAgentException extends RuntimeException {

    public UnknownAgentException(String agentKind) {
        super("no agent adapter registered for kind '" + agentKind + "'");
    }
}
