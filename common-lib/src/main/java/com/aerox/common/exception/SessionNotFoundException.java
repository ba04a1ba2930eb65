package com.aerox.common.exception;

public class SessionNotFoundException extends CreditEngineException {
    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("NegotiationSessionStore", "no negotiation session " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
