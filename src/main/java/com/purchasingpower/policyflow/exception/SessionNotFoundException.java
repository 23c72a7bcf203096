package com.purchasingpower.policyflow.exception;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("No workflow checkpoint found for session: " + sessionId);
        this.sessionId = sessionId;
    }
}
