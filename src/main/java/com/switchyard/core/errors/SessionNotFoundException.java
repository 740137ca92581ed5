package com.switchyard.core.errors;

public class SessionNotFoundException extends SwitchyardException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorKind.SESSION_NOT_FOUND, "Session '%s' not found".formatted(sessionId));
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
