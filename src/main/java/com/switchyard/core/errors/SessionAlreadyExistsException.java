package com.switchyard.core.errors;

public class SessionAlreadyExistsException extends SwitchyardException {

    private final String sessionId;

    public SessionAlreadyExistsException(String sessionId) {
        super(ErrorKind.SESSION_ALREADY_EXISTS, "Session '%s' already exists".formatted(sessionId));
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
