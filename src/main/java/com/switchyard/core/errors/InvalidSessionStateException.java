package com.switchyard.core.errors;

public class InvalidSessionStateException extends SwitchyardException {

    private final String sessionId;
    private final String current;
    private final String expected;

    public InvalidSessionStateException(String sessionId, String current, String expected) {
        super(ErrorKind.INVALID_SESSION_STATE,
                "Session '%s' is in state '%s', expected '%s'".formatted(sessionId, current, expected));
        this.sessionId = sessionId;
        this.current = current;
        this.expected = expected;
    }

    public InvalidSessionStateException(String sessionId, String current, String expected, String message) {
        super(ErrorKind.INVALID_SESSION_STATE, message);
        this.sessionId = sessionId;
        this.current = current;
        this.expected = expected;
    }

    public String sessionId() {
        return sessionId;
    }

    public String current() {
        return current;
    }

    public String expected() {
        return expected;
    }
}
