package com.switchyard.core.errors;

/**
 * Base type for every typed failure surfaced by the engine.
 */
public abstract class SwitchyardException extends RuntimeException {

    private final ErrorKind kind;

    protected SwitchyardException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SwitchyardException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
