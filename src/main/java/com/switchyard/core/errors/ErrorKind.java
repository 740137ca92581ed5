package com.switchyard.core.errors;

/**
 * Classification of engine failures, each with the exit code the CLI returns for it.
 */
public enum ErrorKind {
    SESSION_NOT_FOUND(2),
    SESSION_ALREADY_EXISTS(3),
    WORKTREE_NOT_FOUND(4),
    WORKTREE_ALREADY_EXISTS(5),
    GIT_OPERATION_FAILED(6),
    MERGE_CONFLICT(7),
    INVALID_SESSION_STATE(8),
    DATABASE_ERROR(9),
    INVALID_INPUT(10),
    IO_ERROR(11),
    AGENT_NOT_FOUND(12),
    TERMINAL_OPERATION_FAILED(13);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
