package com.switchyard.core.errors;

/**
 * A git command or JGit call failed. {@code operation} names the logical step
 * (e.g. "create_branch", "worktree_add") rather than the raw command line.
 */
public class GitOperationException extends SwitchyardException {

    private final String operation;
    private final String detail;

    public GitOperationException(String operation, String detail) {
        super(ErrorKind.GIT_OPERATION_FAILED, "Git operation '%s' failed: %s".formatted(operation, detail));
        this.operation = operation;
        this.detail = detail;
    }

    public GitOperationException(String operation, String detail, Throwable cause) {
        super(ErrorKind.GIT_OPERATION_FAILED, "Git operation '%s' failed: %s".formatted(operation, detail), cause);
        this.operation = operation;
        this.detail = detail;
    }

    public String operation() {
        return operation;
    }

    public String detail() {
        return detail;
    }
}
