package com.switchyard.core.errors;

import java.nio.file.Path;

public class WorktreeAlreadyExistsException extends SwitchyardException {

    private final Path path;

    public WorktreeAlreadyExistsException(Path path) {
        super(ErrorKind.WORKTREE_ALREADY_EXISTS, "Worktree already exists at " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
