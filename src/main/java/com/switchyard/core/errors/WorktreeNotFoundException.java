package com.switchyard.core.errors;

import java.nio.file.Path;

public class WorktreeNotFoundException extends SwitchyardException {

    private final Path path;

    public WorktreeNotFoundException(Path path) {
        super(ErrorKind.WORKTREE_NOT_FOUND, "Worktree not found at " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
