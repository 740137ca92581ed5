package com.switchyard.core.model;

import java.util.List;

/**
 * Read-only view of what merging a session would do. The command lists are
 * illustrative equivalents of the operations the engine performs.
 */
public record MergePreview(
    String sessionBranch,
    String parentBranch,
    List<String> squashCommands,
    List<String> reapplyCommands,
    String defaultCommitMessage,
    boolean hasConflicts,
    List<String> conflictingPaths,
    boolean isUpToDate
) {
}
