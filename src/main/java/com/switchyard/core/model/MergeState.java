package com.switchyard.core.model;

import java.util.List;

/**
 * Divergence of a session branch relative to its parent, computed without touching the repository.
 */
public record MergeState(
    boolean hasConflicts,
    List<String> conflictingPaths,
    boolean isUpToDate
) {

    public static MergeState upToDate() {
        return new MergeState(false, List.of(), true);
    }
}
