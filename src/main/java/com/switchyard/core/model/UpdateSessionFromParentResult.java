package com.switchyard.core.model;

import java.util.List;

/**
 * Outcome of moving a session's work forward onto the latest parent tip.
 */
public record UpdateSessionFromParentResult(
    UpdateStatus status,
    String parentBranch,
    String message,
    List<String> conflictingPaths
) {

    public static UpdateSessionFromParentResult of(UpdateStatus status, String parentBranch, String message) {
        return new UpdateSessionFromParentResult(status, parentBranch, message, List.of());
    }
}
