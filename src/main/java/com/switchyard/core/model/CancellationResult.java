package com.switchyard.core.model;

import java.util.List;

/**
 * What a cancellation managed to tear down. Non-fatal failures are listed in {@code errors}.
 */
public record CancellationResult(
    List<String> closedTerminals,
    boolean worktreeRemoved,
    boolean branchDeleted,
    List<String> errors
) {
}
