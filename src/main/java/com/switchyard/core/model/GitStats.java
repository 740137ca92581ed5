package com.switchyard.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Diff size of a session's worktree against the merge base with its parent branch.
 * Includes committed, staged, unstaged and untracked changes.
 */
public record GitStats(
    String sessionId,
    int filesChanged,
    int linesAdded,
    int linesRemoved,
    boolean hasUncommitted,
    Instant calculatedAt
) {

    /**
     * A cache entry is fresh while {@code now - calculatedAt <= maxAge}.
     */
    public boolean isFresh(Instant now, Duration maxAge) {
        return Duration.between(calculatedAt, now).compareTo(maxAge) <= 0;
    }
}
