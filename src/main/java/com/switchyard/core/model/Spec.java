package com.switchyard.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A draft task that has not been materialized into a worktree yet.
 */
public record Spec(
    String id,
    String name,
    String displayName,
    String epicId,
    Path repositoryPath,
    String repositoryName,
    String content,
    Instant createdAt,
    Instant updatedAt
) {
}
