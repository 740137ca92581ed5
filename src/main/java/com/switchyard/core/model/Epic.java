package com.switchyard.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A named, colored grouping that sessions and specs reference by id.
 */
public record Epic(
    String id,
    Path repositoryPath,
    String name,
    String color,
    Instant createdAt,
    Instant updatedAt
) {
}
