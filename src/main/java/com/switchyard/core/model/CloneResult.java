package com.switchyard.core.model;

import java.nio.file.Path;

/**
 * @param projectPath    directory the repository was cloned into
 * @param defaultBranch  branch checked out after the clone, null if it could not be read
 * @param remoteDisplay  credential-free remote label for display
 */
public record CloneResult(Path projectPath, String defaultBranch, String remoteDisplay) {
}
