package com.switchyard.git;

import com.switchyard.core.errors.InvalidInputException;

import java.util.regex.Pattern;

/**
 * Name rules for branches and sessions, plus the internal tooling directory that
 * status, stats and conflict reporting ignore.
 */
public final class GitNames {

    /** Per-worktree tooling directory; never counted as user changes. */
    public static final String INTERNAL_DIR = ".switchyard";

    public static final int MAX_SESSION_NAME_LENGTH = 100;

    private static final Pattern BRANCH_CHARS = Pattern.compile("[A-Za-z0-9/_.\\-]+");
    private static final Pattern SESSION_CHARS = Pattern.compile("[A-Za-z0-9_\\-]+");

    private GitNames() {}

    public static void validateBranchName(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidInputException("branch", "Branch name cannot be empty");
        }
        if (name.contains("..") || name.indexOf('\0') >= 0 || name.indexOf('\\') >= 0) {
            throw new InvalidInputException("branch", "Invalid branch name '%s'".formatted(name));
        }
        if (!BRANCH_CHARS.matcher(name).matches()) {
            throw new InvalidInputException("branch", "Branch name '%s' contains invalid characters".formatted(name));
        }
    }

    public static boolean isValidSessionName(String name) {
        return name != null
                && !name.isEmpty()
                && name.length() <= MAX_SESSION_NAME_LENGTH
                && SESSION_CHARS.matcher(name).matches();
    }

    public static void validateSessionName(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidInputException("name", "Session name cannot be empty");
        }
        if (name.length() > MAX_SESSION_NAME_LENGTH) {
            throw new InvalidInputException("name",
                    "Session name must be at most %d characters".formatted(MAX_SESSION_NAME_LENGTH));
        }
        if (!SESSION_CHARS.matcher(name).matches()) {
            throw new InvalidInputException("name",
                    "Session name '%s' may only contain letters, digits, '_' and '-'".formatted(name));
        }
    }

    public static boolean isInternalPath(String path) {
        return path.equals(INTERNAL_DIR) || path.startsWith(INTERNAL_DIR + "/");
    }
}
