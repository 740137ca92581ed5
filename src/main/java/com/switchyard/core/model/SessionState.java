package com.switchyard.core.model;

import java.util.Locale;

/**
 * Work state of a session. {@link #SPEC} sessions have no worktree on disk.
 */
public enum SessionState {
    SPEC,
    RUNNING,
    REVIEWED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionState fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
