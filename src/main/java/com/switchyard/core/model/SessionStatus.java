package com.switchyard.core.model;

import java.util.Locale;

/**
 * Record-level lifecycle status of a session row.
 */
public enum SessionStatus {
    ACTIVE,
    CANCELLED,
    SPEC;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionStatus fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
