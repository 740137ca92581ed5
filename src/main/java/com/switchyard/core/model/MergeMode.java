package com.switchyard.core.model;

/**
 * How session work lands on the parent branch.
 */
public enum MergeMode {
    /** One new commit on top of the parent containing all session changes. */
    SQUASH,
    /** Session commits replayed onto the parent, parent fast-forwarded to them. */
    REAPPLY
}
