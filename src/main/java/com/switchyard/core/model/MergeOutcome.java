package com.switchyard.core.model;

/**
 * Result of a successful merge; {@code newCommit} is the parent branch's new tip.
 */
public record MergeOutcome(
    String sessionBranch,
    String parentBranch,
    String newCommit,
    MergeMode mode
) {
}
