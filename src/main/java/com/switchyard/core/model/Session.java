package com.switchyard.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A unit of isolated agent work: one branch checked out into one worktree.
 * <p>
 * Instances are immutable; state changes produce a copy through {@link #toBuilder()}.
 * The worktree exists on disk iff {@code sessionState != SPEC}.
 *
 * @param id                      stable identifier (UUID)
 * @param name                    unique per repository, also the last branch segment
 * @param displayName             optional human label
 * @param versionGroupId          groups multi-variant sessions started from one prompt
 * @param versionNumber           position within the version group
 * @param repositoryPath          the repository this session belongs to
 * @param repositoryName          last path segment of the repository
 * @param branch                  session branch, e.g. {@code switchyard/alpha}
 * @param parentBranch            branch the session reconciles into
 * @param originalParentBranch    parent branch at creation time, never updated
 * @param worktreePath            isolated working directory
 * @param status                  row lifecycle status
 * @param sessionState            work state
 * @param createdAt               creation time
 * @param updatedAt               last row update
 * @param lastActivity            last observed activity, null until stamped
 * @param initialPrompt           prompt the agent was started with
 * @param specContent             draft content while the session is a spec
 * @param readyToMerge            set by the review flow
 * @param resumeAllowed           whether the agent may resume its previous conversation
 * @param pendingNameGeneration   a generated display name is still pending
 * @param wasAutoGenerated        the name was generated rather than chosen
 * @param originalAgentType       agent the session was created for
 * @param originalSkipPermissions whether the agent was started with permission prompts disabled
 * @param epicId                  optional epic grouping
 */
public record Session(
    String id,
    String name,
    String displayName,
    String versionGroupId,
    Integer versionNumber,
    Path repositoryPath,
    String repositoryName,
    String branch,
    String parentBranch,
    String originalParentBranch,
    Path worktreePath,
    SessionStatus status,
    SessionState sessionState,
    Instant createdAt,
    Instant updatedAt,
    Instant lastActivity,
    String initialPrompt,
    String specContent,
    boolean readyToMerge,
    boolean resumeAllowed,
    boolean pendingNameGeneration,
    boolean wasAutoGenerated,
    String originalAgentType,
    Boolean originalSkipPermissions,
    String epicId
) {

    public boolean isSpec() {
        return sessionState == SessionState.SPEC;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String displayName;
        private String versionGroupId;
        private Integer versionNumber;
        private Path repositoryPath;
        private String repositoryName;
        private String branch;
        private String parentBranch;
        private String originalParentBranch;
        private Path worktreePath;
        private SessionStatus status = SessionStatus.ACTIVE;
        private SessionState sessionState = SessionState.RUNNING;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastActivity;
        private String initialPrompt;
        private String specContent;
        private boolean readyToMerge;
        private boolean resumeAllowed = true;
        private boolean pendingNameGeneration;
        private boolean wasAutoGenerated;
        private String originalAgentType;
        private Boolean originalSkipPermissions;
        private String epicId;

        private Builder() {
        }

        private Builder(Session s) {
            this.id = s.id;
            this.name = s.name;
            this.displayName = s.displayName;
            this.versionGroupId = s.versionGroupId;
            this.versionNumber = s.versionNumber;
            this.repositoryPath = s.repositoryPath;
            this.repositoryName = s.repositoryName;
            this.branch = s.branch;
            this.parentBranch = s.parentBranch;
            this.originalParentBranch = s.originalParentBranch;
            this.worktreePath = s.worktreePath;
            this.status = s.status;
            this.sessionState = s.sessionState;
            this.createdAt = s.createdAt;
            this.updatedAt = s.updatedAt;
            this.lastActivity = s.lastActivity;
            this.initialPrompt = s.initialPrompt;
            this.specContent = s.specContent;
            this.readyToMerge = s.readyToMerge;
            this.resumeAllowed = s.resumeAllowed;
            this.pendingNameGeneration = s.pendingNameGeneration;
            this.wasAutoGenerated = s.wasAutoGenerated;
            this.originalAgentType = s.originalAgentType;
            this.originalSkipPermissions = s.originalSkipPermissions;
            this.epicId = s.epicId;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder displayName(String displayName) { this.displayName = displayName; return this; }
        public Builder versionGroupId(String versionGroupId) { this.versionGroupId = versionGroupId; return this; }
        public Builder versionNumber(Integer versionNumber) { this.versionNumber = versionNumber; return this; }
        public Builder repositoryPath(Path repositoryPath) { this.repositoryPath = repositoryPath; return this; }
        public Builder repositoryName(String repositoryName) { this.repositoryName = repositoryName; return this; }
        public Builder branch(String branch) { this.branch = branch; return this; }
        public Builder parentBranch(String parentBranch) { this.parentBranch = parentBranch; return this; }
        public Builder originalParentBranch(String originalParentBranch) { this.originalParentBranch = originalParentBranch; return this; }
        public Builder worktreePath(Path worktreePath) { this.worktreePath = worktreePath; return this; }
        public Builder status(SessionStatus status) { this.status = status; return this; }
        public Builder sessionState(SessionState sessionState) { this.sessionState = sessionState; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder lastActivity(Instant lastActivity) { this.lastActivity = lastActivity; return this; }
        public Builder initialPrompt(String initialPrompt) { this.initialPrompt = initialPrompt; return this; }
        public Builder specContent(String specContent) { this.specContent = specContent; return this; }
        public Builder readyToMerge(boolean readyToMerge) { this.readyToMerge = readyToMerge; return this; }
        public Builder resumeAllowed(boolean resumeAllowed) { this.resumeAllowed = resumeAllowed; return this; }
        public Builder pendingNameGeneration(boolean pendingNameGeneration) { this.pendingNameGeneration = pendingNameGeneration; return this; }
        public Builder wasAutoGenerated(boolean wasAutoGenerated) { this.wasAutoGenerated = wasAutoGenerated; return this; }
        public Builder originalAgentType(String originalAgentType) { this.originalAgentType = originalAgentType; return this; }
        public Builder originalSkipPermissions(Boolean originalSkipPermissions) { this.originalSkipPermissions = originalSkipPermissions; return this; }
        public Builder epicId(String epicId) { this.epicId = epicId; return this; }

        public Session build() {
            return new Session(id, name, displayName, versionGroupId, versionNumber, repositoryPath,
                    repositoryName, branch, parentBranch, originalParentBranch, worktreePath, status,
                    sessionState, createdAt, updatedAt, lastActivity, initialPrompt, specContent,
                    readyToMerge, resumeAllowed, pendingNameGeneration, wasAutoGenerated,
                    originalAgentType, originalSkipPermissions, epicId);
        }
    }
}
