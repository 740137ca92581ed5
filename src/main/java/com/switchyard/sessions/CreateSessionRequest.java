package com.switchyard.sessions;

/**
 * Input to {@link SessionService#createSession(CreateSessionRequest)}.
 *
 * @param name             session name, also the last branch segment
 * @param displayName      optional label
 * @param parentBranch     branch to fork from; the configured default when null or blank
 * @param initialPrompt    prompt the agent starts with
 * @param asSpec           create a spec-state session without a worktree
 * @param wasAutoGenerated the name was generated rather than chosen
 * @param agentType        agent the session is created for
 * @param skipPermissions  whether the agent runs with permission prompts disabled
 * @param versionGroupId   groups variants started from one prompt
 * @param versionNumber    position within the version group
 * @param epicId           optional epic
 */
public record CreateSessionRequest(
    String name,
    String displayName,
    String parentBranch,
    String initialPrompt,
    boolean asSpec,
    boolean wasAutoGenerated,
    String agentType,
    Boolean skipPermissions,
    String versionGroupId,
    Integer versionNumber,
    String epicId
) {

    public static CreateSessionRequest of(String name, String parentBranch, String initialPrompt) {
        return new CreateSessionRequest(name, null, parentBranch, initialPrompt, false, false,
                null, null, null, null, null);
    }

    public static CreateSessionRequest spec(String name, String content) {
        return new CreateSessionRequest(name, null, null, content, true, false,
                null, null, null, null, null);
    }

    public CreateSessionRequest withAgent(String agentType, Boolean skipPermissions) {
        return new CreateSessionRequest(name, displayName, parentBranch, initialPrompt, asSpec, wasAutoGenerated,
                agentType, skipPermissions, versionGroupId, versionNumber, epicId);
    }

    public CreateSessionRequest withEpic(String epicId) {
        return new CreateSessionRequest(name, displayName, parentBranch, initialPrompt, asSpec, wasAutoGenerated,
                agentType, skipPermissions, versionGroupId, versionNumber, epicId);
    }
}
