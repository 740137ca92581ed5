package com.switchyard.agents;

import java.util.List;

/**
 * @param cwd     working directory, unquoted
 * @param agent   the agent token as written, possibly a path
 * @param agentId the supported agent it resolved to
 * @param args    arguments after the agent token
 */
public record ParsedAgentCommand(String cwd, String agent, String agentId, List<String> args) {
}
