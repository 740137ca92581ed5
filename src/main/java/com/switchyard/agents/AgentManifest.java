package com.switchyard.agents;

import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.AgentNotFoundException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The agents Switchyard can launch, with per-agent binary, environment and argument overrides
 * taken from {@code switchyard.agents.<id>}.
 */
@Component
public class AgentManifest {

    public static final List<String> SUPPORTED_AGENTS = List.of(
            "claude", "opencode", "gemini", "codex", "droid", "qwen", "amp", "kilocode", "copilot");

    public static final String DEFAULT_AGENT = "claude";

    private final SwitchyardProperties properties;

    public AgentManifest(SwitchyardProperties properties) {
        this.properties = properties;
    }

    public List<String> supportedAgents() {
        return SUPPORTED_AGENTS;
    }

    /**
     * Matches a command token against the supported agents: the bare id, or any path ending in
     * {@code /<id>}. A configured binary override matches as well.
     */
    public Optional<String> agentIdFor(String commandToken) {
        for (String agent : SUPPORTED_AGENTS) {
            if (commandToken.equals(agent) || commandToken.endsWith("/" + agent)) {
                return Optional.of(agent);
            }
        }
        for (Map.Entry<String, SwitchyardProperties.Agent> entry : properties.getAgents().entrySet()) {
            String binary = entry.getValue().getBinary();
            if (binary != null && binary.equals(commandToken) && SUPPORTED_AGENTS.contains(entry.getKey())) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public String binaryFor(String agentId) {
        requireSupported(agentId);
        SwitchyardProperties.Agent override = properties.getAgents().get(agentId);
        if (override != null && override.getBinary() != null && !override.getBinary().isBlank()) {
            return override.getBinary().trim();
        }
        return agentId;
    }

    public Map<String, String> envFor(String agentId) {
        requireSupported(agentId);
        SwitchyardProperties.Agent override = properties.getAgents().get(agentId);
        return override == null ? Map.of() : Map.copyOf(override.getEnv());
    }

    public List<String> extraArgsFor(String agentId) {
        requireSupported(agentId);
        SwitchyardProperties.Agent override = properties.getAgents().get(agentId);
        return override == null ? List.of() : List.copyOf(override.getExtraArgs());
    }

    /**
     * Builds the {@code cd <worktree> && <binary> ["prompt"]} line used to start an agent in a session.
     */
    public AgentLaunchSpec launchSpecFor(String agentId, Path workingDirectory, String prompt) {
        StringBuilder command = new StringBuilder()
                .append("cd ").append(quotePath(workingDirectory.toString()))
                .append(" && ")
                .append(formatBinaryInvocation(binaryFor(agentId)));
        if (prompt != null && !prompt.isBlank()) {
            command.append(" \"").append(escapePromptForShell(prompt)).append('"');
        }
        return new AgentLaunchSpec(command.toString(), workingDirectory, Map.of());
    }

    private void requireSupported(String agentId) {
        if (!SUPPORTED_AGENTS.contains(agentId)) {
            throw new AgentNotFoundException(agentId);
        }
    }

    static String escapePromptForShell(String prompt) {
        StringBuilder escaped = new StringBuilder(prompt.length());
        for (char ch : prompt.toCharArray()) {
            switch (ch) {
                case '"' -> escaped.append("\\\"");
                case '\\' -> escaped.append("\\\\");
                case '$' -> escaped.append("\\$");
                case '`' -> escaped.append("\\`");
                default -> escaped.append(ch);
            }
        }
        return escaped.toString();
    }

    /**
     * Quotes a binary path containing whitespace, quotes or backslashes. Already quoted input is kept.
     */
    static String formatBinaryInvocation(String binary) {
        String trimmed = binary.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        boolean alreadyQuoted = (trimmed.startsWith("\"") && trimmed.endsWith("\"") && trimmed.length() > 1)
                || (trimmed.startsWith("'") && trimmed.endsWith("'") && trimmed.length() > 1);
        if (alreadyQuoted) {
            return trimmed;
        }
        boolean needsQuoting = trimmed.chars().anyMatch(c -> Character.isWhitespace(c) || c == '"' || c == '\\');
        if (!needsQuoting) {
            return trimmed;
        }
        StringBuilder quoted = new StringBuilder(trimmed.length() + 2).append('"');
        for (char ch : trimmed.toCharArray()) {
            switch (ch) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                default -> quoted.append(ch);
            }
        }
        return quoted.append('"').toString();
    }

    private static String quotePath(String path) {
        return path.chars().anyMatch(Character::isWhitespace) ? "\"" + path + "\"" : path;
    }
}
