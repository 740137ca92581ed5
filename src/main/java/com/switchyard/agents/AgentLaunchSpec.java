package com.switchyard.agents;

import java.nio.file.Path;
import java.util.Map;

/**
 * What to run in a terminal: a {@code cd <dir> && <agent> [args]} line plus extra environment.
 * Entries in {@code envVars} override the agent's configured environment.
 */
public record AgentLaunchSpec(String shellCommand, Path workingDirectory, Map<String, String> envVars) {

    public AgentLaunchSpec {
        envVars = envVars == null ? Map.of() : Map.copyOf(envVars);
    }

    /**
     * The command line in parseable form; a bare command is prefixed with its working directory.
     */
    public String formatForShell() {
        String trimmed = shellCommand.trim();
        if (trimmed.startsWith("cd ") || workingDirectory == null) {
            return trimmed;
        }
        return "cd \"" + workingDirectory + "\" && " + trimmed;
    }
}
