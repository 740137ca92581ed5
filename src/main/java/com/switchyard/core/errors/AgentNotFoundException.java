package com.switchyard.core.errors;

public class AgentNotFoundException extends SwitchyardException {

    private final String agentName;

    public AgentNotFoundException(String agentName) {
        super(ErrorKind.AGENT_NOT_FOUND, "Agent '%s' not found".formatted(agentName));
        this.agentName = agentName;
    }

    public String agentName() {
        return agentName;
    }
}
