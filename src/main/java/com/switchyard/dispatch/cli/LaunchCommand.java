package com.switchyard.dispatch.cli;

import com.switchyard.agents.AgentLaunchSpec;
import com.switchyard.agents.AgentManifest;
import com.switchyard.agents.LaunchCoordinator;
import com.switchyard.agents.LocalProcessTerminalBackend;
import com.switchyard.agents.TerminalBackend;
import com.switchyard.core.errors.InvalidInputException;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.Session;
import com.switchyard.sessions.CancellationCoordinator;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard launch &lt;name&gt;
 * <p>
 * Starts the session's agent in its worktree and, unless detached, waits for it to exit.
 * A detached agent is not closed when the CLI exits.
 * A prompt sent to a reviewed session returns it to running.
 */
@Command(name = "launch", mixinStandardHelpOptions = true, description = "Launch an agent in a session")
@Component
public class LaunchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    @Option(names = {"--agent"}, description = "Agent to run (default: the session's agent, else ${DEFAULT-VALUE})",
            defaultValue = AgentManifest.DEFAULT_AGENT)
    private String agent;

    @Option(names = {"--prompt"}, description = "Prompt to send; defaults to the session's initial prompt")
    private String prompt;

    @Option(names = {"--terminal"}, description = "Terminal suffix (default: ${DEFAULT-VALUE})", defaultValue = "top")
    private String terminalSuffix;

    @Option(names = {"--cols"}, description = "Terminal width")
    private Integer cols;

    @Option(names = {"--rows"}, description = "Terminal height")
    private Integer rows;

    @Option(names = {"--detach"}, description = "Return once the agent has started and leave it running")
    private boolean detach;

    private final SessionService sessions;
    private final AgentManifest manifest;
    private final LaunchCoordinator launcher;
    private final TerminalBackend terminals;

    public LaunchCommand(SessionService sessions, AgentManifest manifest, LaunchCoordinator launcher,
                         TerminalBackend terminals) {
        this.sessions = sessions;
        this.manifest = manifest;
        this.launcher = launcher;
        this.terminals = terminals;
    }

    @Override
    public Integer call() {
        try {
            Session session = sessions.getSession(name);
            if (session.isSpec()) {
                throw new InvalidInputException("session", "'%s' is a spec; start it first".formatted(name));
            }
            String agentId = session.originalAgentType() != null && !agentExplicit()
                    ? session.originalAgentType() : agent;
            String effectivePrompt = prompt != null ? prompt : session.initialPrompt();
            if (prompt != null && sessions.unmarkReviewedOnFollowUp(name)) {
                ConsoleOutput.info(name + " returned to running for the follow-up");
            }

            AgentLaunchSpec spec = manifest.launchSpecFor(agentId, session.worktreePath(), effectivePrompt);
            String terminalId = CancellationCoordinator.terminalPrefix(name) + terminalSuffix;
            String command = launcher.launchInTerminal(terminalId, spec, cols, rows);
            ConsoleOutput.success("Launched in " + terminalId + ": " + command);

            if (detach) {
                terminals.detachTerminal(terminalId);
                ConsoleOutput.info(agentId + " left running in " + terminalId);
            } else if (terminals instanceof LocalProcessTerminalBackend local) {
                int exit = local.waitFor(terminalId);
                ConsoleOutput.info(agentId + " exited with code " + exit);
            }
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }

    private boolean agentExplicit() {
        return !AgentManifest.DEFAULT_AGENT.equals(agent);
    }
}
