package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.Session;
import com.switchyard.sessions.CreateSessionRequest;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard create &lt;name&gt;
 * <p>
 * Creates a session branch and worktree off the parent branch, or a spec with {@code --spec}.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create a session")
@Component
public class CreateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    @Option(names = {"--parent", "-p"}, description = "Parent branch (default: configured default)")
    private String parentBranch;

    @Option(names = {"--prompt"}, description = "Initial prompt for the agent")
    private String prompt;

    @Option(names = {"--agent"}, description = "Agent the session is created for")
    private String agentType;

    @Option(names = {"--skip-permissions"}, description = "Start the agent without permission prompts")
    private boolean skipPermissions;

    @Option(names = {"--epic"}, description = "Epic id to group the session under")
    private String epicId;

    @Option(names = {"--spec"}, description = "Create a spec draft instead of a running session")
    private boolean asSpec;

    private final SessionService sessions;

    public CreateCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        CreateSessionRequest request = asSpec
                ? CreateSessionRequest.spec(name, prompt)
                : CreateSessionRequest.of(name, parentBranch, prompt);
        if (agentType != null) {
            request = request.withAgent(agentType, skipPermissions);
        }
        if (epicId != null) {
            request = request.withEpic(epicId);
        }
        try {
            Session session = sessions.createSession(request);
            ConsoleOutput.success("Created session " + session.name());
            if (!session.isSpec()) {
                ConsoleOutput.info("Branch:   " + session.branch() + " (from " + session.parentBranch() + ")");
                ConsoleOutput.info("Worktree: " + session.worktreePath());
            }
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
