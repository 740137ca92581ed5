package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.Session;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard show &lt;name&gt;
 * <p>
 * Shows a session's branches, worktree, review flags and diff stats.
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show a session")
@Component
public class ShowCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    @Option(names = {"--json"}, description = "Print the session as JSON")
    private boolean json;

    private final SessionService sessions;

    public ShowCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        try {
            Session s = sessions.getSession(name);
            if (json) {
                ConsoleOutput.json(s);
                return 0;
            }
            System.out.println();
            System.out.println("SESSION " + s.name());
            System.out.println("──────────────────────────────────");
            System.out.println("  State:         " + s.sessionState().dbValue());
            System.out.println("  Status:        " + s.status().dbValue());
            System.out.println("  Branch:        " + s.branch());
            System.out.println("  Parent:        " + s.parentBranch());
            System.out.println("  Worktree:      " + (s.isSpec() ? "-" : s.worktreePath()));
            System.out.println("  Ready:         " + s.readyToMerge());
            System.out.println("  Agent:         " + (s.originalAgentType() != null ? s.originalAgentType() : "-"));
            System.out.println("  Created:       " + s.createdAt());
            System.out.println("  Last activity: " + (s.lastActivity() != null ? s.lastActivity() : "-"));
            sessions.getGitStats(name).ifPresent(ConsoleOutput::stats);
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
