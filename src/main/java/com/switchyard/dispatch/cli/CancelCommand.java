package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.CancellationResult;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard cancel &lt;name&gt;
 * <p>
 * Teardown problems are reported but do not fail the command.
 */
@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel a session and remove its worktree")
@Component
public class CancelCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    @Option(names = {"--keep-branch"}, description = "Keep the session branch")
    private boolean keepBranch;

    private final SessionService sessions;

    public CancelCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        try {
            CancellationResult result = sessions.cancelSession(name, keepBranch);
            ConsoleOutput.success("Cancelled " + name);
            if (!result.closedTerminals().isEmpty()) {
                ConsoleOutput.info("Closed terminals: " + String.join(", ", result.closedTerminals()));
            }
            ConsoleOutput.info("Worktree removed: " + result.worktreeRemoved()
                    + ", branch deleted: " + result.branchDeleted());
            result.errors().forEach(ConsoleOutput::warn);
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
