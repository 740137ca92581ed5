package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard ready &lt;name&gt;
 * <p>
 * Exits 1 when the worktree still has uncommitted changes.
 */
@Command(name = "ready", mixinStandardHelpOptions = true, description = "Mark a session ready to merge")
@Component
public class ReadyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    private final SessionService sessions;

    public ReadyCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        try {
            if (sessions.markReady(name)) {
                ConsoleOutput.success(name + " is ready to merge");
                return 0;
            }
            ConsoleOutput.warn(name + " has uncommitted changes; commit them first");
            return 1;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
