package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard review &lt;name&gt;
 * <p>
 * Like {@code ready}, but rejects specs and sessions that are already reviewed.
 */
@Command(name = "review", mixinStandardHelpOptions = true, description = "Mark a session as reviewed")
@Component
public class ReviewCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    private final SessionService sessions;

    public ReviewCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        try {
            if (sessions.markReviewed(name)) {
                ConsoleOutput.success(name + " marked as reviewed");
                return 0;
            }
            ConsoleOutput.warn(name + " has uncommitted changes; commit them first");
            return 1;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
