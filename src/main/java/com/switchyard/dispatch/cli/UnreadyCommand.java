package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard unready &lt;name&gt;
 */
@Command(name = "unready", mixinStandardHelpOptions = true, description = "Return a session to running")
@Component
public class UnreadyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    private final SessionService sessions;

    public UnreadyCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        try {
            sessions.unmarkReady(name);
            ConsoleOutput.success(name + " is back to running");
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
