package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.Session;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: switchyard list
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List sessions")
@Component
public class ListCommand implements Callable<Integer> {

    @Option(names = {"--all", "-a"}, description = "Include cancelled sessions")
    private boolean includeCancelled;

    @Option(names = {"--json"}, description = "Print sessions as JSON")
    private boolean json;

    private final SessionService sessions;

    public ListCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        try {
            List<Session> found = sessions.listSessions(includeCancelled);
            if (json) {
                ConsoleOutput.json(found);
                return 0;
            }
            if (found.isEmpty()) {
                ConsoleOutput.info("No sessions.");
                return 0;
            }
            System.out.printf("  %-24s %-8s %-30s%n", "NAME", "STATE", "BRANCH");
            System.out.println("  " + "-".repeat(64));
            found.forEach(ConsoleOutput::sessionRow);
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
