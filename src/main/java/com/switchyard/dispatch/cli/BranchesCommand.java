package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard branches
 */
@Command(name = "branches", mixinStandardHelpOptions = true, description = "List local and remote branches")
@Component
public class BranchesCommand implements Callable<Integer> {

    private final SessionService sessions;

    public BranchesCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        try {
            sessions.listBranches().forEach(b -> System.out.println("  " + b));
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
