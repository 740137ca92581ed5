package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionState;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard transition &lt;name&gt; &lt;spec|running|reviewed&gt;
 */
@Command(name = "transition", mixinStandardHelpOptions = true, description = "Move a session to another state")
@Component
public class TransitionCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    @Parameters(index = "1", description = "Target state: ${COMPLETION-CANDIDATES}")
    private SessionState target;

    private final SessionService sessions;

    public TransitionCommand(SessionService sessions) {
        this.sessions = sessions;
    }

    @Override
    public Integer call() {
        try {
            Session session = sessions.transitionState(name, target);
            ConsoleOutput.success(name + " is now " + session.sessionState().dbValue());
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
