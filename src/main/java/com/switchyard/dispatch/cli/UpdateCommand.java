package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.UpdateSessionFromParentResult;
import com.switchyard.merge.MergeService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard update &lt;name&gt;
 * <p>
 * Replays the session's commits on the latest parent tip.
 */
@Command(name = "update", mixinStandardHelpOptions = true, description = "Update a session from its parent branch")
@Component
public class UpdateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    private final MergeService merges;

    public UpdateCommand(MergeService merges) {
        this.merges = merges;
    }

    @Override
    public Integer call() {
        try {
            UpdateSessionFromParentResult result = merges.updateSessionFromParent(name);
            switch (result.status()) {
                case SUCCESS -> {
                    ConsoleOutput.success(result.message());
                    return 0;
                }
                case ALREADY_UP_TO_DATE -> {
                    ConsoleOutput.info(result.message());
                    return 0;
                }
                case HAS_CONFLICTS -> {
                    ConsoleOutput.error(result.message());
                    ConsoleOutput.paths(result.conflictingPaths());
                    return 1;
                }
                default -> {
                    ConsoleOutput.error(result.message());
                    return 1;
                }
            }
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
