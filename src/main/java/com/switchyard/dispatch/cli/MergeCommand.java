package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.MergeConflictException;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.MergeMode;
import com.switchyard.core.model.MergeOutcome;
import com.switchyard.merge.MergeService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard merge &lt;name&gt; [--mode squash|reapply] [-m message]
 */
@Command(name = "merge", mixinStandardHelpOptions = true, description = "Merge a ready session into its parent")
@Component
public class MergeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    @Option(names = {"--mode"}, description = "${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "SQUASH")
    private MergeMode mode;

    @Option(names = {"--message", "-m"}, description = "Commit message, required for squash")
    private String message;

    private final MergeService merges;

    public MergeCommand(MergeService merges) {
        this.merges = merges;
    }

    @Override
    public Integer call() {
        try {
            MergeOutcome outcome = merges.applyMerge(name, mode, message);
            ConsoleOutput.success("Merged " + outcome.sessionBranch() + " into " + outcome.parentBranch()
                    + " (" + abbreviate(outcome.newCommit()) + ")");
            return 0;
        } catch (MergeConflictException e) {
            int code = ConsoleOutput.failure(e);
            ConsoleOutput.paths(e.files());
            return code;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }

    private static String abbreviate(String commit) {
        return commit != null && commit.length() > 8 ? commit.substring(0, 8) : String.valueOf(commit);
    }
}
