package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.MergePreview;
import com.switchyard.merge.MergeService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchyard preview &lt;name&gt;
 * <p>
 * Shows whether the session would merge cleanly and the equivalent git commands.
 */
@Command(name = "preview", mixinStandardHelpOptions = true, description = "Preview merging a session")
@Component
public class PreviewCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session name")
    private String name;

    private final MergeService merges;

    public PreviewCommand(MergeService merges) {
        this.merges = merges;
    }

    @Override
    public Integer call() {
        try {
            MergePreview preview = merges.preview(name);
            ConsoleOutput.info(preview.sessionBranch() + " -> " + preview.parentBranch());
            if (preview.isUpToDate()) {
                ConsoleOutput.warn("Nothing to merge");
            } else if (preview.hasConflicts()) {
                ConsoleOutput.error("Merge would conflict in:");
                ConsoleOutput.paths(preview.conflictingPaths());
            } else {
                ConsoleOutput.success("Merges cleanly");
            }
            System.out.println();
            System.out.println("  Squash:");
            preview.squashCommands().forEach(c -> System.out.println("    " + c));
            System.out.println("  Reapply:");
            preview.reapplyCommands().forEach(c -> System.out.println("    " + c));
            System.out.println("  Default message: " + preview.defaultCommitMessage());
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
