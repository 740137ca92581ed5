package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.CloneResult;
import com.switchyard.git.CloneService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: switchyard clone &lt;url&gt; &lt;folder&gt; [--into dir]
 */
@Command(name = "clone", mixinStandardHelpOptions = true, description = "Clone a remote repository")
@Component
public class CloneCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Remote URL")
    private String remoteUrl;

    @Parameters(index = "1", description = "Folder name to create")
    private String folderName;

    @Option(names = {"--into"}, description = "Parent directory (default: ${DEFAULT-VALUE})", defaultValue = ".")
    private Path parentDirectory;

    private final CloneService cloneService;

    public CloneCommand(CloneService cloneService) {
        this.cloneService = cloneService;
    }

    @Override
    public Integer call() {
        try {
            CloneResult result = cloneService.cloneProject(remoteUrl, parentDirectory.toAbsolutePath().normalize(),
                    folderName, line -> System.out.println("  " + line));
            ConsoleOutput.success("Cloned " + result.remoteDisplay() + " into " + result.projectPath());
            if (result.defaultBranch() != null) {
                ConsoleOutput.info("Default branch: " + result.defaultBranch());
            }
            return 0;
        } catch (SwitchyardException e) {
            return ConsoleOutput.failure(e);
        }
    }
}
