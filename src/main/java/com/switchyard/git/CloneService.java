package com.switchyard.git;

import com.switchyard.core.errors.GitOperationException;
import com.switchyard.core.errors.InvalidInputException;
import com.switchyard.core.model.CloneResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Clones a remote into a new project directory, streaming git's progress lines.
 * <p>
 * This is the one place that shells out to {@code git clone} rather than using JGit,
 * because the progress text git prints with {@code --progress} is what users expect to see.
 */
@Service
public class CloneService {

    private static final Logger log = LoggerFactory.getLogger(CloneService.class);

    static final String START_MESSAGE = "Starting git clone...";

    private final GitCommandRunner git;
    private final BranchOperations branches;

    public CloneService(GitCommandRunner git, BranchOperations branches) {
        this.git = git;
        this.branches = branches;
    }

    public CloneResult cloneProject(String remoteUrl, Path parentDirectory, String folderName,
                                    Consumer<String> progress) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            throw new InvalidInputException("remote_url", "Remote URL cannot be empty");
        }
        if (folderName == null || folderName.isBlank()
                || folderName.contains("/") || folderName.contains("\\")
                || folderName.equals(".") || folderName.equals("..")) {
            throw new InvalidInputException("folder_name",
                    "Folder name must be a single path segment: " + folderName);
        }
        if (!Files.isDirectory(parentDirectory)) {
            throw new InvalidInputException("parent_directory",
                    "Parent directory does not exist or is not a directory: " + parentDirectory);
        }
        Path destination = parentDirectory.resolve(folderName);
        if (Files.exists(destination)) {
            throw new InvalidInputException("folder_name",
                    "Destination directory already exists: " + destination);
        }

        RemoteSanitizer.RemoteMetadata metadata = RemoteSanitizer.sanitize(remoteUrl);
        log.info("Cloning {} into {}", metadata.historyEntry(), destination);
        progress.accept(START_MESSAGE);

        int exit;
        try {
            exit = git.streamGit(parentDirectory, progress,
                    "clone", "--origin", "origin", "--progress", remoteUrl, destination.toString());
        } catch (GitOperationException e) {
            removeDestination(destination);
            throw e;
        }

        if (exit != 0) {
            removeDestination(destination);
            throw new GitOperationException("clone", "git clone exited with status " + exit);
        }

        String defaultBranch = branches.currentBranch(destination).orElse(null);
        log.info("Cloned {} (default branch: {})", metadata.display(), defaultBranch);
        return new CloneResult(destination, defaultBranch, metadata.display());
    }

    private static void removeDestination(Path destination) {
        if (Files.exists(destination)) {
            log.warn("Removing partially cloned directory {}", destination);
            WorktreeOperations.deleteDirectory(destination);
        }
    }
}
