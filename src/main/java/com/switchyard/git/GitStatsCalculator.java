package com.switchyard.git;

import com.switchyard.core.errors.GitOperationException;
import com.switchyard.core.errors.WorktreeNotFoundException;
import com.switchyard.core.model.GitStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes {@link GitStats} for a worktree against its merge base with the parent branch.
 * <p>
 * Counts committed, staged and unstaged changes from {@code git diff --numstat}, plus
 * untracked files as fully added. The internal tooling directory is excluded throughout.
 */
@Component
public class GitStatsCalculator {

    private static final Logger log = LoggerFactory.getLogger(GitStatsCalculator.class);

    private final GitCommandRunner git;
    private final WorktreeOperations worktrees;

    public GitStatsCalculator(GitCommandRunner git, WorktreeOperations worktrees) {
        this.git = git;
        this.worktrees = worktrees;
    }

    /**
     * One line of {@code git diff --numstat}. Binary files report zero lines.
     */
    record NumstatEntry(String path, int added, int removed) {
    }

    public GitStats calculate(String sessionId, Path worktreePath, String parentBranch, Instant now) {
        if (!Files.isDirectory(worktreePath)) {
            throw new WorktreeNotFoundException(worktreePath);
        }

        String base = mergeBase(worktreePath, parentBranch);
        List<NumstatEntry> entries = parseNumstat(git.runGitOutput(worktreePath, "diff", "--numstat", base));

        Set<String> files = new LinkedHashSet<>();
        int added = 0;
        int removed = 0;
        for (NumstatEntry entry : entries) {
            if (GitNames.isInternalPath(entry.path())) {
                continue;
            }
            files.add(entry.path());
            added += entry.added();
            removed += entry.removed();
        }

        String untracked = git.runGitOutput(worktreePath, "ls-files", "--others", "--exclude-standard");
        for (String path : untracked.split("\n")) {
            if (path.isBlank() || GitNames.isInternalPath(path) || !files.add(path)) {
                continue;
            }
            added += countLines(worktreePath.resolve(path));
        }

        boolean hasUncommitted = worktrees.hasUncommittedChanges(worktreePath);
        log.debug("git_stats: path={} parent={} files={} +{} -{} uncommitted={}",
                worktreePath, parentBranch, files.size(), added, removed, hasUncommitted);
        return new GitStats(sessionId, files.size(), added, removed, hasUncommitted, now);
    }

    /**
     * Parses {@code git diff --numstat} output. A {@code -} count (binary file) is read as 0;
     * malformed lines are skipped.
     */
    static List<NumstatEntry> parseNumstat(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }

        var results = new ArrayList<NumstatEntry>();
        for (String line : output.split("\n")) {
            String[] parts = line.split("\t");
            if (parts.length != 3) {
                continue;
            }
            try {
                int added = parts[0].equals("-") ? 0 : Integer.parseInt(parts[0]);
                int removed = parts[1].equals("-") ? 0 : Integer.parseInt(parts[1]);
                results.add(new NumstatEntry(parts[2], added, removed));
            } catch (NumberFormatException e) {
                log.debug("Skipping malformed numstat line: {}", line);
            }
        }
        return results;
    }

    private String mergeBase(Path worktreePath, String parentBranch) {
        try {
            return git.runGitOutput(worktreePath, "merge-base", "HEAD", parentBranch).trim();
        } catch (GitOperationException e) {
            log.debug("No merge base between HEAD and '{}' in {}, diffing against HEAD: {}",
                    parentBranch, worktreePath, e.getMessage());
            return "HEAD";
        }
    }

    private static int countLines(Path file) {
        if (!Files.isRegularFile(file)) {
            return 0;
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            int lines = 0;
            for (byte b : bytes) {
                if (b == 0) {
                    return 0;
                }
                if (b == '\n') {
                    lines++;
                }
            }
            if (bytes.length > 0 && bytes[bytes.length - 1] != '\n') {
                lines++;
            }
            return lines;
        } catch (IOException e) {
            log.warn("Could not read untracked file {}: {}", file, e.getMessage());
            return 0;
        }
    }
}
