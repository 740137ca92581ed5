package com.switchyard.git;

import com.switchyard.core.errors.GitOperationException;
import com.switchyard.core.errors.IoOperationException;
import com.switchyard.core.errors.WorktreeAlreadyExistsException;
import com.switchyard.core.errors.WorktreeNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Materializes and retires session worktrees.
 * <p>
 * Worktree registration is managed through the {@code git} CLI because JGit has no
 * support for linked worktrees; branch creation at the base commit uses {@link BranchOperations}.
 */
@Component
public class WorktreeOperations {

    private static final Logger log = LoggerFactory.getLogger(WorktreeOperations.class);

    private final GitCommandRunner git;
    private final BranchOperations branches;

    public WorktreeOperations(GitCommandRunner git, BranchOperations branches) {
        this.git = git;
        this.branches = branches;
    }

    /**
     * Creates {@code branchName} at the tip of {@code baseBranch} and checks it out into
     * {@code worktreePath}. A missing base branch is bootstrapped from HEAD first; a stale
     * branch with the session's name is replaced.
     */
    public void createWorktreeFromBase(Path repoPath, String branchName, Path worktreePath, String baseBranch) {
        GitNames.validateBranchName(branchName);
        GitNames.validateBranchName(baseBranch);

        if (Files.exists(worktreePath)) {
            throw new WorktreeAlreadyExistsException(worktreePath);
        }

        String baseCommit = branches.resolveBranchCommit(repoPath, baseBranch).orElseGet(() -> {
            if (!branches.hasCommits(repoPath)) {
                throw new GitOperationException("create_worktree",
                        "Repository at %s has no commits; create an initial commit first".formatted(repoPath));
            }
            log.warn("Base branch '{}' missing when creating worktree, bootstrapping from HEAD", baseBranch);
            branches.ensureBranchAtHead(repoPath, baseBranch);
            return branches.resolveBranchCommit(repoPath, baseBranch).orElseThrow(() ->
                    new GitOperationException("create_worktree",
                            "Base branch '%s' does not exist after bootstrap attempt".formatted(baseBranch)));
        });

        log.info("Creating worktree from commit {} ({})", baseCommit, baseBranch);

        try {
            Files.createDirectories(worktreePath.getParent());
        } catch (IOException e) {
            throw new IoOperationException("create_worktree_parent", worktreePath.getParent(), e);
        }

        if (branches.branchExists(repoPath, branchName)) {
            log.info("Deleting existing branch: {}", branchName);
            branches.deleteBranch(repoPath, branchName);
        }
        branches.createBranchAt(repoPath, branchName, baseCommit);

        git.runGitOutput(repoPath, "worktree", "add", worktreePath.toString(), branchName);
        log.info("Worktree created at {} (branch: {})", worktreePath, branchName);
    }

    /**
     * Removes a worktree: a registered one is deleted from disk and pruned; an unregistered
     * directory is just deleted.
     *
     * @throws WorktreeNotFoundException if the path is neither registered nor present
     */
    public void removeWorktree(Path repoPath, Path worktreePath) {
        boolean registered = isRegistered(repoPath, worktreePath);
        if (registered) {
            if (Files.exists(worktreePath)) {
                deleteDirectory(worktreePath);
            }
            int exit = git.runGit(repoPath, "worktree", "prune");
            if (exit != 0) {
                log.warn("git worktree prune exited with code {} after removing {}", exit, worktreePath);
            }
            log.info("Removed worktree at {}", worktreePath);
            return;
        }

        if (Files.exists(worktreePath)) {
            log.info("Worktree {} is not registered, deleting directory", worktreePath);
            deleteDirectory(worktreePath);
            return;
        }

        throw new WorktreeNotFoundException(worktreePath);
    }

    /**
     * All worktree directories of the repository, the main working directory first.
     */
    public List<Path> listWorktrees(Path repoPath) {
        String output = git.runGitOutput(repoPath, "worktree", "list", "--porcelain");
        List<Path> worktrees = new ArrayList<>();
        for (String line : output.split("\n")) {
            if (line.startsWith("worktree ")) {
                worktrees.add(Path.of(line.substring("worktree ".length()).trim()));
            }
        }
        return worktrees;
    }

    public boolean isRegistered(Path repoPath, Path worktreePath) {
        Path target = canonical(worktreePath);
        return listWorktrees(repoPath).stream()
                .anyMatch(p -> canonical(p).equals(target) || p.equals(worktreePath));
    }

    /**
     * Paths with staged, unstaged or untracked changes, excluding the internal tooling directory.
     */
    public List<String> uncommittedPaths(Path worktreePath) {
        if (!Files.isDirectory(worktreePath)) {
            throw new WorktreeNotFoundException(worktreePath);
        }
        String output = git.runGitOutput(worktreePath, "status", "--porcelain", "--untracked-files=all");
        List<String> paths = new ArrayList<>();
        for (String line : output.split("\n")) {
            if (line.length() < 4) {
                continue;
            }
            String path = unquote(line.substring(3));
            int arrow = path.indexOf(" -> ");
            if (arrow >= 0) {
                path = unquote(path.substring(arrow + 4));
            }
            if (!GitNames.isInternalPath(path)) {
                paths.add(path);
            }
        }
        return paths;
    }

    public boolean hasUncommittedChanges(Path worktreePath) {
        return !uncommittedPaths(worktreePath).isEmpty();
    }

    /**
     * Whether tracked files differ from HEAD. Untracked files are ignored.
     */
    public boolean hasTrackedChanges(Path worktreePath) {
        String output = git.runGitOutput(worktreePath, "status", "--porcelain", "--untracked-files=no");
        return !output.isBlank();
    }

    /**
     * Up to {@code limit} offending paths, for error messages.
     */
    public List<String> uncommittedSamplePaths(Path worktreePath, int limit) {
        List<String> paths = uncommittedPaths(worktreePath);
        return paths.subList(0, Math.min(limit, paths.size()));
    }

    /**
     * Re-syncs a clean worktree's index and files with its branch after the ref was moved underneath it.
     */
    public void syncToHead(Path worktreePath) {
        git.runGitOutput(worktreePath, "reset", "--hard", "HEAD");
        log.debug("Synced worktree {} to HEAD", worktreePath);
    }

    static void deleteDirectory(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException e) {
            throw new IoOperationException("delete_directory", dir, e);
        } catch (UncheckedIOException e) {
            throw new IoOperationException("delete_directory", dir, e.getCause());
        }
    }

    private static Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    private static String unquote(String path) {
        if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }
}
