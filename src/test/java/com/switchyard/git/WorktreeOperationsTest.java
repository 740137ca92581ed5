package com.switchyard.git;

import com.switchyard.TestRepos;
import com.switchyard.core.errors.GitOperationException;
import com.switchyard.core.errors.WorktreeAlreadyExistsException;
import com.switchyard.core.errors.WorktreeNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Worktree lifecycle through the git CLI. Skipped when no git binary is installed.
 */
class WorktreeOperationsTest {

    @TempDir
    Path dir;

    private BranchOperations branches;
    private WorktreeOperations worktrees;
    private Path repo;
    private Path worktree;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(GitCommandRunner.isGitAvailable());
        branches = new BranchOperations();
        worktrees = new WorktreeOperations(new GitCommandRunner(), branches);
        repo = TestRepos.initWithCommit(dir.resolve("repo"));
        worktree = repo.resolve(".switchyard/worktrees/alpha");
    }

    @Test
    @DisplayName("creates the branch at the base tip and registers the worktree")
    void createsWorktree() {
        worktrees.createWorktreeFromBase(repo, "switchyard/alpha", worktree, "main");

        assertTrue(Files.isRegularFile(worktree.resolve("README.md")));
        assertTrue(worktrees.isRegistered(repo, worktree));
        assertEquals(branches.resolveBranchCommit(repo, "main"),
                branches.resolveBranchCommit(repo, "switchyard/alpha"));
    }

    @Test
    @DisplayName("refuses an existing destination")
    void refusesExistingPath() throws Exception {
        Files.createDirectories(worktree);
        assertThrows(WorktreeAlreadyExistsException.class,
                () -> worktrees.createWorktreeFromBase(repo, "switchyard/alpha", worktree, "main"));
    }

    @Test
    @DisplayName("bootstraps a missing base branch from HEAD")
    void bootstrapsMissingBase() {
        worktrees.createWorktreeFromBase(repo, "switchyard/alpha", worktree, "develop");

        assertTrue(branches.branchExists(repo, "develop"));
    }

    @Test
    @DisplayName("fails on a repository without commits")
    void failsWithoutCommits() throws Exception {
        Path empty = TestRepos.initEmpty(dir.resolve("empty"), "main");
        assertThrows(GitOperationException.class, () -> worktrees.createWorktreeFromBase(
                empty, "switchyard/alpha", empty.resolve(".switchyard/worktrees/alpha"), "main"));
    }

    @Test
    @DisplayName("reports untracked and modified paths but not the tooling directory")
    void uncommittedPaths() {
        worktrees.createWorktreeFromBase(repo, "switchyard/alpha", worktree, "main");
        TestRepos.writeFile(worktree, "new.txt", "x\n");
        TestRepos.writeFile(worktree, ".switchyard/state.json", "{}");

        assertEquals(List.of("new.txt"), worktrees.uncommittedPaths(worktree));
        assertTrue(worktrees.hasUncommittedChanges(worktree));
        assertFalse(worktrees.hasTrackedChanges(worktree));

        TestRepos.writeFile(worktree, "README.md", "changed\n");
        assertTrue(worktrees.hasTrackedChanges(worktree));
        assertEquals(1, worktrees.uncommittedSamplePaths(worktree, 1).size());
    }

    @Test
    @DisplayName("remove deletes a registered worktree and prunes it")
    void removesWorktree() {
        worktrees.createWorktreeFromBase(repo, "switchyard/alpha", worktree, "main");

        worktrees.removeWorktree(repo, worktree);

        assertFalse(Files.exists(worktree));
        assertFalse(worktrees.isRegistered(repo, worktree));
        assertThrows(WorktreeNotFoundException.class, () -> worktrees.removeWorktree(repo, worktree));
    }

    @Test
    @DisplayName("remove deletes an unregistered directory")
    void removesStrayDirectory() throws Exception {
        Files.createDirectories(worktree);
        TestRepos.writeFile(worktree, "leftover.txt", "x");

        worktrees.removeWorktree(repo, worktree);

        assertFalse(Files.exists(worktree));
    }
}
