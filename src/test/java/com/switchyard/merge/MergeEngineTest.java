package com.switchyard.merge;

import com.switchyard.TestRepos;
import com.switchyard.core.errors.GitOperationException;
import com.switchyard.core.errors.MergeConflictException;
import com.switchyard.core.model.MergeState;
import com.switchyard.git.BranchOperations;
import com.switchyard.git.WorktreeOperations;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * In-memory merge, replay and ref operations on a JGit repository.
 */
class MergeEngineTest {

    private static final String SESSION = "switchyard/alpha";

    @TempDir
    Path dir;

    private WorktreeOperations worktrees;
    private MergeEngine engine;
    private Path repoPath;
    private Repository repo;

    @BeforeEach
    void setUp() throws Exception {
        worktrees = mock(WorktreeOperations.class);
        engine = new MergeEngine(worktrees);
        repoPath = TestRepos.initWithCommit(dir.resolve("repo"));
        repo = BranchOperations.openRepository(repoPath);
    }

    @AfterEach
    void tearDown() {
        repo.close();
    }

    private ObjectId tip(String branch) throws Exception {
        return engine.resolveBranch(repo, branch);
    }

    private static boolean treeHas(Repository repo, ObjectId commitId, String path) throws Exception {
        try (RevWalk walk = new RevWalk(repo)) {
            RevCommit commit = walk.parseCommit(commitId);
            try (TreeWalk tw = TreeWalk.forPath(repo, path, commit.getTree())) {
                return tw != null;
            }
        }
    }

    @Nested
    @DisplayName("compute")
    class Compute {

        @Test
        @DisplayName("a branch with no new commits is up to date")
        void upToDate() throws Exception {
            new BranchOperations().createBranchAt(repoPath, SESSION, tip("main").name());

            MergeState state = engine.compute(repo, tip(SESSION), tip("main"), SESSION, "main");

            assertTrue(state.isUpToDate());
            assertFalse(state.hasConflicts());
        }

        @Test
        @DisplayName("independent changes merge cleanly")
        void clean() throws Exception {
            TestRepos.commitOnBranch(repoPath, SESSION, "feature.txt", "feature\n", "feature");
            TestRepos.commitOnBranch(repoPath, "main", "other.txt", "other\n", "other");

            MergeState state = engine.compute(repo, tip(SESSION), tip("main"), SESSION, "main");

            assertFalse(state.isUpToDate());
            assertFalse(state.hasConflicts());
            assertTrue(engine.needsRebase(repo, tip(SESSION), tip("main")));
        }

        @Test
        @DisplayName("edits to the same lines conflict and report the path")
        void conflict() throws Exception {
            TestRepos.commitOnBranch(repoPath, SESSION, "README.md", "session\n", "session edit");
            TestRepos.commitOnBranch(repoPath, "main", "README.md", "parent\n", "parent edit");

            MergeState state = engine.compute(repo, tip(SESSION), tip("main"), SESSION, "main");

            assertTrue(state.hasConflicts());
            assertEquals(List.of("README.md"), state.conflictingPaths());
        }
    }

    @Nested
    @DisplayName("replay")
    class Replay {

        @Test
        @DisplayName("replays session commits onto the parent tip keeping their messages")
        void replays() throws Exception {
            TestRepos.commitOnBranch(repoPath, SESSION, "a.txt", "a\n", "add a");
            TestRepos.commitOnBranch(repoPath, SESSION, "b.txt", "b\n", "add b");
            TestRepos.commitOnBranch(repoPath, "main", "other.txt", "other\n", "other");
            ObjectId parentTip = tip("main");

            ObjectId newTip = engine.replay(repo, tip(SESSION), parentTip, false, "alpha", "main");

            try (RevWalk walk = new RevWalk(repo)) {
                RevCommit top = walk.parseCommit(newTip);
                assertEquals("add b", top.getShortMessage());
                RevCommit middle = walk.parseCommit(top.getParent(0));
                assertEquals("add a", middle.getShortMessage());
                assertEquals(parentTip, middle.getParent(0).getId());
            }
            assertTrue(treeHas(repo, newTip, "other.txt"));
            assertTrue(treeHas(repo, newTip, "b.txt"));
            assertFalse(engine.needsRebase(repo, newTip, parentTip));
        }

        @Test
        @DisplayName("a change already on the parent is dropped only when asked")
        void alreadyApplied() throws Exception {
            TestRepos.commitOnBranch(repoPath, SESSION, "same.txt", "same\n", "session copy");
            TestRepos.commitOnBranch(repoPath, "main", "same.txt", "same\n", "parent copy");
            ObjectId parentTip = tip("main");

            assertEquals(parentTip, engine.replay(repo, tip(SESSION), parentTip, true, "alpha", "main"));
            assertThrows(MergeConflictException.class,
                    () -> engine.replay(repo, tip(SESSION), parentTip, false, "alpha", "main"));
        }

        @Test
        @DisplayName("a conflicting commit fails with its paths")
        void conflicting() throws Exception {
            TestRepos.commitOnBranch(repoPath, SESSION, "README.md", "session\n", "session edit");
            TestRepos.commitOnBranch(repoPath, "main", "README.md", "parent\n", "parent edit");

            var e = assertThrows(MergeConflictException.class,
                    () -> engine.replay(repo, tip(SESSION), tip("main"), true, "alpha", "main"));
            assertEquals(List.of("README.md"), e.files());
        }
    }

    @Nested
    @DisplayName("refs")
    class Refs {

        @Test
        @DisplayName("squashCommit has the session tree and the parent as its only parent")
        void squash() throws Exception {
            TestRepos.commitOnBranch(repoPath, SESSION, "a.txt", "a\n", "add a");
            TestRepos.commitOnBranch(repoPath, SESSION, "b.txt", "b\n", "add b");

            ObjectId squash = engine.squashCommit(repo, tip(SESSION), tip("main"), "Squashed work");

            try (RevWalk walk = new RevWalk(repo)) {
                RevCommit commit = walk.parseCommit(squash);
                assertEquals(1, commit.getParentCount());
                assertEquals(tip("main"), commit.getParent(0).getId());
                assertEquals(walk.parseCommit(tip(SESSION)).getTree().getId(), commit.getTree().getId());
                assertEquals("Squashed work", commit.getFullMessage());
            }
        }

        @Test
        @DisplayName("updateBranch refuses when the ref moved underneath")
        void compareAndSwap() throws Exception {
            RevCommit first = TestRepos.commitOnBranch(repoPath, SESSION, "a.txt", "a\n", "add a");
            ObjectId stale = tip("main");

            assertThrows(GitOperationException.class,
                    () -> engine.updateBranch(repo, SESSION, stale, first.getId(), "test"));
            assertEquals(first.getId(), tip(SESSION));
        }

        @Test
        @DisplayName("fastForward refuses a commit that does not descend from the branch")
        void fastForwardNonDescendant() throws Exception {
            RevCommit session = TestRepos.commitOnBranch(repoPath, SESSION, "a.txt", "a\n", "add a");
            TestRepos.commitOnBranch(repoPath, "main", "b.txt", "b\n", "add b");

            assertThrows(GitOperationException.class, () -> engine.fastForward(repo, "main", session.getId()));
        }

        @Test
        @DisplayName("fastForward of the checked-out branch syncs a clean working tree")
        void fastForwardCheckedOut() throws Exception {
            RevCommit session = TestRepos.commitOnBranch(repoPath, SESSION, "a.txt", "a\n", "add a");
            when(worktrees.hasTrackedChanges(any())).thenReturn(false);

            engine.fastForward(repo, "main", session.getId());

            assertEquals(session.getId(), tip("main"));
            verify(worktrees).syncToHead(any());
        }

        @Test
        @DisplayName("fastForward leaves a dirty working tree alone")
        void fastForwardDirty() throws Exception {
            RevCommit session = TestRepos.commitOnBranch(repoPath, SESSION, "a.txt", "a\n", "add a");
            when(worktrees.hasTrackedChanges(any())).thenReturn(true);

            engine.fastForward(repo, "main", session.getId());

            assertEquals(session.getId(), tip("main"));
            verify(worktrees, never()).syncToHead(any());
        }

        @Test
        @DisplayName("fastForward of a branch that is not checked out only moves the ref")
        void fastForwardNotCheckedOut() throws Exception {
            new BranchOperations().createBranchAt(repoPath, "release", tip("main").name());
            RevCommit session = TestRepos.commitOnBranch(repoPath, SESSION, "a.txt", "a\n", "add a");

            engine.fastForward(repo, "release", session.getId());

            assertEquals(session.getId(), tip("release"));
            verifyNoInteractions(worktrees);
        }
    }
}
