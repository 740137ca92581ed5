package com.switchyard.git;

import com.switchyard.TestRepos;
import com.switchyard.core.errors.WorktreeNotFoundException;
import com.switchyard.core.model.GitStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GitStatsCalculatorTest {

    @Nested
    @DisplayName("parseNumstat")
    class ParseNumstat {

        @Test
        @DisplayName("reads counts, treats binary as zero and skips malformed lines")
        void parses() {
            var entries = GitStatsCalculator.parseNumstat("""
                    12\t3\tsrc/App.java
                    -\t-\tlogo.png
                    not a numstat line
                    x\t1\tbad.txt
                    """);

            assertEquals(List.of(
                    new GitStatsCalculator.NumstatEntry("src/App.java", 12, 3),
                    new GitStatsCalculator.NumstatEntry("logo.png", 0, 0)), entries);
        }

        @Test
        @DisplayName("blank output yields no entries")
        void blank() {
            assertTrue(GitStatsCalculator.parseNumstat("").isEmpty());
            assertTrue(GitStatsCalculator.parseNumstat(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("calculate")
    class Calculate {

        @TempDir
        Path dir;

        @Test
        @DisplayName("counts committed and untracked changes since the merge base")
        void countsChanges() throws Exception {
            assumeTrue(GitCommandRunner.isGitAvailable());
            var runner = new GitCommandRunner();
            var branches = new BranchOperations();
            var worktrees = new WorktreeOperations(runner, branches);
            var calculator = new GitStatsCalculator(runner, worktrees);

            Path repo = TestRepos.initWithCommit(dir.resolve("repo"));
            Path wt = repo.resolve(".switchyard/worktrees/alpha");
            worktrees.createWorktreeFromBase(repo, "switchyard/alpha", wt, "main");
            TestRepos.commitInWorktree(wt, "feature.txt", "one\ntwo\n", "add feature");
            TestRepos.writeFile(wt, "notes.txt", "a\nb\nc\n");
            TestRepos.writeFile(wt, ".switchyard/cache", "ignored\n");

            Instant now = Instant.parse("2026-01-15T10:00:00Z");
            GitStats stats = calculator.calculate("s1", wt, "main", now);

            assertEquals(2, stats.filesChanged());
            assertEquals(5, stats.linesAdded());
            assertEquals(0, stats.linesRemoved());
            assertTrue(stats.hasUncommitted());
            assertEquals(now, stats.calculatedAt());
        }

        @Test
        @DisplayName("a missing worktree is reported")
        void missingWorktree() {
            var runner = new GitCommandRunner();
            var calculator = new GitStatsCalculator(runner, new WorktreeOperations(runner, new BranchOperations()));

            assertThrows(WorktreeNotFoundException.class,
                    () -> calculator.calculate("s1", dir.resolve("nope"), "main", Instant.now()));
        }
    }
}
