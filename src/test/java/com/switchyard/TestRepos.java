package com.switchyard;

import com.switchyard.git.GitCommandRunner;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Throwaway git repositories for tests. Commits are made with JGit so no global git identity is needed.
 */
public final class TestRepos {

    public static final PersonIdent AUTHOR = new PersonIdent("Test Author", "author@example.com");

    private TestRepos() {
    }

    /**
     * A repository on {@code main} with one commit containing {@code README.md}.
     */
    public static Path initWithCommit(Path dir) throws Exception {
        try (Git git = Git.init().setDirectory(dir.toFile()).setInitialBranch("main").call()) {
            writeFile(dir, "README.md", "hello\n");
            commitAll(git, "initial commit");
        }
        return dir;
    }

    public static Path initEmpty(Path dir, String initialBranch) throws Exception {
        Git.init().setDirectory(dir.toFile()).setInitialBranch(initialBranch).call().close();
        return dir;
    }

    public static RevCommit commitFile(Path repo, String path, String content, String message) throws Exception {
        try (Git git = Git.open(repo.toFile())) {
            writeFile(repo, path, content);
            return commitAll(git, message);
        }
    }

    /**
     * Commits on {@code branch}, creating it at the current HEAD if needed, then checks {@code main} out again.
     */
    public static RevCommit commitOnBranch(Path repo, String branch, String path, String content, String message)
            throws Exception {
        try (Git git = Git.open(repo.toFile())) {
            boolean exists = git.getRepository().exactRef("refs/heads/" + branch) != null;
            git.checkout().setName(branch).setCreateBranch(!exists).call();
            writeFile(repo, path, content);
            RevCommit commit = commitAll(git, message);
            git.checkout().setName("main").call();
            return commit;
        }
    }

    /**
     * Commits inside a linked worktree through the git CLI, with an inline identity.
     */
    public static void commitInWorktree(Path worktree, String path, String content, String message) {
        writeFile(worktree, path, content);
        GitCommandRunner git = new GitCommandRunner();
        git.runGitOutput(worktree, "add", "-A");
        git.runGitOutput(worktree, "-c", "user.name=Test Author", "-c", "user.email=author@example.com",
                "commit", "-m", message);
    }

    public static void writeFile(Path root, String path, String content) {
        try {
            Path file = root.resolve(path);
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static RevCommit commitAll(Git git, String message) throws Exception {
        git.add().addFilepattern(".").call();
        return git.commit().setMessage(message).setAuthor(AUTHOR).setCommitter(AUTHOR).setSign(false).call();
    }
}
