package com.switchyard.git;

import com.switchyard.core.errors.GitOperationException;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ListBranchCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Branch-level operations on the main repository, implemented with JGit.
 * <p>
 * Each call opens and closes its own repository handle.
 */
@Component
public class BranchOperations {

    private static final Logger log = LoggerFactory.getLogger(BranchOperations.class);

    private static final String ORIGIN_PREFIX = "origin/";

    /**
     * Opens the repository whose working tree is {@code repoPath}.
     */
    public static Repository openRepository(Path repoPath) throws IOException {
        return new FileRepositoryBuilder()
                .setWorkTree(repoPath.toFile())
                .setMustExist(true)
                .build();
    }

    /**
     * Local branches plus remote-tracking branches of {@code origin} with the prefix stripped,
     * deduplicated and sorted. A repository without commits reports its unborn HEAD branch.
     */
    public List<String> listBranches(Path repoPath) {
        try (Repository repo = openRepository(repoPath); Git git = new Git(repo)) {
            if (!hasCommits(repo)) {
                String unborn = unbornHeadBranch(repo);
                if (unborn == null) {
                    log.warn("Repository {} has no commits and no unborn HEAD branch", repoPath);
                    return List.of();
                }
                return List.of(unborn);
            }

            var names = new TreeSet<String>();
            for (Ref ref : git.branchList().call()) {
                names.add(Repository.shortenRefName(ref.getName()));
            }
            for (Ref ref : git.branchList().setListMode(ListBranchCommand.ListMode.REMOTE).call()) {
                String shortName = Repository.shortenRefName(ref.getName());
                if (shortName.startsWith(ORIGIN_PREFIX)) {
                    String branch = shortName.substring(ORIGIN_PREFIX.length());
                    if (!branch.equals(Constants.HEAD)) {
                        names.add(branch);
                    }
                }
            }
            log.debug("Found {} branches in {}", names.size(), repoPath);
            return new ArrayList<>(names);
        } catch (IOException | GitAPIException e) {
            throw new GitOperationException("list_branches", e.getMessage(), e);
        }
    }

    /**
     * Local branch existence. Invalid names and unreadable refs count as absent.
     */
    public boolean branchExists(Path repoPath, String branchName) {
        if (!Repository.isValidRefName(Constants.R_HEADS + branchName)) {
            return false;
        }
        try (Repository repo = openRepository(repoPath)) {
            return repo.exactRef(Constants.R_HEADS + branchName) != null;
        } catch (IOException e) {
            log.warn("Treating unreadable branch '{}' as missing: {}", branchName, e.getMessage());
            return false;
        }
    }

    public void deleteBranch(Path repoPath, String branchName) {
        try (Repository repo = openRepository(repoPath); Git git = new Git(repo)) {
            if (repo.exactRef(Constants.R_HEADS + branchName) == null) {
                throw new GitOperationException("delete_branch", "Branch '%s' does not exist".formatted(branchName));
            }
            git.branchDelete().setBranchNames(branchName).setForce(true).call();
            log.info("Deleted branch '{}'", branchName);
        } catch (IOException | GitAPIException e) {
            throw new GitOperationException("delete_branch",
                    "Failed to delete branch %s: %s".formatted(branchName, e.getMessage()), e);
        }
    }

    /**
     * Renames a local branch. Never overwrites an existing target.
     */
    public void renameBranch(Path repoPath, String oldBranch, String newBranch) {
        GitNames.validateBranchName(newBranch);
        if (!branchExists(repoPath, oldBranch)) {
            throw new GitOperationException("rename_branch", "Branch '%s' does not exist".formatted(oldBranch));
        }
        if (branchExists(repoPath, newBranch)) {
            throw new GitOperationException("rename_branch", "Branch '%s' already exists".formatted(newBranch));
        }
        try (Repository repo = openRepository(repoPath); Git git = new Git(repo)) {
            git.branchRename().setOldName(oldBranch).setNewName(newBranch).call();
            log.info("Renamed branch '{}' to '{}'", oldBranch, newBranch);
        } catch (IOException | GitAPIException e) {
            throw new GitOperationException("rename_branch", e.getMessage(), e);
        }
    }

    /**
     * Leaves the repository checked out on {@code branchName}, pointing at the pre-call HEAD commit.
     * <ol>
     *   <li>An existing branch is simply checked out.</li>
     *   <li>Otherwise a current (non-detached) branch is renamed in place, which bootstraps a fresh
     *       repository whose default branch name differs from the configured one.</li>
     *   <li>Otherwise the branch is created at HEAD.</li>
     * </ol>
     * Checkout is forced. A repository without commits cannot satisfy the contract.
     */
    public void ensureBranchAtHead(Path repoPath, String branchName) {
        GitNames.validateBranchName(branchName);
        try (Repository repo = openRepository(repoPath); Git git = new Git(repo)) {
            if (repo.exactRef(Constants.R_HEADS + branchName) != null) {
                log.info("Branch '{}' already exists, checking out", branchName);
                checkout(git, branchName);
                return;
            }

            String fullBranch = repo.getFullBranch();
            if (fullBranch != null && fullBranch.startsWith(Constants.R_HEADS)
                    && repo.exactRef(fullBranch) != null) {
                String current = Repository.shortenRefName(fullBranch);
                log.info("Renaming current branch '{}' to requested base '{}'", current, branchName);
                git.branchRename().setOldName(current).setNewName(branchName).call();
                checkout(git, branchName);
                return;
            }

            ObjectId head = repo.resolve(Constants.HEAD + "^{commit}");
            if (head == null) {
                throw new GitOperationException("ensure_branch_at_head",
                        "Cannot resolve HEAD commit to create branch '%s'".formatted(branchName));
            }
            git.branchCreate().setName(branchName).setStartPoint(head.getName()).call();
            checkout(git, branchName);
            log.info("Bootstrapped branch '{}' from HEAD commit {}", branchName, head.abbreviate(7).name());
        } catch (IOException | GitAPIException e) {
            throw new GitOperationException("ensure_branch_at_head", e.getMessage(), e);
        }
    }

    /**
     * Creates or moves {@code branchName} to {@code commitId} without touching any working tree.
     */
    public void createBranchAt(Path repoPath, String branchName, String commitId) {
        GitNames.validateBranchName(branchName);
        try (Repository repo = openRepository(repoPath); Git git = new Git(repo)) {
            git.branchCreate().setName(branchName).setStartPoint(commitId).setForce(true).call();
            log.debug("Created branch '{}' at {}", branchName, commitId);
        } catch (IOException | GitAPIException e) {
            throw new GitOperationException("create_branch", e.getMessage(), e);
        }
    }

    /**
     * Resolves a branch to its commit id, trying the local branch first and then {@code origin}.
     */
    public Optional<String> resolveBranchCommit(Path repoPath, String branchName) {
        try (Repository repo = openRepository(repoPath)) {
            for (String refName : List.of(Constants.R_HEADS + branchName, Constants.R_REMOTES + ORIGIN_PREFIX + branchName)) {
                Ref ref = repo.exactRef(refName);
                if (ref != null && ref.getObjectId() != null) {
                    ObjectId commit = repo.resolve(refName + "^{commit}");
                    if (commit != null) {
                        return Optional.of(commit.getName());
                    }
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new GitOperationException("resolve_branch", e.getMessage(), e);
        }
    }

    public boolean hasCommits(Path repoPath) {
        try (Repository repo = openRepository(repoPath)) {
            return hasCommits(repo);
        } catch (IOException e) {
            throw new GitOperationException("has_commits", e.getMessage(), e);
        }
    }

    /**
     * Short name of the checked-out branch, or empty when HEAD is detached.
     */
    public Optional<String> currentBranch(Path repoPath) {
        try (Repository repo = openRepository(repoPath)) {
            String fullBranch = repo.getFullBranch();
            if (fullBranch == null || !fullBranch.startsWith(Constants.R_HEADS)) {
                return Optional.empty();
            }
            return Optional.of(Repository.shortenRefName(fullBranch));
        } catch (IOException e) {
            throw new GitOperationException("current_branch", e.getMessage(), e);
        }
    }

    private static boolean hasCommits(Repository repo) throws IOException {
        return repo.resolve(Constants.HEAD + "^{commit}") != null;
    }

    private static String unbornHeadBranch(Repository repo) throws IOException {
        Ref head = repo.exactRef(Constants.HEAD);
        if (head != null && head.isSymbolic()) {
            return Repository.shortenRefName(head.getTarget().getName());
        }
        return null;
    }

    private static void checkout(Git git, String branchName) throws GitAPIException {
        git.checkout().setName(branchName).setForced(true).call();
    }
}
