package com.switchyard.merge;

import com.switchyard.core.errors.GitOperationException;
import com.switchyard.core.errors.MergeConflictException;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.MergeState;
import com.switchyard.git.GitNames;
import com.switchyard.git.WorktreeOperations;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectInserter;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.merge.MergeStrategy;
import org.eclipse.jgit.merge.ResolveMerger;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevSort;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * History operations behind merge preview, apply and update-from-parent.
 * <p>
 * Merges and replays run in memory against the object database; no working tree is touched
 * until a ref is deliberately moved. Callers own the {@link Repository} handle.
 */
@Component
public class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    static final int CONFLICT_SAMPLE_LIMIT = 5;

    private final WorktreeOperations worktrees;

    public MergeEngine(WorktreeOperations worktrees) {
        this.worktrees = worktrees;
    }

    /**
     * Whether {@code sessionOid} has anything to merge into {@code parentOid}, and whether a
     * trial merge of the two tips conflicts.
     */
    public MergeState compute(Repository repo, ObjectId sessionOid, ObjectId parentOid,
                              String sessionBranch, String parentBranch) {
        try {
            if (!commitsAhead(repo, sessionOid, parentOid)) {
                return MergeState.upToDate();
            }
            ResolveMerger merger = newMerger(repo);
            boolean clean = merger.merge(sessionOid, parentOid);
            List<String> conflicts = clean ? List.of() : conflictingPaths(merger);
            return new MergeState(!conflicts.isEmpty(), conflicts, false);
        } catch (IOException e) {
            throw new GitOperationException("compute_merge_state",
                    "Failed to simulate merge between '%s' and '%s': %s"
                            .formatted(sessionBranch, parentBranch, e.getMessage()), e);
        }
    }

    /**
     * Whether {@code sessionOid} has commits that {@code parentOid} does not.
     */
    public boolean commitsAhead(Repository repo, ObjectId sessionOid, ObjectId parentOid) throws IOException {
        if (sessionOid.equals(parentOid)) {
            return false;
        }
        try (RevWalk walk = new RevWalk(repo)) {
            walk.markStart(walk.parseCommit(sessionOid));
            walk.markUninteresting(walk.parseCommit(parentOid));
            return walk.next() != null;
        }
    }

    public ObjectId mergeBase(Repository repo, ObjectId a, ObjectId b) throws IOException {
        try (RevWalk walk = new RevWalk(repo)) {
            walk.setRevFilter(RevFilter.MERGE_BASE);
            walk.markStart(walk.parseCommit(a));
            walk.markStart(walk.parseCommit(b));
            RevCommit base = walk.next();
            return base == null ? null : base.copy();
        }
    }

    /**
     * True when the parent tip is not already in the session's history.
     */
    public boolean needsRebase(Repository repo, ObjectId sessionOid, ObjectId parentOid) throws IOException {
        return !parentOid.equals(mergeBase(repo, sessionOid, parentOid));
    }

    /**
     * Replays the commits of {@code sessionTip} that {@code onto} lacks, oldest first, keeping
     * each commit's author and message. Only new objects are written; no ref moves.
     *
     * @param skipApplied drop commits whose change {@code onto} already contains instead of failing
     * @return the new tip, or {@code onto} when there was nothing to replay
     * @throws MergeConflictException if a commit does not apply cleanly
     */
    public ObjectId replay(Repository repo, ObjectId sessionTip, ObjectId onto, boolean skipApplied,
                           String sessionName, String parentBranch) throws IOException {
        PersonIdent committer = new PersonIdent(repo);
        try (RevWalk walk = new RevWalk(repo); ObjectInserter inserter = repo.newObjectInserter()) {
            walk.sort(RevSort.TOPO, true);
            walk.sort(RevSort.REVERSE, true);
            walk.markStart(walk.parseCommit(sessionTip));
            walk.markUninteresting(walk.parseCommit(onto));
            List<RevCommit> commits = new ArrayList<>();
            for (RevCommit commit : walk) {
                commits.add(commit);
            }

            ObjectId head = onto;
            for (RevCommit commit : commits) {
                if (commit.getParentCount() == 0) {
                    throw new GitOperationException("rebase",
                            "Cannot replay root commit %s of session '%s'".formatted(commit.abbreviate(7).name(), sessionName));
                }
                ResolveMerger merger = newMerger(repo);
                merger.setBase(commit.getParent(0));
                if (!merger.merge(head, commit)) {
                    List<String> paths = conflictingPaths(merger);
                    throw new MergeConflictException(paths, "Rebase produced conflicts for session '%s': %s"
                            .formatted(sessionName, String.join(", ", paths)));
                }

                ObjectId tree = merger.getResultTreeId();
                ObjectId headTree = walk.parseCommit(head).getTree().getId();
                if (tree.equals(headTree)) {
                    if (!skipApplied) {
                        throw new MergeConflictException(List.of(),
                                "Conflicting change already exists on parent branch '%s' while merging session '%s'"
                                        .formatted(parentBranch, sessionName));
                    }
                    log.debug("Dropping {} of session '{}': already contained in {}",
                            commit.abbreviate(7).name(), sessionName, parentBranch);
                    continue;
                }

                CommitBuilder builder = new CommitBuilder();
                builder.setTreeId(tree);
                builder.setParentId(head);
                builder.setAuthor(commit.getAuthorIdent());
                builder.setCommitter(committer);
                builder.setMessage(commit.getFullMessage());
                head = inserter.insert(builder);
                inserter.flush();
            }
            log.debug("Replayed {} commit(s) of session '{}' onto {}", commits.size(), sessionName, parentBranch);
            return head;
        }
    }

    /**
     * Writes one commit with the session tip's tree and the parent tip as its only parent.
     */
    public ObjectId squashCommit(Repository repo, ObjectId sessionTip, ObjectId parentTip, String message)
            throws IOException {
        PersonIdent signature = new PersonIdent(repo);
        try (RevWalk walk = new RevWalk(repo); ObjectInserter inserter = repo.newObjectInserter()) {
            RevCommit session = walk.parseCommit(sessionTip);
            CommitBuilder builder = new CommitBuilder();
            builder.setTreeId(session.getTree());
            builder.setParentId(parentTip);
            builder.setAuthor(signature);
            builder.setCommitter(signature);
            builder.setMessage(message);
            ObjectId id = inserter.insert(builder);
            inserter.flush();
            return id;
        }
    }

    /**
     * Moves {@code branch} from {@code expectedOld} to {@code newId}. Fails if someone else moved it first.
     */
    public void updateBranch(Repository repo, String branch, ObjectId expectedOld, ObjectId newId, String reason)
            throws IOException {
        RefUpdate update = repo.updateRef(Constants.R_HEADS + branch);
        update.setExpectedOldObjectId(expectedOld);
        update.setNewObjectId(newId);
        update.setForceUpdate(true);
        update.setRefLogMessage("switchyard: " + reason, false);
        RefUpdate.Result result = update.update();
        switch (result) {
            case NEW, FORCED, FAST_FORWARD, NO_CHANGE -> log.debug("Moved {} to {} ({})", branch, newId.name(), result);
            default -> throw new GitOperationException("update_ref",
                    "Failed to move branch '%s' to %s: %s".formatted(branch, newId.name(), result));
        }
    }

    /**
     * Fast-forwards {@code branch} to {@code newOid}. When the branch is checked out in the main
     * working tree and that tree had no tracked changes, the tree follows the ref; otherwise
     * only the ref moves.
     */
    public void fastForward(Repository repo, String branch, ObjectId newOid) throws IOException {
        String refName = Constants.R_HEADS + branch;
        Ref ref = repo.exactRef(refName);
        if (ref == null || ref.getObjectId() == null) {
            throw new GitOperationException("fast_forward", "Reference '%s' not found".formatted(refName));
        }
        ObjectId current = ref.getObjectId();
        if (current.equals(newOid)) {
            log.debug("Branch '{}' already at {}", branch, newOid.name());
            return;
        }
        try (RevWalk walk = new RevWalk(repo)) {
            if (!walk.isMergedInto(walk.parseCommit(current), walk.parseCommit(newOid))) {
                throw new GitOperationException("fast_forward",
                        "Cannot fast-forward branch '%s' because new commit %s does not descend from current head %s"
                                .formatted(branch, newOid.name(), current.name()));
            }
        }

        boolean checkedOut = !repo.isBare() && refName.equals(repo.getFullBranch());
        Path workTree = checkedOut ? repo.getWorkTree().toPath() : null;
        String skipReason = null;
        if (checkedOut) {
            try {
                if (worktrees.hasTrackedChanges(workTree)) {
                    skipReason = "working tree '%s' has tracked changes".formatted(workTree);
                }
            } catch (SwitchyardException e) {
                skipReason = "unable to inspect working tree '%s': %s".formatted(workTree, e.getMessage());
            }
        }

        updateBranch(repo, branch, current, newOid, "fast-forward merge");

        if (!checkedOut) {
            return;
        }
        if (skipReason == null) {
            worktrees.syncToHead(workTree);
            log.debug("Updated working tree for branch '{}'", branch);
        } else {
            log.info("Skipping working tree checkout for branch '{}' because {}", branch, skipReason);
        }
    }

    public ObjectId resolveBranch(Repository repo, String branch) throws IOException {
        Ref ref = repo.exactRef(Constants.R_HEADS + branch);
        if (ref == null || ref.getObjectId() == null) {
            return null;
        }
        return ref.getObjectId();
    }

    private static ResolveMerger newMerger(Repository repo) {
        return (ResolveMerger) MergeStrategy.RECURSIVE.newMerger(repo, true);
    }

    static List<String> conflictingPaths(ResolveMerger merger) {
        TreeSet<String> paths = new TreeSet<>();
        List<String> unmerged = merger.getUnmergedPaths();
        if (unmerged != null) {
            for (String path : unmerged) {
                if (!GitNames.isInternalPath(path)) {
                    paths.add(path);
                }
            }
        }
        return paths.stream().limit(CONFLICT_SAMPLE_LIMIT).toList();
    }
}
