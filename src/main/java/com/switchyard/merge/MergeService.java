package com.switchyard.merge;

import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.GitOperationException;
import com.switchyard.core.errors.InvalidInputException;
import com.switchyard.core.errors.InvalidSessionStateException;
import com.switchyard.core.errors.MergeConflictException;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.errors.WorktreeNotFoundException;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.logging.MdcContext;
import com.switchyard.core.metrics.SwitchyardMetrics;
import com.switchyard.core.model.MergeMode;
import com.switchyard.core.model.MergeOutcome;
import com.switchyard.core.model.MergePreview;
import com.switchyard.core.model.MergeState;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionState;
import com.switchyard.core.model.UpdateSessionFromParentResult;
import com.switchyard.core.model.UpdateStatus;
import com.switchyard.git.BranchOperations;
import com.switchyard.git.WorktreeOperations;
import com.switchyard.sessions.GitStatsCache;
import com.switchyard.sessions.SessionFinalizer;
import com.switchyard.sessions.SessionService;
import jakarta.annotation.PreDestroy;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reconciles session branches with their parent branches.
 * <p>
 * {@link #preview} and {@link #applyMerge} require a session that is marked ready, has a clean
 * worktree and whose branches resolve. Applying is bounded by the configured merge timeout
 * and rejected while another merge of the same session is in flight.
 */
@Service
public class MergeService {

    private static final Logger log = LoggerFactory.getLogger(MergeService.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final SessionService sessions;
    private final SessionFinalizer finalizer;
    private final GitStatsCache statsCache;
    private final WorktreeOperations worktrees;
    private final MergeEngine engine;
    private final SessionMergeLocks locks;
    private final SwitchyardProperties properties;
    private final SwitchyardMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;
    private final ExecutorService executor;

    public MergeService(SessionService sessions, SessionFinalizer finalizer, GitStatsCache statsCache,
                        WorktreeOperations worktrees, MergeEngine engine, SessionMergeLocks locks,
                        SwitchyardProperties properties, SwitchyardMetrics metrics, EventBus eventBus,
                        Clock clock) {
        this.sessions = sessions;
        this.finalizer = finalizer;
        this.statsCache = statsCache;
        this.worktrees = worktrees;
        this.engine = engine;
        this.locks = locks;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "merge-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public MergePreview preview(String sessionName) {
        MergeContext context = prepareContext(sessionName);
        String parent = context.parentBranch();
        MergeState state = assess(context);
        return new MergePreview(
                context.sessionBranch(),
                parent,
                List.of("git rebase " + parent,
                        "git reset --soft " + parent,
                        "git commit -m \"<your message>\""),
                List.of("git rebase " + parent,
                        "git update-ref refs/heads/%s $(git rev-parse HEAD)".formatted(parent)),
                "Merge session %s into %s".formatted(context.session().name(), parent),
                state.hasConflicts(),
                state.conflictingPaths(),
                state.isUpToDate());
    }

    /**
     * Merges a ready session into its parent branch.
     *
     * @param commitMessage required for {@link MergeMode#SQUASH}, ignored otherwise
     */
    public MergeOutcome applyMerge(String sessionName, MergeMode mode, String commitMessage) {
        String message = null;
        if (mode == MergeMode.SQUASH) {
            message = commitMessage == null ? "" : commitMessage.trim();
            if (message.isEmpty()) {
                throw new InvalidInputException("commit_message", "Commit message is required for squash merges");
            }
        }

        Session session = sessions.getSession(sessionName);
        SessionMergeLocks.Lease lease = locks.tryAcquire(session.id())
                .orElseThrow(() -> new InvalidSessionStateException(sessionName, "merging", "idle",
                        "Merge already running for session '%s'".formatted(sessionName)));

        String modeTag = mode.name().toLowerCase(Locale.ROOT);
        String finalMessage = message;
        AtomicBoolean started = new AtomicBoolean();
        Future<MergeOutcome> future;
        try {
            future = executor.submit(() -> {
                started.set(true);
                try {
                    return merge(sessionName, mode, finalMessage);
                } finally {
                    lease.close();
                }
            });
        } catch (RejectedExecutionException e) {
            lease.close();
            throw new GitOperationException("merge", "merge executor is shut down", e);
        }

        long timeoutSeconds = properties.getMergeTimeout().toSeconds();
        try {
            MergeOutcome outcome = future.get(timeoutSeconds, TimeUnit.SECONDS);
            metrics.recordMergeResult(modeTag, true);
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            if (!started.get()) {
                lease.close();
            }
            metrics.recordMergeResult(modeTag, false);
            log.error("Merge of session '{}' timed out after {}s", sessionName, timeoutSeconds);
            throw new GitOperationException("merge",
                    "Merge operation timed out after %d seconds".formatted(timeoutSeconds), e);
        } catch (ExecutionException e) {
            metrics.recordMergeResult(modeTag, false);
            Throwable cause = e.getCause();
            if (cause instanceof SwitchyardException switchyardException) {
                throw switchyardException;
            }
            throw new GitOperationException("merge", String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            metrics.recordMergeResult(modeTag, false);
            throw new GitOperationException("merge", "interrupted while waiting for merge", e);
        }
    }

    /**
     * Replays the session's own commits on top of the current parent tip. Outcomes are reported
     * as a status rather than thrown.
     */
    public UpdateSessionFromParentResult updateSessionFromParent(String sessionName) {
        Optional<Session> found = sessions.findSession(sessionName);
        if (found.isEmpty()) {
            return UpdateSessionFromParentResult.of(UpdateStatus.NO_SESSION, null,
                    "Session '%s' not found".formatted(sessionName));
        }
        Session session = found.get();
        String parent = session.parentBranch();
        if (session.isSpec()) {
            return UpdateSessionFromParentResult.of(UpdateStatus.NO_SESSION, parent,
                    "Session '%s' has no worktree".formatted(sessionName));
        }

        Optional<SessionMergeLocks.Lease> lease = locks.tryAcquire(session.id());
        if (lease.isEmpty()) {
            return UpdateSessionFromParentResult.of(UpdateStatus.MERGE_FAILED, parent,
                    "Merge already running for session '%s'".formatted(sessionName));
        }
        MdcContext.setSession(session.id(), sessionName);
        try (SessionMergeLocks.Lease held = lease.get()) {
            if (worktrees.hasUncommittedChanges(session.worktreePath())) {
                return UpdateSessionFromParentResult.of(UpdateStatus.HAS_UNCOMMITTED_CHANGES, parent,
                        "Session '%s' has uncommitted changes. Commit or stash them before updating."
                                .formatted(sessionName));
            }

            try (Repository repo = BranchOperations.openRepository(session.repositoryPath())) {
                ObjectId parentTip = engine.resolveBranch(repo, parent);
                if (parentTip == null) {
                    return UpdateSessionFromParentResult.of(UpdateStatus.MERGE_FAILED, parent,
                            "Parent branch '%s' not found".formatted(parent));
                }
                ObjectId sessionTip = engine.resolveBranch(repo, session.branch());
                if (sessionTip == null) {
                    return UpdateSessionFromParentResult.of(UpdateStatus.MERGE_FAILED, parent,
                            "Session branch '%s' not found".formatted(session.branch()));
                }
                if (!engine.needsRebase(repo, sessionTip, parentTip)) {
                    return UpdateSessionFromParentResult.of(UpdateStatus.ALREADY_UP_TO_DATE, parent,
                            "Already up to date");
                }

                ObjectId newTip = engine.replay(repo, sessionTip, parentTip, true, sessionName, parent);
                engine.updateBranch(repo, session.branch(), sessionTip, newTip, "update from " + parent);
            }
            worktrees.syncToHead(session.worktreePath());
            refreshStatsQuietly(session);
            log.info("Updated session '{}' from {}", sessionName, parent);
            eventBus.publish(SwitchyardEvent.of(SwitchyardEvent.Type.UPDATED_FROM_PARENT, session.id(), sessionName,
                    Map.of("parentBranch", parent), clock));
            return UpdateSessionFromParentResult.of(UpdateStatus.SUCCESS, parent,
                    "Session updated from " + parent);
        } catch (MergeConflictException e) {
            log.info("Updating session '{}' from {} conflicts: {}", sessionName, parent, e.files());
            return new UpdateSessionFromParentResult(UpdateStatus.HAS_CONFLICTS, parent, e.detail(), e.files());
        } catch (SwitchyardException e) {
            log.warn("Updating session '{}' from {} failed: {}", sessionName, parent, e.getMessage());
            return UpdateSessionFromParentResult.of(UpdateStatus.MERGE_FAILED, parent, e.getMessage());
        } catch (IOException e) {
            log.warn("Updating session '{}' from {} failed: {}", sessionName, parent, e.getMessage());
            return UpdateSessionFromParentResult.of(UpdateStatus.MERGE_FAILED, parent, e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    // ===================================================================
    //  Merge body
    // ===================================================================

    private MergeOutcome merge(String sessionName, MergeMode mode, String message) {
        MergeContext context = prepareContext(sessionName);
        MdcContext.setSession(context.session().id(), sessionName);
        try {
            MergeState state = assess(context);
            if (state.hasConflicts()) {
                String hint = state.conflictingPaths().isEmpty()
                        ? ""
                        : " Conflicting paths: " + String.join(", ", state.conflictingPaths());
                throw new MergeConflictException(state.conflictingPaths(),
                        "Session '%s' has merge conflicts when applying '%s' into '%s'.%s"
                                .formatted(sessionName, context.parentBranch(), context.sessionBranch(), hint));
            }
            if (state.isUpToDate()) {
                throw new GitOperationException("merge",
                        "Session '%s' has no commits to merge into parent branch '%s'."
                                .formatted(sessionName, context.parentBranch()));
            }
            warnIfParentDirty(context);

            MergeOutcome outcome = mode == MergeMode.SQUASH
                    ? performSquash(context, message)
                    : performReapply(context);
            afterSuccess(context, outcome);
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    private MergeOutcome performSquash(MergeContext context, String message) {
        log.info("Squash merging '{}' into '{}'", context.sessionBranch(), context.parentBranch());
        try (Repository repo = BranchOperations.openRepository(context.repoPath())) {
            ObjectId parentTip = requireBranch(repo, context.parentBranch(), context);
            ObjectId sessionTip = rebaseIfNeeded(repo, context, parentTip);
            ObjectId squash = engine.squashCommit(repo, sessionTip, parentTip, message);
            engine.updateBranch(repo, context.sessionBranch(), sessionTip, squash, "squash merge");
            worktrees.syncToHead(context.worktreePath());
            engine.fastForward(repo, context.parentBranch(), squash);
            return new MergeOutcome(context.sessionBranch(), context.parentBranch(), squash.name(), MergeMode.SQUASH);
        } catch (IOException e) {
            throw new GitOperationException("merge", e.getMessage(), e);
        }
    }

    private MergeOutcome performReapply(MergeContext context) {
        log.info("Reapply merging '{}' into '{}'", context.sessionBranch(), context.parentBranch());
        try (Repository repo = BranchOperations.openRepository(context.repoPath())) {
            ObjectId parentTip = requireBranch(repo, context.parentBranch(), context);
            ObjectId sessionTip = rebaseIfNeeded(repo, context, parentTip);
            engine.fastForward(repo, context.parentBranch(), sessionTip);
            return new MergeOutcome(context.sessionBranch(), context.parentBranch(), sessionTip.name(), MergeMode.REAPPLY);
        } catch (IOException e) {
            throw new GitOperationException("merge", e.getMessage(), e);
        }
    }

    private ObjectId rebaseIfNeeded(Repository repo, MergeContext context, ObjectId parentTip) throws IOException {
        ObjectId sessionTip = requireBranch(repo, context.sessionBranch(), context);
        if (!engine.needsRebase(repo, sessionTip, parentTip)) {
            log.debug("Skipping rebase of '{}': '{}' is already an ancestor",
                    context.sessionBranch(), context.parentBranch());
            return sessionTip;
        }
        ObjectId rebased = engine.replay(repo, sessionTip, parentTip, false,
                context.session().name(), context.parentBranch());
        engine.updateBranch(repo, context.sessionBranch(), sessionTip, rebased, "rebase onto " + context.parentBranch());
        worktrees.syncToHead(context.worktreePath());
        return rebased;
    }

    private void afterSuccess(MergeContext context, MergeOutcome outcome) {
        Session session = context.session();
        log.info("Merged session '{}' into '{}' at {}", session.name(), context.parentBranch(), outcome.newCommit());
        finalizer.finalizeStateTransition(session, SessionState.REVIEWED);
        eventBus.publish(SwitchyardEvent.of(SwitchyardEvent.Type.MERGE_COMPLETED, session.id(), session.name(),
                Map.of("parentBranch", context.parentBranch(),
                        "mode", outcome.mode().name().toLowerCase(Locale.ROOT),
                        "mergedCommit", outcome.newCommit()), clock));
        refreshStatsQuietly(session);
    }

    // ===================================================================
    //  Preconditions
    // ===================================================================

    private MergeContext prepareContext(String sessionName) {
        Session session = sessions.getSession(sessionName);
        if (session.isSpec()) {
            throw new InvalidSessionStateException(sessionName, "spec", "reviewed",
                    "Session '%s' is still a spec. Start it before merging.".formatted(sessionName));
        }
        if (!session.readyToMerge()) {
            throw new InvalidSessionStateException(sessionName, session.sessionState().dbValue(), "reviewed",
                    "Session '%s' is not marked ready to merge".formatted(sessionName));
        }
        if (!Files.exists(session.worktreePath())) {
            throw new WorktreeNotFoundException(session.worktreePath());
        }
        List<String> dirty = worktrees.uncommittedSamplePaths(session.worktreePath(), 3);
        if (!dirty.isEmpty()) {
            throw new InvalidSessionStateException(sessionName, "dirty", "clean",
                    "Session '%s' has uncommitted changes. Clean the worktree before merging. Offending paths: %s"
                            .formatted(sessionName, String.join(", ", dirty)));
        }
        String parent = session.parentBranch() == null ? "" : session.parentBranch().trim();
        if (parent.isEmpty()) {
            throw new InvalidInputException("parent_branch",
                    "Session '%s' has no recorded parent branch".formatted(sessionName));
        }

        try (Repository repo = BranchOperations.openRepository(session.repositoryPath())) {
            MergeContext partial = new MergeContext(session, session.repositoryPath(), session.worktreePath(),
                    session.branch(), parent, null, null);
            ObjectId parentOid = requireBranch(repo, parent, partial);
            ObjectId sessionOid = requireBranch(repo, session.branch(), partial);
            return new MergeContext(session, session.repositoryPath(), session.worktreePath(),
                    session.branch(), parent, sessionOid, parentOid);
        } catch (IOException e) {
            throw new GitOperationException("merge_preflight",
                    "Failed to open git repository at %s: %s".formatted(session.repositoryPath(), e.getMessage()), e);
        }
    }

    private MergeState assess(MergeContext context) {
        try (Repository repo = BranchOperations.openRepository(context.repoPath())) {
            return engine.compute(repo, context.sessionOid(), context.parentOid(),
                    context.sessionBranch(), context.parentBranch());
        } catch (IOException e) {
            throw new GitOperationException("compute_merge_state", e.getMessage(), e);
        }
    }

    private void warnIfParentDirty(MergeContext context) {
        Path repoPath = context.repoPath();
        try {
            Optional<String> current;
            try (Repository repo = BranchOperations.openRepository(repoPath)) {
                String full = repo.getFullBranch();
                current = Optional.ofNullable(full).map(Repository::shortenRefName);
            }
            if (current.isEmpty() || !current.get().equals(context.parentBranch())) {
                return;
            }
            List<String> dirty = worktrees.uncommittedSamplePaths(repoPath, 3);
            if (!dirty.isEmpty()) {
                log.warn("Parent branch '{}' has uncommitted changes in repository '{}'. "
                                + "Merge will update refs only without touching the working tree. Offending paths: {}",
                        context.parentBranch(), repoPath, String.join(", ", dirty));
            }
        } catch (IOException | SwitchyardException e) {
            log.warn("Could not inspect parent working tree at {}: {}", repoPath, e.getMessage());
        }
    }

    private ObjectId requireBranch(Repository repo, String branch, MergeContext context) throws IOException {
        ObjectId oid = engine.resolveBranch(repo, branch);
        if (oid == null) {
            String role = branch.equals(context.parentBranch()) ? "Parent" : "Session";
            throw new GitOperationException("resolve_branch", "%s branch '%s' not found for session '%s'"
                    .formatted(role, branch, context.session().name()));
        }
        return oid;
    }

    private void refreshStatsQuietly(Session session) {
        try {
            statsCache.refresh(session);
        } catch (SwitchyardException e) {
            log.warn("Failed to refresh git stats for '{}': {}", session.name(), e.getMessage());
        }
    }

    private record MergeContext(
        Session session,
        Path repoPath,
        Path worktreePath,
        String sessionBranch,
        String parentBranch,
        ObjectId sessionOid,
        ObjectId parentOid
    ) {
    }
}
