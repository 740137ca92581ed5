package com.switchyard.sessions;

import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.InvalidInputException;
import com.switchyard.core.errors.InvalidSessionStateException;
import com.switchyard.core.errors.SessionAlreadyExistsException;
import com.switchyard.core.errors.SessionNotFoundException;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.logging.MdcContext;
import com.switchyard.core.metrics.SwitchyardMetrics;
import com.switchyard.core.model.CancellationResult;
import com.switchyard.core.model.GitStats;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionState;
import com.switchyard.core.model.SessionStatus;
import com.switchyard.core.model.Spec;
import com.switchyard.core.persistence.GitStatsStore;
import com.switchyard.core.persistence.SessionStore;
import com.switchyard.core.persistence.SpecStore;
import com.switchyard.git.BranchOperations;
import com.switchyard.git.GitNames;
import com.switchyard.git.WorktreeOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Session lifecycle for the configured repository: creation, state transitions, the review
 * flow, specs and cancellation.
 * <p>
 * Sessions and specs share one name namespace per repository. A name is reserved in
 * {@link NameReservationRegistry} for the whole of a create call, so two concurrent requests
 * for the same name can never both reach worktree creation.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SwitchyardProperties properties;
    private final SessionStore sessionStore;
    private final SpecStore specStore;
    private final GitStatsStore gitStatsStore;
    private final BranchOperations branches;
    private final WorktreeOperations worktrees;
    private final NameReservationRegistry reservations;
    private final SessionFinalizer finalizer;
    private final GitStatsCache statsCache;
    private final CancellationCoordinator cancellation;
    private final EventBus eventBus;
    private final SwitchyardMetrics metrics;
    private final Clock clock;

    public SessionService(SwitchyardProperties properties, SessionStore sessionStore, SpecStore specStore,
                          GitStatsStore gitStatsStore, BranchOperations branches, WorktreeOperations worktrees,
                          NameReservationRegistry reservations, SessionFinalizer finalizer,
                          GitStatsCache statsCache, CancellationCoordinator cancellation,
                          EventBus eventBus, SwitchyardMetrics metrics, Clock clock) {
        this.properties = properties;
        this.sessionStore = sessionStore;
        this.specStore = specStore;
        this.gitStatsStore = gitStatsStore;
        this.branches = branches;
        this.worktrees = worktrees;
        this.reservations = reservations;
        this.finalizer = finalizer;
        this.statsCache = statsCache;
        this.cancellation = cancellation;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ===================================================================
    //  Creation
    // ===================================================================

    public Session createSession(CreateSessionRequest request) {
        return create(request, request.wasAutoGenerated(), true, false);
    }

    private Session create(CreateSessionRequest request, boolean pendingNameGeneration,
                           boolean resumeAllowed, boolean promotingSpec) {
        String name = request.name();
        requireValidName(name);
        Path repo = repositoryRoot();

        if (!reservations.reserve(repo, name)) {
            log.warn("Rejecting create for '{}': another creation is in progress", name);
            throw new SessionAlreadyExistsException(name);
        }
        MdcContext.setSession(null, name);
        try {
            ensureNameAvailable(repo, name, promotingSpec);

            String parent = resolveParentBranch(request.parentBranch());
            String branch = branchFor(name);
            Path worktree = worktreeFor(name);
            Instant now = now();

            Session session = Session.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name)
                    .displayName(request.displayName())
                    .versionGroupId(request.versionGroupId())
                    .versionNumber(request.versionNumber())
                    .repositoryPath(repo)
                    .repositoryName(repositoryName(repo))
                    .branch(branch)
                    .parentBranch(parent)
                    .originalParentBranch(parent)
                    .worktreePath(worktree)
                    .status(request.asSpec() ? SessionStatus.SPEC : SessionStatus.ACTIVE)
                    .sessionState(request.asSpec() ? SessionState.SPEC : SessionState.RUNNING)
                    .createdAt(now)
                    .updatedAt(now)
                    .initialPrompt(request.initialPrompt())
                    .specContent(request.asSpec() ? request.initialPrompt() : null)
                    .resumeAllowed(resumeAllowed)
                    .pendingNameGeneration(pendingNameGeneration)
                    .wasAutoGenerated(request.wasAutoGenerated())
                    .originalAgentType(request.agentType())
                    .originalSkipPermissions(request.skipPermissions())
                    .epicId(request.epicId())
                    .build();

            if (!request.asSpec()) {
                materializeWorktree(session);
            }

            SessionFinalizer.FinalizationResult result;
            try {
                result = finalizer.finalizeCreation(session, !request.asSpec(), true);
            } catch (SwitchyardException e) {
                log.error("Persisting session '{}' failed, rolling back its worktree: {}", name, e.getMessage());
                if (!request.asSpec()) {
                    retireWorktree(session);
                }
                throw e;
            }

            Session created = result.session();
            metrics.recordSessionCreated(created.sessionState().dbValue());
            eventBus.publish(SwitchyardEvent.of(SwitchyardEvent.Type.SESSION_ADDED, created.id(), created.name(),
                    Map.of("branch", branch, "parentBranch", parent,
                            "state", created.sessionState().dbValue()), clock));
            log.info("Created session '{}' on branch {} from {} ({})",
                    name, branch, parent, created.sessionState().dbValue());
            return created;
        } finally {
            reservations.release(repo, name);
            MdcContext.clear();
        }
    }

    // ===================================================================
    //  State transitions and review flow
    // ===================================================================

    /**
     * Moves a session to {@code newState}. Entering RUNNING from SPEC materializes the worktree;
     * entering SPEC retires it. Both hold the name's reservation, and the state is re-read under
     * it, so a concurrent start or create of the same name cannot touch the same worktree.
     */
    public Session transitionState(String name, SessionState newState) {
        Session session = requireSession(name);
        SessionState current = session.sessionState();
        SessionStateMachine.validateTransition(name, current, newState);
        if (current == newState) {
            return session;
        }
        if (current != SessionState.SPEC && newState != SessionState.SPEC) {
            return applyTransition(session, newState);
        }

        Path repo = repositoryRoot();
        if (!reservations.reserve(repo, name)) {
            log.warn("Rejecting transition of '{}' to {}: another operation on the name is in progress",
                    name, newState.dbValue());
            throw new InvalidSessionStateException(name, current.dbValue(), newState.dbValue(),
                    "Session '%s' is already being changed by another request".formatted(name));
        }
        try {
            Session latest = requireSession(name);
            if (latest.sessionState() == newState) {
                return latest;
            }
            SessionStateMachine.validateTransition(name, latest.sessionState(), newState);
            return applyTransition(latest, newState);
        } finally {
            reservations.release(repo, name);
        }
    }

    private Session applyTransition(Session session, SessionState newState) {
        String name = session.name();
        SessionState current = session.sessionState();
        MdcContext.setSession(session.id(), name);
        try {
            Session.Builder updated = session.toBuilder().updatedAt(now());
            if (current == SessionState.SPEC) {
                materializeWorktree(session);
                updated.status(SessionStatus.ACTIVE).readyToMerge(false);
            } else if (newState == SessionState.SPEC) {
                retireWorktree(session);
                statsCache.evict(session.id());
                updated.status(SessionStatus.SPEC)
                        .readyToMerge(false)
                        .specContent(specContentOf(session));
            } else if (newState == SessionState.RUNNING) {
                updated.readyToMerge(false);
            }
            sessionStore.update(updated.build());
            finalizer.finalizeStateTransition(session, newState);
            recordTransition(session, current, newState);
            return requireSession(name);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Marks a session ready to merge if its worktree is clean.
     *
     * @return {@code false} without changing anything when the worktree has uncommitted changes
     */
    public boolean markReady(String name) {
        Session session = requireSession(name);
        if (session.isSpec()) {
            throw new InvalidSessionStateException(name, "spec", "running");
        }
        List<String> dirty = worktrees.uncommittedSamplePaths(session.worktreePath(), 3);
        if (!dirty.isEmpty()) {
            log.info("Session '{}' not marked ready: uncommitted changes in {}", name, dirty);
            return false;
        }

        sessionStore.update(session.toBuilder().readyToMerge(true).updatedAt(now()).build());
        finalizer.finalizeStateTransition(session, SessionState.REVIEWED);
        recordTransition(session, session.sessionState(), SessionState.REVIEWED);
        refreshStatsQuietly(session);
        return true;
    }

    public void unmarkReady(String name) {
        Session session = requireSession(name);
        sessionStore.update(session.toBuilder().readyToMerge(false).updatedAt(now()).build());
        if (!session.isSpec() && session.sessionState() != SessionState.RUNNING) {
            finalizer.finalizeStateTransition(session, SessionState.RUNNING);
            recordTransition(session, session.sessionState(), SessionState.RUNNING);
        }
    }

    public boolean markReviewed(String name) {
        Session session = requireSession(name);
        if (session.isSpec()) {
            throw new InvalidSessionStateException(name, "spec", "running",
                    "Cannot mark spec session '%s' as reviewed. Start the spec first.".formatted(name));
        }
        if (session.readyToMerge()) {
            throw new InvalidSessionStateException(name, "reviewed", "running",
                    "Session '%s' is already marked as reviewed".formatted(name));
        }
        return markReady(name);
    }

    /**
     * A follow-up prompt sent to a reviewed session returns it to RUNNING.
     *
     * @return whether the session was reviewed and has been reset
     */
    public boolean unmarkReviewedOnFollowUp(String name) {
        Path repo = repositoryRoot();
        if (specStore.findByName(repo, name).isPresent()) {
            return false;
        }
        Session session = requireSession(name);
        if (session.isSpec() || session.sessionState() != SessionState.REVIEWED) {
            return false;
        }
        sessionStore.update(session.toBuilder().readyToMerge(false).updatedAt(now()).build());
        finalizer.finalizeStateTransition(session, SessionState.RUNNING);
        recordTransition(session, SessionState.REVIEWED, SessionState.RUNNING);
        log.info("Session '{}' returned to running after a follow-up prompt", name);
        return true;
    }

    // ===================================================================
    //  Queries
    // ===================================================================

    public Session getSession(String name) {
        return requireSession(name);
    }

    public Optional<Session> findSession(String name) {
        return sessionStore.findByName(repositoryRoot(), name)
                .filter(s -> s.status() != SessionStatus.CANCELLED);
    }

    public List<Session> listSessions(boolean includeCancelled) {
        return sessionStore.list(repositoryRoot(), includeCancelled);
    }

    public List<String> listBranches() {
        return branches.listBranches(repositoryRoot());
    }

    public Optional<GitStats> getGitStats(String name) {
        return statsCache.getOrCompute(requireSession(name));
    }

    // ===================================================================
    //  Specs
    // ===================================================================

    public Spec createSpec(String name, String content) {
        requireValidName(name);
        Path repo = repositoryRoot();
        if (!reservations.reserve(repo, name)) {
            throw new SessionAlreadyExistsException(name);
        }
        try {
            ensureNameAvailable(repo, name, false);
            Instant now = now();
            Spec spec = new Spec(UUID.randomUUID().toString(), name, null, null, repo, repositoryName(repo),
                    content == null ? "" : content, now, now);
            specStore.insert(spec);
            log.info("Created spec '{}'", name);
            return spec;
        } finally {
            reservations.release(repo, name);
        }
    }

    public Spec updateSpecContent(String name, String content) {
        Spec spec = requireSpec(name);
        specStore.updateContent(spec.id(), content, now());
        return requireSpec(name);
    }

    public List<Spec> listSpecs() {
        return specStore.list(repositoryRoot());
    }

    public void deleteSpec(String name) {
        Spec spec = requireSpec(name);
        specStore.delete(spec.id());
        log.info("Deleted spec '{}'", name);
    }

    /**
     * Promotes a spec into a running session seeded with the spec content, then deletes the spec.
     */
    public Session startSpec(String name, String parentBranch) {
        Spec spec = requireSpec(name);
        CreateSessionRequest request = new CreateSessionRequest(spec.name(), spec.displayName(), parentBranch,
                spec.content(), false, false, null, null, null, null, spec.epicId());
        Session session = create(request, true, false, true);
        specStore.delete(spec.id());
        log.info("Started spec '{}' as session on {}", name, session.branch());
        return session;
    }

    /**
     * Retires a running or reviewed session and keeps its prompt as a spec of the same name.
     */
    public Spec convertSessionToSpec(String name) {
        Path repo = repositoryRoot();
        if (!reservations.reserve(repo, name)) {
            throw new InvalidSessionStateException(name, "running", "spec",
                    "Session '%s' is already being changed by another request".formatted(name));
        }
        try {
            Session session = requireSession(name);
            if (session.isSpec()) {
                throw new InvalidSessionStateException(name, "spec", "running",
                        "Session '%s' is already a spec".formatted(name));
            }
            String content = specContentOf(session);
            cancellation.cancel(session, false);
            purgeCancelled(session);

            Instant now = now();
            Spec spec = new Spec(UUID.randomUUID().toString(), name, session.displayName(), session.epicId(),
                    repo, repositoryName(repo), content, now, now);
            specStore.insert(spec);
            eventBus.publish(SwitchyardEvent.of(SwitchyardEvent.Type.SESSION_REMOVED, session.id(), name,
                    Map.of("reason", "converted_to_spec"), clock));
            log.info("Converted session '{}' to a spec", name);
            return spec;
        } finally {
            reservations.release(repo, name);
        }
    }

    // ===================================================================
    //  Cancellation
    // ===================================================================

    public CancellationResult cancelSession(String name, boolean skipBranchDeletion) {
        Session session = requireSession(name);
        MdcContext.setSession(session.id(), name);
        try {
            CancellationResult result = cancellation.cancel(session, skipBranchDeletion);
            statsCache.evict(session.id());
            eventBus.publish(SwitchyardEvent.of(SwitchyardEvent.Type.SESSION_REMOVED, session.id(), name,
                    Map.of("reason", "cancelled", "errors", result.errors().size()), clock));
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    // ===================================================================
    //  Helpers
    // ===================================================================

    Session requireSession(String name) {
        return findSession(name).orElseThrow(() -> new SessionNotFoundException(name));
    }

    private Spec requireSpec(String name) {
        return specStore.findByName(repositoryRoot(), name)
                .orElseThrow(() -> new SessionNotFoundException(name));
    }

    private void ensureNameAvailable(Path repo, String name, boolean promotingSpec) {
        Optional<Session> existing = sessionStore.findByName(repo, name);
        if (existing.isPresent()) {
            if (existing.get().status() != SessionStatus.CANCELLED) {
                throw new SessionAlreadyExistsException(name);
            }
            purgeCancelled(existing.get());
        }
        if (!promotingSpec && specStore.findByName(repo, name).isPresent()) {
            throw new SessionAlreadyExistsException(name);
        }
    }

    // cancelled rows keep their name until reused
    private void purgeCancelled(Session cancelled) {
        log.debug("Purging cancelled session row {} for name '{}'", cancelled.id(), cancelled.name());
        gitStatsStore.delete(cancelled.id());
        sessionStore.delete(cancelled.id());
    }

    private void materializeWorktree(Session session) {
        try {
            worktrees.createWorktreeFromBase(session.repositoryPath(), session.branch(),
                    session.worktreePath(), session.parentBranch());
            metrics.recordWorktreeOperation("add", true);
        } catch (SwitchyardException e) {
            metrics.recordWorktreeOperation("add", false);
            log.error("Creating worktree for session '{}' failed: {}", session.name(), e.getMessage());
            throw e;
        }
    }

    private void retireWorktree(Session session) {
        if (Files.exists(session.worktreePath())) {
            try {
                worktrees.removeWorktree(session.repositoryPath(), session.worktreePath());
                metrics.recordWorktreeOperation("remove", true);
            } catch (SwitchyardException e) {
                metrics.recordWorktreeOperation("remove", false);
                log.warn("Removing worktree {} failed: {}", session.worktreePath(), e.getMessage());
            }
        }
        try {
            if (branches.branchExists(session.repositoryPath(), session.branch())) {
                branches.deleteBranch(session.repositoryPath(), session.branch());
            }
        } catch (SwitchyardException e) {
            log.warn("Deleting branch {} failed: {}", session.branch(), e.getMessage());
        }
    }

    private void refreshStatsQuietly(Session session) {
        try {
            statsCache.refresh(session);
        } catch (SwitchyardException e) {
            log.warn("Failed to refresh git stats for '{}': {}", session.name(), e.getMessage());
        }
    }

    private void recordTransition(Session session, SessionState from, SessionState to) {
        metrics.recordStateTransition(to.dbValue());
        eventBus.publish(SwitchyardEvent.of(SwitchyardEvent.Type.STATE_CHANGED, session.id(), session.name(),
                Map.of("from", from.dbValue(), "to", to.dbValue()), clock));
        log.info("Session '{}' {} -> {}", session.name(), from.dbValue(), to.dbValue());
    }

    private String resolveParentBranch(String requested) {
        String parent = requested == null || requested.isBlank()
                ? properties.getDefaultParentBranch()
                : requested.trim();
        GitNames.validateBranchName(parent);
        return parent;
    }

    private static void requireValidName(String name) {
        if (!GitNames.isValidSessionName(name)) {
            throw new InvalidInputException("name", "use only letters, numbers, hyphens, and underscores");
        }
    }

    private static String specContentOf(Session session) {
        if (session.specContent() != null && !session.specContent().isBlank()) {
            return session.specContent();
        }
        return session.initialPrompt() == null ? "" : session.initialPrompt();
    }

    String branchFor(String name) {
        return properties.getBranchPrefix() + "/" + name;
    }

    Path worktreeFor(String name) {
        return repositoryRoot().resolve(properties.getWorktreeDir()).resolve(name);
    }

    private Path repositoryRoot() {
        return properties.getRepositoryRoot();
    }

    private static String repositoryName(Path repo) {
        Path fileName = repo.getFileName();
        return fileName == null ? repo.toString() : fileName.toString();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
