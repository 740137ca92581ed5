package com.switchyard.sessions;

import com.switchyard.agents.TerminalBackend;
import com.switchyard.core.errors.InvalidSessionStateException;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.CancellationResult;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionStatus;
import com.switchyard.core.persistence.SessionStore;
import com.switchyard.git.BranchOperations;
import com.switchyard.git.WorktreeOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Tears down a running session: its terminals, its worktree and (optionally) its branch.
 * <p>
 * Each teardown step is attempted even if an earlier one failed; failures are collected into
 * the {@link CancellationResult}. The row is marked cancelled in all cases.
 */
@Component
public class CancellationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CancellationCoordinator.class);

    private final TerminalBackend terminals;
    private final WorktreeOperations worktrees;
    private final BranchOperations branches;
    private final SessionStore sessionStore;
    private final Clock clock;

    public CancellationCoordinator(TerminalBackend terminals, WorktreeOperations worktrees,
                                   BranchOperations branches, SessionStore sessionStore, Clock clock) {
        this.terminals = terminals;
        this.worktrees = worktrees;
        this.branches = branches;
        this.sessionStore = sessionStore;
        this.clock = clock;
    }

    /**
     * Terminal ids owned by a session start with this prefix.
     */
    public static String terminalPrefix(String sessionName) {
        return "session-" + sessionName + "-";
    }

    public CancellationResult cancel(Session session, boolean skipBranchDeletion) {
        if (session.isSpec()) {
            throw new InvalidSessionStateException(session.name(), "spec", "running",
                    "Cannot cancel spec session '%s'. Use archive or delete spec operations instead."
                            .formatted(session.name()));
        }
        log.info("Cancelling session '{}'", session.name());

        warnIfDirty(session);

        List<String> errors = new ArrayList<>();
        List<String> closed = closeTerminals(session, errors);

        boolean worktreeRemoved = false;
        try {
            worktrees.removeWorktree(session.repositoryPath(), session.worktreePath());
            worktreeRemoved = true;
        } catch (SwitchyardException e) {
            errors.add("Worktree removal failed: " + e.getMessage());
        }

        boolean branchDeleted = false;
        if (skipBranchDeletion) {
            log.info("Keeping branch '{}' of cancelled session '{}'", session.branch(), session.name());
        } else {
            try {
                if (branches.branchExists(session.repositoryPath(), session.branch())) {
                    branches.deleteBranch(session.repositoryPath(), session.branch());
                    branchDeleted = true;
                } else {
                    log.debug("Branch '{}' already gone", session.branch());
                }
            } catch (SwitchyardException e) {
                errors.add("Branch deletion failed: " + e.getMessage());
            }
        }

        sessionStore.updateStatus(session.id(), SessionStatus.CANCELLED,
                clock.instant().truncatedTo(ChronoUnit.MILLIS));

        if (errors.isEmpty()) {
            log.info("Cancelled session '{}'", session.name());
        } else {
            log.warn("Cancelled session '{}' with {} error(s): {}", session.name(), errors.size(), errors);
        }
        return new CancellationResult(closed, worktreeRemoved, branchDeleted, errors);
    }

    private void warnIfDirty(Session session) {
        try {
            List<String> dirty = worktrees.uncommittedSamplePaths(session.worktreePath(), 3);
            if (!dirty.isEmpty()) {
                log.warn("Session '{}' has uncommitted changes that will be lost: {}", session.name(), dirty);
            }
        } catch (SwitchyardException e) {
            log.warn("Could not inspect worktree of session '{}': {}", session.name(), e.getMessage());
        }
    }

    private List<String> closeTerminals(Session session, List<String> errors) {
        String prefix = terminalPrefix(session.name());
        List<String> closed = new ArrayList<>();
        for (String terminalId : terminals.listTerminals()) {
            if (!terminalId.startsWith(prefix)) {
                continue;
            }
            try {
                terminals.closeTerminal(terminalId);
                closed.add(terminalId);
            } catch (SwitchyardException e) {
                errors.add("Terminal close failed for %s: %s".formatted(terminalId, e.getMessage()));
            }
        }
        return closed;
    }
}
