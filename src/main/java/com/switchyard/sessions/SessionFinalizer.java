package com.switchyard.sessions;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.GitStats;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionState;
import com.switchyard.core.persistence.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Final steps after a session is created or changes state. Only persisting the row can fail
 * the operation; stats and activity stamping are best effort.
 */
@Component
public class SessionFinalizer {

    private static final Logger log = LoggerFactory.getLogger(SessionFinalizer.class);

    private final SessionStore sessionStore;
    private final GitStatsCache statsCache;
    private final Clock clock;

    public SessionFinalizer(SessionStore sessionStore, GitStatsCache statsCache, Clock clock) {
        this.sessionStore = sessionStore;
        this.statsCache = statsCache;
        this.clock = clock;
    }

    /**
     * @param session       the row to insert
     * @param computeStats  prime the stats cache; skipped for specs and missing worktrees
     * @param updateActivity stamp {@code last_activity} with the current time
     * @return the session as persisted, plus stats when they were computed
     */
    public FinalizationResult finalizeCreation(Session session, boolean computeStats, boolean updateActivity) {
        sessionStore.insert(session);

        GitStats stats = null;
        if (computeStats) {
            stats = primeStats(session);
        }

        Session result = session;
        if (updateActivity) {
            Instant now = now();
            if (stampActivity(session, now)) {
                result = session.toBuilder().lastActivity(now).build();
            }
        }
        return new FinalizationResult(result, stats);
    }

    public void finalizeStateTransition(Session session, SessionState newState) {
        Instant now = now();
        sessionStore.updateSessionState(session.id(), newState, now);
        stampActivity(session, now);
    }

    private GitStats primeStats(Session session) {
        if (session.isSpec()) {
            log.debug("Not computing git stats for spec session '{}'", session.name());
            return null;
        }
        if (session.worktreePath() == null || !Files.exists(session.worktreePath())) {
            log.warn("Not computing git stats for session '{}': worktree {} does not exist",
                    session.name(), session.worktreePath());
            return null;
        }
        try {
            return statsCache.refresh(session).orElse(null);
        } catch (SwitchyardException e) {
            log.warn("Failed to compute git stats for session '{}': {}", session.name(), e.getMessage());
            return null;
        }
    }

    private boolean stampActivity(Session session, Instant now) {
        try {
            sessionStore.updateLastActivity(session.id(), now);
            return true;
        } catch (SwitchyardException e) {
            log.warn("Failed to update last activity for session '{}': {}", session.name(), e.getMessage());
            return false;
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public record FinalizationResult(Session session, GitStats gitStats) {
    }
}
