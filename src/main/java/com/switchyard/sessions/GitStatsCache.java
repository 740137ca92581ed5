package com.switchyard.sessions;

import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.events.EventBus;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.metrics.SwitchyardMetrics;
import com.switchyard.core.model.GitStats;
import com.switchyard.core.model.Session;
import com.switchyard.core.persistence.GitStatsStore;
import com.switchyard.git.GitStatsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;

/**
 * Time-bounded cache of per-session diff statistics, backed by the {@code git_stats} table.
 * <p>
 * A persisted entry younger than the configured max age is served verbatim. Older or missing
 * entries are recomputed from the worktree and persisted; if recomputation fails and a stale
 * entry exists, the stale entry is served instead of an error.
 */
@Service
public class GitStatsCache {

    private static final Logger log = LoggerFactory.getLogger(GitStatsCache.class);

    private final GitStatsStore store;
    private final GitStatsCalculator calculator;
    private final Clock clock;
    private final SwitchyardProperties properties;
    private final SwitchyardMetrics metrics;
    private final EventBus eventBus;

    public GitStatsCache(GitStatsStore store, GitStatsCalculator calculator, Clock clock,
                         SwitchyardProperties properties, SwitchyardMetrics metrics, EventBus eventBus) {
        this.store = store;
        this.calculator = calculator;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    /**
     * Returns the cached stats if fresh, otherwise recomputes them.
     *
     * @return empty for spec sessions and sessions whose worktree is not on disk
     */
    public Optional<GitStats> getOrCompute(Session session) {
        if (!hasWorktree(session)) {
            return Optional.empty();
        }
        Instant now = now();
        Optional<GitStats> cached = store.find(session.id());
        if (cached.isPresent() && cached.get().isFresh(now, properties.getStatsMaxAge())) {
            metrics.recordGitStatsLookup("hit");
            return cached;
        }
        return recompute(session, now, cached);
    }

    /**
     * Recomputes regardless of freshness. Used after operations known to change the diff.
     */
    public Optional<GitStats> refresh(Session session) {
        if (!hasWorktree(session)) {
            return Optional.empty();
        }
        return recompute(session, now(), store.find(session.id()));
    }

    public void evict(String sessionId) {
        store.delete(sessionId);
    }

    private Optional<GitStats> recompute(Session session, Instant now, Optional<GitStats> cached) {
        GitStats fresh;
        try {
            fresh = calculator.calculate(session.id(), session.worktreePath(), session.parentBranch(), now);
        } catch (SwitchyardException e) {
            if (cached.isEmpty()) {
                throw e;
            }
            log.warn("Recomputing git stats for session '{}' failed, serving value from {}: {}",
                    session.name(), cached.get().calculatedAt(), e.getMessage());
            metrics.recordGitStatsLookup("fallback");
            return cached;
        }

        store.save(fresh);
        metrics.recordGitStatsLookup("miss");
        eventBus.publish(SwitchyardEvent.of(SwitchyardEvent.Type.GIT_STATS_UPDATED, session.id(), session.name(),
                Map.of("filesChanged", fresh.filesChanged(),
                        "linesAdded", fresh.linesAdded(),
                        "linesRemoved", fresh.linesRemoved(),
                        "hasUncommitted", fresh.hasUncommitted()), clock));
        return Optional.of(fresh);
    }

    private boolean hasWorktree(Session session) {
        if (session.isSpec()) {
            log.debug("Skipping git stats for spec session '{}'", session.name());
            return false;
        }
        if (session.worktreePath() == null || !Files.isDirectory(session.worktreePath())) {
            log.debug("Skipping git stats for session '{}': worktree {} not on disk",
                    session.name(), session.worktreePath());
            return false;
        }
        return true;
    }

    // persisted with millisecond precision; truncate so a cached read equals the computed value
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
