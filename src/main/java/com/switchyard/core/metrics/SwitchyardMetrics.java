package com.switchyard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session lifecycle, merges and agent launches.
 */
@Service
public class SwitchyardMetrics {

    private final MeterRegistry registry;

    public SwitchyardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSessionCreated(String state) {
        Counter.builder("switchyard.sessions.created")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordStateTransition(String toState) {
        Counter.builder("switchyard.sessions.transitions")
                .tag("to", toState)
                .register(registry)
                .increment();
    }

    public void recordMergeResult(String mode, boolean success) {
        Counter.builder("switchyard.merge.results")
                .description("Merge attempts by mode and outcome")
                .tag("mode", mode)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * @param result "success", "failure" or "timeout"
     */
    public void recordLaunch(String result, long ms) {
        Counter.builder("switchyard.launch.results")
                .tag("result", result)
                .register(registry)
                .increment();
        Timer.builder("switchyard.launch.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param result "hit", "miss" or "fallback" (stale value served after a failed recompute)
     */
    public void recordGitStatsLookup(String result) {
        Counter.builder("switchyard.git_stats.lookups")
                .description("Git stats cache lookups")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("switchyard.worktree.operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
