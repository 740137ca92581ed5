package com.switchyard.agents;

import com.switchyard.core.model.ShutdownReport;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes every terminal on the way out. The entry point calls {@link #shutdown()} on normal exit;
 * a JVM shutdown hook covers signals. Only the first call does any work.
 */
@Component
public class ShutdownCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final TerminalBackend terminals;
    private final AtomicBoolean done = new AtomicBoolean(false);

    public ShutdownCoordinator(TerminalBackend terminals) {
        this.terminals = terminals;
    }

    @PostConstruct
    void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            ShutdownReport report = shutdown();
            if (!report.clean()) {
                log.warn("Shutdown hook finished with {} failure(s)", report.failures().size());
            }
        }, "switchyard-shutdown"));
    }

    public ShutdownReport shutdown() {
        if (!done.compareAndSet(false, true)) {
            return new ShutdownReport(List.of(), List.of());
        }
        List<String> closed = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (String terminalId : terminals.listTerminals()) {
            try {
                terminals.closeTerminal(terminalId);
                closed.add(terminalId);
            } catch (RuntimeException e) {
                log.warn("Failed to close terminal {} during shutdown: {}", terminalId, e.getMessage());
                failures.add(terminalId + ": " + e.getMessage());
            }
        }
        if (!closed.isEmpty()) {
            log.info("Closed {} terminal(s) on shutdown", closed.size());
        }
        return new ShutdownReport(List.copyOf(closed), List.copyOf(failures));
    }
}
