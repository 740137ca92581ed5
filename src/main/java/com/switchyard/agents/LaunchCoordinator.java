package com.switchyard.agents;

import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.InvalidInputException;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.errors.TerminalOperationException;
import com.switchyard.core.logging.MdcContext;
import com.switchyard.core.metrics.SwitchyardMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Starts agents inside terminals.
 * <p>
 * Launches for the same terminal id run one at a time. The pipeline (parse, resolve the agent,
 * close the old terminal, create the new one) is bounded by the launch timeout; a launch that
 * overruns is abandoned and its terminal closed so the next attempt starts clean. A create call
 * already in progress when the timeout fires may still finish in the background.
 */
@Service
public class LaunchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LaunchCoordinator.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final AgentCommandParser parser;
    private final AgentManifest manifest;
    private final TerminalBackend terminals;
    private final LaunchLockRegistry launchLocks;
    private final SwitchyardProperties properties;
    private final SwitchyardMetrics metrics;
    private final ExecutorService executor;

    public LaunchCoordinator(AgentCommandParser parser, AgentManifest manifest, TerminalBackend terminals,
                             LaunchLockRegistry launchLocks, SwitchyardProperties properties,
                             SwitchyardMetrics metrics) {
        this.parser = parser;
        this.manifest = manifest;
        this.terminals = terminals;
        this.launchLocks = launchLocks;
        this.properties = properties;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "launch-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Launches the agent described by {@code spec} in terminal {@code terminalId}, replacing any
     * terminal already using that id.
     *
     * @param cols terminal width, or null for the backend default
     * @param rows terminal height, or null for the backend default
     * @return the command line that was launched
     */
    public String launchInTerminal(String terminalId, AgentLaunchSpec spec, Integer cols, Integer rows) {
        ReentrantLock lock = launchLocks.lockFor(terminalId);
        lock.lock();
        MdcContext.setTerminal(terminalId);
        long started = System.nanoTime();
        AtomicBoolean abandoned = new AtomicBoolean(false);
        try {
            Future<String> future = executor.submit(() -> launch(terminalId, spec, cols, rows, abandoned));
            long timeoutSeconds = properties.getLaunchTimeout().toSeconds();
            try {
                String command = future.get(timeoutSeconds, TimeUnit.SECONDS);
                metrics.recordLaunch("success", elapsedMillis(started));
                log.info("Launched agent in terminal {}", terminalId);
                return command;
            } catch (TimeoutException e) {
                abandoned.set(true);
                future.cancel(true);
                closeQuietly(terminalId);
                metrics.recordLaunch("timeout", elapsedMillis(started));
                log.error("Launch in terminal {} exceeded {}s", terminalId, timeoutSeconds);
                throw new TerminalOperationException(
                        "Agent launch exceeded %d seconds and was cancelled. Please retry.".formatted(timeoutSeconds), e);
            } catch (ExecutionException e) {
                metrics.recordLaunch("failure", elapsedMillis(started));
                Throwable cause = e.getCause();
                if (cause instanceof SwitchyardException switchyardException) {
                    throw switchyardException;
                }
                throw new TerminalOperationException(String.valueOf(cause.getMessage()), cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandoned.set(true);
                future.cancel(true);
                metrics.recordLaunch("failure", elapsedMillis(started));
                throw new TerminalOperationException("interrupted while launching in " + terminalId, e);
            }
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    private String launch(String terminalId, AgentLaunchSpec spec, Integer cols, Integer rows,
                          AtomicBoolean abandoned) {
        String commandLine = spec.formatForShell();
        ParsedAgentCommand parsed = parser.parse(commandLine);
        Path cwd = Path.of(parsed.cwd());
        ensureCwdAccess(cwd);

        String binary = manifest.binaryFor(parsed.agentId());
        if (!parsed.agent().equals(parsed.agentId())) {
            // An explicit path in the command wins over the manifest default
            binary = parsed.agent();
        }
        Map<String, String> env = mergeEnv(manifest.envFor(parsed.agentId()), spec.envVars());
        List<String> args = new ArrayList<>(parsed.args());
        args.addAll(manifest.extraArgsFor(parsed.agentId()));

        if (terminals.terminalExists(terminalId)) {
            log.debug("Closing existing terminal {} before relaunch", terminalId);
            terminals.closeTerminal(terminalId);
        }
        if (abandoned.get()) {
            log.warn("Launch in terminal {} was abandoned before the terminal was created", terminalId);
            return commandLine;
        }
        if (cols != null && rows != null) {
            terminals.createTerminalWithAppAndSize(terminalId, cwd, binary, args, env, cols, rows);
        } else {
            terminals.createTerminalWithApp(terminalId, cwd, binary, args, env);
        }
        return commandLine;
    }

    static void ensureCwdAccess(Path cwd) {
        if (!Files.exists(cwd)) {
            throw new InvalidInputException("cwd", "Working directory not found: " + cwd);
        }
        if (!Files.isDirectory(cwd) || !Files.isReadable(cwd) || !Files.isExecutable(cwd)) {
            throw new InvalidInputException("cwd", "Permission required for folder: " + cwd);
        }
    }

    /**
     * Manifest environment overlaid with launch-specific entries.
     */
    static Map<String, String> mergeEnv(Map<String, String> base, Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(base);
        merged.putAll(overrides);
        return merged;
    }

    private void closeQuietly(String terminalId) {
        try {
            terminals.closeTerminal(terminalId);
        } catch (RuntimeException e) {
            log.warn("Failed to close terminal {} after launch timeout: {}", terminalId, e.getMessage());
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
