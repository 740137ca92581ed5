package com.switchyard.agents;

import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.TerminalOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs each terminal's agent as a child process of this JVM attached to its console.
 */
@Component
public class LocalProcessTerminalBackend implements TerminalBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessTerminalBackend.class);

    private final ProcessInspector inspector;
    private final SwitchyardProperties properties;
    private final Map<String, Process> processes = new ConcurrentHashMap<>();

    public LocalProcessTerminalBackend(ProcessInspector inspector, SwitchyardProperties properties) {
        this.inspector = inspector;
        this.properties = properties;
    }

    @Override
    public boolean terminalExists(String terminalId) {
        Process process = processes.get(terminalId);
        return process != null && inspector.isRunning(process.pid());
    }

    @Override
    public void createTerminalWithApp(String terminalId, Path cwd, String command, List<String> args,
                                      Map<String, String> env) {
        start(terminalId, cwd, command, args, env);
    }

    @Override
    public void createTerminalWithAppAndSize(String terminalId, Path cwd, String command, List<String> args,
                                             Map<String, String> env, int cols, int rows) {
        Map<String, String> sized = new HashMap<>(env);
        sized.put("COLUMNS", String.valueOf(cols));
        sized.put("LINES", String.valueOf(rows));
        start(terminalId, cwd, command, args, sized);
    }

    private void start(String terminalId, Path cwd, String command, List<String> args, Map<String, String> env) {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        commandLine.addAll(args);

        ProcessBuilder pb = new ProcessBuilder(commandLine);
        pb.directory(cwd.toFile());
        pb.environment().putAll(env);
        pb.inheritIO();

        try {
            Process process = pb.start();
            Process previous = processes.put(terminalId, process);
            if (previous != null && previous.isAlive()) {
                log.warn("Terminal {} replaced a process that was still running (pid {})", terminalId, previous.pid());
            }
            log.info("Started '{}' in terminal {} (pid {})", command, terminalId, process.pid());
        } catch (IOException e) {
            throw new TerminalOperationException(
                    "Failed to start '%s' in terminal %s: %s".formatted(command, terminalId, e.getMessage()), e);
        }
    }

    /**
     * Sends terminate, then kill if the process outlives the grace period. Unknown ids are ignored.
     */
    @Override
    public void closeTerminal(String terminalId) {
        Process process = processes.remove(terminalId);
        if (process == null) {
            return;
        }
        long pid = process.pid();
        if (!inspector.isRunning(pid)) {
            return;
        }
        inspector.sendTerminate(pid);
        try {
            if (!process.waitFor(properties.getTerminateGrace().toMillis(), TimeUnit.MILLISECONDS)
                    && inspector.isRunning(pid)) {
                log.warn("Terminal {} (pid {}) ignored terminate, killing", terminalId, pid);
                inspector.sendKill(pid);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            inspector.sendKill(pid);
            throw new TerminalOperationException("interrupted while closing terminal " + terminalId, e);
        }
        log.debug("Closed terminal {}", terminalId);
    }

    @Override
    public List<String> listTerminals() {
        return List.copyOf(processes.keySet());
    }

    @Override
    public boolean detachTerminal(String terminalId) {
        Process process = processes.remove(terminalId);
        if (process == null) {
            return false;
        }
        log.info("Detached terminal {} (pid {}), it keeps running after exit", terminalId, process.pid());
        return true;
    }

    /**
     * Blocks until the terminal's process exits and returns its exit code, or -1 if no process is tracked.
     */
    public int waitFor(String terminalId) {
        Process process = processes.get(terminalId);
        if (process == null) {
            return -1;
        }
        try {
            int exit = process.waitFor();
            processes.remove(terminalId, process);
            return exit;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TerminalOperationException("interrupted while waiting for terminal " + terminalId, e);
        }
    }
}
