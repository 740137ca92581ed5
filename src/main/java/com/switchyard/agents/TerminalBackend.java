package com.switchyard.agents;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Hosts the processes agents run in, keyed by terminal id.
 * <p>
 * {@link #closeTerminal(String)} must be idempotent: closing an unknown id is a no-op.
 */
public interface TerminalBackend {

    boolean terminalExists(String terminalId);

    void closeTerminal(String terminalId);

    void createTerminalWithApp(String terminalId, Path cwd, String command, List<String> args,
                               Map<String, String> env);

    void createTerminalWithAppAndSize(String terminalId, Path cwd, String command, List<String> args,
                                      Map<String, String> env, int cols, int rows);

    List<String> listTerminals();

    /**
     * Stops tracking a terminal without closing it, so shutdown leaves its process running.
     *
     * @return {@code false} if the id is unknown
     */
    boolean detachTerminal(String terminalId);
}
