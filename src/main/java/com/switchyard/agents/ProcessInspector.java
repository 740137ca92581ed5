package com.switchyard.agents;

import java.util.Optional;

/**
 * The process operations terminal teardown needs, so tests can substitute a fake.
 */
public interface ProcessInspector {

    boolean isRunning(long pid);

    /** Asks the process to exit. Returns false if it was already gone. */
    boolean sendTerminate(long pid);

    /** Forcibly ends the process. Returns false if it was already gone. */
    boolean sendKill(long pid);

    Optional<String> readCmdline(long pid);
}
