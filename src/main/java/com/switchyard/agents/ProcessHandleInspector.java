package com.switchyard.agents;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * {@link ProcessInspector} over {@link ProcessHandle}.
 */
@Component
public class ProcessHandleInspector implements ProcessInspector {

    @Override
    public boolean isRunning(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean sendTerminate(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::destroy).orElse(false);
    }

    @Override
    public boolean sendKill(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::destroyForcibly).orElse(false);
    }

    @Override
    public Optional<String> readCmdline(long pid) {
        return ProcessHandle.of(pid).flatMap(handle -> handle.info().commandLine());
    }
}
