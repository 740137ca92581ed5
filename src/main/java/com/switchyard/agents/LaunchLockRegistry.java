package com.switchyard.agents;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per terminal id, created on first use and kept for the life of the process.
 * The map is guarded only for lookup and insert; callers hold the returned lock for the launch.
 */
@Component
public class LaunchLockRegistry {

    private final Object mapLock = new Object();
    private final Map<String, ReentrantLock> locks = new HashMap<>();

    public ReentrantLock lockFor(String terminalId) {
        synchronized (mapLock) {
            return locks.computeIfAbsent(terminalId, id -> new ReentrantLock(true));
        }
    }
}
