package com.switchyard.agents;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link TerminalBackend} that records calls and can block creation.
 */
class RecordingTerminalBackend implements TerminalBackend {

    record Created(String terminalId, Path cwd, String command, List<String> args, Map<String, String> env,
                   Integer cols, Integer rows) {
    }

    final List<Created> created = Collections.synchronizedList(new ArrayList<>());
    final List<String> closed = Collections.synchronizedList(new ArrayList<>());
    final Map<String, Boolean> live = Collections.synchronizedMap(new LinkedHashMap<>());
    final AtomicInteger concurrentCreates = new AtomicInteger();
    final AtomicInteger maxConcurrentCreates = new AtomicInteger();

    volatile CountDownLatch createGate;
    volatile RuntimeException closeFailure;

    @Override
    public boolean terminalExists(String terminalId) {
        return live.containsKey(terminalId);
    }

    @Override
    public void closeTerminal(String terminalId) {
        if (closeFailure != null) {
            throw closeFailure;
        }
        closed.add(terminalId);
        live.remove(terminalId);
    }

    @Override
    public void createTerminalWithApp(String terminalId, Path cwd, String command, List<String> args,
                                      Map<String, String> env) {
        record(new Created(terminalId, cwd, command, args, env, null, null));
    }

    @Override
    public void createTerminalWithAppAndSize(String terminalId, Path cwd, String command, List<String> args,
                                             Map<String, String> env, int cols, int rows) {
        record(new Created(terminalId, cwd, command, args, env, cols, rows));
    }

    @Override
    public boolean detachTerminal(String terminalId) {
        return live.remove(terminalId) != null;
    }

    @Override
    public List<String> listTerminals() {
        synchronized (live) {
            return List.copyOf(live.keySet());
        }
    }

    private void record(Created call) {
        int now = concurrentCreates.incrementAndGet();
        maxConcurrentCreates.accumulateAndGet(now, Math::max);
        try {
            CountDownLatch gate = createGate;
            if (gate != null) {
                gate.await();
            }
            created.add(call);
            live.put(call.terminalId(), true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            concurrentCreates.decrementAndGet();
        }
    }
}
