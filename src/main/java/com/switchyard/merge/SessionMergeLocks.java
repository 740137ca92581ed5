package com.switchyard.merge;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * At most one merge or update per session at a time. Acquisition never waits.
 * <p>
 * A {@link Lease} may be closed from any thread, and closing it twice is harmless, so a merge
 * that outlives its caller's deadline keeps the session locked until it actually finishes.
 */
@Component
public class SessionMergeLocks {

    private final ConcurrentHashMap<String, Semaphore> locks = new ConcurrentHashMap<>();

    public Optional<Lease> tryAcquire(String sessionId) {
        Semaphore semaphore = locks.computeIfAbsent(sessionId, id -> new Semaphore(1));
        if (!semaphore.tryAcquire()) {
            return Optional.empty();
        }
        return Optional.of(new Lease(semaphore));
    }

    public static final class Lease implements AutoCloseable {

        private final Semaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }
    }
}
