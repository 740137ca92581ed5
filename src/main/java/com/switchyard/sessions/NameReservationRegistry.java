package com.switchyard.sessions;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Names currently being created, per repository. A name is held from the moment a create
 * request passes validation until its row is persisted or the attempt is abandoned.
 */
@Component
public class NameReservationRegistry {

    private final Object lock = new Object();
    private final Map<Path, Set<String>> reserved = new HashMap<>();

    /**
     * @return {@code false} if another request already holds the name
     */
    public boolean reserve(Path repositoryPath, String name) {
        synchronized (lock) {
            return reserved.computeIfAbsent(key(repositoryPath), k -> new HashSet<>()).add(name);
        }
    }

    public void release(Path repositoryPath, String name) {
        synchronized (lock) {
            Path key = key(repositoryPath);
            Set<String> names = reserved.get(key);
            if (names == null) {
                return;
            }
            names.remove(name);
            if (names.isEmpty()) {
                reserved.remove(key);
            }
        }
    }

    private static Path key(Path repositoryPath) {
        return repositoryPath.toAbsolutePath().normalize();
    }
}
