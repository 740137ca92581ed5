package com.switchyard.core.persistence;

import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionState;
import com.switchyard.core.model.SessionStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for {@link Session} rows. Names are unique per repository.
 */
public interface SessionStore {

    /**
     * @throws com.switchyard.core.errors.SessionAlreadyExistsException if the name is taken
     */
    void insert(Session session);

    void update(Session session);

    Optional<Session> findByName(Path repositoryPath, String name);

    Optional<Session> findById(String id);

    List<Session> list(Path repositoryPath, boolean includeCancelled);

    void updateSessionState(String id, SessionState state, Instant updatedAt);

    void updateStatus(String id, SessionStatus status, Instant updatedAt);

    void updateLastActivity(String id, Instant lastActivity);

    void updateParentBranch(String id, String parentBranch, Instant updatedAt);

    void setEpic(String id, String epicId, Instant updatedAt);

    /**
     * @return number of sessions whose epic reference was cleared
     */
    int clearEpic(String epicId, Instant updatedAt);

    void delete(String id);
}
