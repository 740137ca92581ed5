package com.switchyard.sessions;

import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.InvalidInputException;
import com.switchyard.core.errors.SessionNotFoundException;
import com.switchyard.core.model.Epic;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionStatus;
import com.switchyard.core.model.Spec;
import com.switchyard.core.persistence.EpicStore;
import com.switchyard.core.persistence.SessionStore;
import com.switchyard.core.persistence.SpecStore;
import com.switchyard.git.GitNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Epics group sessions and specs. Deleting an epic detaches its members instead of deleting them.
 */
@Service
public class EpicService {

    private static final Logger log = LoggerFactory.getLogger(EpicService.class);

    private final EpicStore epicStore;
    private final SessionStore sessionStore;
    private final SpecStore specStore;
    private final SwitchyardProperties properties;
    private final Clock clock;

    public EpicService(EpicStore epicStore, SessionStore sessionStore, SpecStore specStore,
                       SwitchyardProperties properties, Clock clock) {
        this.epicStore = epicStore;
        this.sessionStore = sessionStore;
        this.specStore = specStore;
        this.properties = properties;
        this.clock = clock;
    }

    public Epic createEpic(String name, String color) {
        String trimmed = validateName(name);
        Path repo = properties.getRepositoryRoot();
        if (epicStore.findByName(repo, trimmed).isPresent()) {
            throw new InvalidInputException("name", "Epic '%s' already exists".formatted(trimmed));
        }
        Instant now = now();
        Epic epic = new Epic(UUID.randomUUID().toString(), repo, trimmed, normalizeColor(color), now, now);
        epicStore.insert(epic);
        log.info("Created epic '{}'", trimmed);
        return epic;
    }

    public List<Epic> listEpics() {
        return epicStore.list(properties.getRepositoryRoot());
    }

    public Epic updateEpic(String id, String name, String color) {
        Epic existing = requireEpic(id);
        String trimmed = validateName(name);
        Optional<Epic> clash = epicStore.findByName(existing.repositoryPath(), trimmed);
        if (clash.isPresent() && !clash.get().id().equals(id)) {
            throw new InvalidInputException("name", "Epic '%s' already exists".formatted(trimmed));
        }
        Epic updated = new Epic(id, existing.repositoryPath(), trimmed, normalizeColor(color),
                existing.createdAt(), now());
        epicStore.update(updated);
        return updated;
    }

    public void deleteEpic(String id) {
        Epic epic = requireEpic(id);
        Instant now = now();
        int sessions = sessionStore.clearEpic(id, now);
        int specs = specStore.clearEpic(id, now);
        epicStore.delete(id);
        log.info("Deleted epic '{}', detached {} session(s) and {} spec(s)", epic.name(), sessions, specs);
    }

    /**
     * Assigns a session or spec, looked up by name, to an epic. A null {@code epicId} clears it.
     */
    public void setItemEpic(String name, String epicId) {
        if (epicId != null) {
            requireEpic(epicId);
        }
        Path repo = properties.getRepositoryRoot();
        Instant now = now();
        Optional<Session> session = sessionStore.findByName(repo, name)
                .filter(s -> s.status() != SessionStatus.CANCELLED);
        if (session.isPresent()) {
            sessionStore.setEpic(session.get().id(), epicId, now);
            return;
        }
        Optional<Spec> spec = specStore.findByName(repo, name);
        if (spec.isPresent()) {
            specStore.setEpic(spec.get().id(), epicId, now);
            return;
        }
        throw new SessionNotFoundException(name);
    }

    private Epic requireEpic(String id) {
        return epicStore.findById(id)
                .orElseThrow(() -> new InvalidInputException("epic_id", "Epic '%s' not found".formatted(id)));
    }

    private static String validateName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidInputException("name", "Epic name is required");
        }
        if (!GitNames.isValidSessionName(trimmed)) {
            throw new InvalidInputException("name", "use only letters, numbers, hyphens, and underscores");
        }
        return trimmed;
    }

    private static String normalizeColor(String color) {
        return color == null || color.isBlank() ? null : color.trim();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
