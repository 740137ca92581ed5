package com.switchyard.core.events;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Fire-and-forget notification about a session lifecycle change.
 *
 * @param type        what happened
 * @param sessionId   the session this event belongs to
 * @param sessionName the session's name, for subscribers that key by name
 * @param payload     event-specific data
 * @param timestamp   when the event occurred, from the engine clock
 */
public record SwitchyardEvent(
    Type type,
    String sessionId,
    String sessionName,
    Map<String, Object> payload,
    Instant timestamp
) {

    public enum Type {
        SESSION_ADDED("session.added"),
        SESSION_REMOVED("session.removed"),
        STATE_CHANGED("session.state_changed"),
        GIT_STATS_UPDATED("git_stats.updated"),
        MERGE_COMPLETED("merge.completed"),
        UPDATED_FROM_PARENT("merge.updated_from_parent");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public static SwitchyardEvent of(Type type, String sessionId, String sessionName,
                                     Map<String, Object> payload, Clock clock) {
        return new SwitchyardEvent(type, sessionId, sessionName, Map.copyOf(payload), clock.instant());
    }
}
