package com.switchyard.sessions;

import com.switchyard.core.errors.InvalidSessionStateException;
import com.switchyard.core.model.SessionState;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Allowed {@link SessionState} transitions:
 * <pre>
 *   SPEC -> RUNNING
 *   RUNNING -> REVIEWED
 *   REVIEWED -> RUNNING
 *   RUNNING | REVIEWED -> SPEC
 * </pre>
 * A transition to the current state is always allowed and changes nothing.
 */
public final class SessionStateMachine {

    private static final Map<SessionState, Set<SessionState>> ALLOWED = new EnumMap<>(SessionState.class);

    static {
        ALLOWED.put(SessionState.SPEC, EnumSet.of(SessionState.RUNNING));
        ALLOWED.put(SessionState.RUNNING, EnumSet.of(SessionState.REVIEWED, SessionState.SPEC));
        ALLOWED.put(SessionState.REVIEWED, EnumSet.of(SessionState.RUNNING, SessionState.SPEC));
    }

    private SessionStateMachine() {}

    public static boolean canTransition(SessionState from, SessionState to) {
        return from == to || ALLOWED.get(from).contains(to);
    }

    /**
     * @throws InvalidSessionStateException naming the states {@code to} may be entered from
     */
    public static void validateTransition(String sessionName, SessionState from, SessionState to) {
        if (canTransition(from, to)) {
            return;
        }
        String expected = ALLOWED.entrySet().stream()
                .filter(e -> e.getValue().contains(to))
                .map(e -> e.getKey().dbValue())
                .collect(Collectors.joining("|"));
        throw new InvalidSessionStateException(sessionName, from.dbValue(), expected);
    }
}
