package uk.gegc.linguapractice.features.session.domain.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum SessionStatus {
    PLANNED,
    ACTIVE,
    PAUSED,
    COMPLETED,
    ABANDONED;

    private static final Map<SessionStatus, Set<SessionStatus>> TRANSITIONS = new EnumMap<>(SessionStatus.class);

    static {
        TRANSITIONS.put(PLANNED, EnumSet.of(ACTIVE, ABANDONED));
        TRANSITIONS.put(ACTIVE, EnumSet.of(PAUSED, COMPLETED, ABANDONED));
        TRANSITIONS.put(PAUSED, EnumSet.of(ACTIVE, COMPLETED, ABANDONED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(SessionStatus.class));
        TRANSITIONS.put(ABANDONED, EnumSet.noneOf(SessionStatus.class));
    }

    public boolean canTransitionTo(SessionStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Statuses in which a session still accepts lifecycle calls.
     */
    public static Set<SessionStatus> open() {
        return EnumSet.of(PLANNED, ACTIVE, PAUSED);
    }
}
