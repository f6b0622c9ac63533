package com.yoursp.vkyc.model.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a VKYC session.
 *
 * <pre>
 * CREATED -> SCHEDULED -> READY_TO_START -> IN_PROGRESS -> VERIFYING -> COMPLETED
 *    |           |              |                |             |
 *    +-----------+--------------+--> EXPIRED     +-------------+--> FAILED
 * </pre>
 *
 * Transitions only move forward; a terminal state is never left.
 */
public enum SessionState {

    CREATED,
    SCHEDULED,
    READY_TO_START,
    IN_PROGRESS,
    VERIFYING,
    COMPLETED,
    FAILED,
    EXPIRED;

    private static final Set<SessionState> TERMINAL = EnumSet.of(COMPLETED, FAILED, EXPIRED);
    private static final Set<SessionState> ACTIVE = EnumSet.of(IN_PROGRESS, VERIFYING);
    private static final Set<SessionState> EXPIRABLE = EnumSet.of(CREATED, SCHEDULED, READY_TO_START);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** True while the call is live and the signaling channel may carry messages. */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isExpirable() {
        return EXPIRABLE.contains(this);
    }

    public boolean canTransitionTo(SessionState target) {
        if (isTerminal()) {
            return false;
        }
        return switch (target) {
            case SCHEDULED, READY_TO_START -> this == CREATED || (this == SCHEDULED && target == READY_TO_START);
            case IN_PROGRESS -> this == READY_TO_START;
            case VERIFYING -> this == IN_PROGRESS;
            case COMPLETED -> this == VERIFYING;
            case FAILED -> true;
            case EXPIRED -> isExpirable();
            case CREATED -> false;
        };
    }
}
