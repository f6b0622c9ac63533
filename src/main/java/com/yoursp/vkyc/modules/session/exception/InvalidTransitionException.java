package com.yoursp.vkyc.modules.session.exception;

import com.yoursp.vkyc.model.enums.SessionState;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when an operation is not allowed from the session's current state.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final UUID sessionId;
    private final SessionState from;
    private final SessionState to;

    public InvalidTransitionException(UUID sessionId, SessionState from, SessionState to) {
        super("Session " + sessionId + " cannot move from " + from + " to " + to);
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public InvalidTransitionException(UUID sessionId, SessionState from, String message) {
        super(message);
        this.sessionId = sessionId;
        this.from = from;
        this.to = null;
    }
}
