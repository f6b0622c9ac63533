package com.yoursp.vkyc.modules.session.exception;

import java.util.UUID;

/**
 * Thrown when an agent tries to claim a session another agent already holds.
 */
public class AgentConflictException extends RuntimeException {

    public AgentConflictException(UUID sessionId) {
        super("Session " + sessionId + " is already assigned to another agent");
    }
}
