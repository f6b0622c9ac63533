package com.yoursp.vkyc.modules.signaling.exception;

import java.util.UUID;

/**
 * The session is not live, so its channel accepts no peers or messages.
 */
public class SessionNotActiveException extends RuntimeException {

    public SessionNotActiveException(UUID sessionId) {
        super("Session " + sessionId + " is not active");
    }
}
