package com.yoursp.vkyc.modules.verification.exception;

import java.util.UUID;

/**
 * Stops a retry loop once its session has been cancelled.
 */
public class VerificationCancelledException extends RuntimeException {

    public VerificationCancelledException(UUID sessionId) {
        super("Verification cancelled for session " + sessionId);
    }
}
