package com.yoursp.vkyc.model.enums;

/**
 * User-facing "session ended" category.
 */
public enum SessionOutcome {
    COMPLETED,
    EXPIRED,
    DISCONNECTED,
    VERIFICATION_FAILED,
    ENDED
}
