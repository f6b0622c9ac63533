package com.yoursp.vkyc.model.enums;

/**
 * Progress of one document type within a session.
 */
public enum VerificationStatus {

    PENDING,
    RECAPTURE_REQUESTED,
    MATCHED,
    MISMATCHED,
    UNAVAILABLE,
    FAILED;

    /** No further frames will be processed for this document. */
    public boolean isFinal() {
        return this == MATCHED || this == MISMATCHED || this == FAILED;
    }
}
