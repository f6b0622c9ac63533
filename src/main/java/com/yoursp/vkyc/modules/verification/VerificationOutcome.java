package com.yoursp.vkyc.modules.verification;

import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.VerificationStatus;

import java.util.Map;
import java.util.UUID;

/**
 * Result of one pipeline run for a frame, handed to the completion callback.
 */
public record VerificationOutcome(
        UUID sessionId,
        DocumentType documentType,
        VerificationStatus status,
        VerificationFailure failure,
        Map<String, String> fields,
        Double confidence,
        int attempts) {

    public boolean isFailed() {
        return status == VerificationStatus.FAILED || status == VerificationStatus.MISMATCHED;
    }
}
