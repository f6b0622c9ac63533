package com.yoursp.vkyc.modules.verification.exception;

import com.yoursp.vkyc.model.enums.DocumentType;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a frame arrives for a document that already has an attempt in
 * flight, or that is already settled.
 */
@Getter
public class VerificationBusyException extends RuntimeException {

    private final UUID sessionId;
    private final DocumentType documentType;

    public VerificationBusyException(UUID sessionId, DocumentType documentType, String message) {
        super(message);
        this.sessionId = sessionId;
        this.documentType = documentType;
    }
}
