package com.yoursp.vkyc.modules.verification;

import com.yoursp.vkyc.model.enums.DocumentType;

import java.time.Instant;
import java.util.UUID;

/**
 * One document image submitted during a call. Held only while the pipeline
 * processes it; the raw image is never persisted.
 */
public record CaptureFrame(UUID sessionId, DocumentType documentType, byte[] image, Instant capturedAt) {

    public CaptureFrame {
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("Capture frame has no image payload");
        }
    }
}
