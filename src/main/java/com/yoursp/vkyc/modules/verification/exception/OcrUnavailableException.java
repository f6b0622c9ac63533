package com.yoursp.vkyc.modules.verification.exception;

/**
 * Thrown when OCR fails for a frame. Counts as a failed capture attempt.
 */
public class OcrUnavailableException extends RuntimeException {

    public OcrUnavailableException(String message) {
        super(message);
    }

    public OcrUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
