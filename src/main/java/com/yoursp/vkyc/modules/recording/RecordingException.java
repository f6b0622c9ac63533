package com.yoursp.vkyc.modules.recording;

/**
 * Thrown when the recording spool or the codec fails.
 */
public class RecordingException extends RuntimeException {

    public RecordingException(String message, Throwable cause) {
        super(message, cause);
    }
}
