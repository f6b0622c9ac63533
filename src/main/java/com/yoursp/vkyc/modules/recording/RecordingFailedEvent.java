package com.yoursp.vkyc.modules.recording;

import java.util.UUID;

/**
 * The live buffer could not be written; the session cannot be recorded.
 */
public record RecordingFailedEvent(UUID sessionId, String message) {
}
