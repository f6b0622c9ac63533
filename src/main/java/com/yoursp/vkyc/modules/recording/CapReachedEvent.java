package com.yoursp.vkyc.modules.recording;

import java.util.UUID;

/**
 * The recording hit its duration cap and stopped buffering. The session must now
 * resolve to a terminal state (or manual review) on its own.
 */
public record CapReachedEvent(UUID sessionId, long bufferedMillis) {
}
