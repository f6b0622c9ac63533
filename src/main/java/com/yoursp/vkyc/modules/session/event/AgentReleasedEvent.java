package com.yoursp.vkyc.modules.session.event;

import java.util.UUID;

/**
 * The assigned agent handed a live session back to the waiting queue.
 */
public record AgentReleasedEvent(UUID sessionId, String agentId) {
}
