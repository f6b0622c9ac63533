package com.yoursp.vkyc.modules.signaling.message;

/**
 * Agent declines or leaves the session; it returns to the waiting queue.
 */
public record AgentRelease(String reason) implements SignalingMessage {
}
