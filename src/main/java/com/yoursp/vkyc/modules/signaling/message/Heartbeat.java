package com.yoursp.vkyc.modules.signaling.message;

/**
 * Keep-alive from a peer. {@code sentAt} is echoed back in the ack.
 */
public record Heartbeat(Long sentAt) implements SignalingMessage {
}
