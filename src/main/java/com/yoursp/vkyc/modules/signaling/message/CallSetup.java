package com.yoursp.vkyc.modules.signaling.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.yoursp.vkyc.modules.signaling.exception.ChannelProtocolException;

import java.util.Set;

/**
 * WebRTC negotiation. The payload is forwarded to the other peer unread.
 */
public record CallSetup(String kind, JsonNode payload) implements SignalingMessage {

    private static final Set<String> KINDS = Set.of("offer", "answer", "ice_candidate");

    @Override
    public void validate() {
        if (kind == null || !KINDS.contains(kind)) {
            throw new ChannelProtocolException("INVALID_CALL_SETUP", "call_setup kind must be one of " + KINDS);
        }
        if (payload == null || payload.isNull()) {
            throw new ChannelProtocolException("INVALID_CALL_SETUP", "call_setup payload is required");
        }
    }
}
