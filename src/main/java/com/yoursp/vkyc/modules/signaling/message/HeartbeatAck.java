package com.yoursp.vkyc.modules.signaling.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record HeartbeatAck(Long sentAt, long serverTime) implements SignalingMessage {

    @Override
    @JsonIgnore
    public boolean isServerOnly() {
        return true;
    }
}
