package com.yoursp.vkyc.modules.signaling.message;

import com.yoursp.vkyc.model.enums.BiometricKind;
import com.yoursp.vkyc.modules.signaling.exception.ChannelProtocolException;

import java.util.Map;

public record LivenessEvent(String kind, Map<String, Object> payload) implements SignalingMessage {

    @Override
    public void validate() {
        biometricKind();
    }

    public BiometricKind biometricKind() {
        try {
            return BiometricKind.fromClientValue(kind);
        } catch (IllegalArgumentException e) {
            throw new ChannelProtocolException("INVALID_LIVENESS_EVENT", e.getMessage());
        }
    }
}
