package com.yoursp.vkyc.modules.signaling.message;

import com.yoursp.vkyc.modules.signaling.exception.ChannelProtocolException;

/**
 * Instruction shown to the user, e.g. "turn your head left".
 */
public record LivenessPrompt(String prompt) implements SignalingMessage {

    private static final int MAX_LENGTH = 500;

    @Override
    public void validate() {
        if (prompt == null || prompt.isBlank() || prompt.length() > MAX_LENGTH) {
            throw new ChannelProtocolException("INVALID_PROMPT", "prompt must be 1-" + MAX_LENGTH + " characters");
        }
    }
}
