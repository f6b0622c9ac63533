package com.yoursp.vkyc.modules.signaling.exception;

/**
 * A peer sent a message that is malformed or not allowed in the current
 * context. The channel answers with an error notice and stays open.
 */
public class ChannelProtocolException extends RuntimeException {

    private final String code;

    public ChannelProtocolException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
