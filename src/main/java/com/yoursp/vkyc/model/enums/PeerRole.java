package com.yoursp.vkyc.model.enums;

/**
 * The two parties of a signaling channel.
 */
public enum PeerRole {

    USER,
    AGENT;

    public PeerRole opposite() {
        return this == USER ? AGENT : USER;
    }
}
