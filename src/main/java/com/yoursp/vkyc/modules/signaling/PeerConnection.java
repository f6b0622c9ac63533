package com.yoursp.vkyc.modules.signaling;

import com.yoursp.vkyc.model.enums.PeerRole;

import java.io.IOException;

/**
 * One peer's transport. Sends from one thread at a time are delivered in call
 * order.
 */
public interface PeerConnection {

    String id();

    PeerRole role();

    boolean isOpen();

    void send(String text) throws IOException;

    void close(String reason);
}
