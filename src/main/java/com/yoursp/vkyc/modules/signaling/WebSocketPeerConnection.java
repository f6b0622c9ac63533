package com.yoursp.vkyc.modules.signaling;

import com.yoursp.vkyc.model.enums.PeerRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link PeerConnection} over a Spring WebSocket session. The decorator keeps
 * one ordered outbound buffer per peer.
 */
@Slf4j
class WebSocketPeerConnection implements PeerConnection {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 8 * 1024 * 1024;

    private final WebSocketSession session;
    private final PeerRole role;

    WebSocketPeerConnection(WebSocketSession session, PeerRole role) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.role = role;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public PeerRole role() {
        return role;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL.withReason(reason));
        } catch (IOException e) {
            log.warn("Closing {} connection {} failed: {}", role, session.getId(), e.getMessage());
        }
    }
}
