package com.yoursp.vkyc.modules.signaling;

import com.yoursp.vkyc.model.enums.PeerRole;
import com.yoursp.vkyc.modules.signaling.exception.SessionNotActiveException;
import com.yoursp.vkyc.modules.signaling.message.SessionNotice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * WebSocket entry point: {@code /ws/vkyc/{sessionId}?role=USER&token=...} or
 * {@code ?role=AGENT&agentId=...}.
 */
@SuppressWarnings("null")
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalingWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_SESSION_ID = "vkyc.sessionId";
    static final String ATTR_PEER = "vkyc.peer";

    private final SignalingHub hub;
    private final SignalingCodec codec;

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        UUID sessionId;
        PeerRole role;
        String credential;
        try {
            UriComponents uri = UriComponentsBuilder.fromUri(requireUri(session)).build();
            List<String> segments = uri.getPathSegments();
            sessionId = UUID.fromString(segments.get(segments.size() - 1));
            MultiValueMap<String, String> params = uri.getQueryParams();
            role = PeerRole.valueOf(String.valueOf(params.getFirst("role")).toUpperCase(Locale.ROOT));
            credential = role == PeerRole.USER ? params.getFirst("token") : params.getFirst("agentId");
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            reject(session, SessionNotice.UNAUTHORIZED, "Malformed connection request", CloseStatus.BAD_DATA);
            return;
        }

        WebSocketPeerConnection peer = new WebSocketPeerConnection(session, role);
        try {
            hub.connect(sessionId, peer, credential);
        } catch (SessionNotActiveException e) {
            reject(session, SessionNotice.SESSION_NOT_ACTIVE, e.getMessage(), CloseStatus.POLICY_VIOLATION);
            return;
        } catch (SecurityException e) {
            log.warn("Signaling authentication failed: sessionId={}, role={}, reason={}",
                    sessionId, role, e.getMessage());
            reject(session, SessionNotice.UNAUTHORIZED, "Authentication failed", CloseStatus.POLICY_VIOLATION);
            return;
        }

        session.getAttributes().put(ATTR_SESSION_ID, sessionId);
        session.getAttributes().put(ATTR_PEER, peer);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message)
            throws Exception {
        UUID sessionId = (UUID) session.getAttributes().get(ATTR_SESSION_ID);
        PeerConnection peer = (PeerConnection) session.getAttributes().get(ATTR_PEER);
        if (sessionId == null || peer == null) {
            return;
        }
        try {
            hub.onMessage(sessionId, peer, message.getPayload());
        } catch (SessionNotActiveException e) {
            peer.send(codec.encode(SessionNotice.of(SessionNotice.SESSION_NOT_ACTIVE, e.getMessage())));
            peer.close("Session not active");
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("Signaling transport error: connection={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        UUID sessionId = (UUID) session.getAttributes().get(ATTR_SESSION_ID);
        PeerConnection peer = (PeerConnection) session.getAttributes().get(ATTR_PEER);
        if (sessionId != null && peer != null) {
            log.debug("Signaling connection closed: sessionId={}, role={}, status={}",
                    sessionId, peer.role(), status);
            hub.onDisconnect(sessionId, peer);
        }
    }

    private URI requireUri(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null) {
            throw new IllegalArgumentException("Connection has no URI");
        }
        return uri;
    }

    private void reject(WebSocketSession session, String code, String message, CloseStatus status)
            throws IOException {
        if (session.isOpen()) {
            session.sendMessage(new TextMessage(codec.encode(SessionNotice.of(code, message))));
            session.close(status);
        }
    }
}
