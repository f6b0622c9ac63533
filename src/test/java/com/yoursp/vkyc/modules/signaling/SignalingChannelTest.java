package com.yoursp.vkyc.modules.signaling;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.vkyc.model.enums.BiometricKind;
import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.PeerRole;
import com.yoursp.vkyc.model.enums.SessionOutcome;
import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.model.enums.TerminationReason;
import com.yoursp.vkyc.model.enums.VerificationStatus;
import com.yoursp.vkyc.modules.biometric.BiometricLogger;
import com.yoursp.vkyc.modules.session.SessionStateMachine;
import com.yoursp.vkyc.modules.session.exception.AgentConflictException;
import com.yoursp.vkyc.modules.session.exception.InvalidTransitionException;
import com.yoursp.vkyc.modules.signaling.exception.SessionNotActiveException;
import com.yoursp.vkyc.modules.verification.CaptureFrame;
import com.yoursp.vkyc.modules.verification.VerificationOutcome;
import com.yoursp.vkyc.modules.verification.exception.VerificationBusyException;
import com.yoursp.vkyc.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SignalingChannelTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration GRACE = Duration.ofSeconds(30);
    private static final String AGENT_ID = "agent-7";
    private static final String IMAGE = Base64.getEncoder()
            .encodeToString("pan-card-image".getBytes(StandardCharsets.UTF_8));

    @Mock
    private SessionStateMachine stateMachine;
    @Mock
    private BiometricLogger biometricLogger;
    @Mock
    private TaskScheduler scheduler;
    @Mock
    private ScheduledFuture<Object> graceFuture;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final UUID sessionId = UUID.randomUUID();
    private SignalingChannel channel;
    private FakePeer user;
    private FakePeer agent;

    @BeforeEach
    void setUp() {
        channel = new SignalingChannel(sessionId, new SignalingCodec(MAPPER), stateMachine, biometricLogger,
                scheduler, GRACE, clock);
        lenient().doReturn(graceFuture).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        user = new FakePeer("u-1", PeerRole.USER);
        agent = new FakePeer("a-1", PeerRole.AGENT);
        channel.attach(user);
        channel.attach(agent, AGENT_ID);
        user.sent.clear();
        agent.sent.clear();
    }

    // ================================================================
    // Helpers
    // ================================================================

    static class FakePeer implements PeerConnection {

        private final String id;
        private final PeerRole role;
        private final List<JsonNode> sent = new ArrayList<>();
        private boolean open = true;
        private String closeReason;

        FakePeer(String id, PeerRole role) {
            this.id = id;
            this.role = role;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public PeerRole role() {
            return role;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String text) throws IOException {
            sent.add(MAPPER.readTree(text));
        }

        @Override
        public void close(String reason) {
            open = false;
            closeReason = reason;
        }

        JsonNode last() {
            return sent.get(sent.size() - 1);
        }

        boolean receivedNotice(String code) {
            return sent.stream().anyMatch(node -> "session_notice".equals(node.path("type").asText())
                    && code.equals(node.path("code").asText()));
        }

        boolean receivedType(String type) {
            return sent.stream().anyMatch(node -> type.equals(node.path("type").asText()));
        }
    }

    private static String json(Map<String, Object> message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void requestCapture(String documentType) {
        channel.onMessage(agent, json(Map.of("type", "capture_command", "documentType", documentType,
                "action", "request")));
    }

    private void submitCapture(String documentType) {
        channel.onMessage(user, json(Map.of("type", "capture_submission", "documentType", documentType,
                "image", "data:image/jpeg;base64," + IMAGE)));
    }

    private Runnable scheduledGraceTask() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(task.capture(), eq(clock.instant().plus(GRACE)));
        return task.getValue();
    }

    // ================================================================
    // Peers and grace period
    // ================================================================

    @Test
    @DisplayName("Attaching notifies the new peer and the other side")
    void attachNotifiesBothSides() {
        FakePeer freshAgent = new FakePeer("a-2", PeerRole.AGENT);

        channel.attach(freshAgent);

        assertTrue(freshAgent.receivedNotice("CONNECTED"));
        assertTrue(user.receivedNotice("PEER_JOINED"));
        assertFalse(agent.isOpen());
        assertEquals("Replaced by a new connection", agent.closeReason);
    }

    @Test
    @DisplayName("User reconnects within the grace period, session untouched")
    void reconnectWithinGrace() {
        channel.onDisconnect(user);

        assertTrue(agent.receivedNotice("PEER_DISCONNECTED"));
        assertTrue(channel.hasPendingGrace(PeerRole.USER));
        Runnable graceTask = scheduledGraceTask();

        clock.advance(Duration.ofSeconds(20));
        FakePeer reconnected = new FakePeer("u-2", PeerRole.USER);
        channel.attach(reconnected);

        verify(graceFuture).cancel(false);
        assertFalse(channel.hasPendingGrace(PeerRole.USER));
        assertTrue(channel.isConnected(PeerRole.USER));
        assertTrue(agent.receivedNotice("PEER_JOINED"));

        graceTask.run();
        verifyNoInteractions(stateMachine);
    }

    @Test
    @DisplayName("Grace period elapsing fails the session with DISCONNECT_TIMEOUT")
    void graceExpiryFailsSession() {
        channel.onDisconnect(user);

        scheduledGraceTask().run();

        verify(stateMachine).failInternally(sessionId, TerminationReason.DISCONNECT_TIMEOUT);
        assertFalse(channel.hasPendingGrace(PeerRole.USER));
    }

    @Test
    @DisplayName("Disconnect of an already replaced connection is ignored")
    void staleDisconnectIgnored() {
        FakePeer reconnected = new FakePeer("u-2", PeerRole.USER);
        channel.attach(reconnected);

        channel.onDisconnect(user);

        assertTrue(channel.isConnected(PeerRole.USER));
        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("Peers silent past the heartbeat timeout are closed and enter the grace period")
    void silentPeersClosed() {
        clock.advance(Duration.ofSeconds(45));
        channel.onMessage(agent, json(Map.of("type", "heartbeat", "sentAt", 1L)));
        clock.advance(Duration.ofSeconds(30));

        channel.closeSilentPeers(Duration.ofSeconds(60));

        assertFalse(user.isOpen());
        assertEquals("Heartbeat timeout", user.closeReason);
        assertTrue(agent.isOpen());
        assertTrue(channel.hasPendingGrace(PeerRole.USER));
        assertFalse(channel.hasPendingGrace(PeerRole.AGENT));
    }

    @Test
    @DisplayName("Closing the channel tells both peers the outcome and refuses new peers")
    void closeChannel() {
        channel.onDisconnect(user);

        channel.close(SessionOutcome.VERIFICATION_FAILED);

        verify(graceFuture).cancel(false);
        JsonNode ended = agent.last();
        assertEquals("SESSION_ENDED", ended.path("code").asText());
        assertEquals("VERIFICATION_FAILED", ended.path("outcome").asText());
        assertFalse(agent.isOpen());
        assertThrows(SessionNotActiveException.class,
                () -> channel.attach(new FakePeer("u-3", PeerRole.USER)));
    }

    // ================================================================
    // Agent release
    // ================================================================

    @Test
    @DisplayName("agent_release hands the session back, detaches the agent and keeps the user waiting")
    void agentReleaseOverSignaling() {
        requestCapture("pan");

        channel.onMessage(agent, json(Map.of("type", "agent_release", "reason", "declined")));

        verify(stateMachine).releaseAgent(sessionId, AGENT_ID);
        assertTrue(agent.receivedNotice("AGENT_RELEASED"));
        assertFalse(agent.isOpen());
        assertEquals("Agent released the session", agent.closeReason);
        assertTrue(user.receivedNotice("AGENT_LEFT"));
        assertTrue(user.isOpen());
        assertFalse(channel.isConnected(PeerRole.AGENT));

        channel.onDisconnect(agent);
        verifyNoInteractions(scheduler);

        submitCapture("pan");
        assertTrue(user.receivedNotice("CAPTURE_NOT_REQUESTED"));
        verify(stateMachine, never()).requestVerification(any(), any());
    }

    @Test
    @DisplayName("Release while the agent is in its grace period stops the timer")
    void releaseDuringGraceCancelsTimer() {
        channel.onDisconnect(agent);
        Runnable graceTask = scheduledGraceTask();

        channel.onAgentReleased();

        verify(graceFuture).cancel(false);
        assertFalse(channel.hasPendingGrace(PeerRole.AGENT));
        assertTrue(user.receivedNotice("AGENT_LEFT"));

        graceTask.run();
        verify(stateMachine, never()).failInternally(any(), any());

        user.sent.clear();
        channel.onAgentReleased();
        assertTrue(user.sent.isEmpty());
    }

    @Test
    @DisplayName("agent_release is refused from the user and from an agent that no longer holds the session")
    void agentReleaseRefused() {
        channel.onMessage(user, json(Map.of("type", "agent_release")));
        assertTrue(user.receivedNotice("FORBIDDEN_MESSAGE"));

        doThrow(new AgentConflictException(sessionId)).when(stateMachine).releaseAgent(sessionId, AGENT_ID);
        channel.onMessage(agent, json(Map.of("type", "agent_release")));

        assertTrue(agent.receivedNotice("NOT_ASSIGNED"));
        assertTrue(agent.isOpen());
        assertTrue(channel.isConnected(PeerRole.AGENT));
        assertFalse(user.receivedNotice("AGENT_LEFT"));
    }

    // ================================================================
    // Messages
    // ================================================================

    @Test
    @DisplayName("call_setup is forwarded to the other peer unchanged")
    void callSetupForwarded() {
        channel.onMessage(user, json(Map.of("type", "call_setup", "kind", "offer",
                "payload", Map.of("sdp", "v=0"))));

        JsonNode forwarded = agent.last();
        assertEquals("call_setup", forwarded.path("type").asText());
        assertEquals("offer", forwarded.path("kind").asText());
        assertEquals("v=0", forwarded.path("payload").path("sdp").asText());
        assertTrue(user.sent.isEmpty());
    }

    @Test
    @DisplayName("call_setup with the other peer away reports PEER_UNAVAILABLE")
    void callSetupPeerAway() {
        channel.onDisconnect(agent);

        channel.onMessage(user, json(Map.of("type", "call_setup", "kind", "answer",
                "payload", Map.of("sdp", "v=0"))));

        assertTrue(user.receivedNotice("PEER_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Capture submission without an agent command is refused")
    void submissionWithoutCommand() {
        submitCapture("pan");

        assertTrue(user.receivedNotice("CAPTURE_NOT_REQUESTED"));
        verifyNoInteractions(stateMachine);
    }

    @Test
    @DisplayName("Command then submission hands the decoded frame to verification")
    void commandThenSubmission() {
        requestCapture("pan");
        assertTrue(user.receivedType("capture_command"));

        submitCapture("pan");

        ArgumentCaptor<CaptureFrame> frame = ArgumentCaptor.forClass(CaptureFrame.class);
        verify(stateMachine).requestVerification(eq(sessionId), frame.capture());
        assertEquals(DocumentType.PAN, frame.getValue().documentType());
        assertEquals("pan-card-image", new String(frame.getValue().image(), StandardCharsets.UTF_8));
        assertTrue(user.receivedNotice("CAPTURE_ACCEPTED"));
        assertTrue(agent.receivedNotice("CAPTURE_ACCEPTED"));

        user.sent.clear();
        submitCapture("pan");
        assertTrue(user.receivedNotice("CAPTURE_NOT_REQUESTED"));
    }

    @Test
    @DisplayName("Cancelled command disarms the document")
    void cancelledCommand() {
        requestCapture("aadhaar_front");
        channel.onMessage(agent, json(Map.of("type", "capture_command", "documentType", "aadhaar",
                "action", "cancel")));

        submitCapture("aadhaar");

        assertTrue(user.receivedNotice("CAPTURE_NOT_REQUESTED"));
        verifyNoInteractions(stateMachine);
    }

    @Test
    @DisplayName("Busy pipeline answers VERIFICATION_BUSY and keeps the capture armed")
    void busyPipeline() {
        requestCapture("pan");
        doThrow(new VerificationBusyException(sessionId, DocumentType.PAN, "PAN verification already in progress"))
                .doNothing()
                .when(stateMachine).requestVerification(eq(sessionId), any(CaptureFrame.class));

        submitCapture("pan");
        assertTrue(user.receivedNotice("VERIFICATION_BUSY"));

        submitCapture("pan");
        assertTrue(user.receivedNotice("CAPTURE_ACCEPTED"));
        verify(stateMachine, times(2)).requestVerification(eq(sessionId), any(CaptureFrame.class));
    }

    @Test
    @DisplayName("Submission after the session ended answers SESSION_NOT_ACTIVE")
    void submissionAfterTransitionRefused() {
        requestCapture("pan");
        doThrow(new InvalidTransitionException(sessionId, SessionState.FAILED, SessionState.VERIFYING))
                .when(stateMachine).requestVerification(eq(sessionId), any(CaptureFrame.class));

        submitCapture("pan");

        assertTrue(user.receivedNotice("SESSION_NOT_ACTIVE"));
    }

    @Test
    @DisplayName("Re-capture request lets the user submit again without a new command")
    void recaptureRearms() {
        requestCapture("pan");
        submitCapture("pan");

        channel.onVerificationProgress(new VerificationOutcome(sessionId, DocumentType.PAN,
                VerificationStatus.RECAPTURE_REQUESTED, null, Map.of("name", "ASHA RAO"), 0.4, 1));

        JsonNode userUpdate = user.last();
        JsonNode agentUpdate = agent.last();
        assertEquals("verification_update", userUpdate.path("type").asText());
        assertFalse(userUpdate.has("fields"));
        assertEquals("ASHA RAO", agentUpdate.path("fields").path("name").asText());

        submitCapture("pan");
        verify(stateMachine, times(2)).requestVerification(eq(sessionId), any(CaptureFrame.class));
    }

    @Test
    @DisplayName("Liveness events from the user go to the biometric logger")
    void livenessEventLogged() {
        channel.onMessage(user, json(Map.of("type", "liveness_event", "kind", "blink",
                "payload", Map.of("count", 2))));

        verify(biometricLogger).append(eq(sessionId), eq(BiometricKind.BLINK), anyMap());
    }

    @Test
    @DisplayName("Role-restricted messages from the wrong side are refused")
    void roleRestrictions() {
        channel.onMessage(user, json(Map.of("type", "capture_command", "documentType", "pan",
                "action", "request")));
        channel.onMessage(agent, json(Map.of("type", "liveness_event", "kind", "blink")));
        channel.onMessage(user, json(Map.of("type", "session_notice", "code", "SESSION_ENDED")));

        assertEquals(2, user.sent.stream()
                .filter(node -> "FORBIDDEN_MESSAGE".equals(node.path("code").asText()))
                .count());
        assertTrue(agent.receivedNotice("FORBIDDEN_MESSAGE"));
        verifyNoInteractions(biometricLogger);
    }

    @Test
    @DisplayName("Unknown and malformed frames get an error notice, channel stays up")
    void unknownAndMalformed() {
        channel.onMessage(user, "{\"type\":\"teleport\"}");
        channel.onMessage(user, "{not json");
        channel.onMessage(user, json(Map.of("type", "call_setup", "kind", "renegotiate",
                "payload", Map.of())));

        assertTrue(user.receivedNotice("UNKNOWN_MESSAGE_TYPE"));
        assertTrue(user.receivedNotice("MALFORMED_MESSAGE"));
        assertTrue(user.receivedNotice("INVALID_CALL_SETUP"));
        assertTrue(user.isOpen());
        assertTrue(agent.sent.isEmpty());
    }

    @Test
    @DisplayName("Heartbeat is acknowledged with the client timestamp")
    void heartbeatAcknowledged() {
        channel.onMessage(user, json(Map.of("type", "heartbeat", "sentAt", 1234L)));

        JsonNode ack = user.last();
        assertEquals("heartbeat_ack", ack.path("type").asText());
        assertEquals(1234L, ack.path("sentAt").asLong());
        assertEquals(clock.millis(), ack.path("serverTime").asLong());
    }
}
