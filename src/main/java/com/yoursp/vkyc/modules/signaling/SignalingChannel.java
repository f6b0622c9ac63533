package com.yoursp.vkyc.modules.signaling;

import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.PeerRole;
import com.yoursp.vkyc.model.enums.SessionOutcome;
import com.yoursp.vkyc.model.enums.TerminationReason;
import com.yoursp.vkyc.model.enums.VerificationStatus;
import com.yoursp.vkyc.modules.biometric.BiometricLogger;
import com.yoursp.vkyc.modules.session.SessionStateMachine;
import com.yoursp.vkyc.modules.session.exception.AgentConflictException;
import com.yoursp.vkyc.modules.session.exception.InvalidTransitionException;
import com.yoursp.vkyc.modules.signaling.exception.ChannelProtocolException;
import com.yoursp.vkyc.modules.signaling.exception.SessionNotActiveException;
import com.yoursp.vkyc.modules.signaling.message.AgentRelease;
import com.yoursp.vkyc.modules.signaling.message.CallSetup;
import com.yoursp.vkyc.modules.signaling.message.CaptureCommand;
import com.yoursp.vkyc.modules.signaling.message.CaptureSubmission;
import com.yoursp.vkyc.modules.signaling.message.Heartbeat;
import com.yoursp.vkyc.modules.signaling.message.HeartbeatAck;
import com.yoursp.vkyc.modules.signaling.message.LivenessEvent;
import com.yoursp.vkyc.modules.signaling.message.LivenessPrompt;
import com.yoursp.vkyc.modules.signaling.message.SessionNotice;
import com.yoursp.vkyc.modules.signaling.message.SignalingMessage;
import com.yoursp.vkyc.modules.signaling.message.VerificationUpdate;
import com.yoursp.vkyc.modules.verification.CaptureFrame;
import com.yoursp.vkyc.modules.verification.VerificationOutcome;
import com.yoursp.vkyc.modules.verification.exception.VerificationBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * The live channel between the user and the agent of one session.
 * <ul>
 * <li>Inbound messages are handled one at a time, in arrival order</li>
 * <li>A capture submission is accepted only for a document the agent has asked
 * for and the user has been sent the command</li>
 * <li>A peer that drops gets a grace period to reconnect; after that the
 * session fails with DISCONNECT_TIMEOUT</li>
 * <li>An agent that releases the session leaves without a grace period; the
 * user stays connected and waits for the next agent</li>
 * </ul>
 */
@Slf4j
public class SignalingChannel {

    private final UUID sessionId;
    private final SignalingCodec codec;
    private final SessionStateMachine stateMachine;
    private final BiometricLogger biometricLogger;
    private final TaskScheduler scheduler;
    private final Duration gracePeriod;
    private final Clock clock;

    private final Map<PeerRole, PeerConnection> peers = new EnumMap<>(PeerRole.class);
    private final Map<PeerRole, Instant> lastSeen = new EnumMap<>(PeerRole.class);
    private final Map<PeerRole, ScheduledFuture<?>> graceTimers = new EnumMap<>(PeerRole.class);
    private final Set<DocumentType> requestedCaptures = EnumSet.noneOf(DocumentType.class);
    private String agentId;
    private boolean closed;

    public SignalingChannel(UUID sessionId,
            SignalingCodec codec,
            SessionStateMachine stateMachine,
            BiometricLogger biometricLogger,
            TaskScheduler scheduler,
            Duration gracePeriod,
            Clock clock) {
        this.sessionId = sessionId;
        this.codec = codec;
        this.stateMachine = stateMachine;
        this.biometricLogger = biometricLogger;
        this.scheduler = scheduler;
        this.gracePeriod = gracePeriod;
        this.clock = clock;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    // ================================================================
    // Peers
    // ================================================================

    public void attach(PeerConnection peer) {
        attach(peer, null);
    }

    /**
     * Attach a peer, replacing an earlier connection of the same role. Cancels a
     * pending grace timer for that role.
     *
     * @param principal the authenticated agent id for an AGENT peer
     * @throws SessionNotActiveException if the channel is closed
     */
    public synchronized void attach(PeerConnection peer, String principal) {
        if (closed) {
            throw new SessionNotActiveException(sessionId);
        }
        PeerRole role = peer.role();
        if (role == PeerRole.AGENT) {
            agentId = principal;
        }
        PeerConnection previous = peers.put(role, peer);
        if (previous != null && !previous.id().equals(peer.id())) {
            previous.close("Replaced by a new connection");
        }
        ScheduledFuture<?> timer = graceTimers.remove(role);
        if (timer != null) {
            timer.cancel(false);
            log.info("Peer reconnected within grace period: sessionId={}, role={}", sessionId, role);
        }
        lastSeen.put(role, clock.instant());

        deliver(role, SessionNotice.of(SessionNotice.CONNECTED, role.name()));
        deliver(role.opposite(), SessionNotice.of(SessionNotice.PEER_JOINED, role.name()));
        log.info("Peer attached: sessionId={}, role={}, connection={}", sessionId, role, peer.id());
    }

    /**
     * Transport reported the connection gone. Stale connections (already
     * replaced) are ignored.
     */
    public void onDisconnect(PeerConnection peer) {
        synchronized (this) {
            PeerRole role = peer.role();
            if (closed || peers.get(role) != peer) {
                return;
            }
            peers.remove(role);
            lastSeen.remove(role);
            deliver(role.opposite(), SessionNotice.of(SessionNotice.PEER_DISCONNECTED, role.name()));

            ScheduledFuture<?> timer = scheduler.schedule(() -> onGraceExpired(role),
                    clock.instant().plus(gracePeriod));
            graceTimers.put(role, timer);
            log.warn("Peer disconnected, grace period started: sessionId={}, role={}, grace={}s",
                    sessionId, role, gracePeriod.toSeconds());
        }
    }

    void onGraceExpired(PeerRole role) {
        synchronized (this) {
            if (closed || peers.containsKey(role) || !graceTimers.containsKey(role)) {
                return;
            }
            graceTimers.remove(role);
        }
        log.warn("Grace period elapsed without reconnect: sessionId={}, role={}", sessionId, role);
        stateMachine.failInternally(sessionId, TerminationReason.DISCONNECT_TIMEOUT);
    }

    /**
     * Close peers that have been silent longer than {@code timeout}. They enter
     * the normal disconnect path.
     */
    public void closeSilentPeers(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        Map<PeerRole, PeerConnection> silent = new EnumMap<>(PeerRole.class);
        synchronized (this) {
            if (closed) {
                return;
            }
            peers.forEach((role, peer) -> {
                Instant seen = lastSeen.get(role);
                if (seen != null && seen.isBefore(cutoff)) {
                    silent.put(role, peer);
                }
            });
        }
        silent.forEach((role, peer) -> {
            log.warn("Peer silent beyond heartbeat timeout: sessionId={}, role={}", sessionId, role);
            peer.close("Heartbeat timeout");
            onDisconnect(peer);
        });
    }

    /**
     * The agent no longer holds the session. Detaches the agent connection and
     * drops its grace timer so the session does not fail on its account. Safe to
     * call more than once.
     */
    public void onAgentReleased() {
        PeerConnection agent;
        synchronized (this) {
            if (closed) {
                return;
            }
            ScheduledFuture<?> timer = graceTimers.remove(PeerRole.AGENT);
            if (timer != null) {
                timer.cancel(false);
            }
            agent = peers.remove(PeerRole.AGENT);
            lastSeen.remove(PeerRole.AGENT);
            agentId = null;
            if (agent == null && timer == null) {
                return;
            }
            requestedCaptures.clear();
            deliver(PeerRole.USER, SessionNotice.of(SessionNotice.AGENT_LEFT, "Waiting for another agent"));
            if (agent != null) {
                sendTo(agent, SessionNotice.of(SessionNotice.AGENT_RELEASED, sessionId.toString()));
            }
        }
        if (agent != null) {
            agent.close("Agent released the session");
        }
        log.info("Agent detached from channel: sessionId={}", sessionId);
    }

    public synchronized boolean isConnected(PeerRole role) {
        return peers.containsKey(role);
    }

    public synchronized boolean hasPendingGrace(PeerRole role) {
        return graceTimers.containsKey(role);
    }

    /**
     * Tear the channel down after the session ended.
     */
    public void close(SessionOutcome outcome) {
        Map<PeerRole, PeerConnection> remaining;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            graceTimers.values().forEach(timer -> timer.cancel(false));
            graceTimers.clear();
            requestedCaptures.clear();
            for (PeerRole role : PeerRole.values()) {
                deliver(role, SessionNotice.ended(outcome));
            }
            remaining = new EnumMap<>(peers);
            peers.clear();
        }
        remaining.values().forEach(peer -> peer.close("Session ended"));
        log.info("Channel closed: sessionId={}, outcome={}", sessionId, outcome);
    }

    // ================================================================
    // Inbound
    // ================================================================

    /**
     * Handle one inbound frame from a peer.
     */
    public synchronized void onMessage(PeerConnection from, String text) {
        if (closed) {
            sendTo(from, SessionNotice.of(SessionNotice.SESSION_NOT_ACTIVE, "Session has ended"));
            return;
        }
        if (peers.get(from.role()) != from) {
            log.debug("Dropping message from replaced connection: sessionId={}, connection={}", sessionId, from.id());
            return;
        }
        lastSeen.put(from.role(), clock.instant());

        try {
            dispatch(from.role(), codec.decode(text));
        } catch (ChannelProtocolException e) {
            log.warn("Protocol error: sessionId={}, role={}, code={}, message={}",
                    sessionId, from.role(), e.getCode(), e.getMessage());
            sendTo(from, SessionNotice.of(e.getCode(), e.getMessage()));
        } catch (InvalidTransitionException e) {
            sendTo(from, SessionNotice.of(SessionNotice.SESSION_NOT_ACTIVE, e.getMessage()));
        }
    }

    private void dispatch(PeerRole from, SignalingMessage message) {
        if (message.isServerOnly()) {
            throw new ChannelProtocolException("FORBIDDEN_MESSAGE",
                    message.getClass().getSimpleName() + " is sent by the server only");
        }

        if (message instanceof CallSetup setup) {
            forward(from, setup);
        } else if (message instanceof CaptureCommand command) {
            requireRole(from, PeerRole.AGENT, "capture_command");
            onCaptureCommand(command);
        } else if (message instanceof CaptureSubmission submission) {
            requireRole(from, PeerRole.USER, "capture_submission");
            onCaptureSubmission(submission);
        } else if (message instanceof LivenessEvent event) {
            requireRole(from, PeerRole.USER, "liveness_event");
            biometricLogger.append(sessionId, event.biometricKind(), event.payload());
        } else if (message instanceof LivenessPrompt prompt) {
            requireRole(from, PeerRole.AGENT, "liveness_prompt");
            forward(from, prompt);
        } else if (message instanceof AgentRelease release) {
            requireRole(from, PeerRole.AGENT, "agent_release");
            onAgentRelease(release);
        } else if (message instanceof Heartbeat heartbeat) {
            deliver(from, new HeartbeatAck(heartbeat.sentAt(), clock.millis()));
        }
    }

    private void onCaptureCommand(CaptureCommand command) {
        DocumentType document = command.document();
        if (command.isCancel()) {
            requestedCaptures.remove(document);
            deliver(PeerRole.USER, command);
            return;
        }
        if (deliver(PeerRole.USER, command)) {
            requestedCaptures.add(document);
            log.info("Capture requested: sessionId={}, doc={}", sessionId, document);
        } else {
            deliver(PeerRole.AGENT, SessionNotice.of(SessionNotice.PEER_UNAVAILABLE, "User is not connected"));
        }
    }

    private void onAgentRelease(AgentRelease release) {
        if (agentId == null) {
            throw new ChannelProtocolException("NOT_ASSIGNED", "Agent is not assigned to this session");
        }
        try {
            stateMachine.releaseAgent(sessionId, agentId);
        } catch (AgentConflictException e) {
            throw new ChannelProtocolException("NOT_ASSIGNED", e.getMessage());
        }
        log.info("Agent released session over signaling: sessionId={}, reason={}", sessionId, release.reason());
        onAgentReleased();
    }

    private void onCaptureSubmission(CaptureSubmission submission) {
        DocumentType document = submission.document();
        if (!requestedCaptures.contains(document)) {
            throw new ChannelProtocolException("CAPTURE_NOT_REQUESTED",
                    document + " capture was not requested by the agent");
        }
        CaptureFrame frame = new CaptureFrame(sessionId, document, submission.imageBytes(), clock.instant());
        try {
            stateMachine.requestVerification(sessionId, frame);
        } catch (VerificationBusyException e) {
            deliver(PeerRole.USER, SessionNotice.of(SessionNotice.VERIFICATION_BUSY, e.getMessage()));
            return;
        }
        requestedCaptures.remove(document);
        deliver(PeerRole.USER, SessionNotice.of(SessionNotice.CAPTURE_ACCEPTED, document.name()));
        deliver(PeerRole.AGENT, SessionNotice.of(SessionNotice.CAPTURE_ACCEPTED, document.name()));
    }

    // ================================================================
    // Outbound
    // ================================================================

    /**
     * Relay pipeline progress. A re-capture request re-arms the document so the
     * user may submit again without a new command.
     */
    public synchronized void onVerificationProgress(VerificationOutcome outcome) {
        if (closed) {
            return;
        }
        if (outcome.status() == VerificationStatus.RECAPTURE_REQUESTED) {
            requestedCaptures.add(outcome.documentType());
        }
        deliver(PeerRole.USER, VerificationUpdate.forUser(outcome));
        deliver(PeerRole.AGENT, VerificationUpdate.forAgent(outcome));
    }

    private void forward(PeerRole from, SignalingMessage message) {
        if (!deliver(from.opposite(), message)) {
            deliver(from, SessionNotice.of(SessionNotice.PEER_UNAVAILABLE,
                    from.opposite().name() + " is not connected"));
        }
    }

    private void requireRole(PeerRole actual, PeerRole expected, String type) {
        if (actual != expected) {
            throw new ChannelProtocolException("FORBIDDEN_MESSAGE", type + " may only be sent by " + expected);
        }
    }

    private boolean deliver(PeerRole to, SignalingMessage message) {
        PeerConnection peer = peers.get(to);
        return peer != null && sendTo(peer, message);
    }

    private boolean sendTo(PeerConnection peer, SignalingMessage message) {
        if (!peer.isOpen()) {
            return false;
        }
        try {
            peer.send(codec.encode(message));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("Send failed: sessionId={}, role={}, error={}", sessionId, peer.role(), e.getMessage());
            return false;
        }
    }
}
