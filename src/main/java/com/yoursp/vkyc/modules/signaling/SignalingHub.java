package com.yoursp.vkyc.modules.signaling;

import com.yoursp.vkyc.config.VkycProperties;
import com.yoursp.vkyc.model.enums.PeerRole;
import com.yoursp.vkyc.modules.biometric.BiometricLogger;
import com.yoursp.vkyc.modules.link.LinkIssuer;
import com.yoursp.vkyc.modules.session.SessionSnapshot;
import com.yoursp.vkyc.modules.session.SessionStateMachine;
import com.yoursp.vkyc.modules.session.SessionStore;
import com.yoursp.vkyc.modules.session.event.AgentReleasedEvent;
import com.yoursp.vkyc.modules.session.event.SessionStartedEvent;
import com.yoursp.vkyc.modules.session.event.SessionTerminatedEvent;
import com.yoursp.vkyc.modules.session.event.VerificationProgressEvent;
import com.yoursp.vkyc.modules.session.exception.AgentConflictException;
import com.yoursp.vkyc.modules.signaling.exception.SessionNotActiveException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live signaling channels, one per session.
 * <p>
 * Channels open on {@link SessionStartedEvent} and close on
 * {@link SessionTerminatedEvent}. Peers are authenticated here before they are
 * attached: the user by the link token of the session, the agent by the agent
 * id holding (or claiming) the session.
 * </p>
 */
@Slf4j
@Service
public class SignalingHub {

    private final SignalingCodec codec;
    private final SessionStateMachine stateMachine;
    private final SessionStore sessionStore;
    private final LinkIssuer linkIssuer;
    private final BiometricLogger biometricLogger;
    private final TaskScheduler scheduler;
    private final VkycProperties properties;
    private final Clock clock;

    private final Map<UUID, SignalingChannel> channels = new ConcurrentHashMap<>();

    public SignalingHub(SignalingCodec codec,
            SessionStateMachine stateMachine,
            SessionStore sessionStore,
            LinkIssuer linkIssuer,
            BiometricLogger biometricLogger,
            @Qualifier("taskScheduler") TaskScheduler scheduler,
            VkycProperties properties,
            Clock clock) {
        this.codec = codec;
        this.stateMachine = stateMachine;
        this.sessionStore = sessionStore;
        this.linkIssuer = linkIssuer;
        this.biometricLogger = biometricLogger;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    // ================================================================
    // Session events
    // ================================================================

    @EventListener
    public void onSessionStarted(SessionStartedEvent event) {
        open(event.sessionId());
    }

    @EventListener
    public void onSessionTerminated(SessionTerminatedEvent event) {
        SignalingChannel channel = channels.remove(event.sessionId());
        if (channel != null) {
            channel.close(event.reason().getOutcome());
        }
    }

    @EventListener
    public void onAgentReleased(AgentReleasedEvent event) {
        SignalingChannel channel = channels.get(event.sessionId());
        if (channel != null) {
            channel.onAgentReleased();
        }
    }

    @EventListener
    public void onVerificationProgress(VerificationProgressEvent event) {
        SignalingChannel channel = channels.get(event.outcome().sessionId());
        if (channel != null) {
            channel.onVerificationProgress(event.outcome());
        }
    }

    // ================================================================
    // Peers
    // ================================================================

    /**
     * Authenticate a peer and attach it to its session's channel.
     *
     * @param credential link token for USER, agent id for AGENT
     * @throws SessionNotActiveException if the session is not live
     * @throws SecurityException         if the credential does not match
     */
    public SignalingChannel connect(UUID sessionId, PeerConnection peer, String credential) {
        SessionSnapshot session = sessionStore.find(sessionId)
                .filter(s -> s.state().isActive())
                .orElseThrow(() -> new SessionNotActiveException(sessionId));

        if (peer.role() == PeerRole.USER) {
            if (!linkIssuer.isSessionCredential(credential, sessionId)) {
                throw new SecurityException("Invalid session token");
            }
        } else {
            authenticateAgent(session, credential);
        }

        SignalingChannel channel = open(sessionId);
        channel.attach(peer, peer.role() == PeerRole.AGENT ? credential : null);

        // The session may have ended while the peer was being authenticated
        SessionSnapshot current = sessionStore.require(sessionId);
        if (current.state().isTerminal() && channels.remove(sessionId, channel)) {
            channel.close(current.terminationReason().getOutcome());
            throw new SessionNotActiveException(sessionId);
        }
        return channel;
    }

    public void onMessage(UUID sessionId, PeerConnection from, String text) {
        SignalingChannel channel = channels.get(sessionId);
        if (channel == null) {
            throw new SessionNotActiveException(sessionId);
        }
        channel.onMessage(from, text);
    }

    public void onDisconnect(UUID sessionId, PeerConnection peer) {
        SignalingChannel channel = channels.get(sessionId);
        if (channel != null) {
            channel.onDisconnect(peer);
        }
    }

    public Optional<SignalingChannel> find(UUID sessionId) {
        return Optional.ofNullable(channels.get(sessionId));
    }

    /**
     * Close peers silent beyond the heartbeat timeout.
     */
    @Scheduled(fixedDelayString = "#{@vkycProperties.signaling.heartbeatInterval.toMillis()}")
    public void sweepHeartbeats() {
        List<SignalingChannel> snapshot = List.copyOf(channels.values());
        for (SignalingChannel channel : snapshot) {
            channel.closeSilentPeers(properties.getSignaling().getHeartbeatTimeout());
        }
    }

    private SignalingChannel open(UUID sessionId) {
        return channels.computeIfAbsent(sessionId, id -> {
            log.info("Signaling channel opened: sessionId={}", id);
            return new SignalingChannel(id, codec, stateMachine, biometricLogger, scheduler,
                    properties.getSignaling().getDisconnectGracePeriod(), clock);
        });
    }

    private void authenticateAgent(SessionSnapshot session, String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new SecurityException("agentId is required");
        }
        if (agentId.equals(session.assignedAgentId())) {
            return;
        }
        try {
            stateMachine.assignAgent(session.id(), agentId);
        } catch (AgentConflictException e) {
            throw new SecurityException(e.getMessage());
        }
    }
}
