package com.yoursp.vkyc.modules.session;

import com.yoursp.vkyc.config.VkycProperties;
import com.yoursp.vkyc.model.entity.VerificationLink;
import com.yoursp.vkyc.model.entity.VerificationResult;
import com.yoursp.vkyc.model.entity.VkycSession;
import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.SessionMode;
import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.model.enums.TerminationReason;
import com.yoursp.vkyc.model.enums.VerificationStatus;
import com.yoursp.vkyc.modules.biometric.BiometricLogger;
import com.yoursp.vkyc.modules.link.LinkIssuer;
import com.yoursp.vkyc.modules.link.exception.LinkException;
import com.yoursp.vkyc.modules.recording.CapReachedEvent;
import com.yoursp.vkyc.modules.recording.RecordingFailedEvent;
import com.yoursp.vkyc.modules.session.event.AgentReleasedEvent;
import com.yoursp.vkyc.modules.session.event.SessionStartedEvent;
import com.yoursp.vkyc.modules.session.event.SessionTerminatedEvent;
import com.yoursp.vkyc.modules.session.event.VerificationProgressEvent;
import com.yoursp.vkyc.modules.session.exception.AgentConflictException;
import com.yoursp.vkyc.modules.session.exception.InvalidTransitionException;
import com.yoursp.vkyc.modules.verification.CaptureFrame;
import com.yoursp.vkyc.modules.verification.VerificationFailure;
import com.yoursp.vkyc.modules.verification.VerificationOutcome;
import com.yoursp.vkyc.modules.verification.VerificationPipeline;
import com.yoursp.vkyc.repository.VerificationResultRepository;
import com.yoursp.vkyc.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the VKYC session lifecycle.
 * <p>
 * Every transition goes through {@link SessionStore#write}, so transitions of
 * one session are serialized. Side effects that reach other components (events,
 * pipeline cancellation) run after the write has committed and outside the
 * session lock.
 * </p>
 * <ul>
 * <li>{@code startedAt} is set exactly once, on {@code beginSession}</li>
 * <li>{@code endedAt} is set exactly once, on the terminal transition</li>
 * <li>Repeating a transition whose target is the current state is a no-op</li>
 * </ul>
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionStateMachine {

    private final SessionStore sessionStore;
    private final LinkIssuer linkIssuer;
    private final VerificationPipeline verificationPipeline;
    private final BiometricLogger biometricLogger;
    private final VerificationResultRepository resultRepository;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final VkycProperties properties;
    private final Clock clock;

    // ================================================================
    // createSession
    // ================================================================

    /**
     * Open a session for a link. A link already bound to a session yields that
     * session.
     *
     * @throws LinkException NOT_FOUND, EXPIRED or CONSUMED
     */
    public SessionSnapshot createSession(String token) {
        VerificationLink link = linkIssuer.requireUsable(token);

        return sessionStore.exclusive(link.getId(), () -> {
            VerificationLink current = linkIssuer.requireUsable(token);
            if (current.getSessionId() != null) {
                log.debug("Link already bound: linkId={}, sessionId={}", current.getId(), current.getSessionId());
                return sessionStore.require(current.getSessionId());
            }

            VkycSession session = sessionStore.create(VkycSession.builder()
                    .linkId(current.getId())
                    .customerRef(current.getCustomerRef())
                    .state(SessionState.CREATED)
                    .build());
            linkIssuer.bindToSession(current, session.getId());

            auditService.record(session.getId(), AuditService.ACTOR_USER, "SESSION_CREATED",
                    Map.of("linkId", current.getId().toString()));
            log.info("Session created: sessionId={}, linkId={}, customerRef={}",
                    session.getId(), current.getId(), current.getCustomerRef());
            return SessionSnapshot.of(session);
        });
    }

    // ================================================================
    // chooseMode
    // ================================================================

    /**
     * IMMEDIATE moves a CREATED session to READY_TO_START. SCHEDULED books a
     * future slot, issues a fresh link for it and supersedes the current one.
     * Neither choice is accepted once a slot is booked.
     *
     * @param scheduledAt required for SCHEDULED: strictly in the future and
     *                    within the scheduling horizon
     */
    public ModeChoice chooseMode(UUID sessionId, SessionMode mode, OffsetDateTime scheduledAt) {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (mode == SessionMode.SCHEDULED) {
            validateSlot(scheduledAt, now);
        }

        return sessionStore.write(sessionId, session -> {
            SessionState from = session.getState();

            if (mode == SessionMode.IMMEDIATE) {
                if (from == SessionState.READY_TO_START && session.getMode() == SessionMode.IMMEDIATE) {
                    return new ModeChoice(SessionSnapshot.of(session), null);
                }
                // A booked slot is only left through promoteScheduled
                if (from != SessionState.CREATED) {
                    throw new InvalidTransitionException(sessionId, from, SessionState.READY_TO_START);
                }
                session.setMode(SessionMode.IMMEDIATE);
                session.setState(SessionState.READY_TO_START);
                auditService.record(sessionId, AuditService.ACTOR_USER, "MODE_CHOSEN", Map.of("mode", mode.name()));
                log.info("Session ready: sessionId={}, mode=IMMEDIATE", sessionId);
                return new ModeChoice(SessionSnapshot.of(session), null);
            }

            if (from == SessionState.SCHEDULED && scheduledAt.isEqual(session.getScheduledAt())) {
                return new ModeChoice(SessionSnapshot.of(session), null);
            }
            if (from != SessionState.CREATED) {
                throw new InvalidTransitionException(sessionId, from, SessionState.SCHEDULED);
            }

            UUID previousLinkId = session.getLinkId();
            VerificationLink occurrenceLink = linkIssuer.issue(session.getCustomerRef(),
                    scheduledAt.plus(properties.getLink().getScheduledValidity()), sessionId);
            linkIssuer.supersede(previousLinkId);

            session.setMode(SessionMode.SCHEDULED);
            session.setScheduledAt(scheduledAt);
            session.setLinkId(occurrenceLink.getId());
            session.setState(SessionState.SCHEDULED);

            auditService.record(sessionId, AuditService.ACTOR_USER, "MODE_CHOSEN", Map.of(
                    "mode", mode.name(),
                    "scheduledAt", scheduledAt.toString(),
                    "supersededLinkId", previousLinkId.toString(),
                    "linkId", occurrenceLink.getId().toString()));
            log.info("Session scheduled: sessionId={}, scheduledAt={}, linkId={}",
                    sessionId, scheduledAt, occurrenceLink.getId());
            return new ModeChoice(SessionSnapshot.of(session), occurrenceLink);
        });
    }

    /**
     * SCHEDULED → READY_TO_START once the slot has arrived. Used by the sweep.
     *
     * @return true if the session was promoted
     */
    public boolean promoteScheduled(UUID sessionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return sessionStore.write(sessionId, session -> {
            if (session.getState() != SessionState.SCHEDULED || session.getScheduledAt().isAfter(now)) {
                return false;
            }
            session.setState(SessionState.READY_TO_START);
            auditService.record(sessionId, AuditService.ACTOR_SYSTEM, "SCHEDULE_DUE",
                    Map.of("scheduledAt", session.getScheduledAt().toString()));
            log.info("Scheduled session due: sessionId={}", sessionId);
            return true;
        });
    }

    // ================================================================
    // beginSession
    // ================================================================

    /**
     * READY_TO_START → IN_PROGRESS. Consumes the link; recording and signaling
     * have started when this returns.
     */
    public SessionSnapshot beginSession(UUID sessionId) {
        SessionSnapshot before = sessionStore.require(sessionId);
        if (before.state() == SessionState.READY_TO_START
                && !OffsetDateTime.now(clock).isBefore(linkIssuer.expiryOf(before.linkId()))) {
            expire(sessionId, false);
            throw LinkException.expired();
        }

        boolean[] started = new boolean[1];
        SessionSnapshot snapshot = sessionStore.write(sessionId, session -> {
            if (session.getStartedAt() != null && session.getState().isActive()) {
                return SessionSnapshot.of(session);
            }
            requireTransition(session, SessionState.IN_PROGRESS);
            session.setState(SessionState.IN_PROGRESS);
            session.setStartedAt(OffsetDateTime.now(clock));
            linkIssuer.consume(session.getLinkId());
            started[0] = true;
            return SessionSnapshot.of(session);
        });

        if (started[0]) {
            auditService.record(sessionId, AuditService.ACTOR_USER, "SESSION_STARTED",
                    Map.of("linkId", snapshot.linkId().toString()));
            log.info("Session started: sessionId={}", sessionId);
            eventPublisher.publishEvent(new SessionStartedEvent(sessionId));
        }
        return sessionStore.require(sessionId);
    }

    // ================================================================
    // requestVerification
    // ================================================================

    /**
     * Hand a captured frame to the pipeline. Returns once the frame is accepted;
     * the outcome arrives through {@link #onVerificationResult}.
     */
    public void requestVerification(UUID sessionId, CaptureFrame frame) {
        if (!sessionId.equals(frame.sessionId())) {
            throw new IllegalArgumentException("Frame belongs to another session");
        }
        sessionStore.write(sessionId, session -> {
            SessionState from = session.getState();
            if (from == SessionState.IN_PROGRESS) {
                session.setState(SessionState.VERIFYING);
                log.info("Session verifying: sessionId={}", sessionId);
            } else if (from != SessionState.VERIFYING) {
                throw new InvalidTransitionException(sessionId, from, SessionState.VERIFYING);
            }
            return null;
        });

        verificationPipeline.submit(frame, this::onVerificationResult);
        auditService.record(sessionId, AuditService.ACTOR_USER, "VERIFICATION_REQUESTED",
                Map.of("documentType", frame.documentType().name()));
    }

    /**
     * Pipeline completion callback. Runs on a verification worker thread.
     */
    public void onVerificationResult(VerificationOutcome outcome) {
        UUID sessionId = outcome.sessionId();
        SessionSnapshot snapshot = sessionStore.find(sessionId).orElse(null);
        if (snapshot == null || snapshot.state().isTerminal()) {
            log.info("Ignoring verification result for closed session: sessionId={}, doc={}",
                    sessionId, outcome.documentType());
            return;
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("documentType", outcome.documentType().name());
        metadata.put("status", outcome.status().name());
        metadata.put("attempts", outcome.attempts());
        if (outcome.failure() != null) {
            metadata.put("failure", outcome.failure().name());
        }
        auditService.record(sessionId, AuditService.ACTOR_SYSTEM, "VERIFICATION_RESULT", metadata);
        eventPublisher.publishEvent(new VerificationProgressEvent(outcome));

        switch (outcome.status()) {
            case FAILED -> failInternally(sessionId, outcome.failure() == VerificationFailure.LOW_CONFIDENCE
                    ? TerminationReason.LOW_CONFIDENCE
                    : TerminationReason.VERIFICATION_INCOMPLETE);
            case MISMATCHED -> failInternally(sessionId, TerminationReason.REGISTRY_MISMATCH);
            case UNAVAILABLE -> markForManualReview(sessionId, outcome.documentType());
            default -> log.debug("Verification progress: sessionId={}, doc={}, status={}",
                    sessionId, outcome.documentType(), outcome.status());
        }
    }

    // ================================================================
    // completeSession / failSession / expireSession
    // ================================================================

    /**
     * VERIFYING → COMPLETED. Requires every required document MATCHED and
     * liveness passed.
     */
    public SessionSnapshot completeSession(UUID sessionId) {
        return terminate(sessionId, SessionState.COMPLETED, TerminationReason.COMPLETED, true);
    }

    /**
     * Fail from any non-terminal state. Cancels in-flight verification.
     */
    public SessionSnapshot failSession(UUID sessionId, TerminationReason reason) {
        if (reason == null || reason == TerminationReason.COMPLETED) {
            throw new IllegalArgumentException("A failure reason is required");
        }
        return terminate(sessionId, SessionState.FAILED, reason, true);
    }

    /**
     * Expire a session that never started.
     */
    public SessionSnapshot expireSession(UUID sessionId) {
        return expire(sessionId, true);
    }

    // ================================================================
    // assignAgent
    // ================================================================

    /**
     * First agent to claim a live session gets it.
     *
     * @throws AgentConflictException if another agent already holds it
     */
    public SessionSnapshot assignAgent(UUID sessionId, String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        boolean[] claimed = new boolean[1];
        SessionSnapshot snapshot = sessionStore.write(sessionId, session -> {
            if (!session.getState().isActive()) {
                throw new InvalidTransitionException(sessionId, session.getState(),
                        "Session " + sessionId + " is not live, cannot assign an agent");
            }
            if (session.getAssignedAgentId() == null) {
                session.setAssignedAgentId(agentId);
                claimed[0] = true;
            } else if (!session.getAssignedAgentId().equals(agentId)) {
                throw new AgentConflictException(sessionId);
            }
            return SessionSnapshot.of(session);
        });

        if (claimed[0]) {
            auditService.record(sessionId, agentId, "AGENT_ASSIGNED", Map.of("agentId", agentId));
            log.info("Agent assigned: sessionId={}, agentId={}", sessionId, agentId);
        }
        return snapshot;
    }

    /**
     * The holding agent declines or leaves a live session. The session stays
     * live and goes back to the waiting queue for the next claim. Releasing a
     * session nobody holds is a no-op.
     *
     * @throws AgentConflictException if another agent holds the session
     */
    public SessionSnapshot releaseAgent(UUID sessionId, String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        boolean[] released = new boolean[1];
        SessionSnapshot snapshot = sessionStore.write(sessionId, session -> {
            if (!session.getState().isActive()) {
                throw new InvalidTransitionException(sessionId, session.getState(),
                        "Session " + sessionId + " is not live, cannot release an agent");
            }
            String holder = session.getAssignedAgentId();
            if (holder == null) {
                return SessionSnapshot.of(session);
            }
            if (!holder.equals(agentId)) {
                throw new AgentConflictException(sessionId);
            }
            session.setAssignedAgentId(null);
            released[0] = true;
            return SessionSnapshot.of(session);
        });

        if (released[0]) {
            auditService.record(sessionId, agentId, "AGENT_RELEASED", Map.of("agentId", agentId));
            log.info("Agent released session: sessionId={}, agentId={}", sessionId, agentId);
            eventPublisher.publishEvent(new AgentReleasedEvent(sessionId, agentId));
        }
        return snapshot;
    }

    public List<SessionSnapshot> waitingForAgent() {
        return sessionStore.findWaitingForAgent();
    }

    // ================================================================
    // Recording events
    // ================================================================

    /**
     * The recording hit its cap: complete if everything is in, leave for manual
     * review if only the registry is missing, otherwise fail.
     */
    @EventListener
    public void onCapReached(CapReachedEvent event) {
        UUID sessionId = event.sessionId();
        SessionSnapshot snapshot = sessionStore.write(sessionId, session -> {
            session.setCapReached(true);
            return SessionSnapshot.of(session);
        });
        if (snapshot.state().isTerminal()) {
            return;
        }
        auditService.record(sessionId, AuditService.ACTOR_SYSTEM, "RECORDING_CAP_REACHED",
                Map.of("bufferedMillis", event.bufferedMillis()));

        Map<DocumentType, VerificationStatus> statuses = documentStatuses(sessionId);
        Set<DocumentType> required = properties.getVerification().getRequiredDocuments();
        List<DocumentType> unfinished = required.stream()
                .filter(doc -> statuses.get(doc) != VerificationStatus.MATCHED)
                .toList();

        if (snapshot.state() == SessionState.VERIFYING && unfinished.isEmpty()
                && biometricLogger.hasPassedLiveness(sessionId)) {
            terminate(sessionId, SessionState.COMPLETED, TerminationReason.COMPLETED, false);
        } else if (!unfinished.isEmpty()
                && unfinished.stream().allMatch(doc -> statuses.get(doc) == VerificationStatus.UNAVAILABLE)) {
            markForManualReview(sessionId, null);
            log.warn("Recording cap reached with registry outstanding, left for manual review: sessionId={}",
                    sessionId);
        } else {
            failInternally(sessionId, TerminationReason.VERIFICATION_INCOMPLETE);
        }
    }

    @EventListener
    public void onRecordingFailed(RecordingFailedEvent event) {
        log.error("Recording failed, ending session: sessionId={}, error={}", event.sessionId(), event.message());
        failInternally(event.sessionId(), TerminationReason.RECORDING_FAILURE);
    }

    /**
     * Failure raised by an internal component. A session that already reached a
     * terminal state keeps it.
     */
    public void failInternally(UUID sessionId, TerminationReason reason) {
        terminate(sessionId, SessionState.FAILED, reason, false);
    }

    // ================================================================
    // Internals
    // ================================================================

    private SessionSnapshot expire(UUID sessionId, boolean strict) {
        return terminate(sessionId, SessionState.EXPIRED, TerminationReason.LINK_EXPIRED, strict);
    }

    /**
     * Single path to every terminal state.
     *
     * @param strict when false, a session already terminal is left as is instead
     *               of raising
     */
    private SessionSnapshot terminate(UUID sessionId, SessionState target, TerminationReason reason,
            boolean strict) {
        boolean[] transitioned = new boolean[1];
        SessionSnapshot snapshot = sessionStore.write(sessionId, session -> {
            SessionState from = session.getState();
            if (from == target) {
                return SessionSnapshot.of(session);
            }
            if (from.isTerminal() && !strict) {
                log.debug("Session already {}: sessionId={}, ignoring {}", from, sessionId, reason);
                return SessionSnapshot.of(session);
            }
            requireTransition(session, target);
            if (target == SessionState.COMPLETED) {
                requireCompletable(session);
            }
            session.setState(target);
            session.setTerminationReason(reason);
            session.setEndedAt(OffsetDateTime.now(clock));
            transitioned[0] = true;
            return SessionSnapshot.of(session);
        });

        if (transitioned[0]) {
            verificationPipeline.cancel(sessionId);
            biometricLogger.release(sessionId);
            auditService.record(sessionId, AuditService.ACTOR_SYSTEM, "SESSION_" + target.name(), Map.of(
                    "reason", reason.name(),
                    "outcome", reason.getOutcome().name()));
            log.info("Session ended: sessionId={}, state={}, reason={}", sessionId, target, reason);
            eventPublisher.publishEvent(new SessionTerminatedEvent(sessionId, target, reason));
        }
        return snapshot;
    }

    private void requireTransition(VkycSession session, SessionState target) {
        if (!session.getState().canTransitionTo(target)) {
            throw new InvalidTransitionException(session.getId(), session.getState(), target);
        }
    }

    private void requireCompletable(VkycSession session) {
        UUID sessionId = session.getId();
        Map<DocumentType, VerificationStatus> statuses = documentStatuses(sessionId);
        List<DocumentType> missing = properties.getVerification().getRequiredDocuments().stream()
                .filter(doc -> statuses.get(doc) != VerificationStatus.MATCHED)
                .toList();
        if (!missing.isEmpty()) {
            throw new InvalidTransitionException(sessionId, session.getState(),
                    "Documents not verified: " + missing);
        }
        if (!biometricLogger.hasPassedLiveness(sessionId)) {
            throw new InvalidTransitionException(sessionId, session.getState(), "Liveness check not passed");
        }
    }

    private void markForManualReview(UUID sessionId, DocumentType documentType) {
        boolean[] flagged = new boolean[1];
        sessionStore.write(sessionId, session -> {
            if (!session.getState().isTerminal() && !session.isManualReviewRequired()) {
                session.setManualReviewRequired(true);
                flagged[0] = true;
            }
            return null;
        });
        if (flagged[0]) {
            auditService.record(sessionId, AuditService.ACTOR_SYSTEM, "MANUAL_REVIEW_REQUIRED",
                    documentType != null ? Map.of("documentType", documentType.name()) : Map.of());
        }
    }

    private Map<DocumentType, VerificationStatus> documentStatuses(UUID sessionId) {
        Map<DocumentType, VerificationStatus> statuses = new EnumMap<>(DocumentType.class);
        for (VerificationResult result : resultRepository.findAllBySessionId(sessionId)) {
            statuses.put(result.getDocumentType(), result.getStatus());
        }
        return statuses;
    }

    private void validateSlot(OffsetDateTime scheduledAt, OffsetDateTime now) {
        if (scheduledAt == null) {
            throw new IllegalArgumentException("scheduledAt is required for a scheduled session");
        }
        if (!scheduledAt.isAfter(now)) {
            throw new IllegalArgumentException("scheduledAt must be in the future");
        }
        if (scheduledAt.isAfter(now.plus(properties.getLink().getSchedulingHorizon()))) {
            throw new IllegalArgumentException("scheduledAt is beyond the scheduling horizon");
        }
    }
}
