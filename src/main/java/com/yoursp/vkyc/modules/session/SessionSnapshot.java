package com.yoursp.vkyc.modules.session;

import com.yoursp.vkyc.model.entity.VkycSession;
import com.yoursp.vkyc.model.enums.SessionMode;
import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.model.enums.TerminationReason;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Immutable copy of a session handed to components that only read it.
 */
public record SessionSnapshot(
        UUID id,
        UUID linkId,
        String customerRef,
        SessionMode mode,
        OffsetDateTime scheduledAt,
        SessionState state,
        String assignedAgentId,
        boolean manualReviewRequired,
        boolean capReached,
        OffsetDateTime startedAt,
        OffsetDateTime endedAt,
        TerminationReason terminationReason) {

    public static SessionSnapshot of(VkycSession session) {
        return new SessionSnapshot(
                session.getId(),
                session.getLinkId(),
                session.getCustomerRef(),
                session.getMode(),
                session.getScheduledAt(),
                session.getState(),
                session.getAssignedAgentId(),
                session.isManualReviewRequired(),
                session.isCapReached(),
                session.getStartedAt(),
                session.getEndedAt(),
                session.getTerminationReason());
    }
}
