package com.yoursp.vkyc.modules.session.dto;

import com.yoursp.vkyc.model.enums.SessionMode;
import com.yoursp.vkyc.model.enums.SessionOutcome;
import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.modules.link.dto.IssuedLinkResponse;
import com.yoursp.vkyc.modules.session.SessionSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Public view of a session. Carries the outcome category only, never the
 * internal termination reason.
 */
@Getter
@Builder
@AllArgsConstructor
public class SessionView {

    private final UUID sessionId;
    private final SessionState state;
    private final SessionMode mode;
    private final OffsetDateTime scheduledAt;
    private final String assignedAgentId;
    private final boolean manualReviewRequired;
    private final OffsetDateTime startedAt;
    private final OffsetDateTime endedAt;
    private final SessionOutcome outcome;
    /** Fresh link for a newly booked scheduled occurrence. */
    private final IssuedLinkResponse occurrenceLink;

    public static SessionView of(SessionSnapshot snapshot) {
        return of(snapshot, null);
    }

    public static SessionView of(SessionSnapshot snapshot, IssuedLinkResponse occurrenceLink) {
        return SessionView.builder()
                .sessionId(snapshot.id())
                .state(snapshot.state())
                .mode(snapshot.mode())
                .scheduledAt(snapshot.scheduledAt())
                .assignedAgentId(snapshot.assignedAgentId())
                .manualReviewRequired(snapshot.manualReviewRequired())
                .startedAt(snapshot.startedAt())
                .endedAt(snapshot.endedAt())
                .outcome(snapshot.terminationReason() != null ? snapshot.terminationReason().getOutcome() : null)
                .occurrenceLink(occurrenceLink)
                .build();
    }
}
