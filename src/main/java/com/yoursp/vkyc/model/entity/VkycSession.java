package com.yoursp.vkyc.model.entity;

import com.yoursp.vkyc.model.enums.SessionMode;
import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.model.enums.TerminationReason;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A video KYC session. Only {@code SessionStateMachine} writes to it, always
 * through {@code SessionStore}.
 */
@Entity
@Table(name = "vkyc_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VkycSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "link_id", nullable = false)
    private UUID linkId;

    @Column(name = "customer_ref", nullable = false, length = 100)
    private String customerRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", length = 20)
    private SessionMode mode;

    @Column(name = "scheduled_at")
    private OffsetDateTime scheduledAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 20, nullable = false)
    private SessionState state;

    @Column(name = "assigned_agent_id", length = 50)
    private String assignedAgentId;

    @Column(name = "manual_review_required")
    private boolean manualReviewRequired;

    @Column(name = "cap_reached")
    private boolean capReached;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "ended_at")
    private OffsetDateTime endedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "termination_reason", length = 40)
    private TerminationReason terminationReason;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
        if (state == null)
            state = SessionState.CREATED;
    }
}
