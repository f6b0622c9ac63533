package com.yoursp.vkyc.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Single-use verification link. Rows are never deleted: a consumed or
 * superseded link stays for the audit trail.
 */
@Entity
@Table(name = "verification_links")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VerificationLink {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "token", unique = true, nullable = false, length = 64)
    private String token;

    @Column(name = "customer_ref", nullable = false, length = 100)
    private String customerRef;

    @Column(name = "session_id")
    private UUID sessionId;

    /** Issued for a scheduled occurrence; the mode is already fixed. */
    @Column(name = "scheduled_occurrence")
    private boolean scheduledOccurrence;

    @Column(name = "issued_at", updatable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "consumed")
    private boolean consumed;

    @Column(name = "consumed_at")
    private OffsetDateTime consumedAt;

    @Column(name = "superseded_at")
    private OffsetDateTime supersededAt;

    public boolean isExpiredAt(OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isSuperseded() {
        return supersededAt != null;
    }

    @PrePersist
    protected void onCreate() {
        if (issuedAt == null)
            issuedAt = OffsetDateTime.now();
    }
}
