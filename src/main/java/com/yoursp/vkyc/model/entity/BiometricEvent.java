package com.yoursp.vkyc.model.entity;

import com.yoursp.vkyc.model.enums.BiometricKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only liveness / context sample. {@code recordedAt} is strictly
 * increasing per session.
 */
@Entity
@Table(name = "biometric_events")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BiometricEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 20, nullable = false, updatable = false)
    private BiometricKind kind;

    /** JSONB column — stored as raw JSON string. */
    @Column(name = "payload", columnDefinition = "JSONB", updatable = false)
    private String payload;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
