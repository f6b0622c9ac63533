package com.yoursp.vkyc.model.entity;

import com.yoursp.vkyc.model.enums.RecordingState;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "recordings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Recording {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", unique = true, nullable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 20)
    private RecordingState state;

    @Column(name = "buffered_millis")
    private long bufferedMillis;

    @Column(name = "cap_reached")
    private boolean capReached;

    @Column(name = "storage_key", columnDefinition = "TEXT")
    private String storageKey;

    @Column(name = "failure_message", columnDefinition = "TEXT")
    private String failureMessage;

    @Column(name = "started_at", updatable = false)
    private OffsetDateTime startedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;

    @PrePersist
    protected void onCreate() {
        if (startedAt == null)
            startedAt = OffsetDateTime.now();
        if (state == null)
            state = RecordingState.BUFFERING;
    }
}
