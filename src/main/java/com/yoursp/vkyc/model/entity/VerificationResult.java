package com.yoursp.vkyc.model.entity;

import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.RegistryStatus;
import com.yoursp.vkyc.model.enums.VerificationStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "verification_results", uniqueConstraints = @UniqueConstraint(columnNames = { "session_id",
        "document_type" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VerificationResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", length = 20, nullable = false)
    private DocumentType documentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 30)
    private VerificationStatus status;

    /** JSONB column — extracted OCR fields, stored as raw JSON string. */
    @Column(name = "extracted_fields", columnDefinition = "JSONB")
    private String extractedFields;

    @Column(name = "ocr_confidence")
    private Double ocrConfidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "registry_status", length = 20)
    private RegistryStatus registryStatus;

    @Column(name = "failure_reason", length = 40)
    private String failureReason;

    /** Frames submitted for this document. */
    @Column(name = "attempt_count")
    private int attemptCount;

    /** Frames whose OCR was unusable; bounded by the OCR attempt limit. */
    @Column(name = "ocr_failure_count")
    private int ocrFailureCount;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = OffsetDateTime.now();
        if (status == null)
            status = VerificationStatus.PENDING;
    }
}
