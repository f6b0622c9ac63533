package com.yoursp.vkyc.modules.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.vkyc.config.VkycProperties;
import com.yoursp.vkyc.model.entity.VerificationResult;
import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.RegistryStatus;
import com.yoursp.vkyc.model.enums.VerificationStatus;
import com.yoursp.vkyc.modules.verification.exception.OcrUnavailableException;
import com.yoursp.vkyc.modules.verification.exception.RegistryTransientException;
import com.yoursp.vkyc.modules.verification.exception.VerificationBusyException;
import com.yoursp.vkyc.modules.verification.exception.VerificationCancelledException;
import com.yoursp.vkyc.repository.VerificationResultRepository;
import com.yoursp.vkyc.service.OperationalAlertService;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Runs OCR and then registry verification for captured frames.
 * <ul>
 * <li>At most one attempt in flight per (session, document type)</li>
 * <li>OCR below the confidence threshold asks for a re-capture, up to the
 * configured attempt count; only unusable OCR reads count against it</li>
 * <li>Registry calls are retried with exponential backoff on transient failures
 * only; MISMATCHED is final</li>
 * <li>Registry still unreachable after the last retry: UNAVAILABLE, surfaced to
 * operators</li>
 * </ul>
 * All external calls run on {@code verificationExecutor}; {@link #submit} only
 * hands the frame over.
 */
@SuppressWarnings("null")
@Slf4j
@Service
public class VerificationPipeline {

    private final OcrClient ocrClient;
    private final RegistryClient registryClient;
    private final VerificationResultRepository resultRepository;
    private final OperationalAlertService alertService;
    private final ObjectMapper objectMapper;
    private final VkycProperties properties;
    private final Executor executor;

    private final Set<InFlightKey> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<UUID> cancelled = ConcurrentHashMap.newKeySet();

    public VerificationPipeline(OcrClient ocrClient,
            RegistryClient registryClient,
            VerificationResultRepository resultRepository,
            OperationalAlertService alertService,
            ObjectMapper objectMapper,
            VkycProperties properties,
            @Qualifier("verificationExecutor") Executor executor) {
        this.ocrClient = ocrClient;
        this.registryClient = registryClient;
        this.resultRepository = resultRepository;
        this.alertService = alertService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Accept a frame for asynchronous processing.
     *
     * @param frame      the captured document image
     * @param onComplete receives the outcome, unless the session was cancelled
     *                   meanwhile
     * @throws VerificationBusyException if an attempt for the same document is
     *                                   still running
     */
    public void submit(CaptureFrame frame, Consumer<VerificationOutcome> onComplete) {
        InFlightKey key = new InFlightKey(frame.sessionId(), frame.documentType());
        if (!inFlight.add(key)) {
            throw new VerificationBusyException(frame.sessionId(), frame.documentType(),
                    frame.documentType() + " verification already in progress");
        }
        try {
            executor.execute(() -> process(frame, key, onComplete));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            log.warn("Verification executor saturated: sessionId={}, doc={}", frame.sessionId(),
                    frame.documentType());
            throw new VerificationBusyException(frame.sessionId(), frame.documentType(),
                    "Verification capacity exhausted, retry shortly");
        }
        log.debug("Frame accepted: sessionId={}, doc={}", frame.sessionId(), frame.documentType());
    }

    /**
     * Cooperative cancellation: running calls finish, their results are dropped
     * and no further registry retries start.
     */
    public void cancel(UUID sessionId) {
        cancelled.add(sessionId);
        if (!hasInFlight(sessionId)) {
            cancelled.remove(sessionId);
        }
        log.debug("Verification cancelled: sessionId={}", sessionId);
    }

    public boolean isInFlight(UUID sessionId, DocumentType documentType) {
        return inFlight.contains(new InFlightKey(sessionId, documentType));
    }

    public boolean hasInFlight(UUID sessionId) {
        return inFlight.stream().anyMatch(k -> k.sessionId().equals(sessionId));
    }

    private void process(CaptureFrame frame, InFlightKey key, Consumer<VerificationOutcome> onComplete) {
        try {
            VerificationOutcome outcome = runAttempt(frame);
            if (cancelled.contains(frame.sessionId())) {
                log.info("Discarding verification result for cancelled session: sessionId={}, doc={}",
                        frame.sessionId(), frame.documentType());
                return;
            }
            onComplete.accept(outcome);
        } catch (VerificationCancelledException e) {
            log.info("Verification stopped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Verification failed unexpectedly: sessionId={}, doc={}, error={}",
                    frame.sessionId(), frame.documentType(), e.getMessage(), e);
        } finally {
            inFlight.remove(key);
            if (cancelled.contains(frame.sessionId()) && !hasInFlight(frame.sessionId())) {
                cancelled.remove(frame.sessionId());
            }
        }
    }

    private VerificationOutcome runAttempt(CaptureFrame frame) {
        VkycProperties.Verification config = properties.getVerification();
        VerificationResult record = resultRepository
                .findBySessionIdAndDocumentType(frame.sessionId(), frame.documentType())
                .orElseGet(() -> VerificationResult.builder()
                        .sessionId(frame.sessionId())
                        .documentType(frame.documentType())
                        .build());
        record.setAttemptCount(record.getAttemptCount() + 1);
        record.setStatus(VerificationStatus.PENDING);
        record.setFailureReason(null);
        record = resultRepository.save(record);
        int attempt = record.getAttemptCount();

        // ── OCR ──
        OcrResult ocr = null;
        try {
            ocr = ocrClient.extract(frame.image(), frame.documentType());
        } catch (OcrUnavailableException e) {
            log.warn("OCR failed: sessionId={}, doc={}, attempt={}, error={}",
                    frame.sessionId(), frame.documentType(), attempt, e.getMessage());
        }

        if (ocr == null || ocr.confidence() < config.getOcrConfidenceThreshold()) {
            VerificationFailure failure = ocr == null
                    ? VerificationFailure.OCR_UNAVAILABLE
                    : VerificationFailure.LOW_CONFIDENCE;
            record.setOcrConfidence(ocr != null ? ocr.confidence() : null);
            record.setOcrFailureCount(record.getOcrFailureCount() + 1);
            int ocrFailures = record.getOcrFailureCount();
            boolean exhausted = ocrFailures >= config.getOcrMaxAttempts();
            record.setStatus(exhausted ? VerificationStatus.FAILED : VerificationStatus.RECAPTURE_REQUESTED);
            record.setFailureReason(failure.name());
            resultRepository.save(record);

            log.info("OCR not usable: sessionId={}, doc={}, ocrFailures={}/{}, confidence={}, exhausted={}",
                    frame.sessionId(), frame.documentType(), ocrFailures, config.getOcrMaxAttempts(),
                    ocr != null ? ocr.confidence() : null, exhausted);
            return outcome(record, failure, ocr);
        }

        record.setOcrConfidence(ocr.confidence());
        record.setExtractedFields(toJson(ocr.fields()));
        resultRepository.save(record);

        // ── Registry ──
        RegistryStatus registryStatus = verifyWithRetry(frame.sessionId(), ocr.fields(), frame.documentType());
        record.setRegistryStatus(registryStatus);
        VerificationFailure failure = null;
        switch (registryStatus) {
            case MATCHED -> record.setStatus(VerificationStatus.MATCHED);
            case MISMATCHED -> {
                record.setStatus(VerificationStatus.MISMATCHED);
                failure = VerificationFailure.REGISTRY_MISMATCH;
                record.setFailureReason(failure.name());
            }
            case UNAVAILABLE -> {
                record.setStatus(VerificationStatus.UNAVAILABLE);
                alertService.raise("REGISTRY_UNAVAILABLE", frame.sessionId(), Map.of(
                        "documentType", frame.documentType().name(),
                        "attempts", config.getRegistryMaxAttempts()));
            }
        }
        resultRepository.save(record);

        log.info("Registry verification finished: sessionId={}, doc={}, status={}",
                frame.sessionId(), frame.documentType(), registryStatus);
        return outcome(record, failure, ocr);
    }

    private RegistryStatus verifyWithRetry(UUID sessionId, Map<String, String> fields, DocumentType documentType) {
        VkycProperties.Verification config = properties.getVerification();
        RetryConfig retryConfig = RetryConfig.<RegistryStatus>custom()
                .maxAttempts(Math.max(1, config.getRegistryMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        config.getRegistryInitialBackoff(), config.getRegistryBackoffMultiplier()))
                .retryExceptions(RegistryTransientException.class)
                .retryOnResult(status -> status == RegistryStatus.UNAVAILABLE)
                .build();
        Retry retry = Retry.of("registry-" + sessionId + "-" + documentType, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Registry retry: sessionId={}, doc={}, attempt={}, wait={}ms, cause={}",
                sessionId, documentType, event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "UNAVAILABLE"));

        try {
            return retry.executeSupplier(() -> {
                if (cancelled.contains(sessionId)) {
                    throw new VerificationCancelledException(sessionId);
                }
                return registryClient.verify(fields, documentType);
            });
        } catch (RegistryTransientException e) {
            log.warn("Registry unreachable after {} attempt(s): sessionId={}, doc={}",
                    config.getRegistryMaxAttempts(), sessionId, documentType);
            return RegistryStatus.UNAVAILABLE;
        }
    }

    private VerificationOutcome outcome(VerificationResult record, VerificationFailure failure, OcrResult ocr) {
        return new VerificationOutcome(
                record.getSessionId(),
                record.getDocumentType(),
                record.getStatus(),
                failure,
                ocr != null ? ocr.fields() : Map.of(),
                record.getOcrConfidence(),
                record.getAttemptCount());
    }

    private String toJson(Map<String, String> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize OCR fields: {}", e.getMessage());
            return null;
        }
    }

    private record InFlightKey(UUID sessionId, DocumentType documentType) {
    }
}
