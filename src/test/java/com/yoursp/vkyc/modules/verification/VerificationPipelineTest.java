package com.yoursp.vkyc.modules.verification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.vkyc.config.VkycProperties;
import com.yoursp.vkyc.model.entity.VerificationResult;
import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.RegistryStatus;
import com.yoursp.vkyc.model.enums.VerificationStatus;
import com.yoursp.vkyc.modules.verification.exception.OcrUnavailableException;
import com.yoursp.vkyc.modules.verification.exception.RegistryTransientException;
import com.yoursp.vkyc.modules.verification.exception.VerificationBusyException;
import com.yoursp.vkyc.repository.VerificationResultRepository;
import com.yoursp.vkyc.service.OperationalAlertService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VerificationPipelineTest {

    private static final Map<String, String> PAN_FIELDS = Map.of("pan_number", "ABCDE1234F", "name", "ASHA RAO");

    @Mock
    private OcrClient ocrClient;
    @Mock
    private RegistryClient registryClient;
    @Mock
    private VerificationResultRepository resultRepository;
    @Mock
    private OperationalAlertService alertService;

    private final List<VerificationResult> stored = new ArrayList<>();
    private final List<VerificationOutcome> outcomes = new ArrayList<>();
    private final List<Runnable> queued = new ArrayList<>();
    private final UUID sessionId = UUID.randomUUID();
    private VkycProperties properties;

    @BeforeEach
    void setUp() {
        properties = new VkycProperties();
        properties.getVerification().setRegistryInitialBackoff(Duration.ofMillis(1));

        lenient().when(resultRepository.save(any(VerificationResult.class))).thenAnswer(inv -> {
            VerificationResult result = inv.getArgument(0);
            if (!stored.contains(result)) {
                stored.add(result);
            }
            return result;
        });
        lenient().when(resultRepository.findBySessionIdAndDocumentType(any(UUID.class), any(DocumentType.class)))
                .thenAnswer(inv -> stored.stream()
                        .filter(r -> r.getSessionId().equals(inv.getArgument(0))
                                && r.getDocumentType() == inv.getArgument(1))
                        .findFirst());
    }

    private VerificationPipeline pipeline(Executor executor) {
        return new VerificationPipeline(ocrClient, registryClient, resultRepository, alertService,
                new ObjectMapper(), properties, executor);
    }

    private VerificationPipeline directPipeline() {
        return pipeline(Runnable::run);
    }

    private CaptureFrame frame(DocumentType doc) {
        return new CaptureFrame(sessionId, doc, new byte[] { 7, 7, 7 }, Instant.now());
    }

    private VerificationOutcome last() {
        return outcomes.get(outcomes.size() - 1);
    }

    // ================================================================
    // OCR
    // ================================================================

    @Test
    @DisplayName("Three low-confidence reads end in FAILED / LOW_CONFIDENCE")
    void lowConfidenceExhaustsAttempts() {
        when(ocrClient.extract(any(), eq(DocumentType.PAN))).thenReturn(new OcrResult(PAN_FIELDS, 0.4));
        VerificationPipeline pipeline = directPipeline();

        pipeline.submit(frame(DocumentType.PAN), outcomes::add);
        assertEquals(VerificationStatus.RECAPTURE_REQUESTED, last().status());
        assertEquals(1, last().attempts());

        pipeline.submit(frame(DocumentType.PAN), outcomes::add);
        assertEquals(VerificationStatus.RECAPTURE_REQUESTED, last().status());

        pipeline.submit(frame(DocumentType.PAN), outcomes::add);
        assertEquals(VerificationStatus.FAILED, last().status());
        assertEquals(VerificationFailure.LOW_CONFIDENCE, last().failure());
        assertEquals(3, last().attempts());
        assertEquals(0.4, last().confidence());

        verifyNoInteractions(registryClient);
        assertEquals(1, stored.size());
        assertEquals(VerificationStatus.FAILED, stored.get(0).getStatus());
    }

    @Test
    @DisplayName("OCR failure counts as an attempt and asks for a re-capture")
    void ocrUnavailableCountsAsAttempt() {
        when(ocrClient.extract(any(), any())).thenThrow(new OcrUnavailableException("timeout"));

        directPipeline().submit(frame(DocumentType.AADHAAR), outcomes::add);

        assertEquals(VerificationStatus.RECAPTURE_REQUESTED, last().status());
        assertEquals(VerificationFailure.OCR_UNAVAILABLE, last().failure());
        assertEquals(1, stored.get(0).getAttemptCount());
        assertNull(stored.get(0).getOcrConfidence());
        verifyNoInteractions(registryClient);
    }

    @Test
    @DisplayName("Readable frames answered UNAVAILABLE do not use up OCR re-captures")
    void unavailableFramesDoNotCountAgainstOcrLimit() {
        when(ocrClient.extract(any(), any()))
                .thenReturn(new OcrResult(PAN_FIELDS, 0.9))
                .thenReturn(new OcrResult(PAN_FIELDS, 0.9))
                .thenReturn(new OcrResult(PAN_FIELDS, 0.9))
                .thenReturn(new OcrResult(PAN_FIELDS, 0.4));
        when(registryClient.verify(anyMap(), any())).thenThrow(new RegistryTransientException("timeout"));
        VerificationPipeline pipeline = directPipeline();

        for (int i = 0; i < 3; i++) {
            pipeline.submit(frame(DocumentType.PAN), outcomes::add);
            assertEquals(VerificationStatus.UNAVAILABLE, last().status());
        }
        pipeline.submit(frame(DocumentType.PAN), outcomes::add);

        assertEquals(VerificationStatus.RECAPTURE_REQUESTED, last().status());
        assertEquals(VerificationFailure.LOW_CONFIDENCE, last().failure());
        assertEquals(4, last().attempts());
        assertEquals(1, stored.get(0).getOcrFailureCount());
    }

    @Test
    @DisplayName("Front and back Aadhaar frames update one result row, the later side decides")
    void aadhaarSidesShareOneRow() {
        when(ocrClient.extract(any(), eq(DocumentType.AADHAAR)))
                .thenReturn(new OcrResult(Map.of("aadhaar_number", "123412341234"), 0.9));
        when(registryClient.verify(anyMap(), eq(DocumentType.AADHAAR)))
                .thenReturn(RegistryStatus.MISMATCHED)
                .thenReturn(RegistryStatus.MATCHED);
        VerificationPipeline pipeline = directPipeline();

        pipeline.submit(frame(DocumentType.fromClientValue("aadhaar_front")), outcomes::add);
        pipeline.submit(frame(DocumentType.fromClientValue("aadhaar_back")), outcomes::add);

        assertEquals(1, stored.size());
        assertEquals(2, stored.get(0).getAttemptCount());
        assertEquals(VerificationStatus.MATCHED, stored.get(0).getStatus());
    }

    // ================================================================
    // Registry
    // ================================================================

    @Test
    @DisplayName("Readable document matched by the registry")
    void matched() {
        when(ocrClient.extract(any(), any())).thenReturn(new OcrResult(PAN_FIELDS, 0.9));
        when(registryClient.verify(PAN_FIELDS, DocumentType.PAN)).thenReturn(RegistryStatus.MATCHED);

        directPipeline().submit(frame(DocumentType.PAN), outcomes::add);

        assertEquals(VerificationStatus.MATCHED, last().status());
        assertNull(last().failure());
        assertEquals(PAN_FIELDS, last().fields());
        assertEquals(RegistryStatus.MATCHED, stored.get(0).getRegistryStatus());
        assertNotNull(stored.get(0).getExtractedFields());
        assertTrue(stored.get(0).getExtractedFields().contains("ABCDE1234F"));
    }

    @Test
    @DisplayName("Registry timing out on every call ends UNAVAILABLE after exactly two calls")
    void registryUnavailableAfterRetries() {
        when(ocrClient.extract(any(), any())).thenReturn(new OcrResult(PAN_FIELDS, 0.9));
        when(registryClient.verify(anyMap(), any())).thenThrow(new RegistryTransientException("timeout"));

        directPipeline().submit(frame(DocumentType.PAN), outcomes::add);

        assertEquals(VerificationStatus.UNAVAILABLE, last().status());
        verify(registryClient, times(2)).verify(anyMap(), any());
        verify(alertService).raise(eq("REGISTRY_UNAVAILABLE"), eq(sessionId), anyMap());
        assertEquals(RegistryStatus.UNAVAILABLE, stored.get(0).getRegistryStatus());
    }

    @Test
    @DisplayName("A transient failure followed by a match is retried to MATCHED")
    void transientThenMatched() {
        when(ocrClient.extract(any(), any())).thenReturn(new OcrResult(PAN_FIELDS, 0.9));
        when(registryClient.verify(anyMap(), any()))
                .thenThrow(new RegistryTransientException("503"))
                .thenReturn(RegistryStatus.MATCHED);

        directPipeline().submit(frame(DocumentType.PAN), outcomes::add);

        assertEquals(VerificationStatus.MATCHED, last().status());
        verify(registryClient, times(2)).verify(anyMap(), any());
        verifyNoInteractions(alertService);
    }

    @Test
    @DisplayName("MISMATCHED is final and never retried")
    void mismatchNotRetried() {
        when(ocrClient.extract(any(), any())).thenReturn(new OcrResult(PAN_FIELDS, 0.9));
        when(registryClient.verify(anyMap(), any())).thenReturn(RegistryStatus.MISMATCHED);

        directPipeline().submit(frame(DocumentType.PAN), outcomes::add);

        assertEquals(VerificationStatus.MISMATCHED, last().status());
        assertEquals(VerificationFailure.REGISTRY_MISMATCH, last().failure());
        verify(registryClient, times(1)).verify(anyMap(), any());
    }

    @Test
    @DisplayName("Single registry attempt configured: one call, no retry")
    void singleAttemptConfigured() {
        properties.getVerification().setRegistryMaxAttempts(1);
        when(ocrClient.extract(any(), any())).thenReturn(new OcrResult(PAN_FIELDS, 0.9));
        when(registryClient.verify(anyMap(), any())).thenThrow(new RegistryTransientException("timeout"));

        directPipeline().submit(frame(DocumentType.PAN), outcomes::add);

        assertEquals(VerificationStatus.UNAVAILABLE, last().status());
        verify(registryClient, times(1)).verify(anyMap(), any());
    }

    // ================================================================
    // Concurrency
    // ================================================================

    @Test
    @DisplayName("A second frame for the same document while one is in flight is refused")
    void busyWhileInFlight() {
        VerificationPipeline pipeline = pipeline(queued::add);

        pipeline.submit(frame(DocumentType.PAN), outcomes::add);

        assertTrue(pipeline.isInFlight(sessionId, DocumentType.PAN));
        assertThrows(VerificationBusyException.class,
                () -> pipeline.submit(frame(DocumentType.PAN), outcomes::add));
        assertDoesNotThrow(() -> pipeline.submit(frame(DocumentType.AADHAAR), outcomes::add));
        assertEquals(2, queued.size());
    }

    @Test
    @DisplayName("Slot frees once the attempt finishes")
    void slotReleasedAfterCompletion() {
        when(ocrClient.extract(any(), any())).thenReturn(new OcrResult(PAN_FIELDS, 0.4));
        VerificationPipeline pipeline = pipeline(queued::add);

        pipeline.submit(frame(DocumentType.PAN), outcomes::add);
        queued.remove(0).run();

        assertFalse(pipeline.isInFlight(sessionId, DocumentType.PAN));
        assertDoesNotThrow(() -> pipeline.submit(frame(DocumentType.PAN), outcomes::add));
    }

    @Test
    @DisplayName("Cancelled session: running attempt finishes but its result is dropped")
    void cancellationDropsCallback() {
        when(ocrClient.extract(any(), any())).thenReturn(new OcrResult(PAN_FIELDS, 0.9));
        when(registryClient.verify(anyMap(), any())).thenReturn(RegistryStatus.MATCHED);
        VerificationPipeline pipeline = pipeline(queued::add);

        pipeline.submit(frame(DocumentType.PAN), outcomes::add);
        pipeline.cancel(sessionId);
        queued.remove(0).run();

        assertTrue(outcomes.isEmpty());
        assertFalse(pipeline.hasInFlight(sessionId));
    }

    @Test
    @DisplayName("Cancelling before registry retries start stops them")
    void cancellationStopsRetries() {
        when(ocrClient.extract(any(), any())).thenReturn(new OcrResult(PAN_FIELDS, 0.9));
        VerificationPipeline pipeline = pipeline(queued::add);
        when(registryClient.verify(anyMap(), any())).thenAnswer(inv -> {
            pipeline.cancel(sessionId);
            throw new RegistryTransientException("timeout");
        });

        pipeline.submit(frame(DocumentType.PAN), outcomes::add);
        queued.remove(0).run();

        verify(registryClient, times(1)).verify(anyMap(), any());
        assertTrue(outcomes.isEmpty());
    }

    @Test
    @DisplayName("Rejected by a saturated executor: reported busy, slot released")
    void saturatedExecutor() {
        VerificationPipeline pipeline = pipeline(task -> {
            throw new RejectedExecutionException("full");
        });

        assertThrows(VerificationBusyException.class,
                () -> pipeline.submit(frame(DocumentType.PAN), outcomes::add));
        assertFalse(pipeline.isInFlight(sessionId, DocumentType.PAN));
    }
}
