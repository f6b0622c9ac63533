package com.yoursp.vkyc.modules.biometric;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.vkyc.config.VkycProperties;
import com.yoursp.vkyc.model.entity.BiometricEvent;
import com.yoursp.vkyc.model.enums.BiometricKind;
import com.yoursp.vkyc.repository.BiometricEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BiometricLoggerTest {

    @Mock
    private BiometricEventRepository eventRepository;

    private final List<BiometricEvent> saved = new ArrayList<>();
    private final List<Runnable> queued = new ArrayList<>();
    private final Clock fixedClock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final UUID sessionId = UUID.randomUUID();
    private VkycProperties properties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new VkycProperties();
        meterRegistry = new SimpleMeterRegistry();
        lenient().when(eventRepository.save(any(BiometricEvent.class))).thenAnswer(inv -> {
            BiometricEvent event = inv.getArgument(0);
            saved.add(event);
            return event;
        });
    }

    private BiometricLogger logger(Executor executor) {
        return new BiometricLogger(eventRepository, new ObjectMapper(), properties, fixedClock, executor,
                meterRegistry);
    }

    @Test
    @DisplayName("Timestamps stay strictly increasing even when the clock does not move")
    void strictlyIncreasingStamps() {
        BiometricLogger logger = logger(Runnable::run);

        for (int i = 0; i < 5; i++) {
            logger.append(sessionId, BiometricKind.HEAD_POSE, Map.of("yaw", i));
        }

        assertEquals(5, saved.size());
        for (int i = 1; i < saved.size(); i++) {
            assertTrue(saved.get(i).getRecordedAt().isAfter(saved.get(i - 1).getRecordedAt()),
                    "recordedAt must increase at index " + i);
        }
        assertEquals(sessionId, saved.get(0).getSessionId());
        assertTrue(saved.get(0).getPayload().contains("yaw"));
    }

    @Test
    @DisplayName("Sessions are stamped independently")
    void stampsPerSession() {
        BiometricLogger logger = logger(Runnable::run);
        UUID other = UUID.randomUUID();

        logger.append(sessionId, BiometricKind.BLINK, null);
        logger.append(other, BiometricKind.BLINK, null);

        assertEquals(saved.get(0).getRecordedAt(), saved.get(1).getRecordedAt());
        assertEquals("{}", saved.get(0).getPayload());
    }

    @Test
    @DisplayName("Full buffer drops the oldest events and counts them")
    void dropsOldestWhenFull() {
        properties.getBiometric().setBufferCapacity(3);
        BiometricLogger logger = logger(queued::add);

        for (int i = 0; i < 5; i++) {
            logger.append(sessionId, BiometricKind.HEAD_POSE, Map.of("seq", i));
        }

        assertEquals(3, logger.getBufferedCount());
        assertEquals(2, logger.getDroppedCount());
        assertEquals(2.0, meterRegistry.get("vkyc.biometric.dropped").gauge().value());

        queued.remove(0).run();

        assertEquals(3, saved.size());
        assertTrue(saved.get(0).getPayload().contains("\"seq\":2"));
        assertTrue(saved.get(2).getPayload().contains("\"seq\":4"));
        assertEquals(0, logger.getBufferedCount());
    }

    @Test
    @DisplayName("append never waits for the sink")
    void appendDoesNotRunSink() {
        BiometricLogger logger = logger(queued::add);

        logger.append(sessionId, BiometricKind.GEO_SAMPLE, Map.of("lat", 12.9));

        verifyNoInteractions(eventRepository);
        assertEquals(1, queued.size());
        assertEquals(1, logger.getBufferedCount());
    }

    @Test
    @DisplayName("Sink failure keeps events buffered for the next flush")
    void sinkFailureKeepsEvents() {
        BiometricLogger logger = logger(Runnable::run);
        doThrow(new DataAccessResourceFailureException("db down"))
                .when(eventRepository).save(any(BiometricEvent.class));

        logger.append(sessionId, BiometricKind.IP_SAMPLE, Map.of("ip", "10.0.0.1"));
        logger.append(sessionId, BiometricKind.IP_SAMPLE, Map.of("ip", "10.0.0.2"));

        assertEquals(2, logger.getBufferedCount());

        doAnswer(inv -> {
            saved.add(inv.getArgument(0));
            return inv.getArgument(0);
        }).when(eventRepository).save(any(BiometricEvent.class));
        logger.flushPending();

        assertEquals(0, logger.getBufferedCount());
        assertEquals(2, saved.size());
        assertTrue(saved.get(0).getPayload().contains("10.0.0.1"));
    }

    @Test
    @DisplayName("Liveness passes after the configured number of blinks")
    void livenessFromBlinks() {
        properties.getBiometric().setMinBlinks(2);
        BiometricLogger logger = logger(queued::add);

        logger.append(sessionId, BiometricKind.HEAD_POSE, Map.of());
        logger.append(sessionId, BiometricKind.BLINK, Map.of());
        assertFalse(logger.hasPassedLiveness(sessionId));

        logger.append(sessionId, BiometricKind.BLINK, Map.of("count", 3));
        assertTrue(logger.hasPassedLiveness(sessionId));
        assertEquals(4, logger.blinkCount(sessionId));
    }

    @Test
    @DisplayName("release forgets the session but keeps its buffered events")
    void releaseKeepsBufferedEvents() {
        BiometricLogger logger = logger(queued::add);
        logger.append(sessionId, BiometricKind.BLINK, null);

        logger.release(sessionId);

        assertFalse(logger.hasPassedLiveness(sessionId));
        assertEquals(1, logger.getBufferedCount());
    }
}
