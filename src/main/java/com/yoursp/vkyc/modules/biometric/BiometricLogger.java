package com.yoursp.vkyc.modules.biometric;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.vkyc.config.VkycProperties;
import com.yoursp.vkyc.model.entity.BiometricEvent;
import com.yoursp.vkyc.model.enums.BiometricKind;
import com.yoursp.vkyc.repository.BiometricEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort audit of liveness and context signals.
 * <p>
 * {@link #append} never blocks the signaling thread: events are stamped, queued
 * in a bounded buffer and written by a single background drainer. While the
 * repository is down the buffer fills up; past its capacity the oldest events
 * are dropped and counted ({@code vkyc.biometric.dropped}).
 * </p>
 */
@SuppressWarnings("null")
@Slf4j
@Service
public class BiometricLogger {

    private final BiometricEventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final VkycProperties properties;
    private final Clock clock;
    private final Executor executor;

    private final Deque<BiometricEvent> buffer = new ArrayDeque<>();
    private final Map<UUID, Instant> lastStamp = new ConcurrentHashMap<>();
    private final Map<UUID, AtomicInteger> blinkCounts = new ConcurrentHashMap<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    public BiometricLogger(BiometricEventRepository eventRepository,
            ObjectMapper objectMapper,
            VkycProperties properties,
            Clock clock,
            @Qualifier("biometricExecutor") Executor executor,
            MeterRegistry meterRegistry) {
        this.eventRepository = eventRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
        Gauge.builder("vkyc.biometric.dropped", dropped, AtomicLong::get)
                .description("Biometric events dropped because the buffer was full")
                .register(meterRegistry);
        Gauge.builder("vkyc.biometric.buffered", this, BiometricLogger::getBufferedCount)
                .register(meterRegistry);
    }

    /**
     * Queue an event for the session's audit trail. Returns immediately.
     */
    public void append(UUID sessionId, BiometricKind kind, Map<String, Object> payload) {
        if (kind == BiometricKind.BLINK) {
            blinkCounts.computeIfAbsent(sessionId, id -> new AtomicInteger()).addAndGet(blinkIncrement(payload));
        }

        BiometricEvent event = BiometricEvent.builder()
                .sessionId(sessionId)
                .kind(kind)
                .payload(toJson(payload))
                .recordedAt(nextStamp(sessionId))
                .build();

        int capacity = Math.max(1, properties.getBiometric().getBufferCapacity());
        synchronized (buffer) {
            buffer.addLast(event);
            while (buffer.size() > capacity) {
                buffer.pollFirst();
                long total = dropped.incrementAndGet();
                if (total == 1 || total % 100 == 0) {
                    log.warn("Biometric buffer full, dropping oldest events: dropped={}", total);
                }
            }
        }
        scheduleDrain();
    }

    /**
     * Liveness passes once the session has shown at least {@code minBlinks} blinks.
     */
    public boolean hasPassedLiveness(UUID sessionId) {
        AtomicInteger blinks = blinkCounts.get(sessionId);
        return blinks != null && blinks.get() >= properties.getBiometric().getMinBlinks();
    }

    public int blinkCount(UUID sessionId) {
        AtomicInteger blinks = blinkCounts.get(sessionId);
        return blinks != null ? blinks.get() : 0;
    }

    /**
     * Drop per-session bookkeeping once the session has ended. Buffered events
     * are still written.
     */
    public void release(UUID sessionId) {
        lastStamp.remove(sessionId);
        blinkCounts.remove(sessionId);
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getBufferedCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    /**
     * Retry the sink periodically in case it came back while the call was quiet.
     */
    @Scheduled(fixedDelay = 5_000)
    public void flushPending() {
        if (getBufferedCount() > 0) {
            scheduleDrain();
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Biometric drain not scheduled: {}", e.getMessage());
        }
    }

    private void drain() {
        try {
            while (true) {
                BiometricEvent next;
                synchronized (buffer) {
                    next = buffer.peekFirst();
                }
                if (next == null) {
                    return;
                }
                try {
                    eventRepository.save(next);
                } catch (RuntimeException e) {
                    log.warn("Biometric sink unavailable, keeping {} event(s) buffered: {}",
                            getBufferedCount(), e.getMessage());
                    return;
                }
                synchronized (buffer) {
                    // Only remove what was written; the head may have been dropped meanwhile
                    if (buffer.peekFirst() == next) {
                        buffer.pollFirst();
                    }
                }
            }
        } finally {
            draining.set(false);
        }
    }

    /**
     * Strictly increasing per session, even when the clock repeats or steps back.
     */
    private Instant nextStamp(UUID sessionId) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        return lastStamp.compute(sessionId, (id, previous) -> previous == null || now.isAfter(previous)
                ? now
                : previous.plus(1, ChronoUnit.MICROS));
    }

    private int blinkIncrement(Map<String, Object> payload) {
        if (payload != null && payload.get("count") instanceof Number count) {
            return Math.max(0, count.intValue());
        }
        return 1;
    }

    private String toJson(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Unserializable biometric payload: {}", e.getMessage());
            return "{}";
        }
    }
}
