package com.yoursp.vkyc.modules.recording;

import com.yoursp.vkyc.config.VkycProperties;
import com.yoursp.vkyc.model.entity.Recording;
import com.yoursp.vkyc.model.enums.RecordingState;
import com.yoursp.vkyc.modules.session.event.SessionStartedEvent;
import com.yoursp.vkyc.modules.session.event.SessionTerminatedEvent;
import com.yoursp.vkyc.service.AuditService;
import com.yoursp.vkyc.service.OperationalAlertService;
import com.yoursp.vkyc.service.storage.StorageService;
import com.yoursp.vkyc.repository.RecordingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Buffers a session's media and turns it into a compressed artifact.
 * <ul>
 * <li>Starts on {@link SessionStartedEvent}, finalizes on
 * {@link SessionTerminatedEvent}</li>
 * <li>The buffered duration never exceeds the cap: a chunk that would cross it
 * is refused and the recording is finalized at once, whatever the session
 * state</li>
 * <li>Hitting the cap publishes {@link CapReachedEvent}</li>
 * <li>Compression failure marks the recording FAILED and alerts operators; the
 * verification outcome is untouched</li>
 * </ul>
 */
@SuppressWarnings("null")
@Slf4j
@Service
public class RecordingManager {

    private static final DateTimeFormatter KEY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final RecordingRepository recordingRepository;
    private final StorageService storageService;
    private final MediaCodec mediaCodec;
    private final AuditService auditService;
    private final OperationalAlertService alertService;
    private final ApplicationEventPublisher eventPublisher;
    private final VkycProperties properties;
    private final Clock clock;
    private final Executor codecExecutor;

    private final Map<UUID, RecordingBuffer> active = new ConcurrentHashMap<>();

    public RecordingManager(RecordingRepository recordingRepository,
            StorageService storageService,
            MediaCodec mediaCodec,
            AuditService auditService,
            OperationalAlertService alertService,
            ApplicationEventPublisher eventPublisher,
            VkycProperties properties,
            Clock clock,
            @Qualifier("codecExecutor") Executor codecExecutor) {
        this.recordingRepository = recordingRepository;
        this.storageService = storageService;
        this.mediaCodec = mediaCodec;
        this.auditService = auditService;
        this.alertService = alertService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.codecExecutor = codecExecutor;
    }

    @EventListener
    public void onSessionStarted(SessionStartedEvent event) {
        start(event.sessionId());
    }

    @EventListener
    public void onSessionTerminated(SessionTerminatedEvent event) {
        finish(event.sessionId());
    }

    /**
     * Begin buffering. Starting twice is a no-op.
     */
    public void start(UUID sessionId) {
        if (active.containsKey(sessionId) || recordingRepository.findBySessionId(sessionId).isPresent()) {
            log.debug("Recording already started: sessionId={}", sessionId);
            return;
        }

        Path spool = Paths.get(properties.getRecording().getSpoolDirectory(), sessionId + ".part");
        RecordingBuffer buffer;
        try {
            buffer = new RecordingBuffer(sessionId, spool, clock.instant());
        } catch (IOException e) {
            log.error("Cannot open recording spool: sessionId={}, path={}", sessionId, spool, e);
            recordingRepository.save(Recording.builder()
                    .sessionId(sessionId)
                    .state(RecordingState.FAILED)
                    .failureMessage("Spool unavailable: " + e.getMessage())
                    .startedAt(now())
                    .finishedAt(now())
                    .build());
            eventPublisher.publishEvent(new RecordingFailedEvent(sessionId, e.getMessage()));
            return;
        }

        recordingRepository.save(Recording.builder()
                .sessionId(sessionId)
                .state(RecordingState.BUFFERING)
                .startedAt(now())
                .build());
        active.put(sessionId, buffer);
        log.info("Recording started: sessionId={}, cap={}s", sessionId, capMillis() / 1000);
    }

    /**
     * Buffer one media chunk delivered by the transport.
     *
     * @param durationMillis media time covered by the chunk
     */
    public ChunkResult onChunk(UUID sessionId, byte[] data, long durationMillis) {
        if (durationMillis < 0) {
            throw new IllegalArgumentException("Chunk duration must not be negative");
        }
        RecordingBuffer buffer = active.get(sessionId);
        if (buffer == null) {
            return ChunkResult.REJECTED_NOT_BUFFERING;
        }

        ChunkResult result;
        synchronized (buffer) {
            if (!buffer.isBuffering()) {
                return ChunkResult.REJECTED_NOT_BUFFERING;
            }
            long cap = capMillis();
            if (buffer.getBufferedMillis() + durationMillis > cap || wallClockElapsed(buffer) >= cap) {
                result = ChunkResult.REJECTED_CAP_REACHED;
            } else {
                try {
                    buffer.append(data, durationMillis);
                } catch (IOException e) {
                    log.error("Recording spool write failed: sessionId={}", sessionId, e);
                    abandon(buffer, "Spool write failed: " + e.getMessage());
                    eventPublisher.publishEvent(new RecordingFailedEvent(sessionId, e.getMessage()));
                    return ChunkResult.REJECTED_NOT_BUFFERING;
                }
                result = buffer.getBufferedMillis() == cap
                        ? ChunkResult.ACCEPTED_CAP_REACHED
                        : ChunkResult.ACCEPTED;
            }
            if (result == ChunkResult.ACCEPTED) {
                return result;
            }
            if (!stopBuffering(buffer)) {
                return ChunkResult.REJECTED_NOT_BUFFERING;
            }
        }

        onCapReached(buffer);
        return result;
    }

    /**
     * Enforce the cap on wall-clock time too, so a stalled stream cannot keep a
     * recording open past it.
     */
    @Scheduled(fixedDelay = 1_000)
    public void enforceCap() {
        long cap = capMillis();
        for (RecordingBuffer buffer : List.copyOf(active.values())) {
            boolean stopped;
            synchronized (buffer) {
                stopped = buffer.isBuffering() && wallClockElapsed(buffer) >= cap && stopBuffering(buffer);
            }
            if (stopped) {
                onCapReached(buffer);
            }
        }
    }

    /**
     * Stop buffering (if still buffering) and compress what was captured.
     */
    public void finish(UUID sessionId) {
        RecordingBuffer buffer = active.get(sessionId);
        if (buffer == null) {
            return;
        }
        synchronized (buffer) {
            if (!stopBuffering(buffer)) {
                return;
            }
        }
        log.info("Recording stopping with session: sessionId={}, buffered={}ms", sessionId,
                buffer.getBufferedMillis());
        beginFinalize(buffer, false);
    }

    public boolean isBuffering(UUID sessionId) {
        RecordingBuffer buffer = active.get(sessionId);
        if (buffer == null) {
            return false;
        }
        synchronized (buffer) {
            return buffer.isBuffering();
        }
    }

    private void onCapReached(RecordingBuffer buffer) {
        log.info("Recording cap reached: sessionId={}, buffered={}ms", buffer.getSessionId(),
                buffer.getBufferedMillis());
        beginFinalize(buffer, true);
        eventPublisher.publishEvent(new CapReachedEvent(buffer.getSessionId(), buffer.getBufferedMillis()));
    }

    private boolean stopBuffering(RecordingBuffer buffer) {
        try {
            return buffer.stop();
        } catch (IOException e) {
            log.warn("Closing spool failed: sessionId={}, error={}", buffer.getSessionId(), e.getMessage());
            return true;
        }
    }

    private void beginFinalize(RecordingBuffer buffer, boolean capReached) {
        UUID sessionId = buffer.getSessionId();
        updateRecording(sessionId, recording -> {
            recording.setState(RecordingState.FINALIZING);
            recording.setBufferedMillis(buffer.getBufferedMillis());
            recording.setCapReached(capReached);
        });
        try {
            codecExecutor.execute(() -> compressAndStore(buffer));
        } catch (RejectedExecutionException e) {
            log.warn("Codec executor saturated, compressing inline: sessionId={}", sessionId);
            compressAndStore(buffer);
        }
    }

    private void compressAndStore(RecordingBuffer buffer) {
        UUID sessionId = buffer.getSessionId();
        try {
            byte[] raw = buffer.readAll();
            byte[] compressed = mediaCodec.compress(raw);
            String key = "recordings/vkyc_" + sessionId + "_"
                    + OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).format(KEY_TIMESTAMP)
                    + "." + mediaCodec.fileExtension();
            String location = storageService.upload(compressed, key, mediaCodec.contentType());

            updateRecording(sessionId, recording -> {
                recording.setState(RecordingState.DONE);
                recording.setStorageKey(location);
                recording.setFinishedAt(now());
            });
            auditService.record(sessionId, AuditService.ACTOR_SYSTEM, "RECORDING_STORED", Map.of(
                    "storageKey", location,
                    "bufferedMillis", buffer.getBufferedMillis(),
                    "rawBytes", raw.length,
                    "compressedBytes", compressed.length));
            log.info("Recording stored: sessionId={}, key={}, {} -> {} bytes", sessionId, location, raw.length,
                    compressed.length);
        } catch (IOException | RuntimeException e) {
            log.error("Recording finalization failed: sessionId={}", sessionId, e);
            updateRecording(sessionId, recording -> {
                recording.setState(RecordingState.FAILED);
                recording.setFailureMessage(e.getMessage());
                recording.setFinishedAt(now());
            });
            alertService.raise("RECORDING_COMPRESSION_FAILED", sessionId, Map.of(
                    "error", String.valueOf(e.getMessage()),
                    "bufferedMillis", buffer.getBufferedMillis()));
        } finally {
            buffer.discard();
            active.remove(sessionId, buffer);
        }
    }

    private void abandon(RecordingBuffer buffer, String message) {
        buffer.discard();
        active.remove(buffer.getSessionId(), buffer);
        updateRecording(buffer.getSessionId(), recording -> {
            recording.setState(RecordingState.FAILED);
            recording.setBufferedMillis(buffer.getBufferedMillis());
            recording.setFailureMessage(message);
            recording.setFinishedAt(now());
        });
    }

    private void updateRecording(UUID sessionId, Consumer<Recording> change) {
        recordingRepository.findBySessionId(sessionId).ifPresent(recording -> {
            change.accept(recording);
            recordingRepository.save(recording);
        });
    }

    private long wallClockElapsed(RecordingBuffer buffer) {
        return Duration.between(buffer.getStartedAt(), clock.instant()).toMillis();
    }

    private long capMillis() {
        return properties.getRecording().getMaxDuration().toMillis();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
