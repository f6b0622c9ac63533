package com.yoursp.vkyc.modules.recording;

import com.yoursp.vkyc.modules.session.SessionSnapshot;
import com.yoursp.vkyc.modules.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * Transport boundary for media: the external media relay posts each chunk here
 * with the media time it covers.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/vkyc/sessions/{id}/media — one chunk, header
 * {@code X-Chunk-Duration-Ms}</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/vkyc/sessions")
@RequiredArgsConstructor
public class MediaIngestController {

    public static final String DURATION_HEADER = "X-Chunk-Duration-Ms";

    private final RecordingManager recordingManager;
    private final SessionStore sessionStore;

    @PostMapping(value = "/{id}/media", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<Map<String, Object>> ingest(@PathVariable UUID id,
            @RequestHeader(DURATION_HEADER) long durationMillis,
            @RequestBody byte[] chunk) {
        SessionSnapshot session = sessionStore.require(id);
        if (!session.state().isActive()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "SESSION_NOT_ACTIVE",
                            "message", "Session is not accepting media"));
        }
        if (durationMillis < 0) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "VALIDATION_ERROR",
                            "message", DURATION_HEADER + " must not be negative"));
        }

        ChunkResult result = recordingManager.onChunk(id, chunk, durationMillis);
        return switch (result) {
            case ACCEPTED, ACCEPTED_CAP_REACHED -> ResponseEntity.accepted()
                    .body(Map.of("result", result.name()));
            case REJECTED_CAP_REACHED, REJECTED_NOT_BUFFERING -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", result.name(),
                            "message", "Recording is no longer buffering"));
        };
    }
}
