package com.yoursp.vkyc.modules.recording;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.UUID;

/**
 * Spool file for one session's media. Callers synchronize on the instance.
 */
@Slf4j
class RecordingBuffer {

    private final UUID sessionId;
    private final Path spoolFile;
    private final Instant startedAt;
    private OutputStream out;
    private long bufferedMillis;
    private boolean buffering = true;

    RecordingBuffer(UUID sessionId, Path spoolFile, Instant startedAt) throws IOException {
        this.sessionId = sessionId;
        this.spoolFile = spoolFile;
        this.startedAt = startedAt;
        Files.createDirectories(spoolFile.getParent());
        this.out = Files.newOutputStream(spoolFile, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    void append(byte[] data, long durationMillis) throws IOException {
        out.write(data);
        bufferedMillis += durationMillis;
    }

    /**
     * Close the spool for writing. Returns false if it was already stopped.
     */
    boolean stop() throws IOException {
        if (!buffering) {
            return false;
        }
        buffering = false;
        out.close();
        return true;
    }

    byte[] readAll() throws IOException {
        return Files.readAllBytes(spoolFile);
    }

    void discard() {
        try {
            if (buffering) {
                buffering = false;
                out.close();
            }
            Files.deleteIfExists(spoolFile);
        } catch (IOException e) {
            log.warn("Could not remove spool file {}: {}", spoolFile, e.getMessage());
        }
    }

    UUID getSessionId() {
        return sessionId;
    }

    Instant getStartedAt() {
        return startedAt;
    }

    long getBufferedMillis() {
        return bufferedMillis;
    }

    boolean isBuffering() {
        return buffering;
    }
}
