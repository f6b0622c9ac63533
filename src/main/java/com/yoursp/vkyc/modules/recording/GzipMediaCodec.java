package com.yoursp.vkyc.modules.recording;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.Deflater;
import java.util.zip.GZIPOutputStream;

/**
 * Default codec: gzip over the container stream delivered by the media
 * transport. WebM payloads are already compressed, so the gain is small; set
 * {@code vkyc.recording.codec=passthrough} to store the stream as delivered.
 */
@Component
@ConditionalOnProperty(prefix = "vkyc.recording", name = "codec", havingValue = "gzip", matchIfMissing = true)
public class GzipMediaCodec implements MediaCodec {

    @Override
    public byte[] compress(byte[] raw) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out) {
            {
                def.setLevel(Deflater.BEST_COMPRESSION);
            }
        }) {
            gzip.write(raw);
        } catch (IOException e) {
            throw new RecordingException("Compression failed", e);
        }
        return out.toByteArray();
    }

    @Override
    public String fileExtension() {
        return "webm.gz";
    }

    @Override
    public String contentType() {
        return "application/gzip";
    }
}
