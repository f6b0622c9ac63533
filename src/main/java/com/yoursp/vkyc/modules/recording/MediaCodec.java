package com.yoursp.vkyc.modules.recording;

/**
 * Compression step applied to a finished recording.
 */
public interface MediaCodec {

    /**
     * @throws RecordingException if the payload cannot be compressed
     */
    byte[] compress(byte[] raw);

    String fileExtension();

    String contentType();
}
