package com.yoursp.vkyc.modules.recording;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stores the WebM stream from the media transport unchanged.
 */
@Component
@ConditionalOnProperty(prefix = "vkyc.recording", name = "codec", havingValue = "passthrough")
public class PassthroughMediaCodec implements MediaCodec {

    @Override
    public byte[] compress(byte[] raw) {
        return raw;
    }

    @Override
    public String fileExtension() {
        return "webm";
    }

    @Override
    public String contentType() {
        return "video/webm";
    }
}
