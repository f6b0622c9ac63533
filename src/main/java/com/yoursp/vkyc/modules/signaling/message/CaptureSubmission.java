package com.yoursp.vkyc.modules.signaling.message;

import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.modules.signaling.exception.ChannelProtocolException;

import java.util.Base64;

/**
 * A document image captured by the user, base64 encoded.
 */
public record CaptureSubmission(String documentType, String image) implements SignalingMessage {

    @Override
    public void validate() {
        document();
        if (image == null || image.isBlank()) {
            throw new ChannelProtocolException("INVALID_CAPTURE", "image is required");
        }
    }

    public DocumentType document() {
        try {
            return DocumentType.fromClientValue(documentType);
        } catch (IllegalArgumentException e) {
            throw new ChannelProtocolException("UNSUPPORTED_DOCUMENT", e.getMessage());
        }
    }

    /**
     * Decoded image bytes. Accepts a data-URL prefix as sent by browsers.
     */
    public byte[] imageBytes() {
        String data = image;
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        try {
            return Base64.getDecoder().decode(data.trim());
        } catch (IllegalArgumentException e) {
            throw new ChannelProtocolException("INVALID_CAPTURE", "image is not valid base64");
        }
    }
}
