package com.yoursp.vkyc.modules.signaling.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.modules.signaling.exception.ChannelProtocolException;

/**
 * Agent asks the user to capture (or stop capturing) a document.
 */
public record CaptureCommand(String documentType, String action) implements SignalingMessage {

    public static final String REQUEST = "request";
    public static final String CANCEL = "cancel";

    @Override
    public void validate() {
        document();
        if (!REQUEST.equals(action) && !CANCEL.equals(action)) {
            throw new ChannelProtocolException("INVALID_CAPTURE_COMMAND", "action must be request or cancel");
        }
    }

    public DocumentType document() {
        try {
            return DocumentType.fromClientValue(documentType);
        } catch (IllegalArgumentException e) {
            throw new ChannelProtocolException("UNSUPPORTED_DOCUMENT", e.getMessage());
        }
    }

    @JsonIgnore
    public boolean isCancel() {
        return CANCEL.equals(action);
    }
}
