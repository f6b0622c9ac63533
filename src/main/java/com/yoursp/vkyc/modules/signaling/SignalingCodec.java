package com.yoursp.vkyc.modules.signaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.yoursp.vkyc.modules.signaling.exception.ChannelProtocolException;
import com.yoursp.vkyc.modules.signaling.message.SignalingMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON wire format of the signaling channel.
 */
@Component
@RequiredArgsConstructor
public class SignalingCodec {

    private final ObjectMapper objectMapper;

    /**
     * Parse and validate an inbound frame.
     *
     * @throws ChannelProtocolException if the frame is not a valid message
     */
    public SignalingMessage decode(String text) {
        if (text == null || text.isBlank()) {
            throw new ChannelProtocolException("MALFORMED_MESSAGE", "Empty message");
        }
        SignalingMessage message;
        try {
            message = objectMapper.readValue(text, SignalingMessage.class);
        } catch (InvalidTypeIdException e) {
            throw new ChannelProtocolException("UNKNOWN_MESSAGE_TYPE", "Unknown or missing message type");
        } catch (JsonProcessingException e) {
            throw new ChannelProtocolException("MALFORMED_MESSAGE", "Message is not valid JSON for its type");
        }
        if (message == null) {
            throw new ChannelProtocolException("MALFORMED_MESSAGE", "Empty message");
        }
        message.validate();
        return message;
    }

    public String encode(SignalingMessage message) {
        try {
            return objectMapper.writerFor(SignalingMessage.class).writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }
}
