package com.yoursp.vkyc.modules.signaling.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed set of messages carried by a signaling channel, discriminated by
 * {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CallSetup.class, name = "call_setup"),
        @JsonSubTypes.Type(value = CaptureCommand.class, name = "capture_command"),
        @JsonSubTypes.Type(value = CaptureSubmission.class, name = "capture_submission"),
        @JsonSubTypes.Type(value = LivenessEvent.class, name = "liveness_event"),
        @JsonSubTypes.Type(value = LivenessPrompt.class, name = "liveness_prompt"),
        @JsonSubTypes.Type(value = AgentRelease.class, name = "agent_release"),
        @JsonSubTypes.Type(value = Heartbeat.class, name = "heartbeat"),
        @JsonSubTypes.Type(value = HeartbeatAck.class, name = "heartbeat_ack"),
        @JsonSubTypes.Type(value = VerificationUpdate.class, name = "verification_update"),
        @JsonSubTypes.Type(value = SessionNotice.class, name = "session_notice")
})
public interface SignalingMessage {

    /**
     * Per-variant content checks, run after decoding. Throws
     * {@code ChannelProtocolException} on invalid content.
     */
    default void validate() {
    }

    /** Messages only the server may originate. */
    @JsonIgnore
    default boolean isServerOnly() {
        return false;
    }
}
