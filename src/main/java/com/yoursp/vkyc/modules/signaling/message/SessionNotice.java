package com.yoursp.vkyc.modules.signaling.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.yoursp.vkyc.model.enums.SessionOutcome;

/**
 * Server notice: peer presence, errors, and the final outcome category.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionNotice(String code, String message, SessionOutcome outcome) implements SignalingMessage {

    public static final String CONNECTED = "CONNECTED";
    public static final String PEER_JOINED = "PEER_JOINED";
    public static final String PEER_DISCONNECTED = "PEER_DISCONNECTED";
    public static final String PEER_UNAVAILABLE = "PEER_UNAVAILABLE";
    public static final String AGENT_LEFT = "AGENT_LEFT";
    public static final String AGENT_RELEASED = "AGENT_RELEASED";
    public static final String CAPTURE_ACCEPTED = "CAPTURE_ACCEPTED";
    public static final String VERIFICATION_BUSY = "VERIFICATION_BUSY";
    public static final String SESSION_NOT_ACTIVE = "SESSION_NOT_ACTIVE";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String SESSION_ENDED = "SESSION_ENDED";

    public static SessionNotice of(String code, String message) {
        return new SessionNotice(code, message, null);
    }

    public static SessionNotice ended(SessionOutcome outcome) {
        return new SessionNotice(SESSION_ENDED, null, outcome);
    }

    @Override
    @JsonIgnore
    public boolean isServerOnly() {
        return true;
    }
}
