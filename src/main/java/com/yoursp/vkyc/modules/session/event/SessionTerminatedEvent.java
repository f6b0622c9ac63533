package com.yoursp.vkyc.modules.session.event;

import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.model.enums.TerminationReason;

import java.util.UUID;

/**
 * Published once per session, on its terminal transition.
 */
public record SessionTerminatedEvent(UUID sessionId, SessionState state, TerminationReason reason) {
}
