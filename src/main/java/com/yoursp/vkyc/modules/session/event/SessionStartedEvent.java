package com.yoursp.vkyc.modules.session.event;

import java.util.UUID;

/**
 * Published synchronously by {@code beginSession}: recording and signaling start
 * before the call returns.
 */
public record SessionStartedEvent(UUID sessionId) {
}
