package com.yoursp.vkyc.modules.session.event;

import com.yoursp.vkyc.modules.verification.VerificationOutcome;

/**
 * A verification outcome the state machine has accepted; relayed to the peers.
 */
public record VerificationProgressEvent(VerificationOutcome outcome) {
}
