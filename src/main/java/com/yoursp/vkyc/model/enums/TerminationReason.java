package com.yoursp.vkyc.model.enums;

/**
 * Internal reason codes kept in the audit trail. End users only ever see the
 * {@link SessionOutcome} category.
 */
public enum TerminationReason {

    COMPLETED(SessionOutcome.COMPLETED),
    LINK_EXPIRED(SessionOutcome.EXPIRED),
    DISCONNECT_TIMEOUT(SessionOutcome.DISCONNECTED),
    USER_LEFT(SessionOutcome.DISCONNECTED),
    LOW_CONFIDENCE(SessionOutcome.VERIFICATION_FAILED),
    REGISTRY_MISMATCH(SessionOutcome.VERIFICATION_FAILED),
    VERIFICATION_INCOMPLETE(SessionOutcome.VERIFICATION_FAILED),
    RECORDING_FAILURE(SessionOutcome.ENDED),
    AGENT_ABORTED(SessionOutcome.ENDED),
    CLIENT_ERROR(SessionOutcome.ENDED),
    PROCESS_RESTART(SessionOutcome.ENDED);

    private final SessionOutcome outcome;

    TerminationReason(SessionOutcome outcome) {
        this.outcome = outcome;
    }

    public SessionOutcome getOutcome() {
        return outcome;
    }
}
