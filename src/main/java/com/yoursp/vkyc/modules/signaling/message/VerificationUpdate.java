package com.yoursp.vkyc.modules.signaling.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.yoursp.vkyc.modules.verification.VerificationOutcome;

import java.util.Map;

/**
 * Pipeline progress for one document. Extracted fields go to the agent only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationUpdate(
        String documentType,
        String status,
        String failure,
        Double confidence,
        int attempts,
        Map<String, String> fields) implements SignalingMessage {

    public static VerificationUpdate forAgent(VerificationOutcome outcome) {
        return of(outcome, outcome.fields());
    }

    public static VerificationUpdate forUser(VerificationOutcome outcome) {
        return of(outcome, null);
    }

    private static VerificationUpdate of(VerificationOutcome outcome, Map<String, String> fields) {
        return new VerificationUpdate(
                outcome.documentType().name(),
                outcome.status().name(),
                outcome.failure() != null ? outcome.failure().name() : null,
                outcome.confidence(),
                outcome.attempts(),
                fields);
    }

    @Override
    @JsonIgnore
    public boolean isServerOnly() {
        return true;
    }
}
