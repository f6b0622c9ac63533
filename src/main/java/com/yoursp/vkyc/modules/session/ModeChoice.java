package com.yoursp.vkyc.modules.session;

import com.yoursp.vkyc.model.entity.VerificationLink;

/**
 * Result of {@code chooseMode}. {@code occurrenceLink} is set only when a
 * scheduled occurrence was booked and a fresh link issued for it.
 */
public record ModeChoice(SessionSnapshot session, VerificationLink occurrenceLink) {
}
