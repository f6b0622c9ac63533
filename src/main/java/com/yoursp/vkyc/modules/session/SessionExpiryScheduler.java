package com.yoursp.vkyc.modules.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Promotes scheduled sessions whose slot has arrived and expires sessions whose
 * link ran out before they started.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionExpiryScheduler {

    private final SessionStore sessionStore;
    private final SessionStateMachine stateMachine;
    private final Clock clock;

    @Scheduled(fixedRate = 30_000)
    public void sweep() {
        OffsetDateTime now = OffsetDateTime.now(clock);

        int promoted = 0;
        for (UUID sessionId : sessionStore.findDueScheduled(now)) {
            try {
                if (stateMachine.promoteScheduled(sessionId)) {
                    promoted++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to promote scheduled session {}: {}", sessionId, e.getMessage());
            }
        }

        int expired = 0;
        for (UUID sessionId : sessionStore.findExpirable(now)) {
            try {
                stateMachine.expireSession(sessionId);
                expired++;
            } catch (RuntimeException e) {
                // Usually a session that began between the query and the write
                log.warn("Could not expire session {}: {}", sessionId, e.getMessage());
            }
        }

        if (promoted > 0 || expired > 0) {
            log.info("Session sweep: promoted={}, expired={}", promoted, expired);
        }
    }
}
