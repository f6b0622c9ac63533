package com.yoursp.vkyc.modules.session;

import com.yoursp.vkyc.model.enums.RecordingState;
import com.yoursp.vkyc.model.enums.TerminationReason;
import com.yoursp.vkyc.repository.RecordingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Closes out work a previous process left behind. Channels, timers and spool
 * files do not survive a restart, so live sessions are failed and recordings
 * that were still being written are marked FAILED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionRecoveryRunner implements ApplicationRunner {

    private final SessionStore sessionStore;
    private final SessionStateMachine stateMachine;
    private final RecordingRepository recordingRepository;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        List<SessionSnapshot> live = sessionStore.findActive();
        for (SessionSnapshot session : live) {
            try {
                stateMachine.failInternally(session.id(), TerminationReason.PROCESS_RESTART);
            } catch (RuntimeException e) {
                log.error("Could not close interrupted session {}: {}", session.id(), e.getMessage());
            }
        }

        int recordings = recordingRepository.failInterruptedRecordings(RecordingState.FAILED,
                EnumSet.of(RecordingState.BUFFERING, RecordingState.FINALIZING), OffsetDateTime.now(clock));

        if (!live.isEmpty() || recordings > 0) {
            log.warn("Recovered after restart: sessions failed={}, recordings failed={}", live.size(), recordings);
        }
    }
}
