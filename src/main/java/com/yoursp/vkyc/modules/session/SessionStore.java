package com.yoursp.vkyc.modules.session;

import com.yoursp.vkyc.model.entity.VkycSession;
import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.modules.session.exception.SessionNotFoundException;
import com.yoursp.vkyc.repository.VkycSessionRepository;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single-writer access to sessions.
 * <p>
 * Every mutation runs under the lock stripe of its session, so two writers
 * never interleave on one session while unrelated sessions proceed in
 * parallel. Readers get {@link SessionSnapshot}s and never take the lock.
 * </p>
 */
@SuppressWarnings("null")
@Component
public class SessionStore {

    private static final int STRIPES = 64;

    private final VkycSessionRepository sessionRepository;
    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public SessionStore(VkycSessionRepository sessionRepository) {
        this.sessionRepository = sessionRepository;
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public VkycSession create(VkycSession session) {
        return sessionRepository.save(session);
    }

    /**
     * Load, mutate and persist a session under its lock.
     *
     * @param mutation receives the managed entity; its return value is passed
     *                 through
     * @throws SessionNotFoundException if the session does not exist
     */
    public <T> T write(UUID sessionId, Function<VkycSession, T> mutation) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            VkycSession session = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            T result = mutation.apply(session);
            sessionRepository.save(session);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run an action under the lock stripe of an arbitrary key, e.g. a link id
     * that must not spawn two sessions.
     */
    public <T> T exclusive(UUID key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Optional<SessionSnapshot> find(UUID sessionId) {
        return sessionRepository.findById(sessionId).map(SessionSnapshot::of);
    }

    public SessionSnapshot require(UUID sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public List<UUID> findDueScheduled(OffsetDateTime now) {
        return sessionRepository.findDueIds(SessionState.SCHEDULED, now);
    }

    public List<UUID> findExpirable(OffsetDateTime now) {
        return sessionRepository.findExpirableIds(
                EnumSet.of(SessionState.CREATED, SessionState.SCHEDULED, SessionState.READY_TO_START), now);
    }

    public List<SessionSnapshot> findActive() {
        return sessionRepository.findByStateIn(EnumSet.of(SessionState.IN_PROGRESS, SessionState.VERIFYING))
                .stream()
                .map(SessionSnapshot::of)
                .toList();
    }

    public List<SessionSnapshot> findWaitingForAgent() {
        return sessionRepository.findByStateInAndAssignedAgentIdIsNullOrderByStartedAtAsc(
                EnumSet.of(SessionState.IN_PROGRESS, SessionState.VERIFYING))
                .stream()
                .map(SessionSnapshot::of)
                .toList();
    }

    private ReentrantLock lockFor(UUID sessionId) {
        return locks[Math.floorMod(sessionId.hashCode(), STRIPES)];
    }
}
