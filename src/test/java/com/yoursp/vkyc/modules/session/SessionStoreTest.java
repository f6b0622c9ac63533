package com.yoursp.vkyc.modules.session;

import com.yoursp.vkyc.model.entity.VkycSession;
import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.modules.session.exception.SessionNotFoundException;
import com.yoursp.vkyc.repository.VkycSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionStoreTest {

    @Mock
    private VkycSessionRepository sessionRepository;

    private final Map<UUID, VkycSession> sessions = new ConcurrentHashMap<>();
    private SessionStore store;

    @BeforeEach
    void setUp() {
        store = new SessionStore(sessionRepository);
        lenient().when(sessionRepository.save(any(VkycSession.class))).thenAnswer(inv -> {
            VkycSession session = inv.getArgument(0);
            if (session.getId() == null) {
                session.setId(UUID.randomUUID());
            }
            sessions.put(session.getId(), session);
            return session;
        });
        lenient().when(sessionRepository.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(sessions.get(inv.<UUID>getArgument(0))));
    }

    @Test
    @DisplayName("write on an unknown session throws SessionNotFoundException")
    void writeUnknownSession() {
        UUID unknown = UUID.randomUUID();

        assertThrows(SessionNotFoundException.class, () -> store.write(unknown, session -> null));
        assertThrows(SessionNotFoundException.class, () -> store.require(unknown));
        assertTrue(store.find(unknown).isEmpty());
    }

    @Test
    @DisplayName("write persists the mutation and returns the mutation's result")
    void writePersists() {
        VkycSession created = store.create(VkycSession.builder().state(SessionState.CREATED).build());

        SessionState returned = store.write(created.getId(), session -> {
            session.setState(SessionState.READY_TO_START);
            return session.getState();
        });

        assertEquals(SessionState.READY_TO_START, returned);
        assertEquals(SessionState.READY_TO_START, store.require(created.getId()).state());
        verify(sessionRepository, times(2)).save(any(VkycSession.class));
    }

    @Test
    @DisplayName("Concurrent writers on one session never interleave")
    void concurrentWritesSerialized() throws InterruptedException {
        UUID id = store.create(VkycSession.builder().state(SessionState.IN_PROGRESS).build()).getId();
        int threads = 8;
        int writesPerThread = 200;
        int[] counter = new int[1];
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < writesPerThread; i++) {
                    store.write(id, session -> {
                        int read = counter[0];
                        Thread.yield();
                        counter[0] = read + 1;
                        return null;
                    });
                }
            });
        }
        start.countDown();
        pool.shutdown();

        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        assertEquals(threads * writesPerThread, counter[0]);
    }
}
