package com.yoursp.vkyc.modules.session;

import com.yoursp.vkyc.model.enums.SessionMode;
import com.yoursp.vkyc.model.enums.SessionOutcome;
import com.yoursp.vkyc.model.enums.SessionState;
import com.yoursp.vkyc.model.enums.TerminationReason;
import com.yoursp.vkyc.modules.link.LinkIssuer;
import com.yoursp.vkyc.modules.session.dto.AssignAgentRequest;
import com.yoursp.vkyc.modules.session.dto.CreateSessionRequest;
import com.yoursp.vkyc.modules.session.dto.FailSessionRequest;
import com.yoursp.vkyc.modules.session.dto.SessionView;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for SessionController — focuses on what the public view exposes.
 */
@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock
    SessionStateMachine stateMachine;
    @Mock
    SessionStore sessionStore;
    @Mock
    LinkIssuer linkIssuer;

    @InjectMocks
    private SessionController controller;

    private SessionSnapshot snapshot(SessionState state, TerminationReason reason) {
        OffsetDateTime now = OffsetDateTime.now();
        return new SessionSnapshot(UUID.randomUUID(), UUID.randomUUID(), "CUST-1", SessionMode.IMMEDIATE, null,
                state, "agent-1", false, false, now, reason != null ? now : null, reason);
    }

    @Test
    void createReturns201() {
        CreateSessionRequest request = new CreateSessionRequest();
        request.setToken("token-abc");
        when(stateMachine.createSession("token-abc")).thenReturn(snapshot(SessionState.CREATED, null));

        ResponseEntity<SessionView> response = controller.create(request);

        assertEquals(201, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertEquals(SessionState.CREATED, response.getBody().getState());
        assertNull(response.getBody().getOutcome());
    }

    @Test
    void viewShowsOutcomeCategoryOnly() {
        SessionSnapshot failed = snapshot(SessionState.FAILED, TerminationReason.REGISTRY_MISMATCH);
        when(sessionStore.require(failed.id())).thenReturn(failed);

        SessionView view = controller.get(failed.id());

        assertEquals(SessionOutcome.VERIFICATION_FAILED, view.getOutcome());
        assertNotNull(view.getEndedAt());
    }

    @Test
    void failMapsReason() {
        SessionSnapshot failed = snapshot(SessionState.FAILED, TerminationReason.USER_LEFT);
        FailSessionRequest request = new FailSessionRequest();
        request.setReason("USER_LEFT");
        when(stateMachine.failSession(failed.id(), TerminationReason.USER_LEFT)).thenReturn(failed);

        SessionView view = controller.fail(failed.id(), request);

        assertEquals(SessionState.FAILED, view.getState());
        verify(stateMachine).failSession(failed.id(), TerminationReason.USER_LEFT);
    }

    @Test
    void releaseAgentPassesAgentId() {
        SessionSnapshot live = snapshot(SessionState.IN_PROGRESS, null);
        AssignAgentRequest request = new AssignAgentRequest();
        request.setAgentId("agent-1");
        when(stateMachine.releaseAgent(live.id(), "agent-1")).thenReturn(live);

        SessionView view = controller.releaseAgent(live.id(), request);

        assertEquals(SessionState.IN_PROGRESS, view.getState());
        verify(stateMachine).releaseAgent(live.id(), "agent-1");
    }
}
