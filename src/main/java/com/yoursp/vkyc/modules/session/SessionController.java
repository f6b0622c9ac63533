package com.yoursp.vkyc.modules.session;

import com.yoursp.vkyc.model.enums.TerminationReason;
import com.yoursp.vkyc.modules.link.LinkIssuer;
import com.yoursp.vkyc.modules.session.dto.AssignAgentRequest;
import com.yoursp.vkyc.modules.session.dto.ChooseModeRequest;
import com.yoursp.vkyc.modules.session.dto.CreateSessionRequest;
import com.yoursp.vkyc.modules.session.dto.FailSessionRequest;
import com.yoursp.vkyc.modules.session.dto.SessionView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Session lifecycle endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/vkyc/sessions — open a session from a link token</li>
 * <li>GET /api/vkyc/sessions/{id} — current state and outcome category</li>
 * <li>POST /api/vkyc/sessions/{id}/mode — immediate or scheduled</li>
 * <li>POST /api/vkyc/sessions/{id}/begin — start the call</li>
 * <li>GET /api/vkyc/sessions/waiting — live sessions without an agent</li>
 * <li>POST /api/vkyc/sessions/{id}/agent — claim a session</li>
 * <li>POST /api/vkyc/sessions/{id}/agent/release — hand it back to the queue</li>
 * <li>POST /api/vkyc/sessions/{id}/complete — agent completes</li>
 * <li>POST /api/vkyc/sessions/{id}/fail — abort</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/vkyc/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionStateMachine stateMachine;
    private final SessionStore sessionStore;
    private final LinkIssuer linkIssuer;

    @PostMapping
    public ResponseEntity<SessionView> create(@Valid @RequestBody CreateSessionRequest request) {
        SessionSnapshot session = stateMachine.createSession(request.getToken());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionView.of(session));
    }

    @GetMapping("/{id}")
    public SessionView get(@PathVariable UUID id) {
        return SessionView.of(sessionStore.require(id));
    }

    @PostMapping("/{id}/mode")
    public SessionView chooseMode(@PathVariable UUID id, @Valid @RequestBody ChooseModeRequest request) {
        ModeChoice choice = stateMachine.chooseMode(id, request.getMode(), request.getScheduledAt());
        return SessionView.of(choice.session(),
                choice.occurrenceLink() != null ? linkIssuer.toResponse(choice.occurrenceLink()) : null);
    }

    @PostMapping("/{id}/begin")
    public SessionView begin(@PathVariable UUID id) {
        return SessionView.of(stateMachine.beginSession(id));
    }

    @GetMapping("/waiting")
    public List<SessionView> waiting() {
        return stateMachine.waitingForAgent().stream().map(SessionView::of).toList();
    }

    @PostMapping("/{id}/agent")
    public SessionView assignAgent(@PathVariable UUID id, @Valid @RequestBody AssignAgentRequest request) {
        return SessionView.of(stateMachine.assignAgent(id, request.getAgentId()));
    }

    @PostMapping("/{id}/agent/release")
    public SessionView releaseAgent(@PathVariable UUID id, @Valid @RequestBody AssignAgentRequest request) {
        return SessionView.of(stateMachine.releaseAgent(id, request.getAgentId()));
    }

    @PostMapping("/{id}/complete")
    public SessionView complete(@PathVariable UUID id) {
        return SessionView.of(stateMachine.completeSession(id));
    }

    @PostMapping("/{id}/fail")
    public SessionView fail(@PathVariable UUID id, @Valid @RequestBody FailSessionRequest request) {
        TerminationReason reason = TerminationReason.valueOf(request.getReason());
        log.info("Session abort requested: sessionId={}, reason={}", id, reason);
        return SessionView.of(stateMachine.failSession(id, reason));
    }
}
