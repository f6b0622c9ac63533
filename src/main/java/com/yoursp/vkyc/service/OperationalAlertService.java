package com.yoursp.vkyc.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Surfaces operational problems that must reach an operator without changing a
 * session's verification outcome: registry outages, compression failures.
 * <p>
 * Alerts land in the audit trail and the error log. Paging is left to the log
 * shipper.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperationalAlertService {

    private final AuditService auditService;

    /**
     * @param type      alert type (e.g. "REGISTRY_UNAVAILABLE")
     * @param sessionId the session involved
     * @param details   context for the operator
     */
    public void raise(String type, UUID sessionId, Map<String, Object> details) {
        log.error("OPERATIONAL ALERT [{}] sessionId={}, details={}", type, sessionId, details);
        auditService.record(sessionId, AuditService.ACTOR_SYSTEM, "ALERT_" + type, details);
    }
}
