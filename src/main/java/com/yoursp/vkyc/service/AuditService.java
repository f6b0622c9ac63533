package com.yoursp.vkyc.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.vkyc.model.entity.AuditLog;
import com.yoursp.vkyc.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Session audit trail. Internal reason codes live here; the customer only ever
 * sees the outcome category.
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String ACTOR_SYSTEM = "SYSTEM";
    public static final String ACTOR_USER = "USER";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit entry for a session.
     *
     * @param sessionId the session concerned (nullable for link-only actions)
     * @param actor     {@link #ACTOR_SYSTEM}, {@link #ACTOR_USER} or an agent id
     * @param action    short action descriptor, e.g. "SESSION_FAILED"
     * @param metadata  arbitrary key-value metadata (serialized as JSONB)
     */
    public void record(UUID sessionId, String actor, String action, Map<String, Object> metadata) {
        String json = null;
        if (metadata != null) {
            try {
                json = objectMapper.writeValueAsString(metadata);
            } catch (JsonProcessingException e) {
                // Keep the entry even without metadata
                log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
            }
        }

        auditLogRepository.save(AuditLog.builder()
                .sessionId(sessionId)
                .actor(actor)
                .action(action)
                .metadata(json)
                .build());
        log.debug("Audit logged: action={}, session={}, actor={}", action, sessionId, actor);
    }
}
