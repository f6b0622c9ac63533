package com.yoursp.vkyc.repository;

import com.yoursp.vkyc.model.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findAllBySessionIdOrderByCreatedAtAsc(UUID sessionId);
}
