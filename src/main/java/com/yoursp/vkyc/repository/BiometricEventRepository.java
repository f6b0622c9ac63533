package com.yoursp.vkyc.repository;

import com.yoursp.vkyc.model.entity.BiometricEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BiometricEventRepository extends JpaRepository<BiometricEvent, Long> {

    List<BiometricEvent> findAllBySessionIdOrderByRecordedAtAsc(UUID sessionId);
}
