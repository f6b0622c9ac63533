package com.yoursp.vkyc.repository;

import com.yoursp.vkyc.model.entity.Recording;
import com.yoursp.vkyc.model.enums.RecordingState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RecordingRepository extends JpaRepository<Recording, UUID> {

    Optional<Recording> findBySessionId(UUID sessionId);

    /**
     * Buffers live only in process memory; after a restart they are gone.
     */
    @Modifying
    @Transactional
    @Query("UPDATE Recording r SET r.state = :failed, r.failureMessage = 'Process restarted while buffering', " +
            "r.finishedAt = :now WHERE r.state IN :interrupted")
    int failInterruptedRecordings(RecordingState failed, Collection<RecordingState> interrupted, OffsetDateTime now);
}
