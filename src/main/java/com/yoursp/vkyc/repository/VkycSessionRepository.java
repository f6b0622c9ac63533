package com.yoursp.vkyc.repository;

import com.yoursp.vkyc.model.entity.VkycSession;
import com.yoursp.vkyc.model.enums.SessionState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface VkycSessionRepository extends JpaRepository<VkycSession, UUID> {

    List<VkycSession> findByStateIn(Collection<SessionState> states);

    /**
     * Scheduled sessions whose slot has arrived.
     */
    @Query("SELECT s.id FROM VkycSession s WHERE s.state = :state AND s.scheduledAt <= :now")
    List<UUID> findDueIds(SessionState state, OffsetDateTime now);

    /**
     * Sessions that never started and whose link has run out.
     */
    @Query("SELECT s.id FROM VkycSession s, VerificationLink l " +
            "WHERE l.id = s.linkId AND s.state IN :states " +
            "AND l.expiresAt <= :now")
    List<UUID> findExpirableIds(Collection<SessionState> states, OffsetDateTime now);

    /**
     * Live sessions that no agent has claimed yet, oldest first.
     */
    List<VkycSession> findByStateInAndAssignedAgentIdIsNullOrderByStartedAtAsc(Collection<SessionState> states);
}
