package com.yoursp.vkyc.repository;

import com.yoursp.vkyc.model.entity.VerificationResult;
import com.yoursp.vkyc.model.enums.DocumentType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VerificationResultRepository extends JpaRepository<VerificationResult, UUID> {

    Optional<VerificationResult> findBySessionIdAndDocumentType(UUID sessionId, DocumentType documentType);

    List<VerificationResult> findAllBySessionId(UUID sessionId);
}
