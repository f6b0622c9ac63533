package com.yoursp.vkyc.repository;

import com.yoursp.vkyc.model.entity.VerificationLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VerificationLinkRepository extends JpaRepository<VerificationLink, UUID> {

    Optional<VerificationLink> findByToken(String token);

    List<VerificationLink> findByCustomerRefOrderByIssuedAtDesc(String customerRef);
}
