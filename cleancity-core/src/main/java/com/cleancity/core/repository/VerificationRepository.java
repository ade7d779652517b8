package com.cleancity.core.repository;

import com.cleancity.core.domain.Verification;
import com.cleancity.core.domain.Verification.ApprovalStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VerificationRepository extends JpaRepository<Verification, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Verification v WHERE v.id = :id")
    Optional<Verification> findByIdForUpdate(@Param("id") UUID id);

    List<Verification> findByReportIdOrderByStartedAtDesc(UUID reportId);

    Optional<Verification> findFirstByReportIdAndApprovalStatusOrderByStartedAtDesc(UUID reportId, ApprovalStatus status);

    /**
     * Completed attempts awaiting an admin decision, oldest completion first.
     */
    @Query("SELECT v FROM Verification v WHERE v.approvalStatus = :status AND v.completedAt IS NOT NULL " +
           "ORDER BY v.completedAt ASC")
    List<Verification> findCompletedByApprovalStatus(@Param("status") ApprovalStatus status, Pageable pageable);

    long countByApprovalStatusAndCompletedAtIsNotNull(ApprovalStatus status);

    long countByApprovalStatusAndDecidedAtGreaterThanEqual(ApprovalStatus status, Instant since);

    List<Verification> findByApprovalStatusAndDecidedAtGreaterThanEqual(ApprovalStatus status, Instant since);
}
