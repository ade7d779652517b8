package com.cleancity.core.repository;

import com.cleancity.core.domain.PointsCreditRetry;
import com.cleancity.core.domain.PointsCreditRetry.RetryStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PointsCreditRetryRepository extends JpaRepository<PointsCreditRetry, UUID> {

    Optional<PointsCreditRetry> findByReportId(UUID reportId);

    @Query("SELECT p FROM PointsCreditRetry p WHERE p.status = :status AND p.nextAttemptAt <= :now " +
           "ORDER BY p.createdAt ASC")
    List<PointsCreditRetry> findDue(@Param("status") RetryStatus status, @Param("now") Instant now, Pageable pageable);

    long countByStatus(RetryStatus status);
}
