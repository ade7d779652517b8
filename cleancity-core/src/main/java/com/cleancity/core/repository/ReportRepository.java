package com.cleancity.core.repository;

import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReportRepository extends JpaRepository<Report, UUID> {

    /**
     * Loads a report holding a row lock until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Report r WHERE r.id = :id")
    Optional<Report> findByIdForUpdate(@Param("id") UUID id);

    List<Report> findByDeviceIdOrderByCreatedAtDesc(String deviceId);

    List<Report> findByAssignedWorkerIdAndStatusInOrderByCreatedAtAsc(UUID workerId, Collection<ReportStatus> statuses);

    List<Report> findByStatusAndAreaInOrderByCreatedAtAsc(ReportStatus status, Collection<String> areas);

    /**
     * Bounding-box prefilter for duplicate detection; callers refine with haversine.
     */
    @Query("SELECT r FROM Report r WHERE r.status = :status AND r.createdAt > :since " +
           "AND r.location.latitude BETWEEN :minLat AND :maxLat " +
           "AND r.location.longitude BETWEEN :minLng AND :maxLng")
    List<Report> findCreatedSinceInBox(@Param("status") ReportStatus status,
                                       @Param("since") Instant since,
                                       @Param("minLat") double minLat,
                                       @Param("maxLat") double maxLat,
                                       @Param("minLng") double minLng,
                                       @Param("maxLng") double maxLng);

    @Query("SELECT r FROM Report r WHERE r.status = :status AND r.id <> :excludeId " +
           "AND r.location.latitude BETWEEN :minLat AND :maxLat " +
           "AND r.location.longitude BETWEEN :minLng AND :maxLng")
    List<Report> findOthersInBox(@Param("status") ReportStatus status,
                                 @Param("excludeId") UUID excludeId,
                                 @Param("minLat") double minLat,
                                 @Param("maxLat") double maxLat,
                                 @Param("minLng") double minLng,
                                 @Param("maxLng") double maxLng);
}
