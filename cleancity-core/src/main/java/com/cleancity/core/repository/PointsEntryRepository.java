package com.cleancity.core.repository;

import com.cleancity.core.domain.PointsEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PointsEntryRepository extends JpaRepository<PointsEntry, UUID> {

    Optional<PointsEntry> findByReportId(UUID reportId);

    List<PointsEntry> findByDeviceIdOrderByCreatedAtDesc(String deviceId);
}
