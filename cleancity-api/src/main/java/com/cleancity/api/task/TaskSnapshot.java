package com.cleancity.api.task;

import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.domain.Severity;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable copy of the report fields the scheduler needs.
 */
public record TaskSnapshot(
        UUID reportId,
        ReportStatus status,
        Severity severity,
        String area,
        double latitude,
        double longitude,
        String photoUrl,
        String description,
        Set<String> wasteTypes,
        UUID assignedWorkerId,
        Instant createdAt
) {
    public static TaskSnapshot of(Report report) {
        return new TaskSnapshot(
                report.getId(),
                report.getStatus(),
                report.getSeverity(),
                report.getArea(),
                report.getLocation().getLatitude(),
                report.getLocation().getLongitude(),
                report.getPhotoUrl(),
                report.getDescription(),
                Set.copyOf(report.getWasteTypes()),
                report.getAssignedWorkerId(),
                report.getCreatedAt());
    }
}
