package com.cleancity.api.report;

import com.cleancity.api.error.NotFoundException;
import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.domain.Severity;
import com.cleancity.core.domain.Verification;
import com.cleancity.core.domain.Verification.ApprovalStatus;
import com.cleancity.core.repository.ReportRepository;
import com.cleancity.core.repository.VerificationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
@Transactional(readOnly = true)
public class ReportQueryService {

    private final ReportRepository reportRepository;
    private final VerificationRepository verificationRepository;

    public ReportQueryService(ReportRepository reportRepository, VerificationRepository verificationRepository) {
        this.reportRepository = reportRepository;
        this.verificationRepository = verificationRepository;
    }

    public ReportView getReport(UUID reportId) {
        Report report = reportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException("Report not found: " + reportId));
        return toView(report);
    }

    /**
     * Reports of one device, newest first.
     */
    public List<ReportView> listByDevice(String deviceId) {
        return reportRepository.findByDeviceIdOrderByCreatedAtDesc(deviceId).stream()
                .map(this::toView)
                .toList();
    }

    private ReportView toView(Report report) {
        Optional<Verification> approved = report.getStatus() == ReportStatus.RESOLVED
                ? verificationRepository.findFirstByReportIdAndApprovalStatusOrderByStartedAtDesc(
                        report.getId(), ApprovalStatus.APPROVED)
                : Optional.empty();
        return new ReportView(
                report.getId(),
                report.getDeviceId(),
                report.getStatus(),
                report.getSeverity(),
                Set.copyOf(report.getWasteTypes()),
                report.getDescription(),
                report.getArea(),
                report.getLocation().getLatitude(),
                report.getLocation().getLongitude(),
                report.getLocation().getAccuracy(),
                report.getPhotoUrl(),
                report.getAssignedWorkerId(),
                report.getPointsAwarded(),
                report.getCreatedAt(),
                report.getAssignedAt(),
                report.getInProgressAt(),
                report.getVerifiedAt(),
                report.getResolvedAt(),
                approved.map(Verification::getBeforePhotoUrl).orElse(null),
                approved.map(Verification::getAfterPhotoUrl).orElse(null));
    }

    public record ReportView(
            UUID id,
            String deviceId,
            ReportStatus status,
            Severity severity,
            Set<String> wasteTypes,
            String description,
            String area,
            double latitude,
            double longitude,
            Double accuracy,
            String photoUrl,
            UUID assignedWorkerId,
            int pointsAwarded,
            Instant createdAt,
            Instant assignedAt,
            Instant inProgressAt,
            Instant verifiedAt,
            Instant resolvedAt,
            String beforePhotoUrl,
            String afterPhotoUrl
    ) {}
}
