package com.cleancity.api.approval;

import com.cleancity.api.admission.AdmissionProperties;
import com.cleancity.api.error.NotFoundException;
import com.cleancity.api.points.PointsReconciliationService;
import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.Severity;
import com.cleancity.core.domain.Verification;
import com.cleancity.core.domain.Verification.ApprovalStatus;
import com.cleancity.core.repository.ReportRepository;
import com.cleancity.core.repository.VerificationRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of the approval queue.
 */
@Service
@Transactional(readOnly = true)
public class ApprovalQueryService {

    private static final int MAX_PAGE_SIZE = 100;
    static final Duration RESOLUTION_WINDOW = Duration.ofDays(30);

    private final VerificationRepository verificationRepository;
    private final ReportRepository reportRepository;
    private final PointsReconciliationService reconciliationService;
    private final AdmissionProperties admissionProperties;
    private final Clock clock;

    public ApprovalQueryService(
            VerificationRepository verificationRepository,
            ReportRepository reportRepository,
            PointsReconciliationService reconciliationService,
            AdmissionProperties admissionProperties,
            Clock clock) {
        this.verificationRepository = verificationRepository;
        this.reportRepository = reportRepository;
        this.reconciliationService = reconciliationService;
        this.admissionProperties = admissionProperties;
        this.clock = clock;
    }

    /**
     * Completed verifications awaiting a decision, oldest completion first.
     */
    public PendingPage listPending(int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        List<Verification> verifications = verificationRepository.findCompletedByApprovalStatus(
                ApprovalStatus.PENDING, PageRequest.of(safePage, safeSize));
        long total = verificationRepository.countByApprovalStatusAndCompletedAtIsNotNull(ApprovalStatus.PENDING);

        Map<UUID, Report> reports = reportRepository
                .findAllById(verifications.stream().map(Verification::getReportId).toList())
                .stream()
                .collect(Collectors.toMap(Report::getId, Function.identity()));

        List<VerificationDetail> items = verifications.stream()
                .map(v -> toDetail(v, reports.get(v.getReportId())))
                .toList();
        return new PendingPage(items, safePage, safeSize, total);
    }

    public VerificationDetail getVerification(UUID verificationId) {
        Verification verification = verificationRepository.findById(verificationId)
                .orElseThrow(() -> new NotFoundException("Verification not found: " + verificationId));
        Report report = reportRepository.findById(verification.getReportId()).orElse(null);
        return toDetail(verification, report);
    }

    /**
     * Queue counters for today plus the average completion-to-resolution time
     * of approvals decided in the last {@link #RESOLUTION_WINDOW}.
     */
    public ApprovalStats stats() {
        Instant now = clock.instant();
        Instant startOfDay = LocalDate.ofInstant(now, admissionProperties.getCalendarZone())
                .atStartOfDay(admissionProperties.getCalendarZone()).toInstant();

        long pending = verificationRepository.countByApprovalStatusAndCompletedAtIsNotNull(ApprovalStatus.PENDING);
        long approvedToday = verificationRepository
                .countByApprovalStatusAndDecidedAtGreaterThanEqual(ApprovalStatus.APPROVED, startOfDay);
        long rejectedToday = verificationRepository
                .countByApprovalStatusAndDecidedAtGreaterThanEqual(ApprovalStatus.REJECTED, startOfDay);

        double averageHours = verificationRepository
                .findByApprovalStatusAndDecidedAtGreaterThanEqual(ApprovalStatus.APPROVED, now.minus(RESOLUTION_WINDOW))
                .stream()
                .filter(Verification::isCompleted)
                .mapToDouble(v -> Duration.between(v.getCompletedAt(), v.getDecidedAt()).toMinutes() / 60.0)
                .average()
                .orElse(0);

        return new ApprovalStats(pending, approvedToday, rejectedToday, Math.round(averageHours * 10) / 10.0,
                reconciliationService.countPending());
    }

    private static VerificationDetail toDetail(Verification v, Report report) {
        return new VerificationDetail(
                v.getId(),
                v.getReportId(),
                v.getWorkerId(),
                v.getApprovalStatus(),
                v.getBeforePhotoUrl(),
                v.getAfterPhotoUrl(),
                v.getStartedAt(),
                v.getCompletedAt(),
                v.getTimeSpentMinutes(),
                v.getWorkerLocation().getLatitude(),
                v.getWorkerLocation().getLongitude(),
                report == null ? null : report.getPhotoUrl(),
                report == null ? null : report.getLocation().getLatitude(),
                report == null ? null : report.getLocation().getLongitude(),
                report == null ? null : report.getSeverity(),
                report == null ? null : report.getDescription(),
                v.getDecidedBy(),
                v.getDecidedAt(),
                v.getRejectionReason());
    }

    public record VerificationDetail(
            UUID verificationId,
            UUID reportId,
            UUID workerId,
            ApprovalStatus approvalStatus,
            String beforePhotoUrl,
            String afterPhotoUrl,
            Instant startedAt,
            Instant completedAt,
            Integer timeSpentMinutes,
            double workerLatitude,
            double workerLongitude,
            String reportPhotoUrl,
            Double reportLatitude,
            Double reportLongitude,
            Severity severity,
            String description,
            UUID decidedBy,
            Instant decidedAt,
            String rejectionReason
    ) {}

    public record PendingPage(List<VerificationDetail> items, int page, int size, long total) {}

    /**
     * @param pendingPointsCredits approved reports whose points credit is still queued for retry
     */
    public record ApprovalStats(
            long pending,
            long approvedToday,
            long rejectedToday,
            double averageResolutionHours,
            long pendingPointsCredits
    ) {}
}
