package com.cleancity.api.approval;

import com.cleancity.api.error.ApprovalConflictException;
import com.cleancity.api.error.ErrorCode;
import com.cleancity.api.error.NotFoundException;
import com.cleancity.api.error.StateException;
import com.cleancity.api.error.ValidationException;
import com.cleancity.api.notification.VerificationApprovedEvent;
import com.cleancity.api.points.PointsLedgerService;
import com.cleancity.api.points.PointsReconciliationService;
import com.cleancity.api.status.ReportStatusService;
import com.cleancity.core.domain.PointReason;
import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.domain.Severity;
import com.cleancity.core.domain.Verification;
import com.cleancity.core.domain.Verification.ApprovalStatus;
import com.cleancity.core.repository.VerificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Administrative decision on a completed verification.
 *
 * Approval commits the RESOLVED status first and credits points afterwards; a failed
 * credit is queued for reconciliation and never undoes the approval.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);
    private static final int MAX_REASON_LENGTH = 500;

    private final VerificationRepository verificationRepository;
    private final ReportStatusService reportStatusService;
    private final PointsLedgerService pointsLedgerService;
    private final PointsReconciliationService reconciliationService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ApprovalService(
            VerificationRepository verificationRepository,
            ReportStatusService reportStatusService,
            PointsLedgerService pointsLedgerService,
            PointsReconciliationService reconciliationService,
            ApplicationEventPublisher eventPublisher,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.verificationRepository = verificationRepository;
        this.reportStatusService = reportStatusService;
        this.pointsLedgerService = pointsLedgerService;
        this.reconciliationService = reconciliationService;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public ApprovalResult approve(UUID verificationId, UUID adminId) {
        requireAdmin(adminId);
        UUID reportId = reportIdOf(verificationId);

        Decision decision = transactionTemplate.execute(status -> {
            Report report = reportStatusService.lockReport(reportId);
            Verification verification = lockVerification(verificationId);
            requireDecidable(verification, report);

            Instant now = clock.instant();
            verification.approve(adminId, now);
            verificationRepository.save(verification);
            reportStatusService.applyTransition(report, ReportStatus.RESOLVED, null);
            return new Decision(report.getId(), report.getDeviceId(), report.getSeverity());
        });
        log.info("Verification {} approved by admin={} report={}", verificationId, adminId, reportId);

        int points = creditPoints(decision);
        eventPublisher.publishEvent(new VerificationApprovedEvent(
                verificationId, reportId, decision.deviceId(), points, clock.instant()));
        return new ApprovalResult(verificationId, reportId, ReportStatus.RESOLVED, points, points == 0);
    }

    public RejectionResult reject(UUID verificationId, UUID adminId, String reason) {
        requireAdmin(adminId);
        String normalizedReason = reason == null || reason.isBlank() ? null : reason.trim();
        if (normalizedReason != null && normalizedReason.length() > MAX_REASON_LENGTH) {
            throw new ValidationException("reason", "Reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
        UUID reportId = reportIdOf(verificationId);

        RejectionResult result = transactionTemplate.execute(status -> {
            Report report = reportStatusService.lockReport(reportId);
            Verification verification = lockVerification(verificationId);
            requireDecidable(verification, report);

            verification.reject(adminId, normalizedReason, clock.instant());
            verificationRepository.save(verification);
            reportStatusService.applyTransition(report, ReportStatus.ASSIGNED, report.getAssignedWorkerId());
            return new RejectionResult(verificationId, reportId, ReportStatus.ASSIGNED,
                    report.getAssignedWorkerId(), normalizedReason);
        });
        log.info("Verification {} rejected by admin={} report={} reason={}",
                verificationId, adminId, reportId, normalizedReason);
        return result;
    }

    private int creditPoints(Decision decision) {
        try {
            return pointsLedgerService
                    .award(decision.deviceId(), decision.reportId(), PointReason.REPORT_VERIFIED, decision.severity())
                    .pointsAwarded();
        } catch (RuntimeException e) {
            UUID entryId = reconciliationService.enqueue(decision.reportId(), decision.deviceId(),
                    PointReason.REPORT_VERIFIED, decision.severity(), e.getMessage());
            log.error("Points credit failed after approval report={} device={} reconciliation={}",
                    decision.reportId(), decision.deviceId(), entryId, e);
            return 0;
        }
    }

    private UUID reportIdOf(UUID verificationId) {
        return verificationRepository.findById(verificationId)
                .map(Verification::getReportId)
                .orElseThrow(() -> new NotFoundException("Verification not found: " + verificationId));
    }

    private Verification lockVerification(UUID verificationId) {
        return verificationRepository.findByIdForUpdate(verificationId)
                .orElseThrow(() -> new NotFoundException("Verification not found: " + verificationId));
    }

    private static void requireDecidable(Verification verification, Report report) {
        if (verification.getApprovalStatus() == ApprovalStatus.APPROVED) {
            throw new ApprovalConflictException(ErrorCode.ALREADY_APPROVED, "Verification already approved");
        }
        if (verification.getApprovalStatus() == ApprovalStatus.REJECTED) {
            throw new ApprovalConflictException(ErrorCode.ALREADY_REJECTED, "Verification already rejected");
        }
        if (!verification.isCompleted()) {
            throw new StateException("Verification has not been completed yet");
        }
        if (report.getStatus() != ReportStatus.VERIFIED) {
            throw new StateException("Report must be VERIFIED for a decision, but is " + report.getStatus());
        }
    }

    private static void requireAdmin(UUID adminId) {
        if (adminId == null) {
            throw new ValidationException("adminId", "Admin ID is required");
        }
    }

    private record Decision(UUID reportId, String deviceId, Severity severity) {}

    /**
     * @param pointsPending true when the credit failed and was queued for reconciliation
     */
    public record ApprovalResult(
            UUID verificationId,
            UUID reportId,
            ReportStatus status,
            int pointsAwarded,
            boolean pointsPending
    ) {}

    public record RejectionResult(
            UUID verificationId,
            UUID reportId,
            ReportStatus status,
            UUID assignedWorkerId,
            String reason
    ) {}
}
