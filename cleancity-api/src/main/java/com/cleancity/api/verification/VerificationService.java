package com.cleancity.api.verification;

import com.cleancity.api.error.ForbiddenException;
import com.cleancity.api.error.GeofenceException;
import com.cleancity.api.error.NotFoundException;
import com.cleancity.api.error.StateException;
import com.cleancity.api.error.TimingException;
import com.cleancity.api.error.ValidationException;
import com.cleancity.api.status.ReportStatusService;
import com.cleancity.core.domain.GeoLocation;
import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.domain.Verification;
import com.cleancity.core.domain.Verification.ApprovalStatus;
import com.cleancity.core.repository.VerificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Worker-side start and completion of a cleanup.
 *
 * Both operations lock the report first, then check status, worker, and the
 * geofence or timing rule before writing anything.
 */
@Service
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final VerificationRepository verificationRepository;
    private final ReportStatusService reportStatusService;
    private final VerificationProperties properties;
    private final Clock clock;

    public VerificationService(
            VerificationRepository verificationRepository,
            ReportStatusService reportStatusService,
            VerificationProperties properties,
            Clock clock) {
        this.verificationRepository = verificationRepository;
        this.reportStatusService = reportStatusService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public StartResult startTask(UUID reportId, UUID workerId, StartTaskCommand command) {
        requireWorker(workerId);
        validateStart(command);

        Report report = reportStatusService.lockReport(reportId);
        if (report.getStatus() != ReportStatus.ASSIGNED) {
            throw new StateException("Report must be ASSIGNED to start cleanup, but is " + report.getStatus());
        }
        if (!report.isAssignedTo(workerId)) {
            throw new ForbiddenException("Report is not assigned to this worker");
        }

        GeoLocation workerLocation = GeoLocation.of(command.latitude(), command.longitude(), command.accuracy());
        double distance = VerificationRules.distanceMeters(workerLocation, report.getLocation());
        if (!VerificationRules.isWithinGeofence(distance, properties.getMaxDistanceMeters())) {
            log.warn("Start rejected for report={} worker={} distance={}m", reportId, workerId, Math.round(distance));
            throw new GeofenceException(distance, properties.getMaxDistanceMeters());
        }

        Instant now = clock.instant();
        Verification verification = verificationRepository.save(Verification.start(
                reportId, workerId, workerLocation, command.beforePhotoUrl().trim(), now));
        reportStatusService.applyTransition(report, ReportStatus.IN_PROGRESS, workerId);

        log.info("Cleanup started report={} worker={} verification={} distance={}m",
                reportId, workerId, verification.getId(), Math.round(distance));
        return new StartResult(verification.getId(), reportId, ReportStatus.IN_PROGRESS, distance, now);
    }

    @Transactional
    public CompleteResult completeTask(UUID reportId, UUID workerId, String afterPhotoUrl) {
        requireWorker(workerId);
        if (afterPhotoUrl == null || afterPhotoUrl.isBlank()) {
            throw new ValidationException("afterPhotoUrl", "After photo is required");
        }

        Report report = reportStatusService.lockReport(reportId);
        if (report.getStatus() != ReportStatus.IN_PROGRESS) {
            throw new StateException("Report must be IN_PROGRESS to complete cleanup, but is " + report.getStatus());
        }
        if (!report.isAssignedTo(workerId)) {
            throw new ForbiddenException("Report is not assigned to this worker");
        }

        UUID verificationId = verificationRepository
                .findFirstByReportIdAndApprovalStatusOrderByStartedAtDesc(reportId, ApprovalStatus.PENDING)
                .filter(v -> !v.isCompleted())
                .map(Verification::getId)
                .orElseThrow(() -> new StateException("No verification in progress for report " + reportId));
        Verification verification = verificationRepository.findByIdForUpdate(verificationId)
                .orElseThrow(() -> new NotFoundException("Verification not found: " + verificationId));
        if (!verification.belongsTo(workerId)) {
            throw new ForbiddenException("Verification belongs to another worker");
        }

        Instant now = clock.instant();
        double elapsed = verification.elapsedMinutes(now);
        if (!VerificationRules.isWithinTimingWindow(elapsed, properties.getMinMinutes(), properties.getMaxMinutes())) {
            log.warn("Completion rejected for report={} worker={} elapsed={}min", reportId, workerId, elapsed);
            throw new TimingException(elapsed, properties.getMinMinutes(), properties.getMaxMinutes());
        }

        verification.complete(afterPhotoUrl.trim(), now);
        verificationRepository.save(verification);
        reportStatusService.applyTransition(report, ReportStatus.VERIFIED, workerId);

        log.info("Cleanup completed report={} worker={} timeSpent={}min",
                reportId, workerId, verification.getTimeSpentMinutes());
        return new CompleteResult(verification.getId(), reportId, ReportStatus.VERIFIED,
                verification.getTimeSpentMinutes(), now);
    }

    private static void requireWorker(UUID workerId) {
        if (workerId == null) {
            throw new ValidationException("workerId", "Worker ID is required");
        }
    }

    private static void validateStart(StartTaskCommand command) {
        if (command == null) {
            throw new ValidationException("body", "Request body is required");
        }
        if (command.latitude() == null || !Double.isFinite(command.latitude())
                || command.latitude() < -90 || command.latitude() > 90) {
            throw new ValidationException("latitude", "Latitude must be between -90 and 90");
        }
        if (command.longitude() == null || !Double.isFinite(command.longitude())
                || command.longitude() < -180 || command.longitude() > 180) {
            throw new ValidationException("longitude", "Longitude must be between -180 and 180");
        }
        if (command.accuracy() != null && (!Double.isFinite(command.accuracy()) || command.accuracy() < 0)) {
            throw new ValidationException("accuracy", "Accuracy must be a non-negative number");
        }
        if (command.beforePhotoUrl() == null || command.beforePhotoUrl().isBlank()) {
            throw new ValidationException("beforePhotoUrl", "Before photo is required");
        }
    }

    public record StartTaskCommand(Double latitude, Double longitude, Double accuracy, String beforePhotoUrl) {}

    public record StartResult(
            UUID verificationId,
            UUID reportId,
            ReportStatus status,
            double distanceMeters,
            Instant startedAt
    ) {}

    public record CompleteResult(
            UUID verificationId,
            UUID reportId,
            ReportStatus status,
            int timeSpentMinutes,
            Instant completedAt
    ) {}
}
