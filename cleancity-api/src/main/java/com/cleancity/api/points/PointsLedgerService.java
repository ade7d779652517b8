package com.cleancity.api.points;

import com.cleancity.api.admission.AdmissionProperties;
import com.cleancity.api.error.NotFoundException;
import com.cleancity.api.error.StateException;
import com.cleancity.api.error.ValidationException;
import com.cleancity.api.notification.BadgeUnlockedEvent;
import com.cleancity.api.points.PointsCalculator.PointsBreakdown;
import com.cleancity.core.domain.Citizen;
import com.cleancity.core.domain.GeoBounds;
import com.cleancity.core.domain.PointReason;
import com.cleancity.core.domain.PointsEntry;
import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.domain.Severity;
import com.cleancity.core.repository.CitizenRepository;
import com.cleancity.core.repository.PointsEntryRepository;
import com.cleancity.core.repository.ReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Credits citizens for resolved reports, exactly once per report.
 *
 * The report row is locked and its pointsAwarded checked before crediting, and set in the
 * same transaction as the citizen increment and the history row. The history table's
 * unique report id backs this up at the database.
 */
@Service
public class PointsLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PointsLedgerService.class);

    private final ReportRepository reportRepository;
    private final CitizenRepository citizenRepository;
    private final PointsEntryRepository pointsEntryRepository;
    private final PointsCalculator calculator;
    private final PointsProperties properties;
    private final AdmissionProperties admissionProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PointsLedgerService(
            ReportRepository reportRepository,
            CitizenRepository citizenRepository,
            PointsEntryRepository pointsEntryRepository,
            PointsCalculator calculator,
            PointsProperties properties,
            AdmissionProperties admissionProperties,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.reportRepository = reportRepository;
        this.citizenRepository = citizenRepository;
        this.pointsEntryRepository = pointsEntryRepository;
        this.calculator = calculator;
        this.properties = properties;
        this.admissionProperties = admissionProperties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public AwardResult award(String deviceId, UUID reportId, PointReason reason, Severity severity) {
        Report report = reportRepository.findByIdForUpdate(reportId)
                .orElseThrow(() -> new NotFoundException("Report not found: " + reportId));
        if (!report.getDeviceId().equals(deviceId)) {
            throw new ValidationException("deviceId", "Report " + reportId + " was not submitted by this device");
        }
        if (report.hasPointsAwarded()) {
            log.info("Points already awarded for report={}, skipping", reportId);
            return new AwardResult(reportId, deviceId, report.getPointsAwarded(), true, null);
        }
        if (report.getStatus() != ReportStatus.RESOLVED) {
            throw new StateException("Points are only awarded for RESOLVED reports, report is " + report.getStatus());
        }

        Citizen citizen = citizenRepository.findByIdForUpdate(deviceId)
                .orElseThrow(() -> new NotFoundException("Citizen not found: " + deviceId));

        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, admissionProperties.getCalendarZone());
        Severity effectiveSeverity = severity != null ? severity : report.getSeverity();
        PointsBreakdown breakdown = calculator.calculate(
                effectiveSeverity, isPioneer(report), citizen.currentStreak(today));
        int points = breakdown.total();

        boolean badgeUnlocked = citizen.credit(points, now, today);
        report.recordPointsAwarded(points);
        citizenRepository.save(citizen);
        reportRepository.save(report);
        pointsEntryRepository.save(PointsEntry.create(deviceId, reportId,
                reason != null ? reason : PointReason.REPORT_VERIFIED,
                breakdown.basePoints(), breakdown.severityBonus(),
                breakdown.pioneerBonus(), breakdown.streakBonus(), now));

        log.info("Awarded {} points to device={} for report={} (base={} severity={} pioneer={} streak={})",
                points, deviceId, reportId, breakdown.basePoints(), breakdown.severityBonus(),
                breakdown.pioneerBonus(), breakdown.streakBonus());
        if (badgeUnlocked) {
            log.info("Device {} unlocked badge {}", deviceId, citizen.getCurrentBadge());
            eventPublisher.publishEvent(new BadgeUnlockedEvent(deviceId, citizen.getCurrentBadge(), now));
        }
        return new AwardResult(reportId, deviceId, points, false, breakdown);
    }

    /**
     * True when no other resolved report lies within the pioneer radius.
     */
    private boolean isPioneer(Report report) {
        double radius = properties.getPioneerRadiusMeters();
        GeoBounds box = GeoBounds.around(report.getLocation(), radius);
        return reportRepository.findOthersInBox(ReportStatus.RESOLVED, report.getId(),
                        box.minLatitude(), box.maxLatitude(), box.minLongitude(), box.maxLongitude())
                .stream()
                .noneMatch(other -> other.getLocation().distanceTo(report.getLocation()) <= radius);
    }

    /**
     * @param alreadyAwarded true when this call was a no-op because the report was credited before
     */
    public record AwardResult(
            UUID reportId,
            String deviceId,
            int pointsAwarded,
            boolean alreadyAwarded,
            PointsBreakdown breakdown
    ) {}
}
