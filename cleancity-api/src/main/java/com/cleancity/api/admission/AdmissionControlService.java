package com.cleancity.api.admission;

import com.cleancity.api.error.AdmissionException;
import com.cleancity.api.error.ErrorCode;
import com.cleancity.api.error.NotFoundException;
import com.cleancity.core.domain.Citizen;
import com.cleancity.core.domain.GeoBounds;
import com.cleancity.core.domain.GeoLocation;
import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.repository.CitizenRepository;
import com.cleancity.core.repository.ReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Gate in front of report creation.
 *
 * Checks run in a fixed order and the first failure wins: daily cap, cooldown,
 * stale photo, duplicate hotspot, field validation. The citizen row is locked for the
 * whole check-and-insert so two near-simultaneous submissions from one device are serialized.
 * The citizen row itself is created beforehand in a separate short transaction.
 */
@Service
public class AdmissionControlService {

    private static final Logger log = LoggerFactory.getLogger(AdmissionControlService.class);

    private final ReportRepository reportRepository;
    private final CitizenRepository citizenRepository;
    private final CitizenRegistry citizenRegistry;
    private final ReportValidator validator;
    private final AdmissionProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public AdmissionControlService(
            ReportRepository reportRepository,
            CitizenRepository citizenRepository,
            CitizenRegistry citizenRegistry,
            ReportValidator validator,
            AdmissionProperties properties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.reportRepository = reportRepository;
        this.citizenRepository = citizenRepository;
        this.citizenRegistry = citizenRegistry;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public SubmissionResult submitReport(ReportSubmission submission) {
        Instant now = clock.instant();
        validator.validateDeviceId(submission.deviceId());
        citizenRegistry.ensureRegistered(submission.deviceId(), now);
        return transactionTemplate.execute(status -> admit(submission, now));
    }

    private SubmissionResult admit(ReportSubmission submission, Instant now) {
        String deviceId = submission.deviceId();
        Citizen citizen = citizenRepository.findByIdForUpdate(deviceId)
                .orElseThrow(() -> new NotFoundException("Citizen not found: " + deviceId));

        ZoneId zone = properties.getCalendarZone();
        LocalDate today = LocalDate.ofInstant(now, zone);

        checkDailyCap(citizen, today, now, zone);
        checkCooldown(citizen, now);
        checkFreshness(submission.capturedAt(), now);
        checkDuplicate(submission, now);
        validator.validateFields(submission);

        Report report = Report.create(
                deviceId,
                submission.photoUrl().trim(),
                GeoLocation.of(submission.latitude(), submission.longitude(), submission.accuracy()),
                ReportValidator.normalizeDescription(submission.description()),
                normalizeArea(submission.area()),
                submission.severity(),
                normalizeWasteTypes(submission.wasteTypes()),
                submission.capturedAt(),
                now);
        Report saved = reportRepository.save(report);

        citizen.recordSubmission(now, today, saved.getArea());
        citizenRepository.save(citizen);

        log.info("Report created id={} device={} location={} severity={}",
                saved.getId(), deviceId, saved.getLocation(), saved.getSeverity());
        return new SubmissionResult(saved.getId(), saved.getStatus(), saved.getCreatedAt());
    }

    private void checkDailyCap(Citizen citizen, LocalDate today, Instant now, ZoneId zone) {
        if (citizen.reportsSubmittedOn(today) >= properties.getMaxReportsPerDay()) {
            long untilMidnight = Duration.between(now, today.plusDays(1).atStartOfDay(zone).toInstant()).getSeconds();
            log.warn("Daily limit reached for device={}", citizen.getDeviceId());
            throw new AdmissionException(ErrorCode.DAILY_LIMIT_REACHED,
                    "Daily limit of " + properties.getMaxReportsPerDay() + " reports reached. Try again tomorrow.",
                    Math.max(1, untilMidnight));
        }
    }

    private void checkCooldown(Citizen citizen, Instant now) {
        Instant last = citizen.getLastReportAt();
        if (last == null) {
            return;
        }
        Duration sinceLast = Duration.between(last, now);
        if (sinceLast.compareTo(properties.getCooldown()) < 0) {
            Duration remaining = properties.getCooldown().minus(sinceLast);
            long retryAfter = Math.max(1, (remaining.toMillis() + 999) / 1000);
            log.warn("Cooldown active for device={} retryAfter={}s", citizen.getDeviceId(), retryAfter);
            throw new AdmissionException(ErrorCode.COOLDOWN_ACTIVE,
                    "Please wait " + retryAfter + " seconds before submitting another report.",
                    retryAfter);
        }
    }

    private void checkFreshness(Instant capturedAt, Instant now) {
        validator.requireCapturedAt(capturedAt, now);
        Duration age = Duration.between(capturedAt, now);
        if (age.compareTo(properties.getMaxPhotoAge()) > 0) {
            log.warn("Stale photo rejected, age={}s", age.getSeconds());
            throw new AdmissionException(ErrorCode.STALE_PHOTO,
                    "Photo must be taken within the last " + properties.getMaxPhotoAge().toMinutes() + " minutes.",
                    Map.of("ageSeconds", age.getSeconds()));
        }
    }

    private void checkDuplicate(ReportSubmission submission, Instant now) {
        if (!validator.hasValidCoordinates(submission.latitude(), submission.longitude())) {
            return;
        }
        findNearbyOpenReport(submission.latitude(), submission.longitude(), now).ifPresent(existing -> {
            log.warn("Duplicate report near existing report={}", existing.getId());
            throw new AdmissionException(ErrorCode.DUPLICATE_REPORT,
                    "A report already exists at this location.",
                    Map.of("existingReportId", existing.getId().toString()));
        });
    }

    /**
     * Closest OPEN report within the duplicate radius created inside the duplicate window.
     */
    public Optional<Report> findNearbyOpenReport(double latitude, double longitude, Instant now) {
        double radius = properties.getDuplicateRadiusMeters();
        GeoLocation target = GeoLocation.of(latitude, longitude);
        GeoBounds box = GeoBounds.around(target, radius);

        return reportRepository.findCreatedSinceInBox(
                        ReportStatus.OPEN,
                        now.minus(properties.getDuplicateWindow()),
                        box.minLatitude(), box.maxLatitude(),
                        box.minLongitude(), box.maxLongitude())
                .stream()
                .filter(r -> r.getLocation().distanceTo(target) <= radius)
                .min(Comparator.comparingDouble(r -> r.getLocation().distanceTo(target)));
    }

    private static String normalizeArea(String area) {
        if (area == null || area.isBlank()) {
            return null;
        }
        return area.trim();
    }

    private static Set<String> normalizeWasteTypes(Set<String> wasteTypes) {
        if (wasteTypes == null) {
            return Set.of();
        }
        return wasteTypes.stream()
                .map(String::trim)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public record SubmissionResult(UUID reportId, ReportStatus status, Instant createdAt) {}
}
