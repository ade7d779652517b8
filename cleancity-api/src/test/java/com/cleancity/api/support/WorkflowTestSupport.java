package com.cleancity.api.support;

import com.cleancity.api.CleanCityApiApplication;
import com.cleancity.api.admission.AdmissionControlService;
import com.cleancity.api.admission.ReportSubmission;
import com.cleancity.api.approval.ApprovalService;
import com.cleancity.api.status.ReportStatusService;
import com.cleancity.api.verification.VerificationService;
import com.cleancity.api.verification.VerificationService.StartTaskCommand;
import com.cleancity.api.worker.WorkerService;
import com.cleancity.core.domain.Severity;
import com.cleancity.core.repository.CitizenRepository;
import com.cleancity.core.repository.ReportRepository;
import com.cleancity.core.repository.VerificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared context and fixtures for service-level workflow tests.
 *
 * The database outlives individual tests, so every fixture uses a fresh device id,
 * worker phone and random coordinates.
 */
@SpringBootTest(classes = CleanCityApiApplication.class)
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
public abstract class WorkflowTestSupport {

    protected static final Instant BASE_TIME = Instant.parse("2025-06-16T08:00:00Z");

    @Autowired protected MutableClock clock;
    @Autowired protected RecordingNotificationDispatcher notifications;
    @Autowired protected AdmissionControlService admissionControlService;
    @Autowired protected ReportStatusService reportStatusService;
    @Autowired protected VerificationService verificationService;
    @Autowired protected ApprovalService approvalService;
    @Autowired protected WorkerService workerService;
    @Autowired protected ReportRepository reportRepository;
    @Autowired protected VerificationRepository verificationRepository;
    @Autowired protected CitizenRepository citizenRepository;

    @BeforeEach
    protected void resetClock() {
        clock.set(BASE_TIME);
    }

    protected static String newDeviceId() {
        return "dev_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Random point away from the poles and the antimeridian.
     */
    protected static double[] randomPoint() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return new double[] {random.nextDouble(-50, 50), random.nextDouble(-150, 150)};
    }

    protected static String newZone() {
        return "zone-" + UUID.randomUUID().toString().substring(0, 8);
    }

    protected static ReportSubmission submission(String deviceId, double latitude, double longitude,
                                                 Severity severity, String area, Instant capturedAt) {
        return new ReportSubmission(deviceId, latitude, longitude, 6.0,
                "https://cdn.cleancity.test/photos/" + UUID.randomUUID() + ".jpg",
                capturedAt, "Garbage pile near bus stop", severity, Set.of("plastic"), area);
    }

    protected UUID submit(String deviceId, double latitude, double longitude, Severity severity, String area) {
        return admissionControlService
                .submitReport(submission(deviceId, latitude, longitude, severity, area, clock.instant()))
                .reportId();
    }

    protected UUID registerWorker(String zone) {
        String phone = "+91" + ThreadLocalRandom.current().nextLong(1_000_000_000L, 9_999_999_999L);
        return workerService.register("Field Worker", phone, zone == null ? Set.of() : Set.of(zone)).id();
    }

    protected Fixture openReport(Severity severity) {
        String deviceId = newDeviceId();
        double[] point = randomPoint();
        String zone = newZone();
        UUID reportId = submit(deviceId, point[0], point[1], severity, zone);
        return new Fixture(reportId, deviceId, null, null, point[0], point[1], zone);
    }

    protected Fixture assignedReport(Severity severity) {
        Fixture open = openReport(severity);
        UUID workerId = registerWorker(open.zone());
        reportStatusService.assign(open.reportId(), workerId);
        return open.withWorker(workerId);
    }

    protected Fixture startedReport(Severity severity) {
        Fixture assigned = assignedReport(severity);
        UUID verificationId = verificationService.startTask(assigned.reportId(), assigned.workerId(),
                new StartTaskCommand(assigned.latitude(), assigned.longitude(), 5.0,
                        "https://cdn.cleancity.test/before.jpg")).verificationId();
        return assigned.withVerification(verificationId);
    }

    protected Fixture verifiedReport(Severity severity, Duration workDuration) {
        Fixture started = startedReport(severity);
        clock.advance(workDuration);
        verificationService.completeTask(started.reportId(), started.workerId(), "https://cdn.cleancity.test/after.jpg");
        return started;
    }

    public record Fixture(
            UUID reportId,
            String deviceId,
            UUID workerId,
            UUID verificationId,
            double latitude,
            double longitude,
            String zone
    ) {
        Fixture withWorker(UUID worker) {
            return new Fixture(reportId, deviceId, worker, verificationId, latitude, longitude, zone);
        }

        Fixture withVerification(UUID verification) {
            return new Fixture(reportId, deviceId, workerId, verification, latitude, longitude, zone);
        }
    }
}
