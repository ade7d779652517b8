package com.cleancity.api.status;

import com.cleancity.api.error.NotFoundException;
import com.cleancity.api.error.StateException;
import com.cleancity.api.error.ValidationException;
import com.cleancity.api.notification.ReportStatusChangedEvent;
import com.cleancity.api.worker.WorkerService;
import com.cleancity.core.domain.InvalidTransitionException;
import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.repository.ReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Owns report status changes. Every change runs against a row-locked report so two
 * callers can never both leave the same source state.
 */
@Service
public class ReportStatusService {

    private static final Logger log = LoggerFactory.getLogger(ReportStatusService.class);

    private final ReportRepository reportRepository;
    private final WorkerService workerService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReportStatusService(
            ReportRepository reportRepository,
            WorkerService workerService,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.reportRepository = reportRepository;
        this.workerService = workerService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Moves a report to {@code target}.
     *
     * @param actorId the worker to bind when assigning an OPEN report
     */
    @Transactional
    public TransitionResult transition(UUID reportId, ReportStatus target, UUID actorId) {
        if (target == null) {
            throw new ValidationException("status", "Target status is required");
        }
        Report report = lockReport(reportId);
        if (target == ReportStatus.ASSIGNED && report.getStatus() == ReportStatus.OPEN) {
            if (actorId == null) {
                throw new ValidationException("workerId", "A worker is required to assign a report");
            }
            workerService.requireActiveWorker(actorId);
        }
        return applyTransition(report, target, actorId);
    }

    @Transactional
    public TransitionResult assign(UUID reportId, UUID workerId) {
        return transition(reportId, ReportStatus.ASSIGNED, workerId);
    }

    @Transactional
    public TransitionResult unassign(UUID reportId) {
        return transition(reportId, ReportStatus.OPEN, null);
    }

    /**
     * Applies a transition to a report the caller has already locked in its transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransitionResult applyTransition(Report report, ReportStatus target, UUID workerId) {
        ReportStatus previous = report.getStatus();
        Instant now = clock.instant();
        try {
            report.transitionTo(target, workerId, now);
        } catch (InvalidTransitionException e) {
            throw new StateException(e.getMessage());
        }
        reportRepository.save(report);

        log.info("Report {} status {} -> {}", report.getId(), previous, target);
        eventPublisher.publishEvent(new ReportStatusChangedEvent(
                report.getId(), report.getDeviceId(), previous, target,
                report.getAssignedWorkerId(), report.getArea(), now));
        return new TransitionResult(report.getId(), previous, target, report.getAssignedWorkerId(), now);
    }

    public Report lockReport(UUID reportId) {
        return reportRepository.findByIdForUpdate(reportId)
                .orElseThrow(() -> new NotFoundException("Report not found: " + reportId));
    }

    public record TransitionResult(
            UUID reportId,
            ReportStatus previousStatus,
            ReportStatus status,
            UUID assignedWorkerId,
            Instant changedAt
    ) {}
}
