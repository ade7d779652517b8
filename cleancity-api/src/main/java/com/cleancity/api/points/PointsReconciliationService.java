package com.cleancity.api.points;

import com.cleancity.core.domain.PointReason;
import com.cleancity.core.domain.PointsCreditRetry;
import com.cleancity.core.domain.PointsCreditRetry.RetryStatus;
import com.cleancity.core.domain.Severity;
import com.cleancity.core.repository.PointsCreditRetryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Retry queue for points credits that failed after an approval committed.
 * Entries are retried through the idempotent ledger until they succeed or go DEAD.
 */
@Service
public class PointsReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PointsReconciliationService.class);

    private final PointsCreditRetryRepository retryRepository;
    private final PointsLedgerService pointsLedgerService;
    private final PointsProperties properties;
    private final Clock clock;

    public PointsReconciliationService(
            PointsCreditRetryRepository retryRepository,
            PointsLedgerService pointsLedgerService,
            PointsProperties properties,
            Clock clock) {
        this.retryRepository = retryRepository;
        this.pointsLedgerService = pointsLedgerService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID enqueue(UUID reportId, String deviceId, PointReason reason, Severity severity, String error) {
        return retryRepository.findByReportId(reportId)
                .map(PointsCreditRetry::getId)
                .orElseGet(() -> retryRepository.save(
                        PointsCreditRetry.create(reportId, deviceId, reason, severity, error, clock.instant()))
                        .getId());
    }

    @Scheduled(
            fixedDelayString = "${cleancity.points.reconciliation.interval:PT1M}",
            initialDelayString = "${cleancity.points.reconciliation.initial-delay:PT1M}")
    public void runScheduled() {
        int processed = processDue();
        if (processed > 0) {
            log.info("Points reconciliation processed {} entries", processed);
        }
    }

    /**
     * Retries every due entry once.
     *
     * @return number of entries attempted
     */
    public int processDue() {
        Instant now = clock.instant();
        List<PointsCreditRetry> due = retryRepository.findDue(RetryStatus.PENDING, now,
                PageRequest.of(0, properties.getReconciliation().getBatchSize()));
        for (PointsCreditRetry entry : due) {
            retry(entry);
        }
        return due.size();
    }

    private void retry(PointsCreditRetry entry) {
        Instant now = clock.instant();
        try {
            var result = pointsLedgerService.award(
                    entry.getDeviceId(), entry.getReportId(), entry.getReason(), entry.getSeverity());
            entry.markCompleted(now);
            log.info("Reconciled points for report={} points={}", entry.getReportId(), result.pointsAwarded());
        } catch (RuntimeException e) {
            int maxAttempts = properties.getReconciliation().getMaxAttempts();
            entry.recordFailure(e.getMessage(), now.plus(properties.getReconciliation().getRetryDelay()), maxAttempts);
            if (entry.getStatus() == RetryStatus.DEAD) {
                log.error("Points reconciliation gave up on report={} after {} attempts",
                        entry.getReportId(), entry.getAttempts(), e);
            } else {
                log.warn("Points reconciliation attempt {} failed for report={}: {}",
                        entry.getAttempts(), entry.getReportId(), e.getMessage());
            }
        }
        retryRepository.save(entry);
    }

    public long countPending() {
        return retryRepository.countByStatus(RetryStatus.PENDING);
    }
}
