package com.cleancity.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Queued points credit for a resolved report whose post-approval credit failed.
 * Retried until it succeeds or runs out of attempts.
 */
@Entity
@Table(name = "points_reconciliation", indexes = {
    @Index(name = "idx_points_reconciliation_due", columnList = "status, next_attempt_at")
})
public class PointsCreditRetry {

    private static final int MAX_ERROR_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "report_id", nullable = false, unique = true)
    private UUID reportId;

    @NotNull
    @Column(name = "device_id", nullable = false, length = 128)
    private String deviceId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 30)
    private PointReason reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 10)
    private Severity severity;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RetryStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;

    protected PointsCreditRetry() {}

    public static PointsCreditRetry create(UUID reportId, String deviceId, PointReason reason,
                                           Severity severity, String error, Instant now) {
        var retry = new PointsCreditRetry();
        retry.reportId = reportId;
        retry.deviceId = deviceId;
        retry.reason = reason;
        retry.severity = severity;
        retry.status = RetryStatus.PENDING;
        retry.attempts = 0;
        retry.lastError = truncate(error);
        retry.createdAt = now;
        retry.nextAttemptAt = now;
        return retry;
    }

    public void recordFailure(String error, Instant nextAttempt, int maxAttempts) {
        attempts++;
        lastError = truncate(error);
        nextAttemptAt = nextAttempt;
        if (attempts >= maxAttempts) {
            status = RetryStatus.DEAD;
        }
    }

    public void markCompleted(Instant at) {
        attempts++;
        status = RetryStatus.COMPLETED;
        completedAt = at;
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    public UUID getId() { return id; }
    public UUID getReportId() { return reportId; }
    public String getDeviceId() { return deviceId; }
    public PointReason getReason() { return reason; }
    public Severity getSeverity() { return severity; }
    public RetryStatus getStatus() { return status; }
    public int getAttempts() { return attempts; }
    public String getLastError() { return lastError; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public Instant getCompletedAt() { return completedAt; }

    public enum RetryStatus {
        PENDING, COMPLETED, DEAD
    }
}
