package com.cleancity.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One cleanup attempt by a worker on a report: before photo and position at start,
 * after photo at completion, then an admin decision.
 */
@Entity
@Table(name = "verifications", indexes = {
    @Index(name = "idx_verifications_report", columnList = "report_id"),
    @Index(name = "idx_verifications_worker", columnList = "worker_id"),
    @Index(name = "idx_verifications_approval", columnList = "approval_status")
})
public class Verification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "report_id", nullable = false)
    private UUID reportId;

    @NotNull
    @Column(name = "worker_id", nullable = false)
    private UUID workerId;

    @NotNull
    @Column(name = "before_photo_url", nullable = false, length = 2048)
    private String beforePhotoUrl;

    @Column(name = "after_photo_url", length = 2048)
    private String afterPhotoUrl;

    @NotNull
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "latitude", column = @Column(name = "worker_latitude", nullable = false)),
        @AttributeOverride(name = "longitude", column = @Column(name = "worker_longitude", nullable = false)),
        @AttributeOverride(name = "accuracy", column = @Column(name = "worker_accuracy"))
    })
    private GeoLocation workerLocation;

    @NotNull
    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "time_spent_minutes")
    private Integer timeSpentMinutes;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false, length = 20)
    private ApprovalStatus approvalStatus;

    @Column(name = "decided_by")
    private UUID decidedBy;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    @Version
    private Long version;

    protected Verification() {}

    public static Verification start(UUID reportId, UUID workerId, GeoLocation workerLocation,
                                     String beforePhotoUrl, Instant startedAt) {
        var verification = new Verification();
        verification.reportId = reportId;
        verification.workerId = workerId;
        verification.workerLocation = workerLocation;
        verification.beforePhotoUrl = beforePhotoUrl;
        verification.startedAt = startedAt;
        verification.approvalStatus = ApprovalStatus.PENDING;
        return verification;
    }

    public void complete(String afterPhotoUrl, Instant at) {
        if (completedAt != null) {
            throw new IllegalStateException("Verification already completed");
        }
        this.afterPhotoUrl = afterPhotoUrl;
        this.completedAt = at;
        this.timeSpentMinutes = (int) Math.round(elapsedMinutes(at));
    }

    public void approve(UUID adminId, Instant at) {
        requireDecidable();
        this.approvalStatus = ApprovalStatus.APPROVED;
        this.decidedBy = adminId;
        this.decidedAt = at;
    }

    public void reject(UUID adminId, String reason, Instant at) {
        requireDecidable();
        this.approvalStatus = ApprovalStatus.REJECTED;
        this.decidedBy = adminId;
        this.decidedAt = at;
        this.rejectionReason = reason;
    }

    private void requireDecidable() {
        if (approvalStatus != ApprovalStatus.PENDING) {
            throw new IllegalStateException("Verification already " + approvalStatus);
        }
        if (completedAt == null) {
            throw new IllegalStateException("Verification has not been completed");
        }
    }

    /**
     * Minutes between start and {@code at}, fractional.
     */
    public double elapsedMinutes(Instant at) {
        return Duration.between(startedAt, at).toMillis() / 60_000.0;
    }

    public boolean isPending() {
        return approvalStatus == ApprovalStatus.PENDING;
    }

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean belongsTo(UUID worker) {
        return workerId.equals(worker);
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getReportId() { return reportId; }
    public UUID getWorkerId() { return workerId; }
    public String getBeforePhotoUrl() { return beforePhotoUrl; }
    public String getAfterPhotoUrl() { return afterPhotoUrl; }
    public GeoLocation getWorkerLocation() { return workerLocation; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Integer getTimeSpentMinutes() { return timeSpentMinutes; }
    public ApprovalStatus getApprovalStatus() { return approvalStatus; }
    public UUID getDecidedBy() { return decidedBy; }
    public Instant getDecidedAt() { return decidedAt; }
    public String getRejectionReason() { return rejectionReason; }

    public enum ApprovalStatus {
        PENDING, APPROVED, REJECTED
    }
}
