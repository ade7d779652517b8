package com.cleancity.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A geotagged photo report of a waste hotspot.
 *
 * Status changes go through {@link #transitionTo}, which enforces the
 * {@link ReportStatus} transition table and stamps the stage timestamps.
 * Points are recorded at most once.
 */
@Entity
@Table(name = "reports", indexes = {
    @Index(name = "idx_reports_device", columnList = "device_id"),
    @Index(name = "idx_reports_status", columnList = "status"),
    @Index(name = "idx_reports_worker", columnList = "assigned_worker_id"),
    @Index(name = "idx_reports_created", columnList = "created_at")
})
public class Report {

    public static final int MAX_DESCRIPTION_LENGTH = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "device_id", nullable = false, length = 128)
    private String deviceId;

    @NotNull
    @Column(name = "photo_url", nullable = false, length = 2048)
    private String photoUrl;

    @NotNull
    @Embedded
    private GeoLocation location;

    @Size(max = MAX_DESCRIPTION_LENGTH)
    @Column(name = "description", length = MAX_DESCRIPTION_LENGTH)
    private String description;

    @Column(name = "area", length = 100)
    private String area;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 10)
    private Severity severity;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "report_waste_types", joinColumns = @JoinColumn(name = "report_id"))
    @Column(name = "waste_type", nullable = false, length = 50)
    private Set<String> wasteTypes = new LinkedHashSet<>();

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReportStatus status;

    @Column(name = "assigned_worker_id")
    private UUID assignedWorkerId;

    @NotNull
    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "in_progress_at")
    private Instant inProgressAt;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @PositiveOrZero
    @Column(name = "points_awarded", nullable = false)
    private int pointsAwarded;

    @Version
    private Long version;

    protected Report() {}

    public static Report create(String deviceId, String photoUrl, GeoLocation location,
                                String description, String area, Severity severity,
                                Collection<String> wasteTypes, Instant capturedAt, Instant now) {
        var report = new Report();
        report.deviceId = deviceId;
        report.photoUrl = photoUrl;
        report.location = location;
        report.description = description;
        report.area = area;
        report.severity = severity;
        if (wasteTypes != null) {
            report.wasteTypes.addAll(wasteTypes);
        }
        report.capturedAt = capturedAt;
        report.createdAt = now;
        report.status = ReportStatus.OPEN;
        report.pointsAwarded = 0;
        return report;
    }

    /**
     * Moves the report to {@code target}.
     *
     * @param workerId required when assigning an OPEN report, ignored otherwise
     * @throws InvalidTransitionException if the edge is not in the transition table
     */
    public void transitionTo(ReportStatus target, UUID workerId, Instant at) {
        ReportStatus.requireTransition(status, target);
        switch (target) {
            case ASSIGNED -> {
                if (status == ReportStatus.VERIFIED) {
                    // rejected work goes back to the same worker
                    verifiedAt = null;
                    inProgressAt = null;
                } else {
                    if (workerId == null) {
                        throw new IllegalArgumentException("A worker is required to assign a report");
                    }
                    assignedWorkerId = workerId;
                    assignedAt = at;
                }
            }
            case OPEN -> {
                assignedWorkerId = null;
                assignedAt = null;
            }
            case IN_PROGRESS -> inProgressAt = at;
            case VERIFIED -> verifiedAt = at;
            case RESOLVED -> resolvedAt = at;
        }
        status = target;
    }

    public void recordPointsAwarded(int points) {
        if (points <= 0) {
            throw new IllegalArgumentException("Awarded points must be positive");
        }
        if (pointsAwarded > 0) {
            throw new IllegalStateException("Points already awarded for report " + id);
        }
        this.pointsAwarded = points;
    }

    public boolean hasPointsAwarded() {
        return pointsAwarded > 0;
    }

    public boolean isAssignedTo(UUID workerId) {
        return assignedWorkerId != null && assignedWorkerId.equals(workerId);
    }

    /**
     * Timestamp at which the report entered {@code stage}, or null if it has not.
     */
    public Instant timestampFor(ReportStatus stage) {
        return switch (stage) {
            case OPEN -> createdAt;
            case ASSIGNED -> assignedAt;
            case IN_PROGRESS -> inProgressAt;
            case VERIFIED -> verifiedAt;
            case RESOLVED -> resolvedAt;
        };
    }

    public Severity getEffectiveSeverity() {
        return Severity.orDefault(severity);
    }

    // Getters
    public UUID getId() { return id; }
    public String getDeviceId() { return deviceId; }
    public String getPhotoUrl() { return photoUrl; }
    public GeoLocation getLocation() { return location; }
    public String getDescription() { return description; }
    public String getArea() { return area; }
    public Severity getSeverity() { return severity; }
    public Set<String> getWasteTypes() { return Collections.unmodifiableSet(wasteTypes); }
    public ReportStatus getStatus() { return status; }
    public UUID getAssignedWorkerId() { return assignedWorkerId; }
    public Instant getCapturedAt() { return capturedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getAssignedAt() { return assignedAt; }
    public Instant getInProgressAt() { return inProgressAt; }
    public Instant getVerifiedAt() { return verifiedAt; }
    public Instant getResolvedAt() { return resolvedAt; }
    public int getPointsAwarded() { return pointsAwarded; }
    public Long getVersion() { return version; }
}
