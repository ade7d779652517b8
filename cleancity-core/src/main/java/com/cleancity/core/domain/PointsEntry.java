package com.cleancity.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only points history row. The unique report id makes a second credit
 * for the same report fail at the database even if the service check is bypassed.
 */
@Entity
@Table(name = "points_history", indexes = {
    @Index(name = "idx_points_history_device", columnList = "device_id")
})
public class PointsEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "device_id", nullable = false, length = 128)
    private String deviceId;

    @NotNull
    @Column(name = "report_id", nullable = false, unique = true)
    private UUID reportId;

    @Positive
    @Column(name = "points", nullable = false)
    private int points;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 30)
    private PointReason reason;

    @Column(name = "base_points", nullable = false)
    private int basePoints;

    @Column(name = "severity_bonus", nullable = false)
    private int severityBonus;

    @Column(name = "pioneer_bonus", nullable = false)
    private int pioneerBonus;

    @Column(name = "streak_bonus", nullable = false)
    private int streakBonus;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected PointsEntry() {}

    public static PointsEntry create(String deviceId, UUID reportId, PointReason reason,
                                     int basePoints, int severityBonus, int pioneerBonus, int streakBonus,
                                     Instant now) {
        var entry = new PointsEntry();
        entry.deviceId = deviceId;
        entry.reportId = reportId;
        entry.reason = reason;
        entry.basePoints = basePoints;
        entry.severityBonus = severityBonus;
        entry.pioneerBonus = pioneerBonus;
        entry.streakBonus = streakBonus;
        entry.points = basePoints + severityBonus + pioneerBonus + streakBonus;
        entry.createdAt = now;
        return entry;
    }

    public UUID getId() { return id; }
    public String getDeviceId() { return deviceId; }
    public UUID getReportId() { return reportId; }
    public int getPoints() { return points; }
    public PointReason getReason() { return reason; }
    public int getBasePoints() { return basePoints; }
    public int getSeverityBonus() { return severityBonus; }
    public int getPioneerBonus() { return pioneerBonus; }
    public int getStreakBonus() { return streakBonus; }
    public Instant getCreatedAt() { return createdAt; }
}
