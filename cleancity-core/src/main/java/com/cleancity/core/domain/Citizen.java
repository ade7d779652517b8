package com.cleancity.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Anonymous citizen keyed by device id. Holds the points ledger totals,
 * badge, reporting streak and the per-day submission counter used by admission.
 */
@Entity
@Table(name = "citizens", indexes = {
    @Index(name = "idx_citizens_points", columnList = "total_points"),
    @Index(name = "idx_citizens_area", columnList = "area")
})
public class Citizen {

    @Id
    @Column(name = "device_id", length = 128)
    private String deviceId;

    @NotNull
    @Column(name = "first_seen", nullable = false, updatable = false)
    private Instant firstSeen;

    @NotNull
    @Column(name = "last_active", nullable = false)
    private Instant lastActive;

    @PositiveOrZero
    @Column(name = "total_points", nullable = false)
    private int totalPoints;

    /** Reports that earned points. */
    @PositiveOrZero
    @Column(name = "reports_count", nullable = false)
    private int reportsCount;

    @PositiveOrZero
    @Column(name = "submissions_count", nullable = false)
    private int submissionsCount;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "current_badge", nullable = false, length = 30)
    private Badge currentBadge;

    @PositiveOrZero
    @Column(name = "streak_days", nullable = false)
    private int streakDays;

    @Column(name = "last_report_date")
    private LocalDate lastReportDate;

    @Column(name = "last_report_at")
    private Instant lastReportAt;

    @PositiveOrZero
    @Column(name = "daily_report_count", nullable = false)
    private int dailyReportCount;

    @Column(name = "area", length = 100)
    private String area;

    @Version
    private Long version;

    protected Citizen() {}

    public static Citizen create(String deviceId, Instant now) {
        var citizen = new Citizen();
        citizen.deviceId = deviceId;
        citizen.firstSeen = now;
        citizen.lastActive = now;
        citizen.totalPoints = 0;
        citizen.reportsCount = 0;
        citizen.submissionsCount = 0;
        citizen.currentBadge = Badge.CLEANLINESS_ROOKIE;
        citizen.streakDays = 0;
        citizen.dailyReportCount = 0;
        return citizen;
    }

    public int reportsSubmittedOn(LocalDate day) {
        return day.equals(lastReportDate) ? dailyReportCount : 0;
    }

    /**
     * Records an admitted report: bumps the daily counter and extends or restarts the streak.
     */
    public void recordSubmission(Instant at, LocalDate day, String reportArea) {
        if (lastReportDate == null) {
            streakDays = 1;
            dailyReportCount = 1;
        } else if (lastReportDate.equals(day)) {
            streakDays = Math.max(streakDays, 1);
            dailyReportCount++;
        } else {
            streakDays = lastReportDate.equals(day.minusDays(1)) ? streakDays + 1 : 1;
            dailyReportCount = 1;
        }
        lastReportDate = day;
        lastReportAt = at;
        lastActive = at;
        submissionsCount++;
        if (reportArea != null) {
            area = reportArea;
        }
    }

    /**
     * Streak as of {@code today}; a gap of more than one day resets it.
     */
    public int currentStreak(LocalDate today) {
        if (lastReportDate == null || lastReportDate.isBefore(today.minusDays(1))) {
            return 0;
        }
        return streakDays;
    }

    /**
     * Credits points for a verified report.
     *
     * @return true if the badge moved up
     */
    public boolean credit(int points, Instant at, LocalDate today) {
        if (points <= 0) {
            throw new IllegalArgumentException("Credited points must be positive");
        }
        Badge previous = currentBadge;
        totalPoints += points;
        reportsCount++;
        currentBadge = currentBadge.atLeast(Badge.forPoints(totalPoints));
        streakDays = currentStreak(today);
        lastActive = at;
        return currentBadge != previous;
    }

    public Badge nextBadge() {
        Badge[] ladder = Badge.values();
        return currentBadge.ordinal() + 1 < ladder.length ? ladder[currentBadge.ordinal() + 1] : null;
    }

    // Getters
    public String getDeviceId() { return deviceId; }
    public Instant getFirstSeen() { return firstSeen; }
    public Instant getLastActive() { return lastActive; }
    public int getTotalPoints() { return totalPoints; }
    public int getReportsCount() { return reportsCount; }
    public int getSubmissionsCount() { return submissionsCount; }
    public Badge getCurrentBadge() { return currentBadge; }
    public int getStreakDays() { return streakDays; }
    public LocalDate getLastReportDate() { return lastReportDate; }
    public Instant getLastReportAt() { return lastReportAt; }
    public int getDailyReportCount() { return dailyReportCount; }
    public String getArea() { return area; }
}
