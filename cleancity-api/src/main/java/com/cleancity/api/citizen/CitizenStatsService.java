package com.cleancity.api.citizen;

import com.cleancity.api.admission.AdmissionProperties;
import com.cleancity.api.error.NotFoundException;
import com.cleancity.core.domain.Badge;
import com.cleancity.core.domain.Citizen;
import com.cleancity.core.repository.CitizenRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Citizen-facing points summary and the public leaderboard.
 * Leaderboard entries never expose raw device ids.
 */
@Service
@Transactional(readOnly = true)
public class CitizenStatsService {

    private static final int DEFAULT_LEADERBOARD_SIZE = 10;
    private static final int MAX_LEADERBOARD_SIZE = 100;

    private final CitizenRepository citizenRepository;
    private final AdmissionProperties admissionProperties;
    private final Clock clock;

    public CitizenStatsService(CitizenRepository citizenRepository,
                               AdmissionProperties admissionProperties,
                               Clock clock) {
        this.citizenRepository = citizenRepository;
        this.admissionProperties = admissionProperties;
        this.clock = clock;
    }

    public CitizenStats getStats(String deviceId) {
        Citizen citizen = citizenRepository.findById(deviceId)
                .orElseThrow(() -> new NotFoundException("Citizen not found: " + deviceId));
        LocalDate today = LocalDate.ofInstant(clock.instant(), admissionProperties.getCalendarZone());
        Badge next = citizen.nextBadge();
        long rank = citizenRepository.countWithMorePoints(citizen.getTotalPoints()) + 1;
        return new CitizenStats(
                citizen.getDeviceId(),
                citizen.getTotalPoints(),
                citizen.getReportsCount(),
                citizen.getSubmissionsCount(),
                citizen.getCurrentBadge().getDisplayName(),
                next == null ? null : next.getDisplayName(),
                next == null ? 0 : next.getThreshold() - citizen.getTotalPoints(),
                citizen.currentStreak(today),
                rank);
    }

    public List<LeaderboardEntry> leaderboard(String area, Integer limit) {
        int size = limit == null ? DEFAULT_LEADERBOARD_SIZE : Math.min(Math.max(limit, 1), MAX_LEADERBOARD_SIZE);
        List<Citizen> leaders = area == null || area.isBlank()
                ? citizenRepository.findLeaders(PageRequest.of(0, size))
                : citizenRepository.findLeadersInArea(area.trim(), PageRequest.of(0, size));

        List<LeaderboardEntry> entries = new ArrayList<>(leaders.size());
        for (int i = 0; i < leaders.size(); i++) {
            Citizen citizen = leaders.get(i);
            entries.add(new LeaderboardEntry(
                    i + 1,
                    pseudonym(citizen.getDeviceId()),
                    citizen.getTotalPoints(),
                    citizen.getReportsCount(),
                    citizen.getCurrentBadge().getDisplayName()));
        }
        return entries;
    }

    /**
     * Stable public handle for a device: {@code user_} plus the first 8 hex chars of its SHA-256.
     */
    static String pseudonym(String deviceId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(deviceId.getBytes(StandardCharsets.UTF_8));
            return "user_" + HexFormat.of().formatHex(hash).substring(0, 8) + "***";
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record CitizenStats(
            String deviceId,
            int totalPoints,
            int reportsCount,
            int submissionsCount,
            String badge,
            String nextBadge,
            int pointsToNextBadge,
            int streakDays,
            long rank
    ) {}

    public record LeaderboardEntry(int rank, String displayName, int totalPoints, int reportsCount, String badge) {}
}
