package com.cleancity.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CitizenTest {

    private static final Instant NOW = Instant.parse("2025-05-20T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.parse("2025-05-20");

    @Test
    void firstSubmission_startsStreakAndDailyCount() {
        Citizen citizen = Citizen.create("device-0123456789abcdef", NOW);

        citizen.recordSubmission(NOW, TODAY, "Bandra");

        assertThat(citizen.getStreakDays()).isEqualTo(1);
        assertThat(citizen.reportsSubmittedOn(TODAY)).isEqualTo(1);
        assertThat(citizen.getSubmissionsCount()).isEqualTo(1);
        assertThat(citizen.getLastReportAt()).isEqualTo(NOW);
        assertThat(citizen.getArea()).isEqualTo("Bandra");
    }

    @Test
    void sameDaySubmissions_countUpWithoutExtendingStreak() {
        Citizen citizen = Citizen.create("device-0123456789abcdef", NOW);
        citizen.recordSubmission(NOW, TODAY, null);
        citizen.recordSubmission(NOW.plusSeconds(600), TODAY, null);

        assertThat(citizen.reportsSubmittedOn(TODAY)).isEqualTo(2);
        assertThat(citizen.getStreakDays()).isEqualTo(1);
    }

    @Test
    void consecutiveDays_extendStreakAndResetDailyCount() {
        Citizen citizen = Citizen.create("device-0123456789abcdef", NOW);
        citizen.recordSubmission(NOW, TODAY, null);
        citizen.recordSubmission(NOW.plusSeconds(86_400), TODAY.plusDays(1), null);

        assertThat(citizen.getStreakDays()).isEqualTo(2);
        assertThat(citizen.reportsSubmittedOn(TODAY.plusDays(1))).isEqualTo(1);
        assertThat(citizen.reportsSubmittedOn(TODAY)).isZero();
    }

    @Test
    void gapOfMoreThanOneDay_resetsStreak() {
        Citizen citizen = Citizen.create("device-0123456789abcdef", NOW);
        citizen.recordSubmission(NOW, TODAY, null);
        citizen.recordSubmission(NOW.plusSeconds(86_400), TODAY.plusDays(1), null);

        assertThat(citizen.currentStreak(TODAY.plusDays(2))).isEqualTo(2);
        assertThat(citizen.currentStreak(TODAY.plusDays(3))).isZero();

        citizen.recordSubmission(NOW.plusSeconds(3 * 86_400), TODAY.plusDays(3), null);
        assertThat(citizen.getStreakDays()).isEqualTo(1);
    }

    @Test
    void credit_updatesTotalsAndBadge() {
        Citizen citizen = Citizen.create("device-0123456789abcdef", NOW);
        citizen.recordSubmission(NOW, TODAY, null);

        boolean unlocked = citizen.credit(55, NOW, TODAY);

        assertThat(unlocked).isTrue();
        assertThat(citizen.getTotalPoints()).isEqualTo(55);
        assertThat(citizen.getReportsCount()).isEqualTo(1);
        assertThat(citizen.getCurrentBadge()).isEqualTo(Badge.ECO_WARRIOR);
        assertThat(citizen.nextBadge()).isEqualTo(Badge.COMMUNITY_CHAMPION);
    }

    @Test
    void credit_rejectsNonPositivePoints() {
        Citizen citizen = Citizen.create("device-0123456789abcdef", NOW);

        assertThatThrownBy(() -> citizen.credit(0, NOW, TODAY)).isInstanceOf(IllegalArgumentException.class);
        assertThat(citizen.getTotalPoints()).isZero();
    }

    @Property(tries = 100)
    void totalsAndBadgeNeverDecreaseAcrossCredits(
            @ForAll("credits") java.util.List<Integer> credits) {
        Citizen citizen = Citizen.create("device-0123456789abcdef", NOW);
        int previousPoints = 0;
        Badge previousBadge = citizen.getCurrentBadge();
        for (int points : credits) {
            citizen.credit(points, NOW, TODAY);
            assertThat(citizen.getTotalPoints()).isGreaterThan(previousPoints);
            assertThat(citizen.getCurrentBadge().ordinal()).isGreaterThanOrEqualTo(previousBadge.ordinal());
            assertThat(citizen.getCurrentBadge()).isEqualTo(Badge.forPoints(citizen.getTotalPoints()));
            previousPoints = citizen.getTotalPoints();
            previousBadge = citizen.getCurrentBadge();
        }
        assertThat(citizen.getReportsCount()).isEqualTo(credits.size());
    }

    @Provide
    Arbitrary<java.util.List<Integer>> credits() {
        return Arbitraries.integers().between(1, 120).list().ofMinSize(1).ofMaxSize(20);
    }

    @Property(tries = 50)
    void dailyCountTracksSubmissionsOnTheSameDay(@ForAll @IntRange(min = 1, max = 15) int submissions) {
        Citizen citizen = Citizen.create("device-0123456789abcdef", NOW);
        for (int i = 0; i < submissions; i++) {
            citizen.recordSubmission(NOW.plusSeconds(i * 400L), TODAY, null);
        }
        assertThat(citizen.reportsSubmittedOn(TODAY)).isEqualTo(submissions);
    }
}
