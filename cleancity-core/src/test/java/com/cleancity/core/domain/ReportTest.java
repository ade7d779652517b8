package com.cleancity.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportTest {

    private static final Instant T0 = Instant.parse("2025-03-10T08:00:00Z");

    private Report newReport() {
        return Report.create("device-0123456789abcdef", "https://photos/a.jpg",
                GeoLocation.of(19.0760, 72.8777, 8.0), "Overflowing bin", "Andheri",
                Severity.MEDIUM, Set.of("plastic", "organic"), T0.minusSeconds(30), T0);
    }

    @Test
    void create_startsOpenWithOnlyCreatedAt() {
        Report report = newReport();

        assertThat(report.getStatus()).isEqualTo(ReportStatus.OPEN);
        assertThat(report.getCreatedAt()).isEqualTo(T0);
        assertThat(report.getAssignedAt()).isNull();
        assertThat(report.getInProgressAt()).isNull();
        assertThat(report.getVerifiedAt()).isNull();
        assertThat(report.getResolvedAt()).isNull();
        assertThat(report.getPointsAwarded()).isZero();
        assertThat(report.getWasteTypes()).containsExactlyInAnyOrder("plastic", "organic");
    }

    @Test
    void forwardPath_stampsEachStageOnce() {
        Report report = newReport();
        UUID worker = UUID.randomUUID();

        report.transitionTo(ReportStatus.ASSIGNED, worker, T0.plusSeconds(60));
        report.transitionTo(ReportStatus.IN_PROGRESS, worker, T0.plusSeconds(120));
        report.transitionTo(ReportStatus.VERIFIED, worker, T0.plusSeconds(1200));
        report.transitionTo(ReportStatus.RESOLVED, null, T0.plusSeconds(1800));

        assertThat(report.getAssignedWorkerId()).isEqualTo(worker);
        assertThat(report.getAssignedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(report.getInProgressAt()).isEqualTo(T0.plusSeconds(120));
        assertThat(report.getVerifiedAt()).isEqualTo(T0.plusSeconds(1200));
        assertThat(report.getResolvedAt()).isEqualTo(T0.plusSeconds(1800));
        for (ReportStatus stage : ReportStatus.values()) {
            assertThat(report.timestampFor(stage)).isNotNull();
        }
    }

    @Test
    void rejection_clearsVerifiedAndInProgressButKeepsWorker() {
        Report report = newReport();
        UUID worker = UUID.randomUUID();
        report.transitionTo(ReportStatus.ASSIGNED, worker, T0.plusSeconds(60));
        report.transitionTo(ReportStatus.IN_PROGRESS, worker, T0.plusSeconds(120));
        report.transitionTo(ReportStatus.VERIFIED, worker, T0.plusSeconds(1200));

        report.transitionTo(ReportStatus.ASSIGNED, null, T0.plusSeconds(1500));

        assertThat(report.getStatus()).isEqualTo(ReportStatus.ASSIGNED);
        assertThat(report.getAssignedWorkerId()).isEqualTo(worker);
        assertThat(report.getAssignedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(report.getInProgressAt()).isNull();
        assertThat(report.getVerifiedAt()).isNull();
    }

    @Test
    void unassign_clearsWorkerAndAssignedAt() {
        Report report = newReport();
        report.transitionTo(ReportStatus.ASSIGNED, UUID.randomUUID(), T0.plusSeconds(60));

        report.transitionTo(ReportStatus.OPEN, null, T0.plusSeconds(90));

        assertThat(report.getStatus()).isEqualTo(ReportStatus.OPEN);
        assertThat(report.getAssignedWorkerId()).isNull();
        assertThat(report.getAssignedAt()).isNull();
    }

    @Test
    void assignFromOpen_requiresWorker() {
        Report report = newReport();

        assertThatThrownBy(() -> report.transitionTo(ReportStatus.ASSIGNED, null, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(report.getStatus()).isEqualTo(ReportStatus.OPEN);
    }

    @Test
    void skipTransition_isRejected() {
        Report report = newReport();

        assertThatThrownBy(() -> report.transitionTo(ReportStatus.IN_PROGRESS, UUID.randomUUID(), T0))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("OPEN")
                .hasMessageContaining("IN_PROGRESS");
    }

    @Test
    void recordPointsAwarded_onlyOnce() {
        Report report = newReport();

        report.recordPointsAwarded(35);

        assertThat(report.hasPointsAwarded()).isTrue();
        assertThatThrownBy(() -> report.recordPointsAwarded(35)).isInstanceOf(IllegalStateException.class);
        assertThat(report.getPointsAwarded()).isEqualTo(35);
    }

    @Test
    void effectiveSeverity_defaultsToLow() {
        Report report = Report.create("device-0123456789abcdef", "https://photos/b.jpg",
                GeoLocation.of(1, 1), null, null, null, null, T0, T0);

        assertThat(report.getEffectiveSeverity()).isEqualTo(Severity.LOW);
        assertThat(report.getWasteTypes()).isEmpty();
    }
}
