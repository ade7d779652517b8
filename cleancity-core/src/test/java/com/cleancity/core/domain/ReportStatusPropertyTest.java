package com.cleancity.core.domain;

import net.jqwik.api.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property tests for the report status transition table.
 */
class ReportStatusPropertyTest {

    private static final Map<ReportStatus, Set<ReportStatus>> LEGAL = Map.of(
            ReportStatus.OPEN, EnumSet.of(ReportStatus.ASSIGNED),
            ReportStatus.ASSIGNED, EnumSet.of(ReportStatus.IN_PROGRESS, ReportStatus.OPEN),
            ReportStatus.IN_PROGRESS, EnumSet.of(ReportStatus.VERIFIED),
            ReportStatus.VERIFIED, EnumSet.of(ReportStatus.RESOLVED, ReportStatus.ASSIGNED),
            ReportStatus.RESOLVED, EnumSet.noneOf(ReportStatus.class));

    @Property
    void transitionAllowedExactlyForListedEdges(@ForAll ReportStatus from, @ForAll ReportStatus to) {
        assertThat(from.canTransitionTo(to)).isEqualTo(LEGAL.get(from).contains(to));
    }

    @Property
    void sameStateTransitionIsAlwaysRejected(@ForAll ReportStatus status) {
        assertThat(status.canTransitionTo(status)).isFalse();
        assertThatThrownBy(() -> ReportStatus.requireTransition(status, status))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("already");
    }

    @Property
    void resolvedHasNoOutgoingTransitions(@ForAll ReportStatus target) {
        assertThat(ReportStatus.RESOLVED.isTerminal()).isTrue();
        assertThat(ReportStatus.RESOLVED.canTransitionTo(target)).isFalse();
    }

    @Property
    void entityRejectsIllegalTransitionAndKeepsStatus(@ForAll ReportStatus target) {
        Report report = reportIn(ReportStatus.RESOLVED);

        assertThatThrownBy(() -> report.transitionTo(target, UUID.randomUUID(), Instant.now()))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(report.getStatus()).isEqualTo(ReportStatus.RESOLVED);
    }

    @Property
    void entityAppliesLegalTransitionFromAnyReachableState(@ForAll ReportStatus from, @ForAll ReportStatus to) {
        Assume.that(LEGAL.get(from).contains(to));
        Report report = reportIn(from);

        report.transitionTo(to, UUID.randomUUID(), Instant.now());

        assertThat(report.getStatus()).isEqualTo(to);
    }

    @Example
    void nullTargetIsNeverLegal() {
        for (ReportStatus status : ReportStatus.values()) {
            assertThat(status.canTransitionTo(null)).isFalse();
        }
    }

    /**
     * Walks a fresh report forward along the main path until it reaches {@code status}.
     */
    static Report reportIn(ReportStatus status) {
        Instant t = Instant.parse("2025-01-01T10:00:00Z");
        Report report = Report.create("device-0123456789abcdef", "https://photos/1.jpg",
                GeoLocation.of(19.0760, 72.8777, 5.0), null, null, Severity.HIGH, Set.of(), t, t);
        UUID worker = UUID.randomUUID();
        ReportStatus[] path = {ReportStatus.ASSIGNED, ReportStatus.IN_PROGRESS, ReportStatus.VERIFIED, ReportStatus.RESOLVED};
        for (ReportStatus next : path) {
            if (report.getStatus() == status) {
                break;
            }
            t = t.plusSeconds(600);
            report.transitionTo(next, worker, t);
        }
        return report;
    }
}
