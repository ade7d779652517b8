package com.cleancity.api.status;

import com.cleancity.api.error.NotFoundException;
import com.cleancity.api.error.StateException;
import com.cleancity.api.error.ValidationException;
import com.cleancity.api.notification.Notification;
import com.cleancity.api.support.WorkflowTestSupport;
import com.cleancity.core.domain.Report;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.domain.Severity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportStatusServiceTest extends WorkflowTestSupport {

    @Test
    void assign_bindsWorkerAndStampsAssignedAt() {
        Fixture open = openReport(Severity.MEDIUM);
        UUID workerId = registerWorker(open.zone());
        clock.advance(Duration.ofMinutes(3));

        var result = reportStatusService.assign(open.reportId(), workerId);

        assertThat(result.previousStatus()).isEqualTo(ReportStatus.OPEN);
        assertThat(result.status()).isEqualTo(ReportStatus.ASSIGNED);
        Report report = reportRepository.findById(open.reportId()).orElseThrow();
        assertThat(report.getAssignedWorkerId()).isEqualTo(workerId);
        assertThat(report.getAssignedAt()).isEqualTo(BASE_TIME.plus(Duration.ofMinutes(3)));
    }

    @Test
    void assign_notifiesCitizenAndWorker() {
        Fixture assigned = assignedReport(Severity.HIGH);

        assertThat(notifications.sentTo(assigned.deviceId()))
                .extracting(Notification::recipientType)
                .contains(Notification.Recipient.CITIZEN);
        assertThat(notifications.sentTo(assigned.workerId().toString()))
                .extracting(Notification::recipientType)
                .containsExactly(Notification.Recipient.WORKER);
    }

    @Test
    void unassign_returnsReportToOpenWithoutWorker() {
        Fixture assigned = assignedReport(Severity.LOW);

        var result = reportStatusService.unassign(assigned.reportId());

        assertThat(result.status()).isEqualTo(ReportStatus.OPEN);
        Report report = reportRepository.findById(assigned.reportId()).orElseThrow();
        assertThat(report.getAssignedWorkerId()).isNull();
        assertThat(report.getAssignedAt()).isNull();
    }

    @Test
    void assignWithoutWorker_isValidationError() {
        Fixture open = openReport(Severity.LOW);

        assertThatThrownBy(() -> reportStatusService.assign(open.reportId(), null))
                .isInstanceOf(ValidationException.class);
        assertThat(reportRepository.findById(open.reportId()).orElseThrow().getStatus())
                .isEqualTo(ReportStatus.OPEN);
    }

    @Test
    void assignToUnknownOrInactiveWorker_isNotFound() {
        Fixture open = openReport(Severity.LOW);
        UUID inactive = registerWorker(open.zone());
        workerService.deactivate(inactive);

        assertThatThrownBy(() -> reportStatusService.assign(open.reportId(), UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> reportStatusService.assign(open.reportId(), inactive))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void skippingStages_isStateError() {
        Fixture open = openReport(Severity.LOW);

        assertThatThrownBy(() -> reportStatusService.transition(open.reportId(), ReportStatus.RESOLVED, null))
                .isInstanceOf(StateException.class)
                .hasMessageContaining("OPEN");
        assertThatThrownBy(() -> reportStatusService.transition(open.reportId(), ReportStatus.OPEN, null))
                .isInstanceOf(StateException.class);
        assertThat(reportRepository.findById(open.reportId()).orElseThrow().getStatus())
                .isEqualTo(ReportStatus.OPEN);
    }

    @Test
    void assigningAnAssignedReport_isStateError() {
        Fixture assigned = assignedReport(Severity.LOW);
        UUID other = registerWorker(assigned.zone());

        assertThatThrownBy(() -> reportStatusService.assign(assigned.reportId(), other))
                .isInstanceOf(StateException.class);
        assertThat(reportRepository.findById(assigned.reportId()).orElseThrow().getAssignedWorkerId())
                .isEqualTo(assigned.workerId());
    }

    @Test
    void unknownReport_isNotFound() {
        assertThatThrownBy(() -> reportStatusService.unassign(UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
    }
}
