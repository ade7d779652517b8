package com.cleancity.api.notification;

import com.cleancity.api.support.RecordingNotificationDispatcher;
import com.cleancity.core.domain.Badge;
import com.cleancity.core.domain.ReportStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class NotificationListenerTest {

    private static final String DEVICE = "device-0123456789abcdef";
    private static final Instant NOW = Instant.parse("2025-04-01T10:00:00Z");

    private final RecordingNotificationDispatcher dispatcher = new RecordingNotificationDispatcher();
    private final NotificationListener listener = new NotificationListener(dispatcher);

    @Test
    void assignment_notifiesCitizenAndWorker() {
        UUID worker = UUID.randomUUID();

        listener.onStatusChanged(new ReportStatusChangedEvent(UUID.randomUUID(), DEVICE,
                ReportStatus.OPEN, ReportStatus.ASSIGNED, worker, "Bandra", NOW));

        assertThat(dispatcher.sentTo(DEVICE)).singleElement()
                .satisfies(n -> assertThat(n.title()).isEqualTo("Worker Assigned"));
        assertThat(dispatcher.sentTo(worker.toString())).singleElement()
                .satisfies(n -> assertThat(n.body()).isEqualTo("You have a new cleanup task in Bandra."));
    }

    @Test
    void rejectionBackToAssigned_doesNotResendWorkerTask() {
        UUID worker = UUID.randomUUID();

        listener.onStatusChanged(new ReportStatusChangedEvent(UUID.randomUUID(), DEVICE,
                ReportStatus.VERIFIED, ReportStatus.ASSIGNED, worker, null, NOW));

        assertThat(dispatcher.sentTo(worker.toString())).isEmpty();
    }

    @Test
    void resolvedStatus_isAnnouncedOnlyThroughApproval() {
        UUID reportId = UUID.randomUUID();

        listener.onStatusChanged(new ReportStatusChangedEvent(reportId, DEVICE,
                ReportStatus.VERIFIED, ReportStatus.RESOLVED, null, null, NOW));
        listener.onVerificationApproved(new VerificationApprovedEvent(UUID.randomUUID(), reportId, DEVICE, 40, NOW));

        assertThat(dispatcher.sentTo(DEVICE)).singleElement().satisfies(n -> {
            assertThat(n.body()).isEqualTo("The waste has been cleaned up! You earned 40 points.");
            assertThat(n.data()).containsEntry("pointsEarned", "40");
        });
    }

    @Test
    void approvalWithPendingPoints_usesGenericMessage() {
        listener.onVerificationApproved(new VerificationApprovedEvent(UUID.randomUUID(), UUID.randomUUID(),
                DEVICE, 0, NOW));

        assertThat(dispatcher.sentTo(DEVICE)).singleElement()
                .satisfies(n -> assertThat(n.body()).doesNotContain("You earned"));
    }

    @Test
    void badgeUnlock_namesTheBadge() {
        listener.onBadgeUnlocked(new BadgeUnlockedEvent(DEVICE, Badge.ECO_WARRIOR, NOW));

        assertThat(dispatcher.sentTo(DEVICE)).singleElement()
                .satisfies(n -> assertThat(n.body()).contains("Eco Warrior"));
    }

    @Test
    void dispatchFailure_isContained() {
        NotificationListener failing = new NotificationListener(n -> {
            throw new IllegalStateException("push gateway down");
        });

        assertThatCode(() -> failing.onBadgeUnlocked(new BadgeUnlockedEvent(DEVICE, Badge.ECO_WARRIOR, NOW)))
                .doesNotThrowAnyException();
    }
}
