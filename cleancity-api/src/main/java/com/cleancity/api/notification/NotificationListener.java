package com.cleancity.api.notification;

import com.cleancity.api.notification.NotificationMessages.Message;
import com.cleancity.core.domain.ReportStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Map;

/**
 * Turns committed workflow events into notifications. Delivery failures are logged
 * and never reach the workflow that raised the event.
 */
@Component
public class NotificationListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationListener.class);

    private final NotificationDispatcher dispatcher;

    public NotificationListener(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onStatusChanged(ReportStatusChangedEvent event) {
        // resolution is announced with the points outcome by onVerificationApproved
        if (event.newStatus() == ReportStatus.RESOLVED) {
            return;
        }
        Message message = NotificationMessages.forStatus(event.newStatus());
        send(Notification.Recipient.CITIZEN, event.deviceId(), message, Map.of(
                "type", "status_change",
                "reportId", event.reportId().toString(),
                "status", event.newStatus().name()));

        if (event.previousStatus() == ReportStatus.OPEN && event.newStatus() == ReportStatus.ASSIGNED
                && event.workerId() != null) {
            send(Notification.Recipient.WORKER, event.workerId().toString(),
                    NotificationMessages.newTask(event.area()),
                    Map.of("type", "new_task", "reportId", event.reportId().toString()));
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onVerificationApproved(VerificationApprovedEvent event) {
        send(Notification.Recipient.CITIZEN, event.deviceId(), NotificationMessages.resolved(event.pointsAwarded()),
                Map.of("type", "report_resolved",
                        "reportId", event.reportId().toString(),
                        "pointsEarned", String.valueOf(event.pointsAwarded())));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBadgeUnlocked(BadgeUnlockedEvent event) {
        send(Notification.Recipient.CITIZEN, event.deviceId(), NotificationMessages.badgeUnlocked(event.badge()),
                Map.of("type", "badge_unlocked", "badge", event.badge().name()));
    }

    private void send(Notification.Recipient recipient, String recipientId, Message message, Map<String, String> data) {
        try {
            dispatcher.dispatch(new Notification(recipient, recipientId, message.title(), message.body(), data));
        } catch (RuntimeException e) {
            log.warn("Failed to deliver '{}' notification to {} {}", message.title(), recipient, recipientId, e);
        }
    }
}
