package com.cleancity.api.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default dispatcher: records each notification in the application log.
 */
@Component
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    @Override
    public void dispatch(Notification notification) {
        log.info("Notify {} {}: {} - {}", notification.recipientType(), notification.recipientId(),
                notification.title(), notification.body());
    }
}
