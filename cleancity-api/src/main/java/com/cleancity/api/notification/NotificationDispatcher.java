package com.cleancity.api.notification;

/**
 * Outbound delivery of user notifications. Push transport lives outside this service.
 */
public interface NotificationDispatcher {

    void dispatch(Notification notification);
}
