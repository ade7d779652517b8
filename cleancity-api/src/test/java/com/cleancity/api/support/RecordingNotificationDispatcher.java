package com.cleancity.api.support;

import com.cleancity.api.notification.Notification;
import com.cleancity.api.notification.NotificationDispatcher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotificationDispatcher implements NotificationDispatcher {

    private final List<Notification> sent = new CopyOnWriteArrayList<>();

    @Override
    public void dispatch(Notification notification) {
        sent.add(notification);
    }

    public List<Notification> sentTo(String recipientId) {
        return sent.stream().filter(n -> recipientId.equals(n.recipientId())).toList();
    }
}
