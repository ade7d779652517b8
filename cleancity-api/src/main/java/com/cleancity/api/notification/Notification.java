package com.cleancity.api.notification;

import java.util.Map;

public record Notification(
        Recipient recipientType,
        String recipientId,
        String title,
        String body,
        Map<String, String> data
) {
    public enum Recipient {
        CITIZEN, WORKER
    }
}
