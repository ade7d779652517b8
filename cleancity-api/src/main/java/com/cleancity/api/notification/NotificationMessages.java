package com.cleancity.api.notification;

import com.cleancity.core.domain.Badge;
import com.cleancity.core.domain.ReportStatus;

/**
 * Citizen and worker facing notification texts.
 */
public final class NotificationMessages {

    private NotificationMessages() {}

    public record Message(String title, String body) {}

    public static Message forStatus(ReportStatus status) {
        return switch (status) {
            case OPEN -> new Message("Report Submitted",
                    "Your waste report has been submitted successfully.");
            case ASSIGNED -> new Message("Worker Assigned",
                    "A sanitation worker has been assigned to your report.");
            case IN_PROGRESS -> new Message("Cleanup In Progress",
                    "A worker is currently cleaning up the waste you reported.");
            case VERIFIED -> new Message("Cleanup Verified",
                    "The cleanup has been verified and is pending final approval.");
            case RESOLVED -> new Message("Report Resolved!",
                    "The waste has been cleaned up! Thank you for your contribution.");
        };
    }

    public static Message resolved(int pointsEarned) {
        if (pointsEarned <= 0) {
            return forStatus(ReportStatus.RESOLVED);
        }
        return new Message("Report Resolved!",
                "The waste has been cleaned up! You earned " + pointsEarned + " points.");
    }

    public static Message newTask(String area) {
        return new Message("New Task Assigned",
                area == null ? "You have a new cleanup task." : "You have a new cleanup task in " + area + ".");
    }

    public static Message badgeUnlocked(Badge badge) {
        return new Message("Badge Unlocked!",
                "Congratulations! You've earned the \"" + badge.getDisplayName() + "\" badge.");
    }
}
