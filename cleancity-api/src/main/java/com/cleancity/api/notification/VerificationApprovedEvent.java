package com.cleancity.api.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once approval has committed and the points credit has been attempted.
 *
 * @param pointsAwarded zero when the credit was deferred to reconciliation
 */
public record VerificationApprovedEvent(
        UUID verificationId,
        UUID reportId,
        String deviceId,
        int pointsAwarded,
        Instant occurredAt
) {}
