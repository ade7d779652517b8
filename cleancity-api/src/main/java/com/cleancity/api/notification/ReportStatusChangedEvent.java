package com.cleancity.api.notification;

import com.cleancity.core.domain.ReportStatus;

import java.time.Instant;
import java.util.UUID;

public record ReportStatusChangedEvent(
        UUID reportId,
        String deviceId,
        ReportStatus previousStatus,
        ReportStatus newStatus,
        UUID workerId,
        String area,
        Instant occurredAt
) {}
