package com.cleancity.api.admission;

import com.cleancity.core.domain.Severity;

import java.time.Instant;
import java.util.Set;

/**
 * A citizen's report as received, before admission.
 *
 * @param capturedAt when the photo was taken on the device
 */
public record ReportSubmission(
        String deviceId,
        Double latitude,
        Double longitude,
        Double accuracy,
        String photoUrl,
        Instant capturedAt,
        String description,
        Severity severity,
        Set<String> wasteTypes,
        String area
) {}
