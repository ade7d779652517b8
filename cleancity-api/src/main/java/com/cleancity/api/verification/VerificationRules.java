package com.cleancity.api.verification;

import com.cleancity.core.domain.GeoLocation;

/**
 * Point-in-time geofence and timing predicates for field verification.
 * No I/O; callers supply coordinates and durations.
 */
public final class VerificationRules {

    public static final double DEFAULT_MAX_DISTANCE_METERS = 50;
    public static final int DEFAULT_MIN_MINUTES = 2;
    public static final int DEFAULT_MAX_MINUTES = 240;

    private VerificationRules() {}

    public static double distanceMeters(GeoLocation worker, GeoLocation report) {
        return worker.distanceTo(report);
    }

    public static boolean isWithinGeofence(double distanceMeters, double maxDistanceMeters) {
        return distanceMeters <= maxDistanceMeters;
    }

    public static boolean isWithinGeofence(GeoLocation worker, GeoLocation report, double maxDistanceMeters) {
        return isWithinGeofence(distanceMeters(worker, report), maxDistanceMeters);
    }

    /**
     * Inclusive on both ends.
     */
    public static boolean isWithinTimingWindow(double elapsedMinutes, int minMinutes, int maxMinutes) {
        return elapsedMinutes >= minMinutes && elapsedMinutes <= maxMinutes;
    }
}
