package com.cleancity.api.error;

import java.util.Map;

/**
 * Worker was too far from the report location when starting the task.
 */
public class GeofenceException extends WorkflowException {

    private final double distanceMeters;

    public GeofenceException(double distanceMeters, double maxDistanceMeters) {
        super(ErrorCode.PROXIMITY_ERROR,
                String.format("You are %.0fm away from the report location. Must be within %.0fm.",
                        distanceMeters, maxDistanceMeters),
                Map.of("distanceMeters", Math.round(distanceMeters * 10) / 10.0,
                        "maxDistanceMeters", maxDistanceMeters),
                null);
        this.distanceMeters = distanceMeters;
    }

    public double getDistanceMeters() { return distanceMeters; }
}
