package com.cleancity.core.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.Objects;

/**
 * GPS position as captured by a citizen or worker device.
 * Distances use the haversine great-circle formula on a spherical earth.
 */
@Embeddable
public class GeoLocation {

    public static final double EARTH_RADIUS_METERS = 6_371_000;

    @Column(name = "latitude", nullable = false)
    private double latitude;

    @Column(name = "longitude", nullable = false)
    private double longitude;

    @Column(name = "location_accuracy")
    private Double accuracy;

    protected GeoLocation() {}

    public static GeoLocation of(double latitude, double longitude, Double accuracy) {
        var location = new GeoLocation();
        location.latitude = latitude;
        location.longitude = longitude;
        location.accuracy = accuracy;
        return location;
    }

    public static GeoLocation of(double latitude, double longitude) {
        return of(latitude, longitude, null);
    }

    /**
     * Great-circle distance in meters between two coordinates.
     */
    public static double haversineMeters(double lat1, double lng1, double lat2, double lng2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaPhi = Math.toRadians(lat2 - lat1);
        double deltaLambda = Math.toRadians(lng2 - lng1);

        double a = Math.sin(deltaPhi / 2) * Math.sin(deltaPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(deltaLambda / 2) * Math.sin(deltaLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public double distanceTo(GeoLocation other) {
        return haversineMeters(latitude, longitude, other.latitude, other.longitude);
    }

    public boolean hasValidLatitude() {
        return Double.isFinite(latitude) && latitude >= -90 && latitude <= 90;
    }

    public boolean hasValidLongitude() {
        return Double.isFinite(longitude) && longitude >= -180 && longitude <= 180;
    }

    public boolean hasValidAccuracy() {
        return accuracy == null || (Double.isFinite(accuracy) && accuracy >= 0);
    }

    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }
    public Double getAccuracy() { return accuracy; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoLocation other)) return false;
        return Double.compare(latitude, other.latitude) == 0
                && Double.compare(longitude, other.longitude) == 0
                && Objects.equals(accuracy, other.accuracy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude, accuracy);
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
