package com.cleancity.core.domain;

/**
 * Lat/lng box enclosing a circle, used as an index-friendly prefilter
 * before an exact haversine check.
 */
public record GeoBounds(double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {

    private static final double EPSILON_DEGREES = 1e-9;

    public static GeoBounds around(double latitude, double longitude, double radiusMeters) {
        double angular = radiusMeters / GeoLocation.EARTH_RADIUS_METERS;
        double latDelta = Math.toDegrees(angular) + EPSILON_DEGREES;
        double cos = Math.cos(Math.toRadians(latitude));
        double ratio = cos <= 1e-9 ? 1.0 : Math.sin(angular) / cos;
        // widest longitude reached by the spherical cap; poles cover every meridian
        double lngDelta = ratio >= 1.0 ? 180.0 : Math.toDegrees(Math.asin(ratio)) + EPSILON_DEGREES;
        return new GeoBounds(latitude - latDelta, latitude + latDelta, longitude - lngDelta, longitude + lngDelta);
    }

    public static GeoBounds around(GeoLocation center, double radiusMeters) {
        return around(center.getLatitude(), center.getLongitude(), radiusMeters);
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= minLatitude && latitude <= maxLatitude
                && longitude >= minLongitude && longitude <= maxLongitude;
    }
}
