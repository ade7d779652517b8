package com.cleancity.api.verification;

import com.cleancity.core.domain.GeoLocation;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property tests for the geofence and timing predicates.
 */
class VerificationRulesPropertyTest {

    @Property(tries = 100)
    void geofenceAcceptsExactlyDistancesUpToTheLimit(@ForAll @DoubleRange(min = 0, max = 200) double distance) {
        assertThat(VerificationRules.isWithinGeofence(distance, VerificationRules.DEFAULT_MAX_DISTANCE_METERS))
                .isEqualTo(distance <= 50.0);
    }

    @Property(tries = 100)
    void timingWindowIsInclusive(@ForAll @DoubleRange(min = 0, max = 400) double elapsed) {
        assertThat(VerificationRules.isWithinTimingWindow(elapsed,
                VerificationRules.DEFAULT_MIN_MINUTES, VerificationRules.DEFAULT_MAX_MINUTES))
                .isEqualTo(elapsed >= 2 && elapsed <= 240);
    }

    @Property(tries = 100)
    void workerOnTheReportPointIsAlwaysInside(
            @ForAll @DoubleRange(min = -89, max = 89) double lat,
            @ForAll @DoubleRange(min = -179, max = 179) double lng) {
        GeoLocation point = GeoLocation.of(lat, lng);
        assertThat(VerificationRules.isWithinGeofence(point, point, 50)).isTrue();
    }

    @Example
    void boundaryCases() {
        assertThat(VerificationRules.isWithinTimingWindow(1, 2, 240)).isFalse();
        assertThat(VerificationRules.isWithinTimingWindow(2, 2, 240)).isTrue();
        assertThat(VerificationRules.isWithinTimingWindow(30, 2, 240)).isTrue();
        assertThat(VerificationRules.isWithinTimingWindow(240, 2, 240)).isTrue();
        assertThat(VerificationRules.isWithinTimingWindow(241, 2, 240)).isFalse();

        GeoLocation report = GeoLocation.of(19.0760, 72.8777);
        GeoLocation near = GeoLocation.of(19.0760 + Math.toDegrees(49.0 / 6_371_000), 72.8777);
        GeoLocation far = GeoLocation.of(19.0760 + Math.toDegrees(51.0 / 6_371_000), 72.8777);
        assertThat(VerificationRules.isWithinGeofence(near, report, 50)).isTrue();
        assertThat(VerificationRules.isWithinGeofence(far, report, 50)).isFalse();
    }
}
