package org.operaton.rungrade.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.rungrade.model.TrackPoint;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GeoDistance and ActivityStats.
 */
class GeoDistanceTest {

    @Test
    @DisplayName("Should compute about 50 m for 0.00045 degrees of longitude at the equator")
    void testHaversine() {
        double distance = GeoDistance.haversine(0, 0, 0, TestTracks.FIFTY_METERS_LON);

        assertEquals(50.04, distance, 0.01);
    }

    @Test
    @DisplayName("Should count segments with invalid coordinates as zero")
    void testInvalidCoordinates() {
        TrackPoint valid = TrackPoint.builder().latitude(0).longitude(0).build();
        TrackPoint invalid = TrackPoint.builder().latitude(Double.NaN).longitude(0).build();

        assertEquals(0.0, GeoDistance.haversine(valid, invalid));
        assertEquals(0.0, ActivityStats.totalDistanceMeters(List.of(valid, invalid, valid)));
    }

    @Test
    @DisplayName("Should derive elapsed time, elevation gain and heart rate from points")
    void testActivityStats() {
        List<TrackPoint> track = TestTracks.straightTrack(4, 10, 2.4, 150);

        assertEquals(30.0, ActivityStats.elapsedSeconds(track));
        assertEquals(7.0, ActivityStats.elevationGainMeters(track));
        assertEquals(150, ActivityStats.averageHeartRate(track));
        assertEquals(150, ActivityStats.maxHeartRate(track));
    }

    @Test
    @DisplayName("Should ignore zero heart rate samples")
    void testZeroHeartRateIgnored() {
        List<TrackPoint> track = List.of(
            TrackPoint.builder().heartRate(0).build(),
            TrackPoint.builder().heartRate(null).build());

        assertNull(ActivityStats.averageHeartRate(track));
        assertNull(ActivityStats.maxHeartRate(track));
    }
}
