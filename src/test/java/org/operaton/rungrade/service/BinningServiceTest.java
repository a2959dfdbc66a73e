package org.operaton.rungrade.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.rungrade.model.Bin;
import org.operaton.rungrade.model.RunSummary;
import org.operaton.rungrade.model.TrackPoint;
import org.operaton.rungrade.util.ActivityStats;
import org.operaton.rungrade.util.QuadraticGradeModel;
import org.operaton.rungrade.util.TestTracks;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BinningService.
 */
class BinningServiceTest {

    private BinningService binningService;

    @BeforeEach
    void setUp() {
        binningService = new BinningService();
    }

    @Test
    @DisplayName("Should derive gradient, velocity and pace for a single 50 m bin")
    void testSingleBinMetrics() {
        List<TrackPoint> points = List.of(
            TrackPoint.builder().latitude(0).longitude(0).elevation(0).timestamp(TestTracks.START).build(),
            TrackPoint.builder().latitude(0).longitude(0.00045).elevation(10)
                .timestamp(TestTracks.START.plusSeconds(10)).build());

        List<Bin> bins = binningService.bin(points, 50);

        assertEquals(1, bins.size());
        Bin bin = bins.get(0);
        assertEquals(50.04, bin.distanceMeters(), 0.01);
        assertEquals(10.0, bin.elevationChangeMeters());
        assertEquals(19.98, bin.gradientPercent(), 0.05);
        assertEquals(10.0, bin.durationSeconds());
        assertEquals("00:00:10", bin.timeTaken());
        assertEquals(5.0, bin.velocityMps(), 0.01);
        assertEquals(3.33, bin.paceMinPerKm(), 0.01);
        assertEquals(0, bin.startIndex());
        assertEquals(1, bin.endIndex());
    }

    @Test
    @DisplayName("Should share boundary points between consecutive bins and cover the whole track")
    void testBinBoundaries() {
        List<TrackPoint> points = TestTracks.straightTrack(7, 15, 1, null);

        List<Bin> bins = binningService.bin(points, 100);

        // 6 segments of ~50 m, two segments per bin
        assertEquals(3, bins.size());
        assertEquals(0, bins.get(0).startIndex());
        for (int i = 1; i < bins.size(); i++) {
            assertEquals(bins.get(i - 1).endIndex(), bins.get(i).startIndex());
        }
        assertEquals(points.size() - 1, bins.get(bins.size() - 1).endIndex());
    }

    @Test
    @DisplayName("Should emit a shorter remainder bin for leftover points")
    void testRemainderBin() {
        List<TrackPoint> points = TestTracks.straightTrack(6, 15, 0, null);

        List<Bin> bins = binningService.bin(points, 100);

        assertEquals(3, bins.size());
        Bin remainder = bins.get(2);
        assertEquals(4, remainder.startIndex());
        assertEquals(5, remainder.endIndex());
        assertEquals(50.04, remainder.distanceMeters(), 0.01);
    }

    @Test
    @DisplayName("Bin distances should add up to the track distance")
    void testDistanceConservation() {
        List<TrackPoint> points = TestTracks.straightTrack(23, 12, 0.5, 150);

        List<Bin> bins = binningService.bin(points, 130);

        double binned = bins.stream().mapToDouble(Bin::distanceMeters).sum();
        assertEquals(ActivityStats.totalDistanceMeters(points), binned, 1e-6);
    }

    @Test
    @DisplayName("Should report zero gradient for a bin without distance")
    void testZeroDistanceBin() {
        TrackPoint point = TrackPoint.builder().latitude(47).longitude(8).elevation(400)
            .timestamp(TestTracks.START).build();
        TrackPoint samePlaceHigher = TrackPoint.builder().latitude(47).longitude(8).elevation(405)
            .timestamp(TestTracks.START.plusSeconds(20)).build();

        List<Bin> bins = binningService.bin(List.of(point, samePlaceHigher), 50);

        assertEquals(1, bins.size());
        assertEquals(0.0, bins.get(0).gradientPercent());
        assertEquals(0.0, bins.get(0).distanceMeters());
        assertNull(bins.get(0).paceMinPerKm());
    }

    @Test
    @DisplayName("Should leave heart rate fields empty without samples")
    void testNoHeartRate() {
        List<Bin> bins = binningService.bin(TestTracks.straightTrack(3, 10, 0, null), 50);

        for (Bin bin : bins) {
            assertEquals(0, bin.heartRateSampleCount());
            assertNull(bin.avgHeartRate());
            assertNull(bin.maxHeartRate());
            assertNull(bin.minHeartRate());
            assertFalse(bin.hasHeartRate());
        }
    }

    @Test
    @DisplayName("Should aggregate heart rate over all points of a bin including both boundaries")
    void testHeartRateAggregation() {
        List<TrackPoint> points = List.of(
            TrackPoint.builder().latitude(0).longitude(0).timestamp(TestTracks.START).heartRate(140).build(),
            TrackPoint.builder().latitude(0).longitude(0.0003).timestamp(TestTracks.START.plusSeconds(6)).heartRate(0).build(),
            TrackPoint.builder().latitude(0).longitude(0.0006).timestamp(TestTracks.START.plusSeconds(12)).heartRate(151).build());

        Bin bin = binningService.bin(points, 60).get(0);

        assertEquals(2, bin.heartRateSampleCount());
        assertEquals(146, bin.avgHeartRate());
        assertEquals(151, bin.maxHeartRate());
        assertEquals(140, bin.minHeartRate());
    }

    @Test
    @DisplayName("Should leave timing empty when timestamps are missing")
    void testNoTimestamps() {
        List<TrackPoint> points = List.of(
            TrackPoint.builder().latitude(0).longitude(0).build(),
            TrackPoint.builder().latitude(0).longitude(0.00045).build());

        Bin bin = binningService.bin(points, 50).get(0);

        assertNull(bin.durationSeconds());
        assertNull(bin.velocityMps());
        assertNull(bin.paceMinPerKm());
        assertNull(bin.timeTaken());
    }

    @Test
    @DisplayName("Should compute grade-adjusted metrics when a model and reference velocity are given")
    void testGradeAdjustment() {
        List<TrackPoint> points = TestTracks.straightTrack(2, 10, 5, null);

        Bin adjusted = binningService.bin(points, 50, QuadraticGradeModel.INSTANCE, 4.0).get(0);
        Bin plain = binningService.bin(points, 50).get(0);

        double factor = QuadraticGradeModel.INSTANCE.factor(adjusted.gradientPercent());
        assertEquals(adjusted.distanceMeters() * factor, adjusted.gradeAdjustedDistanceMeters(), 1e-9);
        assertEquals(adjusted.distanceMeters() * factor / 4.0, adjusted.adjustedDurationSeconds(), 1e-9);
        assertEquals(0.0, plain.adjustedDurationSeconds());
        assertNull(plain.gradeAdjustedDistanceMeters());
    }

    @Test
    @DisplayName("Should return no bins for fewer than two points")
    void testTooFewPoints() {
        assertTrue(binningService.bin(List.of(), 50).isEmpty());
        assertTrue(binningService.bin(TestTracks.straightTrack(1, 10, 0, null), 50).isEmpty());
    }

    @Test
    @DisplayName("Should reject a non-positive bin length")
    void testInvalidBinLength() {
        List<TrackPoint> points = TestTracks.straightTrack(3, 10, 0, null);

        assertThrows(IllegalArgumentException.class, () -> binningService.bin(points, 0));
        assertThrows(IllegalArgumentException.class, () -> binningService.bin(points, -50));
        assertThrows(IllegalArgumentException.class, () -> binningService.bin(points, Double.NaN));
    }

    @Test
    @DisplayName("Should summarize valid bins with a time weighted pace")
    void testSummarize() {
        List<Bin> bins = List.of(
            Bin.builder().distanceMeters(1000).durationSeconds(300.0).elevationChangeMeters(12)
                .avgHeartRate(150).maxHeartRate(160).build(),
            Bin.builder().distanceMeters(500).durationSeconds(180.0).elevationChangeMeters(-4).build(),
            Bin.builder().distanceMeters(0).build());

        Optional<RunSummary> summary = binningService.summarize(bins);

        assertTrue(summary.isPresent());
        assertEquals(3, summary.get().totalBins());
        assertEquals(2, summary.get().validBins());
        assertEquals(1.5, summary.get().totalDistanceKm());
        assertEquals(480.0, summary.get().totalTimeSeconds());
        assertEquals(12, summary.get().totalElevationGainMeters());
        assertEquals(5.3333, summary.get().avgPaceMinPerKm(), 1e-4);
        assertEquals(150, summary.get().avgHeartRate());
        assertEquals(160, summary.get().maxHeartRate());
        assertEquals(0.5, summary.get().heartRateCoverage());
    }

    @Test
    @DisplayName("Should not summarize runs without valid bins")
    void testSummarizeEmpty() {
        assertTrue(binningService.summarize(List.of()).isEmpty());
        assertTrue(binningService.summarize(List.of(Bin.builder().build())).isEmpty());
    }
}
