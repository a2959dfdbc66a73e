package org.operaton.rungrade.util;

import org.operaton.rungrade.model.TrackPoint;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * File-level statistics derived from a point sequence, used when a file carries no session summary.
 */
public final class ActivityStats {

    private ActivityStats() {
    }

    /**
     * @return summed haversine distance in meters; segments with invalid coordinates count as 0 m
     */
    public static double totalDistanceMeters(List<TrackPoint> points) {
        double total = 0;
        for (int i = 1; i < points.size(); i++) {
            total += GeoDistance.haversine(points.get(i - 1), points.get(i));
        }
        return total;
    }

    /**
     * @return seconds between the first and last point, 0 if either has no timestamp
     */
    public static double elapsedSeconds(List<TrackPoint> points) {
        if (points.isEmpty()) {
            return 0;
        }
        TrackPoint first = points.get(0);
        TrackPoint last = points.get(points.size() - 1);
        if (first.timestamp() == null || last.timestamp() == null) {
            return 0;
        }
        return Duration.between(first.timestamp(), last.timestamp()).toMillis() / 1000.0;
    }

    /**
     * @return sum of positive elevation deltas, rounded to whole meters
     */
    public static double elevationGainMeters(List<TrackPoint> points) {
        double gain = 0;
        for (int i = 1; i < points.size(); i++) {
            double diff = points.get(i).elevation() - points.get(i - 1).elevation();
            if (diff > 0) {
                gain += diff;
            }
        }
        return Math.round(gain);
    }

    public static Integer averageHeartRate(List<TrackPoint> points) {
        double average = points.stream()
            .map(TrackPoint::heartRate)
            .filter(Objects::nonNull)
            .filter(heartRate -> heartRate > 0)
            .mapToInt(Integer::intValue)
            .average()
            .orElse(Double.NaN);
        return Double.isNaN(average) ? null : (int) Math.round(average);
    }

    public static Integer maxHeartRate(List<TrackPoint> points) {
        return points.stream()
            .map(TrackPoint::heartRate)
            .filter(Objects::nonNull)
            .filter(heartRate -> heartRate > 0)
            .max(Integer::compareTo)
            .orElse(null);
    }
}
