package org.operaton.rungrade.util;

import org.operaton.rungrade.model.TrackPoint;

/**
 * Great-circle distance between track points.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_METERS = 6_371_000;

    private GeoDistance() {
    }

    /**
     * Calculates distance between two GPS points using Haversine formula.
     * A segment with a non-finite coordinate at either end counts as 0 m.
     *
     * @return distance in meters
     */
    public static double haversine(TrackPoint from, TrackPoint to) {
        if (!from.hasValidPosition() || !to.hasValidPosition()) {
            return 0;
        }
        return haversine(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    public static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
            Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) *
                Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }
}
