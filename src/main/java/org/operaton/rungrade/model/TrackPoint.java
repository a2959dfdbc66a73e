package org.operaton.rungrade.model;

import lombok.Builder;

import java.time.Instant;

/**
 * A single normalized GPS sample, independent of the file format it was read from.
 *
 * @param latitude  latitude in degrees
 * @param longitude longitude in degrees
 * @param elevation elevation in meters (0 when the source file has none)
 * @param timestamp sample time, may be null
 * @param heartRate heart rate in bpm, may be null
 * @param cadence   cadence in rpm/spm, may be null
 * @param speed     device-reported speed in km/h, may be null
 */
@Builder
public record TrackPoint(
        double latitude,
        double longitude,
        double elevation,
        Instant timestamp,
        Integer heartRate,
        Integer cadence,
        Double speed
) {

    /**
     * @return true if both coordinates are finite numbers
     */
    public boolean hasValidPosition() {
        return Double.isFinite(latitude) && Double.isFinite(longitude);
    }
}
