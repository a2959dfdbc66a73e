package org.operaton.rungrade.util;

import lombok.Data;
import org.operaton.rungrade.model.TrackPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Common data structure for parsed activity files (FIT, GPX).
 * Every format adapter fills this one schema so that downstream code never has to
 * care about where the points came from.
 */
@Data
public class ParsedActivityData {
    private List<TrackPoint> trackPoints = new ArrayList<>();
    private String sourceFormat; // "FIT" or "GPX"
    private String sport = "unknown";
    private Instant startTime;
    private Instant endTime;
    private Double totalTimeSeconds;
    private Double totalDistanceMeters;
    private Double elevationGainMeters;
    private Integer averageHeartRate;
    private Integer maxHeartRate;
    private Integer calories;
}
