package org.operaton.rungrade.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.model.Bin;
import org.operaton.rungrade.model.RunSummary;
import org.operaton.rungrade.model.TrackPoint;
import org.operaton.rungrade.util.GeoDistance;
import org.operaton.rungrade.util.GradeAdjustmentModel;
import org.operaton.rungrade.util.PaceFormatter;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a point sequence into consecutive fixed-distance bins and derives
 * gradient, pace, heart rate and grade-adjusted metrics for each of them.
 */
@Service
@Slf4j
public class BinningService {

    /**
     * Bins a point sequence without grade adjustment.
     *
     * @see #bin(List, double, GradeAdjustmentModel, Double)
     */
    public List<Bin> bin(List<TrackPoint> points, double binLength) {
        return bin(points, binLength, null, null);
    }

    /**
     * Bins a point sequence.
     * <p>
     * Segment distances accumulate until they reach {@code binLength}; the bin then spans from
     * the previous bin's end point to the current point, both inclusive, and carries the
     * accumulated distance unclamped. Points left after the last closed bin form one shorter
     * remainder bin. Consecutive bins share their boundary point, so the index ranges cover
     * the whole sequence.
     *
     * @param points            the normalized point sequence
     * @param binLength         target bin distance in meters
     * @param gradeModel        model used for grade-adjusted metrics, may be null
     * @param referenceVelocity flat-ground velocity in m/s for the adjusted duration, may be null
     * @return the bins in route order, empty for fewer than two points
     * @throws IllegalArgumentException if the bin length is not a positive number
     */
    public List<Bin> bin(List<TrackPoint> points, double binLength,
                         GradeAdjustmentModel gradeModel, Double referenceVelocity) {
        if (!Double.isFinite(binLength) || binLength <= 0) {
            throw new IllegalArgumentException("Bin length must be a positive number of meters, got: " + binLength);
        }
        if (points == null || points.size() < 2) {
            return List.of();
        }

        List<Bin> bins = new ArrayList<>();
        int lastBinIdx = 0;
        double cumulativeDistance = 0;

        for (int i = 1; i < points.size(); i++) {
            cumulativeDistance += GeoDistance.haversine(points.get(i - 1), points.get(i));

            if (cumulativeDistance >= binLength) {
                bins.add(createBin(points, lastBinIdx, i, cumulativeDistance, gradeModel, referenceVelocity));
                cumulativeDistance = 0;
                lastBinIdx = i;
            }
        }

        int lastIdx = points.size() - 1;
        if (lastBinIdx < lastIdx) {
            bins.add(createBin(points, lastBinIdx, lastIdx, cumulativeDistance, gradeModel, referenceVelocity));
        }

        log.debug("Created {} bins of {} m from {} points", bins.size(), binLength, points.size());
        return bins;
    }

    /**
     * Aggregates the bins of one activity. Only bins with a positive distance count as valid.
     *
     * @param bins the bins of one activity
     * @return the summary, empty if there is no valid bin
     */
    public Optional<RunSummary> summarize(List<Bin> bins) {
        if (bins == null || bins.isEmpty()) {
            return Optional.empty();
        }

        List<Bin> validBins = bins.stream()
            .filter(bin -> bin.distanceMeters() > 0)
            .toList();
        if (validBins.isEmpty()) {
            return Optional.empty();
        }

        double totalDistance = 0;
        double totalTime = 0;
        double totalElevationGain = 0;
        int heartRateBins = 0;
        long heartRateSum = 0;
        Integer maxHeartRate = null;

        for (Bin bin : validBins) {
            totalDistance += bin.distanceMeters();
            if (bin.durationSeconds() != null) {
                totalTime += bin.durationSeconds();
            }
            totalElevationGain += Math.max(0, bin.elevationChangeMeters());
            if (bin.hasHeartRate()) {
                heartRateBins++;
                heartRateSum += bin.avgHeartRate();
                if (bin.maxHeartRate() != null && (maxHeartRate == null || bin.maxHeartRate() > maxHeartRate)) {
                    maxHeartRate = bin.maxHeartRate();
                }
            }
        }

        Double avgPace = totalDistance > 0 && totalTime > 0
            ? (totalTime / 60) / (totalDistance / 1000)
            : null;

        return Optional.of(RunSummary.builder()
            .totalBins(bins.size())
            .validBins(validBins.size())
            .totalDistanceKm(round(totalDistance / 1000, 2))
            .totalTimeSeconds(totalTime)
            .totalElevationGainMeters(Math.round(totalElevationGain))
            .avgPaceMinPerKm(avgPace)
            .avgHeartRate(heartRateBins > 0 ? (int) Math.round((double) heartRateSum / heartRateBins) : null)
            .maxHeartRate(maxHeartRate)
            .heartRateCoverage((double) heartRateBins / validBins.size())
            .build());
    }

    private Bin createBin(List<TrackPoint> points, int startIdx, int endIdx, double distance,
                          GradeAdjustmentModel gradeModel, Double referenceVelocity) {
        TrackPoint start = points.get(startIdx);
        TrackPoint end = points.get(endIdx);

        double elevationChange = end.elevation() - start.elevation();
        double gradient = distance > 0 ? round(elevationChange / distance * 100, 2) : 0;

        Bin.BinBuilder bin = Bin.builder()
            .distanceMeters(distance)
            .elevationChangeMeters(round(elevationChange, 2))
            .gradientPercent(gradient)
            .startIndex(startIdx)
            .endIndex(endIdx)
            .startTime(start.timestamp())
            .endTime(end.timestamp());

        applyTiming(bin, start, end, distance);
        applyHeartRate(bin, points, startIdx, endIdx);
        applyGradeAdjustment(bin, distance, gradient, gradeModel, referenceVelocity);

        return bin.build();
    }

    private void applyTiming(Bin.BinBuilder bin, TrackPoint start, TrackPoint end, double distance) {
        if (start.timestamp() == null || end.timestamp() == null) {
            return;
        }
        double seconds = Duration.between(start.timestamp(), end.timestamp()).toMillis() / 1000.0;
        if (!Double.isFinite(seconds) || seconds <= 0) {
            return;
        }

        double velocity = distance / seconds;
        bin.durationSeconds(seconds)
            .timeTaken(PaceFormatter.formatDuration(seconds))
            .velocityMps(velocity);

        if (velocity > 0) {
            bin.paceMinPerKm((1000 / velocity) / 60);
        }
    }

    private void applyHeartRate(Bin.BinBuilder bin, List<TrackPoint> points, int startIdx, int endIdx) {
        int count = 0;
        long sum = 0;
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;

        for (int i = startIdx; i <= endIdx; i++) {
            Integer heartRate = points.get(i).heartRate();
            if (heartRate != null && heartRate > 0) {
                count++;
                sum += heartRate;
                max = Math.max(max, heartRate);
                min = Math.min(min, heartRate);
            }
        }

        bin.heartRateSampleCount(count);
        if (count > 0) {
            bin.avgHeartRate((int) Math.round((double) sum / count))
                .maxHeartRate(max)
                .minHeartRate(min);
        }
    }

    private void applyGradeAdjustment(Bin.BinBuilder bin, double distance, double gradient,
                                      GradeAdjustmentModel gradeModel, Double referenceVelocity) {
        if (gradeModel == null || referenceVelocity == null
            || !Double.isFinite(referenceVelocity) || referenceVelocity <= 0) {
            return;
        }

        double factor = gradeModel.factor(GradeAdjustmentModel.clamp(gradient));
        if (Double.isFinite(factor) && factor > 0) {
            bin.adjustedDurationSeconds(distance * factor / referenceVelocity)
                .gradeAdjustedDistanceMeters(distance * factor);
        }
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
