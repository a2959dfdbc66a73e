package org.operaton.rungrade.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.InvalidAnalysisRequestException;
import org.operaton.rungrade.model.Bin;
import org.operaton.rungrade.model.dto.BinFilterResult;
import org.operaton.rungrade.model.dto.ExclusionCounts;
import org.operaton.rungrade.model.dto.ExclusionReason;
import org.operaton.rungrade.model.dto.FilterOptions;
import org.operaton.rungrade.model.dto.HeartRateRange;
import org.operaton.rungrade.model.dto.RunFilterResult;
import org.operaton.rungrade.model.dto.RunResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes bins whose metrics are physically implausible or whose heart rate falls outside
 * a requested range. Every excluded bin is counted under exactly one reason.
 */
@Service
@Slf4j
public class BinFilterService {

    static final double MIN_SPEED_KMH = 1;
    static final double MAX_SPEED_KMH = 30;
    static final double MAX_ABS_GRADIENT = 30;
    static final double MIN_DURATION_SECONDS = 1;

    private static final double MPS_TO_KPH = 3.6;

    /**
     * Filters the bins of one activity.
     *
     * @param bins    the bins, may be null
     * @param options which checks to run
     * @return kept bins in their original order plus the exclusion counts
     * @throws InvalidAnalysisRequestException if the list contains a null bin
     */
    public BinFilterResult filter(List<Bin> bins, FilterOptions options) {
        FilterOptions effective = options != null ? options : FilterOptions.none();
        ExclusionCounts counts = new ExclusionCounts();
        List<Bin> kept = new ArrayList<>();

        if (bins != null) {
            for (Bin bin : bins) {
                if (bin == null) {
                    throw new InvalidAnalysisRequestException("Bin list contains a null entry");
                }
                Optional<ExclusionReason> reason = exclusionReason(bin, effective);
                if (reason.isPresent()) {
                    counts.count(reason.get());
                } else {
                    kept.add(bin);
                }
            }
        }

        return new BinFilterResult(kept, counts);
    }

    /**
     * Filters every run's bins and sums up the exclusion counts. Null runs are skipped.
     *
     * @param runs    the runs to filter
     * @param options which checks to run
     * @return the runs with their bins replaced by the kept bins
     * @throws InvalidAnalysisRequestException if a run contains a null bin
     */
    public RunFilterResult filterRuns(List<RunResult> runs, FilterOptions options) {
        ExclusionCounts totalCounts = new ExclusionCounts();
        List<RunResult> filtered = new ArrayList<>();
        int originalBins = 0;
        int keptBins = 0;

        for (RunResult run : runs) {
            if (run == null) {
                continue;
            }
            List<Bin> bins = run.binsOrEmpty();
            BinFilterResult result = filter(bins, options);
            originalBins += bins.size();
            keptBins += result.keptBins().size();
            totalCounts.add(result.exclusionCounts());
            filtered.add(run.withBins(result.keptBins()));
        }

        log.debug("Filtered {} runs: kept {} of {} bins, exclusions {}",
            runs.size(), keptBins, originalBins, totalCounts);
        return new RunFilterResult(filtered, originalBins, keptBins, totalCounts);
    }

    /**
     * Determines why a bin is excluded. Checks run in a fixed order and the first match wins.
     */
    Optional<ExclusionReason> exclusionReason(Bin bin, FilterOptions options) {
        if (options.removeUnreliableBins()) {
            double speed = speedKmh(bin);
            if (!(speed >= MIN_SPEED_KMH && speed <= MAX_SPEED_KMH)) {
                return Optional.of(ExclusionReason.SPEED);
            }
            if (!(bin.gradientPercent() >= -MAX_ABS_GRADIENT && bin.gradientPercent() <= MAX_ABS_GRADIENT)) {
                return Optional.of(ExclusionReason.GRADIENT);
            }
            if (bin.durationSeconds() == null || !(bin.durationSeconds() >= MIN_DURATION_SECONDS)) {
                return Optional.of(ExclusionReason.DURATION);
            }
            if (!(bin.distanceMeters() > 0)) {
                return Optional.of(ExclusionReason.DISTANCE);
            }
        }

        if (options.isHeartRateFilterActive()) {
            HeartRateRange range = options.heartRateFilter();
            if (!bin.hasHeartRate() || !range.contains(bin.avgHeartRate())) {
                return Optional.of(ExclusionReason.HEART_RATE);
            }
        }

        return Optional.empty();
    }

    /**
     * Client-supplied km/h speed when present, otherwise derived from the velocity, otherwise 0.
     */
    private double speedKmh(Bin bin) {
        if (bin.averageSpeedKmh() != null) {
            return bin.averageSpeedKmh();
        }
        if (bin.velocityMps() != null) {
            return bin.velocityMps() * MPS_TO_KPH;
        }
        return 0;
    }
}
