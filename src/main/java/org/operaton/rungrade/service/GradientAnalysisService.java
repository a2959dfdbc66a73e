package org.operaton.rungrade.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.InvalidAnalysisRequestException;
import org.operaton.rungrade.model.Bin;
import org.operaton.rungrade.model.GradientKey;
import org.operaton.rungrade.model.dto.AdjustmentExpectationAnalysis;
import org.operaton.rungrade.model.dto.AdjustmentExpectationBucket;
import org.operaton.rungrade.model.dto.AdjustmentStatistic;
import org.operaton.rungrade.model.dto.AdvancedAnalysis;
import org.operaton.rungrade.model.dto.GradeAdjustmentAnalysis;
import org.operaton.rungrade.model.dto.GradeAdjustmentEntry;
import org.operaton.rungrade.model.dto.GradientBucket;
import org.operaton.rungrade.model.dto.GradientPaceAnalysis;
import org.operaton.rungrade.model.dto.PaceByGradientEntry;
import org.operaton.rungrade.model.dto.RunResult;
import org.operaton.rungrade.util.GradeAdjustmentModel;
import org.operaton.rungrade.util.PaceFormatter;
import org.operaton.rungrade.util.QuarticGradeModel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Cross-run statistics relating pace to gradient.
 * <p>
 * The range buckets report the plain mean and median of per-bin paces, while the per-degree
 * chart derives one distance/time weighted pace per group. The grade adjustment analysis
 * builds on the chart; the adjustment-vs-expectation view works on individual bins.
 */
@Service
@Slf4j
public class GradientAnalysisService {

    static final int BASELINE_SEARCH_RADIUS = 2;

    private static final List<GradientRange> GRADIENT_RANGES = List.of(
        new GradientRange("≤-25%", null, -25.0),
        new GradientRange("-25 to -20%", -25.0, -20.0),
        new GradientRange("-20 to -15%", -20.0, -15.0),
        new GradientRange("-15 to -10%", -15.0, -10.0),
        new GradientRange("-10 to -5%", -10.0, -5.0),
        new GradientRange("-5 to 0%", -5.0, 0.0),
        new GradientRange("0 to 5%", 0.0, 5.0),
        new GradientRange("5 to 10%", 5.0, 10.0),
        new GradientRange("10 to 15%", 10.0, 15.0),
        new GradientRange("15 to 20%", 15.0, 20.0),
        new GradientRange("20 to 25%", 20.0, 25.0),
        new GradientRange(">25%", 25.0, null)
    );

    private final GradeAdjustmentModel literatureModel;

    public GradientAnalysisService() {
        this(QuarticGradeModel.LITERATURE);
    }

    GradientAnalysisService(GradeAdjustmentModel literatureModel) {
        this.literatureModel = literatureModel;
    }

    /**
     * Runs all analyses with the mean statistic for the expectation view.
     *
     * @see #analyzeGradientPace(List, AdjustmentStatistic)
     */
    public AdvancedAnalysis analyzeGradientPace(List<RunResult> runs) {
        return analyzeGradientPace(runs, AdjustmentStatistic.MEAN);
    }

    /**
     * Pools the bins of all runs and runs every gradient/pace analysis on them.
     *
     * @param runs      the analyzed runs
     * @param statistic statistic used by the adjustment-vs-expectation view
     * @return the combined analysis
     * @throws InvalidAnalysisRequestException if no run list is given or a run contains a null bin
     */
    public AdvancedAnalysis analyzeGradientPace(List<RunResult> runs, AdjustmentStatistic statistic) {
        if (runs == null) {
            throw new InvalidAnalysisRequestException("No results provided");
        }

        List<Bin> allBins = collectBins(runs);
        List<PaceByGradientEntry> chart = paceByGradientChart(allBins);

        GradientPaceAnalysis gradientPace = runs.isEmpty()
            ? new GradientPaceAnalysis(List.of(), 0, "No results to analyze")
            : rangeBuckets(allBins);

        log.info("Analyzed {} bins from {} runs: {} range buckets, {} gradient groups",
            allBins.size(), runs.size(), gradientPace.buckets().size(), chart.size());

        return new AdvancedAnalysis(
            gradientPace,
            chart,
            gradeAdjustment(chart),
            adjustmentExpectation(allBins, statistic != null ? statistic : AdjustmentStatistic.MEAN)
        );
    }

    /**
     * Partitions bins into twelve non-overlapping gradient ranges and reports mean and median
     * pace and heart rate per range. Ranges without a valid pace are omitted.
     */
    public GradientPaceAnalysis rangeBuckets(List<Bin> allBins) {
        if (allBins.isEmpty()) {
            return new GradientPaceAnalysis(List.of(), 0, "No bins found in results");
        }

        List<GradientBucket> buckets = new ArrayList<>();
        for (GradientRange range : GRADIENT_RANGES) {
            List<Bin> binsInRange = allBins.stream()
                .filter(bin -> range.contains(bin.gradientPercent()))
                .toList();
            if (binsInRange.isEmpty()) {
                continue;
            }

            List<Double> paces = binsInRange.stream()
                .filter(Bin::hasValidPace)
                .map(Bin::paceMinPerKm)
                .toList();
            if (paces.isEmpty()) {
                continue;
            }

            List<Double> heartRates = binsInRange.stream()
                .map(Bin::avgHeartRate)
                .filter(Objects::nonNull)
                .filter(heartRate -> heartRate > 0)
                .map(Integer::doubleValue)
                .toList();

            double avgPace = mean(paces);
            double medianPace = median(paces);
            log.debug("Bucket {}: {} pace values, mean {}, median {}", range.label(), paces.size(), avgPace, medianPace);

            buckets.add(GradientBucket.builder()
                .label(range.label())
                .min(range.min())
                .max(range.max())
                .binCount(binsInRange.size())
                .avgPace(avgPace)
                .medianPace(medianPace)
                .avgHeartRate(heartRates.isEmpty() ? null : mean(heartRates))
                .medianHeartRate(heartRates.isEmpty() ? null : median(heartRates))
                .paceLabel(PaceFormatter.formatPace(avgPace))
                .medianPaceLabel(PaceFormatter.formatPace(medianPace))
                .build());
        }

        return new GradientPaceAnalysis(buckets, allBins.size(),
            String.format("Analyzed %d gradient ranges with %d total bins", buckets.size(), allBins.size()));
    }

    /**
     * Groups bins per integer degree of gradient and derives one weighted pace per group:
     * {@code (sum of time / 60) / (sum of distance / 1000)}. Only bins with a finite gradient,
     * a positive distance and a positive duration take part.
     *
     * @return entries ordered by gradient, extreme groups first and last
     */
    public List<PaceByGradientEntry> paceByGradientChart(List<Bin> allBins) {
        Map<GradientKey, double[]> groups = new TreeMap<>();

        for (Bin bin : allBins) {
            if (!Double.isFinite(bin.gradientPercent()) || !(bin.distanceMeters() > 0)
                || bin.durationSeconds() == null || !(bin.durationSeconds() > 0)) {
                continue;
            }
            double[] totals = groups.computeIfAbsent(GradientKey.of(bin.gradientPercent()), key -> new double[3]);
            totals[0] += bin.distanceMeters();
            totals[1] += bin.durationSeconds();
            totals[2]++;
        }

        List<PaceByGradientEntry> chart = new ArrayList<>(groups.size());
        groups.forEach((key, totals) -> {
            double pace = (totals[1] / 60) / (totals[0] / 1000);
            chart.add(new PaceByGradientEntry(key, (int) totals[2], totals[0], totals[1], pace,
                PaceFormatter.formatPace(pace)));
        });
        return chart;
    }

    /**
     * Compares the runner's pace per gradient group with their flat pace and with the literature model.
     *
     * @param chart the per-degree chart, ordered by gradient
     */
    public GradeAdjustmentAnalysis gradeAdjustment(List<PaceByGradientEntry> chart) {
        Double basePace = findBaseline(chart, PaceByGradientEntry::gradient)
            .map(PaceByGradientEntry::avgPace)
            .orElseGet(() -> chart.isEmpty() ? null : chart.stream()
                .mapToDouble(PaceByGradientEntry::avgPace)
                .average()
                .orElseThrow());

        List<GradeAdjustmentEntry> entries = chart.stream()
            .map(entry -> {
                double gradientValue = entry.gradient().value();
                double personal = basePace != null && basePace > 0 ? entry.avgPace() / basePace : 1;
                return new GradeAdjustmentEntry(
                    entry.gradient(),
                    gradientValue,
                    round4(personal),
                    round4(literatureModel.factor(gradientValue)),
                    entry.avgPace(),
                    entry.paceLabel(),
                    entry.binCount());
            })
            .toList();

        return new GradeAdjustmentAnalysis(entries, basePace, PaceFormatter.formatPace(basePace));
    }

    /**
     * Compares each bin's pace relative to the flat baseline with the literature model's expectation,
     * grouped per integer degree.
     * <p>
     * The baseline is the chosen statistic over the per-bin paces of the 0% group, else of the
     * nearest group within two degrees, else of all bins.
     */
    public AdjustmentExpectationAnalysis adjustmentExpectation(List<Bin> allBins, AdjustmentStatistic statistic) {
        Map<GradientKey, List<Double>> pacesByGradient = new TreeMap<>();
        for (Bin bin : allBins) {
            if (Double.isFinite(bin.gradientPercent()) && bin.hasValidPace()) {
                pacesByGradient.computeIfAbsent(GradientKey.of(bin.gradientPercent()), key -> new ArrayList<>())
                    .add(bin.paceMinPerKm());
            }
        }

        if (pacesByGradient.isEmpty()) {
            return new AdjustmentExpectationAnalysis(statistic, null, List.of());
        }

        List<Double> baselinePaces = findBaseline(pacesByGradient.keySet(), key -> key)
            .map(pacesByGradient::get)
            .orElseGet(() -> pacesByGradient.values().stream().flatMap(List::stream).toList());
        double basePace = apply(statistic, baselinePaces);

        List<AdjustmentExpectationBucket> buckets = new ArrayList<>();
        pacesByGradient.forEach((key, paces) -> {
            List<Double> ratios = paces.stream().map(pace -> pace / basePace).toList();
            double actual = apply(statistic, ratios);
            double expected = literatureModel.factor(key.value());
            buckets.add(new AdjustmentExpectationBucket(key, paces.size(), round4(actual), round4(expected),
                round4(actual - expected)));
        });

        return new AdjustmentExpectationAnalysis(statistic, basePace, buckets);
    }

    /**
     * Picks the 0% group, else the exact group closest to 0 within the search radius.
     * On equal distance the lower gradient wins because groups arrive in ascending order.
     */
    private static <T> Optional<T> findBaseline(Collection<T> groups, Function<T, GradientKey> keyOf) {
        return groups.stream()
            .filter(group -> keyOf.apply(group).isExact())
            .filter(group -> Math.abs(keyOf.apply(group).value()) <= BASELINE_SEARCH_RADIUS)
            .min(Comparator.comparingInt(group -> Math.abs(keyOf.apply(group).value())));
    }

    private static List<Bin> collectBins(List<RunResult> runs) {
        List<Bin> allBins = new ArrayList<>();
        for (RunResult run : runs) {
            if (run == null) {
                continue;
            }
            for (Bin bin : run.binsOrEmpty()) {
                if (bin == null) {
                    throw new InvalidAnalysisRequestException("Bin list contains a null entry");
                }
                allBins.add(bin);
            }
        }
        return allBins;
    }

    private static double apply(AdjustmentStatistic statistic, List<Double> values) {
        return statistic == AdjustmentStatistic.MEDIAN ? median(values) : mean(values);
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    /**
     * Middle value for odd counts, mean of the two middle values for even counts.
     */
    static double median(List<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2 : sorted[mid];
    }

    private static double round4(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }

    /**
     * A gradient range {@code (min, max]}; a null bound leaves that side open,
     * with the lowest range closed at its upper bound.
     */
    private record GradientRange(String label, Double min, Double max) {

        boolean contains(double gradient) {
            if (min == null) {
                return gradient <= max;
            }
            if (max == null) {
                return gradient > min;
            }
            return gradient > min && gradient <= max;
        }
    }
}
