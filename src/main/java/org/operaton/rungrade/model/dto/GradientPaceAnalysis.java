package org.operaton.rungrade.model.dto;

import java.util.List;

/**
 * Range-bucket pace analysis over bins pooled from many runs.
 */
public record GradientPaceAnalysis(List<GradientBucket> buckets, int totalBinsAnalyzed, String summary) {
}
