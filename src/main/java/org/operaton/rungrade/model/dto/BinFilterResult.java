package org.operaton.rungrade.model.dto;

import org.operaton.rungrade.model.Bin;

import java.util.List;

/**
 * Bins that survived the reliability filter and why the others were dropped.
 */
public record BinFilterResult(List<Bin> keptBins, ExclusionCounts exclusionCounts) {
}
