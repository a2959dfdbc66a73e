package org.operaton.rungrade.model.dto;

import java.util.List;

/**
 * Aggregate report returned by the synchronous batch mode.
 */
public record BatchReport(boolean success, BatchSummary summary, List<RunResult> results, List<FileError> errors) {
}
