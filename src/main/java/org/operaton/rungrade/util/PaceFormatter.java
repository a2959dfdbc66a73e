package org.operaton.rungrade.util;

/**
 * Formats durations and paces for display.
 */
public final class PaceFormatter {

    public static final String NOT_AVAILABLE = "N/A";

    private PaceFormatter() {
    }

    /**
     * Formats a duration as {@code HH:MM:SS}, truncating fractional seconds.
     *
     * @param seconds the duration, may be null
     * @return the formatted duration, or null when no duration is given
     */
    public static String formatDuration(Double seconds) {
        if (seconds == null || !Double.isFinite(seconds) || seconds < 0) {
            return null;
        }
        long total = (long) Math.floor(seconds);
        return String.format("%02d:%02d:%02d", total / 3600, (total % 3600) / 60, total % 60);
    }

    /**
     * Formats a pace in min/km as {@code m:ss}, rounded to the nearest second.
     *
     * @param paceMinPerKm the pace, may be null
     * @return the label, or {@code N/A} for an absent or non-positive pace
     */
    public static String formatPace(Double paceMinPerKm) {
        if (paceMinPerKm == null || !Double.isFinite(paceMinPerKm) || paceMinPerKm <= 0) {
            return NOT_AVAILABLE;
        }
        long totalSeconds = Math.round(paceMinPerKm * 60);
        return String.format("%d:%02d", totalSeconds / 60, totalSeconds % 60);
    }
}
