package org.operaton.rungrade.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PaceFormatter.
 */
class PaceFormatterTest {

    @Test
    @DisplayName("Should format pace as minutes and seconds")
    void testFormatPace() {
        assertEquals("5:30", PaceFormatter.formatPace(5.5));
        assertEquals("3:20", PaceFormatter.formatPace(3.3333));
    }

    @Test
    @DisplayName("Should carry rounded seconds into the next minute")
    void testFormatPaceRoundsUpToFullMinute() {
        assertEquals("6:00", PaceFormatter.formatPace(5.999));
    }

    @Test
    @DisplayName("Should return N/A for missing or non-positive pace")
    void testFormatPaceNotAvailable() {
        assertEquals("N/A", PaceFormatter.formatPace(null));
        assertEquals("N/A", PaceFormatter.formatPace(0.0));
        assertEquals("N/A", PaceFormatter.formatPace(-1.0));
        assertEquals("N/A", PaceFormatter.formatPace(Double.NaN));
    }

    @Test
    @DisplayName("Should format durations as HH:MM:SS")
    void testFormatDuration() {
        assertEquals("00:00:10", PaceFormatter.formatDuration(10.0));
        assertEquals("01:02:05", PaceFormatter.formatDuration(3725.9));
        assertNull(PaceFormatter.formatDuration(null));
    }
}
