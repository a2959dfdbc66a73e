package org.operaton.rungrade.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Integer-degree gradient group. Gradients at or beyond the extremes are folded into
 * two open-ended sentinel groups, which sort before and after every exact group.
 */
public record GradientKey(Kind kind, int value) implements Comparable<GradientKey> {

    public static final int EXTREME = 35;

    public static final GradientKey AT_MOST_EXTREME = new GradientKey(Kind.AT_MOST, -EXTREME);
    public static final GradientKey AT_LEAST_EXTREME = new GradientKey(Kind.AT_LEAST, EXTREME);

    public enum Kind {
        /** Gradient rounded to this value and at most -35 */
        AT_MOST,
        /** Gradient rounded to exactly this value */
        EXACT,
        /** Gradient rounded to this value and at least 35 */
        AT_LEAST
    }

    public static GradientKey exact(int value) {
        return new GradientKey(Kind.EXACT, value);
    }

    /**
     * Groups a gradient percentage by rounding to the nearest integer.
     *
     * @param gradientPercent a finite gradient
     * @return the group key
     */
    public static GradientKey of(double gradientPercent) {
        long rounded = Math.round(gradientPercent);
        if (rounded <= -EXTREME) {
            return AT_MOST_EXTREME;
        }
        if (rounded >= EXTREME) {
            return AT_LEAST_EXTREME;
        }
        return exact((int) rounded);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GradientKey parse(String label) {
        String trimmed = label.trim();
        if (trimmed.startsWith("<=")) {
            return new GradientKey(Kind.AT_MOST, Integer.parseInt(trimmed.substring(2)));
        }
        if (trimmed.startsWith(">=")) {
            return new GradientKey(Kind.AT_LEAST, Integer.parseInt(trimmed.substring(2)));
        }
        return exact(Integer.parseInt(trimmed));
    }

    public boolean isExact() {
        return kind == Kind.EXACT;
    }

    @JsonValue
    public String label() {
        return switch (kind) {
            case AT_MOST -> "<=" + value;
            case AT_LEAST -> ">=" + value;
            case EXACT -> Integer.toString(value);
        };
    }

    @Override
    public int compareTo(GradientKey other) {
        int byKind = kind.compareTo(other.kind);
        if (byKind != 0) {
            return byKind;
        }
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return label();
    }
}
