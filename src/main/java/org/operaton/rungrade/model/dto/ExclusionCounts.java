package org.operaton.rungrade.model.dto;

import lombok.Data;

/**
 * Per-reason counters of bins removed by the reliability filter.
 * Every excluded bin is counted under exactly one reason and in {@code total}.
 */
@Data
public class ExclusionCounts {
    private int speed;
    private int gradient;
    private int duration;
    private int distance;
    private int heartRate;
    private int total;

    public void count(ExclusionReason reason) {
        switch (reason) {
            case SPEED -> speed++;
            case GRADIENT -> gradient++;
            case DURATION -> duration++;
            case DISTANCE -> distance++;
            case HEART_RATE -> heartRate++;
        }
        total++;
    }

    public void add(ExclusionCounts other) {
        speed += other.speed;
        gradient += other.gradient;
        duration += other.duration;
        distance += other.distance;
        heartRate += other.heartRate;
        total += other.total;
    }
}
