package com.eainde.fitengine.model;

import java.util.Objects;

/**
 * Detected vs. target seniority. A positive distance means the candidate reads as under-leveled.
 */
public record LevelAssessment(SeniorityLevel detected, SeniorityLevel target, int distance) {

    public LevelAssessment {
        Objects.requireNonNull(detected, "detected");
        Objects.requireNonNull(target, "target");
        if (distance != target.rank() - detected.rank()) {
            throw new IllegalArgumentException("Distance " + distance + " does not match "
                    + target + " - " + detected);
        }
    }

    public static LevelAssessment of(SeniorityLevel detected, SeniorityLevel target) {
        return new LevelAssessment(detected, target, target.rank() - detected.rank());
    }

    public boolean underLeveled() {
        return distance > 0;
    }
}
