package com.eainde.fitengine.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ordered seniority ladder used for both detected and target levels.
 *
 * <p>The {@link #rank()} is what level distance arithmetic runs on; the ordinal is not
 * relied upon anywhere outside this enum.</p>
 */
public enum SeniorityLevel {
    ENTRY(0, "Entry"),
    ASSOCIATE(1, "Associate"),
    MID(2, "Mid"),
    SENIOR(3, "Senior"),
    STAFF(4, "Staff / Principal"),
    DIRECTOR(5, "Director"),
    VP(6, "VP"),
    EXECUTIVE(7, "Executive");

    private final int rank;
    private final String label;

    SeniorityLevel(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    public boolean isAtLeast(SeniorityLevel other) {
        return rank >= other.rank;
    }

    public static Optional<SeniorityLevel> fromRank(int rank) {
        return Arrays.stream(values()).filter(l -> l.rank == rank).findFirst();
    }
}
