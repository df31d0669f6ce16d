package com.eainde.fitengine.model;

import java.util.Comparator;

/**
 * Gap taxonomy in decision authority order. Lower {@link #authority()} wins.
 */
public enum GapCategory {
    CREDIBILITY_VIOLATION(1, "Credibility violation"),
    ELIGIBILITY_VIOLATION(2, "Eligibility violation"),
    FUNCTION_MISMATCH(3, "Function mismatch"),
    EXPERIENCE_GAP(4, "Experience gap"),
    PRESENTATION_GAP(5, "Presentation gap"),
    NONE(99, "No gap");

    public static final Comparator<GapCategory> BY_AUTHORITY = Comparator.comparingInt(GapCategory::authority);

    private final int authority;
    private final String label;

    GapCategory(int authority, String label) {
        this.authority = authority;
        this.label = label;
    }

    public int authority() {
        return authority;
    }

    public String label() {
        return label;
    }

    public boolean outranks(GapCategory other) {
        return authority < other.authority;
    }
}
