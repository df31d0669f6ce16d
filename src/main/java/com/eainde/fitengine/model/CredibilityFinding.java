package com.eainde.fitengine.model;

/**
 * A claim on the resume that cannot be true as written.
 */
public record CredibilityFinding(Kind kind, String detail) {

    public enum Kind {
        TITLE_INFLATION,
        IMPLAUSIBLE_METRIC,
        TIMELINE_INCONSISTENCY
    }
}
