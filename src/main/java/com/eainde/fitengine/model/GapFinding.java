package com.eainde.fitengine.model;

import java.util.Objects;

/**
 * One gap condition that fired, with its reason and where the candidate should aim instead.
 *
 * @param titleInflation true when an inflated title is among the causes; only a credibility finding sets it
 */
public record GapFinding(GapCategory category, GapSeverity severity, String reason, String redirectSuggestion,
                         boolean titleInflation) {

    public GapFinding {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
    }

    public GapFinding(GapCategory category, GapSeverity severity, String reason, String redirectSuggestion) {
        this(category, severity, reason, redirectSuggestion, false);
    }

    public static GapFinding none() {
        return new GapFinding(GapCategory.NONE, GapSeverity.NONE, "No gap conditions fired", null);
    }
}
