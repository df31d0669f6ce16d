package com.eainde.fitengine.model;

import com.eainde.fitengine.exception.AuthorityConflictException;

import java.util.List;
import java.util.Objects;

/**
 * The single active gap of a session plus every other condition that fired but stays inert.
 *
 * @param active               the governing finding
 * @param inert                findings recorded for traceability, never acted upon
 * @param translationSupported whether domain translation claims are allowed
 */
public record GapClassification(GapFinding active, List<GapFinding> inert, boolean translationSupported) {

    public GapClassification {
        Objects.requireNonNull(active, "active");
        inert = inert == null ? List.of() : List.copyOf(inert);
        for (GapFinding finding : inert) {
            if (finding.category().outranks(active.category()) || finding.category() == active.category()) {
                throw new AuthorityConflictException("Inert finding " + finding.category()
                        + " is not below active finding " + active.category());
            }
        }
    }

    public GapCategory category() {
        return active.category();
    }

    public GapSeverity severity() {
        return active.severity();
    }

    public String redirectSuggestion() {
        return active.redirectSuggestion();
    }
}
