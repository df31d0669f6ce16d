package com.eainde.fitengine.model;

import java.util.List;

/**
 * @param missingCredentials required credentials with no trace on the resume
 * @param disqualifiers      explicit JD disqualifiers the candidate hits
 */
public record EligibilityResult(List<String> missingCredentials, List<String> disqualifiers) {

    public EligibilityResult {
        missingCredentials = missingCredentials == null ? List.of() : List.copyOf(missingCredentials);
        disqualifiers = disqualifiers == null ? List.of() : List.copyOf(disqualifiers);
    }

    public boolean eligible() {
        return missingCredentials.isEmpty() && disqualifiers.isEmpty();
    }

    public static EligibilityResult satisfied() {
        return new EligibilityResult(List.of(), List.of());
    }
}
