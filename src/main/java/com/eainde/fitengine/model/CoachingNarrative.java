package com.eainde.fitengine.model;

import java.util.List;

/**
 * Validated narrative. {@code statements} holds the canonical sentences inserted by the engine.
 */
public record CoachingNarrative(
        CoachingMode mode,
        String summary,
        List<String> statements,
        List<String> strengths,
        List<String> gaps,
        String yourMove,
        List<String> threeMonthPlan,
        List<String> sixToTwelveMonthPlan
) {

    public CoachingNarrative {
        statements = List.copyOf(statements);
        strengths = List.copyOf(strengths);
        gaps = List.copyOf(gaps);
        threeMonthPlan = List.copyOf(threeMonthPlan);
        sixToTwelveMonthPlan = List.copyOf(sixToTwelveMonthPlan);
    }
}
