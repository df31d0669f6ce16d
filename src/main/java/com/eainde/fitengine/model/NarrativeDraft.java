package com.eainde.fitengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured output returned by the text provider, before phrase validation.
 */
public record NarrativeDraft(
        @JsonProperty("summary")             String summary,
        @JsonProperty("strengths")           List<String> strengths,
        @JsonProperty("gaps")                List<String> gaps,
        @JsonProperty("yourMove")            String yourMove,
        @JsonProperty("threeMonthPlan")      List<String> threeMonthPlan,
        @JsonProperty("sixToTwelveMonthPlan") List<String> sixToTwelveMonthPlan
) {

    public NarrativeDraft {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        threeMonthPlan = threeMonthPlan == null ? List.of() : List.copyOf(threeMonthPlan);
        sixToTwelveMonthPlan = sixToTwelveMonthPlan == null ? List.of() : List.copyOf(sixToTwelveMonthPlan);
    }
}
