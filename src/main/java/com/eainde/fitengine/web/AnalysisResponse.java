package com.eainde.fitengine.web;

import com.eainde.fitengine.model.AffordanceState;
import com.eainde.fitengine.model.CoachingMode;
import com.eainde.fitengine.model.CoachingNarrative;
import com.eainde.fitengine.model.FinalRecommendation;
import com.eainde.fitengine.model.GapCategory;
import com.eainde.fitengine.model.Recommendation;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.service.AnalysisOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
        @JsonProperty("sessionId")           String sessionId,
        @JsonProperty("fitScore")            int fitScore,
        @JsonProperty("recommendation")      Recommendation recommendation,
        @JsonProperty("recommendationLabel") String recommendationLabel,
        @JsonProperty("affordance")          AffordanceState affordance,
        @JsonProperty("coachingMode")        CoachingMode coachingMode,
        @JsonProperty("gapCategory")         GapCategory gapCategory,
        @JsonProperty("redirectSuggestion")  String redirectSuggestion,
        @JsonProperty("strengths")           List<Strength> strengths,
        @JsonProperty("gaps")                List<String> gaps,
        @JsonProperty("narrative")           CoachingNarrative narrative
) {

    public static AnalysisResponse from(AnalysisOutcome outcome) {
        FinalRecommendation rec = outcome.recommendation();
        return new AnalysisResponse(
                outcome.sessionId(),
                rec.fitScore(),
                rec.recommendation(),
                rec.recommendation().label(),
                rec.affordance(),
                rec.coachingMode(),
                rec.category(),
                outcome.redirectSuggestion(),
                outcome.strengths(),
                outcome.gaps(),
                outcome.narrative());
    }
}
