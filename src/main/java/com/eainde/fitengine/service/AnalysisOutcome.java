package com.eainde.fitengine.service;

import com.eainde.fitengine.model.CoachingNarrative;
import com.eainde.fitengine.model.FinalRecommendation;
import com.eainde.fitengine.model.Strength;

import java.util.List;

/**
 * Everything an analysis hands back. Built before the session is sealed and detached from it.
 */
public record AnalysisOutcome(
        String sessionId,
        FinalRecommendation recommendation,
        String redirectSuggestion,
        List<Strength> strengths,
        List<String> gaps,
        CoachingNarrative narrative
) {

    public AnalysisOutcome {
        strengths = List.copyOf(strengths);
        gaps = List.copyOf(gaps);
    }
}
