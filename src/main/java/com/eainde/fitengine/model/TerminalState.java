package com.eainde.fitengine.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The resolved outcome governing everything downstream of gap classification.
 *
 * @param category             active gap category
 * @param severe               severe variant of the category (3+ levels below target)
 * @param scoreCap             hard cap on the fit score, null for no cap
 * @param ceiling              strongest recommendation allowed
 * @param affordance           affordance state required by this outcome
 * @param coachingMode         tone of the narrative
 * @param headline             system-authored opening sentence, carries the required phrases
 * @param requiredPhrases      phrases that must appear in the rendered output
 * @param forbiddenPhrases     phrases that must not appear anywhere in generated text
 * @param forbiddenPatterns    regex forms of forbidden claims
 * @param canonicalStatements  system-owned sentences for each sensitive topic in play
 * @param requiresClosingPlans whether the narrative must carry 3-month and 6-12 month plans
 * @param redirectSuggestion   what to target instead, may be null
 */
public record TerminalState(
        GapCategory category,
        boolean severe,
        Integer scoreCap,
        Recommendation ceiling,
        AffordanceState affordance,
        CoachingMode coachingMode,
        String headline,
        List<String> requiredPhrases,
        List<String> forbiddenPhrases,
        List<Pattern> forbiddenPatterns,
        Map<SensitiveTopic, String> canonicalStatements,
        boolean requiresClosingPlans,
        String redirectSuggestion
) {

    public TerminalState {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(ceiling, "ceiling");
        Objects.requireNonNull(affordance, "affordance");
        Objects.requireNonNull(coachingMode, "coachingMode");
        Objects.requireNonNull(headline, "headline");
        if (scoreCap != null && (scoreCap < 0 || scoreCap > 100)) {
            throw new IllegalArgumentException("Score cap out of range: " + scoreCap);
        }
        requiredPhrases = List.copyOf(requiredPhrases);
        forbiddenPhrases = List.copyOf(forbiddenPhrases);
        forbiddenPatterns = List.copyOf(forbiddenPatterns);
        canonicalStatements = Map.copyOf(canonicalStatements);
    }

    public int capScore(int score) {
        int bounded = Math.max(0, Math.min(100, score));
        return scoreCap == null ? bounded : Math.min(bounded, scoreCap);
    }

    public boolean isTerminal() {
        return category != GapCategory.NONE;
    }
}
