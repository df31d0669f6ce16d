package com.eainde.fitengine.coaching;

import com.eainde.fitengine.model.CoachingMode;
import com.eainde.fitengine.model.FinalRecommendation;
import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.model.StrengthTier;
import com.eainde.fitengine.model.TerminalState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the locked outcome and the ranked evidence into provider instructions.
 */
@Component
public class NarrativePromptBuilder {

    private static final String SYSTEM_TEMPLATE = """
            You are the coaching writer of a resume-to-job fit engine.
            The decision below is final. You explain it; you never change it.

            ═══════════════════════════════════════════════════════════
            LOCKED DECISION
            ═══════════════════════════════════════════════════════════
            Recommendation : %s
            Gap category   : %s
            Coaching mode  : %s
            Tone           : %s

            ═══════════════════════════════════════════════════════════
            HARD RULES
            ═══════════════════════════════════════════════════════════
            R1  Cite strengths in the order given. Tier JD_REQUIRED first, then JD_ADJACENT,
                then GENERIC. %s
            R2  Every strength must quote or paraphrase its evidence. No evidence, no claim.
            R3  Do not write about title inflation, credibility, functional mismatch, domain
                translation or eligibility. The engine inserts those sentences itself.
            R4  Never use any of these phrases: %s
            R5  "yourMove" is at most 3 sentences.
            R6  %s
            R7  Do not restate or soften the recommendation.

            ═══════════════════════════════════════════════════════════
            OUTPUT FORMAT
            ═══════════════════════════════════════════════════════════
            A single JSON object with the fields summary, strengths, gaps, yourMove,
            threeMonthPlan and sixToTwelveMonthPlan. No markdown, no prose outside the JSON.
            """;

    public NarrativePrompt build(TerminalState state,
                                 FinalRecommendation recommendation,
                                 JobDescription jd,
                                 List<Strength> strengths,
                                 List<String> gaps,
                                 List<String> feedback) {
        String system = SYSTEM_TEMPLATE.formatted(
                recommendation.recommendation().label(),
                state.category().label(),
                state.coachingMode(),
                toneOf(state.coachingMode()),
                strengths.stream().anyMatch(s -> s.tier() == StrengthTier.JD_REQUIRED)
                        ? "Generic leadership language is forbidden for this session."
                        : "Generic leadership language is allowed only for GENERIC strengths.",
                state.forbiddenPhrases().isEmpty() ? "(none)" : "\"" + String.join("\", \"", state.forbiddenPhrases()) + "\"",
                state.requiresClosingPlans()
                        ? "threeMonthPlan and sixToTwelveMonthPlan must each hold at least one concrete step."
                        : "threeMonthPlan and sixToTwelveMonthPlan may be empty arrays.");

        StringBuilder user = new StringBuilder();
        user.append("Role: ").append(jd.roleTitle());
        if (jd.company() != null && !jd.company().isBlank()) {
            user.append(" at ").append(jd.company());
        }
        user.append("\n\nStrengths (ranked):\n");
        for (int i = 0; i < strengths.size(); i++) {
            Strength s = strengths.get(i);
            user.append(i + 1).append(". [").append(s.tier()).append("] ").append(s.capability())
                    .append(" | evidence: ").append(s.evidence()).append('\n');
        }
        user.append("\nGaps:\n");
        gaps.forEach(g -> user.append("- ").append(g).append('\n'));
        if (state.redirectSuggestion() != null) {
            user.append("\nRedirect: ").append(state.redirectSuggestion()).append('\n');
        }
        if (!feedback.isEmpty()) {
            user.append("\nYour previous answer was rejected:\n");
            feedback.forEach(f -> user.append("- ").append(f).append('\n'));
            user.append("Fix every point above.\n");
        }
        return new NarrativePrompt(system, user.toString());
    }

    private static String toneOf(CoachingMode mode) {
        return switch (mode) {
            case REDIRECTION -> "Direct. Point the candidate at roles they can win now.";
            case CREDIBILITY_REPAIR -> "Plain and firm. Focus on making claims verifiable.";
            case SIGNAL_BUILDING -> "Practical. Focus on the concrete signals still missing.";
            case OPTIMIZATION -> "Confident. Sharpen what already works.";
        };
    }
}
