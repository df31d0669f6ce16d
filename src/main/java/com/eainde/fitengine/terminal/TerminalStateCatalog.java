package com.eainde.fitengine.terminal;

import com.eainde.fitengine.model.AffordanceState;
import com.eainde.fitengine.model.CoachingMode;
import com.eainde.fitengine.model.GapCategory;
import com.eainde.fitengine.model.Recommendation;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed outcome table: hard caps, ceilings, affordances and phrase rules per gap category.
 * Numeric caps here are not tunable; penalties are, and live in the penalty schedule.
 */
final class TerminalStateCatalog {

    private TerminalStateCatalog() {
    }

    record Entry(Integer scoreCap, Recommendation ceiling, AffordanceState affordance, CoachingMode mode,
                 List<String> forbidden, boolean closingPlans) {
    }

    static final List<String> UNIVERSAL_FORBIDDEN = List.of(
            "you have the foundation",
            "you likely have this",
            "make it visible on your resume",
            "gaps are meant to be closed",
            "let's build the foundation",
            "a few targeted improvements",
            "i've done the heavy lifting",
            "ready to apply",
            "ready to submit");

    static final List<Pattern> TRANSLATION_PATTERNS = List.of(
            ci("\\byour (experience|background|skills) (translates?|transfers?) (well |directly )?to\\b"),
            ci("\\b(skills|experience) (transfer|translate)s? (well |directly )?to\\b"),
            ci("\\bbackground (applies|maps) (directly |well )?to\\b"),
            ci("\\bdirectly applicable to\\b"));

    static final Entry CREDIBILITY = new Entry(20, Recommendation.PASS, AffordanceState.DISABLED,
            CoachingMode.CREDIBILITY_REPAIR,
            List.of("presentation gap", "you're actually senior", "you're probably operating at senior",
                    "you're close", "stretch role", "with some polish", "strong foundation", "competitive",
                    "supports senior", "supports director"),
            false);

    static final Entry ELIGIBILITY = new Entry(20, Recommendation.PASS, AffordanceState.DISABLED,
            CoachingMode.REDIRECTION,
            List.of("presentation gap", "you're close", "stretch role"),
            false);

    static final Entry FUNCTION_MISMATCH = new Entry(25, Recommendation.LONG_SHOT, AffordanceState.DEMOTED,
            CoachingMode.REDIRECTION,
            List.of("years of experience", "presentation gap", "you're close to", "strong fit"),
            false);

    static final Entry FUNCTION_MISMATCH_COMPLETE = new Entry(25, Recommendation.PASS, AffordanceState.DISABLED,
            CoachingMode.REDIRECTION, FUNCTION_MISMATCH.forbidden(), false);

    static final Entry EXPERIENCE_GAP = new Entry(50, Recommendation.CONDITIONAL_APPLY,
            AffordanceState.ENABLED_WITH_WARNING, CoachingMode.SIGNAL_BUILDING,
            List.of("presentation gap", "you're actually senior", "you're already there"),
            true);

    static final Entry EXPERIENCE_GAP_SEVERE = new Entry(25, Recommendation.PASS, AffordanceState.DISABLED,
            CoachingMode.REDIRECTION,
            List.of("presentation gap", "you're actually senior", "you're already there", "you're close",
                    "stretch role"),
            true);

    static final Entry PRESENTATION_GAP = new Entry(70, Recommendation.CONDITIONAL_APPLY,
            AffordanceState.ENABLED_WITH_WARNING, CoachingMode.SIGNAL_BUILDING,
            List.of("you're actually senior"),
            false);

    static final Entry NONE = new Entry(null, Recommendation.APPLY, AffordanceState.ENABLED,
            CoachingMode.OPTIMIZATION, List.of(), false);

    /** Coaching row for a score band that lands below the category ceiling. */
    record BandRow(CoachingMode mode, String headline) {
    }

    static final BandRow BAND_PASS = new BandRow(CoachingMode.REDIRECTION,
            "Your fit score falls below the bar for this role, so applying now is not recommended.");

    static final BandRow BAND_LONG_SHOT = new BandRow(CoachingMode.SIGNAL_BUILDING,
            "Your fit score is low for this role, so treat an application as a long shot.");

    static final BandRow BAND_CONDITIONAL = new BandRow(CoachingMode.SIGNAL_BUILDING,
            "Your fit score sits in the middle band for this role, so strengthen the evidence before you apply.");

    static BandRow bandRowFor(Recommendation banded) {
        return switch (banded) {
            case PASS -> BAND_PASS;
            case LONG_SHOT -> BAND_LONG_SHOT;
            case CONDITIONAL_APPLY -> BAND_CONDITIONAL;
            case APPLY -> throw new IllegalArgumentException("APPLY is never below a ceiling");
        };
    }

    static Entry entryFor(GapCategory category, boolean severe) {
        return switch (category) {
            case CREDIBILITY_VIOLATION -> CREDIBILITY;
            case ELIGIBILITY_VIOLATION -> ELIGIBILITY;
            case FUNCTION_MISMATCH -> severe ? FUNCTION_MISMATCH_COMPLETE : FUNCTION_MISMATCH;
            case EXPERIENCE_GAP -> severe ? EXPERIENCE_GAP_SEVERE : EXPERIENCE_GAP;
            case PRESENTATION_GAP -> PRESENTATION_GAP;
            case NONE -> NONE;
        };
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
