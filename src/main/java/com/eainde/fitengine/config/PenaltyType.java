package com.eainde.fitengine.config;

/**
 * Named, tunable score deductions. Caps and affordances are not tunable; these are.
 */
public enum PenaltyType {
    EXPERIENCE_GAP_PER_LEVEL,
    PRESENTATION_GAP,
    FUNCTION_MISMATCH,
    KEYWORD_STUFFING,
    CREDIBILITY,
    ELIGIBILITY
}
