package com.eainde.fitengine.model;

import java.time.Instant;

/**
 * The binding decision of a session. Written once by the recommendation controller.
 */
public record FinalRecommendation(
        Recommendation recommendation,
        int fitScore,
        AffordanceState affordance,
        CoachingMode coachingMode,
        GapCategory category,
        Instant lockedAt
) {
}
