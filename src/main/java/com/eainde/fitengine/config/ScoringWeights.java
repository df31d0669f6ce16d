package com.eainde.fitengine.config;

/**
 * Weights of the deterministic fit score. They must add up to 100.
 */
public record ScoringWeights(int coverage, int level, int evidence) {

    public ScoringWeights {
        if (coverage + level + evidence != 100) {
            throw new IllegalArgumentException("Scoring weights must add up to 100 but were "
                    + coverage + " + " + level + " + " + evidence);
        }
    }
}
