package com.eainde.fitengine.config;

import com.eainde.fitengine.model.Recommendation;

/**
 * Maps a capped fit score onto the recommendation band it falls in.
 */
public record ScoreBands(int longShotFloor, int conditionalFloor, int applyFloor) {

    public ScoreBands {
        if (!(0 <= longShotFloor && longShotFloor < conditionalFloor && conditionalFloor < applyFloor && applyFloor <= 100)) {
            throw new IllegalArgumentException("Score bands must be strictly increasing within 0..100: "
                    + longShotFloor + ", " + conditionalFloor + ", " + applyFloor);
        }
    }

    public Recommendation bandFor(int score) {
        if (score >= applyFloor) {
            return Recommendation.APPLY;
        }
        if (score >= conditionalFloor) {
            return Recommendation.CONDITIONAL_APPLY;
        }
        if (score >= longShotFloor) {
            return Recommendation.LONG_SHOT;
        }
        return Recommendation.PASS;
    }
}
