package com.eainde.fitengine.model;

/**
 * Deterministic fit score before the terminal cap is applied.
 *
 * @param raw     weighted score out of 100
 * @param penalty total of the tunable penalties that apply to this session
 */
public record FitScore(int raw, int penalty) {

    public FitScore {
        if (raw < 0 || raw > 100) {
            throw new IllegalArgumentException("Raw score out of range: " + raw);
        }
        if (penalty < 0) {
            throw new IllegalArgumentException("Penalty must not be negative: " + penalty);
        }
    }

    public int net() {
        return Math.max(0, raw - penalty);
    }
}
