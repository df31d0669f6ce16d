package com.eainde.fitengine.model;

/**
 * How far apart the candidate's function is from the role's. Only SIGNIFICANT and COMPLETE
 * count as a function mismatch gap; ADJACENT functions are treated as a bridge.
 */
public enum MismatchSeverity {
    NONE,
    ADJACENT,
    SIGNIFICANT,
    COMPLETE;

    public boolean isMismatch() {
        return this == SIGNIFICANT || this == COMPLETE;
    }
}
