package com.eainde.fitengine.model;

/**
 * Evidence ordering for narrative strengths. Earlier tiers are cited first.
 */
public enum StrengthTier {
    JD_REQUIRED,
    JD_ADJACENT,
    GENERIC
}
