package com.eainde.fitengine.model;

/**
 * A candidate strength with the resume evidence that backs it.
 */
public record Strength(StrengthTier tier, String capability, String evidence) {
}
