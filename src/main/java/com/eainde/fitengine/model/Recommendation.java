package com.eainde.fitengine.model;

/**
 * Closed set of binding recommendations, weakest first.
 */
public enum Recommendation {
    PASS(0, "Pass", AffordanceState.DISABLED),
    LONG_SHOT(1, "Conditional Apply (Long Shot)", AffordanceState.DEMOTED),
    CONDITIONAL_APPLY(2, "Conditional Apply", AffordanceState.ENABLED_WITH_WARNING),
    APPLY(3, "Apply", AffordanceState.ENABLED);

    private final int strength;
    private final String label;
    private final AffordanceState affordance;

    Recommendation(int strength, String label, AffordanceState affordance) {
        this.strength = strength;
        this.label = label;
        this.affordance = affordance;
    }

    public String label() {
        return label;
    }

    public AffordanceState affordance() {
        return affordance;
    }

    public boolean isStrongerThan(Recommendation other) {
        return strength > other.strength;
    }

    public static Recommendation weakerOf(Recommendation a, Recommendation b) {
        return a.strength <= b.strength ? a : b;
    }
}
