package com.eainde.fitengine.model;

/**
 * What the client may offer next to the recommendation (apply button, tailoring, ...).
 */
public enum AffordanceState {
    ENABLED(0),
    ENABLED_WITH_WARNING(1),
    DEMOTED(2),
    DISABLED(3);

    private final int restriction;

    AffordanceState(int restriction) {
        this.restriction = restriction;
    }

    public static AffordanceState mostRestrictive(AffordanceState a, AffordanceState b) {
        return a.restriction >= b.restriction ? a : b;
    }
}
