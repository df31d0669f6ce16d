package com.eainde.fitengine.model;

import java.util.List;

/**
 * Outcome of checking one senior title against the bullets written under it.
 *
 * @param title        the title as written
 * @param impliedLevel level the title claims
 * @param inflated     true when the bullets do not carry the evidence the title requires
 * @param evidence     which evidence classes were found (scope, leadership, strategic)
 */
public record TitleFinding(String title, SeniorityLevel impliedLevel, boolean inflated, List<String> evidence) {

    public TitleFinding {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
