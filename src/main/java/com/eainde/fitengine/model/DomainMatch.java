package com.eainde.fitengine.model;

import java.util.List;

/**
 * Domain overlap between the candidate's history and the role.
 *
 * @param candidateDomains     domains with at least two keyword hits in the resume
 * @param targetDomain         best-scoring domain of the job description, null when none
 * @param translationSupported whether "your experience translates to ..." claims are allowed
 * @param reason               why the claim is or is not allowed
 */
public record DomainMatch(
        List<String> candidateDomains,
        String targetDomain,
        boolean translationSupported,
        String reason
) {

    public DomainMatch {
        candidateDomains = candidateDomains == null ? List.of() : List.copyOf(candidateDomains);
    }
}
