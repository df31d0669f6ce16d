package com.eainde.fitengine.config;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A hard credential a posting can demand, and the resume terms that prove it.
 *
 * @param name          display name, also matched against structured required credentials
 * @param requirement   pattern that marks the credential as mandatory in posting text
 * @param evidenceTerms any of these in the resume counts as holding the credential
 */
public record CredentialRule(String name, Pattern requirement, List<String> evidenceTerms) {

    public CredentialRule {
        evidenceTerms = List.copyOf(evidenceTerms);
    }

    public static List<CredentialRule> defaults() {
        return List.of(
                rule("PMP Certification", "\\b(pmp|project management professional)\\s+(required|certification required)",
                        "pmp", "project management professional"),
                rule("Security Clearance", "\\bactive\\s+(security\\s+)?clearance\\s+required",
                        "clearance", "ts/sci", "top secret"),
                rule("CPA Certification", "\\b(cpa|certified public accountant)\\s+required",
                        "cpa", "certified public accountant"),
                rule("Security Certification", "\\b(cissp|cism)\\s+required", "cissp", "cism"),
                rule("Bar Admission", "\\bbar\\s+admission\\s+required", "bar admission", "admitted to the bar", "juris doctor"),
                rule("RN License", "\\b(rn|registered nurse)\\s+license\\s+required", "registered nurse", "rn license"),
                rule("PE License", "\\bpe\\s+license\\s+required", "professional engineer", "pe license"));
    }

    private static CredentialRule rule(String name, String regex, String... evidence) {
        return new CredentialRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), List.of(evidence));
    }
}
