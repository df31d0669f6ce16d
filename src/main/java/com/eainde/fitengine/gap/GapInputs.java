package com.eainde.fitengine.gap;

import com.eainde.fitengine.model.CredibilityFinding;
import com.eainde.fitengine.model.DomainMatch;
import com.eainde.fitengine.model.EligibilityResult;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.LevelAssessment;
import com.eainde.fitengine.model.SignalExtraction;

import java.util.List;
import java.util.Objects;

/**
 * Everything the gap classifier may look at. Assembled by value from upstream hand-offs.
 *
 * @param extraction          signals and session flags
 * @param level               level assessment
 * @param function            function comparison
 * @param domain              domain comparison
 * @param eligibility         hard requirement check
 * @param credibility         implausible metric and timeline findings
 * @param structuredHistory   whether the resume came with structured roles, which the
 *                            zero-roles-in-function check needs
 */
public record GapInputs(
        SignalExtraction extraction,
        LevelAssessment level,
        FunctionMatch function,
        DomainMatch domain,
        EligibilityResult eligibility,
        List<CredibilityFinding> credibility,
        boolean structuredHistory
) {

    public GapInputs {
        Objects.requireNonNull(extraction, "extraction");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(eligibility, "eligibility");
        credibility = credibility == null ? List.of() : List.copyOf(credibility);
    }
}
