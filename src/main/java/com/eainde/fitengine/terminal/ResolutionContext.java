package com.eainde.fitengine.terminal;

import com.eainde.fitengine.model.DomainMatch;
import com.eainde.fitengine.model.EligibilityResult;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.LevelAssessment;

/**
 * Facts the resolver templates into phrases and canonical statements. Never consulted for the
 * choice of category, which is already made.
 */
public record ResolutionContext(
        String roleTitle,
        FunctionMatch function,
        LevelAssessment level,
        DomainMatch domain,
        EligibilityResult eligibility
) {
}
