package com.eainde.fitengine.model;

import java.util.List;

/**
 * @param candidateFunction     primary function read from the resume
 * @param targetFunction        primary function read from the job description
 * @param severity              distance between the two
 * @param transferable          capabilities that carry across, when the pair is known
 * @param rolesInTargetFunction resume roles whose title falls in the target function
 */
public record FunctionMatch(
        JobFunction candidateFunction,
        JobFunction targetFunction,
        MismatchSeverity severity,
        List<String> transferable,
        int rolesInTargetFunction
) {

    public FunctionMatch {
        transferable = transferable == null ? List.of() : List.copyOf(transferable);
    }

    public static FunctionMatch aligned(JobFunction function, int rolesInTargetFunction) {
        return new FunctionMatch(function, function, MismatchSeverity.NONE, List.of(), rolesInTargetFunction);
    }
}
