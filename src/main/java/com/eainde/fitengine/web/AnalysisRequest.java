package com.eainde.fitengine.web;

import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.ResumeDocument;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound analysis request. The resume arrives already parsed by the upstream collaborator.
 */
public record AnalysisRequest(
        @JsonProperty("resume") @NotNull ResumeDocument resume,
        @JsonProperty("job")    @NotNull JobDescription job
) {
}
