package com.eainde.fitengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One extracted claim about the candidate, with the evidence that backs it (if any).
 *
 * <p>{@code valid} is only ever true when {@code evidenceFound} is true. Title signals are
 * recorded for traceability but are never valid on their own.</p>
 *
 * @param type          the kind of claim
 * @param sourceSpan    the resume text the claim was read from
 * @param roleTitle     title of the role the span belongs to, or null for free text
 * @param evidenceFound whether quantified or structural evidence was found alongside the claim
 * @param valid         whether the signal may contribute to level classification
 * @param evidence      the matched evidence fragments
 */
public record CandidateSignal(
        @JsonProperty("type")          SignalType type,
        @JsonProperty("sourceSpan")    String sourceSpan,
        @JsonProperty("roleTitle")     String roleTitle,
        @JsonProperty("evidenceFound") boolean evidenceFound,
        @JsonProperty("valid")         boolean valid,
        @JsonProperty("evidence")      List<String> evidence
) {

    public CandidateSignal {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceSpan, "sourceSpan");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        if (valid && !evidenceFound) {
            throw new IllegalArgumentException("A signal without evidence cannot be valid: " + sourceSpan);
        }
    }

    public static CandidateSignal evidenced(SignalType type, String span, String roleTitle, List<String> evidence) {
        return new CandidateSignal(type, span, roleTitle, true, type != SignalType.TITLE, evidence);
    }

    public static CandidateSignal unsupported(SignalType type, String span, String roleTitle) {
        return new CandidateSignal(type, span, roleTitle, false, false, List.of());
    }
}
