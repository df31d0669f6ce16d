package com.eainde.fitengine.coaching;

import com.eainde.fitengine.exception.MalformedNarrativeException;
import com.eainde.fitengine.model.NarrativeDraft;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Decodes raw provider output into a {@link NarrativeDraft}. Anything off-schema is a retryable
 * failure; the output is never repaired in place.
 */
@Component
public class NarrativeDecoder {

    private final ObjectMapper objectMapper;

    public NarrativeDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public NarrativeDraft decode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedNarrativeException("Provider returned an empty response");
        }
        NarrativeDraft draft;
        try {
            draft = objectMapper.readValue(raw, NarrativeDraft.class);
        } catch (JsonProcessingException e) {
            throw new MalformedNarrativeException("Provider response does not match the narrative schema: "
                    + e.getOriginalMessage(), e);
        }
        if (draft == null) {
            throw new MalformedNarrativeException("Provider response decoded to null");
        }
        if (isBlank(draft.summary())) {
            throw new MalformedNarrativeException("Narrative is missing a summary");
        }
        if (isBlank(draft.yourMove())) {
            throw new MalformedNarrativeException("Narrative is missing 'yourMove'");
        }
        if (draft.strengths().isEmpty()) {
            throw new MalformedNarrativeException("Narrative lists no strengths");
        }
        return draft;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
