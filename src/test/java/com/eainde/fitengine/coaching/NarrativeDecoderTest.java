package com.eainde.fitengine.coaching;

import com.eainde.fitengine.exception.MalformedNarrativeException;
import com.eainde.fitengine.model.NarrativeDraft;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NarrativeDecoderTest {

    private final NarrativeDecoder decoder = new NarrativeDecoder(new ObjectMapper());

    @Test
    @DisplayName("Decodes a response that follows the schema")
    void decodesValid() {
        String json = """
                {
                  "summary": "Your Java work shows measured results.",
                  "strengths": ["Java: cut settlement errors by 35%."],
                  "gaps": ["No senior-scope evidence yet."],
                  "yourMove": "Lead one service end to end.",
                  "threeMonthPlan": ["Own one design."],
                  "sixToTwelveMonthPlan": []
                }
                """;

        NarrativeDraft draft = decoder.decode(json);

        assertThat(draft.summary()).startsWith("Your Java work");
        assertThat(draft.strengths()).hasSize(1);
        assertThat(draft.threeMonthPlan()).containsExactly("Own one design.");
        assertThat(draft.sixToTwelveMonthPlan()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "not json at all",
            "{\"summary\": \"ok\", \"strengths\": [\"x\"], \"gaps\": [], \"yourMove\": \"go\", \"verdict\": \"apply\"}",
            "{\"strengths\": [\"x\"], \"gaps\": [], \"yourMove\": \"go\"}",
            "{\"summary\": \"ok\", \"strengths\": [\"x\"], \"gaps\": [], \"yourMove\": \"  \"}",
            "{\"summary\": \"ok\", \"strengths\": [], \"gaps\": [], \"yourMove\": \"go\"}",
            "null"
    })
    void rejectsOffSchema(String raw) {
        assertThatThrownBy(() -> decoder.decode(raw)).isInstanceOf(MalformedNarrativeException.class);
    }
}
