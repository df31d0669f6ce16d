package com.eainde.fitengine.web;

import com.eainde.fitengine.exception.InputValidationException;
import com.eainde.fitengine.exception.NarrativeGenerationException;
import com.eainde.fitengine.exception.NarrativeIntegrityException;
import com.eainde.fitengine.exception.SessionAccessException;
import com.eainde.fitengine.model.AffordanceState;
import com.eainde.fitengine.model.CoachingMode;
import com.eainde.fitengine.model.CoachingNarrative;
import com.eainde.fitengine.model.FinalRecommendation;
import com.eainde.fitengine.model.GapCategory;
import com.eainde.fitengine.model.Recommendation;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.model.StrengthTier;
import com.eainde.fitengine.service.AnalysisOutcome;
import com.eainde.fitengine.service.FitAnalysisService;
import com.eainde.fitengine.session.AnalysisSessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class FitAnalysisControllerTest {

    private static final String REQUEST = """
            {"resume": {"experience": [{"title": "Software Engineer", "company": "Acme", "years": 2,
                         "bullets": ["Built a Java service, reducing latency by 40%"]}]},
             "job": {"company": "Globex", "roleTitle": "Senior Software Engineer", "body": "Build Java services."}}
            """;

    @Mock
    private FitAnalysisService analysisService;

    @Mock
    private AnalysisSessionManager sessionManager;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new FitAnalysisController(analysisService, sessionManager))
                .setControllerAdvice(new FitAnalysisExceptionAdvice())
                .build();
    }

    private static AnalysisOutcome outcome() {
        FinalRecommendation rec = new FinalRecommendation(Recommendation.LONG_SHOT, 47,
                AffordanceState.DEMOTED, CoachingMode.SIGNAL_BUILDING, GapCategory.EXPERIENCE_GAP, Instant.now());
        CoachingNarrative narrative = new CoachingNarrative(CoachingMode.SIGNAL_BUILDING,
                "Your Java work shows measured results.",
                List.of("Experience gap: your evidenced level is Associate, below target level Senior."),
                List.of("Java: cut latency by 40%."), List.of("No senior scope yet."),
                "Lead one service end to end.", List.of("Own one design."), List.of("Lead a migration."));
        return new AnalysisOutcome("session-1", rec, "Target Mid-level roles while building toward Senior",
                List.of(new Strength(StrengthTier.JD_REQUIRED, "java", "Built a Java service, reducing latency by 40%")),
                List.of("Experience gap: 2 levels below"), narrative);
    }

    @Nested
    @DisplayName("POST /api/v1/fit-analysis")
    class Analyze {

        @Test
        @DisplayName("Returns the locked recommendation and narrative")
        void success() throws Exception {
            // Arrange
            when(analysisService.analyze(any(), any())).thenReturn(outcome());

            // Act & Assert
            mockMvc.perform(post("/api/v1/fit-analysis").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.sessionId").value("session-1"))
                    .andExpect(jsonPath("$.fitScore").value(47))
                    .andExpect(jsonPath("$.recommendation").value("LONG_SHOT"))
                    .andExpect(jsonPath("$.recommendationLabel").value("Conditional Apply (Long Shot)"))
                    .andExpect(jsonPath("$.affordance").value("DEMOTED"))
                    .andExpect(jsonPath("$.gapCategory").value("EXPERIENCE_GAP"))
                    .andExpect(jsonPath("$.strengths[0].capability").value("java"))
                    .andExpect(jsonPath("$.narrative.threeMonthPlan[0]").value("Own one design."));
        }

        @Test
        @DisplayName("Missing job description is a 400 and never reaches the service")
        void missingJob() throws Exception {
            mockMvc.perform(post("/api/v1/fit-analysis").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"resume\": {\"text\": \"Built things\"}}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("invalid_input"));
            verifyNoInteractions(analysisService);
        }

        @Test
        @DisplayName("Unreadable input maps to 400 with the session id")
        void invalidInput() throws Exception {
            when(analysisService.analyze(any(), any()))
                    .thenThrow(new InputValidationException("Resume text is empty").withSessionId("session-2"));

            mockMvc.perform(post("/api/v1/fit-analysis").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("invalid_input"))
                    .andExpect(jsonPath("$.sessionId").value("session-2"));
        }

        @Test
        @DisplayName("Integrity failures surface as 500")
        void integrity() throws Exception {
            when(analysisService.analyze(any(), any()))
                    .thenThrow(new NarrativeIntegrityException("No evidenced strengths"));

            mockMvc.perform(post("/api/v1/fit-analysis").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.code").value("integrity_error"));
        }

        @Test
        @DisplayName("Exhausted narrative retries surface as 502")
        void generationFailed() throws Exception {
            when(analysisService.analyze(any(), any()))
                    .thenThrow(new NarrativeGenerationException("failed after 3 attempt(s)", null));

            mockMvc.perform(post("/api/v1/fit-analysis").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.code").value("generation_failed"));
        }
    }

    @Nested
    @DisplayName("DELETE /api/v1/fit-analysis/{sessionId}")
    class Cancel {

        @Test
        @DisplayName("Cancels the session and returns 204")
        void cancels() throws Exception {
            mockMvc.perform(delete("/api/v1/fit-analysis/session-1"))
                    .andExpect(status().isNoContent());
            verify(sessionManager).cancel("session-1");
        }

        @Test
        @DisplayName("Unknown session is a 404")
        void unknown() throws Exception {
            doThrow(new SessionAccessException("No active session nope")).when(sessionManager).cancel("nope");

            mockMvc.perform(delete("/api/v1/fit-analysis/nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("session_unavailable"));
        }
    }
}
