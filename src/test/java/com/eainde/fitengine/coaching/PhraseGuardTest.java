package com.eainde.fitengine.coaching;

import com.eainde.fitengine.TestFixtures;
import com.eainde.fitengine.model.CoachingNarrative;
import com.eainde.fitengine.model.NarrativeDraft;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.model.StrengthTier;
import com.eainde.fitengine.model.TerminalState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class PhraseGuardTest {

    private final PhraseGuard guard = new PhraseGuard();

    private static final List<Strength> REQUIRED = List.of(
            new Strength(StrengthTier.JD_REQUIRED, "java", "Built a Java service, reducing errors by 35%"));
    private static final List<Strength> GENERIC = List.of(
            new Strength(StrengthTier.GENERIC, "team leadership", "Managed a team of 12"));

    private static NarrativeDraft draft(String summary, String yourMove) {
        return new NarrativeDraft(summary, List.of("Java: cut settlement errors by 35%."),
                List.of("No evidence yet of senior scope."), yourMove, List.of(), List.of());
    }

    @Test
    @DisplayName("A clean draft has no violations")
    void cleanDraft() {
        NarrativeDraft clean = draft("Your Java work shows measured results.", "Lead one service end to end.");

        assertThat(guard.check(clean, TestFixtures.presentationGapState(), REQUIRED)).isEmpty();
    }

    @Nested
    @DisplayName("Forbidden language")
    class Forbidden {

        @Test
        @DisplayName("Forbidden phrase is caught through a curly apostrophe and mixed case")
        void curlyApostrophe() {
            NarrativeDraft bad = draft("Honestly, You’re Close to this level.", "Lead one service end to end.");

            List<String> violations = guard.check(bad, TestFixtures.experienceGapState(), REQUIRED);

            assertThat(violations).anySatisfy(v -> assertThat(v).contains("you're close"));
        }

        @Test
        @DisplayName("Forbidden claim pattern is caught")
        void forbiddenPattern() {
            TerminalState state = new TerminalState(TestFixtures.noGapState().category(), false, null,
                    TestFixtures.noGapState().ceiling(), TestFixtures.noGapState().affordance(),
                    TestFixtures.noGapState().coachingMode(), "Strong alignment.", List.of(), List.of(),
                    List.of(Pattern.compile("\\bdirectly applicable to\\b", Pattern.CASE_INSENSITIVE)),
                    Map.of(), false, null);
            NarrativeDraft bad = draft("This work is directly applicable to payments.", "Lead one service.");

            assertThat(guard.check(bad, state, REQUIRED)).anySatisfy(v -> assertThat(v).startsWith("Forbidden claim"));
        }

        @Test
        @DisplayName("Any sentence on a sensitive topic is refused")
        void sensitiveTopic() {
            NarrativeDraft bad = draft("Your title is inflated compared to the bullets.", "Lead one service.");

            assertThat(guard.check(bad, TestFixtures.noGapState(), REQUIRED))
                    .anySatisfy(v -> assertThat(v).contains("TITLE_INFLATION"));
        }
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("yourMove longer than three sentences is refused")
        void longYourMove() {
            NarrativeDraft bad = draft("Solid Java work.",
                    "Lead a service. Measure it. Write it up. Share it with your manager.");

            assertThat(guard.check(bad, TestFixtures.noGapState(), REQUIRED))
                    .containsExactly("'yourMove' has more than 3 sentences");
        }

        @Test
        @DisplayName("Missing closing plans are refused when the state requires them")
        void missingPlans() {
            NarrativeDraft noPlans = draft("Solid Java work.", "Lead one service end to end.");

            assertThat(guard.check(noPlans, TestFixtures.experienceGapState(), REQUIRED))
                    .containsExactlyInAnyOrder("Missing 3-month plan", "Missing 6-12 month plan");
        }
    }

    @Nested
    @DisplayName("Generic leadership language")
    class GenericLeadership {

        @Test
        @DisplayName("Refused when a role-required strength is evidenced")
        void refusedWithRequiredStrength() {
            NarrativeDraft bad = draft("You are a proven leader with Java depth.", "Lead one service.");

            assertThat(guard.check(bad, TestFixtures.noGapState(), REQUIRED))
                    .anySatisfy(v -> assertThat(v).contains("proven leader"));
        }

        @Test
        @DisplayName("Allowed when only generic strengths exist")
        void allowedWithGenericOnly() {
            NarrativeDraft draft = draft("You are a proven leader of warehouse teams.", "Target operations roles.");

            assertThat(guard.check(draft, TestFixtures.noGapState(), GENERIC)).isEmpty();
        }
    }

    @Test
    @DisplayName("missingRequired reports phrases absent from the whole narrative")
    void missingRequired() {
        CoachingNarrative narrative = new CoachingNarrative(TestFixtures.experienceGapState().coachingMode(),
                "Solid Java work.", List.of("Experience gap: your evidenced level is Associate."),
                List.of("Java"), List.of(), "Lead a service.", List.of("a"), List.of("b"));

        assertThat(guard.missingRequired(narrative, TestFixtures.experienceGapState()))
                .containsExactly("below target level");
    }
}
