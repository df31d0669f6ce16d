package com.eainde.fitengine.gap;

import com.eainde.fitengine.exception.AuthorityConflictException;
import com.eainde.fitengine.model.CandidateSignal;
import com.eainde.fitengine.model.CredibilityFinding;
import com.eainde.fitengine.model.DomainMatch;
import com.eainde.fitengine.model.EligibilityResult;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.GapCategory;
import com.eainde.fitengine.model.GapClassification;
import com.eainde.fitengine.model.GapFinding;
import com.eainde.fitengine.model.GapSeverity;
import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.KeywordStuffingReport;
import com.eainde.fitengine.model.LevelAssessment;
import com.eainde.fitengine.model.MismatchSeverity;
import com.eainde.fitengine.model.SeniorityLevel;
import com.eainde.fitengine.model.SessionFlags;
import com.eainde.fitengine.model.SignalExtraction;
import com.eainde.fitengine.model.SignalType;
import com.eainde.fitengine.model.TitleFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GapClassifierTest {

    private final GapClassifier classifier = new GapClassifier();

    // =========================================================================
    //  Builders
    // =========================================================================

    private static final DomainMatch SUPPORTED = new DomainMatch(List.of(), null, true, "Target domain not identified");

    private static SignalExtraction clean() {
        return new SignalExtraction(List.of(), SessionFlags.none(), KeywordStuffingReport.clean(), List.of());
    }

    private static SignalExtraction inflated() {
        TitleFinding finding = new TitleFinding("Head of Engineering", SeniorityLevel.DIRECTOR, true, List.of());
        return new SignalExtraction(
                List.of(CandidateSignal.unsupported(SignalType.TITLE, "Head of Engineering", "Head of Engineering")),
                new SessionFlags(true, false), KeywordStuffingReport.clean(), List.of(finding));
    }

    private static SignalExtraction withScope() {
        return new SignalExtraction(
                List.of(CandidateSignal.evidenced(SignalType.SCOPE, "Ran 40 warehouses", null, List.of("quantified scale"))),
                SessionFlags.none(), KeywordStuffingReport.clean(), List.of());
    }

    private static GapInputs inputs(SignalExtraction extraction, LevelAssessment level, FunctionMatch function) {
        return new GapInputs(extraction, level, function, SUPPORTED, EligibilityResult.satisfied(), List.of(), true);
    }

    private static FunctionMatch aligned() {
        return FunctionMatch.aligned(JobFunction.ENGINEERING, 1);
    }

    private static FunctionMatch mismatch(MismatchSeverity severity) {
        return new FunctionMatch(JobFunction.OPERATIONS, JobFunction.PRODUCT_MANAGEMENT, severity, List.of(), 0);
    }

    @Nested
    @DisplayName("Decision authority")
    class Authority {

        @Test
        @DisplayName("Credibility outranks function mismatch and experience gap, which stay inert")
        void credibilityWins() {
            // Arrange
            GapInputs in = inputs(inflated(),
                    LevelAssessment.of(SeniorityLevel.ENTRY, SeniorityLevel.DIRECTOR),
                    mismatch(MismatchSeverity.COMPLETE));

            // Act
            GapClassification result = classifier.classify(in);

            // Assert
            assertThat(result.category()).isEqualTo(GapCategory.CREDIBILITY_VIOLATION);
            assertThat(result.active().reason()).contains("not supported by evidence");
            assertThat(result.active().titleInflation()).isTrue();
            assertThat(result.inert()).extracting(GapFinding::category)
                    .contains(GapCategory.FUNCTION_MISMATCH, GapCategory.EXPERIENCE_GAP)
                    .doesNotContain(GapCategory.CREDIBILITY_VIOLATION);
        }

        @Test
        @DisplayName("Eligibility outranks function mismatch")
        void eligibilityOverFunction() {
            GapInputs in = new GapInputs(clean(), LevelAssessment.of(SeniorityLevel.MID, SeniorityLevel.MID),
                    mismatch(MismatchSeverity.SIGNIFICANT), SUPPORTED,
                    new EligibilityResult(List.of("PMP Certification"), List.of()), List.of(), true);

            GapClassification result = classifier.classify(in);

            assertThat(result.category()).isEqualTo(GapCategory.ELIGIBILITY_VIOLATION);
            assertThat(result.redirectSuggestion()).contains("Obtain PMP Certification");
        }

        @Test
        @DisplayName("An inert finding at or above the active one is refused")
        void conflictRefused() {
            GapFinding experience = new GapFinding(GapCategory.EXPERIENCE_GAP, GapSeverity.HIGH, "gap", null);
            GapFinding credibility = new GapFinding(GapCategory.CREDIBILITY_VIOLATION, GapSeverity.SEVERE, "cred", null);

            assertThatThrownBy(() -> new GapClassification(experience, List.of(credibility), true))
                    .isInstanceOf(AuthorityConflictException.class);
        }
    }

    @Nested
    @DisplayName("Individual conditions")
    class Conditions {

        @Test
        @DisplayName("Nothing fires for an aligned, evidenced candidate")
        void noGap() {
            GapClassification result = classifier.classify(inputs(clean(),
                    LevelAssessment.of(SeniorityLevel.MID, SeniorityLevel.MID), aligned()));

            assertThat(result.category()).isEqualTo(GapCategory.NONE);
            assertThat(result.inert()).isEmpty();
        }

        @Test
        @DisplayName("Implausible metric alone is a credibility violation")
        void implausibleMetric() {
            GapInputs in = new GapInputs(clean(), LevelAssessment.of(SeniorityLevel.MID, SeniorityLevel.MID), aligned(),
                    SUPPORTED, EligibilityResult.satisfied(),
                    List.of(new CredibilityFinding(CredibilityFinding.Kind.IMPLAUSIBLE_METRIC, "Reduction of 250%")), true);

            GapClassification result = classifier.classify(in);

            assertThat(result.category()).isEqualTo(GapCategory.CREDIBILITY_VIOLATION);
            assertThat(result.severity()).isEqualTo(GapSeverity.SEVERE);
            assertThat(result.active().titleInflation()).isFalse();
        }

        @Test
        @DisplayName("Complete function mismatch is severe, significant is high, adjacent does not fire")
        void functionSeverity() {
            LevelAssessment level = LevelAssessment.of(SeniorityLevel.MID, SeniorityLevel.MID);

            assertThat(classifier.classify(inputs(clean(), level, mismatch(MismatchSeverity.COMPLETE))).severity())
                    .isEqualTo(GapSeverity.SEVERE);
            assertThat(classifier.classify(inputs(clean(), level, mismatch(MismatchSeverity.SIGNIFICANT))).severity())
                    .isEqualTo(GapSeverity.HIGH);
            assertThat(classifier.classify(inputs(clean(), level, mismatch(MismatchSeverity.ADJACENT))).category())
                    .isNotEqualTo(GapCategory.FUNCTION_MISMATCH);
        }

        @Test
        @DisplayName("Two levels below target is a high experience gap, three is severe")
        void experienceGapSeverity() {
            GapClassification two = classifier.classify(inputs(withScope(),
                    LevelAssessment.of(SeniorityLevel.ASSOCIATE, SeniorityLevel.SENIOR), aligned()));
            GapClassification three = classifier.classify(inputs(withScope(),
                    LevelAssessment.of(SeniorityLevel.ASSOCIATE, SeniorityLevel.STAFF), aligned()));

            assertThat(two.category()).isEqualTo(GapCategory.EXPERIENCE_GAP);
            assertThat(two.severity()).isEqualTo(GapSeverity.HIGH);
            assertThat(two.redirectSuggestion()).isEqualTo("Target Mid-level roles while building toward Senior");
            assertThat(three.severity()).isEqualTo(GapSeverity.SEVERE);
        }

        @Test
        @DisplayName("No roles in the target function is a moderate experience gap")
        void noRolesInFunction() {
            FunctionMatch adjacent = new FunctionMatch(JobFunction.ENGINEERING, JobFunction.PRODUCT_MANAGEMENT,
                    MismatchSeverity.ADJACENT, List.of("technical depth"), 0);

            GapClassification result = classifier.classify(inputs(clean(),
                    LevelAssessment.of(SeniorityLevel.MID, SeniorityLevel.MID), adjacent));

            assertThat(result.category()).isEqualTo(GapCategory.EXPERIENCE_GAP);
            assertThat(result.severity()).isEqualTo(GapSeverity.MODERATE);
        }

        @Test
        @DisplayName("One level below target, with scope evidenced, is a presentation gap")
        void oneLevelBelow() {
            GapClassification result = classifier.classify(inputs(withScope(),
                    LevelAssessment.of(SeniorityLevel.MID, SeniorityLevel.SENIOR), aligned()));

            assertThat(result.category()).isEqualTo(GapCategory.PRESENTATION_GAP);
            assertThat(result.active().reason()).contains("one level below target");
        }

        @Test
        @DisplayName("Missing scope evidence for a senior target is a presentation gap")
        void missingScope() {
            GapClassification result = classifier.classify(inputs(clean(),
                    LevelAssessment.of(SeniorityLevel.SENIOR, SeniorityLevel.SENIOR), aligned()));

            assertThat(result.category()).isEqualTo(GapCategory.PRESENTATION_GAP);
            assertThat(result.active().reason()).contains("No evidenced scope signal");
        }

        @Test
        @DisplayName("Translation support is carried through from the domain match")
        void translationCarried() {
            DomainMatch unsupported = new DomainMatch(List.of("healthcare"), "adtech", false, "No experience in adtech");
            GapInputs in = new GapInputs(clean(), LevelAssessment.of(SeniorityLevel.MID, SeniorityLevel.MID), aligned(),
                    unsupported, EligibilityResult.satisfied(), List.of(), true);

            assertThat(classifier.classify(in).translationSupported()).isFalse();
        }
    }
}
