package com.eainde.fitengine.coaching;

import com.eainde.fitengine.TestFixtures;
import com.eainde.fitengine.model.CandidateSignal;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.KeywordStuffingReport;
import com.eainde.fitengine.model.MismatchSeverity;
import com.eainde.fitengine.model.ResumeDocument;
import com.eainde.fitengine.model.SessionFlags;
import com.eainde.fitengine.model.SignalExtraction;
import com.eainde.fitengine.model.SignalType;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.model.StrengthTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StrengthRankerTest {

    private static final String JAVA_BULLET =
            "Built a payment reconciliation service in Java, reducing settlement errors by 35%";
    private static final String TEAM_BULLET = "Managed a team of 6 engineers";

    private final StrengthRanker ranker = new StrengthRanker();

    private static SignalExtraction leadership(String span) {
        return new SignalExtraction(
                List.of(CandidateSignal.evidenced(SignalType.LEADERSHIP, span, "Engineer", List.of("quantified leadership"))),
                SessionFlags.none(), KeywordStuffingReport.clean(), List.of());
    }

    @Test
    @DisplayName("Evidenced required capability ranks first and drops generic leadership")
    void requiredFirst() {
        // Arrange
        ResumeDocument resume = TestFixtures.resume("Engineer", 4, JAVA_BULLET, TEAM_BULLET);

        // Act
        List<Strength> strengths = ranker.rank(resume, List.of("java"),
                FunctionMatch.aligned(JobFunction.ENGINEERING, 1), leadership(TEAM_BULLET));

        // Assert
        assertThat(strengths).singleElement().satisfies(s -> {
            assertThat(s.tier()).isEqualTo(StrengthTier.JD_REQUIRED);
            assertThat(s.capability()).isEqualTo("java");
            assertThat(s.evidence()).isEqualTo(JAVA_BULLET);
        });
    }

    @Test
    @DisplayName("Generic leadership is used only when no required capability is evidenced")
    void genericFallback() {
        ResumeDocument resume = TestFixtures.resume("Engineer", 4, TEAM_BULLET);

        List<Strength> strengths = ranker.rank(resume, List.of("kafka"),
                FunctionMatch.aligned(JobFunction.ENGINEERING, 1), leadership(TEAM_BULLET));

        assertThat(strengths).extracting(Strength::tier, Strength::capability)
                .containsExactly(tuple(StrengthTier.GENERIC, "team leadership"));
    }

    @Test
    @DisplayName("Transferable capability with a metric is ranked as adjacent")
    void adjacent() {
        String bullet = "Ran stakeholder management across 12 teams, cutting review time by 30%";
        ResumeDocument resume = TestFixtures.resume("Operations Manager", 4, bullet);
        FunctionMatch opsToPm = new FunctionMatch(JobFunction.OPERATIONS, JobFunction.PRODUCT_MANAGEMENT,
                MismatchSeverity.SIGNIFICANT, List.of("stakeholder management"), 0);

        List<Strength> strengths = ranker.rank(resume, List.of("roadmap"), opsToPm,
                new SignalExtraction(List.of(), SessionFlags.none(), KeywordStuffingReport.clean(), List.of()));

        assertThat(strengths).singleElement()
                .satisfies(s -> assertThat(s.tier()).isEqualTo(StrengthTier.JD_ADJACENT));
    }

    @Test
    @DisplayName("A bare mention without evidence is not a strength")
    void mentionWithoutEvidence() {
        ResumeDocument resume = TestFixtures.resume("Engineer", 2, "Familiar with Kafka and Java");

        List<Strength> strengths = ranker.rank(resume, List.of("kafka", "java"),
                FunctionMatch.aligned(JobFunction.ENGINEERING, 1),
                new SignalExtraction(List.of(), SessionFlags.none(), KeywordStuffingReport.clean(), List.of()));

        assertThat(strengths).isEmpty();
    }
}
