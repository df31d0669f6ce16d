package com.eainde.fitengine.signal;

import com.eainde.fitengine.TestFixtures;
import com.eainde.fitengine.model.CredibilityFinding;
import com.eainde.fitengine.model.ResumeDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricPlausibilityCheckerTest {

    private final MetricPlausibilityChecker checker = new MetricPlausibilityChecker();

    @Test
    @DisplayName("A reduction above 100% is implausible")
    void impossibleReduction() {
        List<CredibilityFinding> findings = checker.check(
                TestFixtures.resume("Engineer", 3, "Reduced page latency by 250% across the storefront"));

        assertThat(findings).singleElement()
                .satisfies(f -> {
                    assertThat(f.kind()).isEqualTo(CredibilityFinding.Kind.IMPLAUSIBLE_METRIC);
                    assertThat(f.detail()).contains("250%");
                });
    }

    @Test
    @DisplayName("Ordinary reductions pass")
    void ordinaryReduction() {
        assertThat(checker.check(TestFixtures.resume("Engineer", 3, "Reduced cloud costs by 40%"))).isEmpty();
    }

    @Test
    @DisplayName("A growth figure next to a reduction verb is not read as the reduction")
    void growthBesideReduction() {
        List<CredibilityFinding> findings = checker.check(TestFixtures.resume("Growth Manager", 3,
                "Cut onboarding time in half and grew weekly signups 300% in two quarters"));

        assertThat(findings).isEmpty();
    }

    @Test
    @DisplayName("A reduction stated as a noun is checked too")
    void reductionNoun() {
        assertThat(checker.check(TestFixtures.resume("Engineer", 3, "Delivered a reduction of 180% in failed builds")))
                .singleElement()
                .satisfies(f -> assertThat(f.detail()).contains("180%"));
    }

    @Test
    @DisplayName("Text that repeats the structured bullets does not double-report a claim")
    void textNotScannedTwice() {
        // Arrange
        String bullet = "Reduced page latency by 250% across the storefront";
        ResumeDocument resume = new ResumeDocument("Engineer\n- " + bullet, null,
                TestFixtures.resume("Engineer", 3, bullet).experience(), null, null);

        // Act
        List<CredibilityFinding> findings = checker.check(resume);

        // Assert
        assertThat(findings).hasSize(1);
    }

    @Test
    @DisplayName("Plain text is scanned when there are no structured bullets")
    void textOnly() {
        ResumeDocument resume = new ResumeDocument("Engineer\n- Reduced page latency by 250%", null, null, null, null);

        assertThat(checker.check(resume)).singleElement()
                .satisfies(f -> assertThat(f.kind()).isEqualTo(CredibilityFinding.Kind.IMPLAUSIBLE_METRIC));
    }

    @Test
    @DisplayName("Claimed years far beyond the listed roles are a timeline inconsistency")
    void timeline() {
        ResumeDocument resume = new ResumeDocument(null, "Engineer with 15 years of experience",
                TestFixtures.resume("Engineer", 4, "Built a Java service").experience(), null, null);

        assertThat(checker.check(resume)).singleElement()
                .satisfies(f -> assertThat(f.kind()).isEqualTo(CredibilityFinding.Kind.TIMELINE_INCONSISTENCY));
    }

    @Test
    @DisplayName("Claimed years within tolerance pass")
    void timelineWithinTolerance() {
        ResumeDocument resume = new ResumeDocument(null, "Engineer with 6 years of experience",
                TestFixtures.resume("Engineer", 4, "Built a Java service").experience(), null, null);

        assertThat(checker.check(resume)).isEmpty();
    }
}
