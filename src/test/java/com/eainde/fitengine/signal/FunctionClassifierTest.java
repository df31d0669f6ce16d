package com.eainde.fitengine.signal;

import com.eainde.fitengine.TestFixtures;
import com.eainde.fitengine.config.FunctionTaxonomy;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.MismatchSeverity;
import com.eainde.fitengine.model.ResumeDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FunctionClassifierTest {

    private final FunctionClassifier classifier = new FunctionClassifier();
    private final FunctionTaxonomy taxonomy = FunctionTaxonomy.defaults();

    @Test
    @DisplayName("Operations background against a product role is a complete mismatch")
    void operationsVersusProduct() {
        // Arrange
        ResumeDocument resume = TestFixtures.resume("Operations Manager", 4,
                "Managed a team of 12 warehouse associates, improving on-time delivery to 98%",
                "Led vendor management and procurement for 40 sites");

        // Act
        FunctionMatch match = classifier.match(resume,
                TestFixtures.job("Product Manager", "Own the product roadmap and run user research."), taxonomy);

        // Assert
        assertThat(match.candidateFunction()).isEqualTo(JobFunction.OPERATIONS);
        assertThat(match.targetFunction()).isEqualTo(JobFunction.PRODUCT_MANAGEMENT);
        assertThat(match.severity()).isEqualTo(MismatchSeverity.COMPLETE);
        assertThat(match.transferable()).isEmpty();
        assertThat(match.rolesInTargetFunction()).isZero();
    }

    @Test
    @DisplayName("Engineering background against a product role is adjacent with transferable skills")
    void engineeringVersusProduct() {
        ResumeDocument resume = TestFixtures.resume("Software Engineer", 3, "Built APIs in Java");

        FunctionMatch match = classifier.match(resume,
                TestFixtures.job("Product Manager", "Own the roadmap and product strategy."), taxonomy);

        assertThat(match.severity()).isEqualTo(MismatchSeverity.ADJACENT);
        assertThat(match.severity().isMismatch()).isFalse();
        assertThat(match.transferable()).contains("technical depth");
    }

    @Test
    @DisplayName("Same function counts the roles held in it")
    void sameFunction() {
        ResumeDocument resume = TestFixtures.resume("Software Engineer", 3, "Wrote code for the billing API");

        FunctionMatch match = classifier.match(resume,
                TestFixtures.job("Backend Engineer", "Design microservices."), taxonomy);

        assertThat(match.severity()).isEqualTo(MismatchSeverity.NONE);
        assertThat(match.targetFunction()).isEqualTo(JobFunction.ENGINEERING);
        assertThat(match.rolesInTargetFunction()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unrecognised text classifies as OTHER")
    void unknownFunction() {
        assertThat(classifier.classify(List.of("Chef"), "cook seasonal menus", taxonomy))
                .isEqualTo(JobFunction.OTHER);
    }
}
