package com.eainde.fitengine.signal;

import com.eainde.fitengine.TestFixtures;
import com.eainde.fitengine.config.DomainTaxonomy;
import com.eainde.fitengine.model.DomainMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DomainClassifierTest {

    private final DomainClassifier classifier = new DomainClassifier();
    private final DomainTaxonomy taxonomy = DomainTaxonomy.defaults();

    @Test
    @DisplayName("Adjacent domain experience supports translation")
    void adjacentDomain() {
        DomainMatch match = classifier.match(
                TestFixtures.resume("Analyst", 3, "Built payments and billing reports for a banking partner"),
                TestFixtures.job("Analyst", "Grow our ecommerce marketplace checkout conversion."),
                taxonomy);

        assertThat(match.candidateDomains()).contains("fintech");
        assertThat(match.targetDomain()).isEqualTo("ecommerce");
        assertThat(match.translationSupported()).isTrue();
        assertThat(match.reason()).startsWith("Adjacent experience");
    }

    @Test
    @DisplayName("Unrelated domain does not support translation")
    void unrelatedDomain() {
        DomainMatch match = classifier.match(
                TestFixtures.resume("Analyst", 3, "Reviewed healthcare clinical data for patient outcomes"),
                TestFixtures.job("Analyst", "Programmatic advertising with RTB bidding."),
                taxonomy);

        assertThat(match.targetDomain()).isEqualTo("adtech");
        assertThat(match.translationSupported()).isFalse();
    }

    @Test
    @DisplayName("Unidentified target domain is treated as supported")
    void unknownTarget() {
        DomainMatch match = classifier.match(
                TestFixtures.resume("Engineer", 2, "Wrote code"),
                TestFixtures.job("Engineer", "Write code."),
                taxonomy);

        assertThat(match.targetDomain()).isNull();
        assertThat(match.translationSupported()).isTrue();
    }
}
