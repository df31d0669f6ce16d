package com.eainde.fitengine.model;

import java.util.List;

/**
 * @param keywordCount           technical keyword occurrences across all bullets
 * @param uncontextualizedCount  keywords repeated without any applied context
 * @param densityPercent         keyword occurrences per ten words of bullet text, as a percentage
 * @param uncontextualized       the offending keywords
 * @param stuffed                whether either configured threshold was crossed
 */
public record KeywordStuffingReport(
        int keywordCount,
        int uncontextualizedCount,
        double densityPercent,
        List<String> uncontextualized,
        boolean stuffed
) {

    public KeywordStuffingReport {
        uncontextualized = uncontextualized == null ? List.of() : List.copyOf(uncontextualized);
    }

    public static KeywordStuffingReport clean() {
        return new KeywordStuffingReport(0, 0, 0.0, List.of(), false);
    }
}
