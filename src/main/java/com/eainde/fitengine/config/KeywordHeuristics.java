package com.eainde.fitengine.config;

import java.util.List;

/**
 * Thresholds for keyword stuffing detection.
 *
 * @param technicalKeywords   keywords counted as technical claims
 * @param contextWords        words that mark a bullet as applied context
 * @param repeatThreshold     a keyword must appear more often than this to count as uncontextualized
 * @param maxUncontextualized stuffing fires above this many uncontextualized keywords
 * @param maxDensityPercent   stuffing fires above this keyword density
 */
public record KeywordHeuristics(
        List<String> technicalKeywords,
        List<String> contextWords,
        int repeatThreshold,
        int maxUncontextualized,
        double maxDensityPercent
) {

    public KeywordHeuristics {
        technicalKeywords = List.copyOf(technicalKeywords);
        contextWords = List.copyOf(contextWords);
    }
}
