package com.eainde.fitengine.config;

import java.util.List;
import java.util.Objects;

/**
 * Versioned, candidate-agnostic configuration. Immutable; every session holds the snapshot it
 * was opened with, so an administrative update never reaches a run already in flight.
 */
public record GlobalConfiguration(
        long version,
        LevelingFramework leveling,
        PenaltySchedule penalties,
        ScoreBands scoreBands,
        ScoringWeights weights,
        KeywordHeuristics keywords,
        FunctionTaxonomy functions,
        DomainTaxonomy domains,
        List<CredentialRule> credentials
) {

    public GlobalConfiguration {
        Objects.requireNonNull(leveling, "leveling");
        Objects.requireNonNull(penalties, "penalties");
        Objects.requireNonNull(scoreBands, "scoreBands");
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(keywords, "keywords");
        Objects.requireNonNull(functions, "functions");
        Objects.requireNonNull(domains, "domains");
        credentials = List.copyOf(credentials);
    }

    public GlobalConfiguration withVersion(long newVersion) {
        return new GlobalConfiguration(newVersion, leveling, penalties, scoreBands, weights, keywords,
                functions, domains, credentials);
    }
}
