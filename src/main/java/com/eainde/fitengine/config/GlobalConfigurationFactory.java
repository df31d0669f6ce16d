package com.eainde.fitengine.config;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds the initial configuration snapshot from {@link FitEngineProperties} on top of the
 * built-in taxonomies.
 */
@Slf4j
public final class GlobalConfigurationFactory {

    private GlobalConfigurationFactory() {
    }

    public static GlobalConfiguration fromProperties(FitEngineProperties properties) {
        FitEngineProperties.Scoring scoring = properties.getScoring();
        FitEngineProperties.Keywords keywords = properties.getKeywords();

        LevelingFramework leveling = LevelingFramework.defaults();
        for (var entry : properties.getLeveling().entrySet()) {
            leveling = leveling.withOverride(entry.getKey(), entry.getValue());
        }

        PenaltySchedule penalties = PenaltySchedule.of(properties.getPenalties().getDefaults());
        for (FitEngineProperties.Penalties.Scope scope : properties.getPenalties().getScopes()) {
            if (scope.getFunction() == null) {
                throw new IllegalStateException("Penalty scope without a function: " + scope);
            }
            penalties = penalties.withScope(scope.getFunction(), scope.getLevel(), scope.getValues());
        }

        GlobalConfiguration configuration = new GlobalConfiguration(
                1L,
                leveling,
                penalties,
                new ScoreBands(scoring.getLongShotFloor(), scoring.getConditionalFloor(), scoring.getApplyFloor()),
                new ScoringWeights(scoring.getCoverageWeight(), scoring.getLevelWeight(), scoring.getEvidenceWeight()),
                new KeywordHeuristics(keywords.getTechnical(), keywords.getContextWords(),
                        keywords.getRepeatThreshold(), keywords.getMaxUncontextualized(), keywords.getMaxDensityPercent()),
                FunctionTaxonomy.defaults(),
                DomainTaxonomy.defaults(),
                CredentialRule.defaults());

        log.info("Built global configuration v{} with {} leveling override(s) and {} penalty scope(s)",
                configuration.version(), properties.getLeveling().size(), properties.getPenalties().getScopes().size());
        return configuration;
    }

    /**
     * Configuration with built-in defaults only. Used by tests and as a fallback for tooling.
     */
    public static GlobalConfiguration defaults() {
        return fromProperties(new FitEngineProperties());
    }
}
