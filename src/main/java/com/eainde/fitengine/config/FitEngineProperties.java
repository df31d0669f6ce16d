package com.eainde.fitengine.config;

import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.SeniorityLevel;
import com.eainde.fitengine.model.SignalType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Externalised settings under {@code fit-engine.*}. Turned into an immutable
 * {@link GlobalConfiguration} snapshot by {@link GlobalConfigurationFactory} at startup.
 */
@Data
@ConfigurationProperties(prefix = "fit-engine")
public class FitEngineProperties {

    private Scoring scoring = new Scoring();
    private Keywords keywords = new Keywords();
    private Penalties penalties = new Penalties();

    /** Per-function leveling overrides; functions not listed use the built-in framework. */
    private Map<JobFunction, Map<SeniorityLevel, Map<SignalType, Integer>>> leveling = new EnumMap<>(JobFunction.class);

    private Narrative narrative = new Narrative();
    private Provider provider = new Provider();

    @Data
    public static class Scoring {
        private int longShotFloor = 40;
        private int conditionalFloor = 55;
        private int applyFloor = 75;
        private int coverageWeight = 50;
        private int levelWeight = 30;
        private int evidenceWeight = 20;
    }

    @Data
    public static class Keywords {
        private List<String> technical = new ArrayList<>(List.of(
                "machine learning", "deep learning", "artificial intelligence", "ai", "ml",
                "python", "java", "javascript", "typescript", "react", "node",
                "aws", "azure", "gcp", "cloud", "kubernetes", "docker",
                "agile", "scrum", "jira", "confluence",
                "sql", "nosql", "mongodb", "postgresql", "mysql",
                "tensorflow", "pytorch", "keras", "scikit-learn",
                "data analysis", "data science", "analytics"));
        private List<String> contextWords = new ArrayList<>(List.of(
                "to", "for", "resulting", "which", "that", "using", "with", "built", "created", "developed"));
        private int repeatThreshold = 2;
        private int maxUncontextualized = 5;
        private double maxDensityPercent = 40.0;
    }

    @Data
    public static class Penalties {
        private Map<PenaltyType, Integer> defaults = new EnumMap<>(Map.of(
                PenaltyType.EXPERIENCE_GAP_PER_LEVEL, 8,
                PenaltyType.PRESENTATION_GAP, 5,
                PenaltyType.FUNCTION_MISMATCH, 15,
                PenaltyType.KEYWORD_STUFFING, 10,
                PenaltyType.CREDIBILITY, 20,
                PenaltyType.ELIGIBILITY, 20));
        private List<Scope> scopes = new ArrayList<>();

        @Data
        public static class Scope {
            private JobFunction function;
            /** Null means every level of the function. */
            private SeniorityLevel level;
            private Map<PenaltyType, Integer> values = new EnumMap<>(PenaltyType.class);
        }
    }

    @Data
    public static class Narrative {
        private int maxAttempts = 3;
        private Duration timeout = Duration.ofSeconds(45);
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private int executorThreads = 4;
    }

    @Data
    public static class Provider {
        private String apiKey;
        private String baseUrl;
        private String modelName = "gpt-4o-mini";
        private Double temperature = 0.2;
        private Integer maxTokens = 1500;
        private Duration timeout = Duration.ofSeconds(45);
        private boolean logRequests = false;
    }

    /**
     * HTTP timeout for the provider client, never longer than one narrative attempt. A cancelled
     * attempt does not abort the HTTP call, so a longer client timeout keeps the worker busy.
     */
    public Duration providerCallTimeout() {
        Duration attempt = narrative.getTimeout();
        Duration http = provider.getTimeout();
        if (http == null || (attempt != null && http.compareTo(attempt) > 0)) {
            return attempt;
        }
        return http;
    }
}
