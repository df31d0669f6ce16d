package com.eainde.fitengine.score;

import com.eainde.fitengine.config.GlobalConfiguration;
import com.eainde.fitengine.config.PenaltySchedule;
import com.eainde.fitengine.config.PenaltyType;
import com.eainde.fitengine.config.ScoringWeights;
import com.eainde.fitengine.model.CandidateSignal;
import com.eainde.fitengine.model.FitScore;
import com.eainde.fitengine.model.GapClassification;
import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.LevelAssessment;
import com.eainde.fitengine.model.ResumeDocument;
import com.eainde.fitengine.model.SignalExtraction;
import com.eainde.fitengine.model.SignalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Deterministic fit score: weighted capability coverage, level alignment and evidence density,
 * minus the penalties of the active gap. The terminal cap is applied later, at lock time.
 */
@Slf4j
@Component
public class FitScorer {

    /** Distance at which level alignment reaches zero. */
    static final int LEVEL_SPAN = 3;
    /** Coverage used when the posting names nothing the configuration recognises. */
    static final double NEUTRAL_COVERAGE = 0.5;

    private final CapabilityExtractor capabilityExtractor;

    public FitScorer(CapabilityExtractor capabilityExtractor) {
        this.capabilityExtractor = capabilityExtractor;
    }

    public FitScore score(ResumeDocument resume,
                          List<String> capabilities,
                          SignalExtraction extraction,
                          LevelAssessment level,
                          GapClassification gap,
                          JobFunction targetFunction,
                          GlobalConfiguration config) {

        double coverage = capabilities.isEmpty()
                ? NEUTRAL_COVERAGE
                : capabilities.stream().filter(c -> capabilityExtractor.isCovered(c, resume)).count()
                / (double) capabilities.size();

        double levelAlignment = 1.0 - Math.min(Math.max(0, level.distance()), LEVEL_SPAN) / (double) LEVEL_SPAN;

        List<CandidateSignal> nonTitle = extraction.signals().stream()
                .filter(s -> s.type() != SignalType.TITLE)
                .toList();
        double evidence = nonTitle.isEmpty() ? 0.0
                : nonTitle.stream().filter(CandidateSignal::valid).count() / (double) nonTitle.size();

        ScoringWeights w = config.weights();
        int raw = (int) Math.round(coverage * w.coverage() + levelAlignment * w.level() + evidence * w.evidence());
        raw = Math.max(0, Math.min(100, raw));

        int penalty = penaltyFor(gap, extraction, level, targetFunction, config.penalties());

        log.info("Fit score raw={} (coverage={}, level={}, evidence={}) penalty={} category={}",
                raw, round2(coverage), round2(levelAlignment), round2(evidence), penalty, gap.category());
        return new FitScore(raw, penalty);
    }

    int penaltyFor(GapClassification gap, SignalExtraction extraction, LevelAssessment level,
                   JobFunction function, PenaltySchedule schedule) {
        var target = level.target();
        int penalty = switch (gap.category()) {
            case CREDIBILITY_VIOLATION -> schedule.valueOf(PenaltyType.CREDIBILITY, function, target);
            case ELIGIBILITY_VIOLATION -> schedule.valueOf(PenaltyType.ELIGIBILITY, function, target);
            case FUNCTION_MISMATCH -> schedule.valueOf(PenaltyType.FUNCTION_MISMATCH, function, target);
            case EXPERIENCE_GAP -> schedule.valueOf(PenaltyType.EXPERIENCE_GAP_PER_LEVEL, function, target)
                    * Math.max(level.distance(), 1);
            case PRESENTATION_GAP -> schedule.valueOf(PenaltyType.PRESENTATION_GAP, function, target);
            case NONE -> 0;
        };
        if (extraction.flags().keywordStuffingDetected()) {
            penalty += schedule.valueOf(PenaltyType.KEYWORD_STUFFING, function, target);
        }
        return penalty;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
