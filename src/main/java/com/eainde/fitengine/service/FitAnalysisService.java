package com.eainde.fitengine.service;

import com.eainde.fitengine.coaching.CoachingNarrativeGenerator;
import com.eainde.fitengine.coaching.StrengthRanker;
import com.eainde.fitengine.config.GlobalConfiguration;
import com.eainde.fitengine.exception.FitEngineException;
import com.eainde.fitengine.gap.GapClassifier;
import com.eainde.fitengine.gap.GapInputs;
import com.eainde.fitengine.level.JobLevelDetector;
import com.eainde.fitengine.level.LevelClassifier;
import com.eainde.fitengine.model.CoachingNarrative;
import com.eainde.fitengine.model.CredibilityFinding;
import com.eainde.fitengine.model.DomainMatch;
import com.eainde.fitengine.model.EligibilityResult;
import com.eainde.fitengine.model.FinalRecommendation;
import com.eainde.fitengine.model.FitScore;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.GapCategory;
import com.eainde.fitengine.model.GapClassification;
import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.LevelAssessment;
import com.eainde.fitengine.model.ResumeDocument;
import com.eainde.fitengine.model.SeniorityLevel;
import com.eainde.fitengine.model.SignalExtraction;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.model.TerminalState;
import com.eainde.fitengine.score.CapabilityExtractor;
import com.eainde.fitengine.score.FitScorer;
import com.eainde.fitengine.session.AnalysisSession;
import com.eainde.fitengine.session.AnalysisSessionManager;
import com.eainde.fitengine.session.SessionKeys;
import com.eainde.fitengine.signal.DomainClassifier;
import com.eainde.fitengine.signal.EligibilityScreen;
import com.eainde.fitengine.signal.FunctionClassifier;
import com.eainde.fitengine.signal.MetricPlausibilityChecker;
import com.eainde.fitengine.signal.SignalExtractor;
import com.eainde.fitengine.terminal.ResolutionContext;
import com.eainde.fitengine.terminal.TerminalStateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one analysis end to end inside its own session:
 * signals, level, gap, terminal state, score, locked recommendation, narrative.
 * The session is sealed on every exit path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FitAnalysisService {

    static final int MAX_LISTED_MISSING_CAPABILITIES = 5;

    private final AnalysisSessionManager sessionManager;
    private final SignalExtractor signalExtractor;
    private final FunctionClassifier functionClassifier;
    private final DomainClassifier domainClassifier;
    private final EligibilityScreen eligibilityScreen;
    private final MetricPlausibilityChecker plausibilityChecker;
    private final JobLevelDetector jobLevelDetector;
    private final LevelClassifier levelClassifier;
    private final GapClassifier gapClassifier;
    private final TerminalStateResolver terminalStateResolver;
    private final CapabilityExtractor capabilityExtractor;
    private final FitScorer fitScorer;
    private final StrengthRanker strengthRanker;
    private final CoachingNarrativeGenerator narrativeGenerator;

    public AnalysisOutcome analyze(ResumeDocument resume, JobDescription jd) {
        AnalysisSession session = sessionManager.open();
        long start = System.currentTimeMillis();
        try {
            return run(session, resume, jd);
        } catch (FitEngineException e) {
            throw e.withSessionId(session.getId());
        } finally {
            sessionManager.seal(session);
            log.info("Analysis {} finished in {}ms", session.getId(), System.currentTimeMillis() - start);
        }
    }

    private AnalysisOutcome run(AnalysisSession session, ResumeDocument resume, JobDescription jd) {
        session.record(SessionKeys.RESUME, resume);
        session.record(SessionKeys.JOB_DESCRIPTION, jd);
        GlobalConfiguration config = session.getConfiguration();

        // =========================================================================
        //  Signals and level
        // =========================================================================
        SignalExtraction extraction = signalExtractor.extract(resume, jd, session);
        FunctionMatch function = functionClassifier.match(resume, jd, config.functions());
        SeniorityLevel target = jobLevelDetector.detect(jd);
        LevelAssessment level = levelClassifier.classify(extraction.signals(), target,
                function.targetFunction(), config.leveling());
        session.record(SessionKeys.LEVEL_ASSESSMENT, level);

        // =========================================================================
        //  Gap and terminal state
        // =========================================================================
        DomainMatch domain = domainClassifier.match(resume, jd, config.domains());
        EligibilityResult eligibility = eligibilityScreen.screen(resume, jd, config.credentials());
        List<CredibilityFinding> credibility = plausibilityChecker.check(resume);

        GapClassification gap = gapClassifier.classify(new GapInputs(extraction, level, function, domain,
                eligibility, credibility, !resume.experience().isEmpty()));
        session.record(SessionKeys.GAP_CLASSIFICATION, gap);

        TerminalState state = terminalStateResolver.resolve(gap,
                new ResolutionContext(jd.roleTitle(), function, level, domain, eligibility));
        session.record(SessionKeys.TERMINAL_STATE, state);

        // =========================================================================
        //  Score and lock
        // =========================================================================
        List<String> capabilities = capabilityExtractor.requiredCapabilities(jd, function.targetFunction(), config);
        FitScore score = fitScorer.score(resume, capabilities, extraction, level, gap,
                function.targetFunction(), config);
        FinalRecommendation recommendation = session.getRecommendation().lock(state, score, config.scoreBands());
        session.getRecommendation().terminalState().ifPresent(settled -> session.record(SessionKeys.TERMINAL_STATE, settled));

        // =========================================================================
        //  Narrative
        // =========================================================================
        List<Strength> strengths = strengthRanker.rank(resume, capabilities, function, extraction);
        session.record(SessionKeys.STRENGTHS, strengths);
        List<String> gaps = gapsOf(gap, capabilities, resume);

        CoachingNarrative narrative = narrativeGenerator.generate(session, session.getRecommendation().view(),
                jd, strengths, gaps);

        return new AnalysisOutcome(session.getId(), recommendation, state.redirectSuggestion(),
                strengths, gaps, narrative);
    }

    private List<String> gapsOf(GapClassification gap, List<String> capabilities, ResumeDocument resume) {
        List<String> gaps = new ArrayList<>();
        if (gap.category() != GapCategory.NONE) {
            gaps.add(gap.category().label() + ": " + gap.active().reason());
        }
        capabilities.stream()
                .filter(c -> !capabilityExtractor.isCovered(c, resume))
                .limit(MAX_LISTED_MISSING_CAPABILITIES)
                .forEach(c -> gaps.add("No resume evidence for " + c));
        return gaps;
    }
}
