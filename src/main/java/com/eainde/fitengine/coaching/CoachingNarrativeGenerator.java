package com.eainde.fitengine.coaching;

import com.eainde.fitengine.config.FitEngineProperties;
import com.eainde.fitengine.exception.MalformedNarrativeException;
import com.eainde.fitengine.exception.NarrativeGenerationException;
import com.eainde.fitengine.exception.NarrativeIntegrityException;
import com.eainde.fitengine.exception.SessionAccessException;
import com.eainde.fitengine.model.CoachingNarrative;
import com.eainde.fitengine.model.FinalRecommendation;
import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.NarrativeDraft;
import com.eainde.fitengine.model.SensitiveTopic;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.model.TerminalState;
import com.eainde.fitengine.recommendation.RecommendationView;
import com.eainde.fitengine.session.AnalysisSession;
import com.eainde.fitengine.session.SessionKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces the coaching narrative for a locked recommendation.
 *
 * <p>The provider call is the only blocking step of an analysis. It runs on the narrative
 * executor with a timeout and is registered with the session so a cancel interrupts it.
 * Timeouts, provider errors, off-schema output and phrase violations are retried with
 * exponential backoff; when attempts run out the session fails with
 * {@link NarrativeGenerationException}. Nothing is ever emitted that has not passed
 * {@link PhraseGuard}.</p>
 */
@Slf4j
@Component
public class CoachingNarrativeGenerator {

    private final NarrativeProvider provider;
    private final NarrativePromptBuilder promptBuilder;
    private final NarrativeDecoder decoder;
    private final PhraseGuard phraseGuard;
    private final ExecutorService executor;
    private final FitEngineProperties.Narrative settings;

    public CoachingNarrativeGenerator(NarrativeProvider provider,
                                      NarrativePromptBuilder promptBuilder,
                                      NarrativeDecoder decoder,
                                      PhraseGuard phraseGuard,
                                      @Qualifier("narrativeExecutor") ExecutorService executor,
                                      FitEngineProperties properties) {
        this.provider = provider;
        this.promptBuilder = promptBuilder;
        this.decoder = decoder;
        this.phraseGuard = phraseGuard;
        this.executor = executor;
        this.settings = properties.getNarrative();
    }

    public CoachingNarrative generate(AnalysisSession session,
                                      RecommendationView recommendation,
                                      JobDescription jd,
                                      List<Strength> strengths,
                                      List<String> gaps) {
        if (strengths == null || strengths.isEmpty()) {
            throw new NarrativeIntegrityException("No evidenced strengths were extracted for session "
                    + session.getId() + "; refusing to generate a narrative");
        }
        FinalRecommendation locked = recommendation.current().orElseThrow(() ->
                new NarrativeIntegrityException("Narrative requested before the recommendation was locked"));
        TerminalState state = recommendation.terminalState().orElseThrow(() ->
                new NarrativeIntegrityException("Locked recommendation carries no terminal state"));

        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        List<String> feedback = List.of();
        String lastFailure = "no attempt made";
        Throwable lastCause = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            session.ensureActive();
            NarrativePrompt prompt = promptBuilder.build(state, locked, jd, strengths, gaps == null ? List.of() : gaps, feedback);

            Future<String> call = executor.submit(() -> provider.generate(prompt));
            session.attachInFlight(call);
            try {
                String raw = call.get(settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
                NarrativeDraft draft = decoder.decode(raw);
                List<String> violations = phraseGuard.check(draft, state, strengths);
                if (violations.isEmpty()) {
                    CoachingNarrative narrative = assemble(state, draft);
                    List<String> missing = phraseGuard.missingRequired(narrative, state);
                    if (!missing.isEmpty()) {
                        throw new NarrativeIntegrityException("Narrative is missing required phrase(s) " + missing);
                    }
                    session.record(SessionKeys.NARRATIVE, narrative);
                    log.info("Narrative accepted on attempt {}/{}", attempt, maxAttempts);
                    return narrative;
                }
                feedback = violations;
                lastFailure = violations.size() + " phrase violation(s)";
                lastCause = null;
                log.warn("Narrative attempt {}/{} rejected: {}", attempt, maxAttempts, violations);
            } catch (TimeoutException e) {
                call.cancel(true);
                feedback = List.of("The previous attempt timed out. Answer more briefly.");
                lastFailure = "timed out after " + settings.getTimeout().toMillis() + "ms";
                lastCause = e;
                log.warn("Narrative attempt {}/{} timed out", attempt, maxAttempts);
            } catch (CancellationException e) {
                throw new SessionAccessException("Session " + session.getId() + " was cancelled during narrative generation");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                feedback = List.of();
                lastFailure = "provider error: " + cause.getMessage();
                lastCause = cause;
                log.warn("Narrative attempt {}/{} failed: {}", attempt, maxAttempts, cause.toString());
            } catch (MalformedNarrativeException e) {
                feedback = List.of(e.getMessage());
                lastFailure = e.getMessage();
                lastCause = e;
                log.warn("Narrative attempt {}/{} malformed: {}", attempt, maxAttempts, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                call.cancel(true);
                throw new NarrativeGenerationException("Interrupted while waiting for the narrative provider", e);
            } finally {
                session.detachInFlight(call);
            }

            if (attempt < maxAttempts) {
                backoff(attempt);
            }
        }

        log.error("Narrative generation failed after {} attempt(s): {}", maxAttempts, lastFailure);
        throw new NarrativeGenerationException("Narrative generation failed after " + maxAttempts
                + " attempt(s): " + lastFailure, lastCause);
    }

    /**
     * Engine-owned sentences go first: the headline, then one canonical statement per sensitive
     * topic in play.
     */
    static CoachingNarrative assemble(TerminalState state, NarrativeDraft draft) {
        List<String> statements = new ArrayList<>();
        statements.add(state.headline());
        for (SensitiveTopic topic : SensitiveTopic.values()) {
            String canonical = state.canonicalStatements().get(topic);
            if (canonical != null) {
                statements.add(canonical);
            }
        }
        if (state.redirectSuggestion() != null) {
            statements.add(state.redirectSuggestion());
        }
        return new CoachingNarrative(state.coachingMode(), draft.summary(), statements, draft.strengths(),
                draft.gaps(), draft.yourMove(), draft.threeMonthPlan(), draft.sixToTwelveMonthPlan());
    }

    Duration backoffFor(int attempt) {
        double factor = Math.pow(settings.getBackoffMultiplier(), attempt - 1);
        return Duration.ofMillis(Math.round(settings.getInitialBackoff().toMillis() * factor));
    }

    private void backoff(int attempt) {
        Duration delay = backoffFor(attempt);
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        log.debug("Backing off {}ms before the next narrative attempt", delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NarrativeGenerationException("Interrupted during narrative retry backoff", e);
        }
    }
}
