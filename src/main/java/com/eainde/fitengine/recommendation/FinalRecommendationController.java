package com.eainde.fitengine.recommendation;

import com.eainde.fitengine.config.ScoreBands;
import com.eainde.fitengine.exception.RecommendationConflictException;
import com.eainde.fitengine.model.AffordanceState;
import com.eainde.fitengine.model.FinalRecommendation;
import com.eainde.fitengine.model.FitScore;
import com.eainde.fitengine.model.Recommendation;
import com.eainde.fitengine.model.TerminalState;
import com.eainde.fitengine.terminal.BandDowngrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sole writer of a session's recommendation. One instance per session, write-once.
 *
 * <p>The locked value is derived only from the terminal state and the capped score:
 * the score band is clamped to the terminal ceiling, and the affordance is the more restrictive
 * of the terminal affordance and the one the final recommendation carries. When the band sits
 * below the ceiling the stored terminal state is settled to it, so coaching mode and headline
 * follow the locked value. Scores that fall in the same band therefore always produce the same
 * affordance and coaching mode.</p>
 */
public class FinalRecommendationController implements RecommendationView {

    private static final Logger log = LoggerFactory.getLogger(FinalRecommendationController.class);

    private final String sessionId;
    private final Clock clock;
    private final AtomicReference<Locked> locked = new AtomicReference<>();

    public FinalRecommendationController(String sessionId, Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Locks the recommendation for this session.
     *
     * @throws RecommendationConflictException on any second call
     */
    public FinalRecommendation lock(TerminalState state, FitScore score, ScoreBands bands) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(score, "score");
        Objects.requireNonNull(bands, "bands");

        int capped = state.capScore(score.net());
        Recommendation banded = bands.bandFor(capped);
        Recommendation finalValue = Recommendation.weakerOf(banded, state.ceiling());
        AffordanceState affordance = AffordanceState.mostRestrictive(state.affordance(), finalValue.affordance());
        TerminalState settled = BandDowngrade.settle(state, finalValue);

        FinalRecommendation candidate = new FinalRecommendation(finalValue, capped, affordance,
                settled.coachingMode(), state.category(), clock.instant());

        if (!locked.compareAndSet(null, new Locked(candidate, settled))) {
            FinalRecommendation existing = locked.get().recommendation();
            log.error("Second recommendation write for session {}: existing={} attempted={}",
                    sessionId, existing.recommendation(), finalValue);
            throw new RecommendationConflictException("Recommendation for session " + sessionId
                    + " is already locked to " + existing.recommendation()
                    + (existing.recommendation() == finalValue ? "" : "; attempted conflicting value " + finalValue));
        }

        log.info("Locked recommendation {} (score {} -> {}, band {}, ceiling {}, affordance {}) for category {}",
                finalValue, score.net(), capped, banded, state.ceiling(), affordance, state.category());
        return candidate;
    }

    @Override
    public Optional<FinalRecommendation> current() {
        return Optional.ofNullable(locked.get()).map(Locked::recommendation);
    }

    @Override
    public FinalRecommendation get() {
        return current().orElseThrow(() ->
                new IllegalStateException("No recommendation locked for session " + sessionId));
    }

    @Override
    public Optional<TerminalState> terminalState() {
        return Optional.ofNullable(locked.get()).map(Locked::state);
    }

    /**
     * A view that cannot be cast back to the controller.
     */
    public RecommendationView view() {
        RecommendationView self = this;
        return new RecommendationView() {
            @Override
            public Optional<FinalRecommendation> current() {
                return self.current();
            }

            @Override
            public FinalRecommendation get() {
                return self.get();
            }

            @Override
            public Optional<TerminalState> terminalState() {
                return self.terminalState();
            }
        };
    }

    private record Locked(FinalRecommendation recommendation, TerminalState state) {
    }
}
