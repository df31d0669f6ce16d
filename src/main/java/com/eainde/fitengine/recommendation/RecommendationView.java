package com.eainde.fitengine.recommendation;

import com.eainde.fitengine.model.FinalRecommendation;
import com.eainde.fitengine.model.TerminalState;

import java.util.Optional;

/**
 * Read-only access to a session's binding recommendation for advisory components.
 */
public interface RecommendationView {

    Optional<FinalRecommendation> current();

    /**
     * @throws IllegalStateException if nothing has been locked yet
     */
    FinalRecommendation get();

    /**
     * The terminal state consumed by the lock. Present once {@link #current()} is.
     */
    Optional<TerminalState> terminalState();

    default boolean isLocked() {
        return current().isPresent();
    }
}
