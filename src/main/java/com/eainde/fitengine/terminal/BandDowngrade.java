package com.eainde.fitengine.terminal;

import com.eainde.fitengine.model.AffordanceState;
import com.eainde.fitengine.model.CoachingMode;
import com.eainde.fitengine.model.GapCategory;
import com.eainde.fitengine.model.Recommendation;
import com.eainde.fitengine.model.TerminalState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings a terminal state in line with a locked recommendation that the score band pushed
 * below the category ceiling.
 *
 * <p>The coaching mode and headline then come from the band row, so the narrative never
 * reads stronger than the locked value. With no gap the category headline is replaced; otherwise
 * the band sentence follows it and the category's required phrases stay in force.</p>
 */
@Slf4j
public final class BandDowngrade {

    private BandDowngrade() {
    }

    public static TerminalState settle(TerminalState state, Recommendation locked) {
        if (!state.ceiling().isStrongerThan(locked)) {
            return state;
        }
        TerminalStateCatalog.BandRow row = TerminalStateCatalog.bandRowFor(locked);

        CoachingMode mode = state.coachingMode() == CoachingMode.OPTIMIZATION
                || state.coachingMode() == CoachingMode.SIGNAL_BUILDING ? row.mode() : state.coachingMode();
        String headline = state.category() == GapCategory.NONE ? row.headline() : state.headline() + " " + row.headline();

        List<String> forbidden = new ArrayList<>(state.forbiddenPhrases());
        TerminalStateCatalog.UNIVERSAL_FORBIDDEN.stream().filter(p -> !forbidden.contains(p)).forEach(forbidden::add);

        log.info("Band {} is below ceiling {}: coaching mode {} -> {}", locked, state.ceiling(), state.coachingMode(), mode);
        return new TerminalState(state.category(), state.severe(), state.scoreCap(), state.ceiling(),
                AffordanceState.mostRestrictive(state.affordance(), locked.affordance()), mode, headline,
                state.requiredPhrases(), forbidden, state.forbiddenPatterns(), state.canonicalStatements(),
                state.requiresClosingPlans(), state.redirectSuggestion());
    }
}
