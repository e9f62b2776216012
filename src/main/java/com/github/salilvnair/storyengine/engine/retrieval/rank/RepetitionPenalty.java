package com.github.salilvnair.storyengine.engine.retrieval.rank;

import com.github.salilvnair.storyengine.engine.state.model.ContextDecayConfig;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import lombok.experimental.UtilityClass;

import java.util.OptionalInt;

/**
 * Divisor applied to a story's base score depending on how recently it was last told.
 */
@UtilityClass
public final class RepetitionPenalty {

    public static final double NO_PENALTY = 1.0d;

    public static double multiplier(ConversationState state, String storyId) {
        OptionalInt lastTold = state.lastToldTurn(storyId);
        if (lastTold.isEmpty()) {
            return NO_PENALTY;
        }
        ContextDecayConfig decay = state.getContextDecay();
        double base = decay == null ? 1.0d : decay.getStoryRepetitionPenaltyBase();
        return tier(state.getTurnCount() - lastTold.getAsInt()) * base;
    }

    public static double tier(int turnsSinceLastTold) {
        if (turnsSinceLastTold <= 2) {
            return 3.0d;
        }
        if (turnsSinceLastTold <= 5) {
            return 2.0d;
        }
        if (turnsSinceLastTold <= 10) {
            return 1.5d;
        }
        return NO_PENALTY;
    }
}
