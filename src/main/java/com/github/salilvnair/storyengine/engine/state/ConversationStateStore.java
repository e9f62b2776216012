package com.github.salilvnair.storyengine.engine.state;

import com.github.salilvnair.storyengine.engine.state.model.ContextDecayConfig;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import com.github.salilvnair.storyengine.engine.state.model.TurnUpdate;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Owns one {@link ConversationState} per session key. Every method returning state returns a
 * detached snapshot. Mutations for the same key are serialized, different keys are independent.
 */
public interface ConversationStateStore {

    ConversationState getOrCreate(String sessionKey);

    Optional<ConversationState> find(String sessionKey);

    ConversationState updateTurn(String sessionKey, TurnUpdate update);

    default ConversationState updateTurn(String sessionKey, List<String> topics, List<String> intents, List<String> concepts) {
        return updateTurn(sessionKey, new TurnUpdate(topics, intents, concepts));
    }

    /** Records a telling at the current turn. False when the session does not exist. */
    boolean recordStoryUsage(String sessionKey, String storyId);

    /**
     * Records the stories of one selection at {@code turn} in a single atomic step. Duplicate ids
     * are recorded once. False, and nothing written, when the session does not exist or was reset
     * since {@code expectedSessionId} was read.
     */
    boolean recordStoryUsages(String sessionKey, String expectedSessionId, int turn, Collection<String> storyIds);

    boolean reset(String sessionKey);

    boolean reconfigure(String sessionKey, ContextDecayConfig decayConfig);

    void restore(ConversationState state);

    int evictInactive(Duration maxIdle);
}
