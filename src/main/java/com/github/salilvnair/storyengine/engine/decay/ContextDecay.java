package com.github.salilvnair.storyengine.engine.decay;

import com.github.salilvnair.storyengine.engine.state.model.ConceptMention;
import com.github.salilvnair.storyengine.engine.state.model.ContextDecayConfig;
import com.github.salilvnair.storyengine.engine.state.model.ConversationFlow;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turn based forgetting. Concepts are pruned from the state, topics are only hidden from the
 * active view, and story history is never touched.
 */
@UtilityClass
public final class ContextDecay {

    /** Prunes stale concepts in place and returns the same state. */
    public static ConversationState decay(ConversationState state) {
        if (state == null) {
            return null;
        }
        int threshold = decayConfig(state).getConceptDecayThreshold();
        int turn = state.getTurnCount();
        state.getMentionedConcepts().entrySet()
                .removeIf(entry -> turn - entry.getValue().getLastTurn() > threshold);
        return state;
    }

    public static boolean isConceptActive(ConversationState state, String label) {
        ConceptMention mention = state.getMentionedConcepts().get(label);
        return mention != null && isActive(state, mention);
    }

    public static Map<String, ConceptMention> activeConcepts(ConversationState state) {
        Map<String, ConceptMention> active = new LinkedHashMap<>();
        state.getMentionedConcepts().forEach((label, mention) -> {
            if (isActive(state, mention)) {
                active.put(label, mention);
            }
        });
        return active;
    }

    public static List<String> activeConceptLabels(ConversationState state) {
        return List.copyOf(activeConcepts(state).keySet());
    }

    /**
     * Current topics while the conversation flow is fresh. Once the flow has not been refreshed for
     * more than the topic threshold every topic counts as decayed.
     */
    public static List<String> activeTopics(ConversationState state) {
        if (isTopicContextStale(state)) {
            return List.of();
        }
        return List.copyOf(state.getCurrentTopics());
    }

    public static boolean isTopicContextStale(ConversationState state) {
        ConversationFlow flow = state.getConversationFlow();
        if (flow == null || flow.getThemeStabilityCount() == 0) {
            return false;
        }
        return state.getTurnCount() - flow.getLastRefreshedTurn() > decayConfig(state).getTopicDecayThreshold();
    }

    private static boolean isActive(ConversationState state, ConceptMention mention) {
        return state.getTurnCount() - mention.getLastTurn() <= decayConfig(state).getConceptDecayThreshold();
    }

    private static ContextDecayConfig decayConfig(ConversationState state) {
        ContextDecayConfig config = state.getContextDecay();
        return config == null ? new ContextDecayConfig(3, 5, 1.0d) : config;
    }
}
