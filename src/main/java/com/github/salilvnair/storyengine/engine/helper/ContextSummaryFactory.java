package com.github.salilvnair.storyengine.engine.helper;

import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.decay.ContextDecay;
import com.github.salilvnair.storyengine.engine.retrieval.model.ContextSummary;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class ContextSummaryFactory {

    private final StoryEngineConfig config;

    public ContextSummary from(ConversationState state) {
        return new ContextSummary(
                state.getSessionId(),
                state.getTurnCount(),
                ContextDecay.activeTopics(state),
                state.dominantTheme(),
                state.recentIntents(config.getState().getRecentIntentsInSummary()),
                ContextDecay.activeConceptLabels(state),
                maturity(state)
        );
    }

    public String maturity(ConversationState state) {
        return state.getTurnCount() > config.getState().getMaturityTurnThreshold()
                ? ContextSummary.MATURITY_ESTABLISHED
                : ContextSummary.MATURITY_NEW;
    }
}
