package com.github.salilvnair.storyengine.analytics;

import com.github.salilvnair.storyengine.analytics.model.RelevanceInsights;
import com.github.salilvnair.storyengine.analytics.model.StateSummary;
import com.github.salilvnair.storyengine.analytics.model.StoryInsight;
import com.github.salilvnair.storyengine.analytics.model.TopicStability;
import com.github.salilvnair.storyengine.analytics.model.UsageStats;
import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.decay.ContextDecay;
import com.github.salilvnair.storyengine.engine.retrieval.model.RankedStory;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionResult;
import com.github.salilvnair.storyengine.engine.state.model.ConversationFlow;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import com.github.salilvnair.storyengine.engine.state.model.StoryUsage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only views over a state snapshot or a selection result. Nothing here mutates its input.
 */
@RequiredArgsConstructor
@Component
public class ConversationAnalytics {

    private final StoryEngineConfig config;

    public List<String> activeTopics(ConversationState state) {
        return ContextDecay.activeTopics(state);
    }

    public List<String> activeConcepts(ConversationState state) {
        return ContextDecay.activeConceptLabels(state);
    }

    public UsageStats usageStats(ConversationState state) {
        List<StoryUsage> history = state.getRetrievedStoryHistory();
        int total = history.size();
        Set<String> unique = new HashSet<>();
        Map<String, Integer> lastTold = new HashMap<>();
        long gapSum = 0L;
        int gaps = 0;
        for (StoryUsage usage : history) {
            unique.add(usage.getStoryId());
            Integer previous = lastTold.put(usage.getStoryId(), usage.getToldAtTurn());
            if (previous != null) {
                gapSum += usage.getToldAtTurn() - previous;
                gaps++;
            }
        }
        double repetitionRate = total == 0 ? 0d : (double) (total - unique.size()) / total;
        double averageGap = gaps == 0 ? 0d : (double) gapSum / gaps;
        return new UsageStats(total, unique.size(), repetitionRate, averageGap);
    }

    public TopicStability topicStability(ConversationState state) {
        ConversationFlow flow = state.getConversationFlow();
        return new TopicStability(
                flow.getDominantTheme(),
                flow.getThemeStabilityCount(),
                flow.getLastTopicShiftTurn(),
                flow.getThemeStabilityCount() == 0 ? 0 : state.getTurnCount() - flow.getLastTopicShiftTurn(),
                ContextDecay.isTopicContextStale(state));
    }

    public StateSummary stateSummary(ConversationState state) {
        return new StateSummary(
                state.getSessionId(),
                state.getSessionKey(),
                state.getTurnCount(),
                List.copyOf(state.getCurrentTopics()),
                state.dominantTheme(),
                state.getRetrievedStoryHistory().size(),
                state.getMentionedConcepts().size(),
                state.getLastUpdated());
    }

    /** Long conversations are worth starting over; the application decides whether to reset. */
    public boolean shouldResetContext(ConversationState state) {
        return state.getTurnCount() > config.getState().getResetAfterTurns();
    }

    public RelevanceInsights insights(SelectionResult result) {
        List<StoryInsight> top = new ArrayList<>();
        double highest = 0d;
        double lowest = 0d;
        List<RankedStory> stories = result.stories();
        for (int i = 0; i < stories.size(); i++) {
            RankedStory ranked = stories.get(i);
            String title = ranked.story().getTitle() == null ? "Untitled" : ranked.story().getTitle();
            top.add(new StoryInsight(
                    i + 1,
                    ranked.storyId(),
                    title.length() > 50 ? title.substring(0, 50) : title,
                    ranked.finalScore(),
                    ranked.breakdown(),
                    ranked.breakdown().summary(),
                    ranked.story().hasMetadata()));
            highest = i == 0 ? ranked.finalScore() : Math.max(highest, ranked.finalScore());
            lowest = i == 0 ? ranked.finalScore() : Math.min(lowest, ranked.finalScore());
        }
        return new RelevanceInsights(result.status(), result.candidateCount(), result.filteredCount(), top, highest, lowest);
    }
}
