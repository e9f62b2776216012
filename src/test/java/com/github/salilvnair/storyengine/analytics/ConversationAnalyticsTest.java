package com.github.salilvnair.storyengine.analytics;

import com.github.salilvnair.storyengine.analytics.model.RelevanceInsights;
import com.github.salilvnair.storyengine.analytics.model.StateSummary;
import com.github.salilvnair.storyengine.analytics.model.TopicStability;
import com.github.salilvnair.storyengine.analytics.model.UsageStats;
import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.retrieval.model.RankedStory;
import com.github.salilvnair.storyengine.engine.retrieval.model.ScoreBreakdown;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionResult;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionStatus;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.storyengine.support.StateFixtures.plainStory;
import static com.github.salilvnair.storyengine.support.StateFixtures.state;
import static com.github.salilvnair.storyengine.support.StateFixtures.toldAt;
import static com.github.salilvnair.storyengine.support.TestConstants.SESSION_KEY;
import static com.github.salilvnair.storyengine.support.TestConstants.STORY_A;
import static com.github.salilvnair.storyengine.support.TestConstants.STORY_B;
import static com.github.salilvnair.storyengine.support.TestConstants.TOPIC_FAMILY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationAnalyticsTest {

    private static final double DELTA = 1e-9;

    private final ConversationAnalytics analytics = new ConversationAnalytics(new StoryEngineConfig());

    @Test
    void usageStatsCountRepeatsAndGaps() {
        ConversationState state = state(9, List.of(), List.of(), List.of());
        toldAt(state, STORY_A, 1);
        toldAt(state, STORY_B, 2);
        toldAt(state, STORY_A, 5);
        toldAt(state, STORY_A, 8);

        UsageStats stats = analytics.usageStats(state);

        assertEquals(4, stats.totalTold());
        assertEquals(2, stats.uniqueTold());
        assertEquals(0.5d, stats.repetitionRate(), DELTA);
        assertEquals(3.5d, stats.averageGap(), DELTA);
    }

    @Test
    void usageStatsOfQuietSessionAreZero() {
        UsageStats stats = analytics.usageStats(state(3, List.of(), List.of(), List.of()));

        assertEquals(new UsageStats(0, 0, 0d, 0d), stats);
    }

    @Test
    void topicStabilityReportsTurnsSinceShiftAndStaleness() {
        ConversationState state = state(2, List.of(TOPIC_FAMILY), List.of(), List.of());
        state.setTurnCount(7);

        TopicStability stability = analytics.topicStability(state);

        assertEquals(TOPIC_FAMILY, stability.dominantTheme());
        assertEquals(5, stability.turnsSinceShift());
        assertTrue(stability.stale());
        assertTrue(analytics.activeTopics(state).isEmpty());
    }

    @Test
    void resetIsSuggestedOnlyAfterFiftyTurns() {
        assertFalse(analytics.shouldResetContext(state(50, List.of(), List.of(), List.of())));
        assertTrue(analytics.shouldResetContext(state(51, List.of(), List.of(), List.of())));
    }

    @Test
    void stateSummaryCountsWithoutCopyingHistory() {
        ConversationState state = toldAt(state(4, List.of(TOPIC_FAMILY), List.of(), List.of("trust")), STORY_A, 2);

        StateSummary summary = analytics.stateSummary(state);

        assertEquals(SESSION_KEY, summary.sessionKey());
        assertEquals(1, summary.storiesToldCount());
        assertEquals(1, summary.keyConceptsCount());
        assertEquals(TOPIC_FAMILY, summary.dominantTheme());
    }

    @Test
    void insightsRankAndBoundScores() {
        SelectionResult result = new SelectionResult(SESSION_KEY, 4, List.of(
                ranked(STORY_A, 6.0d),
                ranked(STORY_B, 2.5d)), SelectionStatus.SELECTED, 5, 3);

        RelevanceInsights insights = analytics.insights(result);

        assertEquals(2, insights.topStories().size());
        assertEquals(1, insights.topStories().get(0).rank());
        assertEquals(6.0d, insights.highestScore(), DELTA);
        assertEquals(2.5d, insights.lowestScore(), DELTA);
        assertEquals(5, insights.totalCandidates());
        assertTrue(insights.hasRelevantStories());
    }

    private static RankedStory ranked(String id, double finalScore) {
        return new RankedStory(plainStory(id),
                new ScoreBreakdown(id, finalScore, 0d, finalScore, 1.0d, 0d, finalScore, null));
    }
}
