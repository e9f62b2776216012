package com.github.salilvnair.storyengine.engine.core;

import com.github.salilvnair.storyengine.analytics.model.RelevanceInsights;
import com.github.salilvnair.storyengine.analytics.model.StateSummary;
import com.github.salilvnair.storyengine.analytics.model.TopicStability;
import com.github.salilvnair.storyengine.analytics.model.UsageStats;
import com.github.salilvnair.storyengine.engine.retrieval.model.ContextSummary;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionResult;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;
import com.github.salilvnair.storyengine.engine.state.model.ContextDecayConfig;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

public interface StoryEngine {

    ConversationState getOrCreate(String sessionKey);

    ConversationState updateTurn(String sessionKey, List<String> topics, List<String> intents, List<String> concepts);

    boolean recordStoryUsage(String sessionKey, String storyId);

    boolean reset(String sessionKey);

    boolean reconfigure(String sessionKey, ContextDecayConfig decayConfig);

    /** Drops sessions idle for longer than {@code maxIdle}; scheduling is up to the application. */
    int evictInactive(Duration maxIdle);

    SelectionResult select(String sessionKey, Collection<Story> candidates, int limit);

    /** Extracts the message, updates the session and selects from the configured corpus. */
    SelectionResult processTurn(String sessionKey, String message, int limit);

    /*
     * Read-only views below never create a session; an unknown key yields empty values.
     */
    List<String> activeTopics(String sessionKey);

    UsageStats usageStats(String sessionKey);

    TopicStability topicStability(String sessionKey);

    ContextSummary conversationContext(String sessionKey);

    StateSummary stateSummary(String sessionKey);

    boolean shouldResetContext(String sessionKey);

    RelevanceInsights insights(SelectionResult result);

    /** Serialized state of an existing session, for external storage. Unknown keys raise {@code SESSION_NOT_FOUND}. */
    byte[] checkpoint(String sessionKey);

    ConversationState restore(byte[] checkpoint);
}
