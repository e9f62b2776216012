package com.github.salilvnair.storyengine.engine.provider;

import com.github.salilvnair.storyengine.analytics.ConversationAnalytics;
import com.github.salilvnair.storyengine.analytics.model.RelevanceInsights;
import com.github.salilvnair.storyengine.analytics.model.StateSummary;
import com.github.salilvnair.storyengine.analytics.model.TopicStability;
import com.github.salilvnair.storyengine.analytics.model.UsageStats;
import com.github.salilvnair.storyengine.engine.core.StoryEngine;
import com.github.salilvnair.storyengine.engine.corpus.StoryCorpus;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.extraction.TurnExtractor;
import com.github.salilvnair.storyengine.engine.helper.ContextSummaryFactory;
import com.github.salilvnair.storyengine.engine.retrieval.StoryRetrievalService;
import com.github.salilvnair.storyengine.engine.retrieval.model.ContextSummary;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionResult;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;
import com.github.salilvnair.storyengine.engine.state.ConversationStateCodec;
import com.github.salilvnair.storyengine.engine.state.ConversationStateStore;
import com.github.salilvnair.storyengine.engine.state.model.ContextDecayConfig;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import com.github.salilvnair.storyengine.engine.state.model.TurnUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
@Component
public class DefaultStoryEngine implements StoryEngine {

    private final ConversationStateStore stateStore;
    private final StoryRetrievalService retrievalService;
    private final ConversationAnalytics analytics;
    private final ContextSummaryFactory summaryFactory;
    private final ConversationStateCodec codec;
    private final ObjectProvider<TurnExtractor> extractorProvider;
    private final ObjectProvider<StoryCorpus> corpusProvider;

    @Override
    public ConversationState getOrCreate(String sessionKey) {
        return stateStore.getOrCreate(sessionKey);
    }

    @Override
    public ConversationState updateTurn(String sessionKey, List<String> topics, List<String> intents, List<String> concepts) {
        return stateStore.updateTurn(sessionKey, new TurnUpdate(topics, intents, concepts));
    }

    @Override
    public boolean recordStoryUsage(String sessionKey, String storyId) {
        return stateStore.recordStoryUsage(sessionKey, storyId);
    }

    @Override
    public boolean reset(String sessionKey) {
        return stateStore.reset(sessionKey);
    }

    @Override
    public boolean reconfigure(String sessionKey, ContextDecayConfig decayConfig) {
        return stateStore.reconfigure(sessionKey, decayConfig);
    }

    @Override
    public int evictInactive(Duration maxIdle) {
        return stateStore.evictInactive(maxIdle);
    }

    @Override
    public SelectionResult select(String sessionKey, Collection<Story> candidates, int limit) {
        return retrievalService.select(sessionKey, candidates, limit);
    }

    @Override
    public SelectionResult processTurn(String sessionKey, String message, int limit) {
        TurnExtractor extractor = extractorProvider.getIfAvailable();
        if (extractor == null) {
            throw new StoryEngineException(StoryEngineErrorCode.EXTRACTOR_MISSING);
        }
        StoryCorpus corpus = corpusProvider.getIfAvailable();
        if (corpus == null) {
            throw new StoryEngineException(StoryEngineErrorCode.CORPUS_MISSING);
        }
        TurnUpdate update = extractor.extract(message);
        stateStore.updateTurn(sessionKey, update);
        List<Story> stories = corpus.stories();
        if (stories == null || stories.isEmpty()) {
            log.warn("No stories found in corpus for session {}", sessionKey);
        }
        return retrievalService.select(sessionKey, stories == null ? List.of() : stories, limit);
    }

    @Override
    public List<String> activeTopics(String sessionKey) {
        return stateStore.find(sessionKey).map(analytics::activeTopics).orElse(List.of());
    }

    @Override
    public UsageStats usageStats(String sessionKey) {
        return stateStore.find(sessionKey)
                .map(analytics::usageStats)
                .orElse(new UsageStats(0, 0, 0d, 0d));
    }

    @Override
    public TopicStability topicStability(String sessionKey) {
        return stateStore.find(sessionKey)
                .map(analytics::topicStability)
                .orElse(new TopicStability(null, 0, 0, 0, false));
    }

    @Override
    public ContextSummary conversationContext(String sessionKey) {
        return stateStore.find(sessionKey)
                .map(summaryFactory::from)
                .orElse(new ContextSummary(null, 0, List.of(), null, List.of(), List.of(), ContextSummary.MATURITY_NEW));
    }

    @Override
    public StateSummary stateSummary(String sessionKey) {
        return stateStore.find(sessionKey)
                .map(analytics::stateSummary)
                .orElse(new StateSummary(null, sessionKey, 0, List.of(), null, 0, 0, null));
    }

    @Override
    public boolean shouldResetContext(String sessionKey) {
        return stateStore.find(sessionKey).map(analytics::shouldResetContext).orElse(false);
    }

    @Override
    public RelevanceInsights insights(SelectionResult result) {
        return analytics.insights(result);
    }

    @Override
    public byte[] checkpoint(String sessionKey) {
        ConversationState state = stateStore.find(sessionKey)
                .orElseThrow(() -> new StoryEngineException(StoryEngineErrorCode.SESSION_NOT_FOUND, "No session for key " + sessionKey));
        return codec.serialize(state);
    }

    @Override
    public ConversationState restore(byte[] checkpoint) {
        ConversationState state = codec.deserialize(checkpoint);
        stateStore.restore(state);
        return state;
    }
}
