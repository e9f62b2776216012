package com.github.salilvnair.storyengine.engine.retrieval;

import com.github.salilvnair.storyengine.audit.AuditService;
import com.github.salilvnair.storyengine.audit.StoryEngineAuditStage;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.helper.ContextSummaryFactory;
import com.github.salilvnair.storyengine.engine.retrieval.filter.MetadataFilter;
import com.github.salilvnair.storyengine.engine.retrieval.filter.MetadataFilterResult;
import com.github.salilvnair.storyengine.engine.retrieval.model.ContextSummary;
import com.github.salilvnair.storyengine.engine.retrieval.model.RankedStory;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionResult;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionStatus;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;
import com.github.salilvnair.storyengine.engine.retrieval.rank.StoryRanker;
import com.github.salilvnair.storyengine.engine.retrieval.semantic.SemanticScorer;
import com.github.salilvnair.storyengine.engine.retrieval.semantic.SemanticScores;
import com.github.salilvnair.storyengine.engine.state.ConversationStateStore;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the three stages for one turn. The session lock is only held to snapshot the state and,
 * at the very end, to record which stories were selected.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class StoryRetrievalService {

    private final ConversationStateStore stateStore;
    private final MetadataFilter metadataFilter;
    private final SemanticScorer semanticScorer;
    private final StoryRanker ranker;
    private final ContextSummaryFactory summaryFactory;
    private final AuditService audit;

    /**
     * Selects up to {@code limit} stories for the session's current turn and records them as told.
     */
    public SelectionResult select(String sessionKey, Collection<Story> candidates, int limit) {
        requirePositiveLimit(limit);
        ConversationState snapshot = stateStore.getOrCreate(sessionKey);
        SelectionResult result;
        try {
            result = rank(snapshot, candidates, limit);
            if (Thread.currentThread().isInterrupted()) {
                throw new StoryEngineException(StoryEngineErrorCode.SELECTION_CANCELLED,
                        "Selection cancelled before usage was recorded");
            }
        } catch (StoryEngineException e) {
            if (e.is(StoryEngineErrorCode.SELECTION_CANCELLED)) {
                audit.audit(StoryEngineAuditStage.SELECTION_CANCELLED, sessionKey, Map.of("turn", snapshot.getTurnCount()));
            }
            throw e;
        }
        if (!result.isEmpty()) {
            stateStore.recordStoryUsages(sessionKey, snapshot.getSessionId(), snapshot.getTurnCount(), result.storyIds());
        }
        return result;
    }

    /**
     * Ranks candidates against a state snapshot without touching the store.
     */
    public SelectionResult rank(ConversationState state, Collection<Story> candidates, int limit) {
        requirePositiveLimit(limit);
        if (state == null) {
            throw new StoryEngineException(StoryEngineErrorCode.INVALID_SELECTION_REQUEST, "Conversation state is required");
        }
        List<Story> pool = distinct(candidates);
        String sessionKey = state.getSessionKey();

        MetadataFilterResult metadata = metadataFilter.filter(state, pool);
        Map<String, Object> filterPayload = new LinkedHashMap<>();
        filterPayload.put("candidates", pool.size());
        filterPayload.put("passed", metadata.passed().size());
        filterPayload.put("fallback", metadata.fallback());
        audit.audit(StoryEngineAuditStage.METADATA_FILTERED, sessionKey, filterPayload);

        ContextSummary summary = summaryFactory.from(state);
        SemanticScores semantic = semanticScorer.scoreAll(summary, metadata.passed());
        if (!semantic.available()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("code", semantic.failureCode());
            payload.put("reason", semantic.failureReason());
            audit.audit(StoryEngineAuditStage.SEMANTIC_DEGRADED, sessionKey, payload);
        }

        // Without the judge every candidate competes on metadata alone.
        List<Story> ranked = semantic.available() ? metadata.passed() : pool;
        List<RankedStory> selected = ranker.rank(state, ranked, metadata, semantic, limit);

        SelectionStatus status = !semantic.available()
                ? SelectionStatus.DEGRADED
                : selected.isEmpty() ? SelectionStatus.EMPTY : SelectionStatus.SELECTED;
        SelectionResult result = new SelectionResult(sessionKey, state.getTurnCount(), selected, status,
                pool.size(), metadata.passed().size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turn", state.getTurnCount());
        payload.put("status", status.name());
        payload.put("storyIds", result.storyIds());
        audit.audit(selected.isEmpty() ? StoryEngineAuditStage.SELECTION_EMPTY : StoryEngineAuditStage.STORIES_SELECTED,
                sessionKey, payload);
        log.info("StoryEngine selected {} stories from {} filtered candidates (session={}, turn={}, status={})",
                selected.size(), metadata.passed().size(), sessionKey, state.getTurnCount(), status);
        return result;
    }

    private void requirePositiveLimit(int limit) {
        if (limit <= 0) {
            throw new StoryEngineException(StoryEngineErrorCode.INVALID_SELECTION_REQUEST,
                    "Selection limit must be positive, was " + limit);
        }
    }

    private List<Story> distinct(Collection<Story> candidates) {
        if (candidates == null) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        List<Story> out = new ArrayList<>();
        for (Story story : candidates) {
            if (story != null && story.getId() != null && ids.add(story.getId())) {
                out.add(story);
            }
        }
        return out;
    }
}
