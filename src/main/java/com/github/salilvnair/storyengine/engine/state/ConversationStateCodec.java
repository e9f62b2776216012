package com.github.salilvnair.storyengine.engine.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.state.model.ConceptMention;
import com.github.salilvnair.storyengine.engine.state.model.ContextDecayConfig;
import com.github.salilvnair.storyengine.engine.state.model.ConversationFlow;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import com.github.salilvnair.storyengine.engine.state.model.StoryUsage;
import com.github.salilvnair.storyengine.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checkpoint format for {@link ConversationState}: UTF-8 JSON with snake_case field names. Storage
 * of the bytes belongs to the caller.
 * <p>
 * Absent collections and an absent {@code conversation_flow} are read as empty. A checkpoint that
 * breaks the state invariants (caps, turn ordering, story ids) is rejected rather than restored.
 */
@RequiredArgsConstructor
@Component
public class ConversationStateCodec {

    private final StoryEngineConfig config;

    private final ObjectMapper mapper = JsonUtil.newMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    public byte[] serialize(ConversationState state) {
        if (state == null) {
            throw new StoryEngineException(StoryEngineErrorCode.STATE_SERIALIZATION_FAILED, "Conversation state cannot be null");
        }
        try {
            return mapper.writeValueAsBytes(state);
        } catch (Exception e) {
            throw new StoryEngineException(StoryEngineErrorCode.STATE_SERIALIZATION_FAILED,
                    "Failed to serialize state for session " + state.getSessionKey(), e);
        }
    }

    public ConversationState deserialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw invalid("Checkpoint is empty");
        }
        ConversationState state;
        try {
            state = mapper.readValue(bytes, ConversationState.class);
        } catch (Exception e) {
            throw new StoryEngineException(StoryEngineErrorCode.STATE_DESERIALIZATION_FAILED,
                    "Failed to deserialize conversation state", e);
        }
        if (state == null || state.getSessionKey() == null || state.getSessionKey().isBlank()) {
            throw invalid("Checkpoint has no session_key");
        }
        normalize(state);
        validate(state);
        return state;
    }

    private void normalize(ConversationState state) {
        if (state.getCurrentTopics() == null) {
            state.setCurrentTopics(new ArrayList<>());
        }
        if (state.getUserIntentHistory() == null) {
            state.setUserIntentHistory(new ArrayList<>());
        }
        if (state.getMentionedConcepts() == null) {
            state.setMentionedConcepts(new LinkedHashMap<>());
        }
        if (state.getRetrievedStoryHistory() == null) {
            state.setRetrievedStoryHistory(new ArrayList<>());
        }
        if (state.getConversationFlow() == null) {
            state.setConversationFlow(new ConversationFlow());
        }
    }

    private void validate(ConversationState state) {
        int turn = state.getTurnCount();
        if (turn < 0) {
            throw invalid("turn_count is negative: " + turn);
        }
        StoryEngineConfig.State caps = config.getState();
        requireLabels("current_topics", state.getCurrentTopics(), caps.getMaxTopics());
        requireLabels("user_intent_history", state.getUserIntentHistory(), caps.getMaxIntents());
        for (Map.Entry<String, ConceptMention> entry : state.getMentionedConcepts().entrySet()) {
            ConceptMention mention = entry.getValue();
            if (mention == null) {
                throw invalid("Concept '" + entry.getKey() + "' has no mention data");
            }
            if (mention.getCount() < 1 || mention.getFirstTurn() > mention.getLastTurn() || mention.getLastTurn() > turn) {
                throw invalid("Concept '" + entry.getKey() + "' has inconsistent turns " + mention + " for turn_count " + turn);
            }
        }
        for (StoryUsage usage : state.getRetrievedStoryHistory()) {
            if (usage == null || usage.getStoryId() == null || usage.getStoryId().isBlank()) {
                throw invalid("retrieved_story_history contains an entry without story_id");
            }
            if (usage.getToldAtTurn() < 0 || usage.getToldAtTurn() > turn) {
                throw invalid("Story '" + usage.getStoryId() + "' told at turn " + usage.getToldAtTurn() + " outside 0.." + turn);
            }
        }
        ContextDecayConfig decay = state.getContextDecay();
        if (decay != null && (decay.getTopicDecayThreshold() < 0
                || decay.getConceptDecayThreshold() < 0
                || decay.getStoryRepetitionPenaltyBase() <= 0d)) {
            throw invalid("context_decay is invalid: " + decay);
        }
    }

    private void requireLabels(String field, List<String> labels, int max) {
        if (labels.size() > max) {
            throw invalid(field + " holds " + labels.size() + " entries, at most " + max + " allowed");
        }
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                throw invalid(field + " contains a blank entry");
            }
        }
    }

    private StoryEngineException invalid(String message) {
        return new StoryEngineException(StoryEngineErrorCode.STATE_DESERIALIZATION_FAILED, message);
    }
}
