package com.github.salilvnair.storyengine.engine.state.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Short-term memory of one conversation. Instances handed out by the state store are detached
 * snapshots; mutating them has no effect on the stored session.
 */
@Data
@NoArgsConstructor
public class ConversationState {

    private String sessionId;
    private String sessionKey;
    private int turnCount;
    private Instant lastUpdated;

    /** Most recent topic first. */
    private List<String> currentTopics = new ArrayList<>();
    /** Oldest intent first. */
    private List<String> userIntentHistory = new ArrayList<>();
    private Map<String, ConceptMention> mentionedConcepts = new LinkedHashMap<>();
    private List<StoryUsage> retrievedStoryHistory = new ArrayList<>();
    private ConversationFlow conversationFlow = new ConversationFlow();
    private ContextDecayConfig contextDecay;

    public static ConversationState create(String sessionKey, ContextDecayConfig contextDecay) {
        ConversationState state = new ConversationState();
        state.sessionId = UUID.randomUUID().toString();
        state.sessionKey = sessionKey;
        state.lastUpdated = Instant.now();
        state.contextDecay = contextDecay;
        return state;
    }

    @JsonIgnore
    public String dominantTheme() {
        return conversationFlow == null ? null : conversationFlow.getDominantTheme();
    }

    @JsonIgnore
    public String latestIntent() {
        return userIntentHistory.isEmpty() ? null : userIntentHistory.get(userIntentHistory.size() - 1);
    }

    public List<String> recentIntents(int max) {
        int from = Math.max(0, userIntentHistory.size() - Math.max(0, max));
        return List.copyOf(userIntentHistory.subList(from, userIntentHistory.size()));
    }

    /** Turn of the most recent telling of the story, empty when it was never told. */
    public OptionalInt lastToldTurn(String storyId) {
        int last = -1;
        boolean found = false;
        for (StoryUsage usage : retrievedStoryHistory) {
            if (storyId.equals(usage.getStoryId()) && (!found || usage.getToldAtTurn() >= last)) {
                last = usage.getToldAtTurn();
                found = true;
            }
        }
        return found ? OptionalInt.of(last) : OptionalInt.empty();
    }

    public ConversationState copy() {
        ConversationState copy = new ConversationState();
        copy.sessionId = sessionId;
        copy.sessionKey = sessionKey;
        copy.turnCount = turnCount;
        copy.lastUpdated = lastUpdated;
        copy.currentTopics = currentTopics == null ? new ArrayList<>() : new ArrayList<>(currentTopics);
        copy.userIntentHistory = userIntentHistory == null ? new ArrayList<>() : new ArrayList<>(userIntentHistory);
        Map<String, ConceptMention> concepts = new LinkedHashMap<>();
        if (mentionedConcepts != null) {
            mentionedConcepts.forEach((label, mention) -> concepts.put(label, mention.copy()));
        }
        copy.mentionedConcepts = concepts;
        List<StoryUsage> history = new ArrayList<>();
        if (retrievedStoryHistory != null) {
            retrievedStoryHistory.forEach(u -> history.add(new StoryUsage(u.getStoryId(), u.getToldAtTurn())));
        }
        copy.retrievedStoryHistory = history;
        copy.conversationFlow = conversationFlow == null ? new ConversationFlow() : conversationFlow.copy();
        copy.contextDecay = contextDecay == null ? null : contextDecay.copy();
        return copy;
    }
}
