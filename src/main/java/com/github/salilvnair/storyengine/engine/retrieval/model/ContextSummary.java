package com.github.salilvnair.storyengine.engine.retrieval.model;

import java.util.List;

/**
 * The conversation as the semantic judge sees it. Built from a state snapshot so no lock is held
 * while the judge runs.
 */
public record ContextSummary(
        String sessionId,
        int turnCount,
        List<String> currentTopics,
        String dominantTheme,
        List<String> recentIntents,
        List<String> keyConcepts,
        String conversationMaturity
) {
    public static final String MATURITY_NEW = "new";
    public static final String MATURITY_ESTABLISHED = "established";

    public ContextSummary {
        currentTopics = currentTopics == null ? List.of() : List.copyOf(currentTopics);
        recentIntents = recentIntents == null ? List.of() : List.copyOf(recentIntents);
        keyConcepts = keyConcepts == null ? List.of() : List.copyOf(keyConcepts);
    }

    public String render() {
        return "Current Topics: " + String.join(", ", currentTopics) + "\n"
                + "Dominant Theme: " + (dominantTheme == null ? "" : dominantTheme) + "\n"
                + "Recent User Intents: " + String.join(", ", recentIntents) + "\n"
                + "Key Concepts: " + String.join(", ", keyConcepts) + "\n"
                + "Conversation Maturity: " + conversationMaturity;
    }
}
