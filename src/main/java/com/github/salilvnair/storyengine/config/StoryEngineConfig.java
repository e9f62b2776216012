package com.github.salilvnair.storyengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "storyengine")
@Getter
@Setter
public class StoryEngineConfig {

    private State state = new State();
    private Decay decay = new Decay();
    private Metadata metadata = new Metadata();
    private Semantic semantic = new Semantic();
    private Ranking ranking = new Ranking();

    @Getter
    @Setter
    public static class State {
        private int maxTopics = 5;
        private int maxIntents = 5;
        private int maxLabelLength = 200;
        private int maturityTurnThreshold = 5;
        private int recentIntentsInSummary = 3;
        private int resetAfterTurns = 50;
    }

    @Getter
    @Setter
    public static class Decay {
        private int topicDecayThreshold = 3;
        private int conceptDecayThreshold = 5;
        private double storyRepetitionPenaltyBase = 1.0d;
    }

    @Getter
    @Setter
    public static class Metadata {
        private double minMetadataScore = 0.5d;
        private double workAlignmentWeight = 1.5d;
        private double adviceEmotionWeight = 2.0d;
        private double valueConfidenceFactor = 0.5d;
        private double triggerKeywordWeight = 2.0d;
        private double storyRequestWeight = 1.0d;
        private double monologueConceptWeight = 1.0d;
        private List<String> workCategories = new ArrayList<>(List.of("Social Interaction", "Stressor"));
        private List<String> workCues = new ArrayList<>(List.of("work"));
        private List<String> adviceIntents = new ArrayList<>(List.of("seek_advice"));
        private List<String> storyRequestIntents = new ArrayList<>(List.of("request_story"));
        private List<String> negativeEmotions = new ArrayList<>(List.of(
                "frustrated", "angry", "stressed", "anxious", "sad", "overwhelmed"));
    }

    @Getter
    @Setter
    public static class Semantic {
        private boolean enabled = true;
        private long timeoutMs = 5000L;
        private int judgeThreads = 4;
        private int maxStoryChars = 800;
        private int maxMonologueChars = 200;
        private String systemPrompt = """
                You are an expert at determining story relevance for conversations.
                You will be given a conversation context and a story with its psychological analysis.
                Score how relevant this story is to the current conversation context on a scale of 0-10.
                Consider topic alignment, emotional resonance, value alignment, fit with the user's
                intent and the potential to enrich the conversation.
                Respond with just a number between 0-10 followed by a brief explanation.""";
        private String userPrompt = """
                Rate the relevance of this story to the current conversation context:

                CONVERSATION CONTEXT:
                [[${context}]]

                STORY WITH ANALYSIS:
                Story Content: [[${content}]]
                - Trigger: [[${trigger}]]
                - Emotions: [[${emotions}]]
                - Internal Thought: [[${thought}]]
                - Violated Value: [[${violatedValue}]]

                Provide a relevance score (0-10) and brief explanation.""";
    }

    @Getter
    @Setter
    public static class Ranking {
        private double metadataWeight = 0.3d;
        private double semanticWeight = 0.7d;
        private double minRelevanceScore = 1.0d;
        private double confidenceBonusFactor = 0.1d;
        private int defaultLimit = 3;
    }
}
