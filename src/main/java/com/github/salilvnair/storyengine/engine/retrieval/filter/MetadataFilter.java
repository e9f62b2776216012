package com.github.salilvnair.storyengine.engine.retrieval.filter;

import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.decay.ContextDecay;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;
import com.github.salilvnair.storyengine.engine.retrieval.model.StoryMetadata;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stage 1: cheap, explainable alignment between structured story metadata and the conversation.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class MetadataFilter {

    private final StoryEngineConfig config;

    public double score(ConversationState state, Story story) {
        if (story == null || !story.hasMetadata()) {
            return 0d;
        }
        StoryEngineConfig.Metadata weights = config.getMetadata();
        StoryMetadata metadata = story.getMetadata();
        List<String> topics = ContextDecay.activeTopics(state);
        List<String> concepts = ContextDecay.activeConceptLabels(state);
        List<String> emotions = lower(metadata.emotionsOrEmpty());

        double score = 0d;

        if (containsIgnoreCase(weights.getWorkCategories(), metadata.getTriggerCategory())
                && topics.stream().anyMatch(topic -> containsAnyCue(topic, weights.getWorkCues()))) {
            score += weights.getWorkAlignmentWeight();
        }

        String description = lower(metadata.getTriggerDescription());
        if (!description.isEmpty()) {
            for (String topic : topics) {
                if (anyWordIn(topic, description)) {
                    score += weights.getTriggerKeywordWeight();
                }
            }
        }

        if (!emotions.isEmpty()) {
            if (containsIgnoreCase(weights.getAdviceIntents(), state.latestIntent())
                    && lower(weights.getNegativeEmotions()).stream().anyMatch(emotions::contains)) {
                score += weights.getAdviceEmotionWeight();
            }
            List<String> recent = state.recentIntents(config.getState().getRecentIntentsInSummary());
            if (recent.stream().anyMatch(intent -> containsIgnoreCase(weights.getStoryRequestIntents(), intent))) {
                score += weights.getStoryRequestWeight();
            }
        }

        String violatedValue = lower(metadata.getViolatedValue());
        Integer confidence = metadata.getConfidence();
        if (!violatedValue.isEmpty() && confidence != null) {
            for (String concept : concepts) {
                if (violatedValue.contains(concept.toLowerCase(Locale.ROOT))) {
                    score += confidence * weights.getValueConfidenceFactor();
                }
            }
        }

        String monologue = lower(metadata.getInternalMonologue());
        if (!monologue.isEmpty()) {
            for (String concept : concepts) {
                if (monologue.contains(concept.toLowerCase(Locale.ROOT))) {
                    score += weights.getMonologueConceptWeight();
                }
            }
        }
        return Math.max(0d, score);
    }

    /**
     * Scores every candidate and keeps the ones above the configured minimum. When none qualify all
     * candidates are passed on, so this stage never gates alone.
     */
    public MetadataFilterResult filter(ConversationState state, Collection<Story> stories) {
        Map<String, Double> scores = new LinkedHashMap<>();
        List<Story> passed = new ArrayList<>();
        List<Story> all = new ArrayList<>();
        double min = config.getMetadata().getMinMetadataScore();
        for (Story story : stories) {
            if (story == null || story.getId() == null) {
                continue;
            }
            double score = score(state, story);
            scores.put(story.getId(), score);
            all.add(story);
            if (score > min) {
                passed.add(story);
            }
        }
        boolean fallback = passed.isEmpty() && !all.isEmpty();
        if (fallback) {
            log.info("No stories passed metadata filtering, passing all {} candidates on", all.size());
        } else {
            log.info("Filtered {} stories from {} based on metadata", passed.size(), all.size());
        }
        return new MetadataFilterResult(scores, fallback ? all : passed, fallback);
    }

    private static boolean containsAnyCue(String topic, List<String> cues) {
        String lowered = lower(topic);
        return cues.stream().anyMatch(cue -> !cue.isBlank() && lowered.contains(cue.toLowerCase(Locale.ROOT)));
    }

    private static boolean anyWordIn(String topic, String text) {
        for (String word : lower(topic).split("\\s+")) {
            if (!word.isBlank() && text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        return candidate != null && values.stream().anyMatch(v -> v.equalsIgnoreCase(candidate.trim()));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static List<String> lower(List<String> values) {
        return values.stream().filter(v -> v != null).map(v -> v.trim().toLowerCase(Locale.ROOT)).toList();
    }
}
