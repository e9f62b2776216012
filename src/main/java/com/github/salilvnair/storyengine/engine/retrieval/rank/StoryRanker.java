package com.github.salilvnair.storyengine.engine.retrieval.rank;

import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.retrieval.filter.MetadataFilterResult;
import com.github.salilvnair.storyengine.engine.retrieval.model.RankedStory;
import com.github.salilvnair.storyengine.engine.retrieval.model.ScoreBreakdown;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;
import com.github.salilvnair.storyengine.engine.retrieval.semantic.SemanticScores;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stage 3: blends the stage scores, applies repetition penalties and confidence bonuses, drops
 * everything at or below the relevance threshold and orders the rest.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class StoryRanker {

    static final Comparator<RankedStory> ORDER = Comparator
            .comparingDouble(RankedStory::finalScore).reversed()
            .thenComparing(RankedStory::storyId);

    private final StoryEngineConfig config;

    public ScoreBreakdown breakdown(ConversationState state, Story story, double metadataScore,
                                    double semanticScore, boolean semanticAvailable, String reasoning) {
        StoryEngineConfig.Ranking ranking = config.getRanking();
        double baseScore = semanticAvailable
                ? ranking.getMetadataWeight() * metadataScore + ranking.getSemanticWeight() * semanticScore
                : metadataScore;
        double multiplier = RepetitionPenalty.multiplier(state, story.getId());
        Integer confidence = story.confidence();
        double confidenceBonus = confidence == null ? 0d : ranking.getConfidenceBonusFactor() * confidence;
        double finalScore = baseScore / multiplier + confidenceBonus;
        return new ScoreBreakdown(
                story.getId(),
                metadataScore,
                semanticAvailable ? semanticScore : 0d,
                baseScore,
                multiplier,
                confidenceBonus,
                finalScore,
                reasoning);
    }

    /**
     * Ranks {@code candidates}; the result never holds more than {@code limit} stories, each with a
     * final score above the threshold, and is identical for identical inputs.
     */
    public List<RankedStory> rank(ConversationState state, List<Story> candidates,
                                  MetadataFilterResult metadata, SemanticScores semantic, int limit) {
        double threshold = config.getRanking().getMinRelevanceScore();
        Set<String> seen = new LinkedHashSet<>();
        List<RankedStory> qualifying = new ArrayList<>();
        for (Story story : candidates) {
            if (!seen.add(story.getId())) {
                continue;
            }
            ScoreBreakdown breakdown = breakdown(state, story,
                    metadata.scoreOf(story.getId()),
                    semantic.scoreOf(story.getId()),
                    semantic.available(),
                    semantic.reasoningOf(story.getId()));
            if (breakdown.finalScore() > threshold) {
                qualifying.add(new RankedStory(story, breakdown));
            } else {
                log.debug("Story {} below relevance threshold: {}", story.getId(), breakdown.summary());
            }
        }
        qualifying.sort(ORDER);
        List<RankedStory> selected = qualifying.size() > limit ? List.copyOf(qualifying.subList(0, limit)) : List.copyOf(qualifying);
        for (int i = 0; i < Math.min(3, selected.size()); i++) {
            RankedStory ranked = selected.get(i);
            log.debug("Rank {}: Story {} - Score: {} - {}", i + 1, ranked.storyId(),
                    String.format("%.2f", ranked.finalScore()), ranked.breakdown().summary());
        }
        return selected;
    }
}
