package com.github.salilvnair.storyengine.analytics.model;

import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionStatus;

import java.util.List;

public record RelevanceInsights(
        SelectionStatus status,
        int totalCandidates,
        int filteredCandidates,
        List<StoryInsight> topStories,
        double highestScore,
        double lowestScore
) {
    public boolean hasRelevantStories() {
        return !topStories.isEmpty();
    }
}
