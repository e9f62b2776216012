package com.github.salilvnair.storyengine.analytics.model;

import com.github.salilvnair.storyengine.engine.retrieval.model.ScoreBreakdown;

public record StoryInsight(
        int rank,
        String storyId,
        String title,
        double relevanceScore,
        ScoreBreakdown scoreBreakdown,
        String selectionReasoning,
        boolean hasMetadata
) {
}
