package com.github.salilvnair.storyengine.engine.retrieval.model;

public record ScoreBreakdown(
        String storyId,
        double metadataScore,
        double semanticScore,
        double baseScore,
        double repetitionMultiplier,
        double confidenceBonus,
        double finalScore,
        String reasoning
) {
    public String summary() {
        return String.format("Metadata: %.1f, Semantic: %.1f, Penalty: %.1fx, Bonus: %.1f",
                metadataScore, semanticScore, repetitionMultiplier, confidenceBonus);
    }
}
