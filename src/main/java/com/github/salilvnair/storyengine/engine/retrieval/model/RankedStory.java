package com.github.salilvnair.storyengine.engine.retrieval.model;

public record RankedStory(Story story, ScoreBreakdown breakdown) {

    public String storyId() {
        return story.getId();
    }

    public double finalScore() {
        return breakdown.finalScore();
    }
}
