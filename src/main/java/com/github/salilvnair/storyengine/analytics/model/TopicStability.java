package com.github.salilvnair.storyengine.analytics.model;

public record TopicStability(
        String dominantTheme,
        int stabilityCount,
        int lastTopicShiftTurn,
        int turnsSinceShift,
        boolean stale
) {
}
