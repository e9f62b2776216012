package com.github.salilvnair.storyengine.analytics.model;

import java.time.Instant;
import java.util.List;

public record StateSummary(
        String sessionId,
        String sessionKey,
        int turnCount,
        List<String> currentTopics,
        String dominantTheme,
        int storiesToldCount,
        int keyConceptsCount,
        Instant lastUpdated
) {
}
