package com.github.salilvnair.storyengine.engine.retrieval.model;

import java.util.List;

public record SelectionResult(
        String sessionKey,
        int turn,
        List<RankedStory> stories,
        SelectionStatus status,
        int candidateCount,
        int filteredCount
) {
    public SelectionResult {
        stories = stories == null ? List.of() : List.copyOf(stories);
    }

    public boolean degraded() {
        return status == SelectionStatus.DEGRADED;
    }

    public boolean isEmpty() {
        return stories.isEmpty();
    }

    public List<String> storyIds() {
        return stories.stream().map(RankedStory::storyId).toList();
    }
}
