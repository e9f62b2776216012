package com.github.salilvnair.storyengine.engine.retrieval.model;

public enum SelectionStatus {
    /** Full pipeline, at least one story returned. */
    SELECTED,
    /** Semantic stage unavailable; scores are metadata only. May still be empty. */
    DEGRADED,
    /** Full pipeline, nothing cleared the relevance threshold. */
    EMPTY
}
