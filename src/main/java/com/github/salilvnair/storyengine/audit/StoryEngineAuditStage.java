package com.github.salilvnair.storyengine.audit;

public enum StoryEngineAuditStage {
    SESSION_CREATED,
    TURN_UPDATED,
    TURN_REJECTED,
    STORY_USAGE_RECORDED,
    SESSION_RESET,
    SESSION_RECONFIGURED,
    SESSION_RESTORED,
    SESSIONS_EVICTED,
    METADATA_FILTERED,
    SEMANTIC_DEGRADED,
    STORIES_SELECTED,
    SELECTION_EMPTY,
    SELECTION_CANCELLED;

    public String value() {
        return name();
    }
}
