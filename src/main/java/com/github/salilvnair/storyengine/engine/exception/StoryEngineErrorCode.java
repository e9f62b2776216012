package com.github.salilvnair.storyengine.engine.exception;

public enum StoryEngineErrorCode {

    // =========================
    // Input validation errors
    // =========================
    INVALID_TURN_INPUT(
            "Turn update contains invalid topics, intents or concepts",
            false
    ),

    INVALID_SELECTION_REQUEST(
            "Story selection request is invalid",
            false
    ),

    INVALID_DECAY_CONFIG(
            "Context decay configuration is invalid",
            false
    ),

    // =========================
    // Semantic judge errors
    // =========================
    JUDGE_UNAVAILABLE(
            "No semantic judge is available",
            true
    ),

    JUDGE_CALL_FAILED(
            "Semantic judge call failed",
            true
    ),

    JUDGE_TIMEOUT(
            "Semantic judge call timed out",
            true
    ),

    JUDGE_INVALID_RESPONSE(
            "Semantic judge returned an unparsable or out of range score",
            true
    ),

    // =========================
    // Collaborator errors
    // =========================
    EXTRACTOR_MISSING(
            "No TurnExtractor bean is configured",
            false
    ),

    CORPUS_MISSING(
            "No StoryCorpus bean is configured",
            false
    ),

    // =========================
    // Persistence errors
    // =========================
    STATE_SERIALIZATION_FAILED(
            "Failed to serialize conversation state",
            false
    ),

    STATE_DESERIALIZATION_FAILED(
            "Failed to deserialize conversation state",
            false
    ),

    SESSION_NOT_FOUND(
            "No conversation state exists for the session key",
            false
    ),

    // =========================
    // Selection lifecycle
    // =========================
    SELECTION_CANCELLED(
            "Story selection was cancelled before usage was recorded",
            true
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal engine error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    StoryEngineErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
