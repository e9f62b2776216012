package com.github.salilvnair.storyengine.engine.retrieval.semantic;

import com.github.salilvnair.storyengine.engine.retrieval.model.JudgeVerdict;

import java.util.Map;

/**
 * Outcome of the semantic stage for one selection. When {@code available} is false the verdicts are
 * empty and ranking falls back to metadata only.
 */
public record SemanticScores(Map<String, JudgeVerdict> verdicts, boolean available, String failureCode, String failureReason) {

    public static SemanticScores available(Map<String, JudgeVerdict> verdicts) {
        return new SemanticScores(Map.copyOf(verdicts), true, null, null);
    }

    public static SemanticScores unavailable(String failureCode, String failureReason) {
        return new SemanticScores(Map.of(), false, failureCode, failureReason);
    }

    public double scoreOf(String storyId) {
        JudgeVerdict verdict = verdicts.get(storyId);
        return verdict == null ? 0d : verdict.score();
    }

    public String reasoningOf(String storyId) {
        JudgeVerdict verdict = verdicts.get(storyId);
        return verdict == null ? null : verdict.reasoning();
    }
}
