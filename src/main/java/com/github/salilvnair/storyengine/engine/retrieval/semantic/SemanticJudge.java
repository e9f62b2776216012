package com.github.salilvnair.storyengine.engine.retrieval.semantic;

import com.github.salilvnair.storyengine.engine.retrieval.model.ContextSummary;
import com.github.salilvnair.storyengine.engine.retrieval.model.JudgeVerdict;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;

/**
 * Remote relevance judge. Implementations may block, throw, or return garbage; the engine treats all
 * of those as a reason to fall back to metadata-only scoring.
 */
@FunctionalInterface
public interface SemanticJudge {
    JudgeVerdict judge(ContextSummary context, Story story);
}
