package com.github.salilvnair.storyengine.engine.retrieval.filter;

import com.github.salilvnair.storyengine.engine.retrieval.model.Story;

import java.util.List;
import java.util.Map;

/**
 * @param scores   metadata score of every candidate, keyed by story id
 * @param passed   candidates handed to the semantic stage
 * @param fallback true when nothing cleared the minimum and every candidate was passed on
 */
public record MetadataFilterResult(Map<String, Double> scores, List<Story> passed, boolean fallback) {

    public double scoreOf(String storyId) {
        Double score = scores.get(storyId);
        return score == null ? 0d : score;
    }
}
