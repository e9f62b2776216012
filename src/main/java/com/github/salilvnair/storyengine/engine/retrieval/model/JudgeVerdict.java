package com.github.salilvnair.storyengine.engine.retrieval.model;

public record JudgeVerdict(double score, String reasoning) {
}
