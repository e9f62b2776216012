package com.github.salilvnair.storyengine.llm.core;

public interface LlmClient {
    String generateText(String hint, String contextJson);

    default String generateText(String systemPrompt, String userPrompt, String contextJson) {
        return generateText(systemPrompt + "\n\n" + userPrompt, contextJson);
    }
}
