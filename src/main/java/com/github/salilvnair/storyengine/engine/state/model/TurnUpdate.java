package com.github.salilvnair.storyengine.engine.state.model;

import java.util.List;

/**
 * What the extraction capability found in one user message.
 */
public record TurnUpdate(
        List<String> topics,
        List<String> intents,
        List<String> concepts
) {
    public TurnUpdate {
        topics = topics == null ? List.of() : topics;
        intents = intents == null ? List.of() : intents;
        concepts = concepts == null ? List.of() : concepts;
    }

    public static TurnUpdate empty() {
        return new TurnUpdate(List.of(), List.of(), List.of());
    }
}
