package com.github.salilvnair.storyengine.engine.extraction;

import com.github.salilvnair.storyengine.engine.state.model.TurnUpdate;

/**
 * Turns a raw user message into topics, intents and concepts. Provided by the application.
 */
@FunctionalInterface
public interface TurnExtractor {
    TurnUpdate extract(String message);
}
