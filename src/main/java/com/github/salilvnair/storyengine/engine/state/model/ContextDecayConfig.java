package com.github.salilvnair.storyengine.engine.state.model;

import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-session forgetting thresholds. Copied from {@link StoryEngineConfig.Decay} when the session is
 * created and only replaced through an explicit reconfigure call.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ContextDecayConfig {
    private int topicDecayThreshold;
    private int conceptDecayThreshold;
    private double storyRepetitionPenaltyBase;

    public static ContextDecayConfig from(StoryEngineConfig.Decay decay) {
        return new ContextDecayConfig(
                decay.getTopicDecayThreshold(),
                decay.getConceptDecayThreshold(),
                decay.getStoryRepetitionPenaltyBase());
    }

    public ContextDecayConfig copy() {
        return new ContextDecayConfig(topicDecayThreshold, conceptDecayThreshold, storyRepetitionPenaltyBase);
    }
}
