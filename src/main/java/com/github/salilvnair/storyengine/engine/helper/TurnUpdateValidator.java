package com.github.salilvnair.storyengine.engine.helper;

import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.state.model.ContextDecayConfig;
import com.github.salilvnair.storyengine.engine.state.model.TurnUpdate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@Component
public class TurnUpdateValidator {

    private final StoryEngineConfig config;

    /**
     * Returns a trimmed copy of the update or throws {@code INVALID_TURN_INPUT}. Nothing is mutated
     * before this passes.
     */
    public TurnUpdate normalize(String sessionKey, TurnUpdate update) {
        requireSessionKey(sessionKey);
        TurnUpdate input = update == null ? TurnUpdate.empty() : update;
        Map<String, Object> violations = new LinkedHashMap<>();
        List<String> topics = labels("topics", input.topics(), violations);
        List<String> intents = labels("intents", input.intents(), violations);
        List<String> concepts = labels("concepts", input.concepts(), violations);
        if (!violations.isEmpty()) {
            throw new StoryEngineException(StoryEngineErrorCode.INVALID_TURN_INPUT,
                    "Invalid turn input for session " + sessionKey + ": " + violations.keySet())
                    .withMetaData(violations);
        }
        return new TurnUpdate(topics, intents, concepts);
    }

    public void requireSessionKey(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new StoryEngineException(StoryEngineErrorCode.INVALID_TURN_INPUT, "Session key cannot be blank");
        }
    }

    public void validateDecayConfig(ContextDecayConfig decayConfig) {
        if (decayConfig == null
                || decayConfig.getTopicDecayThreshold() < 0
                || decayConfig.getConceptDecayThreshold() < 0
                || decayConfig.getStoryRepetitionPenaltyBase() <= 0d) {
            throw new StoryEngineException(StoryEngineErrorCode.INVALID_DECAY_CONFIG,
                    "Decay thresholds must be non-negative and the penalty base positive: " + decayConfig);
        }
    }

    private List<String> labels(String field, List<String> raw, Map<String, Object> violations) {
        int maxLength = config.getState().getMaxLabelLength();
        List<String> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String label = raw.get(i);
            if (label == null || label.isBlank()) {
                violations.put(field + "[" + i + "]", "blank");
                continue;
            }
            String trimmed = label.trim();
            if (trimmed.length() > maxLength) {
                violations.put(field + "[" + i + "]", "longer than " + maxLength);
                continue;
            }
            out.add(trimmed);
        }
        return out;
    }
}
