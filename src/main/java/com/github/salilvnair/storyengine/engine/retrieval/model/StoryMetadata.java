package com.github.salilvnair.storyengine.engine.retrieval.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Psychological analysis attached to a story by the extraction pipeline. Every field is optional.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class StoryMetadata {
    private String triggerCategory;
    private String triggerDescription;
    private List<String> emotions;
    private String internalMonologue;
    private String violatedValue;
    /** 1 to 5 when present. */
    private Integer confidence;

    public List<String> emotionsOrEmpty() {
        return emotions == null ? List.of() : emotions;
    }
}
