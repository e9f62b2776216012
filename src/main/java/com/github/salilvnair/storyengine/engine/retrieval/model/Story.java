package com.github.salilvnair.storyengine.engine.retrieval.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class Story {
    private String id;
    private String title;
    private String content;
    private StoryMetadata metadata;

    public boolean hasMetadata() {
        return metadata != null;
    }

    public Integer confidence() {
        return metadata == null ? null : metadata.getConfidence();
    }
}
