package com.github.salilvnair.storyengine.engine.state.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class StoryUsage {
    private String storyId;
    private int toldAtTurn;
}
