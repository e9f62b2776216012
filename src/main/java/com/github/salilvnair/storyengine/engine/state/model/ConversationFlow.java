package com.github.salilvnair.storyengine.engine.state.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ConversationFlow {
    private String dominantTheme;
    private int themeStabilityCount;
    private int lastTopicShiftTurn;
    private int lastRefreshedTurn;

    public ConversationFlow copy() {
        return new ConversationFlow(dominantTheme, themeStabilityCount, lastTopicShiftTurn, lastRefreshedTurn);
    }
}
