package com.github.salilvnair.storyengine.engine.state.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ConceptMention {
    private int count;
    private int firstTurn;
    private int lastTurn;

    public static ConceptMention firstSeen(int turn) {
        return new ConceptMention(1, turn, turn);
    }

    public void mentionedAgain(int turn) {
        this.count++;
        this.lastTurn = turn;
    }

    public ConceptMention copy() {
        return new ConceptMention(count, firstTurn, lastTurn);
    }
}
