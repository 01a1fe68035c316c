package com.robobracket.model;

/**
 * One node of a double-elimination game graph for a given bracket size.
 * {@code roundNumber} is the dependency depth of the game: every referenced game has a smaller one.
 */
public record GameTemplate(
        int bracketSize,
        int gameNumber,
        String roundName,
        int roundNumber,
        BracketSide side,
        GameSlotSource team1Source,
        GameSlotSource team2Source,
        SlotRef winnerAdvancesTo,
        SlotRef loserAdvancesTo,
        boolean grandFinal,
        boolean resetGame
) {

    public GameSlotSource sourceFor(GameSlot slot) {
        return slot == GameSlot.TEAM1 ? team1Source : team2Source;
    }
}
