package com.robobracket.model;

import java.util.Objects;

/**
 * Advancement target: a slot of another game in the same bracket.
 */
public record SlotRef(
        int gameNumber,
        GameSlot slot
) {
    public SlotRef {
        if (gameNumber < 1) {
            throw new IllegalArgumentException("gameNumber must be positive: " + gameNumber);
        }
        Objects.requireNonNull(slot, "slot is required");
    }

    public static SlotRef team1(int gameNumber) {
        return new SlotRef(gameNumber, GameSlot.TEAM1);
    }

    public static SlotRef team2(int gameNumber) {
        return new SlotRef(gameNumber, GameSlot.TEAM2);
    }
}
