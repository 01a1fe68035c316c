package com.robobracket.engine;

import com.robobracket.model.BracketGame;
import com.robobracket.model.GameSlot;

import java.util.List;

public record AdvancementResult(
        List<BracketGame> games,
        List<SlotUpdate> slotUpdates,
        ByeResolutionResult resolution
) {

    public record SlotUpdate(
            int gameNumber,
            GameSlot slot,
            long teamId
    ) {
    }
}
