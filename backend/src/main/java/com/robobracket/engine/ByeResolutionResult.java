package com.robobracket.engine;

import com.robobracket.model.BracketGame;

import java.util.List;

public record ByeResolutionResult(
        List<BracketGame> games,
        int byeGamesResolved,
        int slotsFilled,
        int readyGamesUpdated,
        int passes
) {
    public boolean hasChanges() {
        return byeGamesResolved > 0 || slotsFilled > 0 || readyGamesUpdated > 0;
    }
}
