package com.robobracket.dto;

import com.robobracket.model.BracketSide;
import com.robobracket.model.BracketStatus;
import com.robobracket.model.GameSlot;
import com.robobracket.model.GameSlotSource;
import com.robobracket.model.GameStatus;
import com.robobracket.model.SlotRef;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class BracketResponses {

    private BracketResponses() {
    }

    public record BracketSummary(
            UUID bracketId,
            Long eventId,
            String name,
            Integer bracketSize,
            BracketStatus status,
            Integer teamCount,
            Integer gamesCompleted,
            Integer gamesTotal,
            Long championTeamId,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record BracketDetail(
            UUID bracketId,
            Long eventId,
            String name,
            Integer bracketSize,
            BracketStatus status,
            Long championTeamId,
            List<Entry> entries,
            List<Game> games,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record Entry(
            Integer seedPosition,
            Long teamId,
            Boolean bye
    ) {
    }

    public record Game(
            Integer gameNumber,
            String roundName,
            Integer roundNumber,
            BracketSide side,
            GameSlotSource team1Source,
            GameSlotSource team2Source,
            Long team1Id,
            Long team2Id,
            GameStatus status,
            Long winnerId,
            Long loserId,
            SlotRef winnerAdvancesTo,
            SlotRef loserAdvancesTo,
            Boolean grandFinal,
            Boolean resetGame
    ) {
    }

    public record TemplateGame(
            Integer gameNumber,
            String roundName,
            Integer roundNumber,
            BracketSide side,
            GameSlotSource team1Source,
            GameSlotSource team2Source,
            SlotRef winnerAdvancesTo,
            SlotRef loserAdvancesTo,
            Boolean grandFinal,
            Boolean resetGame
    ) {
    }

    public record Template(
            Integer bracketSize,
            Integer gameCount,
            List<TemplateGame> games
    ) {
    }

    public record SlotUpdate(
            Integer gameNumber,
            GameSlot slot,
            Long teamId
    ) {
    }

    public record GameResult(
            UUID bracketId,
            Integer gameNumber,
            Boolean replay,
            BracketStatus bracketStatus,
            Long championTeamId,
            List<SlotUpdate> slotUpdates,
            List<Game> games
    ) {
    }
}
