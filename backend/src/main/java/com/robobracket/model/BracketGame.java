package com.robobracket.model;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * An instantiated game of a bracket. Engines only ever mutate copies obtained through {@link #copy()}.
 */
@Getter
@Setter
public class BracketGame {

    private int gameNumber;
    private String roundName;
    private int roundNumber;
    private BracketSide side;
    private GameSlotSource team1Source;
    private GameSlotSource team2Source;
    private Long team1Id;
    private Long team2Id;
    private GameStatus status = GameStatus.PENDING;
    private Long winnerId;
    private Long loserId;
    private SlotRef winnerAdvancesTo;
    private SlotRef loserAdvancesTo;
    private boolean grandFinal;
    private boolean resetGame;

    public static BracketGame fromTemplate(GameTemplate template) {
        BracketGame game = new BracketGame();
        game.setGameNumber(template.gameNumber());
        game.setRoundName(template.roundName());
        game.setRoundNumber(template.roundNumber());
        game.setSide(template.side());
        game.setTeam1Source(template.team1Source());
        game.setTeam2Source(template.team2Source());
        game.setWinnerAdvancesTo(template.winnerAdvancesTo());
        game.setLoserAdvancesTo(template.loserAdvancesTo());
        game.setGrandFinal(template.grandFinal());
        game.setResetGame(template.resetGame());
        return game;
    }

    public BracketGame copy() {
        BracketGame copy = new BracketGame();
        copy.gameNumber = gameNumber;
        copy.roundName = roundName;
        copy.roundNumber = roundNumber;
        copy.side = side;
        copy.team1Source = team1Source;
        copy.team2Source = team2Source;
        copy.team1Id = team1Id;
        copy.team2Id = team2Id;
        copy.status = status;
        copy.winnerId = winnerId;
        copy.loserId = loserId;
        copy.winnerAdvancesTo = winnerAdvancesTo;
        copy.loserAdvancesTo = loserAdvancesTo;
        copy.grandFinal = grandFinal;
        copy.resetGame = resetGame;
        return copy;
    }

    public Long getTeam(GameSlot slot) {
        return slot == GameSlot.TEAM1 ? team1Id : team2Id;
    }

    public void setTeam(GameSlot slot, Long teamId) {
        if (slot == GameSlot.TEAM1) {
            team1Id = teamId;
        } else {
            team2Id = teamId;
        }
    }

    public GameSlotSource getSource(GameSlot slot) {
        return slot == GameSlot.TEAM1 ? team1Source : team2Source;
    }

    public boolean hasBothTeams() {
        return team1Id != null && team2Id != null;
    }

    public boolean isParticipant(Long teamId) {
        return teamId != null && (teamId.equals(team1Id) || teamId.equals(team2Id));
    }

    public Long opponentOf(Long teamId) {
        if (Objects.equals(teamId, team1Id)) {
            return team2Id;
        }
        if (Objects.equals(teamId, team2Id)) {
            return team1Id;
        }
        return null;
    }
}
