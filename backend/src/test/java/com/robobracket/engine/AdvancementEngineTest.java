package com.robobracket.engine;

import com.robobracket.model.BracketGame;
import com.robobracket.model.GameSlot;
import com.robobracket.model.GameStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.robobracket.engine.BracketFixtures.game;
import static com.robobracket.engine.BracketFixtures.resolved;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdvancementEngineTest {

    private static final long SEED_1 = 101L;
    private static final long SEED_2 = 102L;
    private static final long SEED_3 = 103L;
    private static final long SEED_4 = 104L;

    private AdvancementEngine engine;
    private List<BracketGame> games;

    @BeforeEach
    void setUp() {
        engine = new AdvancementEngine(new ByeResolutionEngine());
        games = resolved(4, SEED_1, SEED_2, SEED_3, SEED_4);
    }

    @Test
    void writesWinnerAndLoserIntoTheirDestinations() {
        AdvancementResult result = engine.advance(games, 1, SEED_1, SEED_4);

        BracketGame played = game(result.games(), 1);
        assertEquals(GameStatus.COMPLETED, played.getStatus());
        assertEquals(SEED_1, played.getWinnerId());
        assertEquals(SEED_4, played.getLoserId());
        assertEquals(SEED_1, game(result.games(), 3).getTeam1Id());
        assertEquals(SEED_4, game(result.games(), 4).getTeam1Id());
        assertEquals(
                List.of(
                        new AdvancementResult.SlotUpdate(3, GameSlot.TEAM1, SEED_1),
                        new AdvancementResult.SlotUpdate(4, GameSlot.TEAM1, SEED_4)
                ),
                result.slotUpdates()
        );
    }

    @Test
    void infersLoserWhenOmitted() {
        AdvancementResult result = engine.advance(games, 2, SEED_3, null);

        assertEquals(SEED_2, game(result.games(), 2).getLoserId());
        assertEquals(SEED_3, game(result.games(), 3).getTeam2Id());
        assertEquals(SEED_2, game(result.games(), 4).getTeam2Id());
    }

    @Test
    void destinationBecomesReadyOnceBothSlotsAreFilled() {
        games = engine.advance(games, 1, SEED_1, SEED_4).games();
        assertEquals(GameStatus.PENDING, game(games, 3).getStatus());

        games = engine.advance(games, 2, SEED_2, SEED_3).games();

        assertEquals(GameStatus.READY, game(games, 3).getStatus());
        assertEquals(GameStatus.READY, game(games, 4).getStatus());
        assertEquals(SEED_4, game(games, 4).getTeam1Id());
        assertEquals(SEED_3, game(games, 4).getTeam2Id());
    }

    @Test
    void rejectsSecondAdvanceOfACompletedGame() {
        List<BracketGame> afterFirst = engine.advance(games, 1, SEED_1, SEED_4).games();

        AlreadyCompletedException ex = assertThrows(
                AlreadyCompletedException.class,
                () -> engine.advance(afterFirst, 1, SEED_1, SEED_4)
        );
        assertEquals("already_completed", ex.getCode());
    }

    @Test
    void rejectsWinnerWhoDidNotPlay() {
        InvalidWinnerException ex = assertThrows(
                InvalidWinnerException.class,
                () -> engine.advance(games, 1, SEED_2, null)
        );
        assertEquals("invalid_winner", ex.getCode());
    }

    @Test
    void rejectsLoserWhoIsNotTheOpponent() {
        assertThrows(InvalidWinnerException.class, () -> engine.advance(games, 1, SEED_1, SEED_3));
        assertThrows(InvalidWinnerException.class, () -> engine.advance(games, 1, null, SEED_4));
    }

    @Test
    void rejectsUnknownGame() {
        GameNotFoundException ex = assertThrows(
                GameNotFoundException.class,
                () -> engine.advance(games, 99, SEED_1, SEED_4)
        );
        assertEquals("game_not_found", ex.getCode());
    }

    @Test
    void rejectsGameStillWaitingForTeams() {
        GameNotReadyException ex = assertThrows(
                GameNotReadyException.class,
                () -> engine.advance(games, 3, SEED_1, SEED_2)
        );
        assertEquals("game_not_ready", ex.getCode());
    }

    @Test
    void rejectsGameDecidedByABye() {
        List<BracketGame> withBye = resolved(4, SEED_1, SEED_2, SEED_3);

        assertThrows(AlreadyCompletedException.class, () -> engine.advance(withBye, 1, SEED_1, null));
    }

    @Test
    void leavesInputGamesUntouched() {
        engine.advance(games, 1, SEED_1, SEED_4);

        assertEquals(GameStatus.READY, game(games, 1).getStatus());
        assertNull(game(games, 1).getWinnerId());
        assertNull(game(games, 3).getTeam1Id());
    }

    @Test
    void grandFinalWonFromWinnersBracketClosesTheResetAsABye() {
        games = playToGrandFinal();

        AdvancementResult result = engine.advance(games, 6, SEED_1, SEED_2);

        BracketGame reset = game(result.games(), 7);
        assertEquals(GameStatus.BYE, reset.getStatus());
        assertNull(reset.getTeam1Id());
        assertEquals(SEED_1, reset.getTeam2Id());
        assertEquals(SEED_1, reset.getWinnerId());
        assertEquals(List.of(new AdvancementResult.SlotUpdate(7, GameSlot.TEAM2, SEED_1)), result.slotUpdates());
        assertEquals(Optional.of(SEED_1), engine.championOf(result.games()));
    }

    @Test
    void grandFinalWonFromLosersBracketSendsBothTeamsToTheReset() {
        games = playToGrandFinal();

        List<BracketGame> afterFinal = engine.advance(games, 6, SEED_2, SEED_1).games();

        BracketGame reset = game(afterFinal, 7);
        assertEquals(GameStatus.READY, reset.getStatus());
        assertEquals(SEED_1, reset.getTeam1Id());
        assertEquals(SEED_2, reset.getTeam2Id());
        assertEquals(Optional.empty(), engine.championOf(afterFinal));

        List<BracketGame> afterReset = engine.advance(afterFinal, 7, SEED_2, SEED_1).games();
        assertEquals(Optional.of(SEED_2), engine.championOf(afterReset));
    }

    @Test
    void championIsUnknownBeforeTheFinals() {
        assertEquals(Optional.empty(), engine.championOf(games));
        assertEquals(Optional.empty(), engine.championOf(playToGrandFinal()));
    }

    @Test
    void overrideMovesTheNewWinnerAndLoser() {
        games = engine.advance(games, 1, SEED_1, SEED_4).games();

        List<BracketGame> overridden = engine.advance(games, 1, SEED_4, SEED_1, true).games();

        BracketGame replayed = game(overridden, 1);
        assertEquals(GameStatus.COMPLETED, replayed.getStatus());
        assertEquals(SEED_4, replayed.getWinnerId());
        assertEquals(SEED_4, game(overridden, 3).getTeam1Id());
        assertEquals(SEED_1, game(overridden, 4).getTeam1Id());
    }

    @Test
    void overrideReopensReadyDestinations() {
        games = engine.advance(games, 1, SEED_1, SEED_4).games();
        games = engine.advance(games, 2, SEED_2, SEED_3).games();

        List<BracketGame> overridden = engine.advance(games, 2, SEED_3, SEED_2, true).games();

        assertEquals(GameStatus.READY, game(overridden, 3).getStatus());
        assertEquals(SEED_3, game(overridden, 3).getTeam2Id());
        assertEquals(SEED_2, game(overridden, 4).getTeam2Id());
    }

    @Test
    void overrideIsRejectedOnceADestinationWasPlayed() {
        games = engine.advance(games, 1, SEED_1, SEED_4).games();
        games = engine.advance(games, 2, SEED_2, SEED_3).games();
        List<BracketGame> afterSemi = engine.advance(games, 3, SEED_1, SEED_2).games();

        assertThrows(AlreadyCompletedException.class, () -> engine.advance(afterSemi, 1, SEED_4, SEED_1, true));
    }

    @Test
    void overrideOfGrandFinalReopensTheReset() {
        games = engine.advance(playToGrandFinal(), 6, SEED_1, SEED_2).games();
        assertEquals(GameStatus.BYE, game(games, 7).getStatus());

        List<BracketGame> overridden = engine.advance(games, 6, SEED_2, SEED_1, true).games();

        BracketGame reset = game(overridden, 7);
        assertEquals(GameStatus.READY, reset.getStatus());
        assertEquals(SEED_1, reset.getTeam1Id());
        assertEquals(SEED_2, reset.getTeam2Id());
        assertNull(reset.getWinnerId());
        assertEquals(Optional.empty(), engine.championOf(overridden));
    }

    @Test
    void resetIsNeverReadyWhenWinnersBracketSideTakesTheFinal() {
        List<BracketGame> afterFinal = engine.advance(playToGrandFinal(), 6, SEED_1, null).games();

        BracketGame reset = game(afterFinal, 7);
        assertNotEquals(GameStatus.READY, reset.getStatus());
        assertTrue(reset.getTeam1Id() == null || reset.getTeam2Id() == null);
    }

    /**
     * Seed 1 wins the winners bracket, seed 2 comes back through the losers bracket.
     */
    private List<BracketGame> playToGrandFinal() {
        List<BracketGame> state = engine.advance(games, 1, SEED_1, SEED_4).games();
        state = engine.advance(state, 2, SEED_2, SEED_3).games();
        state = engine.advance(state, 3, SEED_1, SEED_2).games();
        state = engine.advance(state, 4, SEED_3, SEED_4).games();
        state = engine.advance(state, 5, SEED_2, SEED_3).games();

        BracketGame grandFinal = game(state, 6);
        assertEquals(GameStatus.READY, grandFinal.getStatus());
        assertEquals(SEED_1, grandFinal.getTeam1Id());
        assertEquals(SEED_2, grandFinal.getTeam2Id());
        return state;
    }
}
