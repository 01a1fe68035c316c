package com.robobracket.engine;

import com.robobracket.model.BracketGame;
import com.robobracket.model.GameStatus;
import com.robobracket.model.SlotRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Records the result of a played game and moves its winner and loser along the template edges.
 *
 * <p>Grand final: the winners-bracket side (TEAM1) winning ends the tournament, so only the winner reaches the
 * championship reset and bye resolution closes the reset as a bye. The loser is only sent to the reset game when
 * the losers-bracket side wins.
 */
@Component
public class AdvancementEngine {

    private static final Logger log = LoggerFactory.getLogger(AdvancementEngine.class);

    private final ByeResolutionEngine byeResolutionEngine;

    public AdvancementEngine(ByeResolutionEngine byeResolutionEngine) {
        this.byeResolutionEngine = byeResolutionEngine;
    }

    public AdvancementResult advance(Collection<BracketGame> games, int gameNumber, Long winnerId, Long loserId) {
        return advance(games, gameNumber, winnerId, loserId, false);
    }

    /**
     * @param override re-decide a completed game; its previous result is first taken back out of the
     *                 destination slots, which is only possible while no destination has been decided
     */
    public AdvancementResult advance(
            Collection<BracketGame> games,
            int gameNumber,
            Long winnerId,
            Long loserId,
            boolean override
    ) {
        GameGraph graph = GameGraph.copyOf(games);
        BracketGame game = graph.get(gameNumber);
        if (game == null) {
            throw new GameNotFoundException(gameNumber);
        }
        if (winnerId == null) {
            throw new InvalidWinnerException("winnerId is required");
        }
        if (game.getStatus() == GameStatus.BYE) {
            throw new AlreadyCompletedException("Bracket game " + gameNumber + " was decided by a bye");
        }
        if (game.getStatus() == GameStatus.COMPLETED) {
            if (!override) {
                throw new AlreadyCompletedException("Bracket game " + gameNumber + " is already completed");
            }
            retractResult(game, graph);
        }
        if (!game.hasBothTeams()) {
            throw new GameNotReadyException(gameNumber);
        }
        if (!game.isParticipant(winnerId)) {
            throw new InvalidWinnerException("Winner " + winnerId + " is not a participant of bracket game "
                    + gameNumber);
        }
        Long expectedLoser = game.opponentOf(winnerId);
        if (loserId != null && !loserId.equals(expectedLoser)) {
            throw new InvalidWinnerException("Loser " + loserId + " must be the other participant of bracket game "
                    + gameNumber);
        }

        game.setStatus(GameStatus.COMPLETED);
        game.setWinnerId(winnerId);
        game.setLoserId(expectedLoser);

        List<AdvancementResult.SlotUpdate> updates = new ArrayList<>();
        if (game.getWinnerAdvancesTo() != null) {
            place(game, game.getWinnerAdvancesTo(), winnerId, graph, updates);
        }
        if (shouldAdvanceLoser(game)) {
            place(game, game.getLoserAdvancesTo(), expectedLoser, graph, updates);
        }

        ByeResolutionResult resolution = byeResolutionEngine.resolve(graph.games());
        log.debug("Advanced game {}: winner {}, loser {}, {} slot updates", gameNumber, winnerId, expectedLoser,
                updates.size());
        return new AdvancementResult(resolution.games(), List.copyOf(updates), resolution);
    }

    /**
     * The tournament winner: the reset game's winner once it has been played or closed as a bye.
     */
    public Optional<Long> championOf(Collection<BracketGame> games) {
        BracketGame finalGame = null;
        for (BracketGame game : games) {
            if (game.isResetGame()) {
                finalGame = game;
                break;
            }
            if (game.isGrandFinal()) {
                finalGame = game;
            }
        }
        if (finalGame == null || !finalGame.getStatus().isDecided()) {
            return Optional.empty();
        }
        return Optional.ofNullable(finalGame.getWinnerId());
    }

    private static boolean shouldAdvanceLoser(BracketGame game) {
        if (game.getLoserAdvancesTo() == null) {
            return false;
        }
        return !game.isGrandFinal() || !ByeResolutionEngine.isWonFromWinnersBracket(game);
    }

    private static void place(
            BracketGame source,
            SlotRef target,
            Long teamId,
            GameGraph graph,
            List<AdvancementResult.SlotUpdate> updates
    ) {
        BracketGame destination = graph.get(target.gameNumber());
        if (destination == null) {
            throw new IllegalStateException("Bracket game " + source.getGameNumber()
                    + " advances to unknown game " + target.gameNumber());
        }
        Long occupant = destination.getTeam(target.slot());
        if (occupant != null && !occupant.equals(teamId)) {
            throw new IllegalStateException("Slot " + target.slot() + " of bracket game "
                    + destination.getGameNumber() + " already holds team " + occupant);
        }
        destination.setTeam(target.slot(), teamId);
        updates.add(new AdvancementResult.SlotUpdate(destination.getGameNumber(), target.slot(), teamId));
        if (destination.getStatus() == GameStatus.PENDING && destination.hasBothTeams()) {
            destination.setStatus(GameStatus.READY);
        }
    }

    private static void retractResult(BracketGame game, GameGraph graph) {
        BracketGame winnerDestination = destinationOf(game.getWinnerAdvancesTo(), graph);
        BracketGame loserDestination = destinationOf(game.getLoserAdvancesTo(), graph);
        requireUndecided(game, winnerDestination);
        requireUndecided(game, loserDestination);

        clearSlot(winnerDestination, game.getWinnerAdvancesTo(), game.getWinnerId());
        clearSlot(loserDestination, game.getLoserAdvancesTo(), game.getLoserId());

        game.setStatus(GameStatus.READY);
        game.setWinnerId(null);
        game.setLoserId(null);
    }

    private static BracketGame destinationOf(SlotRef target, GameGraph graph) {
        return target == null ? null : graph.get(target.gameNumber());
    }

    private static void requireUndecided(BracketGame game, BracketGame destination) {
        if (destination == null) {
            return;
        }
        boolean propagatedBye = destination.getStatus() == GameStatus.BYE && destination.getWinnerAdvancesTo() != null;
        if (destination.getStatus() == GameStatus.COMPLETED || propagatedBye) {
            throw new AlreadyCompletedException("Cannot override bracket game " + game.getGameNumber()
                    + " because bracket game " + destination.getGameNumber() + " has already been decided");
        }
    }

    private static void clearSlot(BracketGame destination, SlotRef target, Long teamId) {
        if (destination == null || teamId == null) {
            return;
        }
        if (Objects.equals(destination.getTeam(target.slot()), teamId)) {
            destination.setTeam(target.slot(), null);
        }
        if (destination.getStatus() != GameStatus.PENDING) {
            destination.setStatus(GameStatus.PENDING);
            destination.setWinnerId(null);
            destination.setLoserId(null);
        }
    }
}
