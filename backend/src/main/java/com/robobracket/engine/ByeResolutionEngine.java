package com.robobracket.engine;

import com.robobracket.model.BracketGame;
import com.robobracket.model.GameSlot;
import com.robobracket.model.GameSlotSource;
import com.robobracket.model.GameStatus;
import com.robobracket.model.SlotRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Objects;

/**
 * Propagates byes and already known results through a bracket until nothing changes.
 *
 * <p>A slot whose source can never produce a team (a bye seed, the loser of a bye, the winner of a void game)
 * is impossible. A game with one team and an impossible opponent is a bye for that team; a game with two
 * impossible sides is void (a bye without a winner). The input is never modified.
 */
@Component
public class ByeResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ByeResolutionEngine.class);

    public ByeResolutionResult resolve(Collection<BracketGame> games) {
        GameGraph graph = GameGraph.copyOf(games);
        graph.verifyAcyclic();

        Tally tally = new Tally();
        int maxPasses = graph.size() + 1;
        boolean changed = true;
        while (changed) {
            if (tally.passes == maxPasses) {
                throw new CycleDetectedException("Bye resolution did not settle after " + maxPasses + " passes");
            }
            tally.passes++;
            changed = false;
            for (BracketGame game : graph.games()) {
                if (!game.getStatus().isDecided() && resolveGame(game, graph, tally)) {
                    changed = true;
                }
            }
        }

        log.debug(
                "Bye resolution settled after {} passes: {} byes, {} slots filled, {} games ready",
                tally.passes,
                tally.byeGamesResolved,
                tally.slotsFilled,
                tally.readyGamesUpdated
        );
        return new ByeResolutionResult(
                graph.toList(),
                tally.byeGamesResolved,
                tally.slotsFilled,
                tally.readyGamesUpdated,
                tally.passes
        );
    }

    private boolean resolveGame(BracketGame game, GameGraph graph, Tally tally) {
        boolean changed = false;
        SourceResolution team1 = resolveSource(game, GameSlot.TEAM1, graph);
        SourceResolution team2 = resolveSource(game, GameSlot.TEAM2, graph);

        if (game.getTeam1Id() == null && team1.hasTeam()) {
            game.setTeam1Id(team1.teamId());
            tally.slotsFilled++;
            changed = true;
        }
        if (game.getTeam2Id() == null && team2.hasTeam()) {
            game.setTeam2Id(team2.teamId());
            tally.slotsFilled++;
            changed = true;
        }

        boolean team1Impossible = game.getTeam1Id() == null && team1.isImpossible();
        boolean team2Impossible = game.getTeam2Id() == null && team2.isImpossible();

        if (game.getTeam1Id() != null && team2Impossible) {
            markBye(game, game.getTeam1Id(), graph, tally);
            return true;
        }
        if (game.getTeam2Id() != null && team1Impossible) {
            markBye(game, game.getTeam2Id(), graph, tally);
            return true;
        }
        if (team1Impossible && team2Impossible) {
            game.setStatus(GameStatus.BYE);
            game.setWinnerId(null);
            tally.byeGamesResolved++;
            return true;
        }

        if (game.getStatus() == GameStatus.PENDING && game.hasBothTeams()) {
            game.setStatus(GameStatus.READY);
            tally.readyGamesUpdated++;
            changed = true;
        }
        return changed;
    }

    private static SourceResolution resolveSource(BracketGame game, GameSlot slot, GameGraph graph) {
        GameSlotSource source = game.getSource(slot);
        if (source == null) {
            return SourceResolution.UNRESOLVED;
        }
        if (source.isSeed()) {
            Long seeded = game.getTeam(slot);
            return seeded != null ? SourceResolution.of(seeded) : SourceResolution.IMPOSSIBLE;
        }

        BracketGame feeder = graph.get(source.reference());
        if (!feeder.getStatus().isDecided()) {
            return SourceResolution.UNRESOLVED;
        }
        if (source.type() == GameSlotSource.Type.WINNER_OF) {
            return SourceResolution.of(feeder.getWinnerId());
        }
        if (feeder.getStatus() == GameStatus.BYE) {
            return SourceResolution.IMPOSSIBLE;
        }
        if (game.isResetGame() && feeder.isGrandFinal() && isWonFromWinnersBracket(feeder)) {
            return SourceResolution.IMPOSSIBLE;
        }
        return SourceResolution.of(feeder.getLoserId());
    }

    static boolean isWonFromWinnersBracket(BracketGame grandFinal) {
        return grandFinal.getWinnerId() != null && grandFinal.getWinnerId().equals(grandFinal.getTeam1Id());
    }

    private void markBye(BracketGame game, Long winnerId, GameGraph graph, Tally tally) {
        game.setStatus(GameStatus.BYE);
        game.setWinnerId(winnerId);
        game.setLoserId(null);
        tally.byeGamesResolved++;

        SlotRef target = game.getWinnerAdvancesTo();
        if (target == null) {
            return;
        }
        BracketGame destination = graph.get(target.gameNumber());
        if (destination == null) {
            throw new IllegalStateException("Bracket game " + game.getGameNumber()
                    + " advances to unknown game " + target.gameNumber());
        }
        Long occupant = destination.getTeam(target.slot());
        if (occupant != null && !Objects.equals(occupant, winnerId)) {
            throw new IllegalStateException("Slot " + target.slot() + " of bracket game "
                    + destination.getGameNumber() + " already holds team " + occupant);
        }
        if (occupant == null) {
            destination.setTeam(target.slot(), winnerId);
            tally.slotsFilled++;
        }
        if (destination.getStatus() == GameStatus.PENDING && destination.hasBothTeams()) {
            destination.setStatus(GameStatus.READY);
            tally.readyGamesUpdated++;
        }
    }

    private record SourceResolution(
            boolean resolved,
            Long teamId
    ) {
        static final SourceResolution UNRESOLVED = new SourceResolution(false, null);
        static final SourceResolution IMPOSSIBLE = new SourceResolution(true, null);

        static SourceResolution of(Long teamId) {
            return teamId == null ? IMPOSSIBLE : new SourceResolution(true, teamId);
        }

        boolean hasTeam() {
            return resolved && teamId != null;
        }

        boolean isImpossible() {
            return resolved && teamId == null;
        }
    }

    private static final class Tally {
        private int byeGamesResolved;
        private int slotsFilled;
        private int readyGamesUpdated;
        private int passes;
    }
}
