package com.robobracket.engine;

import com.robobracket.model.BracketSide;
import com.robobracket.model.GameSlot;
import com.robobracket.model.GameSlotSource;
import com.robobracket.model.GameTemplate;
import com.robobracket.model.SlotRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the double-elimination game graph for any supported bracket size.
 *
 * <p>Games are numbered in stage order {@code W1, W2, L1, L2, W3, L3, L4, ..., WR, L(2R-3), L(2R-2), GF, Reset}
 * (R = log2(size)), so every game only references games with a smaller number. The losers bracket alternates
 * pairing rounds (odd) with drop rounds (even) where the losers of the next winners round come in. Drops are
 * mirrored on every other drop round to keep teams away from an opponent they just met.
 */
@Component
public class BracketTemplateBuilder {

    public static final List<Integer> SUPPORTED_SIZES = List.of(4, 8, 16, 32, 64);

    public static boolean isSupportedSize(int bracketSize) {
        return SUPPORTED_SIZES.contains(bracketSize);
    }

    public List<GameTemplate> build(int bracketSize) {
        if (!isSupportedSize(bracketSize)) {
            throw UnsupportedSizeException.forSize(bracketSize);
        }

        int winnersRounds = Integer.numberOfTrailingZeros(bracketSize);
        int losersRounds = 2 * winnersRounds - 2;
        List<PlannedGame> planned = new ArrayList<>(2 * bracketSize - 1);
        List<List<PlannedGame>> winners = new ArrayList<>();
        List<List<PlannedGame>> losers = new ArrayList<>();
        winners.add(List.of());
        losers.add(List.of());

        List<SeedOrderGenerator.SeedPair> seedPairs = SeedOrderGenerator.firstRoundPairs(bracketSize);
        List<PlannedGame> firstRound = newRound(planned, seedPairs.size(), BracketSide.WINNERS,
                winnersRoundName(1, winnersRounds));
        for (int i = 0; i < seedPairs.size(); i++) {
            firstRound.get(i).team1Source = GameSlotSource.seed(seedPairs.get(i).topSeed());
            firstRound.get(i).team2Source = GameSlotSource.seed(seedPairs.get(i).bottomSeed());
        }
        winners.add(firstRound);

        for (int round = 2; round <= winnersRounds; round++) {
            List<PlannedGame> previous = winners.get(round - 1);
            List<PlannedGame> current = newRound(planned, previous.size() / 2, BracketSide.WINNERS,
                    winnersRoundName(round, winnersRounds));
            pairWinners(previous, current);
            winners.add(current);

            int dropRoundIndex = round - 1;
            int pairingRound = 2 * dropRoundIndex - 1;
            List<PlannedGame> pairing = newRound(planned, bracketSize >> (dropRoundIndex + 1), BracketSide.LOSERS,
                    losersRoundName(pairingRound, losersRounds));
            if (pairingRound == 1) {
                pairLosers(winners.get(1), pairing);
            } else {
                pairWinners(losers.get(pairingRound - 1), pairing);
            }
            losers.add(pairing);

            List<PlannedGame> drop = newRound(planned, pairing.size(), BracketSide.LOSERS,
                    losersRoundName(pairingRound + 1, losersRounds));
            dropLosers(pairing, current, drop, dropRoundIndex % 2 == 1);
            losers.add(drop);
        }

        PlannedGame grandFinal = newGame(planned, BracketSide.FINALS, "Grand Final");
        grandFinal.grandFinal = true;
        advanceWinner(winners.get(winnersRounds).get(0), grandFinal, GameSlot.TEAM1);
        advanceWinner(losers.get(losersRounds).get(0), grandFinal, GameSlot.TEAM2);

        PlannedGame reset = newGame(planned, BracketSide.FINALS, "Championship Reset");
        reset.resetGame = true;
        reset.team1Source = GameSlotSource.loserOf(grandFinal.gameNumber);
        reset.team2Source = GameSlotSource.winnerOf(grandFinal.gameNumber);
        grandFinal.loserAdvancesTo = SlotRef.team1(reset.gameNumber);
        grandFinal.winnerAdvancesTo = SlotRef.team2(reset.gameNumber);

        return toTemplates(bracketSize, planned);
    }

    private static void pairWinners(List<PlannedGame> feeders, List<PlannedGame> round) {
        for (int i = 0; i < feeders.size(); i++) {
            advanceWinner(feeders.get(i), round.get(i / 2), slotForIndex(i));
        }
    }

    private static void pairLosers(List<PlannedGame> feeders, List<PlannedGame> round) {
        for (int i = 0; i < feeders.size(); i++) {
            advanceLoser(feeders.get(i), round.get(i / 2), slotForIndex(i));
        }
    }

    private static void dropLosers(
            List<PlannedGame> losersFeeders,
            List<PlannedGame> winnersFeeders,
            List<PlannedGame> drop,
            boolean mirrored
    ) {
        int count = drop.size();
        for (int j = 0; j < count; j++) {
            advanceWinner(losersFeeders.get(j), drop.get(j), GameSlot.TEAM1);
            int dropped = mirrored ? count - 1 - j : j;
            advanceLoser(winnersFeeders.get(dropped), drop.get(j), GameSlot.TEAM2);
        }
    }

    private static void advanceWinner(PlannedGame from, PlannedGame to, GameSlot slot) {
        from.winnerAdvancesTo = new SlotRef(to.gameNumber, slot);
        to.setSource(slot, GameSlotSource.winnerOf(from.gameNumber));
    }

    private static void advanceLoser(PlannedGame from, PlannedGame to, GameSlot slot) {
        from.loserAdvancesTo = new SlotRef(to.gameNumber, slot);
        to.setSource(slot, GameSlotSource.loserOf(from.gameNumber));
    }

    private static GameSlot slotForIndex(int index) {
        return index % 2 == 0 ? GameSlot.TEAM1 : GameSlot.TEAM2;
    }

    private static List<PlannedGame> newRound(List<PlannedGame> planned, int games, BracketSide side, String roundName) {
        List<PlannedGame> round = new ArrayList<>(games);
        for (int i = 0; i < games; i++) {
            round.add(newGame(planned, side, roundName));
        }
        return round;
    }

    private static PlannedGame newGame(List<PlannedGame> planned, BracketSide side, String roundName) {
        PlannedGame game = new PlannedGame(planned.size() + 1, side, roundName);
        planned.add(game);
        return game;
    }

    private static String winnersRoundName(int round, int winnersRounds) {
        if (round == winnersRounds) {
            return "Winners Final";
        }
        if (round == winnersRounds - 1 && winnersRounds >= 3) {
            return "Winners Semi";
        }
        return "Winners R" + round;
    }

    private static String losersRoundName(int round, int losersRounds) {
        if (round == losersRounds) {
            return "Losers Final";
        }
        if (round == losersRounds - 1 && losersRounds >= 3) {
            return "Losers Semi";
        }
        return "Losers R" + round;
    }

    private static List<GameTemplate> toTemplates(int bracketSize, List<PlannedGame> planned) {
        int[] depth = new int[planned.size() + 1];
        List<GameTemplate> templates = new ArrayList<>(planned.size());
        for (PlannedGame game : planned) {
            depth[game.gameNumber] = 1 + Math.max(
                    sourceDepth(game.team1Source, depth),
                    sourceDepth(game.team2Source, depth)
            );
            templates.add(new GameTemplate(
                    bracketSize,
                    game.gameNumber,
                    game.roundName,
                    depth[game.gameNumber],
                    game.side,
                    game.team1Source,
                    game.team2Source,
                    game.winnerAdvancesTo,
                    game.loserAdvancesTo,
                    game.grandFinal,
                    game.resetGame
            ));
        }
        return List.copyOf(templates);
    }

    private static int sourceDepth(GameSlotSource source, int[] depth) {
        return source.referencesGame() ? depth[source.reference()] : 0;
    }

    private static final class PlannedGame {
        private final int gameNumber;
        private final BracketSide side;
        private final String roundName;
        private GameSlotSource team1Source;
        private GameSlotSource team2Source;
        private SlotRef winnerAdvancesTo;
        private SlotRef loserAdvancesTo;
        private boolean grandFinal;
        private boolean resetGame;

        private PlannedGame(int gameNumber, BracketSide side, String roundName) {
            this.gameNumber = gameNumber;
            this.side = side;
            this.roundName = roundName;
        }

        private void setSource(GameSlot slot, GameSlotSource source) {
            if (slot == GameSlot.TEAM1) {
                team1Source = source;
            } else {
                team2Source = source;
            }
        }
    }
}
