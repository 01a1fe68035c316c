package com.robobracket.engine;

import com.robobracket.model.BracketGame;
import com.robobracket.model.GameSlot;
import com.robobracket.model.GameSlotSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working copy of a bracket's games keyed by game number, in game-number order.
 */
final class GameGraph {

    private static final int UNVISITED = 0;
    private static final int IN_PROGRESS = 1;
    private static final int DONE = 2;

    private final Map<Integer, BracketGame> gamesByNumber;

    private GameGraph(Map<Integer, BracketGame> gamesByNumber) {
        this.gamesByNumber = gamesByNumber;
    }

    static GameGraph copyOf(Collection<BracketGame> games) {
        if (games == null) {
            throw new IllegalArgumentException("Bracket games are required");
        }
        List<BracketGame> ordered = new ArrayList<>(games.size());
        for (BracketGame game : games) {
            ordered.add(game.copy());
        }
        ordered.sort(Comparator.comparingInt(BracketGame::getGameNumber));

        Map<Integer, BracketGame> gamesByNumber = new LinkedHashMap<>();
        for (BracketGame game : ordered) {
            if (gamesByNumber.putIfAbsent(game.getGameNumber(), game) != null) {
                throw new IllegalArgumentException("Duplicate game number: " + game.getGameNumber());
            }
        }
        return new GameGraph(gamesByNumber);
    }

    BracketGame get(int gameNumber) {
        return gamesByNumber.get(gameNumber);
    }

    Collection<BracketGame> games() {
        return gamesByNumber.values();
    }

    int size() {
        return gamesByNumber.size();
    }

    List<BracketGame> toList() {
        return new ArrayList<>(gamesByNumber.values());
    }

    /**
     * Walks winner/loser sources depth-first and rejects any game that (transitively) feeds itself.
     */
    void verifyAcyclic() {
        Map<Integer, Integer> state = new HashMap<>();
        for (Integer gameNumber : gamesByNumber.keySet()) {
            visit(gameNumber, state);
        }
    }

    private void visit(int gameNumber, Map<Integer, Integer> state) {
        int current = state.getOrDefault(gameNumber, UNVISITED);
        if (current == DONE) {
            return;
        }
        if (current == IN_PROGRESS) {
            throw new CycleDetectedException("Game " + gameNumber + " feeds into itself");
        }
        state.put(gameNumber, IN_PROGRESS);
        BracketGame game = gamesByNumber.get(gameNumber);
        for (GameSlot slot : GameSlot.values()) {
            GameSlotSource source = game.getSource(slot);
            if (source == null || !source.referencesGame()) {
                continue;
            }
            if (!gamesByNumber.containsKey(source.reference())) {
                throw new IllegalArgumentException("Game " + gameNumber + " references unknown game "
                        + source.reference());
            }
            visit(source.reference(), state);
        }
        state.put(gameNumber, DONE);
    }
}
