package com.robobracket.engine;

public class GameNotFoundException extends BracketEngineException {

    public GameNotFoundException(int gameNumber) {
        super("game_not_found", "Bracket game not found: " + gameNumber);
    }
}
