package com.robobracket.engine;

public class GameNotReadyException extends BracketEngineException {

    public GameNotReadyException(int gameNumber) {
        super("game_not_ready", "Bracket game " + gameNumber + " does not have both teams yet");
    }
}
