package com.robobracket.engine;

public class InvalidWinnerException extends BracketEngineException {

    public InvalidWinnerException(String message) {
        super("invalid_winner", message);
    }
}
