package com.robobracket.engine;

public class AlreadyCompletedException extends BracketEngineException {

    public AlreadyCompletedException(String message) {
        super("already_completed", message);
    }
}
