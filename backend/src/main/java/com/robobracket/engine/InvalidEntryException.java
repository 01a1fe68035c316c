package com.robobracket.engine;

public class InvalidEntryException extends BracketEngineException {

    public InvalidEntryException(String message) {
        super("invalid_entry", message);
    }
}
