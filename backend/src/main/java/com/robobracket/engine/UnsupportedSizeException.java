package com.robobracket.engine;

public class UnsupportedSizeException extends BracketEngineException {

    public UnsupportedSizeException(String message) {
        super("unsupported_size", message);
    }

    public static UnsupportedSizeException forSize(int size) {
        return new UnsupportedSizeException("Unsupported bracket size: " + size);
    }
}
