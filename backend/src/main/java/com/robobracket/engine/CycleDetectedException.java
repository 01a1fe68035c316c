package com.robobracket.engine;

/**
 * The game graph references itself. Only a broken template can produce this.
 */
public class CycleDetectedException extends BracketEngineException {

    public CycleDetectedException(String message) {
        super("cycle_detected", message);
    }
}
