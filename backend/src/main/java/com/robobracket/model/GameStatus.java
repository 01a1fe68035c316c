package com.robobracket.model;

public enum GameStatus {
    PENDING,
    READY,
    BYE,
    COMPLETED;

    /**
     * Decided games have a final outcome and are skipped by resolution passes.
     */
    public boolean isDecided() {
        return this == BYE || this == COMPLETED;
    }
}
