package com.robobracket.model;

public enum GameSlot {
    TEAM1,
    TEAM2;

    public GameSlot opposite() {
        return this == TEAM1 ? TEAM2 : TEAM1;
    }
}
