package com.robobracket.model;

public enum BracketSide {
    WINNERS,
    LOSERS,
    FINALS
}
