package com.robobracket.model;

public enum BracketStatus {
    SETUP,
    IN_PROGRESS,
    COMPLETED
}
