package com.robobracket.model;

/**
 * A seed position of a bracket, held either by a team or by a declared bye.
 */
public record BracketEntry(
        int seedPosition,
        Long teamId,
        boolean bye
) {

    public static BracketEntry team(int seedPosition, long teamId) {
        return new BracketEntry(seedPosition, teamId, false);
    }

    public static BracketEntry bye(int seedPosition) {
        return new BracketEntry(seedPosition, null, true);
    }
}
