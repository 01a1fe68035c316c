package com.robobracket.model;

/**
 * A team's score in one seeding round. A null score marks a round that was recorded but not scored.
 */
public record SeedingScore(
        long teamId,
        int roundNumber,
        Double score
) {
}
