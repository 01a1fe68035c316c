package com.robobracket.model;

public record SeedingRanking(
        long teamId,
        Double seedAverage,
        Integer seedRank,
        Double tiebreakerValue,
        Double rawSeedScore
) {

    public boolean isRanked() {
        return seedRank != null;
    }
}
