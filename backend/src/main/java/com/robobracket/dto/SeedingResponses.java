package com.robobracket.dto;

import java.util.List;

public final class SeedingResponses {

    private SeedingResponses() {
    }

    public record Score(
            Long teamId,
            Integer roundNumber,
            Double score
    ) {
    }

    public record Teams(
            Long eventId,
            List<Long> teamIds
    ) {
    }

    public record Ranking(
            Long teamId,
            Double seedAverage,
            Integer seedRank,
            Double tiebreakerValue,
            Double rawSeedScore
    ) {
    }

    public record RecalculationSummary(
            Long eventId,
            Integer teamsRanked,
            Integer teamsUnranked,
            List<Ranking> rankings
    ) {
    }
}
