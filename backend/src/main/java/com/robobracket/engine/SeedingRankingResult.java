package com.robobracket.engine;

import com.robobracket.model.SeedingRanking;

import java.util.List;

public record SeedingRankingResult(
        List<SeedingRanking> rankings,
        int teamsRanked,
        int teamsUnranked
) {
}
