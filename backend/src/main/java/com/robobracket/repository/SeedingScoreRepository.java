package com.robobracket.repository;

import com.robobracket.model.SeedingRanking;
import com.robobracket.model.SeedingScore;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SeedingScoreRepository {

    SeedingScore saveScore(long eventId, SeedingScore score);

    boolean deleteScore(long eventId, long teamId, int roundNumber);

    Optional<SeedingScore> findScore(long eventId, long teamId, int roundNumber);

    List<SeedingScore> findScoresByEventId(long eventId);

    /**
     * Replaces the event's team roster. Rostered teams without scores still take part in the ranking as unranked.
     */
    List<Long> replaceTeams(long eventId, Collection<Long> teamIds);

    List<Long> findTeamIdsByEventId(long eventId);

    /**
     * Replaces every stored ranking of the event.
     */
    void replaceRankings(long eventId, List<SeedingRanking> rankings);

    List<SeedingRanking> findRankingsByEventId(long eventId);
}
