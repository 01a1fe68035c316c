package com.robobracket.service;

import com.robobracket.config.RoboBracketProperties;
import com.robobracket.engine.SeedingRankingCalculator;
import com.robobracket.engine.SeedingRankingResult;
import com.robobracket.model.SeedingRanking;
import com.robobracket.model.SeedingScore;
import com.robobracket.repository.SeedingScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Service
public class SeedingService {

    private static final Logger log = LoggerFactory.getLogger(SeedingService.class);

    private final SeedingScoreRepository seedingScoreRepository;
    private final SeedingRankingCalculator seedingRankingCalculator;
    private final RoboBracketProperties roboBracketProperties;

    public SeedingService(
            SeedingScoreRepository seedingScoreRepository,
            SeedingRankingCalculator seedingRankingCalculator,
            RoboBracketProperties roboBracketProperties
    ) {
        this.seedingScoreRepository = seedingScoreRepository;
        this.seedingRankingCalculator = seedingRankingCalculator;
        this.roboBracketProperties = roboBracketProperties;
    }

    /**
     * Stores or replaces the score of one team in one seeding round. A null score keeps the round on record
     * without counting it towards the ranking.
     */
    public SeedingScore recordScore(long eventId, long teamId, int roundNumber, Double score) {
        int maxRounds = roboBracketProperties.getSeeding().getMaxRounds();
        if (roundNumber < 1 || roundNumber > maxRounds) {
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "roundNumber must be between 1 and " + maxRounds
            );
        }
        if (score != null && (score.isNaN() || score.isInfinite())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "score must be a finite number");
        }
        return seedingScoreRepository.saveScore(eventId, new SeedingScore(teamId, roundNumber, score));
    }

    public void deleteScore(long eventId, long teamId, int roundNumber) {
        if (!seedingScoreRepository.deleteScore(eventId, teamId, roundNumber)) {
            throw new ResponseStatusException(
                    HttpStatus.NOT_FOUND,
                    "Seeding score not found for team " + teamId + " round " + roundNumber
            );
        }
    }

    public List<SeedingScore> listScores(long eventId) {
        return seedingScoreRepository.findScoresByEventId(eventId);
    }

    /**
     * Replaces the event's roster. Every rostered team appears in the rankings, unranked until it has a score.
     */
    public List<Long> registerTeams(long eventId, List<Long> teamIds) {
        Set<Long> distinct = new HashSet<>();
        for (Long teamId : teamIds) {
            if (teamId == null || teamId <= 0) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "teamIds must be positive");
            }
            if (!distinct.add(teamId)) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Team " + teamId + " is listed twice");
            }
        }
        List<Long> roster = seedingScoreRepository.replaceTeams(eventId, teamIds);
        log.info("Registered {} teams for event {}", roster.size(), eventId);
        return roster;
    }

    public List<Long> listTeams(long eventId) {
        return seedingScoreRepository.findTeamIdsByEventId(eventId);
    }

    /**
     * Ranks every team that is rostered for the event or has a score row, in team id order before sorting.
     */
    public SeedingRankingResult recalculateRankings(long eventId) {
        Map<Long, List<Double>> scoresByTeam = new TreeMap<>();
        for (Long teamId : seedingScoreRepository.findTeamIdsByEventId(eventId)) {
            scoresByTeam.put(teamId, new ArrayList<>());
        }
        for (SeedingScore score : seedingScoreRepository.findScoresByEventId(eventId)) {
            scoresByTeam.computeIfAbsent(score.teamId(), ignored -> new ArrayList<>()).add(score.score());
        }
        SeedingRankingResult result = seedingRankingCalculator.calculate(scoresByTeam);
        seedingScoreRepository.replaceRankings(eventId, result.rankings());
        log.info(
                "Recalculated seeding rankings for event {}: {} ranked, {} unranked",
                eventId,
                result.teamsRanked(),
                result.teamsUnranked()
        );
        return result;
    }

    public List<SeedingRanking> getRankings(long eventId) {
        List<SeedingRanking> stored = seedingScoreRepository.findRankingsByEventId(eventId);
        if (!stored.isEmpty()) {
            return stored;
        }
        return recalculateRankings(eventId).rankings();
    }

    /**
     * Team ids in seed order from freshly recalculated rankings. Unranked teams follow the ranked ones when
     * {@code robobracket.seeding.include-unranked-teams} is set.
     */
    public List<Long> seedOrder(long eventId) {
        List<SeedingRanking> rankings = recalculateRankings(eventId).rankings();
        List<Long> ordered = new ArrayList<>();
        rankings.stream()
                .filter(SeedingRanking::isRanked)
                .sorted(Comparator.comparing(SeedingRanking::seedRank))
                .forEach(ranking -> ordered.add(ranking.teamId()));
        if (roboBracketProperties.getSeeding().isIncludeUnrankedTeams()) {
            rankings.stream()
                    .filter(ranking -> !ranking.isRanked())
                    .forEach(ranking -> ordered.add(ranking.teamId()));
        }
        return ordered;
    }
}
