package com.robobracket.repository;

import com.robobracket.model.SeedingRanking;
import com.robobracket.model.SeedingScore;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
public class InMemorySeedingScoreRepository implements SeedingScoreRepository {

    private static final Comparator<SeedingScore> SCORE_ORDER =
            Comparator.comparingLong(SeedingScore::teamId).thenComparingInt(SeedingScore::roundNumber);

    private final ConcurrentMap<Long, ConcurrentMap<ScoreKey, SeedingScore>> scoresByEvent = new ConcurrentHashMap<>();
    private final Map<Long, List<SeedingRanking>> rankingsByEvent = new ConcurrentHashMap<>();
    private final Map<Long, List<Long>> teamsByEvent = new ConcurrentHashMap<>();

    @Override
    public SeedingScore saveScore(long eventId, SeedingScore score) {
        Objects.requireNonNull(score, "score is required");
        scoresByEvent.computeIfAbsent(eventId, ignored -> new ConcurrentHashMap<>())
                .put(new ScoreKey(score.teamId(), score.roundNumber()), score);
        return score;
    }

    @Override
    public boolean deleteScore(long eventId, long teamId, int roundNumber) {
        Map<ScoreKey, SeedingScore> scores = scoresByEvent.get(eventId);
        return scores != null && scores.remove(new ScoreKey(teamId, roundNumber)) != null;
    }

    @Override
    public Optional<SeedingScore> findScore(long eventId, long teamId, int roundNumber) {
        Map<ScoreKey, SeedingScore> scores = scoresByEvent.get(eventId);
        return scores == null ? Optional.empty() : Optional.ofNullable(scores.get(new ScoreKey(teamId, roundNumber)));
    }

    @Override
    public List<SeedingScore> findScoresByEventId(long eventId) {
        Map<ScoreKey, SeedingScore> scores = scoresByEvent.get(eventId);
        if (scores == null) {
            return List.of();
        }
        List<SeedingScore> ordered = new ArrayList<>(scores.values());
        ordered.sort(SCORE_ORDER);
        return ordered;
    }

    @Override
    public List<Long> replaceTeams(long eventId, Collection<Long> teamIds) {
        List<Long> roster = teamIds.stream()
                .distinct()
                .sorted()
                .toList();
        teamsByEvent.put(eventId, roster);
        return roster;
    }

    @Override
    public List<Long> findTeamIdsByEventId(long eventId) {
        return teamsByEvent.getOrDefault(eventId, List.of());
    }

    @Override
    public void replaceRankings(long eventId, List<SeedingRanking> rankings) {
        rankingsByEvent.put(eventId, List.copyOf(rankings));
    }

    @Override
    public List<SeedingRanking> findRankingsByEventId(long eventId) {
        return rankingsByEvent.getOrDefault(eventId, List.of());
    }

    private record ScoreKey(
            long teamId,
            int roundNumber
    ) {
    }
}
