package com.robobracket.engine;

import com.robobracket.model.SeedingRanking;
import com.robobracket.model.SeedingScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks teams by the average of their best two seeding scores.
 *
 * <p>Ties on the average are broken by the third best score, or by the sum of all scores when a team has
 * played fewer than three rounds. Teams without any score are listed last and stay unranked.
 */
@Component
public class SeedingRankingCalculator {

    private static final double RANK_WEIGHT = 0.75;
    private static final double AVERAGE_WEIGHT = 0.25;

    private static final Comparator<Double> DESCENDING_NULLS_LAST =
            Comparator.nullsLast(Comparator.<Double>reverseOrder());

    private static final Comparator<Candidate> RANKING_ORDER =
            Comparator.comparing(Candidate::seedAverage, DESCENDING_NULLS_LAST)
                    .thenComparing(Candidate::tiebreaker, DESCENDING_NULLS_LAST);

    public SeedingRankingResult calculate(Collection<SeedingScore> scores) {
        Map<Long, List<Double>> scoresByTeam = new LinkedHashMap<>();
        for (SeedingScore score : scores) {
            scoresByTeam.computeIfAbsent(score.teamId(), ignored -> new ArrayList<>()).add(score.score());
        }
        return calculate(scoresByTeam);
    }

    /**
     * @param scoresByTeam scores per team; iteration order decides between teams that tie completely
     */
    public SeedingRankingResult calculate(Map<Long, ? extends Collection<Double>> scoresByTeam) {
        List<Candidate> candidates = new ArrayList<>(scoresByTeam.size());
        scoresByTeam.forEach((teamId, teamScores) -> candidates.add(candidateFor(teamId, teamScores)));
        // List.sort is stable, so complete ties keep their input order
        candidates.sort(RANKING_ORDER);

        int rankedCount = (int) candidates.stream().filter(Candidate::isRanked).count();
        double maxSeedAverage = candidates.stream()
                .map(Candidate::seedAverage)
                .filter(Objects::nonNull)
                .findFirst()
                .filter(max -> max != 0.0)
                .orElse(1.0);

        List<SeedingRanking> rankings = new ArrayList<>(candidates.size());
        int rank = 0;
        for (Candidate candidate : candidates) {
            if (!candidate.isRanked()) {
                rankings.add(new SeedingRanking(candidate.teamId(), null, null, null, null));
                continue;
            }
            rank++;
            double rankComponent = RANK_WEIGHT * (rankedCount - rank + 1) / rankedCount;
            double averageComponent = AVERAGE_WEIGHT * (candidate.seedAverage() / maxSeedAverage);
            rankings.add(new SeedingRanking(
                    candidate.teamId(),
                    candidate.seedAverage(),
                    rank,
                    candidate.tiebreaker(),
                    rankComponent + averageComponent
            ));
        }

        return new SeedingRankingResult(List.copyOf(rankings), rankedCount, candidates.size() - rankedCount);
    }

    private static Candidate candidateFor(Long teamId, Collection<Double> teamScores) {
        List<Double> played = teamScores == null ? List.of() : teamScores.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.reverseOrder())
                .toList();

        if (played.isEmpty()) {
            return new Candidate(teamId, null, null);
        }
        if (played.size() == 1) {
            return new Candidate(teamId, played.get(0), played.get(0));
        }
        double seedAverage = (played.get(0) + played.get(1)) / 2;
        double tiebreaker = played.size() >= 3
                ? played.get(2)
                : played.stream().mapToDouble(Double::doubleValue).sum();
        return new Candidate(teamId, seedAverage, tiebreaker);
    }

    private record Candidate(
            long teamId,
            Double seedAverage,
            Double tiebreaker
    ) {
        boolean isRanked() {
            return seedAverage != null;
        }
    }
}
