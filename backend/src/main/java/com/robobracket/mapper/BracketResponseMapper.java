package com.robobracket.mapper;

import com.robobracket.dto.BracketResponses;
import com.robobracket.dto.SeedingResponses;
import com.robobracket.engine.AdvancementResult;
import com.robobracket.engine.SeedingRankingResult;
import com.robobracket.model.Bracket;
import com.robobracket.model.BracketEntry;
import com.robobracket.model.BracketGame;
import com.robobracket.model.GameStatus;
import com.robobracket.model.GameTemplate;
import com.robobracket.model.SeedingRanking;
import com.robobracket.model.SeedingScore;
import com.robobracket.service.RecordedResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class BracketResponseMapper {

    public BracketResponses.BracketSummary toBracketSummaryResponse(Bracket bracket) {
        int teamCount = (int) bracket.getEntries().stream()
                .filter(entry -> !entry.bye())
                .count();
        int gamesCompleted = (int) bracket.getGames().stream()
                .filter(game -> game.getStatus() == GameStatus.COMPLETED)
                .count();
        return new BracketResponses.BracketSummary(
                bracket.getBracketId(),
                bracket.getEventId(),
                bracket.getName(),
                bracket.getBracketSize(),
                bracket.getStatus(),
                teamCount,
                gamesCompleted,
                bracket.getGames().size(),
                bracket.getChampionTeamId(),
                bracket.getCreatedAt(),
                bracket.getUpdatedAt()
        );
    }

    public List<BracketResponses.BracketSummary> toBracketSummaryResponses(Collection<Bracket> brackets) {
        return brackets.stream()
                .map(this::toBracketSummaryResponse)
                .toList();
    }

    public BracketResponses.BracketDetail toBracketDetailResponse(Bracket bracket) {
        return new BracketResponses.BracketDetail(
                bracket.getBracketId(),
                bracket.getEventId(),
                bracket.getName(),
                bracket.getBracketSize(),
                bracket.getStatus(),
                bracket.getChampionTeamId(),
                bracket.getEntries().stream().map(this::toEntryResponse).toList(),
                toGameResponses(bracket.getGames()),
                bracket.getCreatedAt(),
                bracket.getUpdatedAt(),
                bracket.getCompletedAt()
        );
    }

    public BracketResponses.Entry toEntryResponse(BracketEntry entry) {
        return new BracketResponses.Entry(entry.seedPosition(), entry.teamId(), entry.bye());
    }

    public BracketResponses.Game toGameResponse(BracketGame game) {
        return new BracketResponses.Game(
                game.getGameNumber(),
                game.getRoundName(),
                game.getRoundNumber(),
                game.getSide(),
                game.getTeam1Source(),
                game.getTeam2Source(),
                game.getTeam1Id(),
                game.getTeam2Id(),
                game.getStatus(),
                game.getWinnerId(),
                game.getLoserId(),
                game.getWinnerAdvancesTo(),
                game.getLoserAdvancesTo(),
                game.isGrandFinal(),
                game.isResetGame()
        );
    }

    public List<BracketResponses.Game> toGameResponses(Collection<BracketGame> games) {
        return games.stream()
                .map(this::toGameResponse)
                .toList();
    }

    public BracketResponses.Template toTemplateResponse(int bracketSize, List<GameTemplate> templates) {
        List<BracketResponses.TemplateGame> games = templates.stream()
                .map(template -> new BracketResponses.TemplateGame(
                        template.gameNumber(),
                        template.roundName(),
                        template.roundNumber(),
                        template.side(),
                        template.team1Source(),
                        template.team2Source(),
                        template.winnerAdvancesTo(),
                        template.loserAdvancesTo(),
                        template.grandFinal(),
                        template.resetGame()
                ))
                .toList();
        return new BracketResponses.Template(bracketSize, games.size(), games);
    }

    public BracketResponses.GameResult toGameResultResponse(int gameNumber, RecordedResult recorded) {
        Bracket bracket = recorded.bracket();
        return new BracketResponses.GameResult(
                bracket.getBracketId(),
                gameNumber,
                recorded.replay(),
                bracket.getStatus(),
                bracket.getChampionTeamId(),
                recorded.slotUpdates().stream().map(this::toSlotUpdateResponse).toList(),
                toGameResponses(bracket.getGames())
        );
    }

    private BracketResponses.SlotUpdate toSlotUpdateResponse(AdvancementResult.SlotUpdate update) {
        return new BracketResponses.SlotUpdate(update.gameNumber(), update.slot(), update.teamId());
    }

    public SeedingResponses.Score toScoreResponse(SeedingScore score) {
        return new SeedingResponses.Score(score.teamId(), score.roundNumber(), score.score());
    }

    public List<SeedingResponses.Score> toScoreResponses(Collection<SeedingScore> scores) {
        return scores.stream()
                .map(this::toScoreResponse)
                .toList();
    }

    public SeedingResponses.Teams toTeamsResponse(long eventId, List<Long> teamIds) {
        return new SeedingResponses.Teams(eventId, teamIds);
    }

    public SeedingResponses.Ranking toRankingResponse(SeedingRanking ranking) {
        return new SeedingResponses.Ranking(
                ranking.teamId(),
                ranking.seedAverage(),
                ranking.seedRank(),
                ranking.tiebreakerValue(),
                ranking.rawSeedScore()
        );
    }

    public List<SeedingResponses.Ranking> toRankingResponses(Collection<SeedingRanking> rankings) {
        return rankings.stream()
                .map(this::toRankingResponse)
                .toList();
    }

    public SeedingResponses.RecalculationSummary toRecalculationSummary(long eventId, SeedingRankingResult result) {
        return new SeedingResponses.RecalculationSummary(
                eventId,
                result.teamsRanked(),
                result.teamsUnranked(),
                toRankingResponses(result.rankings())
        );
    }
}
