package com.robobracket.controller;

import com.robobracket.dto.SeedingRequests;
import com.robobracket.dto.SeedingResponses;
import com.robobracket.mapper.BracketResponseMapper;
import com.robobracket.model.SeedingScore;
import com.robobracket.service.SeedingService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/events/{eventId}/seeding")
public class SeedingController {

    private final SeedingService seedingService;
    private final BracketResponseMapper bracketResponseMapper;

    public SeedingController(SeedingService seedingService, BracketResponseMapper bracketResponseMapper) {
        this.seedingService = seedingService;
        this.bracketResponseMapper = bracketResponseMapper;
    }

    @PutMapping("/teams")
    public ResponseEntity<SeedingResponses.Teams> registerTeams(
            @PathVariable long eventId,
            @Valid @RequestBody SeedingRequests.RegisterTeamsRequest request
    ) {
        List<Long> roster = seedingService.registerTeams(eventId, request.teamIds());
        return ResponseEntity.ok(bracketResponseMapper.toTeamsResponse(eventId, roster));
    }

    @GetMapping("/teams")
    public ResponseEntity<SeedingResponses.Teams> listTeams(@PathVariable long eventId) {
        return ResponseEntity.ok(bracketResponseMapper.toTeamsResponse(eventId, seedingService.listTeams(eventId)));
    }

    @PutMapping("/scores")
    public ResponseEntity<SeedingResponses.Score> recordScore(
            @PathVariable long eventId,
            @Valid @RequestBody SeedingRequests.RecordScoreRequest request
    ) {
        SeedingScore score = seedingService.recordScore(
                eventId,
                request.teamId(),
                request.roundNumber(),
                request.score()
        );
        return ResponseEntity.ok(bracketResponseMapper.toScoreResponse(score));
    }

    @DeleteMapping("/scores/{teamId}/{roundNumber}")
    public ResponseEntity<Void> deleteScore(
            @PathVariable long eventId,
            @PathVariable long teamId,
            @PathVariable int roundNumber
    ) {
        seedingService.deleteScore(eventId, teamId, roundNumber);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/scores")
    public ResponseEntity<List<SeedingResponses.Score>> listScores(@PathVariable long eventId) {
        return ResponseEntity.ok(bracketResponseMapper.toScoreResponses(seedingService.listScores(eventId)));
    }

    @GetMapping("/rankings")
    public ResponseEntity<List<SeedingResponses.Ranking>> getRankings(@PathVariable long eventId) {
        return ResponseEntity.ok(bracketResponseMapper.toRankingResponses(seedingService.getRankings(eventId)));
    }

    @PostMapping("/rankings/recalculate")
    public ResponseEntity<SeedingResponses.RecalculationSummary> recalculateRankings(@PathVariable long eventId) {
        return ResponseEntity.ok(
                bracketResponseMapper.toRecalculationSummary(eventId, seedingService.recalculateRankings(eventId))
        );
    }
}
