package com.robobracket.controller;

import com.robobracket.dto.BracketRequests;
import com.robobracket.dto.BracketResponses;
import com.robobracket.mapper.BracketResponseMapper;
import com.robobracket.model.Bracket;
import com.robobracket.model.BracketEntry;
import com.robobracket.service.BracketService;
import com.robobracket.service.BracketTemplateService;
import com.robobracket.service.RecordedResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/brackets")
public class BracketController {

    private final BracketService bracketService;
    private final BracketTemplateService bracketTemplateService;
    private final BracketResponseMapper bracketResponseMapper;

    public BracketController(
            BracketService bracketService,
            BracketTemplateService bracketTemplateService,
            BracketResponseMapper bracketResponseMapper
    ) {
        this.bracketService = bracketService;
        this.bracketTemplateService = bracketTemplateService;
        this.bracketResponseMapper = bracketResponseMapper;
    }

    @GetMapping("/templates/{size}")
    public ResponseEntity<BracketResponses.Template> getTemplate(@PathVariable int size) {
        return ResponseEntity.ok(
                bracketResponseMapper.toTemplateResponse(size, bracketTemplateService.getTemplate(size))
        );
    }

    @PostMapping
    public ResponseEntity<BracketResponses.BracketDetail> createBracket(
            @Valid @RequestBody BracketRequests.CreateBracketRequest request
    ) {
        Bracket bracket = bracketService.createBracket(request.eventId(), request.name(), request.bracketSize());
        return ResponseEntity.status(HttpStatus.CREATED).body(bracketResponseMapper.toBracketDetailResponse(bracket));
    }

    @GetMapping
    public ResponseEntity<List<BracketResponses.BracketSummary>> listBrackets(
            @RequestParam(required = false) Long eventId
    ) {
        return ResponseEntity.ok(bracketResponseMapper.toBracketSummaryResponses(bracketService.listBrackets(eventId)));
    }

    @GetMapping("/{bracketId}")
    public ResponseEntity<BracketResponses.BracketDetail> getBracket(@PathVariable UUID bracketId) {
        return ResponseEntity.ok(bracketResponseMapper.toBracketDetailResponse(bracketService.getBracket(bracketId)));
    }

    @DeleteMapping("/{bracketId}")
    public ResponseEntity<Void> deleteBracket(@PathVariable UUID bracketId) {
        bracketService.deleteBracket(bracketId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{bracketId}/entries")
    public ResponseEntity<BracketResponses.BracketDetail> replaceEntries(
            @PathVariable UUID bracketId,
            @Valid @RequestBody BracketRequests.ReplaceEntriesRequest request
    ) {
        List<BracketEntry> entries = request.entries().stream()
                .map(entry -> new BracketEntry(entry.seedPosition(), entry.teamId(), entry.isByeEntry()))
                .toList();
        Bracket bracket = bracketService.replaceEntries(bracketId, entries);
        return ResponseEntity.ok(bracketResponseMapper.toBracketDetailResponse(bracket));
    }

    @PostMapping("/{bracketId}/entries/from-rankings")
    public ResponseEntity<BracketResponses.BracketDetail> populateEntriesFromRankings(@PathVariable UUID bracketId) {
        Bracket bracket = bracketService.populateEntriesFromRankings(bracketId);
        return ResponseEntity.ok(bracketResponseMapper.toBracketDetailResponse(bracket));
    }

    @PostMapping("/{bracketId}/games")
    public ResponseEntity<BracketResponses.BracketDetail> generateGames(@PathVariable UUID bracketId) {
        Bracket bracket = bracketService.generateGames(bracketId);
        return ResponseEntity.status(HttpStatus.CREATED).body(bracketResponseMapper.toBracketDetailResponse(bracket));
    }

    @GetMapping("/{bracketId}/games")
    public ResponseEntity<List<BracketResponses.Game>> getGames(@PathVariable UUID bracketId) {
        return ResponseEntity.ok(bracketResponseMapper.toGameResponses(bracketService.getGames(bracketId)));
    }

    @DeleteMapping("/{bracketId}/games")
    public ResponseEntity<BracketResponses.BracketDetail> resetGames(@PathVariable UUID bracketId) {
        return ResponseEntity.ok(bracketResponseMapper.toBracketDetailResponse(bracketService.resetGames(bracketId)));
    }

    @PostMapping("/{bracketId}/games/{gameNumber}/result")
    public ResponseEntity<BracketResponses.GameResult> recordResult(
            @PathVariable UUID bracketId,
            @PathVariable int gameNumber,
            @Valid @RequestBody BracketRequests.RecordResultRequest request
    ) {
        RecordedResult recorded = bracketService.recordResult(
                bracketId,
                gameNumber,
                request.winnerId(),
                request.loserId(),
                request.override()
        );
        return ResponseEntity.ok(bracketResponseMapper.toGameResultResponse(gameNumber, recorded));
    }
}
