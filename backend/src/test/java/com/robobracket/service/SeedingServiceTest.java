package com.robobracket.service;

import com.robobracket.config.RoboBracketProperties;
import com.robobracket.engine.SeedingRankingCalculator;
import com.robobracket.engine.SeedingRankingResult;
import com.robobracket.model.SeedingRanking;
import com.robobracket.model.SeedingScore;
import com.robobracket.repository.SeedingScoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeedingServiceTest {

    private static final long EVENT_ID = 7L;

    @Mock
    private SeedingScoreRepository seedingScoreRepository;

    private RoboBracketProperties roboBracketProperties;
    private SeedingService seedingService;

    @BeforeEach
    void setUp() {
        roboBracketProperties = new RoboBracketProperties();
        seedingService = new SeedingService(
                seedingScoreRepository,
                new SeedingRankingCalculator(),
                roboBracketProperties
        );
    }

    @Test
    void recordScoreStoresScoreForTheEvent() {
        when(seedingScoreRepository.saveScore(eq(EVENT_ID), any(SeedingScore.class)))
                .thenAnswer(invocation -> invocation.getArgument(1));

        SeedingScore saved = seedingService.recordScore(EVENT_ID, 11L, 2, 87.5);

        assertEquals(new SeedingScore(11L, 2, 87.5), saved);
    }

    @Test
    void recordScoreRejectsRoundsBeyondTheConfiguredMaximum() {
        ResponseStatusException ex = assertThrows(
                ResponseStatusException.class,
                () -> seedingService.recordScore(EVENT_ID, 11L, 4, 50.0)
        );

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(seedingScoreRepository, never()).saveScore(anyLong(), any());
    }

    @Test
    void recordScoreHonoursRaisedRoundLimit() {
        roboBracketProperties.getSeeding().setMaxRounds(5);
        when(seedingScoreRepository.saveScore(eq(EVENT_ID), any(SeedingScore.class)))
                .thenAnswer(invocation -> invocation.getArgument(1));

        assertEquals(5, seedingService.recordScore(EVENT_ID, 11L, 5, null).roundNumber());
    }

    @Test
    void recordScoreRejectsNonFiniteScores() {
        assertThrows(
                ResponseStatusException.class,
                () -> seedingService.recordScore(EVENT_ID, 11L, 1, Double.NaN)
        );
    }

    @Test
    void deleteScoreReportsMissingScore() {
        when(seedingScoreRepository.deleteScore(EVENT_ID, 11L, 1)).thenReturn(false);

        ResponseStatusException ex = assertThrows(
                ResponseStatusException.class,
                () -> seedingService.deleteScore(EVENT_ID, 11L, 1)
        );
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void recalculateRankingsReplacesStoredRankings() {
        when(seedingScoreRepository.findScoresByEventId(EVENT_ID)).thenReturn(List.of(
                new SeedingScore(1L, 1, 50.0),
                new SeedingScore(2L, 1, 70.0),
                new SeedingScore(3L, 1, null)
        ));

        SeedingRankingResult result = seedingService.recalculateRankings(EVENT_ID);

        ArgumentCaptor<List<SeedingRanking>> captor = ArgumentCaptor.forClass(List.class);
        verify(seedingScoreRepository).replaceRankings(eq(EVENT_ID), captor.capture());
        assertEquals(result.rankings(), captor.getValue());
        assertEquals(2, result.teamsRanked());
        assertEquals(1, result.teamsUnranked());
        assertEquals(2L, result.rankings().get(0).teamId());
    }

    @Test
    void getRankingsReturnsStoredRankingsWithoutRecalculating() {
        List<SeedingRanking> stored = List.of(new SeedingRanking(1L, 90.0, 1, 90.0, 1.0));
        when(seedingScoreRepository.findRankingsByEventId(EVENT_ID)).thenReturn(stored);

        assertSame(stored, seedingService.getRankings(EVENT_ID));
        verify(seedingScoreRepository, never()).replaceRankings(anyLong(), anyList());
    }

    @Test
    void getRankingsCalculatesWhenNothingIsStored() {
        when(seedingScoreRepository.findRankingsByEventId(EVENT_ID)).thenReturn(List.of());
        when(seedingScoreRepository.findScoresByEventId(EVENT_ID)).thenReturn(List.of(new SeedingScore(4L, 1, 10.0)));

        List<SeedingRanking> rankings = seedingService.getRankings(EVENT_ID);

        assertEquals(1, rankings.size());
        assertEquals(1, rankings.get(0).seedRank());
    }

    @Test
    void seedOrderListsRankedTeamsOnlyByDefault() {
        when(seedingScoreRepository.findScoresByEventId(EVENT_ID)).thenReturn(List.of(
                new SeedingScore(1L, 1, 50.0),
                new SeedingScore(2L, 1, null),
                new SeedingScore(3L, 1, 80.0)
        ));

        assertEquals(List.of(3L, 1L), seedingService.seedOrder(EVENT_ID));
    }

    @Test
    void seedOrderAppendsUnrankedTeamsWhenConfigured() {
        roboBracketProperties.getSeeding().setIncludeUnrankedTeams(true);
        when(seedingScoreRepository.findScoresByEventId(EVENT_ID)).thenReturn(List.of(
                new SeedingScore(1L, 1, 50.0),
                new SeedingScore(2L, 1, null),
                new SeedingScore(3L, 1, 80.0)
        ));

        assertEquals(List.of(3L, 1L, 2L), seedingService.seedOrder(EVENT_ID));
    }

    @Test
    void rosteredTeamsWithoutScoresAreRankedAsUnranked() {
        when(seedingScoreRepository.findTeamIdsByEventId(EVENT_ID)).thenReturn(List.of(1L, 2L, 3L, 4L));
        when(seedingScoreRepository.findScoresByEventId(EVENT_ID)).thenReturn(List.of(
                new SeedingScore(1L, 1, 50.0),
                new SeedingScore(3L, 1, 80.0)
        ));

        SeedingRankingResult result = seedingService.recalculateRankings(EVENT_ID);

        assertEquals(2, result.teamsRanked());
        assertEquals(2, result.teamsUnranked());
        assertEquals(
                List.of(3L, 1L, 2L, 4L),
                result.rankings().stream().map(SeedingRanking::teamId).toList()
        );
        assertNull(result.rankings().get(2).seedRank());
    }

    @Test
    void seedOrderAppendsRosteredTeamsWithoutScoreRowsWhenConfigured() {
        roboBracketProperties.getSeeding().setIncludeUnrankedTeams(true);
        when(seedingScoreRepository.findTeamIdsByEventId(EVENT_ID)).thenReturn(List.of(5L, 6L));
        when(seedingScoreRepository.findScoresByEventId(EVENT_ID)).thenReturn(List.of(new SeedingScore(6L, 1, 40.0)));

        assertEquals(List.of(6L, 5L), seedingService.seedOrder(EVENT_ID));
    }

    @Test
    void registerTeamsStoresRoster() {
        when(seedingScoreRepository.replaceTeams(EVENT_ID, List.of(9L, 8L))).thenReturn(List.of(8L, 9L));

        assertEquals(List.of(8L, 9L), seedingService.registerTeams(EVENT_ID, List.of(9L, 8L)));
    }

    @Test
    void registerTeamsRejectsDuplicateTeams() {
        ResponseStatusException ex = assertThrows(
                ResponseStatusException.class,
                () -> seedingService.registerTeams(EVENT_ID, List.of(8L, 8L))
        );

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(seedingScoreRepository, never()).replaceTeams(anyLong(), any());
    }
}
