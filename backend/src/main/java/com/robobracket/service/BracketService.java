package com.robobracket.service;

import com.robobracket.config.RoboBracketProperties;
import com.robobracket.engine.AdvancementEngine;
import com.robobracket.engine.AdvancementResult;
import com.robobracket.engine.AlreadyCompletedException;
import com.robobracket.engine.BracketInstantiator;
import com.robobracket.engine.BracketTemplateBuilder;
import com.robobracket.engine.ByeResolutionEngine;
import com.robobracket.engine.ByeResolutionResult;
import com.robobracket.engine.GameNotFoundException;
import com.robobracket.engine.InvalidEntryException;
import com.robobracket.engine.UnsupportedSizeException;
import com.robobracket.model.Bracket;
import com.robobracket.model.BracketEntry;
import com.robobracket.model.BracketGame;
import com.robobracket.model.BracketStatus;
import com.robobracket.model.GameStatus;
import com.robobracket.model.GameTemplate;
import com.robobracket.repository.BracketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Bracket lifecycle on top of the bracket engines.
 *
 * <p>All mutations of one bracket run while holding that bracket's monitor. Engines work on copies, so a rejected
 * submission leaves the stored bracket untouched; the engine output is written back with a single save.
 */
@Service
public class BracketService {

    private static final Logger log = LoggerFactory.getLogger(BracketService.class);

    private static final int MAX_NAME_LENGTH = 120;

    private final BracketRepository bracketRepository;
    private final BracketTemplateService bracketTemplateService;
    private final BracketInstantiator bracketInstantiator;
    private final ByeResolutionEngine byeResolutionEngine;
    private final AdvancementEngine advancementEngine;
    private final BracketEntryPlanner bracketEntryPlanner;
    private final SeedingService seedingService;
    private final RoboBracketProperties roboBracketProperties;
    private final ConcurrentMap<UUID, Object> bracketMonitors = new ConcurrentHashMap<>();

    public BracketService(
            BracketRepository bracketRepository,
            BracketTemplateService bracketTemplateService,
            BracketInstantiator bracketInstantiator,
            ByeResolutionEngine byeResolutionEngine,
            AdvancementEngine advancementEngine,
            BracketEntryPlanner bracketEntryPlanner,
            SeedingService seedingService,
            RoboBracketProperties roboBracketProperties
    ) {
        this.bracketRepository = bracketRepository;
        this.bracketTemplateService = bracketTemplateService;
        this.bracketInstantiator = bracketInstantiator;
        this.byeResolutionEngine = byeResolutionEngine;
        this.advancementEngine = advancementEngine;
        this.bracketEntryPlanner = bracketEntryPlanner;
        this.seedingService = seedingService;
        this.roboBracketProperties = roboBracketProperties;
    }

    public Bracket createBracket(long eventId, String name, int bracketSize) {
        if (!BracketTemplateBuilder.isSupportedSize(bracketSize)) {
            throw UnsupportedSizeException.forSize(bracketSize);
        }
        if (name == null || name.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "name must be at most " + MAX_NAME_LENGTH + " characters"
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        Bracket bracket = new Bracket();
        bracket.setBracketId(UUID.randomUUID());
        bracket.setEventId(eventId);
        bracket.setName(name.trim());
        bracket.setBracketSize(bracketSize);
        bracket.setStatus(BracketStatus.SETUP);
        bracket.setCreatedAt(now);
        bracket.setUpdatedAt(now);

        Bracket saved = bracketRepository.save(bracket);
        log.info("Created bracket {} for event {} with size {}", saved.getBracketId(), eventId, bracketSize);
        return saved;
    }

    public Bracket getBracket(UUID bracketId) {
        return bracketRepository.findById(bracketId)
                .orElseThrow(() -> bracketNotFound(bracketId));
    }

    public List<Bracket> listBrackets(Long eventId) {
        if (eventId == null) {
            return bracketRepository.findAllByOrderByCreatedAtDesc();
        }
        return bracketRepository.findByEventIdOrderByCreatedAtAsc(eventId);
    }

    public void deleteBracket(UUID bracketId) {
        withBracketLock(bracketId, () -> {
            requireBracket(bracketId);
            bracketRepository.deleteById(bracketId);
            log.info("Deleted bracket {}", bracketId);
            return null;
        });
    }

    public Bracket replaceEntries(UUID bracketId, List<BracketEntry> entries) {
        return withBracketLock(bracketId, () -> {
            Bracket bracket = requireBracket(bracketId);
            requireNoGames(bracket);
            bracketInstantiator.validateEntries(bracket.getBracketSize(), entries);
            return saveEntries(bracket, entries);
        });
    }

    /**
     * Seeds the bracket from the event's current seeding rankings.
     */
    public Bracket populateEntriesFromRankings(UUID bracketId) {
        return withBracketLock(bracketId, () -> {
            Bracket bracket = requireBracket(bracketId);
            requireNoGames(bracket);
            List<Long> seedOrder = seedingService.seedOrder(bracket.getEventId());
            List<BracketEntry> entries = bracketEntryPlanner.planEntries(seedOrder, bracket.getBracketSize());
            log.info("Seeding bracket {} with {} ranked teams", bracketId, seedOrder.size());
            return saveEntries(bracket, entries);
        });
    }

    public Bracket generateGames(UUID bracketId) {
        return withBracketLock(bracketId, () -> {
            Bracket bracket = requireBracket(bracketId);
            if (bracket.hasGames()) {
                throw new ResponseStatusException(
                        HttpStatus.CONFLICT,
                        "Bracket games already generated: " + bracketId
                );
            }
            if (bracket.getEntries().isEmpty()) {
                throw new InvalidEntryException("Bracket " + bracketId + " has no entries");
            }

            List<GameTemplate> template = bracketTemplateService.getTemplate(bracket.getBracketSize());
            List<BracketGame> games = bracketInstantiator.instantiate(template, bracket.getEntries());
            ByeResolutionResult resolution = byeResolutionEngine.resolve(games);

            OffsetDateTime now = OffsetDateTime.now();
            bracket.setGames(new ArrayList<>(resolution.games()));
            bracket.setStatus(BracketStatus.IN_PROGRESS);
            bracket.setUpdatedAt(now);
            applyChampion(bracket, now);

            Bracket saved = bracketRepository.save(bracket);
            log.info(
                    "Generated {} games for bracket {} ({} byes resolved)",
                    saved.getGames().size(),
                    bracketId,
                    resolution.byeGamesResolved()
            );
            return saved;
        });
    }

    public List<BracketGame> getGames(UUID bracketId) {
        return getBracket(bracketId).getGames();
    }

    /**
     * Records a played game. Submitting the stored result of a completed game again is a no-op; a different
     * result needs {@code override} and is rejected while overrides are disabled.
     */
    public RecordedResult recordResult(UUID bracketId, int gameNumber, Long winnerId, Long loserId, boolean override) {
        return withBracketLock(bracketId, () -> {
            Bracket bracket = requireBracket(bracketId);
            if (!bracket.hasGames()) {
                throw new ResponseStatusException(
                        HttpStatus.CONFLICT,
                        "Bracket games have not been generated: " + bracketId
                );
            }

            BracketGame game = findGame(bracket, gameNumber);
            if (!override && isReplay(game, winnerId, loserId)) {
                log.info("Ignoring repeated result for game {} of bracket {}", gameNumber, bracketId);
                return new RecordedResult(bracket, List.of(), true);
            }
            if (override && !roboBracketProperties.getBracket().isAllowResultOverride()) {
                throw new AlreadyCompletedException("Result overrides are disabled");
            }

            AdvancementResult result = advancementEngine.advance(
                    bracket.getGames(),
                    gameNumber,
                    winnerId,
                    loserId,
                    override
            );

            OffsetDateTime now = OffsetDateTime.now();
            bracket.setGames(new ArrayList<>(result.games()));
            bracket.setUpdatedAt(now);
            applyChampion(bracket, now);

            Bracket saved = bracketRepository.save(bracket);
            log.info(
                    "Recorded game {} of bracket {}: winner {}{}",
                    gameNumber,
                    bracketId,
                    winnerId,
                    override ? " (override)" : ""
            );
            return new RecordedResult(saved, result.slotUpdates(), false);
        });
    }

    public Bracket resetGames(UUID bracketId) {
        return withBracketLock(bracketId, () -> {
            Bracket bracket = requireBracket(bracketId);
            bracket.setGames(new ArrayList<>());
            bracket.setStatus(BracketStatus.SETUP);
            bracket.setChampionTeamId(null);
            bracket.setCompletedAt(null);
            bracket.setUpdatedAt(OffsetDateTime.now());
            Bracket saved = bracketRepository.save(bracket);
            log.info("Reset games of bracket {}", bracketId);
            return saved;
        });
    }

    private Bracket saveEntries(Bracket bracket, List<BracketEntry> entries) {
        List<BracketEntry> ordered = new ArrayList<>(entries);
        ordered.sort(Comparator.comparingInt(BracketEntry::seedPosition));
        bracket.setEntries(ordered);
        bracket.setUpdatedAt(OffsetDateTime.now());
        return bracketRepository.save(bracket);
    }

    private void applyChampion(Bracket bracket, OffsetDateTime now) {
        Optional<Long> champion = advancementEngine.championOf(bracket.getGames());
        if (champion.isPresent()) {
            if (bracket.getStatus() != BracketStatus.COMPLETED) {
                log.info("Bracket {} completed, champion team {}", bracket.getBracketId(), champion.get());
                bracket.setCompletedAt(now);
            }
            bracket.setStatus(BracketStatus.COMPLETED);
            bracket.setChampionTeamId(champion.get());
            return;
        }
        if (bracket.getStatus() == BracketStatus.COMPLETED) {
            bracket.setStatus(BracketStatus.IN_PROGRESS);
            bracket.setChampionTeamId(null);
            bracket.setCompletedAt(null);
        }
    }

    private static boolean isReplay(BracketGame game, Long winnerId, Long loserId) {
        return game.getStatus() == GameStatus.COMPLETED
                && winnerId != null
                && winnerId.equals(game.getWinnerId())
                && (loserId == null || Objects.equals(loserId, game.getLoserId()));
    }

    private static BracketGame findGame(Bracket bracket, int gameNumber) {
        return bracket.getGames().stream()
                .filter(game -> game.getGameNumber() == gameNumber)
                .findFirst()
                .orElseThrow(() -> new GameNotFoundException(gameNumber));
    }

    private static void requireNoGames(Bracket bracket) {
        if (bracket.hasGames()) {
            throw new InvalidEntryException("Entries of bracket " + bracket.getBracketId()
                    + " cannot change after games were generated");
        }
    }

    private Bracket requireBracket(UUID bracketId) {
        return bracketRepository.findById(bracketId)
                .orElseThrow(() -> bracketNotFound(bracketId));
    }

    /**
     * Runs {@code action} holding the bracket's monitor. Monitors only exist for stored brackets: unknown ids are
     * rejected before one is created, and the monitor is dropped once its bracket is gone.
     */
    private <T> T withBracketLock(UUID bracketId, Supplier<T> action) {
        if (!bracketRepository.existsById(bracketId)) {
            throw bracketNotFound(bracketId);
        }
        Object monitor = bracketMonitors.computeIfAbsent(bracketId, ignored -> new Object());
        synchronized (monitor) {
            try {
                return action.get();
            } finally {
                if (!bracketRepository.existsById(bracketId)) {
                    bracketMonitors.remove(bracketId, monitor);
                }
            }
        }
    }

    int bracketMonitorCount() {
        return bracketMonitors.size();
    }

    private static ResponseStatusException bracketNotFound(UUID bracketId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Bracket not found: " + bracketId);
    }
}
