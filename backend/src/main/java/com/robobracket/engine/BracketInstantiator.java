package com.robobracket.engine;

import com.robobracket.model.BracketEntry;
import com.robobracket.model.BracketGame;
import com.robobracket.model.GameSlot;
import com.robobracket.model.GameSlotSource;
import com.robobracket.model.GameStatus;
import com.robobracket.model.GameTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a template and a seeded entry list into concrete games. Only seed sources are resolved here;
 * winner/loser sources are filled later by {@link ByeResolutionEngine} and {@link AdvancementEngine}.
 */
@Component
public class BracketInstantiator {

    public List<BracketGame> instantiate(List<GameTemplate> templates, List<BracketEntry> entries) {
        if (templates == null || templates.isEmpty()) {
            throw new IllegalArgumentException("Bracket template is required");
        }
        int bracketSize = templates.get(0).bracketSize();
        Map<Integer, BracketEntry> entriesBySeed = validateEntries(bracketSize, entries);

        List<BracketGame> games = new ArrayList<>(templates.size());
        for (GameTemplate template : templates) {
            if (template.bracketSize() != bracketSize) {
                throw new IllegalArgumentException("Template mixes bracket sizes " + bracketSize
                        + " and " + template.bracketSize());
            }
            BracketGame game = BracketGame.fromTemplate(template);
            boolean team1Bye = assignSeed(game, GameSlot.TEAM1, entriesBySeed);
            boolean team2Bye = assignSeed(game, GameSlot.TEAM2, entriesBySeed);

            if (game.hasBothTeams()) {
                game.setStatus(GameStatus.READY);
            } else if (team2Bye && game.getTeam1Id() != null) {
                markBye(game, game.getTeam1Id());
            } else if (team1Bye && game.getTeam2Id() != null) {
                markBye(game, game.getTeam2Id());
            }
            games.add(game);
        }
        return games;
    }

    /**
     * Checks the entry set as a whole: one entry per seed position, byes without teams, no team twice,
     * and no first-round game between two byes.
     */
    public Map<Integer, BracketEntry> validateEntries(int bracketSize, List<BracketEntry> entries) {
        if (entries == null || entries.size() != bracketSize) {
            throw new InvalidEntryException("Bracket of size " + bracketSize + " requires exactly "
                    + bracketSize + " entries, got " + (entries == null ? 0 : entries.size()));
        }

        Map<Integer, BracketEntry> entriesBySeed = new HashMap<>();
        Set<Long> teamIds = new HashSet<>();
        for (BracketEntry entry : entries) {
            if (entry == null) {
                throw new InvalidEntryException("Bracket entry is required");
            }
            int seed = entry.seedPosition();
            if (seed < 1 || seed > bracketSize) {
                throw new InvalidEntryException("Seed position out of range 1.." + bracketSize + ": " + seed);
            }
            if (entry.bye() == (entry.teamId() != null)) {
                throw new InvalidEntryException(
                        "Invalid entry at seed " + seed + ": bye requires no team, non-bye requires a team");
            }
            if (entriesBySeed.putIfAbsent(seed, entry) != null) {
                throw new InvalidEntryException("Duplicate seed position: " + seed);
            }
            if (entry.teamId() != null && !teamIds.add(entry.teamId())) {
                throw new InvalidEntryException("Team entered more than once: " + entry.teamId());
            }
        }

        for (SeedOrderGenerator.SeedPair pair : SeedOrderGenerator.firstRoundPairs(bracketSize)) {
            if (entriesBySeed.get(pair.topSeed()).bye() && entriesBySeed.get(pair.bottomSeed()).bye()) {
                throw new InvalidEntryException("Seeds " + pair.topSeed() + " and " + pair.bottomSeed()
                        + " are both byes and would meet in the first round");
            }
        }
        return entriesBySeed;
    }

    private static boolean assignSeed(BracketGame game, GameSlot slot, Map<Integer, BracketEntry> entriesBySeed) {
        GameSlotSource source = game.getSource(slot);
        if (!source.isSeed()) {
            return false;
        }
        BracketEntry entry = entriesBySeed.get(source.reference());
        if (entry == null) {
            throw new InvalidEntryException("Template references missing seed position: " + source.reference());
        }
        game.setTeam(slot, entry.teamId());
        return entry.bye();
    }

    private static void markBye(BracketGame game, Long winnerId) {
        game.setStatus(GameStatus.BYE);
        game.setWinnerId(winnerId);
    }
}
