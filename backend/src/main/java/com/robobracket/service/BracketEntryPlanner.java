package com.robobracket.service;

import com.robobracket.engine.BracketTemplateBuilder;
import com.robobracket.engine.InvalidEntryException;
import com.robobracket.engine.UnsupportedSizeException;
import com.robobracket.model.BracketEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns an ordered team list (best seed first) into a complete entry set for a bracket.
 */
@Component
public class BracketEntryPlanner {

    public int chooseBracketSize(int teamCount) {
        if (teamCount < 2) {
            throw new UnsupportedSizeException("A bracket needs at least 2 teams, got " + teamCount);
        }
        for (int size : BracketTemplateBuilder.SUPPORTED_SIZES) {
            if (size >= teamCount) {
                return size;
            }
        }
        throw new UnsupportedSizeException("No supported bracket size fits " + teamCount + " teams; supported sizes: "
                + BracketTemplateBuilder.SUPPORTED_SIZES);
    }

    /**
     * Team {@code i} of the list gets seed {@code i + 1}; remaining seed positions become byes. At least half of
     * the slots must hold teams so that no first-round game is played between two byes.
     */
    public List<BracketEntry> planEntries(List<Long> orderedTeamIds, int bracketSize) {
        if (!BracketTemplateBuilder.isSupportedSize(bracketSize)) {
            throw UnsupportedSizeException.forSize(bracketSize);
        }
        if (orderedTeamIds == null || orderedTeamIds.isEmpty()) {
            throw new InvalidEntryException("At least one team is required");
        }
        if (orderedTeamIds.size() > bracketSize) {
            throw new InvalidEntryException(orderedTeamIds.size() + " teams do not fit a bracket of size "
                    + bracketSize);
        }
        if (orderedTeamIds.size() * 2 < bracketSize) {
            throw new InvalidEntryException("A bracket of size " + bracketSize + " needs at least "
                    + bracketSize / 2 + " teams, got " + orderedTeamIds.size());
        }

        Set<Long> seen = new HashSet<>();
        List<BracketEntry> entries = new ArrayList<>(bracketSize);
        for (int i = 0; i < orderedTeamIds.size(); i++) {
            Long teamId = orderedTeamIds.get(i);
            if (teamId == null) {
                throw new InvalidEntryException("Team id is required at position " + (i + 1));
            }
            if (!seen.add(teamId)) {
                throw new InvalidEntryException("Team listed more than once: " + teamId);
            }
            entries.add(BracketEntry.team(i + 1, teamId));
        }
        for (int seed = orderedTeamIds.size() + 1; seed <= bracketSize; seed++) {
            entries.add(BracketEntry.bye(seed));
        }
        return entries;
    }
}
