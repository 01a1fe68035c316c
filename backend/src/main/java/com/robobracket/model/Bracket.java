package com.robobracket.model;

import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Getter
@Setter
public class Bracket {

    private UUID bracketId;
    private long eventId;
    private String name;
    private int bracketSize;
    private BracketStatus status = BracketStatus.SETUP;
    private List<BracketEntry> entries = new ArrayList<>();
    private List<BracketGame> games = new ArrayList<>();
    private Long championTeamId;
    private OffsetDateTime createdAt = OffsetDateTime.now();
    private OffsetDateTime updatedAt = OffsetDateTime.now();
    private OffsetDateTime completedAt;

    public boolean hasGames() {
        return games != null && !games.isEmpty();
    }

    /**
     * Copy whose game list can be handed out without exposing the stored games.
     */
    public Bracket snapshot() {
        Bracket copy = new Bracket();
        copy.bracketId = bracketId;
        copy.eventId = eventId;
        copy.name = name;
        copy.bracketSize = bracketSize;
        copy.status = status;
        copy.entries = new ArrayList<>(entries);
        copy.games = games.stream().map(BracketGame::copy).collect(Collectors.toCollection(ArrayList::new));
        copy.championTeamId = championTeamId;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.completedAt = completedAt;
        return copy;
    }
}
