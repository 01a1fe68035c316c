package com.robobracket.repository;

import com.robobracket.model.Bracket;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps brackets in memory. Every read and write goes through {@link Bracket#snapshot()} so callers never share
 * game instances with the store.
 */
@Repository
public class InMemoryBracketRepository implements BracketRepository {

    private final Map<UUID, Bracket> brackets = new ConcurrentHashMap<>();

    @Override
    public Bracket save(Bracket bracket) {
        Objects.requireNonNull(bracket, "bracket is required");
        if (bracket.getBracketId() == null) {
            bracket.setBracketId(UUID.randomUUID());
        }
        brackets.put(bracket.getBracketId(), bracket.snapshot());
        return bracket.snapshot();
    }

    @Override
    public Optional<Bracket> findById(UUID bracketId) {
        Bracket stored = brackets.get(bracketId);
        return stored == null ? Optional.empty() : Optional.of(stored.snapshot());
    }

    @Override
    public List<Bracket> findByEventIdOrderByCreatedAtAsc(long eventId) {
        return brackets.values().stream()
                .filter(bracket -> bracket.getEventId() == eventId)
                .sorted(Comparator.comparing(Bracket::getCreatedAt))
                .map(Bracket::snapshot)
                .toList();
    }

    @Override
    public List<Bracket> findAllByOrderByCreatedAtDesc() {
        return brackets.values().stream()
                .sorted(Comparator.comparing(Bracket::getCreatedAt).reversed())
                .map(Bracket::snapshot)
                .toList();
    }

    @Override
    public boolean existsById(UUID bracketId) {
        return brackets.containsKey(bracketId);
    }

    @Override
    public void deleteById(UUID bracketId) {
        brackets.remove(bracketId);
    }
}
