package com.robobracket.repository;

import com.robobracket.model.Bracket;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BracketRepository {

    Bracket save(Bracket bracket);

    Optional<Bracket> findById(UUID bracketId);

    List<Bracket> findByEventIdOrderByCreatedAtAsc(long eventId);

    List<Bracket> findAllByOrderByCreatedAtDesc();

    boolean existsById(UUID bracketId);

    void deleteById(UUID bracketId);
}
