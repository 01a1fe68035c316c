package com.robobracket.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Where a game slot gets its team from: a seed position, or the winner/loser of an earlier game.
 * Serialized as {@code seed:K}, {@code winner:G} or {@code loser:G}.
 */
public record GameSlotSource(
        Type type,
        int reference
) {

    public enum Type {
        SEED("seed"),
        WINNER_OF("winner"),
        LOSER_OF("loser");

        private final String prefix;

        Type(String prefix) {
            this.prefix = prefix;
        }

        static Type fromPrefix(String prefix) {
            for (Type type : values()) {
                if (type.prefix.equals(prefix)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown slot source type: " + prefix);
        }
    }

    public GameSlotSource {
        Objects.requireNonNull(type, "type is required");
        if (reference < 1) {
            throw new IllegalArgumentException("Slot source reference must be positive: " + reference);
        }
    }

    public static GameSlotSource seed(int position) {
        return new GameSlotSource(Type.SEED, position);
    }

    public static GameSlotSource winnerOf(int gameNumber) {
        return new GameSlotSource(Type.WINNER_OF, gameNumber);
    }

    public static GameSlotSource loserOf(int gameNumber) {
        return new GameSlotSource(Type.LOSER_OF, gameNumber);
    }

    public boolean isSeed() {
        return type == Type.SEED;
    }

    /**
     * True for winner/loser references, which point at another game of the bracket.
     */
    public boolean referencesGame() {
        return type != Type.SEED;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GameSlotSource parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Slot source is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        int separator = normalized.indexOf(':');
        if (separator <= 0 || separator == normalized.length() - 1) {
            throw new IllegalArgumentException("Malformed slot source: " + value);
        }
        Type type = Type.fromPrefix(normalized.substring(0, separator));
        try {
            return new GameSlotSource(type, Integer.parseInt(normalized.substring(separator + 1)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Malformed slot source: " + value, ex);
        }
    }

    @JsonValue
    @Override
    public String toString() {
        return type.prefix + ":" + reference;
    }
}
