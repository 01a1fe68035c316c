package com.robobracket.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class BracketRequests {

    private BracketRequests() {
    }

    public record CreateBracketRequest(
            @NotNull(message = "eventId is required")
            @Positive(message = "eventId must be positive")
            Long eventId,

            @NotBlank(message = "name is required")
            @Size(max = 120, message = "name must be at most 120 characters")
            String name,

            @NotNull(message = "bracketSize is required")
            Integer bracketSize
    ) {
    }

    public record EntryRequest(
            @NotNull(message = "seedPosition is required")
            @Min(value = 1, message = "seedPosition must be at least 1")
            Integer seedPosition,

            Long teamId,

            Boolean bye
    ) {
        /**
         * An entry without an explicit flag is a bye exactly when it names no team.
         */
        public boolean isByeEntry() {
            return bye != null ? bye : teamId == null;
        }
    }

    public record ReplaceEntriesRequest(
            @NotEmpty(message = "entries are required")
            List<@Valid @NotNull(message = "entry is required") EntryRequest> entries
    ) {
    }

    public record RecordResultRequest(
            @NotNull(message = "winnerId is required")
            Long winnerId,

            Long loserId,

            boolean override
    ) {
        @AssertTrue(message = "winnerId and loserId must differ")
        public boolean isLoserDifferentFromWinner() {
            return loserId == null || !loserId.equals(winnerId);
        }
    }
}
