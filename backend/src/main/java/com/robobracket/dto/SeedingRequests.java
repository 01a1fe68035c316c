package com.robobracket.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public final class SeedingRequests {

    private SeedingRequests() {
    }

    public record RecordScoreRequest(
            @NotNull(message = "teamId is required")
            @Positive(message = "teamId must be positive")
            Long teamId,

            @NotNull(message = "roundNumber is required")
            @Min(value = 1, message = "roundNumber must be at least 1")
            Integer roundNumber,

            @PositiveOrZero(message = "score must be non-negative")
            Double score
    ) {
    }

    public record RegisterTeamsRequest(
            @NotNull(message = "teamIds are required")
            List<@NotNull(message = "teamId is required") @Positive(message = "teamId must be positive") Long> teamIds
    ) {
    }
}
