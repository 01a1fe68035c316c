package com.robobracket.service;

import com.robobracket.engine.AdvancementResult;
import com.robobracket.model.Bracket;

import java.util.List;

/**
 * Outcome of a result submission. {@code replay} marks a submission that matched the stored result and changed
 * nothing.
 */
public record RecordedResult(
        Bracket bracket,
        List<AdvancementResult.SlotUpdate> slotUpdates,
        boolean replay
) {
}
