package com.assettrack.inventory.importer;

import java.time.LocalDateTime;

/** Assignment row; {@code assetId == 0} means the id was empty or not a number. */
public record AssignmentCandidate(
        long assetId,
        String userId,
        String purpose,
        Coerced<LocalDateTime> expectedReturnAt,
        String notes
) implements CandidateRecord {

    @Override
    public ImportKind kind() { return ImportKind.ASSIGNMENTS; }
}
