package com.clinicflow.dispensing.model;

import org.springframework.lang.Nullable;

import java.util.UUID;

/**
 * Result of writing one dispensing record. {@code tier} is unknown for replayed batches.
 */
public record DispensingItemOutcome(
        int drugIndex,
        String drugName,
        @Nullable MatchTier tier,
        @Nullable UUID inventoryDrugId,
        int quantity,
        @Nullable UUID recordId,
        @Nullable String error
) {

    public boolean succeeded() {
        return recordId != null;
    }
}
