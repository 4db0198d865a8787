package com.clinicflow.dispensing.model;

import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.inventory.InventoryItem;
import org.springframework.lang.Nullable;

/**
 * Outcome of reconciling one prescribed entry. {@code position} is the entry's index in the list it came
 * from.
 */
public record MatchResult(
        int position,
        PrescribedDrug prescribed,
        @Nullable InventoryItem inventoryItem,
        MatchTier tier
) {

    public static MatchResult unmatched(int position, PrescribedDrug prescribed) {
        return new MatchResult(position, prescribed, null, MatchTier.NONE);
    }

    public boolean matched() {
        return inventoryItem != null;
    }
}
