package com.clinicflow.api;

import com.clinicflow.entity.InventoryDrug;
import com.clinicflow.inventory.InventoryItem;
import com.clinicflow.inventory.RelevanceSelector;

public record InventoryDrugResponse(
        String id,
        String drugName,
        String genericName,
        String dosageForm,
        String strength,
        String category,
        int stockQuantity,
        Double relevanceScore
) {

    public static InventoryDrugResponse from(RelevanceSelector.ScoredDrug scored) {
        InventoryItem item = scored.item();
        return new InventoryDrugResponse(item.id(), item.drugName(), item.genericName(), item.dosageForm(),
                item.strength(), item.category(), item.stockQuantity(), scored.score());
    }

    public static InventoryDrugResponse from(InventoryDrug drug) {
        return new InventoryDrugResponse(String.valueOf(drug.getId()), drug.getDrugName(), drug.getGenericName(),
                drug.getDosageForm(), drug.getStrength(), drug.getCategory(), drug.getStockQuantity(), null);
    }
}
