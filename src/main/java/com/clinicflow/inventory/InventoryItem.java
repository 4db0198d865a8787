package com.clinicflow.inventory;

import com.clinicflow.entity.InventoryDrug;
import org.springframework.lang.Nullable;

/**
 * Read-only snapshot of one inventory record, as seen by selection and reconciliation.
 */
public record InventoryItem(
        String id,
        String drugName,
        @Nullable String genericName,
        @Nullable String activeIngredient,
        @Nullable String dosageForm,
        @Nullable String strength,
        @Nullable String dosageAdults,
        @Nullable String category,
        int stockQuantity
) {

    public static InventoryItem from(InventoryDrug drug) {
        return new InventoryItem(
                drug.getId() == null ? null : drug.getId().toString(),
                drug.getDrugName(),
                drug.getGenericName(),
                drug.getActiveIngredient(),
                drug.getDosageForm(),
                drug.getStrength(),
                drug.getDosageAdults(),
                drug.getCategory(),
                drug.getStockQuantity());
    }

    public boolean inStock() {
        return stockQuantity > 0;
    }

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }
}
